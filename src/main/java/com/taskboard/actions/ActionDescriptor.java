package com.taskboard.actions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One parsed, not yet executed action request.
 */
public class ActionDescriptor {

    private final ChatAction action;
    private final String rawName;
    private final Map<String, Object> params;
    private final String message;

    public ActionDescriptor(ChatAction action, String rawName, Map<String, Object> params, String message) {
        this.action = action;
        this.rawName = rawName;
        this.params = params != null ? new LinkedHashMap<>(params) : new LinkedHashMap<>();
        this.message = message;
    }

    public static ActionDescriptor of(String rawName, Map<String, Object> params, String message) {
        return new ActionDescriptor(ChatAction.fromName(rawName), rawName, params, message);
    }

    public ChatAction getAction() {
        return action;
    }

    /**
     * The action name as the assistant wrote it.
     */
    public String getRawName() {
        return rawName;
    }

    /**
     * Name used in outcome records: the canonical name, or the raw one for unknown actions.
     */
    public String getReportName() {
        return action == ChatAction.UNKNOWN ? (rawName != null ? rawName : "") : action.wireName();
    }

    public Map<String, Object> getParams() {
        return Collections.unmodifiableMap(params);
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "ActionDescriptor{" +
            "action=" + getReportName() +
            ", params=" + params +
            '}';
    }
}
