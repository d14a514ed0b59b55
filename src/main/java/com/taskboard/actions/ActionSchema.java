package com.taskboard.actions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Logical fields of one action with the parameter spellings each field accepts, in priority order.
 */
public class ActionSchema {

    private final ChatAction action;
    private final Map<String, List<String>> aliases = new LinkedHashMap<>();
    private final List<String> required = new ArrayList<>();

    public ActionSchema(ChatAction action) {
        this.action = action;
    }

    public ActionSchema required(String field, String... spellings) {
        aliases.put(field, Arrays.asList(spellings));
        required.add(field);
        return this;
    }

    public ActionSchema optional(String field, String... spellings) {
        aliases.put(field, Arrays.asList(spellings));
        return this;
    }

    public ChatAction getAction() {
        return action;
    }

    public List<String> getRequiredFields() {
        return Collections.unmodifiableList(required);
    }

    public List<String> spellingsOf(String field) {
        List<String> spellings = aliases.get(field);
        return spellings != null ? spellings : Collections.emptyList();
    }

    /**
     * Resolve every field: the first spelling with a non-empty scalar value wins.
     */
    public ResolvedParams resolve(Map<String, Object> params) {
        Map<String, String> values = new LinkedHashMap<>();
        for (Map.Entry<String, List<String>> entry : aliases.entrySet()) {
            String value = firstValue(params, entry.getValue());
            if (value != null) {
                values.put(entry.getKey(), value);
            }
        }
        List<String> missing = new ArrayList<>();
        for (String field : required) {
            if (!values.containsKey(field)) {
                missing.add(field);
            }
        }
        return new ResolvedParams(values, missing);
    }

    static String firstValue(Map<String, Object> params, List<String> spellings) {
        if (params == null) {
            return null;
        }
        for (String key : spellings) {
            Object raw = params.get(key);
            if (raw == null || raw instanceof Map || raw instanceof List) {
                continue;
            }
            String value = String.valueOf(raw).trim();
            if (!value.isEmpty()) {
                return value;
            }
        }
        return null;
    }
}
