package com.taskboard.models;

/**
 * The result of one attempted chat action. Failures are reported here, never thrown.
 */
public class ActionOutcome {

    private String action;
    private String description;
    private boolean success;

    public ActionOutcome() {
    }

    public ActionOutcome(String action, String description, boolean success) {
        this.action = action;
        this.description = description;
        this.success = success;
    }

    public static ActionOutcome success(String action, String description) {
        return new ActionOutcome(action, description, true);
    }

    public static ActionOutcome failure(String action, String description) {
        return new ActionOutcome(action, description, false);
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    @Override
    public String toString() {
        return "ActionOutcome{" +
            "action='" + action + '\'' +
            ", description='" + description + '\'' +
            ", success=" + success +
            '}';
    }
}
