package com.taskboard.models;

import java.util.ArrayList;
import java.util.List;

public class ChatResponse {

    private final String response;
    private final List<ActionOutcome> actionsTaken;

    public ChatResponse(String response, List<ActionOutcome> actionsTaken) {
        this.response = response;
        this.actionsTaken = actionsTaken != null ? new ArrayList<>(actionsTaken) : new ArrayList<>();
    }

    public String getResponse() {
        return response;
    }

    public List<ActionOutcome> getActionsTaken() {
        return actionsTaken;
    }
}
