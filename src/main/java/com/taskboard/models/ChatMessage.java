package com.taskboard.models;

import java.util.ArrayList;
import java.util.List;

/**
 * One persisted chat exchange. {@code boardId == null} belongs to the user's global conversation.
 * {@code actionsTaken} is null when no mutating action was attempted.
 */
public class ChatMessage {

    private String id;
    private String boardId;
    private String userId;
    private String message;
    private String response;
    private List<ActionOutcome> actionsTaken;
    private long createdAt;

    public ChatMessage() {
    }

    public ChatMessage(String id, String boardId, String userId, String message, String response,
                       List<ActionOutcome> actionsTaken, long createdAt) {
        this.id = id;
        this.boardId = boardId;
        this.userId = userId;
        this.message = message;
        this.response = response;
        this.actionsTaken = actionsTaken != null ? new ArrayList<>(actionsTaken) : null;
        this.createdAt = createdAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getBoardId() {
        return boardId;
    }

    public void setBoardId(String boardId) {
        this.boardId = boardId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getResponse() {
        return response;
    }

    public void setResponse(String response) {
        this.response = response;
    }

    public List<ActionOutcome> getActionsTaken() {
        return actionsTaken;
    }

    public void setActionsTaken(List<ActionOutcome> actionsTaken) {
        this.actionsTaken = actionsTaken;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }
}
