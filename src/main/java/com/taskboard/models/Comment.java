package com.taskboard.models;

/**
 * A note left on a card by one user.
 */
public class Comment {

    private String id;
    private String cardId;
    private String userId;
    private String body;
    private long createdAt;
    private long updatedAt;

    public Comment() {
    }

    public Comment(String id, String cardId, String userId, String body, long createdAt, long updatedAt) {
        this.id = id;
        this.cardId = cardId;
        this.userId = userId;
        this.body = body;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getCardId() {
        return cardId;
    }

    public void setCardId(String cardId) {
        this.cardId = cardId;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }

    public long getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(long updatedAt) {
        this.updatedAt = updatedAt;
    }
}
