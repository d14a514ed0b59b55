package com.taskboard.models;

public class CardTag {

    private String cardId;
    private String tagId;
    private long createdAt;

    public CardTag() {
    }

    public CardTag(String cardId, String tagId, long createdAt) {
        this.cardId = cardId;
        this.tagId = tagId;
        this.createdAt = createdAt;
    }

    public String getCardId() {
        return cardId;
    }

    public void setCardId(String cardId) {
        this.cardId = cardId;
    }

    public String getTagId() {
        return tagId;
    }

    public void setTagId(String tagId) {
        this.tagId = tagId;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }
}
