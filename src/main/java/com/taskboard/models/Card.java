package com.taskboard.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A task card. {@code columnId == null} marks a standalone (inbox) card; such a card
 * has no primary position and may still be placed on boards through assignments.
 */
public class Card {

    private String id;
    private String columnId;
    private String title;
    private String body;
    private int position;
    private CardVisibility visibility = CardVisibility.RESTRICTED;
    private CardStatus status = CardStatus.OPEN;
    private String startDate;
    private String endDate;
    private String dueDate;
    private String ownerId;
    private String createdBy;
    private long createdAt;
    private long updatedAt;

    public Card() {
    }

    public Card(String id, String columnId, String title, String body, int position,
                CardVisibility visibility, CardStatus status, String ownerId, String createdBy,
                long createdAt, long updatedAt) {
        this.id = id;
        this.columnId = columnId;
        this.title = title;
        this.body = body;
        this.position = position;
        this.visibility = visibility;
        this.status = status;
        this.ownerId = ownerId;
        this.createdBy = createdBy;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    @JsonIgnore
    public boolean isStandalone() {
        return columnId == null;
    }

    /**
     * True when the user owns or created the card.
     */
    public boolean isHeldBy(String userId) {
        if (userId == null) {
            return false;
        }
        return userId.equals(ownerId) || userId.equals(createdBy);
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getColumnId() {
        return columnId;
    }

    public void setColumnId(String columnId) {
        this.columnId = columnId;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getBody() {
        return body;
    }

    public void setBody(String body) {
        this.body = body;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
    }

    public CardVisibility getVisibility() {
        return visibility;
    }

    public void setVisibility(CardVisibility visibility) {
        this.visibility = visibility;
    }

    public CardStatus getStatus() {
        return status;
    }

    public void setStatus(CardStatus status) {
        this.status = status;
    }

    public String getStartDate() {
        return startDate;
    }

    public void setStartDate(String startDate) {
        this.startDate = startDate;
    }

    public String getEndDate() {
        return endDate;
    }

    public void setEndDate(String endDate) {
        this.endDate = endDate;
    }

    public String getDueDate() {
        return dueDate;
    }

    public void setDueDate(String dueDate) {
        this.dueDate = dueDate;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public String getCreatedBy() {
        return createdBy;
    }

    public void setCreatedBy(String createdBy) {
        this.createdBy = createdBy;
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

    @Override
    public String toString() {
        return "Card{" +
            "id='" + id + '\'' +
            ", columnId='" + columnId + '\'' +
            ", title='" + title + '\'' +
            ", position=" + position +
            ", visibility=" + visibility +
            ", status=" + status +
            '}';
    }
}
