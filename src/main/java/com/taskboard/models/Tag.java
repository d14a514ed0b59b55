package com.taskboard.models;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A label. Exactly one of {@code boardId} (board-scoped) or {@code ownerId} (a user's global tag) is set.
 */
public class Tag {

    public static final String DEFAULT_COLOR = "#6c757d";

    private String id;
    private String boardId;
    private String ownerId;
    private String name;
    private String color;
    private long createdAt;

    public Tag() {
    }

    private Tag(String id, String boardId, String ownerId, String name, String color, long createdAt) {
        this.id = id;
        this.boardId = boardId;
        this.ownerId = ownerId;
        this.name = name;
        this.color = color;
        this.createdAt = createdAt;
    }

    public static Tag boardScoped(String id, String boardId, String name, String color, long createdAt) {
        if (boardId == null || boardId.isBlank()) {
            throw new IllegalArgumentException("Board tag requires a board id");
        }
        return new Tag(id, boardId, null, name, colorOrDefault(color), createdAt);
    }

    public static Tag global(String id, String ownerId, String name, String color, long createdAt) {
        if (ownerId == null || ownerId.isBlank()) {
            throw new IllegalArgumentException("Global tag requires an owner id");
        }
        return new Tag(id, null, ownerId, name, colorOrDefault(color), createdAt);
    }

    private static String colorOrDefault(String color) {
        return color == null || color.isBlank() ? DEFAULT_COLOR : color.trim();
    }

    @JsonIgnore
    public boolean isBoardScoped() {
        return boardId != null;
    }

    /**
     * Both or neither scope set.
     */
    @JsonIgnore
    public boolean hasInvalidScope() {
        return (boardId == null) == (ownerId == null);
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

    public String getOwnerId() {
        return ownerId;
    }

    public void setOwnerId(String ownerId) {
        this.ownerId = ownerId;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getColor() {
        return color;
    }

    public void setColor(String color) {
        this.color = color;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }
}
