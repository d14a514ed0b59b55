package com.taskboard.models;

public class BoardPermission {

    private String id;
    private String boardId;
    private String userId;
    private BoardRole role;
    private long createdAt;

    public BoardPermission() {
    }

    public BoardPermission(String id, String boardId, String userId, BoardRole role, long createdAt) {
        this.id = id;
        this.boardId = boardId;
        this.userId = userId;
        this.role = role;
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

    public BoardRole getRole() {
        return role;
    }

    public void setRole(BoardRole role) {
        this.role = role;
    }

    public long getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(long createdAt) {
        this.createdAt = createdAt;
    }
}
