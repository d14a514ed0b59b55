package com.taskboard.models;

public class Column {

    private String id;
    private String boardId;
    private String name;
    private int position;
    private long createdAt;
    private long updatedAt;

    public Column() {
    }

    public Column(String id, String boardId, String name, int position, long createdAt, long updatedAt) {
        this.id = id;
        this.boardId = boardId;
        this.name = name;
        this.position = position;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
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

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public int getPosition() {
        return position;
    }

    public void setPosition(int position) {
        this.position = position;
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
        return "Column{" +
            "id='" + id + '\'' +
            ", boardId='" + boardId + '\'' +
            ", name='" + name + '\'' +
            ", position=" + position +
            '}';
    }
}
