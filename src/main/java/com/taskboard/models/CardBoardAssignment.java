package com.taskboard.models;

/**
 * Places a card on a board independently of its primary column. Positions are dense
 * within the (boardId, columnId) bucket; a null columnId is the board's column-less bucket.
 */
public class CardBoardAssignment {

    private String id;
    private String cardId;
    private String boardId;
    private String columnId;
    private int position;
    private long createdAt;

    public CardBoardAssignment() {
    }

    public CardBoardAssignment(String id, String cardId, String boardId, String columnId, int position, long createdAt) {
        this.id = id;
        this.cardId = cardId;
        this.boardId = boardId;
        this.columnId = columnId;
        this.position = position;
        this.createdAt = createdAt;
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

    public String getBoardId() {
        return boardId;
    }

    public void setBoardId(String boardId) {
        this.boardId = boardId;
    }

    public String getColumnId() {
        return columnId;
    }

    public void setColumnId(String columnId) {
        this.columnId = columnId;
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
}
