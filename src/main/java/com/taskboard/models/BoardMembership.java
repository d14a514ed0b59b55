package com.taskboard.models;

/**
 * A board as seen by one user, together with that user's role on it.
 */
public class BoardMembership {

    private final Board board;
    private final BoardRole role;

    public BoardMembership(Board board, BoardRole role) {
        this.board = board;
        this.role = role;
    }

    public Board getBoard() {
        return board;
    }

    public BoardRole getRole() {
        return role;
    }
}
