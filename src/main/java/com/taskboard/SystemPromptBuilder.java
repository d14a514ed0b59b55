package com.taskboard;

import com.taskboard.models.Board;
import com.taskboard.models.BoardRole;
import com.taskboard.models.Column;
import com.taskboard.models.Tag;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the system prompt describing board state and the action format.
 */
public class SystemPromptBuilder {

    /**
     * A board as described to the model: its columns with card counts and its tags.
     */
    public static class BoardSnapshot {
        private final Board board;
        private final BoardRole role;
        private final List<Column> columns;
        private final List<Integer> cardCounts;
        private final List<Tag> tags;

        public BoardSnapshot(Board board, BoardRole role, List<Column> columns, List<Integer> cardCounts, List<Tag> tags) {
            this.board = board;
            this.role = role;
            this.columns = new ArrayList<>(columns);
            this.cardCounts = new ArrayList<>(cardCounts);
            this.tags = new ArrayList<>(tags);
        }

        public Board getBoard() {
            return board;
        }

        public BoardRole getRole() {
            return role;
        }

        public List<Column> getColumns() {
            return columns;
        }

        public List<Integer> getCardCounts() {
            return cardCounts;
        }

        public List<Tag> getTags() {
            return tags;
        }

        public int getTotalCards() {
            return cardCounts.stream().mapToInt(Integer::intValue).sum();
        }
    }

    public String boardPrompt(BoardSnapshot snapshot, String userContext) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are an assistant that manages the task board \"")
            .append(snapshot.getBoard().getName()).append("\".\n\n");
        sb.append("Columns:\n");
        appendColumns(sb, snapshot, "- ");
        sb.append("\nTags: ").append(tagList(snapshot.getTags())).append("\n");
        if (userContext != null && !userContext.isBlank()) {
            sb.append("\nAbout the user: ").append(userContext.trim()).append("\n");
        }
        sb.append("\nAvailable actions:\n")
            .append("- create_card {\"column\", \"title\", \"body\"?}\n")
            .append("- move_card {\"card_title\", \"target_column\", \"position\"?}\n")
            .append("- create_tag {\"name\", \"color\"?}\n")
            .append("- add_tag {\"card_title\", \"tag_name\"}\n")
            .append("- delete_card {\"card\"}\n")
            .append("- delete_column {\"column\"}\n")
            .append("- delete_tag {\"tag\"}\n")
            .append("- list_cards, list_tags, no_action {}\n");
        appendFormat(sb);
        return sb.toString();
    }

    public String globalPrompt(List<BoardSnapshot> snapshots) {
        StringBuilder sb = new StringBuilder();
        sb.append("You are an assistant that manages all of the user's task boards.\n\n");
        if (snapshots.isEmpty()) {
            sb.append("The user has no boards yet.\n");
        }
        for (BoardSnapshot snapshot : snapshots) {
            sb.append("Board \"").append(snapshot.getBoard().getName()).append("\" (role: ")
                .append(snapshot.getRole()).append(", ").append(snapshot.getTotalCards()).append(" cards)\n");
            appendColumns(sb, snapshot, "  - ");
            sb.append("  Tags: ").append(tagList(snapshot.getTags())).append("\n");
        }
        sb.append("\nEvery board action needs a \"board\" parameter naming the board.\n")
            .append("Available actions:\n")
            .append("- create_board {\"name\", \"description\"?}\n")
            .append("- create_card {\"board\", \"column\", \"title\", \"body\"?}\n")
            .append("- move_card {\"board\", \"card_title\", \"target_column\", \"position\"?}\n")
            .append("- move_card_cross_board {\"from_board\", \"to_board\", \"card\", \"column\"}\n")
            .append("- create_tag {\"board\", \"name\", \"color\"?}\n")
            .append("- add_tag {\"board\", \"card_title\", \"tag_name\"}\n")
            .append("- delete_card {\"board\", \"card\"}\n")
            .append("- delete_column {\"board\", \"column\"}\n")
            .append("- delete_tag {\"board\", \"tag\"}\n")
            .append("- list_cards, list_tags, no_action {}\n");
        appendFormat(sb);
        return sb.toString();
    }

    private void appendColumns(StringBuilder sb, BoardSnapshot snapshot, String indent) {
        if (snapshot.getColumns().isEmpty()) {
            sb.append(indent).append("(no columns)\n");
        }
        for (int i = 0; i < snapshot.getColumns().size(); i++) {
            sb.append(indent).append(snapshot.getColumns().get(i).getName())
                .append(" (").append(snapshot.getCardCounts().get(i)).append(" cards)\n");
        }
    }

    private String tagList(List<Tag> tags) {
        if (tags.isEmpty()) {
            return "(none)";
        }
        List<String> names = new ArrayList<>();
        for (Tag tag : tags) {
            names.add(tag.getName());
        }
        return String.join(", ", names);
    }

    private void appendFormat(StringBuilder sb) {
        sb.append("\nReply with JSON only, one object per action:\n")
            .append("{\"action\": \"<name>\", \"params\": {...}, \"message\": \"<short reply to the user>\"}\n")
            .append("Several actions may be sent as {\"actions\": [ ... ]}.\n")
            .append("Use no_action with a message when nothing needs to change.\n");
    }
}
