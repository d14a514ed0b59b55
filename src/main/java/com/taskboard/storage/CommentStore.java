package com.taskboard.storage;

import com.taskboard.models.Comment;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

public class CommentStore extends JsonFileStore<Comment> {

    public CommentStore(Path dataDirectory) {
        super("CommentStore", dataDirectory, "comments.json", Comment[].class);
    }

    @Override
    protected String keyOf(Comment row) {
        return row.getId();
    }

    /**
     * Oldest first.
     */
    public List<Comment> listByCard(String cardId) {
        return rows.values().stream()
            .filter(comment -> cardId.equals(comment.getCardId()))
            .sorted(Comparator.comparingLong(Comment::getCreatedAt).thenComparing(Comment::getId))
            .collect(Collectors.toList());
    }

    public List<Comment> deleteByCard(String cardId) {
        return deleteWhere(comment -> cardId.equals(comment.getCardId()));
    }
}
