package com.taskboard;

import com.taskboard.models.Board;
import com.taskboard.models.Card;
import com.taskboard.models.CardBoardAssignment;
import com.taskboard.models.Column;
import com.taskboard.models.Tag;
import com.taskboard.ordering.PositionStore;
import com.taskboard.storage.BoardStore;
import com.taskboard.storage.CardBoardStore;
import com.taskboard.storage.CardStore;
import com.taskboard.storage.CardTagStore;
import com.taskboard.storage.ChatMessageStore;
import com.taskboard.storage.ColumnStore;
import com.taskboard.storage.CommentStore;
import com.taskboard.storage.PermissionStore;
import com.taskboard.storage.TagStore;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Removal of cards, columns and boards together with everything that hangs off them.
 * Callers check authorization first.
 */
public class BoardCascade {

    private final BoardStore boards;
    private final PermissionStore permissions;
    private final ColumnStore columns;
    private final CardStore cards;
    private final CardBoardStore assignments;
    private final TagStore tags;
    private final CardTagStore cardTags;
    private final CommentStore comments;
    private final ChatMessageStore chatMessages;
    private final PositionStore<Column> columnPositions;
    private final PositionStore<Card> cardPositions;
    private final PositionStore<CardBoardAssignment> assignmentPositions;

    public BoardCascade(BoardStore boards, PermissionStore permissions, ColumnStore columns, CardStore cards,
                        CardBoardStore assignments, TagStore tags, CardTagStore cardTags,
                        CommentStore comments, ChatMessageStore chatMessages, PositionStore<Column> columnPositions,
                        PositionStore<Card> cardPositions, PositionStore<CardBoardAssignment> assignmentPositions) {
        this.boards = boards;
        this.permissions = permissions;
        this.columns = columns;
        this.cards = cards;
        this.assignments = assignments;
        this.tags = tags;
        this.cardTags = cardTags;
        this.comments = comments;
        this.chatMessages = chatMessages;
        this.columnPositions = columnPositions;
        this.cardPositions = cardPositions;
        this.assignmentPositions = assignmentPositions;
    }

    /**
     * Delete a card with its tag links and comments, closing the gap in its column and in every
     * assignment bucket.
     */
    public void deleteCard(Card card) {
        for (CardBoardAssignment assignment : assignments.listByCard(card.getId())) {
            assignmentPositions.remove(assignment);
        }
        cardTags.deleteByCard(card.getId());
        comments.deleteByCard(card.getId());
        cardPositions.remove(card);
    }

    /**
     * Delete a column. Its cards are deleted, except cards also assigned to another board,
     * which lose their column and live on through that assignment.
     */
    public void deleteColumn(Column column) {
        releaseColumnCards(column);
        columnPositions.remove(column);
    }

    /**
     * Delete a board with its columns, cards, board tags and their card links, permissions,
     * assignments to the board and chat history.
     */
    public void deleteBoard(Board board) {
        String boardId = board.getId();
        for (Column column : columns.listByBoard(boardId)) {
            releaseColumnCards(column);
        }
        columns.deleteWhere(column -> boardId.equals(column.getBoardId()));
        assignments.deleteWhere(assignment -> boardId.equals(assignment.getBoardId()));

        List<String> tagIds = tags.listByBoard(boardId).stream().map(Tag::getId).collect(Collectors.toList());
        if (!tagIds.isEmpty()) {
            cardTags.deleteByTags(tagIds);
        }
        tags.deleteByBoard(boardId);
        chatMessages.deleteByBoard(boardId);
        permissions.deleteByBoard(boardId);
        boards.delete(boardId);
    }

    private void releaseColumnCards(Column column) {
        String boardId = column.getBoardId();
        for (Card card : cards.listByColumn(column.getId())) {
            boolean assignedElsewhere = assignments.listByCard(card.getId()).stream()
                .anyMatch(assignment -> !boardId.equals(assignment.getBoardId()));
            if (assignedElsewhere) {
                card.setColumnId(null);
                card.setPosition(0);
                card.setUpdatedAt(Timestamps.next());
                cards.save(card);
            } else {
                for (CardBoardAssignment assignment : assignments.listByCard(card.getId())) {
                    assignmentPositions.remove(assignment);
                }
                cardTags.deleteByCard(card.getId());
                comments.deleteByCard(card.getId());
                cards.delete(card.getId());
            }
        }
        // assignments placed into this column fall back to their board's column-less bucket
        for (CardBoardAssignment assignment : assignments.listByBucket(boardId, column.getId())) {
            assignmentPositions.move(assignment, CardBoardStore.bucket(boardId, null),
                assignments.listByBucket(boardId, null).size());
        }
    }
}
