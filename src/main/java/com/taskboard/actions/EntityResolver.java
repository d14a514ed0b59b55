package com.taskboard.actions;

import com.taskboard.BoardService;
import com.taskboard.models.BoardMembership;
import com.taskboard.models.Card;
import com.taskboard.models.Column;
import com.taskboard.models.Tag;
import com.taskboard.storage.CardStore;
import com.taskboard.storage.ColumnStore;
import com.taskboard.storage.TagStore;

import java.util.Locale;
import java.util.Optional;

/**
 * Name lookups against current board state. Matching is case-insensitive exact equality;
 * when several entities share a name the earliest in a fixed order wins.
 */
public class EntityResolver {

    private final BoardService boardService;
    private final ColumnStore columns;
    private final CardStore cards;
    private final TagStore tags;

    public EntityResolver(BoardService boardService, ColumnStore columns, CardStore cards, TagStore tags) {
        this.boardService = boardService;
        this.columns = columns;
        this.cards = cards;
        this.tags = tags;
    }

    public Optional<Column> findColumn(String boardId, String name) {
        for (Column column : columns.listByBoard(boardId)) {
            if (sameName(column.getName(), name)) {
                return Optional.of(column);
            }
        }
        return Optional.empty();
    }

    /**
     * Columns are scanned by position, cards within a column by position.
     */
    public Optional<Card> findCard(String boardId, String title) {
        for (Column column : columns.listByBoard(boardId)) {
            for (Card card : cards.listByColumn(column.getId())) {
                if (sameName(card.getTitle(), title)) {
                    return Optional.of(card);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Board tags ordered by name, then creation time.
     */
    public Optional<Tag> findBoardTag(String boardId, String name) {
        return tags.listByBoard(boardId).stream()
            .filter(tag -> sameName(tag.getName(), name))
            .findFirst();
    }

    public Optional<Tag> findGlobalTag(String ownerId, String name) {
        return tags.listGlobal(ownerId).stream()
            .filter(tag -> sameName(tag.getName(), name))
            .findFirst();
    }

    /**
     * Among the boards the user has a role on, oldest first.
     */
    public Optional<BoardMembership> findBoard(String userId, String name) {
        return boardService.listBoards(userId).stream()
            .filter(membership -> sameName(membership.getBoard().getName(), name))
            .findFirst();
    }

    static boolean sameName(String candidate, String wanted) {
        if (candidate == null || wanted == null) {
            return false;
        }
        return candidate.toLowerCase(Locale.ROOT).equals(wanted.toLowerCase(Locale.ROOT));
    }
}
