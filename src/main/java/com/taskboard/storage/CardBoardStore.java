package com.taskboard.storage;

import com.taskboard.models.CardBoardAssignment;
import com.taskboard.ordering.PositionedRows;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Card-to-board assignments. The ordering container is the (board, column) bucket,
 * encoded as {@code boardId|columnId} or {@code boardId|-} for the column-less bucket.
 */
public class CardBoardStore extends JsonFileStore<CardBoardAssignment> implements PositionedRows<CardBoardAssignment> {

    private static final String NO_COLUMN = "-";

    public CardBoardStore(Path dataDirectory) {
        super("CardBoardStore", dataDirectory, "card_boards.json", CardBoardAssignment[].class);
    }

    public static String bucket(String boardId, String columnId) {
        return boardId + "|" + (columnId != null ? columnId : NO_COLUMN);
    }

    @Override
    protected String keyOf(CardBoardAssignment row) {
        return row.getId();
    }

    public Optional<CardBoardAssignment> findFor(String cardId, String boardId) {
        return rows.values().stream()
            .filter(a -> cardId.equals(a.getCardId()) && boardId.equals(a.getBoardId()))
            .findFirst();
    }

    public List<CardBoardAssignment> listByCard(String cardId) {
        return rows.values().stream()
            .filter(a -> cardId.equals(a.getCardId()))
            .sorted(Comparator.comparingLong(CardBoardAssignment::getCreatedAt))
            .collect(Collectors.toList());
    }

    public List<CardBoardAssignment> listByBoard(String boardId) {
        return where(a -> boardId.equals(a.getBoardId()));
    }

    public List<CardBoardAssignment> listByBucket(String boardId, String columnId) {
        return rowsIn(bucket(boardId, columnId));
    }

    @Override
    public String idOf(CardBoardAssignment row) {
        return row.getId();
    }

    @Override
    public String containerOf(CardBoardAssignment row) {
        return bucket(row.getBoardId(), row.getColumnId());
    }

    @Override
    public int positionOf(CardBoardAssignment row) {
        return row.getPosition();
    }

    @Override
    public List<CardBoardAssignment> rowsIn(String container) {
        return rows.values().stream()
            .filter(a -> container.equals(containerOf(a)))
            .sorted(Comparator.comparingInt(CardBoardAssignment::getPosition))
            .collect(Collectors.toList());
    }

    @Override
    public void place(CardBoardAssignment row, String container, int position) {
        int split = container.indexOf('|');
        String columnId = container.substring(split + 1);
        row.setBoardId(container.substring(0, split));
        row.setColumnId(NO_COLUMN.equals(columnId) ? null : columnId);
        row.setPosition(position);
        rows.put(row.getId(), row);
    }
}
