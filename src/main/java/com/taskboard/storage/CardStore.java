package com.taskboard.storage;

import com.taskboard.models.Card;
import com.taskboard.ordering.PositionedRows;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Cards, ordered within their primary column. Standalone cards have no container.
 */
public class CardStore extends JsonFileStore<Card> implements PositionedRows<Card> {

    public CardStore(Path dataDirectory) {
        super("CardStore", dataDirectory, "cards.json", Card[].class);
    }

    @Override
    protected String keyOf(Card row) {
        return row.getId();
    }

    public List<Card> listByColumn(String columnId) {
        return rows.values().stream()
            .filter(card -> columnId.equals(card.getColumnId()))
            .sorted(Comparator.comparingInt(Card::getPosition))
            .collect(Collectors.toList());
    }

    /**
     * Standalone cards the user owns or created, oldest first.
     */
    public List<Card> listStandaloneFor(String userId) {
        return rows.values().stream()
            .filter(card -> card.isStandalone() && card.isHeldBy(userId))
            .sorted(Comparator.comparingLong(Card::getCreatedAt).thenComparing(Card::getId))
            .collect(Collectors.toList());
    }

    @Override
    public String idOf(Card row) {
        return row.getId();
    }

    @Override
    public String containerOf(Card row) {
        return row.getColumnId();
    }

    @Override
    public int positionOf(Card row) {
        return row.getPosition();
    }

    @Override
    public List<Card> rowsIn(String container) {
        return listByColumn(container);
    }

    @Override
    public void place(Card row, String container, int position) {
        row.setColumnId(container);
        row.setPosition(position);
        rows.put(row.getId(), row);
    }
}
