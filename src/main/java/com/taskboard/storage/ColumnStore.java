package com.taskboard.storage;

import com.taskboard.models.Column;
import com.taskboard.ordering.PositionedRows;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Columns, ordered within their board.
 */
public class ColumnStore extends JsonFileStore<Column> implements PositionedRows<Column> {

    public ColumnStore(Path dataDirectory) {
        super("ColumnStore", dataDirectory, "columns.json", Column[].class);
    }

    @Override
    protected String keyOf(Column row) {
        return row.getId();
    }

    public List<Column> listByBoard(String boardId) {
        return rows.values().stream()
            .filter(column -> boardId.equals(column.getBoardId()))
            .sorted(Comparator.comparingInt(Column::getPosition))
            .collect(Collectors.toList());
    }

    @Override
    public String idOf(Column row) {
        return row.getId();
    }

    @Override
    public String containerOf(Column row) {
        return row.getBoardId();
    }

    @Override
    public int positionOf(Column row) {
        return row.getPosition();
    }

    @Override
    public List<Column> rowsIn(String container) {
        return listByBoard(container);
    }

    @Override
    public void place(Column row, String container, int position) {
        row.setBoardId(container);
        row.setPosition(position);
        rows.put(row.getId(), row);
    }
}
