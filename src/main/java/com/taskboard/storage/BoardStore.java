package com.taskboard.storage;

import com.taskboard.models.Board;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

public class BoardStore extends JsonFileStore<Board> {

    public BoardStore(Path dataDirectory) {
        super("BoardStore", dataDirectory, "boards.json", Board[].class);
    }

    @Override
    protected String keyOf(Board row) {
        return row.getId();
    }

    /**
     * Boards with the given ids, oldest first.
     */
    public List<Board> listByIds(java.util.Collection<String> ids) {
        return rows.values().stream()
            .filter(board -> ids.contains(board.getId()))
            .sorted(Comparator.comparingLong(Board::getCreatedAt).thenComparing(Board::getId))
            .collect(Collectors.toList());
    }

    public List<Board> findByName(String name) {
        String wanted = name.toLowerCase(Locale.ROOT);
        return where(board -> board.getName() != null && board.getName().toLowerCase(Locale.ROOT).equals(wanted));
    }
}
