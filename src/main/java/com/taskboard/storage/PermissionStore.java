package com.taskboard.storage;

import com.taskboard.models.BoardPermission;
import com.taskboard.models.BoardRole;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

public class PermissionStore extends JsonFileStore<BoardPermission> {

    public PermissionStore(Path dataDirectory) {
        super("PermissionStore", dataDirectory, "permissions.json", BoardPermission[].class);
    }

    @Override
    protected String keyOf(BoardPermission row) {
        return row.getId();
    }

    public Optional<BoardPermission> findFor(String boardId, String userId) {
        if (boardId == null || userId == null) {
            return Optional.empty();
        }
        return rows.values().stream()
            .filter(p -> boardId.equals(p.getBoardId()) && userId.equals(p.getUserId()))
            .findFirst();
    }

    /**
     * The user's role on the board, read fresh on every call. Empty means no relation.
     */
    public Optional<BoardRole> roleOf(String boardId, String userId) {
        return findFor(boardId, userId).map(BoardPermission::getRole);
    }

    public List<BoardPermission> listForBoard(String boardId) {
        return rows.values().stream()
            .filter(p -> boardId.equals(p.getBoardId()))
            .sorted(Comparator.comparingLong(BoardPermission::getCreatedAt))
            .collect(Collectors.toList());
    }

    public List<BoardPermission> listForUser(String userId) {
        return where(p -> userId.equals(p.getUserId()));
    }

    public boolean hasOwner(String boardId) {
        return rows.values().stream()
            .anyMatch(p -> boardId.equals(p.getBoardId()) && p.getRole() == BoardRole.OWNER);
    }

    public List<BoardPermission> deleteByBoard(String boardId) {
        return deleteWhere(p -> boardId.equals(p.getBoardId()));
    }
}
