package com.taskboard;

import com.taskboard.access.AccessPolicy;
import com.taskboard.errors.ForbiddenException;
import com.taskboard.errors.NotFoundException;
import com.taskboard.errors.StorageException;
import com.taskboard.errors.ValidationException;
import com.taskboard.models.Board;
import com.taskboard.models.BoardMembership;
import com.taskboard.models.BoardPermission;
import com.taskboard.models.BoardRole;
import com.taskboard.models.Column;
import com.taskboard.ordering.PositionStore;
import com.taskboard.storage.BoardStore;
import com.taskboard.storage.ColumnStore;
import com.taskboard.storage.PermissionStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Boards, their members and their columns.
 */
public class BoardService {

    private final BoardStore boards;
    private final PermissionStore permissions;
    private final ColumnStore columns;
    private final PositionStore<Column> columnPositions;
    private final BoardCascade cascade;

    public BoardService(BoardStore boards, PermissionStore permissions, ColumnStore columns,
                        PositionStore<Column> columnPositions, BoardCascade cascade) {
        this.boards = boards;
        this.permissions = permissions;
        this.columns = columns;
        this.columnPositions = columnPositions;
        this.cascade = cascade;
    }

    // ---- boards ----

    /**
     * Create a board; the creator becomes its Owner in the same step.
     */
    public Board createBoard(String actorId, String name, String description) {
        requireActor(actorId);
        String trimmed = requireText(name, "Board name");
        long now = Timestamps.next();
        Board board = new Board(UUID.randomUUID().toString(), trimmed, description, actorId, now, now);
        BoardPermission owner = new BoardPermission(UUID.randomUUID().toString(), board.getId(), actorId,
            BoardRole.OWNER, now);

        boards.save(board);
        try {
            permissions.save(owner);
        } catch (StorageException e) {
            boards.delete(board.getId());
            throw e;
        }
        log("Board created: " + board.getName() + " (" + board.getId() + ") by " + actorId);
        return board;
    }

    /**
     * Boards the user has any role on, oldest first.
     */
    public List<BoardMembership> listBoards(String userId) {
        Map<String, BoardRole> roles = permissions.listForUser(userId).stream()
            .collect(Collectors.toMap(BoardPermission::getBoardId, BoardPermission::getRole, (a, b) -> a));
        List<BoardMembership> result = new ArrayList<>();
        for (Board board : boards.listByIds(roles.keySet())) {
            result.add(new BoardMembership(board, roles.get(board.getId())));
        }
        return result;
    }

    public Board getBoard(String actorId, String boardId) {
        requireRole(boardId, actorId);
        return boards.find(boardId).orElseThrow(ForbiddenException::new);
    }

    public Board updateBoard(String actorId, String boardId, String name, String description) {
        requireEdit(boardId, actorId);
        Board board = boards.find(boardId).orElseThrow(ForbiddenException::new);
        if (name != null) {
            board.setName(requireText(name, "Board name"));
        }
        if (description != null) {
            board.setDescription(description);
        }
        board.setUpdatedAt(Timestamps.next());
        return boards.save(board);
    }

    public void deleteBoard(String actorId, String boardId) {
        BoardRole role = requireRole(boardId, actorId);
        if (!AccessPolicy.canDeleteBoard(role)) {
            throw new ForbiddenException("Only the board owner can delete the board");
        }
        Board board = boards.find(boardId).orElseThrow(ForbiddenException::new);
        cascade.deleteBoard(board);
        log("Board deleted: " + board.getName() + " (" + boardId + ") by " + actorId);
    }

    // ---- roles and permissions ----

    /**
     * The user's current role on the board. Empty when the board is missing or the user has no relation.
     */
    public Optional<BoardRole> roleOf(String boardId, String userId) {
        if (boardId == null || userId == null || boards.find(boardId).isEmpty()) {
            return Optional.empty();
        }
        return permissions.roleOf(boardId, userId);
    }

    /**
     * Missing boards and boards without a relation are both reported as Forbidden.
     */
    public BoardRole requireRole(String boardId, String actorId) {
        return roleOf(boardId, actorId).orElseThrow(ForbiddenException::new);
    }

    public BoardRole requireEdit(String boardId, String actorId) {
        BoardRole role = requireRole(boardId, actorId);
        if (!AccessPolicy.canEdit(role)) {
            throw new ForbiddenException("You don't have permission to edit this board");
        }
        return role;
    }

    public List<BoardPermission> listPermissions(String actorId, String boardId) {
        requireRole(boardId, actorId);
        return permissions.listForBoard(boardId);
    }

    /**
     * Add a member or change a member's role. Granting Owner and changing the Owner's role are rejected.
     */
    public BoardPermission setPermission(String actorId, String boardId, String userId, BoardRole role) {
        requireManage(boardId, actorId);
        requireText(userId, "User id");
        if (!AccessPolicy.canGrant(role)) {
            throw new ValidationException("A board has exactly one owner; the owner role cannot be granted");
        }
        Optional<BoardPermission> existing = permissions.findFor(boardId, userId);
        if (existing.isPresent()) {
            BoardPermission permission = existing.get();
            if (!AccessPolicy.canRevoke(permission.getRole())) {
                throw new ValidationException("The owner's role cannot be changed");
            }
            permission.setRole(role);
            return permissions.save(permission);
        }
        BoardPermission permission = new BoardPermission(UUID.randomUUID().toString(), boardId, userId, role,
            Timestamps.next());
        permissions.save(permission);
        log("Permission granted: " + role + " on " + boardId + " to " + userId);
        return permission;
    }

    public void removePermission(String actorId, String boardId, String userId) {
        requireManage(boardId, actorId);
        BoardPermission permission = permissions.findFor(boardId, userId)
            .orElseThrow(() -> new NotFoundException("Permission", userId));
        if (!AccessPolicy.canRevoke(permission.getRole())) {
            throw new ValidationException("The owner permission cannot be removed");
        }
        permissions.delete(permission.getId());
        log("Permission removed on " + boardId + " for " + userId);
    }

    private void requireManage(String boardId, String actorId) {
        BoardRole role = requireRole(boardId, actorId);
        if (!AccessPolicy.canManagePermissions(role)) {
            throw new ForbiddenException("Only the board owner can manage permissions");
        }
    }

    // ---- columns ----

    /**
     * Create a column at the given position, or at the end when position is null.
     */
    public Column createColumn(String actorId, String boardId, String name, Integer position) {
        requireEdit(boardId, actorId);
        long now = Timestamps.next();
        Column column = new Column(UUID.randomUUID().toString(), boardId, requireText(name, "Column name"), 0, now, now);
        columnPositions.insert(column, boardId, position);
        return column;
    }

    public List<Column> listColumns(String actorId, String boardId) {
        requireRole(boardId, actorId);
        return columns.listByBoard(boardId);
    }

    public Column renameColumn(String actorId, String columnId, String name) {
        Column column = editableColumn(actorId, columnId);
        column.setName(requireText(name, "Column name"));
        column.setUpdatedAt(Timestamps.next());
        return columns.save(column);
    }

    public Column moveColumn(String actorId, String columnId, int position) {
        Column column = editableColumn(actorId, columnId);
        columnPositions.move(column, column.getBoardId(), position);
        return column;
    }

    public void deleteColumn(String actorId, String columnId) {
        Column column = editableColumn(actorId, columnId);
        cascade.deleteColumn(column);
        log("Column deleted: " + column.getName() + " (" + columnId + ")");
    }

    /**
     * The column, after checking the actor can view its board.
     */
    public Column getColumn(String actorId, String columnId) {
        Column column = columns.find(columnId).orElseThrow(() -> new NotFoundException("Column", columnId));
        requireRole(column.getBoardId(), actorId);
        return column;
    }

    private Column editableColumn(String actorId, String columnId) {
        Column column = columns.find(columnId).orElseThrow(() -> new NotFoundException("Column", columnId));
        requireEdit(column.getBoardId(), actorId);
        return column;
    }

    static void requireActor(String actorId) {
        if (actorId == null || actorId.isBlank()) {
            throw new ValidationException("Actor id is required");
        }
    }

    static String requireText(String value, String label) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(label + " is required");
        }
        return value.trim();
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[BoardService] " + message);
        } else {
            System.out.println("[BoardService] " + message);
        }
    }
}
