package com.taskboard;

import com.taskboard.errors.ForbiddenException;
import com.taskboard.errors.ValidationException;
import com.taskboard.models.Board;
import com.taskboard.models.BoardRole;
import com.taskboard.models.Card;
import com.taskboard.models.CardBoardAssignment;
import com.taskboard.models.ChatMessage;
import com.taskboard.models.Column;
import com.taskboard.models.Tag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class BoardServiceTest {

    private TaskboardContext ctx;
    private BoardService boards;

    @BeforeEach
    void setUp() {
        ctx = TestContexts.memory();
        boards = ctx.boards();
    }

    private List<String> columnNames(String boardId) {
        return ctx.columnStore().listByBoard(boardId).stream().map(Column::getName).collect(Collectors.toList());
    }

    @Test
    void creatorBecomesTheOnlyOwner() {
        Board board = boards.createBoard("alice", "Sprint", "two weeks");
        assertEquals(BoardRole.OWNER, boards.roleOf(board.getId(), "alice").orElseThrow());
        assertEquals(1, boards.listPermissions("alice", board.getId()).size());
        assertEquals(1, boards.listBoards("alice").size());
        assertTrue(boards.listBoards("bob").isEmpty());
    }

    @Test
    void blankBoardNameIsRejected() {
        assertThrows(ValidationException.class, () -> boards.createBoard("alice", "  ", null));
        assertTrue(ctx.boardStore().all().isEmpty());
    }

    @Test
    void ownerCannotBeGrantedChangedOrRemoved() {
        Board board = boards.createBoard("alice", "Sprint", null);
        assertThrows(ValidationException.class,
            () -> boards.setPermission("alice", board.getId(), "bob", BoardRole.OWNER));
        assertThrows(ValidationException.class,
            () -> boards.setPermission("alice", board.getId(), "alice", BoardRole.READER));
        assertThrows(ValidationException.class,
            () -> boards.removePermission("alice", board.getId(), "alice"));
        assertEquals(BoardRole.OWNER, boards.roleOf(board.getId(), "alice").orElseThrow());
    }

    @Test
    void onlyOwnerManagesMembers() {
        Board board = boards.createBoard("alice", "Sprint", null);
        boards.setPermission("alice", board.getId(), "bob", BoardRole.EDITOR);
        assertThrows(ForbiddenException.class,
            () -> boards.setPermission("bob", board.getId(), "carol", BoardRole.READER));

        boards.setPermission("alice", board.getId(), "bob", BoardRole.READER);
        assertEquals(BoardRole.READER, boards.roleOf(board.getId(), "bob").orElseThrow());

        boards.removePermission("alice", board.getId(), "bob");
        assertTrue(boards.roleOf(board.getId(), "bob").isEmpty());
    }

    @Test
    void missingBoardAndNoRelationLookTheSame() {
        Board board = boards.createBoard("alice", "Sprint", null);
        ForbiddenException noRelation = assertThrows(ForbiddenException.class, () -> boards.getBoard("bob", board.getId()));
        ForbiddenException missing = assertThrows(ForbiddenException.class, () -> boards.getBoard("bob", "no-such-board"));
        assertEquals(noRelation.getMessage(), missing.getMessage());
    }

    @Test
    void onlyOwnerDeletesBoard() {
        Board board = boards.createBoard("alice", "Sprint", null);
        boards.setPermission("alice", board.getId(), "bob", BoardRole.EDITOR);
        assertThrows(ForbiddenException.class, () -> boards.deleteBoard("bob", board.getId()));
        assertTrue(ctx.boardStore().find(board.getId()).isPresent());
    }

    @Test
    void readersCannotEdit() {
        Board board = boards.createBoard("alice", "Sprint", null);
        boards.setPermission("alice", board.getId(), "bob", BoardRole.READER);
        assertThrows(ForbiddenException.class, () -> boards.createColumn("bob", board.getId(), "Todo", null));
        assertThrows(ForbiddenException.class, () -> boards.updateBoard("bob", board.getId(), "Renamed", null));
        assertTrue(boards.listColumns("bob", board.getId()).isEmpty());
    }

    @Test
    void columnsStayDenseThroughInsertMoveAndDelete() {
        Board board = boards.createBoard("alice", "Sprint", null);
        Column todo = boards.createColumn("alice", board.getId(), "Todo", null);
        boards.createColumn("alice", board.getId(), "Done", null);
        boards.createColumn("alice", board.getId(), "Doing", 1);
        assertEquals(List.of("Todo", "Doing", "Done"), columnNames(board.getId()));

        boards.moveColumn("alice", todo.getId(), 2);
        assertEquals(List.of("Doing", "Done", "Todo"), columnNames(board.getId()));

        boards.deleteColumn("alice", ctx.resolver().findColumn(board.getId(), "Done").orElseThrow().getId());
        assertEquals(List.of("Doing", "Todo"), columnNames(board.getId()));
        assertEquals(1, todo.getPosition());

        boards.renameColumn("alice", todo.getId(), "Backlog");
        assertEquals(List.of("Doing", "Backlog"), columnNames(board.getId()));
    }

    @Test
    void deletingBoardCascadesButKeepsCardsAssignedElsewhere() {
        Board doomed = boards.createBoard("alice", "Doomed", null);
        Board keeper = boards.createBoard("alice", "Keeper", null);
        Column doomedTodo = boards.createColumn("alice", doomed.getId(), "Todo", null);
        Column keeperTodo = boards.createColumn("alice", keeper.getId(), "Todo", null);
        boards.setPermission("alice", doomed.getId(), "bob", BoardRole.EDITOR);

        Card gone = ctx.cards().createCard("alice", doomedTodo.getId(), "Gone", null, null);
        Card survivor = ctx.cards().createCard("alice", doomedTodo.getId(), "Survivor", null, null);
        CardBoardAssignment placement = ctx.cards().assignToBoard("alice", survivor.getId(), keeper.getId(),
            keeperTodo.getId(), null);
        Tag doomedTag = ctx.tags().createBoardTag("alice", doomed.getId(), "urgent", null);
        ctx.tags().addTagToCard("alice", gone.getId(), doomedTag.getId());
        ctx.tags().addTagToCard("alice", survivor.getId(), doomedTag.getId());
        ctx.chatMessageStore().append(new ChatMessage("m1", doomed.getId(), "alice", "hi", "hello", null, 1L));

        boards.deleteBoard("alice", doomed.getId());

        assertTrue(ctx.boardStore().find(doomed.getId()).isEmpty());
        assertTrue(ctx.columnStore().listByBoard(doomed.getId()).isEmpty());
        assertTrue(ctx.cardStore().find(gone.getId()).isEmpty());
        assertTrue(ctx.tagStore().listByBoard(doomed.getId()).isEmpty());
        assertTrue(ctx.cardTagStore().all().isEmpty());
        assertTrue(ctx.permissionStore().listForBoard(doomed.getId()).isEmpty());
        assertTrue(ctx.chatMessageStore().recentForBoard(doomed.getId(), 50).isEmpty());

        Card kept = ctx.cardStore().find(survivor.getId()).orElseThrow();
        assertNull(kept.getColumnId());
        assertEquals(List.of(kept), ctx.cards().listBoardCards("alice", keeper.getId(), null));
        assertEquals(keeper.getId(), ctx.cardBoardStore().find(placement.getId()).orElseThrow().getBoardId());
    }
}
