package com.taskboard.actions;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskboard.TaskboardContext;
import com.taskboard.TestContexts;
import com.taskboard.models.ActionOutcome;
import com.taskboard.models.Board;
import com.taskboard.models.BoardRole;
import com.taskboard.models.Card;
import com.taskboard.models.Column;
import com.taskboard.models.Tag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class ActionExecutorTest {

    private TaskboardContext ctx;
    private ActionParser parser;
    private Board board;
    private Column todo;
    private Column done;

    @BeforeEach
    void setUp() {
        ctx = TestContexts.memory();
        parser = new ActionParser(new ObjectMapper());
        board = ctx.boards().createBoard("alice", "Sprint", null);
        todo = ctx.boards().createColumn("alice", board.getId(), "Todo", null);
        done = ctx.boards().createColumn("alice", board.getId(), "Done", null);
    }

    private List<ActionOutcome> run(String actor, String modelText) {
        return ctx.actions().executeAll(parser.parse(modelText), ActionExecutionContext.forBoard(actor, board.getId()));
    }

    private List<ActionOutcome> runGlobal(String actor, String modelText) {
        return ctx.actions().executeAll(parser.parse(modelText), ActionExecutionContext.global(actor));
    }

    private List<String> titles(Column column) {
        return ctx.cardStore().listByColumn(column.getId()).stream().map(Card::getTitle).collect(Collectors.toList());
    }

    @Test
    void moveCardToDoneLandsAtTop() {
        Card fix = ctx.cards().createCard("alice", todo.getId(), "Fix bug", null, null);
        ctx.cards().createCard("alice", done.getId(), "Old work", null, null);

        List<ActionOutcome> outcomes = run("alice",
            "{\"action\":\"move_card\",\"params\":{\"card_title\":\"fix bug\",\"target_column\":\"Done\"}}");

        assertEquals(1, outcomes.size());
        assertTrue(outcomes.get(0).isSuccess(), outcomes.get(0).getDescription());
        assertEquals(done.getId(), fix.getColumnId());
        assertEquals(0, fix.getPosition());
        assertTrue(titles(todo).isEmpty());
        assertEquals(List.of("Fix bug", "Old work"), titles(done));
    }

    @Test
    void readerCannotCreateCards() {
        ctx.boards().setPermission("alice", board.getId(), "bob", BoardRole.READER);

        List<ActionOutcome> outcomes = run("bob",
            "{\"action\":\"create_card\",\"params\":{\"column\":\"Todo\",\"title\":\"x\"}}");

        assertEquals(1, outcomes.size());
        assertFalse(outcomes.get(0).isSuccess());
        assertTrue(outcomes.get(0).getDescription().contains("permission"));
        assertTrue(ctx.cardStore().all().isEmpty());
    }

    @Test
    void laterActionsSeeEarlierOnes() {
        ctx.cards().createCard("alice", todo.getId(), "Fix bug", null, null);

        List<ActionOutcome> outcomes = run("alice",
            "{\"action\":\"create_tag\",\"params\":{\"name\":\"urgent\"}}\n"
                + "{\"action\":\"add_tag\",\"params\":{\"card\":\"Fix bug\",\"tag\":\"urgent\"}}");

        assertEquals(2, outcomes.size());
        assertTrue(outcomes.get(0).isSuccess());
        assertTrue(outcomes.get(1).isSuccess(), outcomes.get(1).getDescription());
        assertEquals(1, ctx.cardTagStore().all().size());
    }

    @Test
    void referenceBeforeCreationFailsOnlyThatAction() {
        ctx.cards().createCard("alice", todo.getId(), "Fix bug", null, null);

        List<ActionOutcome> outcomes = run("alice",
            "{\"action\":\"add_tag\",\"params\":{\"card\":\"Fix bug\",\"tag\":\"urgent\"}}\n"
                + "{\"action\":\"create_tag\",\"params\":{\"name\":\"urgent\"}}");

        assertEquals(2, outcomes.size());
        assertFalse(outcomes.get(0).isSuccess());
        assertTrue(outcomes.get(0).getDescription().contains("not found"));
        assertTrue(outcomes.get(1).isSuccess());
        assertTrue(ctx.cardTagStore().all().isEmpty());
    }

    @Test
    void missingFieldEchoesParamsAndChangesNothing() {
        List<ActionOutcome> outcomes = run("alice",
            "{\"action\":\"create_card\",\"params\":{\"column\":\"Todo\"}}");

        assertFalse(outcomes.get(0).isSuccess());
        assertTrue(outcomes.get(0).getDescription().contains("title"));
        assertTrue(outcomes.get(0).getDescription().contains("Received params: {\"column\":\"Todo\"}"));
        assertTrue(ctx.cardStore().all().isEmpty());
    }

    @Test
    void aliasesResolveInPriorityOrder() {
        List<ActionOutcome> outcomes = run("alice",
            "{\"action\":\"create_card\",\"params\":{\"in\":\"todo\",\"name\":\"second\",\"title\":\"first\",\"content\":\"b\"}}");

        assertTrue(outcomes.get(0).isSuccess());
        Card card = ctx.cardStore().listByColumn(todo.getId()).get(0);
        assertEquals("first", card.getTitle());
        assertEquals("b", card.getBody());
    }

    @Test
    void unknownActionsAreReportedAndReadOnlyOnesSkipped() {
        List<ActionOutcome> outcomes = run("alice",
            "{\"action\":\"list_cards\"} {\"action\":\"archive_all\",\"params\":{}} {\"action\":\"no_action\"}");

        assertEquals(1, outcomes.size());
        assertEquals("archive_all", outcomes.get(0).getAction());
        assertEquals("Unknown action: archive_all", outcomes.get(0).getDescription());
    }

    @Test
    void unresolvedColumnFails() {
        List<ActionOutcome> outcomes = run("alice",
            "{\"action\":\"create_card\",\"params\":{\"column\":\"Backlog\",\"title\":\"x\"}}");
        assertFalse(outcomes.get(0).isSuccess());
        assertEquals("Column 'Backlog' not found", outcomes.get(0).getDescription());
    }

    @Test
    void outOfRangePositionFailsWithoutMoving() {
        Card fix = ctx.cards().createCard("alice", todo.getId(), "Fix bug", null, null);
        List<ActionOutcome> outcomes = run("alice",
            "{\"action\":\"move_card\",\"params\":{\"card\":\"Fix bug\",\"to\":\"Done\",\"position\":5}}");
        assertFalse(outcomes.get(0).isSuccess());
        assertEquals(todo.getId(), fix.getColumnId());
    }

    @Test
    void deleteActions() {
        ctx.cards().createCard("alice", todo.getId(), "Fix bug", null, null);
        ctx.tags().createBoardTag("alice", board.getId(), "urgent", null);

        List<ActionOutcome> outcomes = run("alice",
            "{\"actions\":[{\"action\":\"delete_card\",\"params\":{\"card\":\"Fix bug\"}},"
                + "{\"action\":\"delete_tag\",\"params\":{\"tag\":\"URGENT\"}},"
                + "{\"action\":\"delete_column\",\"params\":{\"column\":\"Todo\"}}]}");

        assertEquals(3, outcomes.size());
        assertTrue(outcomes.stream().allMatch(ActionOutcome::isSuccess));
        assertTrue(ctx.cardStore().all().isEmpty());
        assertTrue(ctx.tagStore().all().isEmpty());
        List<Column> columns = ctx.columnStore().listByBoard(board.getId());
        assertEquals(1, columns.size());
        assertEquals(0, columns.get(0).getPosition());
    }

    @Test
    void globalOnlyActionsAreRejectedInBoardChat() {
        List<ActionOutcome> outcomes = run("alice",
            "{\"action\":\"create_board\",\"params\":{\"name\":\"Other\"}}");
        assertFalse(outcomes.get(0).isSuccess());
        assertEquals("This action is only available in global chat", outcomes.get(0).getDescription());
        assertEquals(1, ctx.boardStore().all().size());
    }

    @Test
    void globalChatActionsNameTheirBoard() {
        List<ActionOutcome> outcomes = runGlobal("alice",
            "{\"action\":\"create_card\",\"params\":{\"board_name\":\"sprint\",\"column\":\"Todo\",\"title\":\"x\"}}\n"
                + "{\"action\":\"create_card\",\"params\":{\"column\":\"Todo\",\"title\":\"y\"}}\n"
                + "{\"action\":\"create_card\",\"params\":{\"board\":\"Nope\",\"column\":\"Todo\",\"title\":\"z\"}}");

        assertEquals(3, outcomes.size());
        assertTrue(outcomes.get(0).isSuccess());
        assertFalse(outcomes.get(1).isSuccess());
        assertTrue(outcomes.get(1).getDescription().startsWith("Missing board"));
        assertEquals("Board 'Nope' not found", outcomes.get(2).getDescription());
        assertEquals(List.of("x"), titles(todo));
    }

    @Test
    void crossBoardMoveKeepsIdentityAndDropsSourceTags() {
        Board other = ctx.boards().createBoard("alice", "Release", null);
        Column inbox = ctx.boards().createColumn("alice", other.getId(), "Inbox", null);
        Card fix = ctx.cards().createCard("alice", todo.getId(), "Fix bug", null, null);
        Tag urgent = ctx.tags().createBoardTag("alice", board.getId(), "urgent", null);
        ctx.tags().addTagToCard("alice", fix.getId(), urgent.getId());

        List<ActionOutcome> outcomes = runGlobal("alice",
            "{\"action\":\"move_card_cross_board\",\"params\":{\"from_board\":\"Sprint\",\"to_board\":\"Release\","
                + "\"card\":\"Fix bug\",\"column\":\"Inbox\"}}");

        assertTrue(outcomes.get(0).isSuccess(), outcomes.get(0).getDescription());
        assertEquals(inbox.getId(), fix.getColumnId());
        assertTrue(ctx.cardStore().find(fix.getId()).isPresent());
        assertTrue(ctx.cardTagStore().listByCard(fix.getId()).isEmpty());
    }

    @Test
    void crossBoardMoveNeedsEditRightsOnBothBoards() {
        Board other = ctx.boards().createBoard("carol", "Release", null);
        ctx.boards().createColumn("carol", other.getId(), "Inbox", null);
        ctx.boards().setPermission("carol", other.getId(), "alice", BoardRole.READER);
        Card fix = ctx.cards().createCard("alice", todo.getId(), "Fix bug", null, null);

        List<ActionOutcome> outcomes = runGlobal("alice",
            "{\"action\":\"move_card_cross_board\",\"params\":{\"source\":\"Sprint\",\"destination\":\"Release\","
                + "\"card\":\"Fix bug\",\"to_column\":\"Inbox\"}}");

        assertFalse(outcomes.get(0).isSuccess());
        assertEquals("You don't have permission to edit board 'Release'", outcomes.get(0).getDescription());
        assertEquals(todo.getId(), fix.getColumnId());
    }

    @Test
    void createBoardInGlobalChat() {
        List<ActionOutcome> outcomes = runGlobal("bob",
            "{\"action\":\"create_board\",\"params\":{\"board_name\":\"Personal\",\"desc\":\"mine\"}}");
        assertTrue(outcomes.get(0).isSuccess());
        assertEquals(1, ctx.boards().listBoards("bob").size());
        assertEquals(BoardRole.OWNER, ctx.boards().listBoards("bob").get(0).getRole());
    }

    @Test
    void permissionIsReadAgainForEachAction() {
        ctx.boards().setPermission("alice", board.getId(), "bob", BoardRole.EDITOR);
        ActionExecutionContext context = ActionExecutionContext.forBoard("bob", board.getId());

        ActionOutcome first = ctx.actions().execute(ActionDescriptor.of("create_tag",
            java.util.Map.of("name", "a"), null), context).orElseThrow();
        ctx.boards().setPermission("alice", board.getId(), "bob", BoardRole.READER);
        ActionOutcome second = ctx.actions().execute(ActionDescriptor.of("create_tag",
            java.util.Map.of("name", "b"), null), context).orElseThrow();

        assertTrue(first.isSuccess());
        assertFalse(second.isSuccess());
    }
}
