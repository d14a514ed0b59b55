package com.taskboard;

import com.taskboard.errors.ForbiddenException;
import com.taskboard.errors.NotFoundException;
import com.taskboard.errors.ValidationException;
import com.taskboard.models.Board;
import com.taskboard.models.BoardRole;
import com.taskboard.models.Card;
import com.taskboard.models.CardBoardAssignment;
import com.taskboard.models.CardFilter;
import com.taskboard.models.CardStatus;
import com.taskboard.models.CardUpdate;
import com.taskboard.models.CardVisibility;
import com.taskboard.models.Column;
import com.taskboard.models.Tag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class CardServiceTest {

    private TaskboardContext ctx;
    private CardService cards;
    private Board board;
    private Column todo;
    private Column done;

    @BeforeEach
    void setUp() {
        ctx = TestContexts.memory();
        cards = ctx.cards();
        board = ctx.boards().createBoard("alice", "Sprint", null);
        todo = ctx.boards().createColumn("alice", board.getId(), "Todo", null);
        done = ctx.boards().createColumn("alice", board.getId(), "Done", null);
        ctx.boards().setPermission("alice", board.getId(), "reader", BoardRole.READER);
        ctx.boards().setPermission("alice", board.getId(), "editor", BoardRole.EDITOR);
    }

    private List<String> titles(List<Card> list) {
        return list.stream().map(Card::getTitle).collect(Collectors.toList());
    }

    @Test
    void columnCardsDefaultToRestrictedAndOpen() {
        Card card = cards.createCard("alice", todo.getId(), "Fix bug", "details", null);
        assertEquals(CardVisibility.RESTRICTED, card.getVisibility());
        assertEquals(CardStatus.OPEN, card.getStatus());
        assertEquals("alice", card.getOwnerId());
        assertEquals("alice", card.getCreatedBy());
    }

    @Test
    void visibilityTiersDecideWhoCanRead() {
        Card card = cards.createCard("alice", todo.getId(), "Secret", null, null);
        assertNotNull(cards.getCard("reader", card.getId()));

        cards.updateCard("alice", card.getId(), new CardUpdate().visibility(CardVisibility.PRIVATE));
        assertThrows(ForbiddenException.class, () -> cards.getCard("reader", card.getId()));
        assertNotNull(cards.getCard("editor", card.getId()));
        assertThrows(ForbiddenException.class, () -> cards.getCard("stranger", card.getId()));

        cards.updateCard("alice", card.getId(), new CardUpdate().visibility(CardVisibility.PUBLIC));
        assertNotNull(cards.getCard("stranger", card.getId()));
        assertThrows(NotFoundException.class, () -> cards.getCard("alice", "missing"));
    }

    @Test
    void listingHidesCardsTheViewerCannotSee() {
        cards.createCard("alice", todo.getId(), "Visible", null, null);
        Card hidden = cards.createCard("alice", done.getId(), "Hidden", null, null);
        cards.updateCard("alice", hidden.getId(), new CardUpdate().visibility(CardVisibility.PRIVATE));

        assertEquals(List.of("Visible"), titles(cards.listBoardCards("reader", board.getId(), null)));
        assertEquals(List.of("Visible", "Hidden"), titles(cards.listBoardCards("editor", board.getId(), null)));
        assertThrows(ForbiddenException.class, () -> cards.listBoardCards("stranger", board.getId(), null));
    }

    @Test
    void listingFilters() {
        Card a = cards.createCard("alice", todo.getId(), "Write docs", "readme", null);
        Card b = cards.createCard("alice", todo.getId(), "Fix login", null, null);
        cards.updateCard("alice", a.getId(), new CardUpdate().dueDate("2024-03-10").status(CardStatus.IN_PROGRESS));
        cards.updateCard("alice", b.getId(), new CardUpdate().dueDate("2024-04-01"));
        Tag urgent = ctx.tags().createBoardTag("alice", board.getId(), "urgent", null);
        ctx.tags().addTagToCard("alice", b.getId(), urgent.getId());

        assertEquals(List.of("Write docs"), titles(cards.listBoardCards("alice", board.getId(), new CardFilter().query("README"))));
        assertEquals(List.of("Fix login"), titles(cards.listBoardCards("alice", board.getId(), new CardFilter().tag(urgent.getId()))));
        assertEquals(List.of("Write docs"), titles(cards.listBoardCards("alice", board.getId(),
            new CardFilter().dueDateFrom("2024-03-01").dueDateTo("2024-03-31"))));
        assertEquals(List.of("Write docs"), titles(cards.listBoardCards("alice", board.getId(),
            new CardFilter().status(CardStatus.IN_PROGRESS))));
    }

    @Test
    void invalidDatesAreRejected() {
        Card card = cards.createCard("alice", todo.getId(), "Fix bug", null, null);
        assertThrows(ValidationException.class,
            () -> cards.updateCard("alice", card.getId(), new CardUpdate().dueDate("next tuesday")));
        cards.updateCard("alice", card.getId(), new CardUpdate().dueDate("2024-01-05"));
        assertEquals("2024-01-05", cards.getCard("alice", card.getId()).getDueDate());
        cards.updateCard("alice", card.getId(), new CardUpdate().dueDate(""));
        assertNull(cards.getCard("alice", card.getId()).getDueDate());
    }

    @Test
    void moveStaysOnTheSameBoard() {
        Board other = ctx.boards().createBoard("alice", "Other", null);
        Column elsewhere = ctx.boards().createColumn("alice", other.getId(), "Todo", null);
        Card card = cards.createCard("alice", todo.getId(), "Fix bug", null, null);

        assertThrows(ValidationException.class, () -> cards.moveCard("alice", card.getId(), elsewhere.getId(), 0));
        assertThrows(ForbiddenException.class, () -> cards.moveCard("reader", card.getId(), done.getId(), 0));

        cards.moveCard("editor", card.getId(), done.getId(), 0);
        assertEquals(done.getId(), cards.getCard("editor", card.getId()).getColumnId());
    }

    @Test
    void movingOntoAnAssignedBoardDropsTheAssignment() {
        Board other = ctx.boards().createBoard("alice", "Other", null);
        Column otherTodo = ctx.boards().createColumn("alice", other.getId(), "Todo", null);
        Card card = cards.createCard("alice", todo.getId(), "Fix bug", null, null);
        Card note = cards.createStandaloneCard("alice", "Idea", null);
        cards.assignToBoard("alice", card.getId(), other.getId(), null, null);
        cards.assignToBoard("alice", note.getId(), other.getId(), null, null);

        cards.moveCardToBoard("alice", card.getId(), otherTodo.getId(), 0);

        assertEquals(otherTodo.getId(), cards.getCard("alice", card.getId()).getColumnId());
        assertTrue(ctx.cardBoardStore().findFor(card.getId(), other.getId()).isEmpty());
        assertEquals(Set.of(other.getId()), cards.attachedBoardIds(cards.findCard(card.getId())));
        assertEquals(List.of("Idea"), bucketTitles(other.getId(), null));
        assertEquals(0, ctx.cardBoardStore().findFor(note.getId(), other.getId()).orElseThrow().getPosition());
        assertEquals(1, cards.listBoardCards("alice", other.getId(), null).stream()
            .filter(c -> c.getId().equals(card.getId())).count());
    }

    @Test
    void deletingCardClosesGaps() {
        Card first = cards.createCard("alice", todo.getId(), "First", null, null);
        Card second = cards.createCard("alice", todo.getId(), "Second", null, null);
        cards.deleteCard("alice", first.getId());
        assertEquals(0, cards.getCard("alice", second.getId()).getPosition());
        assertTrue(ctx.cardStore().find(first.getId()).isEmpty());
    }

    @Test
    void inboxCardsArePrivateToTheirOwner() {
        Card note = cards.createStandaloneCard("bob", "Call dentist", null);
        assertNull(note.getColumnId());
        assertEquals(CardVisibility.PRIVATE, note.getVisibility());

        assertEquals(List.of("Call dentist"), titles(cards.listInbox("bob", null)));
        assertTrue(cards.listInbox("alice", null).isEmpty());
        assertThrows(ForbiddenException.class, () -> cards.getCard("alice", note.getId()));

        cards.updateStatus("bob", note.getId(), CardStatus.DONE);
        assertTrue(cards.listInbox("bob", CardStatus.OPEN).isEmpty());
        assertEquals(1, cards.listInbox("bob", CardStatus.DONE).size());
    }

    @Test
    void assigningPlacesCardOnBoardOnce() {
        ctx.boards().setPermission("alice", board.getId(), "bob", BoardRole.EDITOR);
        Card note = cards.createStandaloneCard("bob", "Call dentist", null);

        CardBoardAssignment assignment = cards.assignToBoard("bob", note.getId(), board.getId(), todo.getId(), null);
        assertEquals(0, assignment.getPosition());
        assertThrows(ValidationException.class,
            () -> cards.assignToBoard("bob", note.getId(), board.getId(), null, null));
        assertTrue(cards.listBoardCards("alice", board.getId(), null).stream()
            .anyMatch(card -> card.getId().equals(note.getId())));
        assertTrue(cards.listBoardCards("reader", board.getId(), null).stream()
            .noneMatch(card -> card.getId().equals(note.getId())));

        cards.updateCard("bob", note.getId(), new CardUpdate().visibility(CardVisibility.RESTRICTED));
        assertNotNull(cards.getCard("reader", note.getId()));
    }

    @Test
    void assignmentColumnMustBelongToTheBoard() {
        Board other = ctx.boards().createBoard("alice", "Other", null);
        Column elsewhere = ctx.boards().createColumn("alice", other.getId(), "Todo", null);
        Card note = cards.createStandaloneCard("alice", "Idea", null);
        assertThrows(ValidationException.class,
            () -> cards.assignToBoard("alice", note.getId(), board.getId(), elsewhere.getId(), null));
        assertTrue(ctx.cardBoardStore().all().isEmpty());
    }

    @Test
    void assignmentBucketsStayDense() {
        Card a = cards.createStandaloneCard("alice", "A", null);
        Card b = cards.createStandaloneCard("alice", "B", null);
        Card c = cards.createStandaloneCard("alice", "C", null);
        cards.assignToBoard("alice", a.getId(), board.getId(), null, null);
        cards.assignToBoard("alice", b.getId(), board.getId(), null, null);
        cards.assignToBoard("alice", c.getId(), board.getId(), null, 0);

        assertEquals(List.of("C", "A", "B"), bucketTitles(null));

        cards.moveAssignment("alice", a.getId(), board.getId(), todo.getId(), 0);
        assertEquals(List.of("C", "B"), bucketTitles(null));
        assertEquals(List.of("A"), bucketTitles(todo.getId()));

        cards.removeFromBoard("alice", c.getId(), board.getId());
        assertEquals(List.of("B"), bucketTitles(null));
        assertEquals(0, ctx.cardBoardStore().findFor(b.getId(), board.getId()).orElseThrow().getPosition());
    }

    private List<String> bucketTitles(String columnId) {
        return bucketTitles(board.getId(), columnId);
    }

    private List<String> bucketTitles(String boardId, String columnId) {
        return ctx.cardBoardStore().listByBucket(boardId, columnId).stream()
            .map(assignment -> ctx.cardStore().find(assignment.getCardId()).orElseThrow().getTitle())
            .collect(Collectors.toList());
    }
}
