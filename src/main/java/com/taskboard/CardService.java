package com.taskboard;

import com.taskboard.access.AccessPolicy;
import com.taskboard.errors.ForbiddenException;
import com.taskboard.errors.NotFoundException;
import com.taskboard.errors.ValidationException;
import com.taskboard.models.BoardRole;
import com.taskboard.models.Card;
import com.taskboard.models.CardBoardAssignment;
import com.taskboard.models.CardFilter;
import com.taskboard.models.CardStatus;
import com.taskboard.models.CardTag;
import com.taskboard.models.CardUpdate;
import com.taskboard.models.CardVisibility;
import com.taskboard.models.Column;
import com.taskboard.models.Tag;
import com.taskboard.ordering.PositionStore;
import com.taskboard.storage.CardBoardStore;
import com.taskboard.storage.CardStore;
import com.taskboard.storage.CardTagStore;
import com.taskboard.storage.ColumnStore;
import com.taskboard.storage.TagStore;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Cards in columns, standalone (inbox) cards and their board assignments.
 */
public class CardService {

    private final BoardService boardService;
    private final ColumnStore columns;
    private final CardStore cards;
    private final CardBoardStore assignments;
    private final TagStore tags;
    private final CardTagStore cardTags;
    private final PositionStore<Card> cardPositions;
    private final PositionStore<CardBoardAssignment> assignmentPositions;
    private final BoardCascade cascade;

    public CardService(BoardService boardService, ColumnStore columns, CardStore cards, CardBoardStore assignments,
                       TagStore tags, CardTagStore cardTags, PositionStore<Card> cardPositions,
                       PositionStore<CardBoardAssignment> assignmentPositions, BoardCascade cascade) {
        this.boardService = boardService;
        this.columns = columns;
        this.cards = cards;
        this.assignments = assignments;
        this.tags = tags;
        this.cardTags = cardTags;
        this.cardPositions = cardPositions;
        this.assignmentPositions = assignmentPositions;
        this.cascade = cascade;
    }

    // ---- cards in columns ----

    /**
     * Create a card in a column, at the given position or at the end. Visibility defaults to Restricted.
     */
    public Card createCard(String actorId, String columnId, String title, String body, Integer position) {
        BoardService.requireActor(actorId);
        Column column = columns.find(columnId).orElseThrow(() -> new NotFoundException("Column", columnId));
        boardService.requireEdit(column.getBoardId(), actorId);
        long now = Timestamps.next();
        Card card = new Card(UUID.randomUUID().toString(), columnId, BoardService.requireText(title, "Card title"),
            body, 0, CardVisibility.RESTRICTED, CardStatus.OPEN, actorId, actorId, now, now);
        cardPositions.insert(card, columnId, position);
        return card;
    }

    public Card getCard(String actorId, String cardId) {
        Card card = findCard(cardId);
        if (!AccessPolicy.canViewCard(card, attachedRoles(card, actorId), actorId)) {
            throw new ForbiddenException();
        }
        return card;
    }

    public Card updateCard(String actorId, String cardId, CardUpdate update) {
        Card card = editableCard(actorId, cardId);
        if (update.getTitle() != null) {
            card.setTitle(BoardService.requireText(update.getTitle(), "Card title"));
        }
        if (update.getBody() != null) {
            card.setBody(update.getBody());
        }
        if (update.getVisibility() != null) {
            card.setVisibility(update.getVisibility());
        }
        if (update.getStatus() != null) {
            card.setStatus(update.getStatus());
        }
        if (update.getStartDate() != null) {
            card.setStartDate(normalizeDate(update.getStartDate(), "Start date"));
        }
        if (update.getEndDate() != null) {
            card.setEndDate(normalizeDate(update.getEndDate(), "End date"));
        }
        if (update.getDueDate() != null) {
            card.setDueDate(normalizeDate(update.getDueDate(), "Due date"));
        }
        card.setUpdatedAt(Timestamps.next());
        return cards.save(card);
    }

    public Card updateStatus(String actorId, String cardId, CardStatus status) {
        if (status == null) {
            throw new ValidationException("Status is required");
        }
        return updateCard(actorId, cardId, new CardUpdate().status(status));
    }

    public void deleteCard(String actorId, String cardId) {
        Card card = editableCard(actorId, cardId);
        cascade.deleteCard(card);
    }

    /**
     * Move a card to a column of the same board.
     */
    public Card moveCard(String actorId, String cardId, String targetColumnId, int position) {
        Card card = findCard(cardId);
        if (card.isStandalone()) {
            throw new ValidationException("Card is not in a column");
        }
        Column source = columns.find(card.getColumnId()).orElseThrow(() -> new NotFoundException("Column", card.getColumnId()));
        Column target = columns.find(targetColumnId).orElseThrow(() -> new NotFoundException("Column", targetColumnId));
        boardService.requireEdit(source.getBoardId(), actorId);
        if (!source.getBoardId().equals(target.getBoardId())) {
            throw new ValidationException("Target column belongs to a different board");
        }
        cardPositions.move(card, targetColumnId, position);
        return card;
    }

    /**
     * Move a card into a column of another board. Requires edit rights on both boards.
     * The card keeps its id; links to tags of the source board are dropped, and an assignment
     * to the target board is removed since the card now lives there.
     */
    public Card moveCardToBoard(String actorId, String cardId, String targetColumnId, int position) {
        Card card = findCard(cardId);
        if (card.isStandalone()) {
            throw new ValidationException("Card is not in a column");
        }
        Column source = columns.find(card.getColumnId()).orElseThrow(() -> new NotFoundException("Column", card.getColumnId()));
        Column target = columns.find(targetColumnId).orElseThrow(() -> new NotFoundException("Column", targetColumnId));
        boardService.requireEdit(source.getBoardId(), actorId);
        boardService.requireEdit(target.getBoardId(), actorId);

        cardPositions.move(card, targetColumnId, position);
        if (!source.getBoardId().equals(target.getBoardId())) {
            assignments.findFor(card.getId(), target.getBoardId()).ifPresent(assignmentPositions::remove);
            List<String> sourceTagIds = tags.listByBoard(source.getBoardId()).stream()
                .map(Tag::getId)
                .collect(Collectors.toList());
            if (!sourceTagIds.isEmpty()) {
                cardTags.deleteByCardAndTags(card.getId(), sourceTagIds);
            }
        }
        return card;
    }

    /**
     * Cards on a board the viewer may see: cards in its columns by column then card position,
     * followed by cards assigned to the board by bucket.
     */
    public List<Card> listBoardCards(String actorId, String boardId, CardFilter filter) {
        boardService.requireRole(boardId, actorId);
        List<Column> boardColumns = columns.listByBoard(boardId);
        Set<Card> ordered = new LinkedHashSet<>();
        for (Column column : boardColumns) {
            ordered.addAll(cards.listByColumn(column.getId()));
        }
        List<CardBoardAssignment> placed = new ArrayList<>(assignments.listByBoard(boardId));
        Map<String, Integer> columnOrder = boardColumns.stream()
            .collect(Collectors.toMap(Column::getId, Column::getPosition));
        placed.sort(Comparator
            .comparingInt((CardBoardAssignment a) -> a.getColumnId() == null
                ? Integer.MAX_VALUE : columnOrder.getOrDefault(a.getColumnId(), Integer.MAX_VALUE))
            .thenComparingInt(CardBoardAssignment::getPosition));
        for (CardBoardAssignment assignment : placed) {
            cards.find(assignment.getCardId()).ifPresent(ordered::add);
        }

        List<Card> result = new ArrayList<>();
        for (Card card : ordered) {
            if (AccessPolicy.canViewCard(card, attachedRoles(card, actorId), actorId) && matches(card, filter)) {
                result.add(card);
            }
        }
        return result;
    }

    private boolean matches(Card card, CardFilter filter) {
        if (filter == null) {
            return true;
        }
        if (filter.getQuery() != null && !filter.getQuery().isBlank()) {
            String query = filter.getQuery().trim().toLowerCase(Locale.ROOT);
            String title = card.getTitle() != null ? card.getTitle().toLowerCase(Locale.ROOT) : "";
            String body = card.getBody() != null ? card.getBody().toLowerCase(Locale.ROOT) : "";
            if (!title.contains(query) && !body.contains(query)) {
                return false;
            }
        }
        if (filter.getStatus() != null && filter.getStatus() != card.getStatus()) {
            return false;
        }
        if (!filter.getTagIds().isEmpty()) {
            Set<String> cardTagIds = cardTags.listByCard(card.getId()).stream()
                .map(CardTag::getTagId)
                .collect(Collectors.toSet());
            if (!cardTagIds.containsAll(filter.getTagIds())) {
                return false;
            }
        }
        if (filter.getDueDateFrom() != null || filter.getDueDateTo() != null) {
            if (card.getDueDate() == null) {
                return false;
            }
            LocalDate due = LocalDate.parse(card.getDueDate());
            if (filter.getDueDateFrom() != null && due.isBefore(parseDate(filter.getDueDateFrom(), "Due date from"))) {
                return false;
            }
            if (filter.getDueDateTo() != null && due.isAfter(parseDate(filter.getDueDateTo(), "Due date to"))) {
                return false;
            }
        }
        return true;
    }

    // ---- inbox ----

    /**
     * Create a card owned by the actor outside any board. Visibility defaults to Private.
     */
    public Card createStandaloneCard(String actorId, String title, String body) {
        BoardService.requireActor(actorId);
        long now = Timestamps.next();
        Card card = new Card(UUID.randomUUID().toString(), null, BoardService.requireText(title, "Card title"),
            body, 0, CardVisibility.PRIVATE, CardStatus.OPEN, actorId, actorId, now, now);
        return cards.save(card);
    }

    public List<Card> listInbox(String actorId, CardStatus status) {
        BoardService.requireActor(actorId);
        return cards.listStandaloneFor(actorId).stream()
            .filter(card -> status == null || card.getStatus() == status)
            .collect(Collectors.toList());
    }

    /**
     * Place a card on a board, in a column of that board or in the column-less bucket.
     */
    public CardBoardAssignment assignToBoard(String actorId, String cardId, String boardId, String columnId,
                                             Integer position) {
        Card card = editableCard(actorId, cardId);
        boardService.requireEdit(boardId, actorId);
        if (assignments.findFor(cardId, boardId).isPresent() || boardId.equals(primaryBoardOf(card))) {
            throw new ValidationException("Card is already on this board");
        }
        requireColumnOnBoard(columnId, boardId);
        CardBoardAssignment assignment = new CardBoardAssignment(UUID.randomUUID().toString(), cardId, boardId,
            columnId, 0, Timestamps.next());
        assignmentPositions.insert(assignment, CardBoardStore.bucket(boardId, columnId), position);
        return assignment;
    }

    public void removeFromBoard(String actorId, String cardId, String boardId) {
        findCard(cardId);
        boardService.requireEdit(boardId, actorId);
        CardBoardAssignment assignment = assignments.findFor(cardId, boardId)
            .orElseThrow(() -> new NotFoundException("Assignment", cardId));
        assignmentPositions.remove(assignment);
    }

    /**
     * Move a card's assignment between the buckets of one board.
     */
    public CardBoardAssignment moveAssignment(String actorId, String cardId, String boardId, String columnId,
                                              int position) {
        findCard(cardId);
        boardService.requireEdit(boardId, actorId);
        CardBoardAssignment assignment = assignments.findFor(cardId, boardId)
            .orElseThrow(() -> new NotFoundException("Assignment", cardId));
        requireColumnOnBoard(columnId, boardId);
        assignmentPositions.move(assignment, CardBoardStore.bucket(boardId, columnId), position);
        return assignment;
    }

    public List<CardBoardAssignment> listAssignments(String actorId, String cardId) {
        getCard(actorId, cardId);
        return assignments.listByCard(cardId);
    }

    private void requireColumnOnBoard(String columnId, String boardId) {
        if (columnId == null) {
            return;
        }
        Column column = columns.find(columnId).orElseThrow(() -> new NotFoundException("Column", columnId));
        if (!boardId.equals(column.getBoardId())) {
            throw new ValidationException("Column does not belong to this board");
        }
    }

    // ---- shared lookups ----

    public Card findCard(String cardId) {
        return cards.find(cardId).orElseThrow(() -> new NotFoundException("Card", cardId));
    }

    Card editableCard(String actorId, String cardId) {
        BoardService.requireActor(actorId);
        Card card = findCard(cardId);
        if (!AccessPolicy.canEditCard(card, attachedRoles(card, actorId), actorId)) {
            throw new ForbiddenException("You don't have permission to edit this card");
        }
        return card;
    }

    /**
     * Board of the card's primary column, or null for standalone cards.
     */
    public String primaryBoardOf(Card card) {
        if (card.getColumnId() == null) {
            return null;
        }
        return columns.find(card.getColumnId()).map(Column::getBoardId).orElse(null);
    }

    /**
     * Every board the card is on: its primary column's board first, then assignment boards.
     */
    public Set<String> attachedBoardIds(Card card) {
        Set<String> boardIds = new LinkedHashSet<>();
        String primary = primaryBoardOf(card);
        if (primary != null) {
            boardIds.add(primary);
        }
        for (CardBoardAssignment assignment : assignments.listByCard(card.getId())) {
            boardIds.add(assignment.getBoardId());
        }
        return boardIds;
    }

    /**
     * The user's role on each attached board, null where there is no relation.
     */
    public List<BoardRole> attachedRoles(Card card, String userId) {
        List<BoardRole> roles = new ArrayList<>();
        for (String boardId : attachedBoardIds(card)) {
            Optional<BoardRole> role = boardService.roleOf(boardId, userId);
            roles.add(role.orElse(null));
        }
        return roles;
    }

    private String normalizeDate(String value, String label) {
        if (value.isBlank()) {
            return null;
        }
        return parseDate(value, label).toString();
    }

    private LocalDate parseDate(String value, String label) {
        try {
            return LocalDate.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException(label + " must be an ISO date (yyyy-MM-dd): " + value);
        }
    }
}
