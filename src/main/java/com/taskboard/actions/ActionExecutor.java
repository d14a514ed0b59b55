package com.taskboard.actions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskboard.AppLogger;
import com.taskboard.BoardService;
import com.taskboard.CardService;
import com.taskboard.TagService;
import com.taskboard.access.AccessPolicy;
import com.taskboard.errors.StorageException;
import com.taskboard.errors.TaskboardException;
import com.taskboard.models.ActionOutcome;
import com.taskboard.models.Board;
import com.taskboard.models.BoardMembership;
import com.taskboard.models.BoardRole;
import com.taskboard.models.Card;
import com.taskboard.models.Column;
import com.taskboard.models.Tag;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs parsed actions one at a time, in order, for one actor.
 *
 * Each mutating action yields exactly one {@link ActionOutcome}. Missing fields, unknown
 * names, unresolved references and permission denials are failure outcomes; only storage
 * failures propagate. Roles are read again for every action.
 */
public class ActionExecutor {

    private static final String GLOBAL_ONLY = "This action is only available in global chat";

    private final BoardService boardService;
    private final CardService cardService;
    private final TagService tagService;
    private final EntityResolver resolver;
    private final ActionSchemaRegistry registry;
    private final ObjectMapper objectMapper;

    public ActionExecutor(BoardService boardService, CardService cardService, TagService tagService,
                          EntityResolver resolver, ActionSchemaRegistry registry, ObjectMapper objectMapper) {
        this.boardService = boardService;
        this.cardService = cardService;
        this.tagService = tagService;
        this.resolver = resolver;
        this.registry = registry;
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
    }

    /**
     * Outcomes for the mutating descriptors, in descriptor order. Read-only descriptors are skipped.
     */
    public List<ActionOutcome> executeAll(List<ActionDescriptor> descriptors, ActionExecutionContext context) {
        List<ActionOutcome> outcomes = new ArrayList<>();
        for (ActionDescriptor descriptor : descriptors) {
            execute(descriptor, context).ifPresent(outcomes::add);
        }
        return outcomes;
    }

    /**
     * Empty for read-only actions, which make no modification.
     */
    public Optional<ActionOutcome> execute(ActionDescriptor descriptor, ActionExecutionContext context) {
        ChatAction action = descriptor.getAction();
        if (action.isReadOnly()) {
            logDebug("No modification made for " + action.wireName());
            return Optional.empty();
        }
        ActionOutcome outcome = run(descriptor, context);
        if (outcome.isSuccess()) {
            log("Action " + outcome.getAction() + " succeeded: " + outcome.getDescription());
        } else {
            logWarning("Action " + outcome.getAction() + " failed: " + outcome.getDescription());
        }
        return Optional.of(outcome);
    }

    private ActionOutcome run(ActionDescriptor descriptor, ActionExecutionContext context) {
        ChatAction action = descriptor.getAction();
        String name = descriptor.getReportName();
        ActionSchema schema = registry.getSchema(action);
        if (action == ChatAction.UNKNOWN || schema == null) {
            return ActionOutcome.failure(name, "Unknown action: " + descriptor.getRawName());
        }
        if (action.isGlobalOnly() && !context.isGlobal()) {
            return ActionOutcome.failure(name, GLOBAL_ONLY);
        }
        try {
            switch (action) {
                case CREATE_BOARD:
                    return createBoard(descriptor, schema, context);
                case MOVE_CARD_CROSS_BOARD:
                    return moveCardAcrossBoards(descriptor, schema, context);
                default:
                    return runOnBoard(descriptor, schema, context);
            }
        } catch (StorageException e) {
            throw e;
        } catch (TaskboardException | IllegalArgumentException e) {
            return ActionOutcome.failure(name, e.getMessage());
        }
    }

    private ActionOutcome runOnBoard(ActionDescriptor descriptor, ActionSchema schema, ActionExecutionContext context) {
        String name = descriptor.getReportName();
        String actorId = context.getActorId();
        Board board;
        if (context.isGlobal()) {
            ResolvedParams selector = registry.boardSelector().resolve(descriptor.getParams());
            if (!selector.isComplete()) {
                return missing(name, selector.getMissing(), descriptor);
            }
            Optional<BoardMembership> membership = resolver.findBoard(actorId, selector.get(ActionSchemaRegistry.BOARD));
            if (membership.isEmpty()) {
                return ActionOutcome.failure(name, "Board '" + selector.get(ActionSchemaRegistry.BOARD) + "' not found");
            }
            board = membership.get().getBoard();
        } else {
            Optional<BoardRole> role = boardService.roleOf(context.getBoardId(), actorId);
            if (role.isEmpty()) {
                return ActionOutcome.failure(name, "You don't have permission to edit this board");
            }
            board = boardService.getBoard(actorId, context.getBoardId());
        }

        if (!canEdit(board.getId(), actorId)) {
            return denied(name, board);
        }
        ResolvedParams params = schema.resolve(descriptor.getParams());
        if (!params.isComplete()) {
            return missing(name, params.getMissing(), descriptor);
        }

        switch (descriptor.getAction()) {
            case CREATE_CARD:
                return createCard(name, board, params, actorId);
            case MOVE_CARD:
                return moveCard(name, board, params, actorId);
            case CREATE_TAG:
                return createTag(name, board, params, actorId);
            case ADD_TAG:
                return addTag(name, board, params, actorId);
            case DELETE_COLUMN:
                return deleteColumn(name, board, params, actorId);
            case DELETE_TAG:
                return deleteTag(name, board, params, actorId);
            case DELETE_CARD:
                return deleteCard(name, board, params, actorId);
            default:
                return ActionOutcome.failure(name, "Unknown action: " + descriptor.getRawName());
        }
    }

    private ActionOutcome createBoard(ActionDescriptor descriptor, ActionSchema schema, ActionExecutionContext context) {
        String name = descriptor.getReportName();
        ResolvedParams params = schema.resolve(descriptor.getParams());
        if (!params.isComplete()) {
            return missing(name, params.getMissing(), descriptor);
        }
        Board board = boardService.createBoard(context.getActorId(), params.get("name"), params.get("description"));
        return ActionOutcome.success(name, "Created board '" + board.getName() + "'");
    }

    private ActionOutcome moveCardAcrossBoards(ActionDescriptor descriptor, ActionSchema schema,
                                               ActionExecutionContext context) {
        String name = descriptor.getReportName();
        String actorId = context.getActorId();
        ResolvedParams params = schema.resolve(descriptor.getParams());
        if (!params.isComplete()) {
            return missing(name, params.getMissing(), descriptor);
        }
        Optional<BoardMembership> from = resolver.findBoard(actorId, params.get("from_board"));
        if (from.isEmpty()) {
            return ActionOutcome.failure(name, "Board '" + params.get("from_board") + "' not found");
        }
        Optional<BoardMembership> to = resolver.findBoard(actorId, params.get("to_board"));
        if (to.isEmpty()) {
            return ActionOutcome.failure(name, "Board '" + params.get("to_board") + "' not found");
        }
        Board source = from.get().getBoard();
        Board target = to.get().getBoard();
        if (!canEdit(source.getId(), actorId)) {
            return denied(name, source);
        }
        if (!canEdit(target.getId(), actorId)) {
            return denied(name, target);
        }
        Optional<Card> card = resolver.findCard(source.getId(), params.get("card"));
        if (card.isEmpty()) {
            return ActionOutcome.failure(name, "Card '" + params.get("card") + "' not found");
        }
        Optional<Column> column = resolver.findColumn(target.getId(), params.get("column"));
        if (column.isEmpty()) {
            return ActionOutcome.failure(name, "Column '" + params.get("column") + "' not found");
        }
        cardService.moveCardToBoard(actorId, card.get().getId(), column.get().getId(), params.getInt("position", 0));
        return ActionOutcome.success(name, "Moved card '" + card.get().getTitle() + "' from board '"
            + source.getName() + "' to column '" + column.get().getName() + "' on board '" + target.getName() + "'");
    }

    private ActionOutcome createCard(String name, Board board, ResolvedParams params, String actorId) {
        Optional<Column> column = resolver.findColumn(board.getId(), params.get("column"));
        if (column.isEmpty()) {
            return ActionOutcome.failure(name, "Column '" + params.get("column") + "' not found");
        }
        Card card = cardService.createCard(actorId, column.get().getId(), params.get("title"), params.get("body"), null);
        return ActionOutcome.success(name, "Created card '" + card.getTitle() + "' in column '"
            + column.get().getName() + "'");
    }

    private ActionOutcome moveCard(String name, Board board, ResolvedParams params, String actorId) {
        Optional<Card> card = resolver.findCard(board.getId(), params.get("card"));
        if (card.isEmpty()) {
            return ActionOutcome.failure(name, "Card '" + params.get("card") + "' not found");
        }
        Optional<Column> column = resolver.findColumn(board.getId(), params.get("column"));
        if (column.isEmpty()) {
            return ActionOutcome.failure(name, "Column '" + params.get("column") + "' not found");
        }
        cardService.moveCard(actorId, card.get().getId(), column.get().getId(), params.getInt("position", 0));
        return ActionOutcome.success(name, "Moved card '" + card.get().getTitle() + "' to column '"
            + column.get().getName() + "'");
    }

    private ActionOutcome createTag(String name, Board board, ResolvedParams params, String actorId) {
        Tag tag = tagService.createBoardTag(actorId, board.getId(), params.get("name"), params.get("color"));
        return ActionOutcome.success(name, "Created tag '" + tag.getName() + "' with color " + tag.getColor());
    }

    /**
     * Board tags are looked up first, then the actor's global tags.
     */
    private ActionOutcome addTag(String name, Board board, ResolvedParams params, String actorId) {
        Optional<Card> card = resolver.findCard(board.getId(), params.get("card"));
        if (card.isEmpty()) {
            return ActionOutcome.failure(name, "Card '" + params.get("card") + "' not found");
        }
        Optional<Tag> tag = resolver.findBoardTag(board.getId(), params.get("tag"));
        if (tag.isEmpty()) {
            tag = resolver.findGlobalTag(actorId, params.get("tag"));
        }
        if (tag.isEmpty()) {
            return ActionOutcome.failure(name, "Tag '" + params.get("tag") + "' not found");
        }
        tagService.addTagToCard(actorId, card.get().getId(), tag.get().getId());
        return ActionOutcome.success(name, "Added tag '" + tag.get().getName() + "' to card '"
            + card.get().getTitle() + "'");
    }

    private ActionOutcome deleteColumn(String name, Board board, ResolvedParams params, String actorId) {
        Optional<Column> column = resolver.findColumn(board.getId(), params.get("column"));
        if (column.isEmpty()) {
            return ActionOutcome.failure(name, "Column '" + params.get("column") + "' not found");
        }
        boardService.deleteColumn(actorId, column.get().getId());
        return ActionOutcome.success(name, "Deleted column '" + column.get().getName() + "'");
    }

    private ActionOutcome deleteTag(String name, Board board, ResolvedParams params, String actorId) {
        Optional<Tag> tag = resolver.findBoardTag(board.getId(), params.get("tag"));
        if (tag.isEmpty()) {
            return ActionOutcome.failure(name, "Tag '" + params.get("tag") + "' not found");
        }
        tagService.deleteTag(actorId, tag.get().getId());
        return ActionOutcome.success(name, "Deleted tag '" + tag.get().getName() + "'");
    }

    private ActionOutcome deleteCard(String name, Board board, ResolvedParams params, String actorId) {
        Optional<Card> card = resolver.findCard(board.getId(), params.get("card"));
        if (card.isEmpty()) {
            return ActionOutcome.failure(name, "Card '" + params.get("card") + "' not found");
        }
        cardService.deleteCard(actorId, card.get().getId());
        return ActionOutcome.success(name, "Deleted card '" + card.get().getTitle() + "'");
    }

    private boolean canEdit(String boardId, String actorId) {
        return AccessPolicy.canEdit(boardService.roleOf(boardId, actorId).orElse(null));
    }

    private ActionOutcome denied(String name, Board board) {
        return ActionOutcome.failure(name, "You don't have permission to edit board '" + board.getName() + "'");
    }

    private ActionOutcome missing(String name, List<String> fields, ActionDescriptor descriptor) {
        return ActionOutcome.failure(name, "Missing " + String.join(", ", fields)
            + ". Received params: " + describe(descriptor.getParams()));
    }

    private String describe(Map<String, Object> params) {
        try {
            return objectMapper.writeValueAsString(params);
        } catch (JsonProcessingException e) {
            return String.valueOf(params);
        }
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[ActionExecutor] " + message);
        } else {
            System.out.println("[ActionExecutor] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[ActionExecutor] " + message);
        } else {
            System.out.println("[ActionExecutor] " + message);
        }
    }

    private void logDebug(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.debug("[ActionExecutor] " + message);
        }
    }
}
