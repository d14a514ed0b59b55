package com.taskboard;

import com.taskboard.access.AccessPolicy;
import com.taskboard.actions.ActionDescriptor;
import com.taskboard.actions.ActionExecutionContext;
import com.taskboard.actions.ActionExecutor;
import com.taskboard.actions.ActionParser;
import com.taskboard.errors.AssistantUnavailableException;
import com.taskboard.errors.ForbiddenException;
import com.taskboard.models.ActionOutcome;
import com.taskboard.models.Board;
import com.taskboard.models.BoardMembership;
import com.taskboard.models.BoardRole;
import com.taskboard.models.ChatMessage;
import com.taskboard.models.ChatResponse;
import com.taskboard.models.Column;
import com.taskboard.providers.chat.ChatEndpoint;
import com.taskboard.providers.chat.ChatProvider;
import com.taskboard.providers.chat.ChatTurn;
import com.taskboard.storage.CardStore;
import com.taskboard.storage.ChatMessageStore;
import com.taskboard.storage.ColumnStore;
import com.taskboard.storage.TagStore;

import java.io.IOException;
import java.net.http.HttpTimeoutException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Board and global chat: prompt the model, run the actions it asks for and record the exchange.
 */
public class ChatService {

    static final String PROCESSING = "Processing your request...";

    private final BoardService boardService;
    private final ColumnStore columns;
    private final CardStore cards;
    private final TagStore tags;
    private final ChatMessageStore messages;
    private final ActionParser parser;
    private final ActionExecutor executor;
    private final SystemPromptBuilder promptBuilder;
    private final ChatProvider provider;
    private final ChatEndpoint endpoint;
    private final int historyLimit;

    public ChatService(BoardService boardService, ColumnStore columns, CardStore cards, TagStore tags,
                       ChatMessageStore messages, ActionParser parser, ActionExecutor executor,
                       SystemPromptBuilder promptBuilder, ChatProvider provider, ChatEndpoint endpoint,
                       int historyLimit) {
        this.boardService = boardService;
        this.columns = columns;
        this.cards = cards;
        this.tags = tags;
        this.messages = messages;
        this.parser = parser;
        this.executor = executor;
        this.promptBuilder = promptBuilder;
        this.provider = provider;
        this.endpoint = endpoint;
        this.historyLimit = historyLimit;
    }

    /**
     * Chat about one board. The actor needs a role on it; edits still need edit rights per action.
     */
    public ChatResponse chat(String actorId, String boardId, String message, String userContext)
        throws AssistantUnavailableException {
        BoardService.requireActor(actorId);
        BoardRole role = boardService.requireRole(boardId, actorId);
        String text = BoardService.requireText(message, "Message");
        Board board = boardService.getBoard(actorId, boardId);
        log("Board chat from " + actorId + " on " + board.getName());

        String systemPrompt = promptBuilder.boardPrompt(snapshot(board, role), userContext);
        String raw = callModel(systemPrompt, text);
        return respond(actorId, boardId, text, raw, ActionExecutionContext.forBoard(actorId, boardId));
    }

    /**
     * Chat across every board the actor can access. Actions name their board.
     */
    public ChatResponse chatGlobal(String actorId, String message) throws AssistantUnavailableException {
        BoardService.requireActor(actorId);
        String text = BoardService.requireText(message, "Message");
        log("Global chat from " + actorId);

        List<SystemPromptBuilder.BoardSnapshot> snapshots = new ArrayList<>();
        for (BoardMembership membership : boardService.listBoards(actorId)) {
            snapshots.add(snapshot(membership.getBoard(), membership.getRole()));
        }
        String raw = callModel(promptBuilder.globalPrompt(snapshots), text);
        return respond(actorId, null, text, raw, ActionExecutionContext.global(actorId));
    }

    /**
     * The board's last messages, oldest first.
     */
    public List<ChatMessage> history(String actorId, String boardId) {
        boardService.requireRole(boardId, actorId);
        return messages.recentForBoard(boardId, historyLimit);
    }

    public List<ChatMessage> globalHistory(String actorId) {
        BoardService.requireActor(actorId);
        return messages.recentGlobal(actorId, historyLimit);
    }

    public void clearHistory(String actorId, String boardId) {
        BoardRole role = boardService.requireRole(boardId, actorId);
        if (!AccessPolicy.canEdit(role)) {
            throw new ForbiddenException("You don't have permission to clear this board's chat");
        }
        int removed = messages.deleteByBoard(boardId).size();
        log("Cleared " + removed + " chat message(s) on " + boardId);
    }

    private ChatResponse respond(String actorId, String boardId, String text, String raw,
                                 ActionExecutionContext context) {
        List<ActionDescriptor> descriptors = parser.parse(raw);
        log("Parsed " + descriptors.size() + " action(s)");
        List<ActionOutcome> outcomes = executor.executeAll(descriptors, context);
        long successful = outcomes.stream().filter(ActionOutcome::isSuccess).count();
        log("Executed " + outcomes.size() + " action(s), " + successful + " successful");

        String reply = readableReply(descriptors, raw);
        messages.append(new ChatMessage(UUID.randomUUID().toString(), boardId, actorId, text, reply,
            outcomes.isEmpty() ? null : outcomes, Timestamps.next()));
        return new ChatResponse(reply, outcomes);
    }

    private SystemPromptBuilder.BoardSnapshot snapshot(Board board, BoardRole role) {
        List<Column> boardColumns = columns.listByBoard(board.getId());
        List<Integer> counts = new ArrayList<>();
        for (Column column : boardColumns) {
            counts.add(cards.listByColumn(column.getId()).size());
        }
        return new SystemPromptBuilder.BoardSnapshot(board, role, boardColumns, counts, tags.listByBoard(board.getId()));
    }

    private String callModel(String systemPrompt, String text) throws AssistantUnavailableException {
        List<ChatTurn> turns = Arrays.asList(ChatTurn.system(systemPrompt), ChatTurn.user(text));
        try {
            String reply = provider.chat(endpoint, turns);
            return reply != null ? reply : "";
        } catch (HttpTimeoutException e) {
            logWarning("Model request timed out: " + e.getMessage());
            throw new AssistantUnavailableException("The assistant did not answer in time", e);
        } catch (IOException e) {
            logWarning("Model request failed: " + e.getMessage());
            throw new AssistantUnavailableException("The assistant is unavailable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AssistantUnavailableException("The assistant request was interrupted", e);
        }
    }

    /**
     * The actions' messages joined by spaces; otherwise a placeholder for JSON-looking replies,
     * or the reply text itself.
     */
    static String readableReply(List<ActionDescriptor> descriptors, String raw) {
        List<String> parts = new ArrayList<>();
        for (ActionDescriptor descriptor : descriptors) {
            String message = descriptor.getMessage();
            if (message != null && !message.isBlank()) {
                parts.add(message.trim());
            }
        }
        if (!parts.isEmpty()) {
            return String.join(" ", parts);
        }
        String trimmed = raw.trim();
        if (trimmed.startsWith("{") || trimmed.contains("\"action\"")) {
            return PROCESSING;
        }
        return trimmed;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info("[ChatService] " + message);
        } else {
            System.out.println("[ChatService] " + message);
        }
    }

    private void logWarning(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.warn("[ChatService] " + message);
        } else {
            System.out.println("[ChatService] " + message);
        }
    }
}
