package com.taskboard;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskboard.actions.ActionExecutor;
import com.taskboard.actions.ActionParser;
import com.taskboard.actions.ActionSchemaRegistry;
import com.taskboard.actions.EntityResolver;
import com.taskboard.models.Card;
import com.taskboard.models.CardBoardAssignment;
import com.taskboard.models.Column;
import com.taskboard.ordering.PositionStore;
import com.taskboard.providers.chat.ChatEndpoint;
import com.taskboard.providers.chat.ChatProvider;
import com.taskboard.providers.chat.ChatProviderFactory;
import com.taskboard.storage.BoardStore;
import com.taskboard.storage.CardBoardStore;
import com.taskboard.storage.CardStore;
import com.taskboard.storage.CardTagStore;
import com.taskboard.storage.ChatMessageStore;
import com.taskboard.storage.ColumnStore;
import com.taskboard.storage.CommentStore;
import com.taskboard.storage.PermissionStore;
import com.taskboard.storage.TagStore;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Holder wiring the stores and services for one data directory.
 */
public class TaskboardContext {

    private final AppConfig config;
    private final ObjectMapper objectMapper;
    private final BoardStore boardStore;
    private final PermissionStore permissionStore;
    private final ColumnStore columnStore;
    private final CardStore cardStore;
    private final CardBoardStore cardBoardStore;
    private final TagStore tagStore;
    private final CardTagStore cardTagStore;
    private final CommentStore commentStore;
    private final ChatMessageStore chatMessageStore;
    private final BoardService boardService;
    private final CardService cardService;
    private final TagService tagService;
    private final CommentService commentService;
    private final EntityResolver entityResolver;
    private final ActionExecutor actionExecutor;
    private final ChatService chatService;

    public TaskboardContext(AppConfig config, ObjectMapper objectMapper) {
        this(config, objectMapper, new ChatProviderFactory(objectMapper).getProvider(config.getChatProvider()));
    }

    /**
     * Wire everything with an explicit chat provider.
     */
    public TaskboardContext(AppConfig config, ObjectMapper objectMapper, ChatProvider chatProvider) {
        this.config = config;
        this.objectMapper = objectMapper;
        Path dataDir = config.getDataDirectory();

        this.boardStore = new BoardStore(dataDir);
        this.permissionStore = new PermissionStore(dataDir);
        this.columnStore = new ColumnStore(dataDir);
        this.cardStore = new CardStore(dataDir);
        this.cardBoardStore = new CardBoardStore(dataDir);
        this.tagStore = new TagStore(dataDir);
        this.cardTagStore = new CardTagStore(dataDir);
        this.commentStore = new CommentStore(dataDir);
        this.chatMessageStore = new ChatMessageStore(dataDir);

        PositionStore<Column> columnPositions = new PositionStore<>("columns", columnStore);
        PositionStore<Card> cardPositions = new PositionStore<>("cards", cardStore);
        PositionStore<CardBoardAssignment> assignmentPositions = new PositionStore<>("assignments", cardBoardStore);

        BoardCascade cascade = new BoardCascade(boardStore, permissionStore, columnStore, cardStore, cardBoardStore,
            tagStore, cardTagStore, commentStore, chatMessageStore, columnPositions, cardPositions, assignmentPositions);
        this.boardService = new BoardService(boardStore, permissionStore, columnStore, columnPositions, cascade);
        this.cardService = new CardService(boardService, columnStore, cardStore, cardBoardStore, tagStore,
            cardTagStore, cardPositions, assignmentPositions, cascade);
        this.tagService = new TagService(boardService, cardService, tagStore, cardTagStore);
        this.commentService = new CommentService(cardService, commentStore);
        this.entityResolver = new EntityResolver(boardService, columnStore, cardStore, tagStore);
        this.actionExecutor = new ActionExecutor(boardService, cardService, tagService, entityResolver,
            ActionSchemaRegistry.defaults(), objectMapper);
        this.chatService = new ChatService(boardService, columnStore, cardStore, tagStore, chatMessageStore,
            new ActionParser(objectMapper), actionExecutor, new SystemPromptBuilder(), chatProvider,
            ChatEndpoint.fromConfig(config), config.getHistoryLimit());

        log("Taskboard context loaded" + (dataDir != null ? " for " + dataDir : " (memory only)"));
    }

    /**
     * Build the configuration from environment variables, start logging and wire the context.
     */
    public static TaskboardContext bootstrap(Map<String, String> env) throws IOException {
        AppConfig config = new AppConfig.Builder().fromEnvironment(env).build();
        AppLogger.initialize(config, true);
        return new TaskboardContext(config, new ObjectMapper());
    }

    public AppConfig config() {
        return config;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public BoardService boards() {
        return boardService;
    }

    public CardService cards() {
        return cardService;
    }

    public TagService tags() {
        return tagService;
    }

    public CommentService comments() {
        return commentService;
    }

    public EntityResolver resolver() {
        return entityResolver;
    }

    public ActionExecutor actions() {
        return actionExecutor;
    }

    public ChatService chat() {
        return chatService;
    }

    public BoardStore boardStore() {
        return boardStore;
    }

    public PermissionStore permissionStore() {
        return permissionStore;
    }

    public ColumnStore columnStore() {
        return columnStore;
    }

    public CardStore cardStore() {
        return cardStore;
    }

    public CardBoardStore cardBoardStore() {
        return cardBoardStore;
    }

    public TagStore tagStore() {
        return tagStore;
    }

    public CardTagStore cardTagStore() {
        return cardTagStore;
    }

    public CommentStore commentStore() {
        return commentStore;
    }

    public ChatMessageStore chatMessageStore() {
        return chatMessageStore;
    }

    private void log(String message) {
        AppLogger logger = AppLogger.get();
        if (logger != null) {
            logger.info(message);
        } else {
            System.out.println(message);
        }
    }
}
