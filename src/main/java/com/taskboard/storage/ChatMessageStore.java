package com.taskboard.storage;

import com.taskboard.models.ChatMessage;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Append-only chat audit records.
 */
public class ChatMessageStore extends JsonFileStore<ChatMessage> {

    private static final Comparator<ChatMessage> CHRONOLOGICAL = Comparator
        .comparingLong(ChatMessage::getCreatedAt)
        .thenComparing(ChatMessage::getId);

    public ChatMessageStore(Path dataDirectory) {
        super("ChatMessageStore", dataDirectory, "chat_messages.json", ChatMessage[].class);
    }

    @Override
    protected String keyOf(ChatMessage row) {
        return row.getId();
    }

    public ChatMessage append(ChatMessage message) {
        return save(message);
    }

    /**
     * The most recent {@code limit} messages of the board's conversation, oldest first.
     */
    public List<ChatMessage> recentForBoard(String boardId, int limit) {
        return recent(m -> boardId.equals(m.getBoardId()), limit);
    }

    /**
     * The most recent {@code limit} messages of the user's global conversation, oldest first.
     */
    public List<ChatMessage> recentGlobal(String userId, int limit) {
        return recent(m -> m.getBoardId() == null && userId.equals(m.getUserId()), limit);
    }

    public List<ChatMessage> deleteByBoard(String boardId) {
        return deleteWhere(m -> boardId.equals(m.getBoardId()));
    }

    private List<ChatMessage> recent(Predicate<ChatMessage> filter, int limit) {
        List<ChatMessage> matching = rows.values().stream()
            .filter(filter)
            .sorted(CHRONOLOGICAL)
            .collect(Collectors.toList());
        int from = Math.max(0, matching.size() - Math.max(0, limit));
        return matching.subList(from, matching.size());
    }
}
