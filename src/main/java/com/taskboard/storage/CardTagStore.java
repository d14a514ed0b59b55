package com.taskboard.storage;

import com.taskboard.models.CardTag;

import java.nio.file.Path;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

public class CardTagStore extends JsonFileStore<CardTag> {

    public CardTagStore(Path dataDirectory) {
        super("CardTagStore", dataDirectory, "card_tags.json", CardTag[].class);
    }

    @Override
    protected String keyOf(CardTag row) {
        return key(row.getCardId(), row.getTagId());
    }

    public static String key(String cardId, String tagId) {
        return cardId + "|" + tagId;
    }

    public boolean contains(String cardId, String tagId) {
        return rows.containsKey(key(cardId, tagId));
    }

    public List<CardTag> listByCard(String cardId) {
        return rows.values().stream()
            .filter(link -> cardId.equals(link.getCardId()))
            .sorted(Comparator.comparingLong(CardTag::getCreatedAt))
            .collect(Collectors.toList());
    }

    public List<CardTag> deleteByCard(String cardId) {
        return deleteWhere(link -> cardId.equals(link.getCardId()));
    }

    public List<CardTag> deleteByTags(Collection<String> tagIds) {
        return deleteWhere(link -> tagIds.contains(link.getTagId()));
    }

    public List<CardTag> deleteByCardAndTags(String cardId, Collection<String> tagIds) {
        return deleteWhere(link -> cardId.equals(link.getCardId()) && tagIds.contains(link.getTagId()));
    }
}
