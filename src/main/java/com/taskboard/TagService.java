package com.taskboard;

import com.taskboard.errors.ForbiddenException;
import com.taskboard.errors.NotFoundException;
import com.taskboard.errors.ValidationException;
import com.taskboard.models.Card;
import com.taskboard.models.CardTag;
import com.taskboard.models.Tag;
import com.taskboard.storage.CardTagStore;
import com.taskboard.storage.TagStore;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Board-scoped and global tags, and the tags attached to cards.
 */
public class TagService {

    private final BoardService boardService;
    private final CardService cardService;
    private final TagStore tags;
    private final CardTagStore cardTags;

    public TagService(BoardService boardService, CardService cardService, TagStore tags, CardTagStore cardTags) {
        this.boardService = boardService;
        this.cardService = cardService;
        this.tags = tags;
        this.cardTags = cardTags;
    }

    public Tag createBoardTag(String actorId, String boardId, String name, String color) {
        boardService.requireEdit(boardId, actorId);
        Tag tag = Tag.boardScoped(UUID.randomUUID().toString(), boardId, BoardService.requireText(name, "Tag name"),
            colorOrDefault(color), Timestamps.next());
        return tags.save(tag);
    }

    /**
     * Board tags ordered by name, then creation.
     */
    public List<Tag> listBoardTags(String actorId, String boardId) {
        boardService.requireRole(boardId, actorId);
        return tags.listByBoard(boardId);
    }

    public Tag createGlobalTag(String actorId, String name, String color) {
        BoardService.requireActor(actorId);
        Tag tag = Tag.global(UUID.randomUUID().toString(), actorId, BoardService.requireText(name, "Tag name"),
            colorOrDefault(color), Timestamps.next());
        return tags.save(tag);
    }

    public List<Tag> listGlobalTags(String actorId) {
        BoardService.requireActor(actorId);
        return tags.listGlobal(actorId);
    }

    public Tag updateTag(String actorId, String tagId, String name, String color) {
        Tag tag = editableTag(actorId, tagId);
        if (name != null) {
            tag.setName(BoardService.requireText(name, "Tag name"));
        }
        if (color != null) {
            tag.setColor(colorOrDefault(color));
        }
        return tags.save(tag);
    }

    public void deleteTag(String actorId, String tagId) {
        Tag tag = editableTag(actorId, tagId);
        cardTags.deleteByTags(Collections.singletonList(tag.getId()));
        tags.delete(tag.getId());
    }

    /**
     * Attach a tag to a card. A board tag must belong to one of the card's boards and needs edit
     * rights there; a global tag needs tag ownership and card edit rights. Adding a tag the card
     * already carries changes nothing.
     */
    public CardTag addTagToCard(String actorId, String cardId, String tagId) {
        BoardService.requireActor(actorId);
        Card card = cardService.findCard(cardId);
        Tag tag = tags.find(tagId).orElseThrow(() -> new NotFoundException("Tag", tagId));
        if (tag.isBoardScoped()) {
            if (!cardService.attachedBoardIds(card).contains(tag.getBoardId())) {
                throw new ValidationException("Tag belongs to a board the card is not on");
            }
            boardService.requireEdit(tag.getBoardId(), actorId);
        } else {
            if (!actorId.equals(tag.getOwnerId())) {
                throw new ForbiddenException("You don't own this tag");
            }
            cardService.editableCard(actorId, cardId);
        }
        Optional<CardTag> existing = cardTags.find(CardTagStore.key(cardId, tagId));
        if (existing.isPresent()) {
            return existing.get();
        }
        return cardTags.save(new CardTag(cardId, tagId, Timestamps.next()));
    }

    public void removeTagFromCard(String actorId, String cardId, String tagId) {
        cardService.editableCard(actorId, cardId);
        cardTags.delete(CardTagStore.key(cardId, tagId));
    }

    public List<Tag> listCardTags(String actorId, String cardId) {
        cardService.getCard(actorId, cardId);
        return cardTags.listByCard(cardId).stream()
            .map(link -> tags.find(link.getTagId()))
            .filter(Optional::isPresent)
            .map(Optional::get)
            .collect(Collectors.toList());
    }

    private Tag editableTag(String actorId, String tagId) {
        Tag tag = tags.find(tagId).orElseThrow(() -> new NotFoundException("Tag", tagId));
        if (tag.isBoardScoped()) {
            boardService.requireEdit(tag.getBoardId(), actorId);
        } else if (actorId == null || !actorId.equals(tag.getOwnerId())) {
            throw new ForbiddenException("You don't own this tag");
        }
        return tag;
    }

    private String colorOrDefault(String color) {
        if (color == null || color.isBlank()) {
            return Tag.DEFAULT_COLOR;
        }
        return color.trim();
    }
}
