package com.taskboard.storage;

import com.taskboard.models.Tag;

import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

public class TagStore extends JsonFileStore<Tag> {

    private static final Comparator<Tag> BY_NAME = Comparator
        .comparing((Tag tag) -> tag.getName() != null ? tag.getName().toLowerCase() : "")
        .thenComparingLong(Tag::getCreatedAt)
        .thenComparing(Tag::getId);

    public TagStore(Path dataDirectory) {
        super("TagStore", dataDirectory, "tags.json", Tag[].class);
    }

    @Override
    protected String keyOf(Tag row) {
        return row.getId();
    }

    public List<Tag> listByBoard(String boardId) {
        return rows.values().stream()
            .filter(tag -> boardId.equals(tag.getBoardId()))
            .sorted(BY_NAME)
            .collect(Collectors.toList());
    }

    public List<Tag> listGlobal(String ownerId) {
        return rows.values().stream()
            .filter(tag -> tag.getBoardId() == null && ownerId.equals(tag.getOwnerId()))
            .sorted(BY_NAME)
            .collect(Collectors.toList());
    }

    public List<Tag> deleteByBoard(String boardId) {
        return deleteWhere(tag -> boardId.equals(tag.getBoardId()));
    }
}
