package com.taskboard.models;

import java.util.ArrayList;
import java.util.List;

/**
 * Optional narrowing for board card listings. Null fields do not filter.
 * Dates are ISO-8601 (yyyy-MM-dd) and bounds are inclusive.
 */
public class CardFilter {

    private String query;
    private List<String> tagIds = new ArrayList<>();
    private String dueDateFrom;
    private String dueDateTo;
    private CardStatus status;

    public String getQuery() {
        return query;
    }

    public CardFilter query(String query) {
        this.query = query;
        return this;
    }

    public List<String> getTagIds() {
        return tagIds;
    }

    public CardFilter tag(String tagId) {
        if (tagId != null && !tagId.isBlank()) {
            tagIds.add(tagId);
        }
        return this;
    }

    public String getDueDateFrom() {
        return dueDateFrom;
    }

    public CardFilter dueDateFrom(String dueDateFrom) {
        this.dueDateFrom = dueDateFrom;
        return this;
    }

    public String getDueDateTo() {
        return dueDateTo;
    }

    public CardFilter dueDateTo(String dueDateTo) {
        this.dueDateTo = dueDateTo;
        return this;
    }

    public CardStatus getStatus() {
        return status;
    }

    public CardFilter status(CardStatus status) {
        this.status = status;
        return this;
    }
}
