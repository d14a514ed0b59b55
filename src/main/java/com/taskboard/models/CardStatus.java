package com.taskboard.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CardStatus {
    OPEN("open"),
    IN_PROGRESS("in_progress"),
    DONE("done"),
    CLOSED("closed");

    private final String wireName;

    CardStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Accepts "in_progress", "InProgress" and "inprogress" alike. Unknown text is rejected.
     */
    @JsonCreator
    public static CardStatus parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT).replace("_", "");
            for (CardStatus status : values()) {
                if (status.wireName.replace("_", "").equals(normalized)) {
                    return status;
                }
            }
        }
        throw new IllegalArgumentException("Invalid status: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
