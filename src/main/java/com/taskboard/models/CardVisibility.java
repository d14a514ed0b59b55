package com.taskboard.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum CardVisibility {
    PRIVATE("private"),
    RESTRICTED("restricted"),
    PUBLIC("public");

    private final String wireName;

    CardVisibility(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Strict parse for submitted values.
     */
    public static CardVisibility parse(String value) {
        CardVisibility visibility = lookup(value);
        if (visibility == null) {
            throw new IllegalArgumentException("Invalid visibility: " + value);
        }
        return visibility;
    }

    /**
     * Lenient parse for stored values: anything unrecognised reads as PRIVATE.
     */
    @JsonCreator
    public static CardVisibility fromStored(String value) {
        CardVisibility visibility = lookup(value);
        return visibility != null ? visibility : PRIVATE;
    }

    private static CardVisibility lookup(String value) {
        if (value == null) {
            return null;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (CardVisibility visibility : values()) {
            if (visibility.wireName.equals(normalized)) {
                return visibility;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return wireName;
    }
}
