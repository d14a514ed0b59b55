package com.taskboard.models;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * A member's role on a board. Owner ⊇ Editor ⊇ Reader.
 */
public enum BoardRole {
    OWNER("owner"),
    EDITOR("editor"),
    READER("reader");

    private final String wireName;

    BoardRole(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Parse a stored or submitted role. Unknown text is rejected.
     */
    @JsonCreator
    public static BoardRole parse(String value) {
        if (value != null) {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            for (BoardRole role : values()) {
                if (role.wireName.equals(normalized)) {
                    return role;
                }
            }
        }
        throw new IllegalArgumentException("Invalid role: " + value);
    }

    @Override
    public String toString() {
        return wireName;
    }
}
