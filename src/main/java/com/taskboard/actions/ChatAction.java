package com.taskboard.actions;

import java.util.Locale;

/**
 * The closed set of actions the assistant may request. Names are matched after
 * lower-casing and removing underscores, so {@code create_card}, {@code CreateCard}
 * and {@code createcard} are the same action.
 */
public enum ChatAction {
    CREATE_BOARD("create_board", false, true),
    CREATE_CARD("create_card", false, false),
    MOVE_CARD("move_card", false, false),
    MOVE_CARD_CROSS_BOARD("move_card_cross_board", false, true),
    CREATE_TAG("create_tag", false, false),
    ADD_TAG("add_tag", false, false),
    LIST_CARDS("list_cards", true, false),
    LIST_TAGS("list_tags", true, false),
    DELETE_COLUMN("delete_column", false, false),
    DELETE_TAG("delete_tag", false, false),
    DELETE_CARD("delete_card", false, false),
    NO_ACTION("no_action", true, false),
    UNKNOWN("unknown", false, false);

    private final String wireName;
    private final boolean readOnly;
    private final boolean globalOnly;

    ChatAction(String wireName, boolean readOnly, boolean globalOnly) {
        this.wireName = wireName;
        this.readOnly = readOnly;
        this.globalOnly = globalOnly;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Listing and no-op actions never mutate and are left out of execution reports.
     */
    public boolean isReadOnly() {
        return readOnly;
    }

    /**
     * Only valid in the global (all boards) conversation.
     */
    public boolean isGlobalOnly() {
        return globalOnly;
    }

    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name.trim().toLowerCase(Locale.ROOT).replace("_", "");
    }

    /**
     * Never null: unrecognised names map to {@link #UNKNOWN}.
     */
    public static ChatAction fromName(String name) {
        String normalized = normalize(name);
        if (normalized.isEmpty()) {
            return UNKNOWN;
        }
        for (ChatAction action : values()) {
            if (action != UNKNOWN && normalize(action.wireName).equals(normalized)) {
                return action;
            }
        }
        return UNKNOWN;
    }
}
