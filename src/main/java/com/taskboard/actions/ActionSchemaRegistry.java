package com.taskboard.actions;

import java.util.EnumMap;
import java.util.Map;

/**
 * Parameter alias tables for every mutating action.
 */
public class ActionSchemaRegistry {

    public static final String BOARD = "board";

    private final Map<ChatAction, ActionSchema> schemas = new EnumMap<>(ChatAction.class);

    public ActionSchemaRegistry register(ActionSchema schema) {
        if (schema != null) {
            schemas.put(schema.getAction(), schema);
        }
        return this;
    }

    public ActionSchema getSchema(ChatAction action) {
        return schemas.get(action);
    }

    public boolean hasSchema(ChatAction action) {
        return schemas.containsKey(action);
    }

    /**
     * In the global conversation, board-scoped actions name their board with one of these.
     */
    public ActionSchema boardSelector() {
        return new ActionSchema(ChatAction.UNKNOWN).required(BOARD, "board", "board_name");
    }

    public static ActionSchemaRegistry defaults() {
        return new ActionSchemaRegistry()
            .register(new ActionSchema(ChatAction.CREATE_BOARD)
                .required("name", "name", "board_name", "title")
                .optional("description", "description", "desc"))
            .register(new ActionSchema(ChatAction.CREATE_CARD)
                .required("column", "column", "column_name", "in")
                .required("title", "title", "name", "card_title")
                .optional("body", "body", "description", "content"))
            .register(new ActionSchema(ChatAction.MOVE_CARD)
                .required("card", "card_title", "card", "title", "name")
                .required("column", "target_column", "column", "to", "destination")
                .optional("position", "position", "pos", "index"))
            .register(new ActionSchema(ChatAction.MOVE_CARD_CROSS_BOARD)
                .required("from_board", "from_board", "source_board", "source")
                .required("to_board", "to_board", "target_board", "destination")
                .required("card", "card", "card_title", "title")
                .required("column", "column", "target_column", "to_column")
                .optional("position", "position", "pos", "index"))
            .register(new ActionSchema(ChatAction.CREATE_TAG)
                .required("name", "name", "tag_name", "tag")
                .optional("color", "color", "hex_color"))
            .register(new ActionSchema(ChatAction.ADD_TAG)
                .required("card", "card_title", "card", "title")
                .required("tag", "tag_name", "tag", "name"))
            .register(new ActionSchema(ChatAction.DELETE_COLUMN)
                .required("column", "column", "column_name", "name"))
            .register(new ActionSchema(ChatAction.DELETE_TAG)
                .required("tag", "tag", "tag_name", "name"))
            .register(new ActionSchema(ChatAction.DELETE_CARD)
                .required("card", "card", "card_title", "title", "name"));
    }
}
