package com.taskboard.actions;

/**
 * Who is acting and where: a board conversation, or the global one when boardId is null.
 */
public class ActionExecutionContext {

    private final String actorId;
    private final String boardId;

    private ActionExecutionContext(String actorId, String boardId) {
        this.actorId = actorId;
        this.boardId = boardId;
    }

    public static ActionExecutionContext forBoard(String actorId, String boardId) {
        return new ActionExecutionContext(actorId, boardId);
    }

    public static ActionExecutionContext global(String actorId) {
        return new ActionExecutionContext(actorId, null);
    }

    public String getActorId() {
        return actorId;
    }

    public String getBoardId() {
        return boardId;
    }

    public boolean isGlobal() {
        return boardId == null;
    }
}
