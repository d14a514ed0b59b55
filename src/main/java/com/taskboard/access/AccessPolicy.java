package com.taskboard.access;

import com.taskboard.models.BoardRole;
import com.taskboard.models.Card;
import com.taskboard.models.CardVisibility;

import java.util.Collection;
import java.util.Objects;

/**
 * Authorization rules for boards and cards. Pure functions over role and ownership facts;
 * a null role means the subject has no relation to the board.
 */
public final class AccessPolicy {

    private AccessPolicy() {
    }

    public static boolean canView(BoardRole role) {
        return role != null;
    }

    public static boolean canEdit(BoardRole role) {
        return role == BoardRole.OWNER || role == BoardRole.EDITOR;
    }

    public static boolean canDeleteBoard(BoardRole role) {
        return role == BoardRole.OWNER;
    }

    public static boolean canManagePermissions(BoardRole role) {
        return role == BoardRole.OWNER;
    }

    /**
     * @param attachedRoles one entry per board the card is attached to (its primary column's
     *                      board and any assignment boards) holding the viewer's role there,
     *                      or null where the viewer has no relation. Empty for inbox cards.
     */
    public static boolean canViewCard(Card card, Collection<BoardRole> attachedRoles, String viewerId) {
        if (card.isHeldBy(viewerId)) {
            return true;
        }
        if (attachedRoles.isEmpty()) {
            return false;
        }
        CardVisibility visibility = card.getVisibility() != null ? card.getVisibility() : CardVisibility.PRIVATE;
        switch (visibility) {
            case PUBLIC:
                return true;
            case RESTRICTED:
                return attachedRoles.stream().anyMatch(Objects::nonNull);
            case PRIVATE:
            default:
                return attachedRoles.stream().anyMatch(AccessPolicy::canEdit);
        }
    }

    /**
     * Owner or creator, or edit rights on at least one attached board. A card attached to no
     * board is only editable by its owner or creator.
     */
    public static boolean canEditCard(Card card, Collection<BoardRole> attachedRoles, String viewerId) {
        if (card.isHeldBy(viewerId)) {
            return true;
        }
        return attachedRoles.stream().anyMatch(AccessPolicy::canEdit);
    }

    /**
     * A board has exactly one Owner, set at creation; granting Owner is never allowed.
     */
    public static boolean canGrant(BoardRole requested) {
        return requested != null && requested != BoardRole.OWNER;
    }

    /**
     * The Owner permission is only removed by deleting the board.
     */
    public static boolean canRevoke(BoardRole existing) {
        return existing != BoardRole.OWNER;
    }
}
