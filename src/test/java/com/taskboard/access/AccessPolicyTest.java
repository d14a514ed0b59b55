package com.taskboard.access;

import com.taskboard.models.BoardRole;
import com.taskboard.models.Card;
import com.taskboard.models.CardStatus;
import com.taskboard.models.CardVisibility;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AccessPolicyTest {

    private Card card(CardVisibility visibility) {
        return new Card("c1", "col1", "Fix bug", null, 0, visibility, CardStatus.OPEN, "owner", "creator", 1L, 1L);
    }

    private List<BoardRole> roles(BoardRole... roles) {
        return new ArrayList<>(Arrays.asList(roles));
    }

    @Test
    void boardRoleLattice() {
        assertTrue(AccessPolicy.canEdit(BoardRole.OWNER));
        assertTrue(AccessPolicy.canEdit(BoardRole.EDITOR));
        assertFalse(AccessPolicy.canEdit(BoardRole.READER));
        assertFalse(AccessPolicy.canEdit(null));

        assertTrue(AccessPolicy.canDeleteBoard(BoardRole.OWNER));
        assertFalse(AccessPolicy.canDeleteBoard(BoardRole.EDITOR));
        assertFalse(AccessPolicy.canDeleteBoard(null));

        assertTrue(AccessPolicy.canManagePermissions(BoardRole.OWNER));
        assertFalse(AccessPolicy.canManagePermissions(BoardRole.EDITOR));
        assertFalse(AccessPolicy.canManagePermissions(BoardRole.READER));
    }

    @Test
    void ownerHasEveryCapabilityOfOtherRoles() {
        for (BoardRole role : BoardRole.values()) {
            if (AccessPolicy.canEdit(role)) {
                assertTrue(AccessPolicy.canEdit(BoardRole.OWNER));
            }
            if (AccessPolicy.canView(role)) {
                assertTrue(AccessPolicy.canView(BoardRole.OWNER));
            }
            if (AccessPolicy.canDeleteBoard(role)) {
                assertTrue(AccessPolicy.canDeleteBoard(BoardRole.OWNER));
            }
        }
    }

    @Test
    void ownerAndCreatorAlwaysSeeAndEditTheirCard() {
        Card card = card(CardVisibility.PRIVATE);
        assertTrue(AccessPolicy.canViewCard(card, Collections.emptyList(), "owner"));
        assertTrue(AccessPolicy.canViewCard(card, Collections.emptyList(), "creator"));
        assertTrue(AccessPolicy.canEditCard(card, Collections.emptyList(), "creator"));
    }

    @Test
    void privateCardNeedsEditRightsOnAnAttachedBoard() {
        Card card = card(CardVisibility.PRIVATE);
        assertFalse(AccessPolicy.canViewCard(card, roles(BoardRole.READER), "someone"));
        assertTrue(AccessPolicy.canViewCard(card, roles(BoardRole.READER, BoardRole.EDITOR), "someone"));
        assertFalse(AccessPolicy.canViewCard(card, roles((BoardRole) null), "someone"));
    }

    @Test
    void restrictedCardNeedsAnyRoleOnAnAttachedBoard() {
        Card card = card(CardVisibility.RESTRICTED);
        assertTrue(AccessPolicy.canViewCard(card, roles(BoardRole.READER), "someone"));
        assertTrue(AccessPolicy.canViewCard(card, roles(null, BoardRole.READER), "someone"));
        assertFalse(AccessPolicy.canViewCard(card, roles((BoardRole) null), "someone"));
    }

    @Test
    void publicCardOnABoardIsVisibleToAnyone() {
        Card card = card(CardVisibility.PUBLIC);
        assertTrue(AccessPolicy.canViewCard(card, roles((BoardRole) null), "stranger"));
        assertFalse(AccessPolicy.canEditCard(card, roles((BoardRole) null), "stranger"));
    }

    @Test
    void inboxCardHasNoFallbackGrant() {
        Card card = card(CardVisibility.PUBLIC);
        card.setColumnId(null);
        assertFalse(AccessPolicy.canViewCard(card, Collections.emptyList(), "stranger"));
        assertFalse(AccessPolicy.canEditCard(card, Collections.emptyList(), "stranger"));
    }

    @Test
    void cardEditNeedsEditRightsOnSomeAttachedBoard() {
        Card card = card(CardVisibility.RESTRICTED);
        assertFalse(AccessPolicy.canEditCard(card, roles(BoardRole.READER), "someone"));
        assertTrue(AccessPolicy.canEditCard(card, roles(BoardRole.READER, BoardRole.EDITOR), "someone"));
    }

    @Test
    void ownerRoleIsNeverGrantedOrRevoked() {
        assertFalse(AccessPolicy.canGrant(BoardRole.OWNER));
        assertTrue(AccessPolicy.canGrant(BoardRole.EDITOR));
        assertTrue(AccessPolicy.canGrant(BoardRole.READER));
        assertFalse(AccessPolicy.canRevoke(BoardRole.OWNER));
        assertTrue(AccessPolicy.canRevoke(BoardRole.READER));
    }
}
