// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.soulwire.core.market;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class ListingStatusTest {

    @Test
    void openMovesAnywhereButBack() {
        assertTrue(ListingStatus.OPEN.canTransitionTo(ListingStatus.MATCHED));
        assertTrue(ListingStatus.OPEN.canTransitionTo(ListingStatus.CANCELLED));
        assertTrue(ListingStatus.OPEN.canTransitionTo(ListingStatus.EXPIRED));
        assertFalse(ListingStatus.OPEN.canTransitionTo(ListingStatus.OPEN));
    }

    @Test
    void matchedOnlyCancels() {
        assertTrue(ListingStatus.MATCHED.canTransitionTo(ListingStatus.CANCELLED));
        assertFalse(ListingStatus.MATCHED.canTransitionTo(ListingStatus.OPEN));
        assertFalse(ListingStatus.MATCHED.canTransitionTo(ListingStatus.EXPIRED));
    }

    @Test
    void terminalStatesAreFinal() {
        for (ListingStatus next : ListingStatus.values()) {
            assertFalse(ListingStatus.CANCELLED.canTransitionTo(next));
            assertFalse(ListingStatus.EXPIRED.canTransitionTo(next));
        }
        assertTrue(ListingStatus.EXPIRED.isTerminal());
        assertFalse(ListingStatus.MATCHED.isTerminal());
    }

    @Test
    void sidesAreOpposite() {
        assertEquals(Side.REQUEST, Side.OFFER.opposite());
        assertEquals(Side.OFFER, Side.REQUEST.opposite());
        assertEquals(Role.SEEKER, Role.PROVIDER.counterpart());
    }
}
