package de.bsommerfeld.feedsim.core.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TurnMetadataTest {

    @Test
    void constructor_shouldCopyCountsDefensively() {
        Map<TurnAction, Integer> counts = new HashMap<>();
        counts.put(TurnAction.LIKE, 4);

        var metadata = new TurnMetadata("run_1", 0, counts, Instant.EPOCH);
        counts.put(TurnAction.FOLLOW, 9);

        assertEquals(4, metadata.count(TurnAction.LIKE));
        assertEquals(0, metadata.count(TurnAction.FOLLOW));
        assertThrows(UnsupportedOperationException.class,
                () -> metadata.totalActions().put(TurnAction.COMMENT, 1));
    }

    @Test
    void constructor_shouldRejectNegativeCounts() {
        var e = assertThrows(IllegalArgumentException.class,
                () -> new TurnMetadata("run_1", 0, Map.of(TurnAction.COMMENT, -1), Instant.EPOCH));
        assertTrue(e.getMessage().contains("comment"));
    }

    @Test
    void constructor_shouldRejectNegativeTurn() {
        assertThrows(IllegalArgumentException.class,
                () -> new TurnMetadata("run_1", -1, Map.of(), Instant.EPOCH));
    }

    @Test
    void turnAction_shouldParseLowerCaseValues() {
        assertEquals(TurnAction.FOLLOW, TurnAction.fromValue("follow"));
        assertThrows(IllegalArgumentException.class, () -> TurnAction.fromValue("repost"));
    }
}
