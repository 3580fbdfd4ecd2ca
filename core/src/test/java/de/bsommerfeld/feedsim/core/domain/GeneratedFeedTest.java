package de.bsommerfeld.feedsim.core.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class GeneratedFeedTest {

    @Test
    void constructor_shouldKeepUriOrderAndCopy() {
        List<String> uris = new ArrayList<>(List.of("at://b", "at://a"));

        var feed = new GeneratedFeed(GeneratedFeed.newFeedId(), "run_1", 0, "alice", uris, Instant.EPOCH);
        uris.clear();

        assertEquals(List.of("at://b", "at://a"), feed.postUris());
    }

    @Test
    void constructor_shouldAcceptEmptyFeed() {
        var feed = new GeneratedFeed("feed_1", "run_1", 2, "alice", List.of(), Instant.EPOCH);
        assertTrue(feed.postUris().isEmpty());
    }

    @Test
    void constructor_shouldRejectMissingAgent() {
        assertThrows(IllegalArgumentException.class,
                () -> new GeneratedFeed("feed_1", "run_1", 0, "", List.of(), Instant.EPOCH));
    }

    @Test
    void newFeedId_shouldBeUnique() {
        assertNotEquals(GeneratedFeed.newFeedId(), GeneratedFeed.newFeedId());
        assertTrue(GeneratedFeed.newFeedId().startsWith("feed_"));
    }
}
