package de.bsommerfeld.feedsim.feeds;

import de.bsommerfeld.feedsim.core.domain.FeedPost;
import de.bsommerfeld.feedsim.core.domain.SocialMediaAgent;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FeedAlgorithmTest {

    private static final SocialMediaAgent AGENT = SocialMediaAgent.withHandle("reader");

    @Test
    void chronological_shouldOrderNewestFirst() {
        FeedPost p1 = post("at://p1", 3);
        FeedPost p2 = post("at://p2", 1);
        FeedPost p3 = post("at://p3", 2);

        List<FeedPost> ranked = FeedAlgorithm.CHRONOLOGICAL.rank(List.of(p1, p2, p3), AGENT, 20);

        assertEquals(List.of(p1, p3, p2), ranked);
    }

    @Test
    void chronological_shouldTruncateToLimit() {
        List<FeedPost> candidates = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            candidates.add(post("at://p" + i, i));
        }

        List<FeedPost> ranked = FeedAlgorithm.CHRONOLOGICAL.rank(candidates, AGENT, FeedAlgorithm.DEFAULT_LIMIT);

        assertEquals(20, ranked.size());
        assertEquals("at://p29", ranked.get(0).uri());
        assertEquals("at://p10", ranked.get(19).uri());
    }

    @Test
    void chronological_shouldKeepCandidateOrderForEqualTimestamps() {
        FeedPost first = post("at://z", 5);
        FeedPost second = post("at://a", 5);

        assertEquals(List.of(first, second), FeedAlgorithm.CHRONOLOGICAL.rank(List.of(first, second), AGENT, 20));
    }

    @Test
    void chronological_shouldNotModifyInput() {
        List<FeedPost> candidates = new ArrayList<>(List.of(post("at://old", 1), post("at://new", 2)));

        FeedAlgorithm.CHRONOLOGICAL.rank(candidates, AGENT, 20);

        assertEquals("at://old", candidates.get(0).uri());
    }

    @Test
    void chronological_shouldHandleEmptyCandidates() {
        assertTrue(FeedAlgorithm.CHRONOLOGICAL.rank(List.of(), AGENT, 20).isEmpty());
    }

    @Test
    void fromName_shouldResolveRegisteredName() {
        assertSame(FeedAlgorithm.CHRONOLOGICAL, FeedAlgorithm.fromName("chronological"));
    }

    @Test
    void fromName_shouldRejectUnknownNameWithoutFallback() {
        UnknownAlgorithmException e = assertThrows(UnknownAlgorithmException.class,
                () -> FeedAlgorithm.fromName("engagement"));

        assertEquals("engagement", e.getName());
        assertTrue(e.getMessage().contains("chronological"));
    }

    @Test
    void fromName_shouldRejectNull() {
        assertThrows(UnknownAlgorithmException.class, () -> FeedAlgorithm.fromName(null));
    }

    private static FeedPost post(String uri, long epochSecond) {
        return new FeedPost(uri, "Author", "author", "text", 0, 0, 0, 0, 0, Instant.ofEpochSecond(epochSecond));
    }
}
