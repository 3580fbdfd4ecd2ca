package de.bsommerfeld.feedsim.db.repository;

import de.bsommerfeld.feedsim.core.domain.GeneratedFeed;
import de.bsommerfeld.feedsim.db.SqliteDatabase;
import de.bsommerfeld.feedsim.db.adapter.SqlGeneratedFeedAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class GeneratedFeedRepositoryTest {

    @TempDir
    Path tempDir;

    private GeneratedFeedRepository repository;

    @BeforeEach
    void setUp() {
        repository = new GeneratedFeedRepository(
                new SqlGeneratedFeedAdapter(new SqliteDatabase(tempDir.resolve("test.db"))));
    }

    @Test
    void createOrUpdateGeneratedFeed_shouldBeReadableByKey() {
        GeneratedFeed feed = new GeneratedFeed(GeneratedFeed.newFeedId(), "run_1", 0, "alice",
                List.of("at://1"), Instant.EPOCH);
        repository.createOrUpdateGeneratedFeed(feed);

        assertEquals(feed, repository.getGeneratedFeed("alice", "run_1", 0).orElseThrow());
        assertEquals(Set.of("at://1"), repository.getPostUrisForRun("alice", "run_1"));
        assertEquals(List.of(feed), repository.readFeedsForTurn("run_1", 0));
    }

    @Test
    void getGeneratedFeed_shouldValidateArguments() {
        assertThrows(IllegalArgumentException.class, () -> repository.getGeneratedFeed("", "run_1", 0));
        assertThrows(IllegalArgumentException.class, () -> repository.getGeneratedFeed("alice", " ", 0));
        assertThrows(IllegalArgumentException.class, () -> repository.getGeneratedFeed("alice", "run_1", -1));
    }

    @Test
    void readFeedsForTurn_shouldRejectNegativeTurn() {
        assertThrows(IllegalArgumentException.class, () -> repository.readFeedsForTurn("run_1", -1));
    }

    @Test
    void createOrUpdateGeneratedFeed_shouldRejectNull() {
        assertThrows(IllegalArgumentException.class, () -> repository.createOrUpdateGeneratedFeed(null));
    }
}
