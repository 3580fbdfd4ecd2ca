package de.bsommerfeld.feedsim.db.repository;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.GeneratedFeed;
import de.bsommerfeld.feedsim.core.domain.Validators;
import de.bsommerfeld.feedsim.db.adapter.GeneratedFeedAdapter;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Stores the feeds served to agents. A feed is keyed by
 * {@code (agentHandle, runId, turnNumber)}; writing the same key again
 * replaces the earlier feed.
 */
@Singleton
public class GeneratedFeedRepository {

    private final GeneratedFeedAdapter adapter;

    @Inject
    public GeneratedFeedRepository(GeneratedFeedAdapter adapter) {
        this.adapter = adapter;
    }

    public GeneratedFeed createOrUpdateGeneratedFeed(GeneratedFeed feed) {
        Validators.requirePresent(feed, "feed");
        adapter.writeGeneratedFeed(feed);
        return feed;
    }

    public Optional<GeneratedFeed> getGeneratedFeed(String agentHandle, String runId, int turnNumber) {
        Validators.requireNonBlank(agentHandle, "agent_handle");
        Validators.requireNonBlank(runId, "run_id");
        Validators.requireNonNegative(turnNumber, "turn_number");
        return adapter.readGeneratedFeed(agentHandle, runId, turnNumber);
    }

    public List<GeneratedFeed> listAllGeneratedFeeds() {
        return adapter.readAllGeneratedFeeds();
    }

    /**
     * Every post URI already served to {@code agentHandle} during
     * {@code runId}, over all turns so far.
     */
    public Set<String> getPostUrisForRun(String agentHandle, String runId) {
        Validators.requireNonBlank(agentHandle, "agent_handle");
        Validators.requireNonBlank(runId, "run_id");
        return adapter.readPostUrisForRun(agentHandle, runId);
    }

    public List<GeneratedFeed> readFeedsForTurn(String runId, int turnNumber) {
        Validators.requireNonBlank(runId, "run_id");
        Validators.requireNonNegative(turnNumber, "turn_number");
        return adapter.readFeedsForTurn(runId, turnNumber);
    }
}
