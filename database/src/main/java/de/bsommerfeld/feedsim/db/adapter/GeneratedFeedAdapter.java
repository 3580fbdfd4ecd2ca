package de.bsommerfeld.feedsim.db.adapter;

import de.bsommerfeld.feedsim.core.domain.GeneratedFeed;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence gateway for {@link GeneratedFeed}s. Writes replace any existing
 * feed with the same {@code (agentHandle, runId, turnNumber)}.
 */
public interface GeneratedFeedAdapter {

    void writeGeneratedFeed(GeneratedFeed feed);

    Optional<GeneratedFeed> readGeneratedFeed(String agentHandle, String runId, int turnNumber);

    List<GeneratedFeed> readAllGeneratedFeeds();

    /**
     * Union of the post URIs of every feed served to {@code agentHandle} in
     * {@code runId}, across all turns.
     */
    Set<String> readPostUrisForRun(String agentHandle, String runId);

    /** Feeds of one turn, ordered by agent handle. */
    List<GeneratedFeed> readFeedsForTurn(String runId, int turnNumber);
}
