package de.bsommerfeld.feedsim.core.domain;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The feed served to one agent on one turn of one run. {@code postUris} is in
 * presentation order. The key {@code (agentHandle, runId, turnNumber)} is
 * unique and written with replace semantics; {@code feedId} is an additional
 * unique token.
 *
 * @param feedId      unique token, see {@link #newFeedId()}
 * @param runId       owning run
 * @param turnNumber  0-indexed turn, {@code >= 0}
 * @param agentHandle handle of the agent the feed was served to
 * @param postUris    ordered content references
 * @param createdAt   generation time
 */
public record GeneratedFeed(
        String feedId,
        String runId,
        int turnNumber,
        String agentHandle,
        List<String> postUris,
        Instant createdAt) {

    public GeneratedFeed {
        Validators.requireNonBlank(feedId, "feed_id");
        Validators.requireNonBlank(runId, "run_id");
        Validators.requireNonNegative(turnNumber, "turn_number");
        Validators.requireNonBlank(agentHandle, "agent_handle");
        Validators.requirePresent(postUris, "post_uris");
        Validators.requirePresent(createdAt, "created_at");
        postUris = List.copyOf(postUris);
    }

    public static String newFeedId() {
        return "feed_" + UUID.randomUUID();
    }
}
