package de.bsommerfeld.feedsim.feeds;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.config.FeedConfig;
import de.bsommerfeld.feedsim.core.domain.FeedPost;
import de.bsommerfeld.feedsim.core.domain.GeneratedFeed;
import de.bsommerfeld.feedsim.core.domain.SocialMediaAgent;
import de.bsommerfeld.feedsim.core.domain.Validators;
import de.bsommerfeld.feedsim.core.util.Timestamps;
import de.bsommerfeld.feedsim.db.repository.FeedPostRepository;
import de.bsommerfeld.feedsim.db.repository.GeneratedFeedRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds, stores and hydrates the feeds of one turn.
 *
 * <p>
 * Per call to {@link #generateFeeds} the candidate universe is loaded once.
 * Each agent's candidates are filtered and ranked, the resulting
 * {@link GeneratedFeed} is upserted, and afterwards all referenced URIs are
 * resolved in a single batch read. URIs whose post no longer exists are
 * dropped from the hydrated feed and reported in one warning per agent.
 */
@Singleton
public class FeedGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(FeedGenerator.class);

    static final int MISSING_URI_EXAMPLES = 5;

    private final CandidateSource candidateSource;
    private final CandidateFilter candidateFilter;
    private final GeneratedFeedRepository generatedFeedRepository;
    private final FeedPostRepository feedPostRepository;
    private final FeedConfig feedConfig;
    private final Clock clock;

    @Inject
    public FeedGenerator(CandidateSource candidateSource, CandidateFilter candidateFilter,
            GeneratedFeedRepository generatedFeedRepository, FeedPostRepository feedPostRepository,
            FeedConfig feedConfig, Clock clock) {
        this.candidateSource = candidateSource;
        this.candidateFilter = candidateFilter;
        this.generatedFeedRepository = generatedFeedRepository;
        this.feedPostRepository = feedPostRepository;
        this.feedConfig = feedConfig;
        this.clock = clock;
    }

    /**
     * Filters and ranks {@code candidates} for a single agent. Nothing is
     * persisted.
     */
    public GeneratedFeed generateFeed(SocialMediaAgent agent, List<FeedPost> candidates, String runId,
            int turnNumber, FeedAlgorithm algorithm) {
        Validators.requirePresent(agent, "agent");
        Validators.requireNonBlank(runId, "run_id");
        Validators.requireNonNegative(turnNumber, "turn_number");
        Validators.requirePresent(algorithm, "algorithm");

        List<FeedPost> filtered = candidateFilter.filterCandidates(candidates, agent, runId);
        List<FeedPost> ranked = algorithm.rank(filtered, agent, feedConfig.getMaxPosts());
        List<String> uris = new ArrayList<>(ranked.size());
        for (FeedPost post : ranked) {
            uris.add(post.uri());
        }
        return new GeneratedFeed(GeneratedFeed.newFeedId(), runId, turnNumber, agent.handle(), uris,
                Timestamps.now(clock));
    }

    /**
     * @see #generateFeeds(List, String, int, FeedAlgorithm)
     * @throws UnknownAlgorithmException if {@code algorithmName} is not
     *                                   registered
     */
    public Map<String, List<FeedPost>> generateFeeds(List<SocialMediaAgent> agents, String runId, int turnNumber,
            String algorithmName) {
        return generateFeeds(agents, runId, turnNumber, FeedAlgorithm.fromName(algorithmName));
    }

    /**
     * Generates, persists and hydrates one feed per agent.
     *
     * @return hydrated posts per agent handle, in feed order and in the order
     *         of {@code agents}
     * @throws IllegalArgumentException if two agents share a handle
     */
    public Map<String, List<FeedPost>> generateFeeds(List<SocialMediaAgent> agents, String runId, int turnNumber,
            FeedAlgorithm algorithm) {
        Validators.requirePresent(agents, "agents");
        Validators.requireNonBlank(runId, "run_id");
        Validators.requireNonNegative(turnNumber, "turn_number");
        Validators.requirePresent(algorithm, "algorithm");
        Set<String> handles = new HashSet<>();
        for (SocialMediaAgent agent : agents) {
            Validators.requirePresent(agent, "agent");
            if (!handles.add(agent.handle())) {
                throw new IllegalArgumentException("Duplicate agent handle: " + agent.handle());
            }
        }

        Map<String, List<FeedPost>> hydrated = new LinkedHashMap<>();
        if (agents.isEmpty()) {
            return hydrated;
        }

        List<FeedPost> universe = candidateSource.loadCandidatePosts();
        List<GeneratedFeed> feeds = new ArrayList<>(agents.size());
        Set<String> referenced = new LinkedHashSet<>();
        for (SocialMediaAgent agent : agents) {
            GeneratedFeed feed = generateFeed(agent, universe, runId, turnNumber, algorithm);
            generatedFeedRepository.createOrUpdateGeneratedFeed(feed);
            feeds.add(feed);
            referenced.addAll(feed.postUris());
        }

        Map<String, FeedPost> byUri = new HashMap<>();
        for (FeedPost post : feedPostRepository.readFeedPostsByUris(referenced)) {
            byUri.put(post.uri(), post);
        }

        for (GeneratedFeed feed : feeds) {
            hydrated.put(feed.agentHandle(), hydrate(feed, byUri));
        }
        LOG.debug("Generated {} feeds for {} turn {} ({} distinct posts)", feeds.size(), runId, turnNumber,
                referenced.size());
        return hydrated;
    }

    private List<FeedPost> hydrate(GeneratedFeed feed, Map<String, FeedPost> byUri) {
        List<FeedPost> posts = new ArrayList<>(feed.postUris().size());
        List<String> missing = new ArrayList<>();
        for (String uri : feed.postUris()) {
            FeedPost post = byUri.get(uri);
            if (post == null) {
                missing.add(uri);
            } else {
                posts.add(post);
            }
        }
        if (!missing.isEmpty()) {
            LOG.warn("Dropped {} missing post(s) from feed {} of agent {} (run {}, turn {}): {}",
                    missing.size(), feed.feedId(), feed.agentHandle(), feed.runId(), feed.turnNumber(),
                    describeMissing(missing));
        }
        return posts;
    }

    static String describeMissing(List<String> missing) {
        int shown = Math.min(MISSING_URI_EXAMPLES, missing.size());
        String examples = String.join(", ", missing.subList(0, shown));
        int remainder = missing.size() - shown;
        return remainder > 0 ? examples + " (+" + remainder + " more)" : examples;
    }
}
