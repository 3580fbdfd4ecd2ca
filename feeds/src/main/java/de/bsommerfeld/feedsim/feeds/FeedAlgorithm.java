package de.bsommerfeld.feedsim.feeds;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Iterables;
import de.bsommerfeld.feedsim.core.domain.FeedPost;
import de.bsommerfeld.feedsim.core.domain.SocialMediaAgent;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Closed registry of ranking algorithms. Each constant turns a filtered
 * candidate list into an ordered feed of at most {@code limit} posts.
 */
public enum FeedAlgorithm {

    /**
     * Newest first. The sort is stable, so posts with equal
     * {@code createdAt} keep their candidate order.
     */
    CHRONOLOGICAL("chronological") {
        @Override
        public List<FeedPost> rank(List<FeedPost> candidates, SocialMediaAgent agent, int limit) {
            List<FeedPost> sorted = new ArrayList<>(candidates);
            sorted.sort(Comparator.comparing(FeedPost::createdAt).reversed());
            return ImmutableList.copyOf(Iterables.limit(sorted, limit));
        }
    };

    public static final int DEFAULT_LIMIT = 20;

    private final String algorithmName;

    FeedAlgorithm(String algorithmName) {
        this.algorithmName = algorithmName;
    }

    /** Registry key, as used in configuration and on the command line. */
    public String algorithmName() {
        return algorithmName;
    }

    /**
     * Orders {@code candidates} for {@code agent} and keeps the first
     * {@code limit}.
     */
    public abstract List<FeedPost> rank(List<FeedPost> candidates, SocialMediaAgent agent, int limit);

    /**
     * Looks up an algorithm by its registry key.
     *
     * @throws UnknownAlgorithmException if no algorithm has that name
     */
    public static FeedAlgorithm fromName(String name) {
        for (FeedAlgorithm algorithm : values()) {
            if (algorithm.algorithmName.equals(name)) {
                return algorithm;
            }
        }
        throw new UnknownAlgorithmException(name, names());
    }

    public static Set<String> names() {
        Set<String> names = new LinkedHashSet<>();
        for (FeedAlgorithm algorithm : values()) {
            names.add(algorithm.algorithmName);
        }
        return names;
    }
}
