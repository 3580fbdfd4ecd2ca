package de.bsommerfeld.feedsim.feeds;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.FeedPost;
import de.bsommerfeld.feedsim.core.domain.SocialMediaAgent;
import de.bsommerfeld.feedsim.core.domain.Validators;
import de.bsommerfeld.feedsim.db.repository.GeneratedFeedRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Removes candidates an agent must not see: posts already served to it in
 * any earlier feed of the same run, and posts it authored itself.
 */
@Singleton
public class CandidateFilter {

    private static final Logger LOG = LoggerFactory.getLogger(CandidateFilter.class);

    private final GeneratedFeedRepository generatedFeedRepository;

    @Inject
    public CandidateFilter(GeneratedFeedRepository generatedFeedRepository) {
        this.generatedFeedRepository = generatedFeedRepository;
    }

    public List<FeedPost> filterCandidates(List<FeedPost> posts, SocialMediaAgent agent, String runId) {
        Validators.requirePresent(posts, "posts");
        Validators.requirePresent(agent, "agent");
        Validators.requireNonBlank(runId, "run_id");

        Set<String> seen = generatedFeedRepository.getPostUrisForRun(agent.handle(), runId);
        List<FeedPost> remaining = new ArrayList<>(posts.size());
        for (FeedPost post : posts) {
            if (!seen.contains(post.uri()) && !post.authorHandle().equals(agent.handle())) {
                remaining.add(post);
            }
        }
        LOG.debug("Filtered candidates for {} in {}: {} -> {}", agent.handle(), runId, posts.size(),
                remaining.size());
        return remaining;
    }
}
