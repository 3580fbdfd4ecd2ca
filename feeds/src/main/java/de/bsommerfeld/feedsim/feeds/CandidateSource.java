package de.bsommerfeld.feedsim.feeds;

import de.bsommerfeld.feedsim.core.domain.FeedPost;

import java.util.List;

/**
 * Supplies the content universe feeds are drawn from.
 */
public interface CandidateSource {

    List<FeedPost> loadCandidatePosts();
}
