package de.bsommerfeld.feedsim.feeds;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.FeedPost;
import de.bsommerfeld.feedsim.db.repository.FeedPostRepository;

import java.util.List;

/**
 * Uses every stored post as a candidate.
 */
@Singleton
public class RepositoryCandidateSource implements CandidateSource {

    private final FeedPostRepository feedPostRepository;

    @Inject
    public RepositoryCandidateSource(FeedPostRepository feedPostRepository) {
        this.feedPostRepository = feedPostRepository;
    }

    @Override
    public List<FeedPost> loadCandidatePosts() {
        return feedPostRepository.listAllFeedPosts();
    }
}
