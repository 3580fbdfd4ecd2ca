package de.bsommerfeld.feedsim.db.adapter;

import de.bsommerfeld.feedsim.core.domain.FeedPost;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Persistence gateway for ingested {@link FeedPost}s.
 */
public interface FeedPostAdapter {

    Optional<FeedPost> readFeedPost(String uri);

    List<FeedPost> readFeedPostsByAuthor(String authorHandle);

    List<FeedPost> readAllFeedPosts();

    /**
     * Batch lookup. URIs without a stored post are absent from the result; the
     * result order is unspecified.
     */
    List<FeedPost> readFeedPostsByUris(Collection<String> uris);

    void writeFeedPost(FeedPost post);

    /**
     * Writes all posts in one transaction. A failing row rolls back the whole
     * batch.
     */
    void writeFeedPosts(List<FeedPost> posts);
}
