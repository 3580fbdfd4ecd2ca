package de.bsommerfeld.feedsim.db.repository;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.FeedPost;
import de.bsommerfeld.feedsim.core.domain.Validators;
import de.bsommerfeld.feedsim.db.adapter.FeedPostAdapter;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Access to ingested posts. Posts are reference data for the simulation; the
 * write methods exist for ingestion and test setup.
 */
@Singleton
public class FeedPostRepository {

    private final FeedPostAdapter adapter;

    @Inject
    public FeedPostRepository(FeedPostAdapter adapter) {
        this.adapter = adapter;
    }

    public Optional<FeedPost> getFeedPost(String uri) {
        Validators.requireNonBlank(uri, "uri");
        return adapter.readFeedPost(uri);
    }

    /** Posts of one author, newest first. */
    public List<FeedPost> listFeedPostsByAuthor(String authorHandle) {
        Validators.requireNonBlank(authorHandle, "author_handle");
        return adapter.readFeedPostsByAuthor(authorHandle);
    }

    public List<FeedPost> listAllFeedPosts() {
        return adapter.readAllFeedPosts();
    }

    /**
     * Batch hydration. URIs that have no stored post are skipped; the caller
     * decides how to report them. Result order is unspecified.
     */
    public List<FeedPost> readFeedPostsByUris(Set<String> uris) {
        Validators.requirePresent(uris, "uris");
        for (String uri : uris) {
            Validators.requireNonBlank(uri, "uri");
        }
        if (uris.isEmpty()) {
            return Collections.emptyList();
        }
        return adapter.readFeedPostsByUris(uris);
    }

    public FeedPost createOrUpdateFeedPost(FeedPost post) {
        Validators.requirePresent(post, "post");
        adapter.writeFeedPost(post);
        return post;
    }

    /**
     * Writes all posts atomically; nothing is stored if any row fails.
     */
    public List<FeedPost> createOrUpdateFeedPosts(List<FeedPost> posts) {
        Validators.requirePresent(posts, "posts");
        for (FeedPost post : posts) {
            Validators.requirePresent(post, "post");
        }
        adapter.writeFeedPosts(posts);
        return posts;
    }
}
