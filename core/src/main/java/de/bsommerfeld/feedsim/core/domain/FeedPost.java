package de.bsommerfeld.feedsim.core.domain;

import java.time.Instant;

/**
 * Immutable snapshot of an ingested Bluesky feed post. Owned by the ingestion
 * side; the simulation only reads it.
 *
 * @param uri               at-protocol URI, unique, doubles as the post id
 * @param authorDisplayName author's display name at ingestion time
 * @param authorHandle      author's handle
 * @param text              post body
 * @param bookmarkCount     engagement counter, {@code >= 0}
 * @param likeCount         engagement counter, {@code >= 0}
 * @param quoteCount        engagement counter, {@code >= 0}
 * @param replyCount        engagement counter, {@code >= 0}
 * @param repostCount       engagement counter, {@code >= 0}
 * @param createdAt         authoring time
 */
public record FeedPost(
        String uri,
        String authorDisplayName,
        String authorHandle,
        String text,
        int bookmarkCount,
        int likeCount,
        int quoteCount,
        int replyCount,
        int repostCount,
        Instant createdAt) {

    public FeedPost {
        Validators.requireNonBlank(uri, "uri");
        Validators.requirePresent(authorDisplayName, "author_display_name");
        Validators.requireNonBlank(authorHandle, "author_handle");
        Validators.requirePresent(text, "text");
        Validators.requireNonNegative(bookmarkCount, "bookmark_count");
        Validators.requireNonNegative(likeCount, "like_count");
        Validators.requireNonNegative(quoteCount, "quote_count");
        Validators.requireNonNegative(replyCount, "reply_count");
        Validators.requireNonNegative(repostCount, "repost_count");
        Validators.requirePresent(createdAt, "created_at");
    }

    /** Platform-agnostic identifier; for Bluesky posts this is the URI. */
    public String id() {
        return uri;
    }
}
