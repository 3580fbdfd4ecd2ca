package de.bsommerfeld.feedsim.db.adapter;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.FeedPost;
import de.bsommerfeld.feedsim.core.util.Timestamps;
import de.bsommerfeld.feedsim.db.SqlLoader;
import de.bsommerfeld.feedsim.db.SqliteDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed {@link FeedPostAdapter}.
 *
 * <p>
 * URI lookups are split into chunks of {@value #URI_CHUNK_SIZE} bind
 * parameters and run on one connection.
 */
@Singleton
public class SqlFeedPostAdapter implements FeedPostAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(SqlFeedPostAdapter.class);

    static final int URI_CHUNK_SIZE = 500;

    private final SqliteDatabase database;

    @Inject
    public SqlFeedPostAdapter(SqliteDatabase database) {
        this.database = database;
    }

    @Override
    public Optional<FeedPost> readFeedPost(String uri) {
        return database.query("read-feed-post", uri, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-feed-post"))) {
                ps.setString(1, uri);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapPost(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public List<FeedPost> readFeedPostsByAuthor(String authorHandle) {
        return database.query("read-feed-posts-by-author", authorHandle, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-feed-posts-by-author"))) {
                ps.setString(1, authorHandle);
                return collect(ps);
            }
        });
    }

    @Override
    public List<FeedPost> readAllFeedPosts() {
        return database.query("read-all-feed-posts", null, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-feed-posts"))) {
                return collect(ps);
            }
        });
    }

    @Override
    public List<FeedPost> readFeedPostsByUris(Collection<String> uris) {
        if (uris.isEmpty()) {
            return Collections.emptyList();
        }
        List<String> distinct = new ArrayList<>(new LinkedHashSet<>(uris));
        List<FeedPost> posts = database.query("read-feed-posts-by-uris", distinct.size() + " uris", conn -> {
            List<FeedPost> found = new ArrayList<>();
            for (int from = 0; from < distinct.size(); from += URI_CHUNK_SIZE) {
                List<String> chunk = distinct.subList(from, Math.min(from + URI_CHUNK_SIZE, distinct.size()));
                found.addAll(readChunk(conn, chunk));
            }
            return found;
        });
        LOG.debug("Hydrated {} of {} requested post URIs", posts.size(), distinct.size());
        return posts;
    }

    @Override
    public void writeFeedPost(FeedPost post) {
        writeFeedPosts(Collections.singletonList(post));
    }

    @Override
    public void writeFeedPosts(List<FeedPost> posts) {
        if (posts.isEmpty()) {
            return;
        }
        String key = posts.size() == 1 ? posts.get(0).uri() : posts.size() + " posts";
        database.inTransaction("write-feed-posts", key, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-feed-post"))) {
                for (FeedPost post : posts) {
                    ps.setString(1, post.uri());
                    ps.setString(2, post.authorDisplayName());
                    ps.setString(3, post.authorHandle());
                    ps.setString(4, post.text());
                    ps.setInt(5, post.bookmarkCount());
                    ps.setInt(6, post.likeCount());
                    ps.setInt(7, post.quoteCount());
                    ps.setInt(8, post.replyCount());
                    ps.setInt(9, post.repostCount());
                    ps.setLong(10, Timestamps.toEpochMillis(post.createdAt()));
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            return null;
        });
        LOG.debug("Wrote {} feed posts", posts.size());
    }

    private List<FeedPost> readChunk(Connection conn, List<String> chunk) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                SqlLoader.expand("select-feed-posts-by-uris", chunk.size()))) {
            for (int i = 0; i < chunk.size(); i++) {
                ps.setString(i + 1, chunk.get(i));
            }
            return collect(ps);
        }
    }

    private List<FeedPost> collect(PreparedStatement ps) throws SQLException {
        List<FeedPost> posts = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                posts.add(mapPost(rs));
            }
        }
        return posts;
    }

    private FeedPost mapPost(ResultSet rs) throws SQLException {
        RowReader row = new RowReader(rs, "feed_posts[uri=" + rs.getString("uri") + "]");
        String uri = row.requireString("uri");
        String displayName = row.requireString("author_display_name");
        String handle = row.requireString("author_handle");
        String text = row.requireString("text");
        int bookmarks = row.requireInt("bookmark_count");
        int likes = row.requireInt("like_count");
        int quotes = row.requireInt("quote_count");
        int replies = row.requireInt("reply_count");
        int reposts = row.requireInt("repost_count");
        Instant createdAt = row.requireInstant("created_at");
        return row.build(() -> new FeedPost(uri, displayName, handle, text,
                bookmarks, likes, quotes, replies, reposts, createdAt));
    }
}
