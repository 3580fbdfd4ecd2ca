package de.bsommerfeld.feedsim.db.adapter;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.GeneratedFeed;
import de.bsommerfeld.feedsim.core.util.Timestamps;
import de.bsommerfeld.feedsim.db.SqlLoader;
import de.bsommerfeld.feedsim.db.SqliteDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * SQLite-backed {@link GeneratedFeedAdapter}. {@code post_uris} is stored as a
 * JSON array to keep the presentation order.
 */
@Singleton
public class SqlGeneratedFeedAdapter implements GeneratedFeedAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(SqlGeneratedFeedAdapter.class);

    private final SqliteDatabase database;

    @Inject
    public SqlGeneratedFeedAdapter(SqliteDatabase database) {
        this.database = database;
    }

    @Override
    public void writeGeneratedFeed(GeneratedFeed feed) {
        String key = feedKey(feed.agentHandle(), feed.runId(), feed.turnNumber());
        database.inTransaction("write-generated-feed", key, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-generated-feed"))) {
                ps.setString(1, feed.feedId());
                ps.setString(2, feed.runId());
                ps.setInt(3, feed.turnNumber());
                ps.setString(4, feed.agentHandle());
                ps.setString(5, JsonColumns.writeUris(feed.postUris()));
                ps.setLong(6, Timestamps.toEpochMillis(feed.createdAt()));
                ps.executeUpdate();
            }
            return null;
        });
        LOG.debug("Wrote feed {} with {} posts for {}", feed.feedId(), feed.postUris().size(), key);
    }

    @Override
    public Optional<GeneratedFeed> readGeneratedFeed(String agentHandle, String runId, int turnNumber) {
        return database.query("read-generated-feed", feedKey(agentHandle, runId, turnNumber), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-generated-feed"))) {
                ps.setString(1, agentHandle);
                ps.setString(2, runId);
                ps.setInt(3, turnNumber);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapFeed(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public List<GeneratedFeed> readAllGeneratedFeeds() {
        return database.query("read-all-generated-feeds", null, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-generated-feeds"))) {
                return collect(ps);
            }
        });
    }

    @Override
    public Set<String> readPostUrisForRun(String agentHandle, String runId) {
        String key = agentHandle + "@" + runId;
        return database.query("read-post-uris-for-run", key, conn -> {
            Set<String> uris = new HashSet<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-post-uris-for-run"))) {
                ps.setString(1, agentHandle);
                ps.setString(2, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        RowReader row = new RowReader(rs, "generated_feeds[" + key + "]");
                        uris.addAll(JsonColumns.readUris(row.requireString("post_uris"), row.context()));
                    }
                }
            }
            return uris;
        });
    }

    @Override
    public List<GeneratedFeed> readFeedsForTurn(String runId, int turnNumber) {
        return database.query("read-feeds-for-turn", runId + "#" + turnNumber, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-feeds-for-turn"))) {
                ps.setString(1, runId);
                ps.setInt(2, turnNumber);
                return collect(ps);
            }
        });
    }

    private List<GeneratedFeed> collect(PreparedStatement ps) throws SQLException {
        List<GeneratedFeed> feeds = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                feeds.add(mapFeed(rs));
            }
        }
        return feeds;
    }

    private GeneratedFeed mapFeed(ResultSet rs) throws SQLException {
        RowReader row = new RowReader(rs, "generated_feeds[feed_id=" + rs.getString("feed_id") + "]");
        String feedId = row.requireString("feed_id");
        String runId = row.requireString("run_id");
        int turnNumber = row.requireInt("turn_number");
        String agentHandle = row.requireString("agent_handle");
        List<String> uris = JsonColumns.readUris(row.requireString("post_uris"), row.context());
        Instant createdAt = row.requireInstant("created_at");
        return row.build(() -> new GeneratedFeed(feedId, runId, turnNumber, agentHandle, uris, createdAt));
    }

    private static String feedKey(String agentHandle, String runId, int turnNumber) {
        return agentHandle + "@" + runId + "#" + turnNumber;
    }
}
