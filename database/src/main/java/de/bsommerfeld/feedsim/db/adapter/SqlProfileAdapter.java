package de.bsommerfeld.feedsim.db.adapter;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.Profile;
import de.bsommerfeld.feedsim.db.SqlLoader;
import de.bsommerfeld.feedsim.db.SqliteDatabase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * SQLite-backed {@link ProfileAdapter}.
 */
@Singleton
public class SqlProfileAdapter implements ProfileAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(SqlProfileAdapter.class);

    private final SqliteDatabase database;

    @Inject
    public SqlProfileAdapter(SqliteDatabase database) {
        this.database = database;
    }

    @Override
    public Optional<Profile> readProfile(String handle) {
        return database.query("read-profile", handle, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-profile"))) {
                ps.setString(1, handle);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapProfile(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public List<Profile> readAllProfiles() {
        return database.query("read-all-profiles", null, conn -> {
            List<Profile> profiles = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-profiles"));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    profiles.add(mapProfile(rs));
                }
            }
            return profiles;
        });
    }

    @Override
    public void writeProfile(Profile profile) {
        database.inTransaction("write-profile", profile.handle(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-profile"))) {
                ps.setString(1, profile.handle());
                ps.setString(2, profile.did());
                ps.setString(3, profile.displayName());
                ps.setString(4, profile.bio());
                ps.setInt(5, profile.followersCount());
                ps.setInt(6, profile.followsCount());
                ps.setInt(7, profile.postsCount());
                ps.executeUpdate();
            }
            return null;
        });
        LOG.debug("Wrote profile {}", profile.handle());
    }

    private Profile mapProfile(ResultSet rs) throws SQLException {
        RowReader row = new RowReader(rs, "profiles[handle=" + rs.getString("handle") + "]");
        String handle = row.requireString("handle");
        String did = row.requireString("did");
        String displayName = row.requireString("display_name");
        String bio = row.requireString("bio");
        int followers = row.requireInt("followers_count");
        int follows = row.requireInt("follows_count");
        int posts = row.requireInt("posts_count");
        return row.build(() -> new Profile(handle, did, displayName, bio, followers, follows, posts));
    }
}
