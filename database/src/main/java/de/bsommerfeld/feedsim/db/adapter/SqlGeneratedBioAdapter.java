package de.bsommerfeld.feedsim.db.adapter;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.GeneratedBio;
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
import java.util.List;
import java.util.Optional;

@Singleton
public class SqlGeneratedBioAdapter implements GeneratedBioAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(SqlGeneratedBioAdapter.class);

    private final SqliteDatabase database;

    @Inject
    public SqlGeneratedBioAdapter(SqliteDatabase database) {
        this.database = database;
    }

    @Override
    public Optional<GeneratedBio> readGeneratedBio(String handle) {
        return database.query("read-generated-bio", handle, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-generated-bio"))) {
                ps.setString(1, handle);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapBio(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public List<GeneratedBio> readAllGeneratedBios() {
        return database.query("read-all-generated-bios", null, conn -> {
            List<GeneratedBio> bios = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-generated-bios"));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    bios.add(mapBio(rs));
                }
            }
            return bios;
        });
    }

    @Override
    public void writeGeneratedBio(GeneratedBio bio) {
        database.inTransaction("write-generated-bio", bio.handle(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("upsert-generated-bio"))) {
                ps.setString(1, bio.handle());
                ps.setString(2, bio.generatedBio());
                ps.setLong(3, Timestamps.toEpochMillis(bio.createdAt()));
                ps.executeUpdate();
            }
            return null;
        });
        LOG.debug("Wrote generated bio for {}", bio.handle());
    }

    private GeneratedBio mapBio(ResultSet rs) throws SQLException {
        RowReader row = new RowReader(rs, "generated_bios[handle=" + rs.getString("handle") + "]");
        String handle = row.requireString("handle");
        String text = row.requireString("generated_bio");
        Instant createdAt = row.requireInstant("created_at");
        return row.build(() -> new GeneratedBio(handle, text, createdAt));
    }
}
