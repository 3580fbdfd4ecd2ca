package de.bsommerfeld.feedsim.db.adapter;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.feedsim.core.domain.Run;
import de.bsommerfeld.feedsim.core.domain.RunStatus;
import de.bsommerfeld.feedsim.core.domain.TurnAction;
import de.bsommerfeld.feedsim.core.domain.TurnMetadata;
import de.bsommerfeld.feedsim.core.util.Timestamps;
import de.bsommerfeld.feedsim.db.SqlLoader;
import de.bsommerfeld.feedsim.db.SqliteDatabase;
import de.bsommerfeld.feedsim.db.exception.DuplicateTurnMetadataException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteErrorCode;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * SQLite-backed {@link RunAdapter}.
 *
 * <p>
 * Timestamps are stored as epoch milliseconds so the {@code CHECK}
 * constraints on {@code runs} compare numerically. {@code total_actions} is a
 * JSON object keyed by action name.
 */
@Singleton
public class SqlRunAdapter implements RunAdapter {

    private static final Logger LOG = LoggerFactory.getLogger(SqlRunAdapter.class);

    private final SqliteDatabase database;

    @Inject
    public SqlRunAdapter(SqliteDatabase database) {
        this.database = database;
    }

    // =====================================================================
    // Runs
    // =====================================================================

    @Override
    public void writeRun(Run run) {
        database.inTransaction("write-run", run.runId(), conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-run"))) {
                ps.setString(1, run.runId());
                ps.setLong(2, Timestamps.toEpochMillis(run.createdAt()));
                ps.setLong(3, Timestamps.toEpochMillis(run.startedAt()));
                ps.setInt(4, run.totalTurns());
                ps.setInt(5, run.totalAgents());
                ps.setString(6, run.status().value());
                setOptionalInstant(ps, 7, run.completedAt());
                ps.executeUpdate();
            }
            return null;
        });
        LOG.debug("Wrote run {}", run.runId());
    }

    @Override
    public Optional<Run> readRun(String runId) {
        return database.query("read-run", runId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-run"))) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapRun(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public List<Run> readAllRuns() {
        return database.query("read-all-runs", null, conn -> {
            List<Run> runs = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-all-runs"));
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    runs.add(mapRun(rs));
                }
            }
            return runs;
        });
    }

    @Override
    public boolean updateRunStatus(String runId, RunStatus expected, RunStatus status, Instant completedAt) {
        int updated = database.inTransaction("update-run-status", runId, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("update-run-status"))) {
                ps.setString(1, status.value());
                setOptionalInstant(ps, 2, completedAt);
                ps.setString(3, runId);
                ps.setString(4, expected.value());
                return ps.executeUpdate();
            }
        });
        if (updated == 0) {
            LOG.debug("Run {} is no longer {}, status left unchanged", runId, expected.value());
            return false;
        }
        LOG.debug("Set status of run {} to {}", runId, status.value());
        return true;
    }

    // =====================================================================
    // Turn metadata
    // =====================================================================

    @Override
    public Optional<TurnMetadata> readTurnMetadata(String runId, int turnNumber) {
        return database.query("read-turn-metadata", runId + "#" + turnNumber, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-turn-metadata"))) {
                ps.setString(1, runId);
                ps.setInt(2, turnNumber);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(mapTurnMetadata(rs)) : Optional.empty();
                }
            }
        });
    }

    @Override
    public List<TurnMetadata> readTurnMetadataForRun(String runId) {
        return database.query("read-turn-metadata-for-run", runId, conn -> {
            List<TurnMetadata> turns = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("select-turn-metadata-for-run"))) {
                ps.setString(1, runId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        turns.add(mapTurnMetadata(rs));
                    }
                }
            }
            return turns;
        });
    }

    @Override
    public void writeTurnMetadata(TurnMetadata metadata) {
        String key = metadata.runId() + "#" + metadata.turnNumber();
        database.inTransaction("write-turn-metadata", key, conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load("insert-turn-metadata"))) {
                ps.setString(1, metadata.runId());
                ps.setInt(2, metadata.turnNumber());
                ps.setString(3, JsonColumns.writeActions(metadata.totalActions()));
                ps.setLong(4, Timestamps.toEpochMillis(metadata.createdAt()));
                ps.executeUpdate();
            } catch (SQLException e) {
                if (isUniqueViolation(e)) {
                    throw new DuplicateTurnMetadataException(metadata.runId(), metadata.turnNumber());
                }
                throw e;
            }
            return null;
        });
        LOG.debug("Wrote turn metadata {}", key);
    }

    // =====================================================================
    // Mapping
    // =====================================================================

    private Run mapRun(ResultSet rs) throws SQLException {
        RowReader row = new RowReader(rs, "runs[run_id=" + rs.getString("run_id") + "]");
        String runId = row.requireString("run_id");
        Instant createdAt = row.requireInstant("created_at");
        Instant startedAt = row.requireInstant("started_at");
        int totalTurns = row.requireInt("total_turns");
        int totalAgents = row.requireInt("total_agents");
        RunStatus status = row.requireParsed("status", RunStatus::fromValue);
        Instant completedAt = row.optionalInstant("completed_at");
        return row.build(() -> new Run(runId, createdAt, startedAt, totalTurns, totalAgents, status, completedAt));
    }

    private TurnMetadata mapTurnMetadata(ResultSet rs) throws SQLException {
        RowReader row = new RowReader(rs,
                "turn_metadata[run_id=" + rs.getString("run_id") + ", turn=" + rs.getString("turn_number") + "]");
        String runId = row.requireString("run_id");
        int turnNumber = row.requireInt("turn_number");
        Map<TurnAction, Integer> actions = JsonColumns.readActions(row.requireString("total_actions"), row.context());
        Instant createdAt = row.requireInstant("created_at");
        return row.build(() -> new TurnMetadata(runId, turnNumber, actions, createdAt));
    }

    private static void setOptionalInstant(PreparedStatement ps, int index, Instant value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.INTEGER);
        } else {
            ps.setLong(index, Timestamps.toEpochMillis(value));
        }
    }

    private static boolean isUniqueViolation(SQLException e) {
        return e.getErrorCode() == SQLiteErrorCode.SQLITE_CONSTRAINT.code
                && e.getMessage() != null
                && e.getMessage().contains("UNIQUE");
    }
}
