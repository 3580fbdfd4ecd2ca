package de.bsommerfeld.feedsim.db;

import de.bsommerfeld.feedsim.db.exception.StorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * Connection and transaction boundary for the SQLite store.
 *
 * <p>
 * The schema is applied from {@code schema.sql} on construction; every DDL
 * statement uses {@code IF NOT EXISTS} so it is safe to re-run.
 *
 * <h3>Connection strategy</h3>
 * A new {@link Connection} is opened per operation and closed immediately
 * after. SQLite serializes writes at the file level, so pooling buys nothing;
 * concurrent writers wait up to the configured busy timeout. Foreign keys are
 * enforced on every connection.
 *
 * <h3>Transaction boundaries</h3>
 * {@link #inTransaction} wraps the work in an explicit transaction and rolls
 * back on any failure, so a partial write is never observable. {@link #query}
 * runs read-only work in auto-commit mode. {@link SQLException}s surface as
 * {@link StorageException}; runtime exceptions thrown by the work (domain
 * errors, malformed rows) pass through unchanged after the rollback.
 */
public class SqliteDatabase {

    private static final Logger LOG = LoggerFactory.getLogger(SqliteDatabase.class);

    public static final int DEFAULT_BUSY_TIMEOUT_MS = 5000;

    private final String dbUrl;
    private final Properties connectionProperties;

    /**
     * Unit of work executed against an open connection.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T execute(Connection conn) throws SQLException;
    }

    public SqliteDatabase(Path databaseFile) {
        this(databaseFile, DEFAULT_BUSY_TIMEOUT_MS);
    }

    public SqliteDatabase(Path databaseFile, int busyTimeoutMs) {
        Path parent = databaseFile.toAbsolutePath().getParent();
        try {
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }
        } catch (IOException e) {
            throw new StorageException("create-data-directory", String.valueOf(parent), e);
        }
        this.dbUrl = "jdbc:sqlite:" + databaseFile.toAbsolutePath();

        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(busyTimeoutMs);
        this.connectionProperties = config.toProperties();

        initialize();
    }

    public String getUrl() {
        return dbUrl;
    }

    public Connection getConnection() throws SQLException {
        return DriverManager.getConnection(dbUrl, connectionProperties);
    }

    private void initialize() {
        LOG.info("Initializing database at {}", dbUrl);
        inTransaction("apply-schema", null, conn -> {
            applySchema(conn);
            return null;
        });
        LOG.info("Database schema applied.");
    }

    /**
     * Executes every statement of {@code schema.sql}, split on semicolons at
     * line ends.
     */
    private void applySchema(Connection conn) throws SQLException {
        String schemaSql;
        try (InputStream schemaStream = getClass().getClassLoader().getResourceAsStream("schema.sql")) {
            if (schemaStream == null) {
                throw new IllegalStateException("schema.sql not found on classpath");
            }
            schemaSql = new String(schemaStream.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SQLException("Failed to read schema.sql", e);
        }

        try (Statement stmt = conn.createStatement()) {
            for (String sql : schemaSql.split(";\\s*(\\r?\\n|$)")) {
                if (!sql.trim().isEmpty()) {
                    stmt.execute(sql.trim());
                }
            }
        }
    }

    /**
     * Runs {@code work} inside one transaction: commit on success, rollback on
     * any exception.
     *
     * @param operation name used in error messages and logs
     * @param key       identifying key of the affected row(s), may be
     *                  {@code null}
     * @throws StorageException wrapping any {@link SQLException}
     */
    public <T> T inTransaction(String operation, String key, SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            conn.setAutoCommit(false);
            try {
                T result = work.execute(conn);
                conn.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, operation, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new StorageException(operation, key, e);
        }
    }

    /**
     * Runs read-only {@code work} on a fresh auto-commit connection.
     *
     * @throws StorageException wrapping any {@link SQLException}
     */
    public <T> T query(String operation, String key, SqlWork<T> work) {
        try (Connection conn = getConnection()) {
            return work.execute(conn);
        } catch (SQLException e) {
            throw new StorageException(operation, key, e);
        }
    }

    private void rollbackQuietly(Connection conn, String operation, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
            LOG.error("Rollback failed during {}", operation, rollbackFailure);
        }
    }
}
