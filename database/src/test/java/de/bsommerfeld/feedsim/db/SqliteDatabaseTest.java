package de.bsommerfeld.feedsim.db;

import de.bsommerfeld.feedsim.db.exception.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqliteDatabaseTest {

    @TempDir
    Path tempDir;

    private SqliteDatabase database;

    @BeforeEach
    void setUp() {
        database = new SqliteDatabase(tempDir.resolve("nested").resolve("test.db"));
    }

    @Test
    void constructor_shouldCreateParentDirectoryAndApplySchema() {
        assertTrue(Files.isDirectory(tempDir.resolve("nested")));

        List<String> tables = database.query("list-tables", null, conn -> {
            List<String> names = new ArrayList<>();
            try (Statement stmt = conn.createStatement();
                    ResultSet rs = stmt.executeQuery("SELECT name FROM sqlite_master WHERE type = 'table' ORDER BY name")) {
                while (rs.next()) {
                    names.add(rs.getString(1));
                }
            }
            return names;
        });

        assertEquals(List.of("feed_posts", "generated_bios", "generated_feeds", "profiles", "runs", "turn_metadata"),
                tables);
    }

    @Test
    void constructor_shouldBeIdempotentOnExistingFile() {
        Path file = tempDir.resolve("nested").resolve("test.db");
        assertDoesNotThrow(() -> new SqliteDatabase(file));
    }

    @Test
    void inTransaction_shouldRollbackWhenWorkThrows() {
        assertThrows(IllegalStateException.class, () -> database.inTransaction("test", "k", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO generated_bios (handle, generated_bio, created_at) VALUES ('a', 'bio', 1)")) {
                ps.executeUpdate();
            }
            throw new IllegalStateException("boom");
        }));

        assertEquals(0, countBios());
    }

    @Test
    void inTransaction_shouldWrapSqlExceptionWithOperationAndKey() {
        StorageException e = assertThrows(StorageException.class,
                () -> database.inTransaction("bad-insert", "key-1", conn -> {
                    try (Statement stmt = conn.createStatement()) {
                        stmt.executeUpdate("INSERT INTO no_such_table VALUES (1)");
                    }
                    return null;
                }));

        assertEquals("bad-insert", e.getOperation());
        assertEquals("key-1", e.getKey());
        assertTrue(e.getMessage().contains("bad-insert"));
    }

    @Test
    void runsTable_shouldRejectCompletedAtWithoutCompletedStatus() {
        assertThrows(StorageException.class, () -> database.inTransaction("check", null, conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.executeUpdate("INSERT INTO runs VALUES ('r', 1, 1, 1, 1, 'running', 5)");
            }
            return null;
        }));
    }

    @Test
    void turnMetadataTable_shouldEnforceForeignKey() {
        assertThrows(StorageException.class, () -> database.inTransaction("fk", null, conn -> {
            try (Statement stmt = conn.createStatement()) {
                stmt.executeUpdate("INSERT INTO turn_metadata VALUES ('missing', 0, '{}', 1)");
            }
            return null;
        }));
    }

    private int countBios() {
        return database.query("count", null, conn -> {
            try (Statement stmt = conn.createStatement();
                    ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM generated_bios")) {
                rs.next();
                return rs.getInt(1);
            }
        });
    }
}
