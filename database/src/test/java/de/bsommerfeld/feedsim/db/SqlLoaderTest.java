package de.bsommerfeld.feedsim.db;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SqlLoader reads from "sql/{name}.sql"; schema.sql lives at the classpath
 * root and is applied by SqliteDatabase.
 */
class SqlLoaderTest {

    @Test
    void load_shouldReturnInsertRun() {
        String sql = SqlLoader.load("insert-run");
        assertFalse(sql.isBlank());
        assertTrue(sql.toLowerCase().startsWith("insert into runs"));
    }

    @Test
    void load_shouldTrimStatement() {
        String sql = SqlLoader.load("select-run");
        assertEquals(sql.trim(), sql);
    }

    @Test
    void load_shouldCacheRepeatCalls() {
        String first = SqlLoader.load("upsert-generated-feed");
        String second = SqlLoader.load("upsert-generated-feed");
        assertSame(first, second, "Cached calls should return the same String reference");
    }

    @Test
    void load_shouldThrowForMissingResource() {
        assertThrows(IllegalStateException.class, () -> SqlLoader.load("does-not-exist"));
    }

    @Test
    void expand_shouldReplacePlaceholderToken() {
        String sql = SqlLoader.expand("select-feed-posts-by-uris", 3);
        assertTrue(sql.contains("IN (?, ?, ?)"), sql);
        assertFalse(sql.contains(SqlLoader.PLACEHOLDERS));
    }

    @Test
    void expand_shouldRejectStatementWithoutToken() {
        assertThrows(IllegalStateException.class, () -> SqlLoader.expand("select-run", 2));
    }

    @Test
    void expand_shouldRejectNonPositiveCount() {
        assertThrows(IllegalArgumentException.class, () -> SqlLoader.expand("select-feed-posts-by-uris", 0));
    }
}
