package de.bsommerfeld.feedsim.db;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Loads and caches SQL statements from classpath resources under {@code sql/}.
 *
 * <p>
 * Each file is read once and cached for the lifetime of the JVM. The naming
 * convention is {@code sql/<operation>-<entity>.sql}, e.g.
 * {@code insert-run.sql} or {@code select-feeds-for-turn.sql}.
 *
 * @see SqliteDatabase
 */
public final class SqlLoader {

    /** Token in a statement that is expanded to {@code ?, ?, ...} by {@link #expand}. */
    public static final String PLACEHOLDERS = "{placeholders}";

    private static final ConcurrentHashMap<String, String> CACHE = new ConcurrentHashMap<>();

    private SqlLoader() {
    }

    /**
     * Returns the statement from {@code sql/<name>.sql}, trimmed.
     *
     * @throws IllegalStateException if the resource is missing or unreadable
     */
    public static String load(String name) {
        return CACHE.computeIfAbsent(name, SqlLoader::readResource);
    }

    /**
     * Loads a statement containing {@link #PLACEHOLDERS} and replaces the token
     * with {@code count} bind markers. Used for {@code IN (...)} lookups.
     */
    public static String expand(String name, int count) {
        if (count <= 0) {
            throw new IllegalArgumentException("count must be greater than 0");
        }
        String sql = load(name);
        if (!sql.contains(PLACEHOLDERS)) {
            throw new IllegalStateException("SQL resource has no " + PLACEHOLDERS + " token: " + name);
        }
        return sql.replace(PLACEHOLDERS, String.join(", ", Collections.nCopies(count, "?")));
    }

    private static String readResource(String name) {
        String path = "sql/" + name + ".sql";
        try (InputStream in = SqlLoader.class.getClassLoader().getResourceAsStream(path)) {
            if (in == null) {
                throw new IllegalStateException("SQL resource not found: " + path);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8).trim();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SQL resource: " + path, e);
        }
    }
}
