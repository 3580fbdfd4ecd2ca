package de.bsommerfeld.feedsim.db.adapter;

import de.bsommerfeld.feedsim.core.util.Timestamps;
import de.bsommerfeld.feedsim.db.exception.MalformedRowException;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Strict column access for a single {@link ResultSet} row. A {@code NULL} in a
 * required column raises {@link MalformedRowException} naming the column and
 * the row context; no defaults are substituted.
 */
final class RowReader {

    private final ResultSet rs;
    private final String context;

    RowReader(ResultSet rs, String context) {
        this.rs = rs;
        this.context = context;
    }

    String context() {
        return context;
    }

    String requireString(String column) throws SQLException {
        String value = rs.getString(column);
        if (value == null) {
            throw missing(column);
        }
        return value;
    }

    int requireInt(String column) throws SQLException {
        int value = rs.getInt(column);
        if (rs.wasNull()) {
            throw missing(column);
        }
        return value;
    }

    long requireLong(String column) throws SQLException {
        long value = rs.getLong(column);
        if (rs.wasNull()) {
            throw missing(column);
        }
        return value;
    }

    /**
     * Reads a required text column and parses it, reporting a rejected value
     * against the column.
     */
    <T> T requireParsed(String column, Function<String, T> parser) throws SQLException {
        String raw = requireString(column);
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            throw new MalformedRowException(column, context, "has invalid value '" + raw + "'", e);
        }
    }

    Instant requireInstant(String column) throws SQLException {
        return Timestamps.fromEpochMillis(requireLong(column));
    }

    Instant optionalInstant(String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : Timestamps.fromEpochMillis(value);
    }

    /**
     * Builds the domain record, converting a rejected value into a
     * {@link MalformedRowException} for this row.
     */
    <T> T build(Supplier<T> factory) {
        try {
            return factory.get();
        } catch (IllegalArgumentException e) {
            throw new MalformedRowException("record", context, "rejected: " + e.getMessage(), e);
        }
    }

    private MalformedRowException missing(String column) {
        return new MalformedRowException(column, context, "is NULL");
    }
}
