package de.bsommerfeld.feedsim.core.util;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;

/**
 * Timestamp helpers. Every persisted instant is truncated to milliseconds so a
 * value survives the epoch-millis round trip through SQLite unchanged.
 */
public final class Timestamps {

    private static final DateTimeFormatter COMPACT = DateTimeFormatter
            .ofPattern("yyyyMMdd'T'HHmmss")
            .withZone(ZoneOffset.UTC);

    private Timestamps() {
    }

    public static Instant now(Clock clock) {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    public static long toEpochMillis(Instant instant) {
        return instant.toEpochMilli();
    }

    public static Instant fromEpochMillis(long millis) {
        return Instant.ofEpochMilli(millis);
    }

    /** Sortable, filesystem-safe UTC rendering, e.g. {@code 20240101T120000}. */
    public static String compact(Instant instant) {
        return COMPACT.format(instant);
    }
}
