package com.example.docimp.io;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Fixed-width UTC timestamp formats. Every field is zero-padded, so lexical order of the
 * produced strings equals chronological order.
 */
public final class Timestamps {
    private static final DateTimeFormatter RECORD_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSSSSS'Z'").withZone(ZoneOffset.UTC);
    // Colons and dots are not portable in file names.
    private static final DateTimeFormatter FILE_NAME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss-SSSSSSSSS'Z'").withZone(ZoneOffset.UTC);

    private Timestamps() {
    }

    public static String format(Instant instant) {
        return RECORD_FORMAT.format(instant);
    }

    public static String now(Clock clock) {
        return format(clock.instant());
    }

    public static String forFileName(Instant instant) {
        return FILE_NAME_FORMAT.format(instant);
    }
}
