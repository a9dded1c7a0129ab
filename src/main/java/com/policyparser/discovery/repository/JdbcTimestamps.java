package com.policyparser.discovery.repository;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Fixed-width UTC timestamps so that string comparison in SQL follows time order.
 */
final class JdbcTimestamps {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private JdbcTimestamps() {
    }

    static String format(Instant instant) {
        return FORMAT.format(instant);
    }

    static String now() {
        return format(Instant.now());
    }
}
