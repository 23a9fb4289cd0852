package com.raceintel.racedata.output;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Timestamps are stored as fixed-width UTC text so that ORDER BY timestamp is chronological.
 */
public final class StoreTimestamps {

    public static final DateTimeFormatter FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private StoreTimestamps() {
    }

    public static String format(Instant instant) {
        return instant == null ? null : FORMAT.format(instant);
    }

    public static Instant parse(String stored) {
        return stored == null ? null : Instant.from(FORMAT.parse(stored));
    }
}
