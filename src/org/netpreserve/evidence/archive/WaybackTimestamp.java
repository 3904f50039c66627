package org.netpreserve.evidence.archive;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;

/**
 * The 14 digit UTC timestamps the Wayback Machine uses in CDX rows and capture URLs.
 */
public final class WaybackTimestamp {
    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ofPattern("uuuuMMddHHmmss")
            .withZone(ZoneOffset.UTC);

    private WaybackTimestamp() {
    }

    public static Instant parse(String timestamp) throws MalformedResponseException {
        if (timestamp.length() != 14) throw new MalformedResponseException("Unexpected timestamp: " + timestamp);
        try {
            return LocalDateTime.parse(timestamp, FORMAT).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new MalformedResponseException("Unexpected timestamp: " + timestamp, e);
        }
    }

    public static String format(Instant instant) {
        return FORMAT.format(instant);
    }
}
