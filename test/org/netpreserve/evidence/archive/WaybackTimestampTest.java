package org.netpreserve.evidence.archive;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class WaybackTimestampTest {
    @Test
    void parsesAndFormatsUtcTimestamps() throws Exception {
        assertEquals(Instant.parse("2006-03-21T20:50:14Z"), WaybackTimestamp.parse("20060321205014"));
        assertEquals("20060321205014", WaybackTimestamp.format(Instant.parse("2006-03-21T20:50:14Z")));
    }

    @Test
    void rejectsOtherLengthsAndInvalidDates() {
        assertThrows(MalformedResponseException.class, () -> WaybackTimestamp.parse("2006"));
        assertThrows(MalformedResponseException.class, () -> WaybackTimestamp.parse("20061321205014"));
        assertThrows(MalformedResponseException.class, () -> WaybackTimestamp.parse("2006032120501x"));
    }
}
