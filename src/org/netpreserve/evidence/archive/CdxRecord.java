package org.netpreserve.evidence.archive;

import org.jetbrains.annotations.Nullable;

import java.time.Instant;

/**
 * One row of a CDX search result.
 *
 * @param url       original URL of the capture
 * @param timestamp when the capture was made
 * @param digest    Base32 SHA-1 of the captured payload
 * @param mimeType  recorded content type
 * @param status    recorded HTTP status, null when the archive recorded none ("-")
 */
public record CdxRecord(String url, Instant timestamp, @Nullable String digest, @Nullable String mimeType,
                        @Nullable Integer status) {

    public String waybackTimestamp() {
        return WaybackTimestamp.format(timestamp);
    }
}
