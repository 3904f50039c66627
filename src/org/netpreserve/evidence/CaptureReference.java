package org.netpreserve.evidence;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.evidence.archive.CdxRecord;
import org.netpreserve.evidence.archive.WaybackTimestamp;

import java.time.Instant;

/**
 * An archived capture of a post, as reported by the CDX index.
 *
 * @param expectedDigest digest the index recorded for the payload, if any
 */
public record CaptureReference(
        PostId postId,
        Instant timestamp,
        String url,
        @Nullable String expectedDigest,
        @Nullable String mimeType,
        @Nullable Integer status) {

    public static CaptureReference of(PostId postId, CdxRecord record) {
        return new CaptureReference(postId, record.timestamp(), record.url(), record.digest(), record.mimeType(),
                record.status());
    }

    public String waybackTimestamp() {
        return WaybackTimestamp.format(timestamp);
    }
}
