package org.netpreserve.evidence.store;

import org.jetbrains.annotations.Nullable;

/**
 * A stored payload.
 *
 * @param digest          Base32 SHA-1 of the payload
 * @param path            location of the gzipped payload relative to the store directory
 * @param size            uncompressed payload length in bytes
 * @param primaryStatusId status id of the post whose capture first brought this payload in
 */
public record ContentDigestRecord(
        String digest,
        String path,
        long size,
        @Nullable Long primaryStatusId) {
}
