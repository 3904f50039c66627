package org.netpreserve.evidence.store;

/**
 * A capture of a post linked to its stored payload.
 *
 * @param timestamp capture time in epoch milliseconds
 */
public record CaptureLink(
        long statusId,
        String screenName,
        long timestamp,
        String url,
        String digest) {
}
