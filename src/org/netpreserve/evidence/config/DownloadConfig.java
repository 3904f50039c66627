package org.netpreserve.evidence.config;

/**
 * Concurrency of the two request stages.
 *
 * @param concurrency      content downloads in flight
 * @param indexConcurrency CDX queries in flight
 * @param allCaptures      download every capture of a deleted post instead of only the earliest
 */
public record DownloadConfig(
        int concurrency,
        int indexConcurrency,
        boolean allCaptures) {

    public DownloadConfig {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be at least 1");
        if (indexConcurrency < 1) throw new IllegalArgumentException("indexConcurrency must be at least 1");
    }
}
