package org.netpreserve.evidence.config;

/**
 * Root configuration.
 *
 * @param pacing         request pacing per archive surface
 * @param archive        archive endpoints, timeouts and retries
 * @param download       concurrency of index queries and downloads
 * @param store          where downloaded evidence is kept
 * @param existenceCheck whether and how to check if posts are still live
 * @param diagnostics    operator diagnostics
 */
public record EvidenceConfig(
        PacingConfig pacing,
        ArchiveConfig archive,
        DownloadConfig download,
        StoreConfig store,
        ExistenceCheckConfig existenceCheck,
        DiagnosticsConfig diagnostics) {
}
