package org.netpreserve.evidence;

import org.jetbrains.annotations.Nullable;

import java.nio.file.Path;

/**
 * What became of one capture handed to the download pipeline.
 *
 * @param digest digest the payload is stored under, for STORED and CACHED
 * @param path   where the payload is stored, for STORED and CACHED
 * @param error  why the capture could not be retrieved, for FAILED
 */
public record DownloadResult(
        CaptureReference capture,
        Status status,
        @Nullable String digest,
        @Nullable Path path,
        @Nullable String error) {

    public enum Status {
        /** Downloaded in this run. */
        STORED,
        /** Already in the store, no request made. */
        CACHED,
        /** Gave up after a fatal failure or exhausting retries. */
        FAILED,
        /** The run was cancelled before the capture was retrieved. */
        CANCELLED
    }

    public static DownloadResult stored(CaptureReference capture, String digest, Path path) {
        return new DownloadResult(capture, Status.STORED, digest, path, null);
    }

    public static DownloadResult cached(CaptureReference capture, String digest, @Nullable Path path) {
        return new DownloadResult(capture, Status.CACHED, digest, path, null);
    }

    public static DownloadResult failed(CaptureReference capture, String error) {
        return new DownloadResult(capture, Status.FAILED, null, null, error);
    }

    public static DownloadResult cancelled(CaptureReference capture) {
        return new DownloadResult(capture, Status.CANCELLED, null, null, null);
    }

    public boolean isAvailable() {
        return status == Status.STORED || status == Status.CACHED;
    }
}
