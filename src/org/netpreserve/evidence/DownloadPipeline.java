package org.netpreserve.evidence;

import org.netpreserve.evidence.archive.ContentClient;
import org.netpreserve.evidence.pacing.PacingController;
import org.netpreserve.evidence.retry.Retrier;
import org.netpreserve.evidence.store.ContentDigests;
import org.netpreserve.evidence.store.ContentStore;
import org.netpreserve.evidence.util.BoundedFanout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Retrieves captures into the content store with up to {@code concurrency} downloads in flight.
 * <p>
 * Captures whose payload is already stored are linked without any request. Everything else goes through the
 * retrier and the content pacing controller, which is where backpressure comes from: raising the concurrency only
 * queues more callers on the controller's permits. One capture failing doesn't affect the others; the content store
 * failing aborts the run.
 */
public class DownloadPipeline {
    private static final Logger log = LoggerFactory.getLogger(DownloadPipeline.class);
    private final ContentStore store;
    private final ContentClient client;
    private final Retrier retrier;
    private final PacingController controller;
    private final int concurrency;
    private final Executor storeExecutor;
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private final Set<BoundedFanout<?, ?>> runs = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;

    /**
     * @param storeExecutor runs the blocking content store calls
     */
    public DownloadPipeline(ContentStore store, ContentClient client, Retrier retrier, PacingController controller,
                            int concurrency, Executor storeExecutor) {
        if (concurrency < 1) throw new IllegalArgumentException("concurrency must be at least 1");
        this.store = store;
        this.client = client;
        this.retrier = retrier;
        this.controller = controller;
        this.concurrency = concurrency;
        this.storeExecutor = storeExecutor;
    }

    /**
     * Retrieves the given captures. The future completes with one result per capture in input order, or
     * exceptionally with a {@link org.netpreserve.evidence.store.ContentStoreException} if the store fails.
     */
    public CompletableFuture<List<DownloadResult>> run(List<CaptureReference> captures) {
        var fanout = BoundedFanout.start(captures, concurrency, this::process, DownloadResult::cancelled,
                storeExecutor);
        runs.add(fanout);
        if (cancelled) fanout.stop();
        return fanout.result().whenComplete((results, error) -> {
            runs.remove(fanout);
            if (results != null) logSummary(results);
        });
    }

    /**
     * Stops starting downloads and abandons pending permits. Requests already sent are allowed to finish but their
     * payloads are discarded.
     */
    public void cancel() {
        cancelled = true;
        for (var fanout : runs) {
            fanout.stop();
        }
        for (var future : inFlight) {
            future.cancel(false);
        }
    }

    private CompletableFuture<DownloadResult> process(CaptureReference capture) {
        if (cancelled) return CompletableFuture.completedFuture(DownloadResult.cancelled(capture));
        return CompletableFuture.supplyAsync(() -> fromStore(capture), storeExecutor)
                .thenCompose(hit -> hit.map(CompletableFuture::completedFuture)
                        .orElseGet(() -> download(capture)));
    }

    private Optional<DownloadResult> fromStore(CaptureReference capture) {
        PostId postId = capture.postId();
        Optional<String> linked = store.lookup(postId, capture.timestamp());
        if (linked.isPresent()) {
            return Optional.of(DownloadResult.cached(capture, linked.get(), store.path(linked.get()).orElse(null)));
        }
        String expected = capture.expectedDigest();
        if (expected != null) {
            Optional<Path> path = store.path(expected);
            if (path.isPresent()) {
                store.record(postId, capture, expected);
                return Optional.of(DownloadResult.cached(capture, expected, path.get()));
            }
        }
        return Optional.empty();
    }

    private CompletableFuture<DownloadResult> download(CaptureReference capture) {
        if (cancelled) return CompletableFuture.completedFuture(DownloadResult.cancelled(capture));
        CompletableFuture<byte[]> call = retrier.call(controller, () -> client.fetch(capture));
        inFlight.add(call);
        return call.handle((bytes, error) -> {
            inFlight.remove(call);
            if (error == null) {
                return CompletableFuture.supplyAsync(() -> commit(capture, bytes), storeExecutor);
            }
            Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause() : error;
            if (cause instanceof CancellationException) {
                return CompletableFuture.completedFuture(DownloadResult.cancelled(capture));
            }
            log.atWarn().addKeyValue("post", capture.postId()).addKeyValue("timestamp", capture.waybackTimestamp())
                    .log("Unable to download {}: {}", capture.url(), cause.getMessage());
            return CompletableFuture.completedFuture(DownloadResult.failed(capture, String.valueOf(cause.getMessage())));
        }).thenCompose(future -> future);
    }

    private DownloadResult commit(CaptureReference capture, byte[] bytes) {
        String digest = ContentDigests.sha1(bytes);
        String expected = capture.expectedDigest();
        if (expected != null && !expected.equals(digest)) {
            log.warn("Digest mismatch for {} at {}: index says {}, payload is {}", capture.url(),
                    capture.waybackTimestamp(), expected, digest);
        }
        Path path = store.put(digest, bytes, capture.postId());
        store.record(capture.postId(), capture, digest);
        log.atInfo().addKeyValue("post", capture.postId()).addKeyValue("timestamp", capture.waybackTimestamp())
                .addKeyValue("digest", digest).log("Stored capture");
        return DownloadResult.stored(capture, digest, path);
    }

    private static void logSummary(List<DownloadResult> results) {
        var counts = new int[DownloadResult.Status.values().length];
        for (DownloadResult result : results) {
            counts[result.status().ordinal()]++;
        }
        log.atInfo()
                .addKeyValue("stored", counts[DownloadResult.Status.STORED.ordinal()])
                .addKeyValue("cached", counts[DownloadResult.Status.CACHED.ordinal()])
                .addKeyValue("failed", counts[DownloadResult.Status.FAILED.ordinal()])
                .addKeyValue("cancelled", counts[DownloadResult.Status.CANCELLED.ordinal()])
                .log("Downloads finished");
    }
}
