package org.netpreserve.evidence;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.evidence.archive.CdxClient;
import org.netpreserve.evidence.archive.CdxRecord;
import org.netpreserve.evidence.pacing.PacingController;
import org.netpreserve.evidence.retry.Retrier;
import org.netpreserve.evidence.util.BoundedFanout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Finds out which posts were deleted and have archived evidence, and retrieves that evidence.
 * <p>
 * Each post goes through: CDX lookup, then (if captures were found) a live-existence check, then resolution. Posts
 * resolved as deleted, or unchecked when existence checking is off, have their captures handed to the download
 * pipeline when one is configured. Results always come back in input order.
 */
public class DeletionWorkflow {
    private static final Logger log = LoggerFactory.getLogger(DeletionWorkflow.class);
    private final CdxClient cdxClient;
    private final Retrier retrier;
    private final PacingController indexController;
    private final @Nullable LiveStatusChecker liveStatusChecker;
    private final @Nullable DownloadPipeline pipeline;
    private final Settings settings;
    private final Executor executor;
    private final Set<BoundedFanout<?, ?>> fanouts = ConcurrentHashMap.newKeySet();
    private final Set<CompletableFuture<?>> inFlight = ConcurrentHashMap.newKeySet();
    private volatile boolean cancelled;

    /**
     * @param indexConcurrency     CDX lookups in flight
     * @param existenceConcurrency existence checks in flight
     * @param allCaptures          download every usable capture instead of only the earliest
     */
    public record Settings(int indexConcurrency, int existenceConcurrency, boolean allCaptures) {
        public Settings {
            if (indexConcurrency < 1) throw new IllegalArgumentException("indexConcurrency must be at least 1");
            if (existenceConcurrency < 1) throw new IllegalArgumentException("existenceConcurrency must be at least 1");
        }
    }

    /**
     * @param liveStatusChecker null to skip existence checks
     * @param pipeline          null to only resolve posts without retrieving evidence
     * @param executor          runs completion callbacks that start further lookups
     */
    public DeletionWorkflow(CdxClient cdxClient, Retrier retrier, PacingController indexController,
                            @Nullable LiveStatusChecker liveStatusChecker, @Nullable DownloadPipeline pipeline,
                            Settings settings, Executor executor) {
        this.cdxClient = cdxClient;
        this.retrier = retrier;
        this.indexController = indexController;
        this.liveStatusChecker = liveStatusChecker;
        this.pipeline = pipeline;
        this.settings = settings;
        this.executor = executor;
    }

    /**
     * Resolves the given posts. Completes exceptionally with {@link WorkflowAbortedException} if evidence retrieval
     * hits a failure that stops the whole run.
     */
    public CompletableFuture<List<PostDeletionResult>> run(List<PostId> postIds) {
        log.info("Looking up {} posts", postIds.size());
        var lookups = BoundedFanout.start(postIds, settings.indexConcurrency(), this::lookup, Lookup::cancelled,
                executor);
        track(lookups);
        return lookups.result().thenCompose(this::resolve);
    }

    /**
     * Resolves every post of an account the archive has a capture of, found with a single prefix query. Posts are
     * ordered by when they were last archived, most recent first.
     *
     * @param limit only consider this many posts, null for all
     */
    public CompletableFuture<List<PostDeletionResult>> runForUser(String screenName, @Nullable Integer limit) {
        String query = "twitter.com/" + screenName + "/status/*";
        log.info("Searching the archive for {}", query);
        CompletableFuture<List<CdxRecord>> call = retrier.call(indexController, () -> cdxClient.search(query));
        inFlight.add(call);
        return call.whenComplete((records, error) -> inFlight.remove(call))
                .thenCompose(records -> {
                    List<Lookup> lookups = groupByPost(records);
                    lookups.sort(Comparator.comparing(Lookup::lastArchived).reversed()
                            .thenComparing(lookup -> lookup.postId().statusId(), Comparator.reverseOrder()));
                    if (limit != null && lookups.size() > limit) {
                        lookups = new ArrayList<>(lookups.subList(0, limit));
                    }
                    log.info("Found captures of {} posts by {}", lookups.size(), screenName);
                    return resolve(lookups);
                });
    }

    /**
     * Stops starting lookups, checks and downloads. Posts not yet resolved come back as {@link Resolution#CANCELLED}.
     */
    public void cancel() {
        cancelled = true;
        for (var fanout : fanouts) {
            fanout.stop();
        }
        for (var future : inFlight) {
            future.cancel(false);
        }
        if (pipeline != null) pipeline.cancel();
    }

    /**
     * 0 when every post was resolved, 1 if any lookup or retrieval failed.
     */
    public static int exitStatus(List<PostDeletionResult> results) {
        for (PostDeletionResult result : results) {
            if (result.isFailure()) return 1;
        }
        return 0;
    }

    private CompletableFuture<Lookup> lookup(PostId postId) {
        if (cancelled) return CompletableFuture.completedFuture(Lookup.cancelled(postId));
        CompletableFuture<List<CdxRecord>> call = retrier.call(indexController,
                () -> cdxClient.search(postId.cdxQuery()));
        inFlight.add(call);
        return call.handle((records, error) -> {
            inFlight.remove(call);
            if (error == null) return new Lookup(postId, usableCaptures(postId, records), null, false);
            Throwable cause = unwrap(error);
            if (cause instanceof CancellationException) return Lookup.cancelled(postId);
            log.atWarn().addKeyValue("post", postId).log("CDX lookup failed: {}", cause.getMessage());
            return new Lookup(postId, List.of(), String.valueOf(cause.getMessage()), false);
        });
    }

    private CompletableFuture<List<PostDeletionResult>> resolve(List<Lookup> lookups) {
        var toCheck = new ArrayList<Lookup>();
        if (liveStatusChecker != null) {
            for (Lookup lookup : lookups) {
                if (lookup.error() == null && !lookup.cancelled() && !lookup.captures().isEmpty()) toCheck.add(lookup);
            }
        }
        var checks = BoundedFanout.start(toCheck, settings.existenceConcurrency(), this::check,
                lookup -> new Check(lookup.postId(), null, null, true), executor);
        track(checks);
        return checks.result().thenCompose(checked -> {
            Map<Long, Check> byPost = new HashMap<>();
            for (Check check : checked) {
                byPost.put(check.postId().statusId(), check);
            }
            var results = new ArrayList<PostDeletionResult>(lookups.size());
            for (Lookup lookup : lookups) {
                results.add(resolution(lookup, byPost.get(lookup.postId().statusId())));
            }
            logSummary(results);
            return retrieve(results);
        });
    }

    private CompletableFuture<Check> check(Lookup lookup) {
        PostId postId = lookup.postId();
        if (cancelled) return CompletableFuture.completedFuture(new Check(postId, null, null, true));
        CompletableFuture<LiveStatus> call = liveStatusChecker.check(postId);
        inFlight.add(call);
        return call.handle((status, error) -> {
            inFlight.remove(call);
            if (error == null) return new Check(postId, status, null, false);
            Throwable cause = unwrap(error);
            if (cause instanceof CancellationException) return new Check(postId, null, null, true);
            log.atWarn().addKeyValue("post", postId).log("Existence check failed: {}", cause.getMessage());
            return new Check(postId, null, "existence check failed: " + cause.getMessage(), false);
        });
    }

    private PostDeletionResult resolution(Lookup lookup, @Nullable Check check) {
        PostId postId = lookup.postId();
        if (lookup.cancelled()) return PostDeletionResult.cancelled(postId);
        if (lookup.error() != null) return PostDeletionResult.failed(postId, lookup.error());
        if (lookup.captures().isEmpty()) {
            return new PostDeletionResult(postId, List.of(), null, Resolution.NO_EVIDENCE, List.of(), null);
        }
        if (liveStatusChecker == null || check == null) {
            return new PostDeletionResult(postId, lookup.captures(), null, Resolution.UNCHECKED_WITH_EVIDENCE,
                    List.of(), null);
        }
        if (check.cancelled()) return PostDeletionResult.cancelled(postId);
        if (check.error() != null) {
            return new PostDeletionResult(postId, lookup.captures(), null, Resolution.FAILED, List.of(),
                    check.error());
        }
        Resolution resolution = check.status() == LiveStatus.DELETED
                ? Resolution.DELETED_WITH_EVIDENCE
                : Resolution.EXTANT_WITH_EVIDENCE;
        return new PostDeletionResult(postId, lookup.captures(), check.status(), resolution, List.of(), null);
    }

    private CompletableFuture<List<PostDeletionResult>> retrieve(List<PostDeletionResult> results) {
        if (pipeline == null) return CompletableFuture.completedFuture(results);
        var selected = new LinkedHashMap<String, CaptureReference>();
        for (PostDeletionResult result : results) {
            if (!result.resolution().wantsDownload()) continue;
            List<CaptureReference> captures = settings.allCaptures()
                    ? result.captures()
                    : List.of(result.earliestCapture());
            for (CaptureReference capture : captures) {
                selected.putIfAbsent(capture.postId().statusId() + "@" + capture.waybackTimestamp(), capture);
            }
        }
        if (selected.isEmpty()) return CompletableFuture.completedFuture(results);
        log.info("Retrieving {} captures", selected.size());
        return pipeline.run(List.copyOf(selected.values())).handle((downloads, error) -> {
            if (error != null) {
                throw new WorkflowAbortedException("Evidence retrieval aborted", results, unwrap(error));
            }
            Map<Long, List<DownloadResult>> byPost = new HashMap<>();
            for (DownloadResult download : downloads) {
                byPost.computeIfAbsent(download.capture().postId().statusId(), id -> new ArrayList<>()).add(download);
            }
            var withDownloads = new ArrayList<PostDeletionResult>(results.size());
            for (PostDeletionResult result : results) {
                withDownloads.add(result.withDownloads(byPost.getOrDefault(result.postId().statusId(), List.of())));
            }
            return withDownloads;
        });
    }

    static List<CaptureReference> usableCaptures(PostId postId, List<CdxRecord> records) {
        var captures = new ArrayList<CaptureReference>();
        for (CdxRecord record : records) {
            // redirects point at retweets or renamed accounts rather than the post itself
            if (record.status() != null && record.status() != 200) continue;
            captures.add(CaptureReference.of(postId, record));
        }
        captures.sort(Comparator.comparing(CaptureReference::timestamp));
        return captures;
    }

    static List<Lookup> groupByPost(List<CdxRecord> records) {
        Map<Long, PostId> posts = new LinkedHashMap<>();
        Map<Long, List<CdxRecord>> byPost = new HashMap<>();
        for (CdxRecord record : records) {
            var postId = PostId.fromUrl(record.url());
            if (postId.isEmpty()) continue;
            long statusId = postId.get().statusId();
            posts.putIfAbsent(statusId, postId.get());
            byPost.computeIfAbsent(statusId, id -> new ArrayList<>()).add(record);
        }
        var lookups = new ArrayList<Lookup>();
        for (PostId postId : posts.values()) {
            List<CaptureReference> captures = usableCaptures(postId, byPost.get(postId.statusId()));
            if (!captures.isEmpty()) lookups.add(new Lookup(postId, captures, null, false));
        }
        return lookups;
    }

    private void logSummary(List<PostDeletionResult> results) {
        var counts = new int[Resolution.values().length];
        for (PostDeletionResult result : results) {
            counts[result.resolution().ordinal()]++;
        }
        var event = log.atInfo();
        for (Resolution resolution : Resolution.values()) {
            if (counts[resolution.ordinal()] > 0) {
                event = event.addKeyValue(resolution.name().toLowerCase(Locale.ROOT), counts[resolution.ordinal()]);
            }
        }
        event.log("Resolved {} posts", results.size());
    }

    private void track(BoundedFanout<?, ?> fanout) {
        fanouts.add(fanout);
        if (cancelled) fanout.stop();
        fanout.result().whenComplete((value, error) -> fanouts.remove(fanout));
    }

    private static Throwable unwrap(Throwable error) {
        while (error instanceof CompletionException && error.getCause() != null) {
            error = error.getCause();
        }
        return error;
    }

    record Lookup(PostId postId, List<CaptureReference> captures, @Nullable String error, boolean cancelled) {
        static Lookup cancelled(PostId postId) {
            return new Lookup(postId, List.of(), null, true);
        }

        Instant lastArchived() {
            return captures.get(captures.size() - 1).timestamp();
        }
    }

    record Check(PostId postId, @Nullable LiveStatus status, @Nullable String error, boolean cancelled) {
    }
}
