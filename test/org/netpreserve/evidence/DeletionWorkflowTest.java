package org.netpreserve.evidence;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.evidence.archive.CdxClient;
import org.netpreserve.evidence.archive.CdxRecord;
import org.netpreserve.evidence.archive.ContentClient;
import org.netpreserve.evidence.archive.HttpStatusException;
import org.netpreserve.evidence.archive.OEmbedLiveStatusChecker;
import org.netpreserve.evidence.pacing.FixedPacingController;
import org.netpreserve.evidence.pacing.PacingController;
import org.netpreserve.evidence.pacing.PacingProfile;
import org.netpreserve.evidence.pacing.Surface;
import org.netpreserve.evidence.retry.Retrier;
import org.netpreserve.evidence.store.ContentStore;
import org.netpreserve.evidence.store.ContentStoreException;
import org.netpreserve.evidence.util.NamedThreadFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class DeletionWorkflowTest {
    private static final PostId A = new PostId("alice", 101);
    private static final PostId B = new PostId("alice", 102);
    private static final PostId C = new PostId("carol", 103);

    @TempDir
    Path dir;
    private FakeArchive archive;
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService storeExecutor = Executors.newSingleThreadExecutor(new NamedThreadFactory("store"));
    private final ExecutorService executor = Executors.newSingleThreadExecutor(new NamedThreadFactory("workflow"));
    private final PacingController index = controller(Surface.INDEX);
    private final PacingController content = controller(Surface.CONTENT);
    private CaptureReference firstOfA;
    private CaptureReference secondOfA;

    @BeforeEach
    void startArchive() throws IOException {
        archive = new FakeArchive();
        firstOfA = archive.addCapture(A, "20190101000000", "<p>A, first seen</p>");
        secondOfA = archive.addCapture(A, "20200101000000", "<p>A, later</p>");
        archive.addCapture(C, "20210101000000", "<p>C</p>");
        archive.setLive(A, false);
        archive.setLive(C, true);
    }

    @AfterEach
    void shutdown() {
        archive.close();
        scheduler.shutdownNow();
        storeExecutor.shutdownNow();
        executor.shutdownNow();
    }

    private PacingController controller(Surface surface) {
        return new FixedPacingController(surface, PacingProfile.DEFAULT, Duration.ZERO, 64, scheduler,
                Clock.systemUTC());
    }

    private OEmbedLiveStatusChecker checker() {
        return new OEmbedLiveStatusChecker(FakeArchive.httpClient(), archive.existenceCheckConfig(),
                archive.config(), new Retrier(archive.config().retry()));
    }

    private DownloadPipeline pipeline(ContentStore store) {
        return new DownloadPipeline(store, new ContentClient(FakeArchive.httpClient(), archive.config()),
                new Retrier(archive.config().retry()), content, 2, storeExecutor);
    }

    private DeletionWorkflow workflow(LiveStatusChecker checker, DownloadPipeline pipeline, boolean allCaptures) {
        return new DeletionWorkflow(new CdxClient(FakeArchive.httpClient(), archive.config()),
                new Retrier(archive.config().retry()), index, checker, pipeline,
                new DeletionWorkflow.Settings(3, 3, allCaptures), executor);
    }

    private static List<Resolution> resolutions(List<PostDeletionResult> results) {
        return results.stream().map(PostDeletionResult::resolution).toList();
    }

    @Test
    void resolvesEachPostInInputOrder() throws Exception {
        archive.setMaxLatency(30);
        List<PostDeletionResult> results = workflow(checker(), null, false)
                .run(List.of(A, B, C)).get(30, TimeUnit.SECONDS);

        assertEquals(List.of(A, B, C), results.stream().map(PostDeletionResult::postId).toList());
        assertEquals(List.of(Resolution.DELETED_WITH_EVIDENCE, Resolution.NO_EVIDENCE,
                Resolution.EXTANT_WITH_EVIDENCE), resolutions(results));
        assertEquals(LiveStatus.DELETED, results.get(0).liveStatus());
        assertEquals(firstOfA.timestamp(), results.get(0).earliestCapture().timestamp());
        assertEquals(secondOfA.timestamp(), results.get(0).latestCapture().timestamp());
        assertNull(results.get(1).liveStatus());
        assertEquals(3, archive.cdxRequests());
        assertEquals(2, archive.oembedRequests(), "posts without captures are not checked");
        assertEquals(0, DeletionWorkflow.exitStatus(results));
    }

    @Test
    void retrievesTheEarliestCaptureOfDeletedPostsOnce() throws Exception {
        try (var store = ContentStore.open(dir)) {
            List<PostDeletionResult> results = workflow(checker(), pipeline(store), false)
                    .run(List.of(A, B, C)).get(30, TimeUnit.SECONDS);

            assertEquals(1, archive.contentRequests());
            List<DownloadResult> downloads = results.get(0).downloads();
            assertEquals(1, downloads.size());
            assertEquals(DownloadResult.Status.STORED, downloads.get(0).status());
            assertEquals(firstOfA.timestamp(), downloads.get(0).capture().timestamp());
            assertEquals(firstOfA.expectedDigest(), store.lookup(A, firstOfA.timestamp()).orElseThrow());
            assertTrue(results.get(2).downloads().isEmpty(), "live posts are not retrieved");

            List<PostDeletionResult> again = workflow(checker(), pipeline(store), false)
                    .run(List.of(A, B, C)).get(30, TimeUnit.SECONDS);
            assertEquals(1, archive.contentRequests(), "second run downloads nothing");
            assertEquals(DownloadResult.Status.CACHED, again.get(0).downloads().get(0).status());
            assertEquals(resolutions(results), resolutions(again));
        }
    }

    @Test
    void retrievesEveryCaptureWhenAsked() throws Exception {
        try (var store = ContentStore.open(dir)) {
            List<PostDeletionResult> results = workflow(checker(), pipeline(store), true)
                    .run(List.of(A, C)).get(30, TimeUnit.SECONDS);

            assertEquals(2, results.get(0).downloads().size());
            assertEquals(2, archive.contentRequests());
            assertEquals(2, store.fileCount());
        }
    }

    @Test
    void withoutExistenceChecksEveryArchivedPostIsRetrieved() throws Exception {
        try (var store = ContentStore.open(dir)) {
            List<PostDeletionResult> results = workflow(null, pipeline(store), false)
                    .run(List.of(A, B, C)).get(30, TimeUnit.SECONDS);

            assertEquals(List.of(Resolution.UNCHECKED_WITH_EVIDENCE, Resolution.NO_EVIDENCE,
                    Resolution.UNCHECKED_WITH_EVIDENCE), resolutions(results));
            assertEquals(0, archive.oembedRequests());
            assertEquals(2, archive.contentRequests());
        }
    }

    @Test
    void failedLookupIsReportedNotMistakenForNoEvidence() throws Exception {
        var d = new PostId("dave", 104);
        archive.failCdx(d, 403);
        List<PostDeletionResult> results = workflow(checker(), null, false)
                .run(List.of(A, d, C)).get(30, TimeUnit.SECONDS);

        PostDeletionResult failed = results.get(1);
        assertEquals(Resolution.FAILED, failed.resolution());
        assertTrue(failed.error().contains("403"), failed.error());
        assertEquals(Resolution.DELETED_WITH_EVIDENCE, results.get(0).resolution());
        assertEquals(Resolution.EXTANT_WITH_EVIDENCE, results.get(2).resolution());
        assertEquals(1, DeletionWorkflow.exitStatus(results));
    }

    @Test
    void failedExistenceCheckLeavesThePostUnresolved() throws Exception {
        archive.setLiveStatus(C, 500);
        List<PostDeletionResult> results = workflow(checker(), null, false)
                .run(List.of(A, C)).get(30, TimeUnit.SECONDS);

        assertEquals(Resolution.DELETED_WITH_EVIDENCE, results.get(0).resolution());
        assertEquals(Resolution.FAILED, results.get(1).resolution());
        assertTrue(results.get(1).error().startsWith("existence check failed"), results.get(1).error());
        assertEquals(1, results.get(1).captures().size());
        assertEquals(1, DeletionWorkflow.exitStatus(results));
    }

    @Test
    void failedDownloadCountsAsFailure() throws Exception {
        archive.removeContent(firstOfA);
        try (var store = ContentStore.open(dir)) {
            List<PostDeletionResult> results = workflow(checker(), pipeline(store), false)
                    .run(List.of(A)).get(30, TimeUnit.SECONDS);

            assertEquals(Resolution.DELETED_WITH_EVIDENCE, results.get(0).resolution());
            assertEquals(DownloadResult.Status.FAILED, results.get(0).downloads().get(0).status());
            assertEquals(1, DeletionWorkflow.exitStatus(results));
        }
    }

    @Test
    void redirectCapturesAreNotEvidence() throws Exception {
        var retweet = new PostId("erin", 105);
        archive.addCapture(retweet, "20200101000000", retweet.url(),
                "moved".getBytes(StandardCharsets.UTF_8), "301");
        archive.setLive(retweet, false);
        List<PostDeletionResult> results = workflow(checker(), null, false)
                .run(List.of(retweet)).get(30, TimeUnit.SECONDS);

        assertEquals(Resolution.NO_EVIDENCE, results.get(0).resolution());
        assertEquals(0, archive.oembedRequests());
    }

    @Test
    void storeFailureAbortsWithPartialResults() throws Exception {
        var store = ContentStore.open(dir);
        store.close();
        var e = assertThrows(ExecutionException.class, () -> workflow(checker(), pipeline(store), false)
                .run(List.of(A, B, C)).get(30, TimeUnit.SECONDS));

        var aborted = assertInstanceOf(WorkflowAbortedException.class, e.getCause());
        assertInstanceOf(ContentStoreException.class, aborted.getCause());
        assertEquals(List.of(Resolution.DELETED_WITH_EVIDENCE, Resolution.NO_EVIDENCE,
                Resolution.EXTANT_WITH_EVIDENCE), resolutions(aborted.partialResults()));
    }

    @Test
    void cancelledWorkflowResolvesNothing() throws Exception {
        var workflow = workflow(checker(), null, false);
        workflow.cancel();
        List<PostDeletionResult> results = workflow.run(List.of(A, B, C)).get(30, TimeUnit.SECONDS);

        assertEquals(List.of(Resolution.CANCELLED, Resolution.CANCELLED, Resolution.CANCELLED),
                resolutions(results));
        assertEquals(0, archive.cdxRequests());
    }

    @Test
    void findsAnAccountsPostsWithOnePrefixQuery() throws Exception {
        var older = new PostId("alice", 99);
        archive.addCapture(older, "20150101000000", "<p>old</p>");
        archive.addCapture(new PostId("bob", 200), "20220101000000", "<p>bob</p>");

        List<PostDeletionResult> results = workflow(checker(), null, false)
                .runForUser("alice", null).get(30, TimeUnit.SECONDS);

        assertEquals(1, archive.cdxRequests());
        assertEquals(List.of(A, older), results.stream().map(PostDeletionResult::postId).toList(),
                "most recently archived first, posts without captures are not listed");
        assertEquals(2, results.get(0).captures().size());

        List<PostDeletionResult> limited = workflow(checker(), null, false)
                .runForUser("alice", 1).get(30, TimeUnit.SECONDS);
        assertEquals(List.of(A), limited.stream().map(PostDeletionResult::postId).toList());
    }

    @Test
    void failedAccountSearchFailsTheRun() {
        archive.failCdx("twitter.com/zed/status/*", 400);
        var e = assertThrows(ExecutionException.class, () -> workflow(checker(), null, false)
                .runForUser("zed", null).get(30, TimeUnit.SECONDS));
        assertEquals(400, assertInstanceOf(HttpStatusException.class, e.getCause()).status());
        assertEquals(1, archive.cdxRequests());
    }

    @Test
    void groupsPrefixResultsByPost() {
        List<CdxRecord> records = List.of(
                new CdxRecord("https://twitter.com/alice/status/7", Instant.parse("2020-01-02T00:00:00Z"), null, null, 200),
                new CdxRecord("https://twitter.com/alice/status/7?s=20", Instant.parse("2020-01-01T00:00:00Z"), null, null, null),
                new CdxRecord("https://twitter.com/alice/status/8", Instant.parse("2020-01-01T00:00:00Z"), null, null, 302),
                new CdxRecord("https://twitter.com/alice/with_replies", Instant.parse("2020-01-01T00:00:00Z"), null, null, 200));

        List<DeletionWorkflow.Lookup> lookups = DeletionWorkflow.groupByPost(records);
        assertEquals(1, lookups.size());
        assertEquals(new PostId("alice", 7), lookups.get(0).postId());
        assertEquals(Instant.parse("2020-01-01T00:00:00Z"), lookups.get(0).captures().get(0).timestamp());
        assertEquals(Instant.parse("2020-01-02T00:00:00Z"), lookups.get(0).lastArchived());
    }

    @Test
    void revisitRowsCountAsEvidenceButRedirectsDoNot() {
        var post = new PostId("alice", 7);
        List<CdxRecord> records = List.of(
                new CdxRecord(post.url(), Instant.parse("2020-01-01T00:00:00Z"), null, null, null),
                new CdxRecord(post.url(), Instant.parse("2020-01-02T00:00:00Z"), null, null, 301),
                new CdxRecord(post.url(), Instant.parse("2020-01-03T00:00:00Z"), null, null, 200),
                new CdxRecord(post.url(), Instant.parse("2020-01-04T00:00:00Z"), null, null, 404));

        List<CaptureReference> captures = DeletionWorkflow.usableCaptures(post, records);
        assertEquals(List.of(Instant.parse("2020-01-01T00:00:00Z"), Instant.parse("2020-01-03T00:00:00Z")),
                captures.stream().map(CaptureReference::timestamp).toList());
    }
}
