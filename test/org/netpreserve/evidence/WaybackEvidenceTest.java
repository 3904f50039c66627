package org.netpreserve.evidence;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.netpreserve.evidence.config.ConfigLoader;
import org.netpreserve.evidence.pacing.PacingProfile;
import org.netpreserve.evidence.store.ContentDigests;
import org.netpreserve.evidence.store.ContentStore;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WaybackEvidenceTest {
    @TempDir
    Path dir;

    private static WaybackEvidence.Options parse(String... args) throws WaybackEvidence.UsageException {
        return WaybackEvidence.parseArgs(args);
    }

    @Test
    void parsesCheckWithOptions() throws Exception {
        var options = parse("--pacing", "adaptive", "--concurrency", "4", "-s", "evidence", "-vv",
                "check", "jack/20", "https://twitter.com/jack/status/21");

        assertEquals("check", options.command());
        assertEquals(List.of("jack/20", "https://twitter.com/jack/status/21"), options.arguments());
        assertEquals(PacingProfile.ADAPTIVE, options.pacing());
        assertEquals(4, options.concurrency());
        assertEquals("evidence", options.store());
        assertEquals(2, options.verbosity());
        assertTrue(options.download());
    }

    @Test
    void parsesDeletedPosts() throws Exception {
        var options = parse("deleted-posts", "jack", "--limit", "10", "--report", "-c", "my.yaml",
                "--no-existence-check", "--all-captures");

        assertEquals("deleted-posts", options.command());
        assertEquals(List.of("jack"), options.arguments());
        assertEquals(10, options.limit());
        assertTrue(options.report());
        assertTrue(options.download());
        assertEquals(Path.of("my.yaml"), options.configFile());
        assertTrue(options.noExistenceCheck());
        assertTrue(options.allCaptures());
    }

    @Test
    void listingOnlyDoesNotDownload() throws Exception {
        assertFalse(parse("check", "jack/20").download());
    }

    @Test
    void helpReturnsNull() throws Exception {
        assertNull(parse("check", "--help"));
        assertNull(parse("-h"));
    }

    @Test
    void rejectsBadUsage() {
        assertThrows(WaybackEvidence.UsageException.class, () -> parse());
        assertThrows(WaybackEvidence.UsageException.class, () -> parse("frobnicate", "x"));
        assertThrows(WaybackEvidence.UsageException.class, () -> parse("deleted-posts"));
        assertThrows(WaybackEvidence.UsageException.class, () -> parse("deleted-posts", "a", "b"));
        assertThrows(WaybackEvidence.UsageException.class, () -> parse("check"));
        assertThrows(WaybackEvidence.UsageException.class, () -> parse("check", "jack/20", "--limit", "3"));
        assertThrows(WaybackEvidence.UsageException.class, () -> parse("check", "jack/20", "--concurrency", "0"));
        assertThrows(WaybackEvidence.UsageException.class, () -> parse("check", "jack/20", "--concurrency", "many"));
        assertThrows(WaybackEvidence.UsageException.class, () -> parse("check", "jack/20", "--pacing", "fast"));
        assertThrows(WaybackEvidence.UsageException.class, () -> parse("check", "jack/20", "--store"));
        assertThrows(WaybackEvidence.UsageException.class, () -> parse("check", "jack/20", "--bogus"));
    }

    @Test
    void optionsBecomeConfigOverrides() throws Exception {
        var loader = new ConfigLoader();
        ObjectNode overrides = WaybackEvidence.overrides(loader, parse("--pacing", "conservative",
                "--index-concurrency", "3", "--no-existence-check", "--store", "out", "check", "jack/1"));

        assertEquals("conservative", overrides.at("/pacing/profile").asText());
        assertEquals(3, overrides.at("/download/indexConcurrency").asInt());
        assertTrue(overrides.at("/download/concurrency").isMissingNode());
        assertFalse(overrides.at("/existenceCheck/enabled").asBoolean(true));
        assertEquals("out", overrides.at("/store/path").asText());

        var config = loader.load(null, overrides);
        assertEquals(PacingProfile.CONSERVATIVE, config.pacing().profile());
        assertEquals(1, config.download().concurrency());
        assertEquals(3, config.download().indexConcurrency());
        assertFalse(config.existenceCheck().enabled());
    }

    @Test
    void dumpsEffectiveConfig() {
        var out = new ByteArrayOutputStream();
        var err = new ByteArrayOutputStream();
        int status = WaybackEvidence.run(new String[]{"--dump-config", "--pacing", "adaptive"},
                new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));

        assertEquals(0, status);
        String dumped = out.toString(StandardCharsets.UTF_8);
        assertTrue(dumped.contains("adaptive"), dumped);
        assertTrue(dumped.contains("cooldownOnRateLimit"), dumped);
    }

    @Test
    void usageErrorsExitWithTwo() {
        var err = new ByteArrayOutputStream();
        int status = WaybackEvidence.run(new String[]{"check"}, System.out,
                new PrintStream(err, true, StandardCharsets.UTF_8));
        assertEquals(2, status);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("check needs at least one post identifier"));

        int badPost = WaybackEvidence.run(new String[]{"check", "not-a-post"}, System.out,
                new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8));
        assertEquals(2, badPost);
    }

    @Test
    void bareStatusIdsAreRejected() {
        var err = new ByteArrayOutputStream();
        int status = WaybackEvidence.run(new String[]{"check", "20"}, System.out,
                new PrintStream(err, true, StandardCharsets.UTF_8));
        assertEquals(2, status);
        assertTrue(err.toString(StandardCharsets.UTF_8).contains("SCREEN/20"));
    }

    @Test
    void verifyStoreTakesNoArguments() throws Exception {
        assertEquals("verify-store", parse("verify-store", "--store", "out").command());
        assertThrows(WaybackEvidence.UsageException.class, () -> parse("verify-store", "jack/20"));
        assertThrows(WaybackEvidence.UsageException.class, () -> parse("verify-store", "--limit", "2"));
    }

    @Test
    void verifyStoreReportsCorruptPayloads() throws Exception {
        Path storeDir = dir.resolve("store");
        byte[] good = "good".getBytes(StandardCharsets.UTF_8);
        byte[] bad = "bad".getBytes(StandardCharsets.UTF_8);
        String badDigest = ContentDigests.sha1(bad);
        Path badPath;
        try (var store = ContentStore.open(storeDir)) {
            store.put(ContentDigests.sha1(good), good);
            badPath = store.put(badDigest, bad);
        }

        var out = new ByteArrayOutputStream();
        String[] args = {"verify-store", "--store", storeDir.toString()};
        assertEquals(0, WaybackEvidence.run(args, new PrintStream(out, true, StandardCharsets.UTF_8), System.err));
        assertTrue(out.toString(StandardCharsets.UTF_8).contains("2 valid, 0 corrupt, 0 missing"));

        Files.write(badPath, new byte[]{1, 2, 3});
        out.reset();
        assertEquals(1, WaybackEvidence.run(args, new PrintStream(out, true, StandardCharsets.UTF_8), System.err));
        List<String> lines = out.toString(StandardCharsets.UTF_8).lines().toList();
        assertEquals(List.of("corrupt " + badDigest, "1 valid, 1 corrupt, 0 missing"), lines);
    }

    @Test
    void checksPostsAgainstTheArchive() throws Exception {
        try (var archive = new FakeArchive()) {
            var deleted = new PostId("alice", 1);
            var live = new PostId("alice", 2);
            archive.addCapture(deleted, "20200101000000", "<p>gone</p>");
            archive.addCapture(live, "20200102000000", "<p>here</p>");
            archive.setLive(deleted, false);
            Path config = dir.resolve("config.yaml");
            Files.writeString(config, "archive:\n  baseUrl: " + archive.baseUrl()
                    + "\n  retry:\n    maxAttempts: 2\n    baseDelay: 1ms\n    maxDelay: 5ms\n"
                    + "existenceCheck:\n  oembedUrl: " + archive.baseUrl() + "/oembed\n"
                    + "pacing:\n  default:\n    index: 0ms\n    content: 0ms\n");
            var out = new ByteArrayOutputStream();
            int status = WaybackEvidence.run(new String[]{"-c", config.toString(), "check", "alice/1", "alice/2"},
                    new PrintStream(out, true, StandardCharsets.UTF_8), System.err);

            assertEquals(0, status);
            assertEquals(List.of(archive.baseUrl() + "/web/20200101000000/https://twitter.com/alice/status/1"),
                    out.toString(StandardCharsets.UTF_8).lines().toList());
            assertEquals(0, archive.contentRequests());
            assertEquals(2, archive.oembedRequests());
        }
    }
}
