package org.netpreserve.evidence.pacing;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ScoreboardTest {
    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor();
    private final MutableClock clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

    @AfterEach
    void shutdown() {
        scheduler.shutdownNow();
    }

    @Test
    void snapshotReflectsEachSurfaceIndependently() {
        var index = new FixedPacingController(Surface.INDEX, PacingProfile.DEFAULT, Duration.ofSeconds(1), 8,
                scheduler, clock);
        var content = new AdaptivePacingController(Surface.CONTENT, AdaptivePacingControllerTest.config(), 8,
                scheduler, clock);
        var scoreboard = new Scoreboard(List.of(index, content));

        content.report(new OutcomeEvent(Surface.CONTENT, clock.instant(), Outcome.THROTTLED, Duration.ZERO));
        index.report(new OutcomeEvent(Surface.INDEX, clock.instant(), Outcome.SUCCESS, Duration.ZERO));

        List<PacingSnapshot> snapshots = scoreboard.snapshot();
        assertEquals(Surface.INDEX, snapshots.get(0).surface());
        assertEquals(Duration.ofSeconds(1), snapshots.get(0).delay());
        assertEquals(1, snapshots.get(0).successes());
        assertEquals(0, snapshots.get(0).throttled());

        assertEquals(Surface.CONTENT, snapshots.get(1).surface());
        assertEquals(Duration.ofMillis(3000), snapshots.get(1).delay());
        assertEquals(1, snapshots.get(1).throttled());
        assertEquals(1, snapshots.get(1).penaltyLevel());
    }

    @Test
    void formatsOneRowPerSurface() {
        var content = new AdaptivePacingController(Surface.CONTENT, AdaptivePacingControllerTest.config(), 8,
                scheduler, clock);
        content.report(new OutcomeEvent(Surface.CONTENT, clock.instant(), Outcome.THROTTLED, Duration.ZERO));
        clock.advance(Duration.ofMinutes(4));

        String table = new Scoreboard(List.of(content)).format();
        String[] lines = table.split("\n");
        assertEquals(2, lines.length);
        assertTrue(lines[0].startsWith("surface"));
        assertTrue(lines[0].contains("cooldown"));
        assertTrue(lines[0].contains("429") && lines[0].contains("decode") && lines[0].contains("timeout"), lines[0]);
        assertTrue(lines[1].startsWith("content"));
        assertTrue(lines[1].contains("adaptive"));
        assertTrue(lines[1].contains("3000ms"));
        // the controller's clock, not wall time, decides how much cooldown is left
        assertTrue(lines[1].contains("360000ms"), lines[1]);
    }

    @Test
    void countsFailuresByClass() {
        var index = new FixedPacingController(Surface.INDEX, PacingProfile.DEFAULT, Duration.ofSeconds(1), 8,
                scheduler, clock);
        index.report(new OutcomeEvent(Surface.INDEX, clock.instant(), Outcome.ERROR, Duration.ZERO,
                FailureClass.DECODE));
        index.report(new OutcomeEvent(Surface.INDEX, clock.instant(), Outcome.ERROR, Duration.ZERO,
                FailureClass.DECODE));
        index.report(new OutcomeEvent(Surface.INDEX, clock.instant(), Outcome.THROTTLED, Duration.ZERO,
                FailureClass.SERVER_ERROR));

        PacingSnapshot snapshot = new Scoreboard(List.of(index)).snapshot().get(0);
        assertEquals(2, snapshot.errors());
        assertEquals(1, snapshot.throttled());
        assertEquals(2, snapshot.failures(FailureClass.DECODE));
        assertEquals(1, snapshot.failures(FailureClass.SERVER_ERROR));
        assertEquals(0, snapshot.failures(FailureClass.RATE_LIMITED));
    }

    @Test
    void diagnosticsListenerPrintsOnRequest() throws Exception {
        var index = new FixedPacingController(Surface.INDEX, PacingProfile.CONSERVATIVE, Duration.ofSeconds(2), 8,
                scheduler, clock);
        var buffer = new ByteArrayOutputStream();
        try (var listener = new DiagnosticsListener(new Scoreboard(List.of(index)),
                new PrintStream(buffer, true, StandardCharsets.UTF_8))) {
            listener.requestDump();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (!buffer.toString(StandardCharsets.UTF_8).contains("2000ms") && System.nanoTime() < deadline) {
                Thread.sleep(10);
            }
        }
        String output = buffer.toString(StandardCharsets.UTF_8);
        assertTrue(output.contains("conservative"), output);
        assertTrue(output.contains("2000ms"), output);
    }
}
