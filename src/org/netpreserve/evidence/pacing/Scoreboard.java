package org.netpreserve.evidence.pacing;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Read-only view over the pacing controllers. Reading only copies each controller's latest published snapshot so it
 * never waits on, pauses or alters the request path.
 */
public class Scoreboard {
    private final List<PacingController> controllers;

    public Scoreboard(Collection<PacingController> controllers) {
        this.controllers = List.copyOf(controllers);
    }

    public List<PacingSnapshot> snapshot() {
        var snapshots = new ArrayList<PacingSnapshot>(controllers.size());
        for (PacingController controller : controllers) {
            snapshots.add(controller.snapshot());
        }
        return snapshots;
    }

    /**
     * Renders the current snapshots as a table. Cooldowns are measured against each controller's own clock.
     */
    public String format() {
        var sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%-8s %-13s %9s %9s %9s %9s %7s %8s %9s %6s",
                "surface", "profile", "delay", "floor", "ceiling", "cooldown", "penalty",
                "success", "throttled", "error"));
        for (FailureClass failureClass : FailureClass.values()) {
            sb.append(String.format(Locale.ROOT, " %7s", failureClass.label()));
        }
        sb.append(String.format(Locale.ROOT, " %8s%n", "events"));
        for (PacingController controller : controllers) {
            row(sb, controller.snapshot(), controller.now());
        }
        return sb.toString();
    }

    private static void row(StringBuilder sb, PacingSnapshot s, Instant now) {
        sb.append(String.format(Locale.ROOT, "%-8s %-13s %9s %9s %9s %9s %7d %8d %9d %6d",
                s.surface().label(), s.profile().label(), millis(s.delay()), millis(s.minDelay()),
                millis(s.maxDelay()), millis(s.cooldownRemaining(now)), s.penaltyLevel(), s.successes(),
                s.throttled(), s.errors()));
        for (FailureClass failureClass : FailureClass.values()) {
            sb.append(String.format(Locale.ROOT, " %7d", s.failures(failureClass)));
        }
        sb.append(String.format(Locale.ROOT, " %8d%n", s.totalEvents()));
    }

    private static String millis(Duration duration) {
        return duration.toMillis() + "ms";
    }
}
