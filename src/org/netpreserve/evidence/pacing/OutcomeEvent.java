package org.netpreserve.evidence.pacing;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;

/**
 * The result of one completed request, fed back to the controller of its surface.
 *
 * @param failureClass what went wrong, null on success
 */
public record OutcomeEvent(
        @NotNull Surface surface,
        @NotNull Instant timestamp,
        @NotNull Outcome outcome,
        @NotNull Duration latency,
        @Nullable FailureClass failureClass) {

    public OutcomeEvent {
        if (outcome == Outcome.SUCCESS) {
            failureClass = null;
        } else if (failureClass == null) {
            failureClass = outcome == Outcome.THROTTLED ? FailureClass.RATE_LIMITED : FailureClass.OTHER;
        }
    }

    /**
     * An event with the failure class implied by the outcome.
     */
    public OutcomeEvent(Surface surface, Instant timestamp, Outcome outcome, Duration latency) {
        this(surface, timestamp, outcome, latency, null);
    }
}
