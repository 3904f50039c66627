package org.netpreserve.evidence.pacing;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable point-in-time copy of a controller's state.
 *
 * @param surface       the surface the controller paces
 * @param profile       profile in effect
 * @param delay         current inter-request delay
 * @param minDelay      smallest delay the controller may use
 * @param maxDelay      largest delay the controller may use
 * @param cooldownUntil permits are held until this instant
 * @param penaltyLevel  current escalation step (adaptive only)
 * @param successes     successes in the trailing window
 * @param throttled     throttling responses in the trailing window
 * @param errors        errors in the trailing window
 * @param failures      failures in the trailing window by class, throttling included
 * @param totalEvents   outcome events reported since startup
 * @param permits       permits granted since startup
 */
public record PacingSnapshot(
        Surface surface,
        PacingProfile profile,
        Duration delay,
        Duration minDelay,
        Duration maxDelay,
        Instant cooldownUntil,
        int penaltyLevel,
        int successes,
        int throttled,
        int errors,
        Map<FailureClass, Integer> failures,
        long totalEvents,
        long permits) {

    public int failures(FailureClass failureClass) {
        return failures.getOrDefault(failureClass, 0);
    }

    public Duration cooldownRemaining(Instant now) {
        if (!now.isBefore(cooldownUntil)) return Duration.ZERO;
        return Duration.between(now, cooldownUntil);
    }
}
