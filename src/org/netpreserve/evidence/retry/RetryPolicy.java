package org.netpreserve.evidence.retry;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.evidence.config.DurationDeserializer;

import java.time.Duration;
import java.util.Random;

/**
 * Bounded exponential backoff.
 *
 * @param maxAttempts total attempts including the first
 * @param baseDelay   wait after the first failed attempt
 * @param maxDelay    cap on the exponential wait before jitter
 * @param jitter      fraction of the wait added at random (0.5 adds up to 50%)
 */
public record RetryPolicy(
        int maxAttempts,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration baseDelay,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration maxDelay,
        double jitter) {

    public static final RetryPolicy DEFAULT = new RetryPolicy(8, Duration.ofMillis(250), Duration.ofSeconds(30), 0.5);

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be at least 1");
        if (baseDelay == null || baseDelay.isNegative()) throw new IllegalArgumentException("baseDelay must not be negative");
        if (maxDelay == null || maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must be at least baseDelay");
        }
        if (jitter < 0) throw new IllegalArgumentException("jitter must not be negative");
    }

    /**
     * Wait before the attempt following failed attempt number {@code attempt} (1-based).
     */
    public Duration backoff(int attempt, Random random) {
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        long wait = base;
        for (int i = 1; i < attempt && wait < cap; i++) {
            wait *= 2;
        }
        wait = Math.min(wait, cap);
        long extra = jitter > 0 ? (long) (wait * jitter * random.nextDouble()) : 0;
        return Duration.ofMillis(wait + extra);
    }
}
