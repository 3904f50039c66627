package org.netpreserve.evidence.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.evidence.pacing.Surface;

import java.time.Duration;

/**
 * Fixed inter-request delays for a non-adaptive profile.
 *
 * @param index   delay between CDX queries
 * @param content delay between content downloads
 */
public record FixedPacingConfig(
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration index,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration content) {

    public FixedPacingConfig {
        requireNonNegative(index, "index");
        requireNonNegative(content, "content");
    }

    public Duration delay(Surface surface) {
        return switch (surface) {
            case INDEX -> index;
            case CONTENT -> content;
        };
    }

    static void requireNonNegative(Duration duration, String name) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException(name + " must be a non-negative duration");
        }
    }

    /**
     * Multiplicative backoff can't grow a zero delay, so adaptive bounds and cooldowns must be strictly positive.
     */
    static void requirePositive(Duration duration, String name) {
        if (duration == null || duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be a positive duration");
        }
    }
}
