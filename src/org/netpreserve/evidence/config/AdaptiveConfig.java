package org.netpreserve.evidence.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.netpreserve.evidence.pacing.FailureClass;
import org.netpreserve.evidence.pacing.Surface;

import java.time.Duration;

/**
 * Tuning for the adaptive profile. Backoff reacts to a single throttling response while recovery needs a
 * sustained run of successes, so the delay does not flap back into the range that triggered the throttling.
 *
 * @param index              delay bounds for CDX queries
 * @param content            delay bounds for content downloads
 * @param backoffFactor      delay multiplier applied on throttling (greater than 1)
 * @param recoveryFactor     delay multiplier applied on sustained success (between 0 and 1)
 * @param sustain            how long since the last throttle or error before successes start recovering
 * @param errorThreshold     consecutive errors that count as backpressure
 * @param cooldownOnRateLimit   base time to hold all permits after a 429 or a block
 * @param cooldownOnServerError base time to hold all permits after a 5xx
 * @param cooldownOnDecode      base time to hold all permits after an unparseable response
 * @param cooldownOnTimeout     base time to hold all permits after a timeout or refused connection
 * @param cooldownOnOther       base time to hold all permits after any other failure
 * @param cooldownGrowth     cooldown multiplier per penalty level
 * @param maxCooldown        upper bound on any single cooldown
 * @param maxPenaltyLevel    number of escalation steps
 */
public record AdaptiveConfig(
        SurfaceLimits index,
        SurfaceLimits content,
        double backoffFactor,
        double recoveryFactor,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration sustain,
        int errorThreshold,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration cooldownOnRateLimit,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration cooldownOnServerError,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration cooldownOnDecode,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration cooldownOnTimeout,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration cooldownOnOther,
        int cooldownGrowth,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration maxCooldown,
        int maxPenaltyLevel) {

    public AdaptiveConfig {
        if (index == null || content == null) throw new IllegalArgumentException("index and content limits are required");
        if (!(backoffFactor > 1.0)) throw new IllegalArgumentException("backoffFactor must be greater than 1");
        if (!(recoveryFactor > 0.0 && recoveryFactor < 1.0)) {
            throw new IllegalArgumentException("recoveryFactor must be between 0 and 1");
        }
        if (recoveryFactor * backoffFactor <= 1.0) {
            throw new IllegalArgumentException("one recovery step must undo less than one backoff step");
        }
        FixedPacingConfig.requirePositive(sustain, "sustain");
        FixedPacingConfig.requirePositive(cooldownOnRateLimit, "cooldownOnRateLimit");
        FixedPacingConfig.requirePositive(cooldownOnServerError, "cooldownOnServerError");
        FixedPacingConfig.requirePositive(cooldownOnDecode, "cooldownOnDecode");
        FixedPacingConfig.requirePositive(cooldownOnTimeout, "cooldownOnTimeout");
        FixedPacingConfig.requirePositive(cooldownOnOther, "cooldownOnOther");
        FixedPacingConfig.requirePositive(maxCooldown, "maxCooldown");
        if (errorThreshold < 1) throw new IllegalArgumentException("errorThreshold must be at least 1");
        if (cooldownGrowth < 1) throw new IllegalArgumentException("cooldownGrowth must be at least 1");
        if (maxPenaltyLevel < 0) throw new IllegalArgumentException("maxPenaltyLevel must not be negative");
    }

    public SurfaceLimits limits(Surface surface) {
        return switch (surface) {
            case INDEX -> index;
            case CONTENT -> content;
        };
    }

    /**
     * Base cooldown for a failure of the given class, before escalation.
     */
    public Duration cooldown(FailureClass failureClass) {
        return switch (failureClass) {
            case RATE_LIMITED, BLOCKED -> cooldownOnRateLimit;
            case SERVER_ERROR -> cooldownOnServerError;
            case DECODE -> cooldownOnDecode;
            case TIMEOUT -> cooldownOnTimeout;
            case OTHER -> cooldownOnOther;
        };
    }
}
