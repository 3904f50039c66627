package org.netpreserve.evidence.config;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import java.time.Duration;

/**
 * Delay bounds for one surface under the adaptive profile.
 *
 * @param initial delay at startup
 * @param floor   smallest delay recovery may reach
 * @param ceiling largest delay backoff may reach
 */
public record SurfaceLimits(
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration initial,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration floor,
        @JsonDeserialize(using = DurationDeserializer.class)
        Duration ceiling) {

    public SurfaceLimits {
        FixedPacingConfig.requirePositive(initial, "initial");
        FixedPacingConfig.requirePositive(floor, "floor");
        FixedPacingConfig.requirePositive(ceiling, "ceiling");
        if (floor.compareTo(ceiling) > 0) throw new IllegalArgumentException("floor must not exceed ceiling");
        if (initial.compareTo(floor) < 0 || initial.compareTo(ceiling) > 0) {
            throw new IllegalArgumentException("initial must lie between floor and ceiling");
        }
    }
}
