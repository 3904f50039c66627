package org.netpreserve.evidence.pacing;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PacingProfile {
    /** Large fixed delay, no adaptation. */
    CONSERVATIVE,
    /** Moderate fixed delay, no adaptation. */
    DEFAULT,
    /** Dynamic delay with hysteresis (fast backoff, slow recovery). */
    ADAPTIVE;

    @JsonCreator
    public static PacingProfile parse(String value) {
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown pacing profile '" + value
                                               + "' (expected conservative, default or adaptive)");
        }
    }

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
