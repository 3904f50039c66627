package org.netpreserve.evidence.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.netpreserve.evidence.pacing.PacingProfile;

/**
 * Request pacing for the two archive surfaces.
 *
 * @param profile      which profile is in effect for this run
 * @param windowSize   number of recent outcome events kept per surface for diagnostics
 * @param conservative delays for the conservative profile
 * @param standard     delays for the default profile
 * @param adaptive     tuning for the adaptive profile
 */
public record PacingConfig(
        PacingProfile profile,
        int windowSize,
        FixedPacingConfig conservative,
        @JsonProperty("default")
        FixedPacingConfig standard,
        AdaptiveConfig adaptive) {

    public PacingConfig {
        if (profile == null) profile = PacingProfile.DEFAULT;
        if (windowSize <= 0) throw new IllegalArgumentException("windowSize must be positive");
    }

    public FixedPacingConfig fixed(PacingProfile profile) {
        return switch (profile) {
            case CONSERVATIVE -> conservative;
            case DEFAULT -> standard;
            case ADAPTIVE -> throw new IllegalArgumentException("the adaptive profile has no fixed delays");
        };
    }

    public PacingConfig withProfile(PacingProfile profile) {
        return new PacingConfig(profile, windowSize, conservative, standard, adaptive);
    }
}
