package org.netpreserve.evidence.pacing;

import java.time.Instant;

/**
 * The right to issue the next request on a surface.
 *
 * @param surface   the surface the permit was issued for
 * @param slot      the instant the request was scheduled for
 */
public record Permit(Surface surface, Instant slot) {
}
