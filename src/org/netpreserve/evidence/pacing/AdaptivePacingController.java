package org.netpreserve.evidence.pacing;

import org.netpreserve.evidence.config.AdaptiveConfig;
import org.netpreserve.evidence.config.SurfaceLimits;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Delay that backs off multiplicatively as soon as the archive pushes back and recovers in small steps only after
 * a sustained period without trouble.
 *
 * <ul>
 *     <li>Throttled: delay &times; backoffFactor, then hold all permits for a cooldown that grows with repeated
 *     throttling. The base cooldown depends on the failure class: a 429 holds far longer than a timeout.</li>
 *     <li>Error: the same once {@code errorThreshold} errors arrive in a row, with the cooldown of the last
 *     error's class.</li>
 *     <li>Success: delay &times; recoveryFactor, but only outside a cooldown and once {@code sustain} has passed
 *     since the last throttle or error. Each such success also lowers the penalty level by one.</li>
 * </ul>
 */
public class AdaptivePacingController extends PacingController {
    private static final Logger log = LoggerFactory.getLogger(AdaptivePacingController.class);
    private final AdaptiveConfig config;
    private Instant lastDangerAt;
    private int consecutiveErrors;
    private int penaltyLevel;

    public AdaptivePacingController(Surface surface, AdaptiveConfig config, int windowSize,
                                    ScheduledExecutorService scheduler, Clock clock) {
        this(surface, config, config.limits(surface), windowSize, scheduler, clock);
    }

    private AdaptivePacingController(Surface surface, AdaptiveConfig config, SurfaceLimits limits, int windowSize,
                                     ScheduledExecutorService scheduler, Clock clock) {
        super(surface, PacingProfile.ADAPTIVE, limits.initial(), limits.floor(), limits.ceiling(), windowSize,
                scheduler, clock);
        this.config = config;
    }

    @Override
    protected void onOutcome(OutcomeEvent event) {
        Instant now = event.timestamp();
        switch (event.outcome()) {
            case SUCCESS -> {
                consecutiveErrors = 0;
                if (now.isBefore(cooldownUntil())) return;
                if (lastDangerAt != null && Duration.between(lastDangerAt, now).compareTo(config.sustain()) < 0) return;
                if (penaltyLevel > 0) penaltyLevel--;
                setDelay(scale(delay(), config.recoveryFactor()));
            }
            case THROTTLED -> {
                lastDangerAt = now;
                consecutiveErrors = 0;
                backoff(now, event.failureClass());
            }
            case ERROR -> {
                lastDangerAt = now;
                if (++consecutiveErrors >= config.errorThreshold()) {
                    consecutiveErrors = 0;
                    backoff(now, event.failureClass());
                }
            }
        }
    }

    private void backoff(Instant now, FailureClass failureClass) {
        setDelay(scale(delay(), config.backoffFactor()));
        penaltyLevel = Math.min(penaltyLevel + 1, config.maxPenaltyLevel());
        Duration cooldown = escalate(config.cooldown(failureClass), penaltyLevel);
        holdUntil(now.plus(cooldown));
        log.info("Backing off {} requests after {}: delay {}ms, holding for {}s (penalty level {})",
                surface().label(), failureClass.label(), delay().toMillis(), cooldown.toSeconds(), penaltyLevel);
    }

    /**
     * base &times; growth<sup>level - 1</sup>, capped at the configured maximum.
     */
    Duration escalate(Duration base, int level) {
        double nanos = base.toNanos();
        for (int i = 1; i < level && nanos < config.maxCooldown().toNanos(); i++) {
            nanos *= config.cooldownGrowth();
        }
        long capped = (long) Math.min(nanos, config.maxCooldown().toNanos());
        return Duration.ofNanos(capped);
    }

    @Override
    protected int penaltyLevel() {
        return penaltyLevel;
    }

    private static Duration scale(Duration duration, double factor) {
        double nanos = duration.toNanos() * factor;
        if (nanos >= Long.MAX_VALUE) return Duration.ofNanos(Long.MAX_VALUE);
        return Duration.ofNanos(Math.round(nanos));
    }
}
