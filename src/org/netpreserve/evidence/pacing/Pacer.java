package org.netpreserve.evidence.pacing;

import org.netpreserve.evidence.config.PacingConfig;
import org.netpreserve.evidence.util.NamedThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Owns one pacing controller per surface and the scheduler that releases their permits.
 */
public class Pacer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(Pacer.class);
    private final PacingProfile profile;
    private final Map<Surface, PacingController> controllers;
    private final ScheduledExecutorService scheduler;
    private final Scoreboard scoreboard;

    private Pacer(PacingProfile profile, Map<Surface, PacingController> controllers,
                  ScheduledExecutorService scheduler) {
        this.profile = profile;
        this.controllers = controllers;
        this.scheduler = scheduler;
        this.scoreboard = new Scoreboard(controllers.values());
    }

    public static Pacer create(PacingConfig config) {
        return create(config, Clock.systemUTC());
    }

    public static Pacer create(PacingConfig config, Clock clock) {
        var executor = new ScheduledThreadPoolExecutor(1, new NamedThreadFactory("pacer"));
        executor.setRemoveOnCancelPolicy(true);
        ScheduledExecutorService scheduler = Executors.unconfigurableScheduledExecutorService(executor);
        var controllers = new EnumMap<Surface, PacingController>(Surface.class);
        for (Surface surface : Surface.values()) {
            controllers.put(surface, createController(config, surface, scheduler, clock));
        }
        log.info("Pacing profile {}", config.profile().label());
        return new Pacer(config.profile(), controllers, scheduler);
    }

    static PacingController createController(PacingConfig config, Surface surface,
                                             ScheduledExecutorService scheduler, Clock clock) {
        PacingProfile profile = config.profile();
        if (profile == PacingProfile.ADAPTIVE) {
            return new AdaptivePacingController(surface, config.adaptive(), config.windowSize(), scheduler, clock);
        }
        return new FixedPacingController(surface, profile, config.fixed(profile).delay(surface),
                config.windowSize(), scheduler, clock);
    }

    public PacingProfile profile() {
        return profile;
    }

    public PacingController controller(Surface surface) {
        return controllers.get(surface);
    }

    public Scoreboard scoreboard() {
        return scoreboard;
    }

    /**
     * Stops the permit scheduler. Permits still waiting are never released.
     */
    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
