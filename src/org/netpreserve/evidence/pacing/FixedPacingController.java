package org.netpreserve.evidence.pacing;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Constant delay. Outcome events only feed the diagnostic window.
 */
public class FixedPacingController extends PacingController {
    public FixedPacingController(Surface surface, PacingProfile profile, Duration delay, int windowSize,
                                 ScheduledExecutorService scheduler, Clock clock) {
        super(surface, profile, delay, delay, delay, windowSize, scheduler, clock);
    }

    @Override
    protected void onOutcome(OutcomeEvent event) {
    }
}
