package org.netpreserve.evidence.pacing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Issues permits for one surface, spacing them by the current delay.
 *
 * <p>Permits are reserved in call order from a single "next permit" pointer, so after an idle period only one
 * permit is immediate and later callers queue behind it. Waiting callers don't hold a thread: the returned future
 * is completed by the scheduler when the reserved slot arrives. Subclasses decide how the delay reacts to outcome
 * events; they run under the controller's lock and must keep that critical section short.</p>
 *
 * <p>Readers such as the {@link Scoreboard} never take the lock. Every mutation republishes an immutable
 * {@link PacingSnapshot} through a volatile field.</p>
 */
public abstract class PacingController {
    private static final Logger log = LoggerFactory.getLogger(PacingController.class);
    private final Surface surface;
    private final PacingProfile profile;
    private final ScheduledExecutorService scheduler;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final OutcomeWindow window;
    private final Duration minDelay;
    private final Duration maxDelay;
    private Duration delay;
    private Instant nextPermitAt = Instant.EPOCH;
    private Instant cooldownUntil = Instant.EPOCH;
    private long permits;
    private volatile PacingSnapshot snapshot;

    protected PacingController(Surface surface, PacingProfile profile, Duration initialDelay, Duration minDelay,
                               Duration maxDelay, int windowSize, ScheduledExecutorService scheduler, Clock clock) {
        this.surface = surface;
        this.profile = profile;
        this.delay = initialDelay;
        this.minDelay = minDelay;
        this.maxDelay = maxDelay;
        this.window = new OutcomeWindow(windowSize);
        this.scheduler = scheduler;
        this.clock = clock;
        publish();
    }

    public Surface surface() {
        return surface;
    }

    public PacingProfile profile() {
        return profile;
    }

    public Instant now() {
        return clock.instant();
    }

    /**
     * Reserves the next permit. The future completes once the caller may issue its request. Cancelling it
     * abandons the permit.
     */
    public CompletableFuture<Permit> acquire() {
        var future = new CompletableFuture<Permit>();
        Instant now = clock.instant();
        Instant slot;
        lock.lock();
        try {
            slot = reserve(now);
        } finally {
            lock.unlock();
        }
        schedule(future, now, slot);
        return future;
    }

    /**
     * Blocking form of {@link #acquire()}.
     */
    public Permit awaitPermit() throws InterruptedException {
        var future = acquire();
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(false);
            throw e;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Permit scheduling failed", e.getCause());
        }
    }

    /**
     * Records the outcome of a completed request. Never blocks on I/O.
     */
    public void report(OutcomeEvent event) {
        if (event.surface() != surface) {
            throw new IllegalArgumentException("event for " + event.surface() + " reported to " + surface + " controller");
        }
        lock.lock();
        try {
            window.add(event);
            Duration before = delay;
            onOutcome(event);
            if (!delay.equals(before)) {
                log.debug("{} delay {}ms -> {}ms after {}", surface.label(), before.toMillis(), delay.toMillis(),
                        event.failureClass() != null ? event.failureClass().label() : event.outcome());
            }
            publish();
        } finally {
            lock.unlock();
        }
    }

    public PacingSnapshot snapshot() {
        return snapshot;
    }

    /**
     * Adjusts pacing state for a reported outcome. Called with the lock held.
     */
    protected abstract void onOutcome(OutcomeEvent event);

    /**
     * Escalation step included in snapshots. Called with the lock held.
     */
    protected int penaltyLevel() {
        return 0;
    }

    protected Duration delay() {
        return delay;
    }

    /**
     * Sets the delay, clamped to the controller's bounds.
     */
    protected void setDelay(Duration delay) {
        if (delay.compareTo(minDelay) < 0) delay = minDelay;
        if (delay.compareTo(maxDelay) > 0) delay = maxDelay;
        this.delay = delay;
    }

    protected Instant cooldownUntil() {
        return cooldownUntil;
    }

    /**
     * Holds all permits until the given instant. Never shortens an existing cooldown.
     */
    protected void holdUntil(Instant until) {
        if (until.isAfter(cooldownUntil)) cooldownUntil = until;
    }

    private Instant reserve(Instant now) {
        Instant slot = now;
        if (nextPermitAt.isAfter(slot)) slot = nextPermitAt;
        if (cooldownUntil.isAfter(slot)) slot = cooldownUntil;
        nextPermitAt = slot.plus(delay);
        return slot;
    }

    private void schedule(CompletableFuture<Permit> future, Instant now, Instant slot) {
        long waitNanos = Duration.between(now, slot).toNanos();
        if (waitNanos <= 0) {
            grant(future, slot);
            return;
        }
        ScheduledFuture<?> task = scheduler.schedule(() -> release(future, slot), waitNanos, TimeUnit.NANOSECONDS);
        future.whenComplete((permit, error) -> {
            if (future.isCancelled()) task.cancel(false);
        });
    }

    /**
     * Hands out a reserved permit unless a cooldown began while the caller was waiting, in which case the caller
     * is moved behind the cooldown.
     */
    private void release(CompletableFuture<Permit> future, Instant slot) {
        if (future.isDone()) return;
        Instant now = clock.instant();
        Instant rescheduled = null;
        lock.lock();
        try {
            if (cooldownUntil.isAfter(now) && cooldownUntil.isAfter(slot)) {
                rescheduled = reserve(now);
            }
        } finally {
            lock.unlock();
        }
        if (rescheduled != null) {
            schedule(future, now, rescheduled);
        } else {
            grant(future, slot);
        }
    }

    /**
     * Completes the caller's future. Permits are counted here rather than on reservation because a reservation
     * that a cooldown pushes back is reserved again.
     */
    private void grant(CompletableFuture<Permit> future, Instant slot) {
        if (!future.complete(new Permit(surface, slot))) return;
        lock.lock();
        try {
            permits++;
            publish();
        } finally {
            lock.unlock();
        }
    }

    private void publish() {
        snapshot = new PacingSnapshot(surface, profile, delay, minDelay, maxDelay, cooldownUntil,
                penaltyLevel(), window.count(Outcome.SUCCESS), window.count(Outcome.THROTTLED),
                window.count(Outcome.ERROR), window.failureCounts(), window.total(), permits);
    }
}
