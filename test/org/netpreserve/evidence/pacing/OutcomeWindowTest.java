package org.netpreserve.evidence.pacing;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class OutcomeWindowTest {
    private static OutcomeEvent event(Outcome outcome) {
        return new OutcomeEvent(Surface.INDEX, Instant.EPOCH, outcome, Duration.ZERO);
    }

    @Test
    void evictsTheOldestEventOnceFull() {
        var window = new OutcomeWindow(4);
        window.add(event(Outcome.THROTTLED));
        window.add(event(Outcome.ERROR));
        for (int i = 0; i < 3; i++) {
            window.add(event(Outcome.SUCCESS));
        }
        assertEquals(4, window.size());
        assertEquals(0, window.count(Outcome.THROTTLED));
        assertEquals(1, window.count(Outcome.ERROR));
        assertEquals(3, window.count(Outcome.SUCCESS));
        assertEquals(5, window.total());

        window.add(event(Outcome.SUCCESS));
        assertEquals(0, window.count(Outcome.ERROR));
        assertEquals(4, window.count(Outcome.SUCCESS));
        assertEquals(6, window.total());
    }

    @Test
    void countsFailuresByClassAndForgetsEvictedOnes() {
        var window = new OutcomeWindow(3);
        window.add(new OutcomeEvent(Surface.INDEX, Instant.EPOCH, Outcome.ERROR, Duration.ZERO, FailureClass.DECODE));
        window.add(new OutcomeEvent(Surface.INDEX, Instant.EPOCH, Outcome.ERROR, Duration.ZERO, FailureClass.TIMEOUT));
        window.add(event(Outcome.THROTTLED));
        assertEquals(1, window.count(FailureClass.DECODE));
        assertEquals(1, window.count(FailureClass.TIMEOUT));
        assertEquals(1, window.count(FailureClass.RATE_LIMITED));
        assertEquals(2, window.count(Outcome.ERROR));

        window.add(event(Outcome.SUCCESS));
        assertEquals(0, window.count(FailureClass.DECODE));
        assertEquals(0, window.failureCounts().get(FailureClass.DECODE).intValue());
        assertEquals(1, window.failureCounts().get(FailureClass.TIMEOUT).intValue());
    }

    @Test
    void rejectsEmptyCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new OutcomeWindow(0));
    }
}
