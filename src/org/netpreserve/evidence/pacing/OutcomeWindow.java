package org.netpreserve.evidence.pacing;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Fixed-capacity ring buffer of the most recent outcome events. The oldest event is evicted on insert once full.
 * Not thread-safe; guarded by the owning controller's lock.
 */
class OutcomeWindow {
    private final OutcomeEvent[] events;
    private final int[] counts = new int[Outcome.values().length];
    private final int[] failureCounts = new int[FailureClass.values().length];
    private int next;
    private int size;
    private long total;

    OutcomeWindow(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        this.events = new OutcomeEvent[capacity];
    }

    void add(OutcomeEvent event) {
        OutcomeEvent evicted = events[next];
        if (evicted != null) {
            counts[evicted.outcome().ordinal()]--;
            if (evicted.failureClass() != null) failureCounts[evicted.failureClass().ordinal()]--;
        }
        events[next] = event;
        counts[event.outcome().ordinal()]++;
        if (event.failureClass() != null) failureCounts[event.failureClass().ordinal()]++;
        next = (next + 1) % events.length;
        if (size < events.length) size++;
        total++;
    }

    int count(Outcome outcome) {
        return counts[outcome.ordinal()];
    }

    int count(FailureClass failureClass) {
        return failureCounts[failureClass.ordinal()];
    }

    /**
     * Per-class failure counts, in {@link FailureClass} order.
     */
    Map<FailureClass, Integer> failureCounts() {
        var map = new EnumMap<FailureClass, Integer>(FailureClass.class);
        for (FailureClass failureClass : FailureClass.values()) {
            map.put(failureClass, failureCounts[failureClass.ordinal()]);
        }
        return Collections.unmodifiableMap(map);
    }

    int size() {
        return size;
    }

    /**
     * Events ever added, including evicted ones.
     */
    long total() {
        return total;
    }
}
