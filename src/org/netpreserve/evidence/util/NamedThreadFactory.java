package org.netpreserve.evidence.util;

import org.jetbrains.annotations.NotNull;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Daemon threads named after the pool they belong to, numbered from 1 when the pool has more than one.
 */
public class NamedThreadFactory implements ThreadFactory {
    private final String name;
    private final AtomicInteger counter = new AtomicInteger();

    public NamedThreadFactory(String name) {
        this.name = name;
    }

    @Override
    public Thread newThread(@NotNull Runnable r) {
        int n = counter.incrementAndGet();
        Thread thread = new Thread(r, n == 1 ? name : name + "-" + n);
        thread.setDaemon(true);
        return thread;
    }
}
