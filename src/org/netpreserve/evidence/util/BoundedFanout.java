package org.netpreserve.evidence.util;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReferenceArray;
import java.util.function.Function;

/**
 * Applies an asynchronous function to a list of items with at most {@code limit} calls outstanding at once.
 * Results keep the order of the input list regardless of completion order.
 * <p>
 * A failed call is treated as fatal for the whole batch: no further items are started and the batch completes
 * exceptionally. After {@link #stop()} no further items are started either, but the batch still completes
 * normally, with the {@code skipped} value in place of every item that never started.
 */
public class BoundedFanout<T, R> {
    private final List<T> items;
    private final Function<T, CompletableFuture<R>> function;
    private final Function<T, R> skipped;
    private final Executor executor;
    private final AtomicInteger next = new AtomicInteger();
    private final AtomicInteger remaining;
    private final AtomicReferenceArray<R> results;
    private final CompletableFuture<List<R>> result = new CompletableFuture<>();
    private volatile boolean stopped;

    private BoundedFanout(List<T> items, Function<T, CompletableFuture<R>> function, Function<T, R> skipped,
                          Executor executor) {
        this.items = List.copyOf(items);
        this.function = function;
        this.skipped = skipped;
        this.executor = executor;
        this.remaining = new AtomicInteger(this.items.size());
        this.results = new AtomicReferenceArray<>(this.items.size());
    }

    /**
     * @param executor runs the completion callbacks that start the next item
     */
    public static <T, R> BoundedFanout<T, R> start(List<T> items, int limit, Function<T, CompletableFuture<R>> function,
                                                   Function<T, R> skipped, Executor executor) {
        if (limit < 1) throw new IllegalArgumentException("limit must be at least 1");
        var fanout = new BoundedFanout<>(items, function, skipped, executor);
        if (fanout.items.isEmpty()) {
            fanout.result.complete(List.of());
            return fanout;
        }
        int lanes = Math.min(limit, fanout.items.size());
        for (int i = 0; i < lanes; i++) {
            fanout.launchNext();
        }
        return fanout;
    }

    public CompletableFuture<List<R>> result() {
        return result;
    }

    /**
     * Stops starting new items. Items already started run to completion.
     */
    public void stop() {
        stopped = true;
        // drain anything not yet claimed by a lane so the batch can complete
        launchNext();
    }

    private void launchNext() {
        while (true) {
            int index = next.getAndIncrement();
            if (index >= items.size()) return;
            T item = items.get(index);
            if (stopped) {
                if (!result.isDone()) finish(index, skipped.apply(item));
                continue;
            }
            CompletableFuture<R> call;
            try {
                call = function.apply(item);
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }
            call.whenCompleteAsync((value, error) -> {
                if (error != null) {
                    stopped = true;
                    result.completeExceptionally(error instanceof CompletionException && error.getCause() != null
                            ? error.getCause() : error);
                    return;
                }
                finish(index, value);
                launchNext();
            }, executor);
            return;
        }
    }

    private void finish(int index, R value) {
        results.set(index, value);
        if (remaining.decrementAndGet() == 0) {
            var list = new ArrayList<R>(results.length());
            for (int i = 0; i < results.length(); i++) {
                list.add(results.get(i));
            }
            result.complete(list);
        }
    }
}
