package org.netpreserve.evidence.retry;

import org.jetbrains.annotations.Nullable;
import org.netpreserve.evidence.pacing.OutcomeEvent;
import org.netpreserve.evidence.pacing.PacingController;
import org.netpreserve.evidence.pacing.Permit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs an asynchronous network operation with bounded exponential backoff.
 * <p>
 * Every attempt waits for a permit from the given pacing controller and reports exactly one outcome event back to
 * it, so throttling still slows the surface down even when a later attempt succeeds. Cancelling the returned future
 * abandons any permit still pending and stops further attempts.
 */
public class Retrier {
    private static final Logger log = LoggerFactory.getLogger(Retrier.class);
    private final RetryPolicy policy;
    private final FailureClassifier classifier;
    private final Random random;

    public Retrier(RetryPolicy policy) {
        this(policy, FailureClassifier.DEFAULT, new Random());
    }

    public Retrier(RetryPolicy policy, FailureClassifier classifier, Random random) {
        this.policy = policy;
        this.classifier = classifier;
        this.random = random;
    }

    public <T> CompletableFuture<T> call(@Nullable PacingController controller,
                                         Supplier<CompletableFuture<T>> operation) {
        var result = new CompletableFuture<T>();
        attempt(result, controller, operation, 1);
        return result;
    }

    private <T> void attempt(CompletableFuture<T> result, @Nullable PacingController controller,
                             Supplier<CompletableFuture<T>> operation, int attempt) {
        if (result.isDone()) return;
        CompletableFuture<Permit> permit = controller == null
                ? CompletableFuture.completedFuture(null)
                : controller.acquire();
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) permit.cancel(false);
        });
        permit.whenComplete((p, permitError) -> {
            if (result.isDone()) return;
            if (permitError != null) {
                result.completeExceptionally(unwrap(permitError));
                return;
            }
            long start = System.nanoTime();
            CompletableFuture<T> call;
            try {
                call = operation.get();
            } catch (RuntimeException e) {
                call = CompletableFuture.failedFuture(e);
            }
            call.whenComplete((value, error) -> {
                Duration latency = Duration.ofNanos(System.nanoTime() - start);
                Throwable failure = error == null ? null : unwrap(error);
                Verdict verdict = failure == null ? Verdict.SUCCESS : classifier.classify(failure);
                if (controller != null) {
                    controller.report(new OutcomeEvent(controller.surface(), controller.now(), verdict.outcome(),
                            latency, verdict.failureClass()));
                }
                if (failure == null) {
                    result.complete(value);
                } else if (!verdict.retryable()) {
                    result.completeExceptionally(failure);
                } else if (attempt >= policy.maxAttempts()) {
                    result.completeExceptionally(new RetriesExhaustedException(attempt, failure));
                } else {
                    Duration wait = policy.backoff(attempt, random);
                    log.debug("Attempt {} failed ({}), retrying in {}ms", attempt, failure.toString(),
                            wait.toMillis());
                    CompletableFuture.delayedExecutor(wait.toMillis(), TimeUnit.MILLISECONDS)
                            .execute(() -> attempt(result, controller, operation, attempt + 1));
                }
            });
        });
    }

    static Throwable unwrap(Throwable throwable) {
        while ((throwable instanceof CompletionException || throwable instanceof ExecutionException)
               && throwable.getCause() != null) {
            throwable = throwable.getCause();
        }
        return throwable;
    }
}
