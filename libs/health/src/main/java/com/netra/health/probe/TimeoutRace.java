package com.netra.health.probe;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Races an asynchronous operation against a timer.
 * <p>
 * The race always completes normally with a {@link ProbeOutcome}; errors and timeouts are
 * returned as values. When the timer wins, or the race itself is cancelled, the operation
 * is cancelled.
 */
public final class TimeoutRace {

    private TimeoutRace() {
    }

    /**
     * Starts the race.
     *
     * @param operation the in-flight operation
     * @param timeout   time bound for the operation
     * @param <T>       operation result type
     * @return a future completing with the first of: value, failure, timeout
     */
    public static <T> CompletableFuture<ProbeOutcome<T>> race(CompletableFuture<T> operation, Duration timeout) {
        if (operation == null) {
            throw new IllegalArgumentException("operation must not be null");
        }
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        CompletableFuture<ProbeOutcome<T>> race = operation
                .handle((value, error) -> error == null
                        ? ProbeOutcome.success(value)
                        : ProbeOutcome.<T>failure(unwrap(error)))
                .completeOnTimeout(ProbeOutcome.timeout(), timeout.toMillis(), TimeUnit.MILLISECONDS);
        race.whenComplete((outcome, error) -> {
            if (error != null || (outcome != null && outcome.timedOut())) {
                operation.cancel(true);
            }
        });
        return race;
    }

    /**
     * Cancels {@code upstream} whenever {@code downstream} is cancelled, so cancelling a
     * dependent stage reaches the work it depends on.
     */
    public static void propagateCancellation(CompletableFuture<?> downstream, CompletableFuture<?> upstream) {
        downstream.whenComplete((ignored, error) -> {
            if (downstream.isCancelled()) {
                upstream.cancel(true);
            }
        });
    }

    /**
     * Strips {@link CompletionException} and {@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
