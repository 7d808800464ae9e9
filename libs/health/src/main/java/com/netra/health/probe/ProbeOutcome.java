package com.netra.health.probe;

/**
 * Result of racing a probe operation against its time bound: exactly one of a value, a
 * failure, or a timeout.
 *
 * @param value    the operation's result when it succeeded
 * @param failure  the operation's error when it failed
 * @param timedOut true when the time bound elapsed first
 * @param <T>      operation result type
 */
public record ProbeOutcome<T>(T value, Throwable failure, boolean timedOut) {

    public static <T> ProbeOutcome<T> success(T value) {
        return new ProbeOutcome<>(value, null, false);
    }

    public static <T> ProbeOutcome<T> failure(Throwable failure) {
        if (failure == null) {
            throw new IllegalArgumentException("failure must not be null");
        }
        return new ProbeOutcome<>(null, failure, false);
    }

    public static <T> ProbeOutcome<T> timeout() {
        return new ProbeOutcome<>(null, null, true);
    }

    /** Returns true when the operation completed normally before the time bound. */
    public boolean succeeded() {
        return !timedOut && failure == null;
    }
}
