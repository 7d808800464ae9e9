package com.netra.health.probe;

import com.netra.health.ServiceHealthRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.sql.SQLTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;

/**
 * Skeleton shared by the dependency probes.
 * <p>
 * A probe run has three steps: an optional {@link #precheck()} that can answer without
 * touching the network (missing settings, missing client library), the {@link #execute}
 * operation raced against the timeout by {@link TimeoutRace}, and {@link #classify} of a
 * successful result. Timeouts and failures are turned into {@code failed} records here,
 * so subclasses only deal with the happy path.
 *
 * @param <T> result type of the network operation
 */
public abstract class AbstractHealthProbe<T> implements HealthProbe {

    private static final Logger log = LoggerFactory.getLogger(AbstractHealthProbe.class);

    /** Detail key carrying the {@link ProbeErrorKind} tag of a failed record. */
    public static final String DETAIL_ERROR_KIND = "error_kind";

    /** Detail key carrying the simple class name of the error that failed the probe. */
    public static final String DETAIL_EXCEPTION_TYPE = "exception_type";

    /** Detail key for slow-response and memory-pressure warnings. */
    public static final String DETAIL_WARNING = "warning";

    protected final Clock clock;
    protected final ErrorSanitizer sanitizer;
    private final LongSupplier nanoTicker;

    /**
     * @param clock      source of {@code checked_at} timestamps
     * @param nanoTicker monotonic time source used to measure response times
     */
    protected AbstractHealthProbe(Clock clock, LongSupplier nanoTicker) {
        if (clock == null || nanoTicker == null) {
            throw new IllegalArgumentException("clock and nanoTicker must not be null");
        }
        this.clock = clock;
        this.nanoTicker = nanoTicker;
        this.sanitizer = new ErrorSanitizer();
    }

    @Override
    public final CompletableFuture<ServiceHealthRecord> probe(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        Optional<ServiceHealthRecord> answered = precheck();
        if (answered.isPresent()) {
            return CompletableFuture.completedFuture(answered.get());
        }

        long start = nanoTicker.getAsLong();
        CompletableFuture<T> operation;
        try {
            operation = execute(timeout);
        } catch (RuntimeException e) {
            operation = CompletableFuture.failedFuture(e);
        }

        CompletableFuture<ProbeOutcome<T>> race = TimeoutRace.race(operation, timeout);
        CompletableFuture<ServiceHealthRecord> result =
                race.thenApply(outcome -> toRecord(outcome, elapsedMillis(start), timeout));
        TimeoutRace.propagateCancellation(result, race);
        return result;
    }

    /**
     * Answers without running the operation, or returns empty to proceed.
     */
    protected Optional<ServiceHealthRecord> precheck() {
        return Optional.empty();
    }

    /**
     * Starts the network operation. Exceptions thrown here are reported like failures of the
     * returned future.
     *
     * @param timeout the bound the operation is raced against, for clients that accept one
     */
    protected abstract CompletableFuture<T> execute(Duration timeout);

    /**
     * Classifies a result that arrived before the timeout.
     *
     * @param value          the operation result
     * @param responseTimeMs elapsed wall-clock time, rounded to two decimals
     */
    protected abstract ServiceHealthRecord classify(T value, double responseTimeMs);

    /**
     * Builds a failed record tagged with {@code kind} and any extra details.
     */
    protected ServiceHealthRecord failed(String error, ProbeErrorKind kind, Map<String, Object> extraDetails) {
        Map<String, Object> details = new LinkedHashMap<>(extraDetails);
        details.put(DETAIL_ERROR_KIND, kind.tag());
        return ServiceHealthRecord.failed(serviceName(), error, details, clock.instant());
    }

    /**
     * Returns the service name of the probed dependency.
     */
    protected String serviceName() {
        return kind().serviceName();
    }

    /**
     * Formats a bound for messages: whole seconds as {@code "5s"}, anything else as {@code "250ms"}.
     */
    public static String describe(Duration timeout) {
        long millis = timeout.toMillis();
        return millis % 1000 == 0 ? (millis / 1000) + "s" : millis + "ms";
    }

    /**
     * Rounds a millisecond value to two decimals.
     */
    public static double roundMillis(double millis) {
        return Math.round(millis * 100.0) / 100.0;
    }

    private ServiceHealthRecord toRecord(ProbeOutcome<T> outcome, double responseTimeMs, Duration timeout) {
        if (outcome.timedOut()) {
            return timedOut(timeout, TimeoutException.class.getSimpleName());
        }
        if (outcome.failure() != null) {
            Throwable failure = outcome.failure();
            if (isTimeout(failure)) {
                return timedOut(timeout, failure.getClass().getSimpleName());
            }
            log.debug("Probe for {} failed with {}", serviceName(), failure.getClass().getName());
            return failed(sanitizer.sanitize(failure), ProbeErrorKind.CONNECTIVITY_FAILURE,
                    Map.of(DETAIL_EXCEPTION_TYPE, failure.getClass().getSimpleName()));
        }
        return classify(outcome.value(), responseTimeMs);
    }

    private ServiceHealthRecord timedOut(Duration timeout, String exceptionType) {
        return failed("Connection timeout (" + describe(timeout) + ")", ProbeErrorKind.CONNECTIVITY_TIMEOUT,
                Map.of("timeout_ms", timeout.toMillis(), DETAIL_EXCEPTION_TYPE, exceptionType));
    }

    private double elapsedMillis(long startNanos) {
        return roundMillis((nanoTicker.getAsLong() - startNanos) / 1_000_000.0);
    }

    private static boolean isTimeout(Throwable failure) {
        return failure instanceof TimeoutException
                || failure instanceof HttpTimeoutException
                || failure instanceof SocketTimeoutException
                || failure instanceof SQLTimeoutException;
    }
}
