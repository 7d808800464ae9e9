package com.netra.health.tracking;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps a bounded sliding window of recent response times per service.
 * <p>
 * Each window holds at most {@link #MAX_SAMPLES} values; recording beyond that evicts the
 * oldest samples. Windows are created lazily and guarded by their own monitor, so
 * concurrent recorders for different services never contend.
 */
public final class ResponseTimeTracker {

    /** Maximum number of samples retained per service. */
    public static final int MAX_SAMPLES = 100;

    private final Map<String, Deque<Double>> windows = new ConcurrentHashMap<>();
    private final int maxSamples;

    /**
     * Creates a tracker retaining {@link #MAX_SAMPLES} samples per service.
     */
    public ResponseTimeTracker() {
        this(MAX_SAMPLES);
    }

    /**
     * Creates a tracker with a custom window size.
     *
     * @param maxSamples samples retained per service
     */
    public ResponseTimeTracker(int maxSamples) {
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be positive");
        }
        this.maxSamples = maxSamples;
    }

    /**
     * Appends a response time to the service's window, evicting the oldest samples on overflow.
     *
     * @param service      service name
     * @param responseTime response time in milliseconds
     */
    public void record(String service, double responseTime) {
        if (service == null || service.isBlank()) {
            throw new IllegalArgumentException("service must not be null or blank");
        }
        Deque<Double> window = windows.computeIfAbsent(service, key -> new ArrayDeque<>(maxSamples + 1));
        synchronized (window) {
            window.addLast(responseTime);
            while (window.size() > maxSamples) {
                window.removeFirst();
            }
        }
    }

    /**
     * Returns the arithmetic mean of the service's current window, or 0.0 if it has no samples.
     */
    public double average(String service) {
        Deque<Double> window = windows.get(service);
        if (window == null) {
            return 0.0;
        }
        synchronized (window) {
            if (window.isEmpty()) {
                return 0.0;
            }
            double sum = 0.0;
            for (double sample : window) {
                sum += sample;
            }
            return sum / window.size();
        }
    }

    /**
     * Returns a copy of the service's window, oldest first.
     */
    public List<Double> samples(String service) {
        Deque<Double> window = windows.get(service);
        if (window == null) {
            return List.of();
        }
        synchronized (window) {
            return List.copyOf(window);
        }
    }

    /**
     * Returns the number of samples currently held for the service.
     */
    public int sampleCount(String service) {
        Deque<Double> window = windows.get(service);
        if (window == null) {
            return 0;
        }
        synchronized (window) {
            return window.size();
        }
    }

    /**
     * Returns the configured window size.
     */
    public int maxSamples() {
        return maxSamples;
    }
}
