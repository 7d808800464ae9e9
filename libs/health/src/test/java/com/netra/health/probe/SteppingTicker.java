package com.netra.health.probe;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.LongSupplier;

/**
 * Monotonic ticker returning preset millisecond readings (as nanoseconds) in order, then
 * repeating the last one.
 */
final class SteppingTicker implements LongSupplier {

    private final long[] readingsMillis;
    private final AtomicInteger next = new AtomicInteger();

    private SteppingTicker(long[] readingsMillis) {
        this.readingsMillis = readingsMillis;
    }

    static SteppingTicker ofMillis(long... readingsMillis) {
        return new SteppingTicker(readingsMillis.clone());
    }

    @Override
    public long getAsLong() {
        int index = Math.min(next.getAndIncrement(), readingsMillis.length - 1);
        return readingsMillis[index] * 1_000_000L;
    }
}
