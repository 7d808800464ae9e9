package com.netra.health.probe;

import java.util.OptionalDouble;

/**
 * Server information reported by the cache store.
 *
 * @param version    server version string, or null if not reported
 * @param usedMemory bytes currently in use
 * @param maxMemory  configured memory limit in bytes; 0 means unlimited
 */
public record CacheServerInfo(String version, long usedMemory, long maxMemory) {

    /**
     * Returns {@code usedMemory / maxMemory}, or empty when no limit is configured.
     */
    public OptionalDouble memoryUsageRatio() {
        if (maxMemory <= 0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of((double) usedMemory / maxMemory);
    }
}
