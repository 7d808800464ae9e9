package com.netra.health.config;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only key/value lookup for dependency connection settings.
 * <p>
 * Keys follow the environment-variable convention {@code <PREFIX>_<SETTING>}, for example
 * {@code REDIS_HOST} or {@code CLICKHOUSE_REQUIRED}.
 */
@FunctionalInterface
public interface ConfigurationSource {

    /**
     * Returns the value for {@code key}, or empty if it is not set.
     */
    Optional<String> get(String key);

    /**
     * Creates a source backed by a fixed map.
     */
    static ConfigurationSource of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(values);
        return key -> Optional.ofNullable(copy.get(key));
    }

    /**
     * Creates a source backed by the process environment.
     */
    static ConfigurationSource systemEnvironment() {
        return key -> Optional.ofNullable(System.getenv(key));
    }
}
