package com.netra.health;

/**
 * The dependencies whose health is aggregated into a {@link SystemHealthSnapshot}.
 * <p>
 * Declaration order is the order in which services appear in a snapshot.
 */
public enum DependencyKind {

    /** Primary relational store. Always critical. */
    RELATIONAL("postgres"),

    /** Key/value cache store. Critical only when configured as required. */
    CACHE("redis"),

    /** Analytics store. Critical only when configured as required. */
    ANALYTICS("clickhouse");

    private final String serviceName;

    DependencyKind(String serviceName) {
        this.serviceName = serviceName;
    }

    /**
     * Returns the service name used as the key in snapshots, caches and metric tags.
     */
    public String serviceName() {
        return serviceName;
    }
}
