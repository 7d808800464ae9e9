package com.netra.health.aggregation;

/**
 * Per-deployment criticality of the optional dependencies. The relational store is always
 * critical and therefore has no flag.
 *
 * @param cacheRequired     whether a failed cache store fails the whole system
 * @param analyticsRequired whether a failed analytics store fails the whole system
 */
public record CriticalityFlags(boolean cacheRequired, boolean analyticsRequired) {

    /** Neither optional dependency is critical. */
    public static CriticalityFlags noneRequired() {
        return new CriticalityFlags(false, false);
    }
}
