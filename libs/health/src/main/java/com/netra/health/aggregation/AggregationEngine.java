package com.netra.health.aggregation;

import com.netra.health.HealthStatus;
import com.netra.health.OverallStatus;

import java.util.List;

/**
 * Derives the overall system status from the dependency statuses.
 * <p>
 * Rules are evaluated strictly in table order and the first match wins:
 * <ol>
 *   <li>relational store failed: failed</li>
 *   <li>cache store failed and required: failed</li>
 *   <li>analytics store failed and required: failed</li>
 *   <li>any other failure: degraded</li>
 *   <li>any degraded dependency: degraded</li>
 *   <li>everything healthy or not configured: healthy</li>
 * </ol>
 * If no rule matches the result is {@link OverallStatus#UNKNOWN}. With a closed
 * {@link HealthStatus} enum the table is exhaustive, so that fallback is never produced.
 * <p>
 * Stateless and thread-safe.
 */
public final class AggregationEngine {

    /** Name reported by {@link #evaluate} when no rule matched. */
    public static final String FALLBACK_RULE = "no-rule-matched";

    private static final List<AggregationRule> RULES = List.of(
            new AggregationRule("relational-failed",
                    (s, f) -> s.relational() == HealthStatus.FAILED,
                    OverallStatus.FAILED),
            new AggregationRule("required-cache-failed",
                    (s, f) -> s.cache() == HealthStatus.FAILED && f.cacheRequired(),
                    OverallStatus.FAILED),
            new AggregationRule("required-analytics-failed",
                    (s, f) -> s.analytics() == HealthStatus.FAILED && f.analyticsRequired(),
                    OverallStatus.FAILED),
            new AggregationRule("optional-dependency-failed",
                    (s, f) -> s.any(HealthStatus.FAILED),
                    OverallStatus.DEGRADED),
            new AggregationRule("dependency-degraded",
                    (s, f) -> s.any(HealthStatus.DEGRADED),
                    OverallStatus.DEGRADED),
            new AggregationRule("all-healthy",
                    (s, f) -> s.all().stream().allMatch(
                            status -> status == HealthStatus.HEALTHY || status == HealthStatus.NOT_CONFIGURED),
                    OverallStatus.HEALTHY)
    );

    private static final AggregationRule FALLBACK =
            new AggregationRule(FALLBACK_RULE, (s, f) -> true, OverallStatus.UNKNOWN);

    /**
     * Returns the overall status for the given inputs.
     *
     * @param statuses the three dependency statuses
     * @param flags    criticality of the optional dependencies
     * @return the outcome of the first matching rule
     */
    public OverallStatus aggregate(ServiceStatuses statuses, CriticalityFlags flags) {
        return evaluate(statuses, flags).outcome();
    }

    /**
     * Returns the first rule matching the inputs, or a fallback rule named
     * {@value #FALLBACK_RULE} with outcome {@link OverallStatus#UNKNOWN}.
     */
    public AggregationRule evaluate(ServiceStatuses statuses, CriticalityFlags flags) {
        if (statuses == null || flags == null) {
            throw new IllegalArgumentException("statuses and flags must not be null");
        }
        for (AggregationRule rule : RULES) {
            if (rule.matches(statuses, flags)) {
                return rule;
            }
        }
        return FALLBACK;
    }

    /**
     * Returns the ordered rule table.
     */
    public List<AggregationRule> rules() {
        return RULES;
    }
}
