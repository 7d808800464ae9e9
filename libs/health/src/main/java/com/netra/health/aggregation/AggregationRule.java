package com.netra.health.aggregation;

import com.netra.health.OverallStatus;

import java.util.function.BiPredicate;

/**
 * One row of the aggregation table: when {@code predicate} holds, the overall status is
 * {@code outcome}.
 *
 * @param name      short identifier used in logs and tests
 * @param predicate condition over the service statuses and criticality flags
 * @param outcome   overall status produced when the predicate matches
 */
public record AggregationRule(
        String name,
        BiPredicate<ServiceStatuses, CriticalityFlags> predicate,
        OverallStatus outcome
) {

    public AggregationRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (predicate == null || outcome == null) {
            throw new IllegalArgumentException("predicate and outcome must not be null");
        }
    }

    /** Returns true when this rule applies to the given inputs. */
    public boolean matches(ServiceStatuses statuses, CriticalityFlags flags) {
        return predicate.test(statuses, flags);
    }
}
