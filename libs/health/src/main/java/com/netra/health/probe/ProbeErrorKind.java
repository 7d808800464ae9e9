package com.netra.health.probe;

/**
 * Why a probe produced a {@code failed} record. Reported as {@code details.error_kind}.
 * <p>
 * An optional dependency without settings is not an error and has no kind; it is reported
 * as {@code not_configured}.
 */
public enum ProbeErrorKind {

    /** The dependency is required for this deployment but has no connection settings. */
    CONFIGURATION_MISSING_REQUIRED("configuration_missing_required"),

    /** The probe did not finish within its time bound. */
    CONNECTIVITY_TIMEOUT("connectivity_timeout"),

    /** The probe finished with an error (refused connection, driver error, bad response). */
    CONNECTIVITY_FAILURE("connectivity_failure"),

    /** The client library needed to reach the dependency is not available in this build. */
    DEPENDENCY_MISSING("dependency_missing");

    private final String tag;

    ProbeErrorKind(String tag) {
        this.tag = tag;
    }

    /** Returns the value stored under {@code details.error_kind}. */
    public String tag() {
        return tag;
    }
}
