/**
 * Bounded-time dependency probes and the client interfaces they consume.
 *
 * <p>Every probe reports dependency problems as data: a timeout, refused connection,
 * missing setting or missing client library becomes a {@code failed} or
 * {@code not_configured} {@link com.netra.health.ServiceHealthRecord}, tagged with a
 * {@link com.netra.health.probe.ProbeErrorKind}.
 */
package com.netra.health.probe;
