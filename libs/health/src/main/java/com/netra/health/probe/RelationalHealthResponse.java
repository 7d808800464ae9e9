package com.netra.health.probe;

/**
 * Answer of a relational-store health-check query.
 *
 * @param connected whether the query round trip succeeded
 * @param error     driver-reported error when not connected, or null
 * @param engine    database product name and version (e.g., "PostgreSQL 16.2"), or null
 */
public record RelationalHealthResponse(boolean connected, String error, String engine) {

    public static RelationalHealthResponse connected(String engine) {
        return new RelationalHealthResponse(true, null, engine);
    }

    public static RelationalHealthResponse failed(String error) {
        return new RelationalHealthResponse(false, error, null);
    }
}
