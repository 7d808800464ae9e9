package com.netra.health.probe;

import java.util.concurrent.CompletableFuture;

/**
 * Client able to run a lightweight round-trip query against the relational store.
 */
public interface RelationalStoreClient {

    /**
     * Runs the health-check query. Implementations may complete exceptionally on driver errors;
     * the probe converts those into failed records.
     */
    CompletableFuture<RelationalHealthResponse> runHealthCheckQuery();

    /**
     * Returns false when no data source is wired at all.
     */
    default boolean isConfigured() {
        return true;
    }

    /**
     * Returns a client for deployments without a relational data source.
     */
    static RelationalStoreClient unconfigured() {
        return new RelationalStoreClient() {
            @Override
            public CompletableFuture<RelationalHealthResponse> runHealthCheckQuery() {
                return CompletableFuture.completedFuture(
                        RelationalHealthResponse.failed("No relational data source configured"));
            }

            @Override
            public boolean isConfigured() {
                return false;
            }
        };
    }
}
