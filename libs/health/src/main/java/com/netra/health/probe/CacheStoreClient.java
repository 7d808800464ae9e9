package com.netra.health.probe;

import java.util.concurrent.CompletableFuture;

/**
 * Client for the cache store's liveness and server-info commands.
 */
public interface CacheStoreClient {

    /**
     * Sends a ping; completes with the server's reply (typically "PONG").
     */
    CompletableFuture<String> ping();

    /**
     * Fetches version and memory information.
     */
    CompletableFuture<CacheServerInfo> info();
}
