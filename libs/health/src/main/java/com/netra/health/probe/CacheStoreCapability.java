package com.netra.health.probe;

import java.util.Optional;

/**
 * Whether this build can talk to the cache store at all.
 * <p>
 * The composition root decides the variant once, from what it was built with: a build
 * carrying a cache client library wires {@link #present}, a build without one wires
 * {@link #absent}. The probe never looks for libraries at runtime.
 */
public final class CacheStoreCapability {

    private final CacheStoreClient client;
    private final String missingReason;

    private CacheStoreCapability(CacheStoreClient client, String missingReason) {
        this.client = client;
        this.missingReason = missingReason;
    }

    /** A capability backed by a usable client. */
    public static CacheStoreCapability present(CacheStoreClient client) {
        if (client == null) {
            throw new IllegalArgumentException("client must not be null");
        }
        return new CacheStoreCapability(client, null);
    }

    /** No cache client is available in this build. */
    public static CacheStoreCapability absent(String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason must not be null or blank");
        }
        return new CacheStoreCapability(null, reason);
    }

    public boolean isPresent() {
        return client != null;
    }

    /** Returns the client when present. */
    public Optional<CacheStoreClient> client() {
        return Optional.ofNullable(client);
    }

    /** Returns why the capability is absent, or null when present. */
    public String missingReason() {
        return missingReason;
    }
}
