package com.etcd.coordination.health;

import com.etcd.coordination.store.KeyValueStore;

/**
 * Pings the backing store and reports the round-trip latency.
 * A slow but successful ping is reported as DEGRADED.
 */
public class StoreHealthCheck implements HealthCheck {

    static final long DEFAULT_DEGRADED_LATENCY_MS = 1_000;

    private final KeyValueStore store;
    private final long degradedLatencyMs;

    public StoreHealthCheck(KeyValueStore store) {
        this(store, DEFAULT_DEGRADED_LATENCY_MS);
    }

    public StoreHealthCheck(KeyValueStore store, long degradedLatencyMs) {
        this.store = store;
        this.degradedLatencyMs = degradedLatencyMs;
    }

    @Override
    public String getName() {
        return "store";
    }

    @Override
    public HealthStatus check() {
        try {
            long startNs = System.nanoTime();
            store.ping();
            long latencyMs = (System.nanoTime() - startNs) / 1_000_000;

            HealthStatus base = latencyMs >= degradedLatencyMs
                    ? HealthStatus.degraded("Store ping took " + latencyMs + "ms")
                    : HealthStatus.up();
            return base
                    .withDetail("latencyMs", latencyMs)
                    .withDetail("store", store.describe());
        } catch (RuntimeException e) {
            return HealthStatus.down("Store unreachable: " + e.getMessage())
                    .withDetail("error", e.getClass().getSimpleName())
                    .withDetail("store", store.describe());
        }
    }
}
