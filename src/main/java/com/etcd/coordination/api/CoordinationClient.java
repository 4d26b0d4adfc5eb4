package com.etcd.coordination.api;

import com.etcd.coordination.health.HealthCheckRegistry;
import com.etcd.coordination.health.HealthStatus;
import com.etcd.coordination.health.StoreHealthCheck;
import com.etcd.coordination.instrument.CallEvents;
import com.etcd.coordination.instrument.CallListener;
import com.etcd.coordination.lock.LockAcquirer;
import com.etcd.coordination.lock.LockConfig;
import com.etcd.coordination.lock.LockHandle;
import com.etcd.coordination.memoize.MemoizeEngine;
import com.etcd.coordination.memoize.MemoizeOptions;
import com.etcd.coordination.metrics.MetricsCallListener;
import com.etcd.coordination.metrics.MetricsService;
import com.etcd.coordination.metrics.NoOpMetricsService;
import com.etcd.coordination.store.EtcdConfig;
import com.etcd.coordination.store.EtcdKeyValueStore;
import com.etcd.coordination.store.JsonCodec;
import com.etcd.coordination.store.KeyValueStore;
import com.etcd.coordination.store.ReadOptions;
import com.etcd.coordination.store.ValueStore;
import com.etcd.coordination.tracing.NoOpTracingService;
import com.etcd.coordination.tracing.TracingCallListener;
import com.etcd.coordination.tracing.TracingService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Main entry point for the coordination client.
 *
 * <p>Usage:</p>
 * <pre>
 * CoordinationClient client = CoordinationClient.builder()
 *     .etcd(EtcdConfig.builder().endpoints("http://localhost:2379").namespace("/my-app").build())
 *     .build();
 *
 * // JSON values with expiry
 * client.set(ctx, "config/flags", Map.of("beta", true), 60);
 * Optional&lt;JsonNode&gt; flags = client.get(ctx, "config/flags");
 *
 * // Mutual exclusion
 * try (LockHandle lock = client.acquireLock(ctx, "jobs/rebuild")) {
 *     rebuild();
 * }
 *
 * // Compute once across the fleet, cache for 5 minutes
 * JsonNode report = client.memoize(ctx, "reports/daily", this::buildReport);
 * </pre>
 *
 * <p>Every public operation emits start and finish events to the registered
 * {@link CallListener}s. Calls on different keys are independent; the client is
 * safe for concurrent use.</p>
 */
public class CoordinationClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(CoordinationClient.class);

    private final KeyValueStore store;
    private final boolean ownsStore;
    private final CallEvents events;
    private final ValueStore values;
    private final LockAcquirer locks;
    private final MemoizeEngine memoizer;
    private final LockConfig lockConfig;
    private final MemoizeOptions memoizeOptions;
    private final ScheduledExecutorService renewalScheduler;
    private final HealthCheckRegistry healthCheckRegistry;

    private CoordinationClient(Builder builder) {
        this.store = builder.store;
        this.ownsStore = builder.ownsStore;
        this.lockConfig = builder.lockConfig;
        this.memoizeOptions = builder.memoizeOptions;

        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();
        TracingService tracingService = builder.tracingService != null
                ? builder.tracingService : new NoOpTracingService();

        this.events = new CallEvents();
        if (!(metricsService instanceof NoOpMetricsService)) {
            events.addListener(new MetricsCallListener(metricsService));
        }
        if (!(tracingService instanceof NoOpTracingService)) {
            events.addListener(new TracingCallListener(tracingService));
        }
        builder.listeners.forEach(events::addListener);

        JsonCodec codec = builder.objectMapper != null ? new JsonCodec(builder.objectMapper) : new JsonCodec();
        this.values = new ValueStore(store, codec, events);
        this.locks = new LockAcquirer(store, events, metricsService);
        this.renewalScheduler = Executors.newScheduledThreadPool(
                builder.renewalThreads, new DaemonThreadFactory("coordination-lease-renewal"));
        this.memoizer = new MemoizeEngine(values, locks, lockConfig, renewalScheduler, events, metricsService);

        this.healthCheckRegistry = new HealthCheckRegistry();
        healthCheckRegistry.register(new StoreHealthCheck(store));

        log.info("CoordinationClient initialized with store: {}", store.describe());
    }

    // ========== Values ==========

    /**
     * Reads the JSON value at {@code key}; empty if it does not exist or has expired.
     */
    public Optional<JsonNode> get(CallContext context, String key) {
        return values.read(context, key, ReadOptions.single());
    }

    /**
     * Reads a value, or with {@link ReadOptions#tree()} the whole subtree under {@code key}
     * folded into one object.
     */
    public Optional<JsonNode> get(CallContext context, String key, ReadOptions options) {
        return values.read(context, key, options);
    }

    /**
     * Reads the value at {@code key} and converts it with the client's object mapper.
     */
    public <T> Optional<T> get(CallContext context, String key, Class<T> type) {
        return values.read(context, key, ReadOptions.single())
                .map(node -> values.codec().convert(node, type));
    }

    /**
     * Writes {@code value} as JSON without expiry.
     */
    public void set(CallContext context, String key, Object value) {
        values.write(context, key, value, 0);
    }

    /**
     * Writes {@code value} as JSON; the store removes it after {@code ttlSeconds}.
     */
    public void set(CallContext context, String key, Object value, long ttlSeconds) {
        values.write(context, key, value, ttlSeconds);
    }

    /**
     * Deletes the value at {@code key}. Deleting an absent key succeeds.
     */
    public void delete(CallContext context, String key) {
        values.remove(context, key);
    }

    // ========== Locks ==========

    /**
     * Acquires the lock at {@code key} with the client's default lock settings.
     */
    public LockHandle acquireLock(CallContext context, String key) {
        return locks.acquire(context, key, lockConfig);
    }

    public LockHandle acquireLock(CallContext context, String key, LockConfig config) {
        return locks.acquire(context, key, config);
    }

    /**
     * Releases a lock. Never throws; a lock that cannot be deleted expires with its lease.
     */
    public void releaseLock(LockHandle lock) {
        if (lock != null) {
            lock.release();
        }
    }

    // ========== Memoize ==========

    public JsonNode memoize(CallContext context, String key, Callable<?> computation) {
        return memoizer.memoize(context, key, computation, memoizeOptions);
    }

    public JsonNode memoize(CallContext context, String key, Callable<?> computation, MemoizeOptions options) {
        return memoizer.memoize(context, key, computation, options);
    }

    public <T> T memoize(CallContext context, String key, Callable<T> computation, Class<T> type) {
        return memoizer.memoize(context, key, computation, memoizeOptions, type);
    }

    public <T> T memoize(CallContext context, String key, Callable<T> computation, MemoizeOptions options,
                         Class<T> type) {
        return memoizer.memoize(context, key, computation, options, type);
    }

    // ========== Instrumentation & health ==========

    public void addListener(CallListener listener) {
        events.addListener(listener);
    }

    public void removeListener(CallListener listener) {
        events.removeListener(listener);
    }

    /**
     * Returns the aggregate health status of all registered health checks.
     */
    public HealthStatus health() {
        return healthCheckRegistry.checkAll();
    }

    public HealthCheckRegistry getHealthCheckRegistry() {
        return healthCheckRegistry;
    }

    public LockConfig getLockConfig() {
        return lockConfig;
    }

    public MemoizeOptions getMemoizeOptions() {
        return memoizeOptions;
    }

    /**
     * Wraps this client in an {@link AsyncCoordinationClient}. Closing the async
     * client stops its worker pool but leaves this client open.
     */
    public AsyncCoordinationClient async() {
        return new AsyncCoordinationClientImpl(this);
    }

    @Override
    public void close() {
        renewalScheduler.shutdownNow();
        try {
            if (!renewalScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Lease renewal threads did not stop within 5s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (ownsStore) {
            try {
                store.close();
            } catch (RuntimeException e) {
                log.warn("Error closing store", e);
            }
        }
        log.info("CoordinationClient closed");
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private KeyValueStore store;
        private boolean ownsStore = false;
        private ObjectMapper objectMapper;
        private LockConfig lockConfig = LockConfig.defaults();
        private MemoizeOptions memoizeOptions = MemoizeOptions.defaults();
        private MetricsService metricsService;
        private TracingService tracingService;
        private int renewalThreads = 2;
        private final List<CallListener> listeners = new ArrayList<>();

        /**
         * Uses an existing store. The caller keeps ownership and closes it.
         */
        public Builder store(KeyValueStore store) {
            this.store = store;
            this.ownsStore = false;
            return this;
        }

        /**
         * Connects to etcd. The connection is owned by the client and closed with it.
         */
        public Builder etcd(EtcdConfig config) {
            this.store = new EtcdKeyValueStore(config);
            this.ownsStore = true;
            return this;
        }

        /**
         * Sets the Jackson mapper used to encode and decode values.
         */
        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        /**
         * Sets the default settings for {@link CoordinationClient#acquireLock(CallContext, String)}.
         */
        public Builder lockConfig(LockConfig lockConfig) {
            this.lockConfig = lockConfig;
            return this;
        }

        /**
         * Sets the default settings for {@code memoize} calls made without explicit options.
         */
        public Builder memoizeOptions(MemoizeOptions memoizeOptions) {
            this.memoizeOptions = memoizeOptions;
            return this;
        }

        /**
         * Sets a custom metrics service for recording operational metrics.
         * Defaults to {@link NoOpMetricsService} if not set.
         */
        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        /**
         * Sets a custom tracing service for distributed tracing.
         * Defaults to {@link NoOpTracingService} if not set.
         */
        public Builder tracingService(TracingService tracingService) {
            this.tracingService = tracingService;
            return this;
        }

        /**
         * Registers a listener for call start and finish events.
         */
        public Builder listener(CallListener listener) {
            this.listeners.add(listener);
            return this;
        }

        public Builder renewalThreads(int renewalThreads) {
            if (renewalThreads <= 0) {
                throw new IllegalArgumentException("renewalThreads must be > 0");
            }
            this.renewalThreads = renewalThreads;
            return this;
        }

        public CoordinationClient build() {
            if (store == null) {
                throw new IllegalStateException("A store is required: call store(...) or etcd(...)");
            }
            if (lockConfig == null || memoizeOptions == null) {
                throw new IllegalStateException("lockConfig and memoizeOptions must not be null");
            }
            return new CoordinationClient(this);
        }
    }
}
