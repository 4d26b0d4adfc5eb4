package com.etcd.coordination.memoize;

import com.etcd.coordination.api.CallContext;
import com.etcd.coordination.instrument.CallEvents;
import com.etcd.coordination.instrument.CallScope;
import com.etcd.coordination.instrument.CallStatus;
import com.etcd.coordination.lock.LeaseRenewer;
import com.etcd.coordination.lock.LockAcquirer;
import com.etcd.coordination.lock.LockConfig;
import com.etcd.coordination.lock.LockHandle;
import com.etcd.coordination.logging.LogContext;
import com.etcd.coordination.metrics.MetricsService;
import com.etcd.coordination.store.ReadOptions;
import com.etcd.coordination.store.ValueStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Compute-once cache fill across processes.
 *
 * <p>The result of a computation is cached at {@code <key>-value}; the right to
 * compute it is guarded by a lock at {@code <key>-lock}. Callers first look for a
 * cached value without locking, then take the lock and look again, and only the
 * caller that still finds nothing runs the computation. The lock lease is renewed
 * for as long as the computation runs.</p>
 *
 * <p>Failures are never cached: if the computation throws, the lock is released and
 * the next caller computes again.</p>
 */
public class MemoizeEngine {
    private static final Logger log = LoggerFactory.getLogger(MemoizeEngine.class);

    static final String VALUE_SUFFIX = "-value";
    static final String LOCK_SUFFIX = "-lock";

    private final ValueStore values;
    private final LockAcquirer locks;
    private final LockConfig lockDefaults;
    private final ScheduledExecutorService scheduler;
    private final CallEvents events;
    private final MetricsService metrics;

    public MemoizeEngine(ValueStore values, LockAcquirer locks, LockConfig lockDefaults,
                         ScheduledExecutorService scheduler, CallEvents events, MetricsService metrics) {
        this.values = values;
        this.locks = locks;
        this.lockDefaults = lockDefaults;
        this.scheduler = scheduler;
        this.events = events;
        this.metrics = metrics;
    }

    /**
     * Returns the cached result for {@code key}, computing and caching it if needed.
     *
     * @param computation the work to run at most once per cache lifetime
     * @return the cached or computed value; a {@code null} result is returned (and cached) as {@code {}}
     * @throws com.etcd.coordination.lock.LockTimeoutException if the fill lock could not be taken in time
     * @throws com.etcd.coordination.store.StoreException      on store failure, including a lost lease
     * @throws ComputationException                            if the computation threw a checked exception
     */
    public JsonNode memoize(CallContext context, String key, Callable<?> computation, MemoizeOptions options) {
        return fill(context, key, computation, options, null);
    }

    /**
     * Typed variant of {@link #memoize(CallContext, String, Callable, MemoizeOptions)};
     * the cached JSON is converted to {@code type} with the client's object mapper.
     *
     * <p>A computed result that does not convert to {@code type} fails with a
     * {@link ComputationException} and is not cached.</p>
     */
    public <T> T memoize(CallContext context, String key, Callable<T> computation, MemoizeOptions options,
                         Class<T> type) {
        return values.codec().convert(fill(context, key, computation, options, type), type);
    }

    private JsonNode fill(CallContext context, String key, Callable<?> computation, MemoizeOptions options,
                          Class<?> type) {
        String valueKey = key + VALUE_SUFFIX;
        String lockKey = key + LOCK_SUFFIX;
        Map<String, Object> fields = Map.of(
                "ttl", options.ttlSeconds(),
                "leaseTimeoutSeconds", options.leaseTimeoutSeconds(),
                "maxWaitMillis", options.maxWaitMillis());

        try (LogContext ignored = LogContext.forCall("memoize", key, context);
             CallScope call = events.begin("memoize", key, context, fields)) {

            Optional<JsonNode> cached = values.read(context, valueKey, ReadOptions.single());
            if (cached.isPresent()) {
                call.status(CallStatus.CACHE_HIT_BEFORE_LOCK);
                return cached.get();
            }

            LockHandle lock = locks.acquire(context, lockKey, options.lockConfig(lockDefaults));
            try {
                cached = values.read(context, valueKey, ReadOptions.single());
                if (cached.isPresent()) {
                    log.debug("Value for {} was filled while waiting for the lock", key);
                    call.status(CallStatus.CACHE_HIT_AFTER_LOCK);
                    return cached.get();
                }

                JsonNode result;
                try (LeaseRenewer renewer = LeaseRenewer.start(lock, scheduler, metrics)) {
                    result = normalize(compute(key, computation));
                    if (type != null) {
                        checkConvertible(key, result, type);
                    }
                    renewer.throwIfFailed();
                    if (options.caches()) {
                        values.write(context, valueKey, result, options.ttlSeconds());
                    }
                }
                log.info("Computed value for {} (cached: {})", key, options.caches());
                call.status(CallStatus.COMPUTED);
                return result;
            } finally {
                lock.release();
            }
        }
    }

    private Object compute(String key, Callable<?> computation) {
        try {
            return computation.call();
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ComputationException(key, e);
        } catch (Exception e) {
            throw new ComputationException(key, e);
        }
    }

    private void checkConvertible(String key, JsonNode result, Class<?> type) {
        try {
            values.codec().convert(result, type);
        } catch (IllegalArgumentException e) {
            throw new ComputationException(key, e);
        }
    }

    private JsonNode normalize(Object result) {
        JsonNode node = result == null ? null : values.codec().toTree(result);
        if (node == null || node.isNull() || node.isMissingNode()) {
            return values.codec().emptyObject();
        }
        return node;
    }
}
