package com.etcd.coordination.lock;

import com.etcd.coordination.api.CallContext;
import com.etcd.coordination.instrument.CallEvents;
import com.etcd.coordination.instrument.CallScope;
import com.etcd.coordination.instrument.CallStatus;
import com.etcd.coordination.logging.LogContext;
import com.etcd.coordination.metrics.MetricsService;
import com.etcd.coordination.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

/**
 * Drives a {@link LockHandle} to acquisition within a bounded wait.
 *
 * <p>Contention is retried with linear backoff ({@link LockConfig#backoffDelayMillis(int)}),
 * never sleeping past the deadline. While waiting, a deletion watch on the lock key
 * cuts the backoff short so the next attempt happens as soon as the holder releases.
 * If the watch cannot be registered the protocol simply keeps polling.
 * Any store error other than contention ends the acquisition immediately.</p>
 */
public class LockAcquirer {
    private static final Logger log = LoggerFactory.getLogger(LockAcquirer.class);

    private final KeyValueStore store;
    private final CallEvents events;
    private final MetricsService metrics;

    public LockAcquirer(KeyValueStore store, CallEvents events, MetricsService metrics) {
        this.store = store;
        this.events = events;
        this.metrics = metrics;
    }

    /**
     * Acquires the lock at {@code key}, blocking up to {@code config.maxWait()}.
     *
     * @return the held lock; the caller must release it
     * @throws LockTimeoutException     if the wait elapsed while the lock stayed contended
     * @throws LockAcquisitionException if the waiting thread was interrupted
     * @throws com.etcd.coordination.store.StoreException on any other store failure
     */
    public LockHandle acquire(CallContext context, String key, LockConfig config) {
        Map<String, Object> fields = Map.of(
                "leaseTimeoutSeconds", config.leaseTimeoutSeconds(),
                "maxWaitMillis", config.maxWaitMillis());
        try (LogContext ignored = LogContext.forCall("acquireLock", key, context);
             CallScope call = events.begin("acquireLock", key, context, fields)) {

            LockHandle lock = new LockHandle(store, key, config.leaseTimeoutSeconds());
            long start = System.nanoTime();
            long deadline = start + TimeUnit.MILLISECONDS.toNanos(config.maxWaitMillis());
            Semaphore freed = new Semaphore(0);
            Closeable watch = null;
            int attempt = 0;
            try {
                while (true) {
                    attempt++;
                    if (lock.tryAcquire() == AcquireResult.ACQUIRED) {
                        Duration waited = Duration.ofNanos(System.nanoTime() - start);
                        if (attempt > 1) {
                            metrics.recordLockWait(waited);
                        }
                        call.status(attempt == 1 ? CallStatus.ACQUIRED : CallStatus.WAITED_THEN_ACQUIRED);
                        log.info("Lock acquired: {} after {}ms ({} attempts)", key, waited.toMillis(), attempt);
                        return lock;
                    }

                    metrics.recordLockContention();
                    long remaining = deadline - System.nanoTime();
                    if (remaining <= 0) {
                        Duration waited = Duration.ofNanos(System.nanoTime() - start);
                        call.status(CallStatus.TIMEOUT);
                        log.warn("Gave up on lock {} after {}ms ({} attempts)", key, waited.toMillis(), attempt);
                        throw new LockTimeoutException(key, waited);
                    }
                    if (watch == null) {
                        watch = watchRelease(key, freed);
                    }

                    long delay = Math.min(TimeUnit.MILLISECONDS.toNanos(config.backoffDelayMillis(attempt)), remaining);
                    log.warn("Lock {} is held elsewhere, retrying in {}ms (attempt {})",
                            key, TimeUnit.NANOSECONDS.toMillis(delay), attempt);
                    if (freed.tryAcquire(delay, TimeUnit.NANOSECONDS)) {
                        freed.drainPermits();
                        log.debug("Lock {} became free, retrying immediately", key);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new LockAcquisitionException(key, "Interrupted while acquiring lock for: " + key, e);
            } finally {
                closeQuietly(key, watch);
            }
        }
    }

    private Closeable watchRelease(String key, Semaphore freed) {
        try {
            return store.watchDeletion(key, freed::release);
        } catch (RuntimeException e) {
            log.debug("Cannot watch lock {}, falling back to polling: {}", key, e.getMessage());
            return () -> { };
        }
    }

    private static void closeQuietly(String key, Closeable watch) {
        if (watch == null) {
            return;
        }
        try {
            watch.close();
        } catch (IOException | RuntimeException e) {
            log.debug("Failed to close watch on lock {}: {}", key, e.getMessage());
        }
    }
}
