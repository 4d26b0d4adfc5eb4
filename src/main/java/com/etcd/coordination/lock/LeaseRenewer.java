package com.etcd.coordination.lock;

import com.etcd.coordination.metrics.MetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodically renews a held lock while protected work runs.
 *
 * <pre>
 * try (LeaseRenewer renewer = LeaseRenewer.start(lock, scheduler, metrics)) {
 *     result = work.call();
 *     renewer.throwIfFailed();
 * }
 * </pre>
 *
 * <p>The renewal period is half the lease timeout. The first failed renewal stops
 * the task; the failure is kept and rethrown by {@link #throwIfFailed()}.
 * {@link #close()} returns only once no renewal is running.</p>
 */
public final class LeaseRenewer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LeaseRenewer.class);

    private final LockHandle lock;
    private final MetricsService metrics;
    private final ReentrantLock running = new ReentrantLock();
    private volatile RuntimeException failure;
    private volatile boolean closed;
    private ScheduledFuture<?> task;

    private LeaseRenewer(LockHandle lock, MetricsService metrics) {
        this.lock = lock;
        this.metrics = metrics;
    }

    public static LeaseRenewer start(LockHandle lock, ScheduledExecutorService scheduler, MetricsService metrics) {
        LeaseRenewer renewer = new LeaseRenewer(lock, metrics);
        long periodMillis = Math.max(1, lock.leaseTimeoutSeconds() * 1000L / 2);
        renewer.task = scheduler.scheduleWithFixedDelay(renewer::renewOnce, periodMillis, periodMillis,
                TimeUnit.MILLISECONDS);
        return renewer;
    }

    private void renewOnce() {
        running.lock();
        try {
            if (closed || failure != null) {
                return;
            }
            lock.renew();
            metrics.recordLeaseRenewal(true);
            log.info("Renewed lease on lock {}", lock.key());
        } catch (RuntimeException e) {
            failure = e;
            metrics.recordLeaseRenewal(false);
            log.warn("Lease renewal failed for lock {}: {}", lock.key(), e.getMessage());
            // Throwing from a periodic task suppresses further runs.
            throw e;
        } finally {
            running.unlock();
        }
    }

    /**
     * Rethrows the renewal failure, if any, so work done after losing the lease is not published.
     */
    public void throwIfFailed() {
        RuntimeException e = failure;
        if (e != null) {
            throw e;
        }
    }

    public boolean failed() {
        return failure != null;
    }

    @Override
    public void close() {
        closed = true;
        if (task != null) {
            task.cancel(false);
        }
        // Wait for an in-flight renewal to finish.
        running.lock();
        running.unlock();
    }
}
