package com.etcd.coordination.memoize;

import com.etcd.coordination.lock.LockConfig;

/**
 * Per-call settings for {@link MemoizeEngine}.
 *
 * @param ttlSeconds          lifetime of the cached result; {@code 0} disables caching
 * @param leaseTimeoutSeconds lease of the fill lock while the computation runs
 * @param maxWaitMillis       how long to wait for the fill lock
 */
public record MemoizeOptions(long ttlSeconds, int leaseTimeoutSeconds, long maxWaitMillis) {

    public MemoizeOptions {
        if (ttlSeconds < 0) {
            throw new IllegalArgumentException("ttlSeconds must be >= 0");
        }
        if (leaseTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("leaseTimeoutSeconds must be > 0");
        }
        if (maxWaitMillis < 0) {
            throw new IllegalArgumentException("maxWaitMillis must be >= 0");
        }
    }

    /**
     * Default options: cache for 5 minutes, 10s lease, 30s max wait.
     */
    public static MemoizeOptions defaults() {
        return new MemoizeOptions(300, 10, 30_000);
    }

    public MemoizeOptions withTtlSeconds(long seconds) {
        return new MemoizeOptions(seconds, leaseTimeoutSeconds, maxWaitMillis);
    }

    public boolean caches() {
        return ttlSeconds != 0;
    }

    /**
     * Lock settings for the fill lock, keeping the backoff policy of {@code base}.
     */
    public LockConfig lockConfig(LockConfig base) {
        return new LockConfig(leaseTimeoutSeconds, maxWaitMillis, base.backoffStepMillis(), base.backoffCapMillis());
    }
}
