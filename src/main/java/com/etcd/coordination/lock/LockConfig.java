package com.etcd.coordination.lock;

import java.time.Duration;

/**
 * Configuration for lock acquisition.
 *
 * @param leaseTimeoutSeconds lifetime of a held lock before the store expires it
 * @param maxWaitMillis       total time to keep retrying before giving up
 * @param backoffStepMillis   delay added per failed attempt (linear backoff)
 * @param backoffCapMillis    upper bound on a single backoff delay
 */
public record LockConfig(int leaseTimeoutSeconds, long maxWaitMillis, long backoffStepMillis, long backoffCapMillis) {

    public LockConfig {
        if (leaseTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("leaseTimeoutSeconds must be > 0");
        }
        if (maxWaitMillis < 0) {
            throw new IllegalArgumentException("maxWaitMillis must be >= 0");
        }
        if (backoffStepMillis <= 0) {
            throw new IllegalArgumentException("backoffStepMillis must be > 0");
        }
        if (backoffCapMillis < backoffStepMillis) {
            throw new IllegalArgumentException("backoffCapMillis must be >= backoffStepMillis");
        }
    }

    /**
     * Default configuration: 10s lease, 30s max wait, 250ms backoff step capped at 750ms.
     */
    public static LockConfig defaults() {
        return new LockConfig(10, 30_000, 250, 750);
    }

    public LockConfig withLeaseTimeoutSeconds(int seconds) {
        return new LockConfig(seconds, maxWaitMillis, backoffStepMillis, backoffCapMillis);
    }

    public LockConfig withMaxWaitMillis(long millis) {
        return new LockConfig(leaseTimeoutSeconds, millis, backoffStepMillis, backoffCapMillis);
    }

    public LockConfig withBackoff(long stepMillis, long capMillis) {
        return new LockConfig(leaseTimeoutSeconds, maxWaitMillis, stepMillis, capMillis);
    }

    public Duration maxWait() {
        return Duration.ofMillis(maxWaitMillis);
    }

    /**
     * Delay before the next attempt after {@code attempt} failed attempts (1-based).
     */
    public long backoffDelayMillis(int attempt) {
        return Math.min(backoffStepMillis * Math.max(1, attempt), backoffCapMillis);
    }
}
