package com.etcd.coordination.lock;

import java.time.Duration;

/**
 * Thrown when the maximum wait elapses while another holder keeps the lock.
 */
public class LockTimeoutException extends LockAcquisitionException {

    private final Duration waited;

    public LockTimeoutException(String key, Duration waited) {
        super(key, "Timed out after " + waited.toMillis() + "ms waiting for lock '" + key + "'");
        this.waited = waited;
    }

    public Duration waited() {
        return waited;
    }
}
