package com.etcd.coordination.lock;

/**
 * Outcome of a single acquisition attempt.
 */
public enum AcquireResult {
    ACQUIRED,
    ALREADY_LOCKED
}
