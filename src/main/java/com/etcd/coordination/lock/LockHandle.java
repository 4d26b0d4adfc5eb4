package com.etcd.coordination.lock;

import com.etcd.coordination.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Instant;
import java.util.UUID;

/**
 * A lock on one key, identified by a holder id unique to this handle.
 *
 * <p>The lock is an entry at the key holding the holder id, written with the lease
 * timeout as its TTL. Acquisition is create-if-absent, renewal restarts the TTL only
 * while the entry still holds this handle's id, and release deletes the entry only if
 * it still belongs to this handle.</p>
 */
public class LockHandle implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(LockHandle.class);

    private final KeyValueStore store;
    private final String key;
    private final String holderId;
    private final int leaseTimeoutSeconds;

    private volatile boolean held;
    private volatile Instant acquiredAt;

    public LockHandle(KeyValueStore store, String key, int leaseTimeoutSeconds) {
        this(store, key, leaseTimeoutSeconds, UUID.randomUUID().toString());
    }

    public LockHandle(KeyValueStore store, String key, int leaseTimeoutSeconds, String holderId) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
        if (leaseTimeoutSeconds <= 0) {
            throw new IllegalArgumentException("leaseTimeoutSeconds must be > 0");
        }
        this.store = store;
        this.key = key;
        this.leaseTimeoutSeconds = leaseTimeoutSeconds;
        this.holderId = holderId;
    }

    /**
     * Makes one acquisition attempt.
     *
     * @return {@link AcquireResult#ACQUIRED} if this handle now holds the lock
     */
    public AcquireResult tryAcquire() {
        if (held) {
            return AcquireResult.ACQUIRED;
        }
        if (store.putIfAbsent(key, holderId, leaseTimeoutSeconds)) {
            held = true;
            acquiredAt = Instant.now();
            return AcquireResult.ACQUIRED;
        }
        return AcquireResult.ALREADY_LOCKED;
    }

    /**
     * Restarts the lease so the lock does not expire while work is still running.
     *
     * @throws IllegalStateException if this handle does not hold the lock
     */
    public void renew() {
        if (!held) {
            throw new IllegalStateException("Lock '" + key + "' is not held by " + holderId);
        }
        store.refresh(key, holderId, leaseTimeoutSeconds);
    }

    /**
     * Releases the lock. Idempotent; failures are logged and otherwise ignored,
     * because the lease expires the entry anyway.
     */
    public void release() {
        if (!held) {
            return;
        }
        held = false;
        try {
            if (store.deleteIfValue(key, holderId)) {
                log.debug("Lock released: {}", key);
            } else {
                log.debug("Lock {} was no longer held by {} at release", key, holderId);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to release lock {}: {}", key, e.getMessage());
        }
    }

    /**
     * Registers a callback fired when the lock entry disappears. Expiry is reported
     * as soon as the backing store notices it; see {@link KeyValueStore#watchDeletion}.
     */
    public Closeable onUnlock(Runnable callback) {
        return store.watchDeletion(key, callback);
    }

    public boolean isHeld() {
        return held;
    }

    public Instant acquiredAt() {
        return acquiredAt;
    }

    public String key() {
        return key;
    }

    public String holderId() {
        return holderId;
    }

    public int leaseTimeoutSeconds() {
        return leaseTimeoutSeconds;
    }

    @Override
    public void close() {
        release();
    }
}
