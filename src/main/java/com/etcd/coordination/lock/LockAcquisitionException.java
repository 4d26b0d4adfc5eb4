package com.etcd.coordination.lock;

/**
 * Runtime exception thrown when a lock cannot be acquired for a reason other
 * than the store itself failing, such as the acquiring thread being interrupted.
 */
public class LockAcquisitionException extends RuntimeException {

    private final String key;

    public LockAcquisitionException(String key, String message) {
        super(message);
        this.key = key;
    }

    public LockAcquisitionException(String key, String message, Throwable cause) {
        super(message, cause);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
