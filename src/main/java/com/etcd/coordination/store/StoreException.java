package com.etcd.coordination.store;

/**
 * Runtime exception for any store failure other than "key not found" and lock
 * contention, both of which are ordinary results rather than errors.
 * Carries the store's error classifier, which is also reported as the finish
 * status of the failed call.
 */
public class StoreException extends RuntimeException {

    public static final String UNKNOWN = "unknown";
    public static final String TIMEOUT = "timeout";
    public static final String INTERRUPTED = "interrupted";
    public static final String MALFORMED_VALUE = "malformed-value";
    public static final String LOCK_LOST = "lock-lost";

    private final String statusCode;

    public StoreException(String statusCode, String message) {
        super(message);
        this.statusCode = statusCode != null ? statusCode : UNKNOWN;
    }

    public StoreException(String statusCode, String message, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode != null ? statusCode : UNKNOWN;
    }

    public String statusCode() {
        return statusCode;
    }
}
