package com.etcd.coordination.memoize;

/**
 * Wraps a checked exception thrown by a memoized computation, or the conversion
 * failure of a typed result that does not fit the requested type.
 * Unchecked exceptions from the computation are rethrown as they are.
 */
public class ComputationException extends RuntimeException {

    private final String key;

    public ComputationException(String key, Throwable cause) {
        super("Computation for '" + key + "' failed: " + cause.getMessage(), cause);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
