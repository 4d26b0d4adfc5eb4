package com.etcd.coordination.instrument;

import java.util.Set;

/**
 * Status vocabulary reported on finish events.
 * Store operations report {@link #OK} or the store's own error classifier.
 */
public final class CallStatus {

    public static final String OK = "0";
    public static final String ERROR = "error";

    public static final String ACQUIRED = "acquired";
    public static final String WAITED_THEN_ACQUIRED = "waited-then-acquired";
    public static final String TIMEOUT = "timeout";

    public static final String CACHE_HIT_BEFORE_LOCK = "cache-hit-before-lock";
    public static final String CACHE_HIT_AFTER_LOCK = "cache-hit-after-lock";
    public static final String COMPUTED = "computed";

    private static final Set<String> SUCCESSES = Set.of(
            OK, ACQUIRED, WAITED_THEN_ACQUIRED, CACHE_HIT_BEFORE_LOCK, CACHE_HIT_AFTER_LOCK, COMPUTED);

    private CallStatus() {
    }

    public static boolean isFailure(String status) {
        return !SUCCESSES.contains(status);
    }
}
