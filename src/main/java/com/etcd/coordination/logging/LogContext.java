package com.etcd.coordination.logging;

import com.etcd.coordination.api.CallContext;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;

/**
 * AutoCloseable MDC (Mapped Diagnostic Context) wrapper for structured logging.
 * Adds key-value pairs to SLF4J MDC and restores the previous values on close,
 * so nested calls (memoize -> get -> acquireLock) leave the outer context intact.
 *
 * <pre>
 * try (LogContext ctx = LogContext.forCall("memoize", key, context)) {
 *     log.info("Computing value for {}", key);
 * }
 * </pre>
 */
public class LogContext implements AutoCloseable {

    private final List<String> keys = new ArrayList<>();
    private final List<String> previous = new ArrayList<>();

    private LogContext() {
    }

    /**
     * Creates a log context for one client operation.
     */
    public static LogContext forCall(String method, String key, CallContext context) {
        LogContext ctx = new LogContext();
        if (context != null) {
            ctx.put("correlationId", context.correlationId());
        }
        ctx.put("method", method);
        ctx.put("key", key);
        return ctx;
    }

    /**
     * Adds an additional key-value pair to this log context.
     */
    public LogContext with(String key, String value) {
        put(key, value);
        return this;
    }

    private void put(String key, String value) {
        keys.add(key);
        previous.add(MDC.get(key));
        MDC.put(key, value);
    }

    @Override
    public void close() {
        for (int i = keys.size() - 1; i >= 0; i--) {
            String old = previous.get(i);
            if (old == null) {
                MDC.remove(keys.get(i));
            } else {
                MDC.put(keys.get(i), old);
            }
        }
        keys.clear();
        previous.clear();
    }
}
