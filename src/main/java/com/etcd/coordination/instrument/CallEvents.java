package com.etcd.coordination.instrument;

import com.etcd.coordination.api.CallContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publishes start/finish events for client operations to the registered listeners.
 *
 * <p>Usage:</p>
 * <pre>
 * try (CallScope call = events.begin("get", key, context)) {
 *     String raw = store.get(key);
 *     call.status(CallStatus.OK);
 * }
 * </pre>
 */
public class CallEvents {
    private static final Logger log = LoggerFactory.getLogger(CallEvents.class);

    private final AtomicLong sequence = new AtomicLong();
    private final List<CallListener> listeners = new CopyOnWriteArrayList<>();

    public void addListener(CallListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public void removeListener(CallListener listener) {
        if (listeners.remove(listener)) {
            try {
                listener.onRemoved();
            } catch (RuntimeException e) {
                log.debug("Listener {} failed on removal: {}", listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    public int listenerCount() {
        return listeners.size();
    }

    public CallScope begin(String method, String key, CallContext context) {
        return begin(method, key, context, Map.of());
    }

    /**
     * Emits the start event and returns the scope that will emit the finish event.
     */
    public CallScope begin(String method, String key, CallContext context, Map<String, Object> fields) {
        CallInfo call = new CallInfo(sequence.incrementAndGet(), key, method, context, fields);
        for (CallListener listener : listeners) {
            try {
                listener.onStart(call);
            } catch (RuntimeException e) {
                log.debug("Listener {} failed on start of {} {}: {}",
                        listener.getClass().getSimpleName(), method, key, e.getMessage());
            }
        }
        return new CallScope(this, call);
    }

    void finish(CallInfo call, String status) {
        for (CallListener listener : listeners) {
            try {
                listener.onFinish(call, status);
            } catch (RuntimeException e) {
                log.debug("Listener {} failed on finish of {} {}: {}",
                        listener.getClass().getSimpleName(), call.method(), call.key(), e.getMessage());
            }
        }
    }
}
