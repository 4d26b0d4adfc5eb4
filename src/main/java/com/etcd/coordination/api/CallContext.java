package com.etcd.coordination.api;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Caller-supplied context passed through every client operation.
 * Carried on instrumentation events and copied into the logging MDC; it never
 * influences the result of an operation.
 *
 * @param correlationId identifier tying the events and log lines of one logical request together
 * @param attributes    free-form caller attributes forwarded to listeners
 */
public record CallContext(String correlationId, Map<String, String> attributes) {

    public CallContext {
        correlationId = correlationId != null ? correlationId : UUID.randomUUID().toString();
        attributes = attributes != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(attributes)) : Map.of();
    }

    /**
     * Context with a freshly generated correlation id and no attributes.
     */
    public static CallContext create() {
        return new CallContext(null, Map.of());
    }

    public static CallContext of(String correlationId) {
        return new CallContext(correlationId, Map.of());
    }

    public CallContext withAttribute(String key, String value) {
        Map<String, String> copy = new LinkedHashMap<>(attributes);
        copy.put(key, value);
        return new CallContext(correlationId, copy);
    }
}
