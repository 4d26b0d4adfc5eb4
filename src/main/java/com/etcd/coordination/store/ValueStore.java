package com.etcd.coordination.store;

import com.etcd.coordination.api.CallContext;
import com.etcd.coordination.instrument.CallEvents;
import com.etcd.coordination.instrument.CallScope;
import com.etcd.coordination.instrument.CallStatus;
import com.etcd.coordination.logging.LogContext;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;

/**
 * JSON view over a {@link KeyValueStore}: encodes values on write, decodes them on
 * read, translates TTLs and reports every call to the {@link CallEvents} listeners.
 *
 * <p>A missing key reads as {@link Optional#empty()}; every other failure is a
 * {@link StoreException} whose classifier is also the finish status of the call.</p>
 */
public class ValueStore {

    private final KeyValueStore store;
    private final JsonCodec codec;
    private final CallEvents events;

    public ValueStore(KeyValueStore store, JsonCodec codec, CallEvents events) {
        this.store = store;
        this.codec = codec;
        this.events = events;
    }

    public Optional<JsonNode> read(CallContext context, String key, ReadOptions options) {
        try (LogContext logContext = LogContext.forCall("get", key, context);
             CallScope call = events.begin("get", key, context)) {
            try {
                Optional<JsonNode> value = options.recursive() ? readTree(key) : readSingle(key);
                call.status(CallStatus.OK);
                return value;
            } catch (StoreException e) {
                call.status(e.statusCode());
                throw e;
            }
        }
    }

    /**
     * Writes {@code value} as JSON.
     *
     * @param ttlSeconds expiry in seconds; {@code 0} or negative means no expiry
     * @throws IllegalArgumentException if the value is not JSON-serializable
     */
    public void write(CallContext context, String key, Object value, long ttlSeconds) {
        try (LogContext logContext = LogContext.forCall("set", key, context);
             CallScope call = events.begin("set", key, context, Map.of("ttl", ttlSeconds))) {
            try {
                store.put(key, codec.encode(value), Math.max(ttlSeconds, 0));
                call.status(CallStatus.OK);
            } catch (StoreException e) {
                call.status(e.statusCode());
                throw e;
            }
        }
    }

    public void remove(CallContext context, String key) {
        try (LogContext logContext = LogContext.forCall("delete", key, context);
             CallScope call = events.begin("delete", key, context)) {
            try {
                store.delete(key);
                call.status(CallStatus.OK);
            } catch (StoreException e) {
                call.status(e.statusCode());
                throw e;
            }
        }
    }

    public JsonCodec codec() {
        return codec;
    }

    private Optional<JsonNode> readSingle(String key) {
        return store.get(key).map(raw -> codec.decode(key, raw));
    }

    private Optional<JsonNode> readTree(String key) {
        SortedMap<String, String> entries = store.getPrefix(key);
        if (entries.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(codec.assembleTree(key, entries));
    }
}
