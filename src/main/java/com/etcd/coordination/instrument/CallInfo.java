package com.etcd.coordination.instrument;

import com.etcd.coordination.api.CallContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Ephemeral record describing one client operation, handed to {@link CallListener}s
 * on start and finish. Has no persistence and no effect on correctness.
 *
 * @param callId  process-unique sequence number, stable between start and finish
 * @param key     the store key the operation targets
 * @param method  operation name ({@code get}, {@code set}, {@code delete}, {@code acquireLock}, {@code memoize})
 * @param context the caller's context
 * @param fields  extra operation fields such as {@code ttl}
 */
public record CallInfo(long callId, String key, String method, CallContext context, Map<String, Object> fields) {

    public CallInfo {
        fields = fields != null ? Collections.unmodifiableMap(new LinkedHashMap<>(fields)) : Map.of();
    }
}
