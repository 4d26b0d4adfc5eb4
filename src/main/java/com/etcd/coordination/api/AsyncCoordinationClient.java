package com.etcd.coordination.api;

import com.etcd.coordination.lock.LockConfig;
import com.etcd.coordination.lock.LockHandle;
import com.etcd.coordination.memoize.MemoizeOptions;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous view of a {@link CoordinationClient}.
 * Every method runs the blocking operation on a worker pool and returns a
 * {@link CompletableFuture}. Abandoning a future does not abort the store calls
 * already in flight.
 */
public interface AsyncCoordinationClient extends AutoCloseable {

    CompletableFuture<Optional<JsonNode>> getAsync(CallContext context, String key);

    CompletableFuture<Void> setAsync(CallContext context, String key, Object value, long ttlSeconds);

    CompletableFuture<Void> deleteAsync(CallContext context, String key);

    CompletableFuture<LockHandle> acquireLockAsync(CallContext context, String key, LockConfig config);

    CompletableFuture<JsonNode> memoizeAsync(CallContext context, String key, Callable<?> computation,
                                             MemoizeOptions options);

    @Override
    void close();
}
