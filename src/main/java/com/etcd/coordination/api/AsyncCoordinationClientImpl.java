package com.etcd.coordination.api;

import com.etcd.coordination.lock.LockConfig;
import com.etcd.coordination.lock.LockHandle;
import com.etcd.coordination.memoize.MemoizeOptions;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Thread-pool implementation of {@link AsyncCoordinationClient}.
 * Uses a cached pool of daemon threads, since lock waits and memoized computations
 * can block for a long time and must not starve each other.
 */
public class AsyncCoordinationClientImpl implements AsyncCoordinationClient {
    private static final Logger log = LoggerFactory.getLogger(AsyncCoordinationClientImpl.class);

    private final CoordinationClient client;
    private final ExecutorService executor;

    public AsyncCoordinationClientImpl(CoordinationClient client) {
        this(client, Executors.newCachedThreadPool(new DaemonThreadFactory("coordination-async")));
    }

    public AsyncCoordinationClientImpl(CoordinationClient client, ExecutorService executor) {
        this.client = client;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Optional<JsonNode>> getAsync(CallContext context, String key) {
        return CompletableFuture.supplyAsync(() -> client.get(context, key), executor);
    }

    @Override
    public CompletableFuture<Void> setAsync(CallContext context, String key, Object value, long ttlSeconds) {
        return CompletableFuture.runAsync(() -> client.set(context, key, value, ttlSeconds), executor);
    }

    @Override
    public CompletableFuture<Void> deleteAsync(CallContext context, String key) {
        return CompletableFuture.runAsync(() -> client.delete(context, key), executor);
    }

    @Override
    public CompletableFuture<LockHandle> acquireLockAsync(CallContext context, String key, LockConfig config) {
        return CompletableFuture.supplyAsync(() -> client.acquireLock(context, key, config), executor);
    }

    @Override
    public CompletableFuture<JsonNode> memoizeAsync(CallContext context, String key, Callable<?> computation,
                                                    MemoizeOptions options) {
        return CompletableFuture.supplyAsync(() -> client.memoize(context, key, computation, options), executor);
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Async coordination tasks still running after 30s, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
