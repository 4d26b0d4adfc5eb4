package com.etcd.coordination.store;

import io.etcd.jetcd.ByteSequence;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.ClientBuilder;
import io.etcd.jetcd.KV;
import io.etcd.jetcd.KeyValue;
import io.etcd.jetcd.Lease;
import io.etcd.jetcd.Watch;
import io.etcd.jetcd.common.exception.EtcdException;
import io.etcd.jetcd.kv.GetResponse;
import io.etcd.jetcd.kv.TxnResponse;
import io.etcd.jetcd.lease.LeaseKeepAliveResponse;
import io.etcd.jetcd.op.Cmp;
import io.etcd.jetcd.op.CmpTarget;
import io.etcd.jetcd.op.Op;
import io.etcd.jetcd.options.DeleteOption;
import io.etcd.jetcd.options.GetOption;
import io.etcd.jetcd.options.PutOption;
import io.etcd.jetcd.watch.WatchEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * etcd v3 implementation using the jetcd client.
 *
 * <p>Expiry is implemented with one etcd lease per entry: writes with a TTL grant a
 * lease and attach it to the key, renewal keeps that lease alive once, and
 * compare-and-delete revokes it. Create-if-absent is a transaction guarded by
 * {@code version(key) == 0}. Every round trip is bounded by the configured request
 * timeout; network retries are left to jetcd.</p>
 */
public class EtcdKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(EtcdKeyValueStore.class);

    private static final String PING_KEY = "/__coordination/ping";

    private final Client client;
    private final KV kv;
    private final Lease leases;
    private final Watch watch;
    private final long requestTimeoutMillis;
    private final String description;

    public EtcdKeyValueStore(EtcdConfig config) {
        this(buildClient(config), config.getRequestTimeoutMillis(),
                "etcd" + config.getEndpoints() + (config.getNamespace().isEmpty() ? "" : " ns=" + config.getNamespace()));
        log.info("etcd store initialized: endpoints={} namespace='{}'",
                config.getEndpoints(), config.getNamespace());
    }

    EtcdKeyValueStore(Client client, long requestTimeoutMillis, String description) {
        this.client = client;
        this.kv = client.getKVClient();
        this.leases = client.getLeaseClient();
        this.watch = client.getWatchClient();
        this.requestTimeoutMillis = requestTimeoutMillis;
        this.description = description;
    }

    private static Client buildClient(EtcdConfig config) {
        ClientBuilder builder = Client.builder()
                .endpoints(config.getEndpoints().toArray(new String[0]));
        if (!config.getNamespace().isEmpty()) {
            builder.namespace(bytes(config.getNamespace()));
        }
        if (config.hasCredentials()) {
            builder.user(bytes(config.getUser()))
                    .password(bytes(config.getPassword() != null ? config.getPassword() : ""));
        }
        return builder.build();
    }

    @Override
    public Optional<String> get(String key) {
        GetResponse response = await(kv.get(bytes(key)), "get", key);
        log.debug("get {} -> {} kvs", key, response.getKvs().size());
        if (response.getKvs().isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(string(response.getKvs().get(0).getValue()));
    }

    @Override
    public SortedMap<String, String> getPrefix(String key) {
        GetOption option = GetOption.builder().isPrefix(true).build();
        GetResponse response = await(kv.get(bytes(key), option), "getPrefix", key);

        SortedMap<String, String> entries = new TreeMap<>();
        String childPrefix = key.endsWith("/") ? key : key + "/";
        for (KeyValue entry : response.getKvs()) {
            String entryKey = string(entry.getKey());
            // a prefix read of "/a" also matches "/ab"; keep only the subtree
            if (entryKey.equals(key) || entryKey.startsWith(childPrefix)) {
                entries.put(entryKey, string(entry.getValue()));
            }
        }
        log.debug("getPrefix {} -> {} entries", key, entries.size());
        return entries;
    }

    @Override
    public void put(String key, String value, long ttlSeconds) {
        PutOption option = leaseOption(key, ttlSeconds);
        await(kv.put(bytes(key), bytes(value), option), "put", key);
        log.debug("put {} ttl={}", key, ttlSeconds);
    }

    @Override
    public boolean delete(String key) {
        long deleted = await(kv.delete(bytes(key)), "delete", key).getDeleted();
        log.debug("delete {} -> {}", key, deleted);
        return deleted > 0;
    }

    @Override
    public boolean putIfAbsent(String key, String value, long ttlSeconds) {
        ByteSequence k = bytes(key);
        long leaseId = ttlSeconds > 0 ? grant(key, ttlSeconds) : 0L;
        PutOption option = leaseId != 0L ? PutOption.builder().withLeaseId(leaseId).build() : PutOption.DEFAULT;

        TxnResponse response = await(kv.txn()
                .If(new Cmp(k, Cmp.Op.EQUAL, CmpTarget.version(0)))
                .Then(Op.put(k, bytes(value), option))
                .commit(), "putIfAbsent", key);

        if (!response.isSucceeded() && leaseId != 0L) {
            revokeUnused(key, leaseId);
        }
        log.debug("putIfAbsent {} -> {}", key, response.isSucceeded());
        return response.isSucceeded();
    }

    @Override
    public void refresh(String key, String expectedValue, long ttlSeconds) {
        KeyValue current = currentEntry(key, expectedValue, "refresh");
        long leaseId = current.getLease();
        if (leaseId == 0L) {
            // written without a TTL, nothing can expire
            return;
        }
        LeaseKeepAliveResponse response = await(leases.keepAliveOnce(leaseId), "refresh", key);
        if (response.getTTL() <= 0) {
            throw new StoreException(StoreException.LOCK_LOST, "Lease for " + key + " has already expired");
        }
        log.debug("refresh {} ttl={}", key, response.getTTL());
    }

    @Override
    public boolean deleteIfValue(String key, String expectedValue) {
        ByteSequence k = bytes(key);
        GetResponse current = await(kv.get(k), "deleteIfValue", key);
        if (current.getKvs().isEmpty()) {
            return false;
        }
        KeyValue entry = current.getKvs().get(0);
        if (!expectedValue.equals(string(entry.getValue()))) {
            return false;
        }

        TxnResponse response = await(kv.txn()
                .If(new Cmp(k, Cmp.Op.EQUAL, CmpTarget.modRevision(entry.getModRevision())))
                .Then(Op.delete(k, DeleteOption.DEFAULT))
                .commit(), "deleteIfValue", key);

        if (response.isSucceeded() && entry.getLease() != 0L) {
            await(leases.revoke(entry.getLease()), "revoke", key);
        }
        log.debug("deleteIfValue {} -> {}", key, response.isSucceeded());
        return response.isSucceeded();
    }

    @Override
    public Closeable watchDeletion(String key, Runnable onDeleted) {
        Watch.Watcher watcher = watch.watch(bytes(key), Watch.listener(response -> {
            for (WatchEvent event : response.getEvents()) {
                if (event.getEventType() == WatchEvent.EventType.DELETE) {
                    onDeleted.run();
                    return;
                }
            }
        }));
        return watcher::close;
    }

    @Override
    public void ping() {
        await(kv.get(bytes(PING_KEY)), "ping", PING_KEY);
    }

    @Override
    public String describe() {
        return description;
    }

    @Override
    public void close() {
        client.close();
        log.info("etcd store closed");
    }

    // ========== Internal ==========

    private KeyValue currentEntry(String key, String expectedValue, String operation) {
        GetResponse response = await(kv.get(bytes(key)), operation, key);
        if (response.getKvs().isEmpty()) {
            throw new StoreException(StoreException.LOCK_LOST, "Entry " + key + " no longer exists");
        }
        KeyValue entry = response.getKvs().get(0);
        if (!expectedValue.equals(string(entry.getValue()))) {
            throw new StoreException(StoreException.LOCK_LOST, "Entry " + key + " is held by another holder");
        }
        return entry;
    }

    private PutOption leaseOption(String key, long ttlSeconds) {
        if (ttlSeconds <= 0) {
            return PutOption.DEFAULT;
        }
        return PutOption.builder().withLeaseId(grant(key, ttlSeconds)).build();
    }

    private long grant(String key, long ttlSeconds) {
        return await(leases.grant(ttlSeconds), "grant", key).getID();
    }

    private void revokeUnused(String key, long leaseId) {
        try {
            await(leases.revoke(leaseId), "revoke", key);
        } catch (StoreException e) {
            // the unused lease expires on its own
            log.debug("Could not revoke unused lease {} for {}: {}", leaseId, key, e.getMessage());
        }
    }

    private <T> T await(CompletableFuture<T> future, String operation, String key) {
        try {
            return future.get(requestTimeoutMillis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StoreException(StoreException.INTERRUPTED,
                    "Interrupted during etcd " + operation + " of " + key, e);
        } catch (TimeoutException e) {
            throw new StoreException(StoreException.TIMEOUT,
                    "etcd " + operation + " of " + key + " timed out after " + requestTimeoutMillis + "ms", e);
        } catch (ExecutionException e) {
            throw translate(operation, key, e.getCause());
        }
    }

    static StoreException translate(String operation, String key, Throwable cause) {
        if (cause instanceof StoreException storeException) {
            return storeException;
        }
        if (cause instanceof EtcdException etcdException && etcdException.getErrorCode() != null) {
            return new StoreException(etcdException.getErrorCode().name().toLowerCase(),
                    "etcd " + operation + " of " + key + " failed: " + etcdException.getMessage(), etcdException);
        }
        return new StoreException(StoreException.UNKNOWN,
                "etcd " + operation + " of " + key + " failed: " + (cause != null ? cause.getMessage() : "unknown"),
                cause);
    }

    private static ByteSequence bytes(String value) {
        return ByteSequence.from(value, StandardCharsets.UTF_8);
    }

    private static String string(ByteSequence value) {
        return value.toString(StandardCharsets.UTF_8);
    }
}
