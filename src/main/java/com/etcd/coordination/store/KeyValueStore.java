package com.etcd.coordination.store;

import java.io.Closeable;
import java.util.Optional;
import java.util.SortedMap;

/**
 * Interface for the backing key-value store.
 * Abstracts the underlying store implementation; keys are hierarchical
 * {@code /}-separated paths and values are opaque strings (JSON text).
 *
 * <p>Every method throws {@link StoreException} for failures other than the
 * expected "not found" and "already exists" outcomes, which are reported
 * through return values.</p>
 */
public interface KeyValueStore extends AutoCloseable {

    /**
     * Reads a single entry.
     *
     * @param key the entry key
     * @return the stored value, or empty if the key does not exist or has expired
     */
    Optional<String> get(String key);

    /**
     * Reads the subtree rooted at {@code key}: the entry at {@code key} itself and
     * every entry whose key starts with {@code key + "/"}.
     *
     * @param key the subtree root
     * @return entries ordered by key; empty if nothing exists under the root
     */
    SortedMap<String, String> getPrefix(String key);

    /**
     * Writes an entry, replacing any previous value.
     *
     * @param key        the entry key
     * @param value      the value
     * @param ttlSeconds expiry enforced by the store; {@code <= 0} means no expiry
     */
    void put(String key, String value, long ttlSeconds);

    /**
     * Deletes an entry. Deleting an absent key is not an error.
     *
     * @param key the entry key
     * @return true if an entry was removed
     */
    boolean delete(String key);

    /**
     * Atomically creates an entry only if the key does not exist.
     *
     * @param key        the entry key
     * @param value      the value
     * @param ttlSeconds expiry enforced by the store; {@code <= 0} means no expiry
     * @return true if this call created the entry, false if the key already existed
     */
    boolean putIfAbsent(String key, String value, long ttlSeconds);

    /**
     * Restarts the expiry clock of an entry, provided it still holds {@code expectedValue}.
     *
     * @param key           the entry key
     * @param expectedValue the value the caller wrote when creating the entry
     * @param ttlSeconds    the entry's TTL
     * @throws StoreException with {@link StoreException#LOCK_LOST} if the entry is gone or
     *                        holds another value
     */
    void refresh(String key, String expectedValue, long ttlSeconds);

    /**
     * Deletes an entry only if it still holds {@code expectedValue}, and releases any
     * expiry resources attached to it.
     *
     * @return true if the entry was deleted
     */
    boolean deleteIfValue(String key, String expectedValue);

    /**
     * Registers a callback fired whenever the entry at {@code key} disappears,
     * either through deletion or expiry. Callbacks may run on a store thread.
     *
     * <p>How soon an expiry is reported depends on the backend. etcd reports it when
     * the lease runs out; {@link InMemoryKeyValueStore} only notices it on its next
     * operation, so on an idle in-memory store the callback waits until something
     * touches the store.</p>
     *
     * @return handle that stops the notifications when closed
     */
    Closeable watchDeletion(String key, Runnable onDeleted);

    /**
     * Performs a cheap round trip to verify connectivity.
     */
    void ping();

    /**
     * Describes the store for health reporting and logs.
     */
    String describe();

    @Override
    void close();
}
