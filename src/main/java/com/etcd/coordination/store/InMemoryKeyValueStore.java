package com.etcd.coordination.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * In-process store with etcd-like semantics: atomic create-if-absent, TTL expiry
 * and deletion notifications (including on expiry).
 * Suitable for single-JVM deployments, local development and tests.
 *
 * <p>Expiry is enforced lazily: expired entries are purged at the start of every
 * operation, and their deletion watchers fire at that point.</p>
 */
public class InMemoryKeyValueStore implements KeyValueStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryKeyValueStore.class);

    private record Entry(String value, Instant expiresAt) {
        boolean isExpired(Instant now) {
            return expiresAt != null && !expiresAt.isAfter(now);
        }
    }

    private final Clock clock;
    private final Object monitor = new Object();
    private final TreeMap<String, Entry> entries = new TreeMap<>();
    private final Map<String, List<Runnable>> deletionWatchers = new HashMap<>();

    public InMemoryKeyValueStore() {
        this(Clock.systemUTC());
    }

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Optional<String> get(String key) {
        return withEntries(fired -> Optional.ofNullable(entries.get(key)).map(Entry::value));
    }

    @Override
    public SortedMap<String, String> getPrefix(String key) {
        return withEntries(fired -> {
            SortedMap<String, String> subtree = new TreeMap<>();
            String childPrefix = key.endsWith("/") ? key : key + "/";
            for (Map.Entry<String, Entry> e : entries.tailMap(key, true).entrySet()) {
                if (!e.getKey().startsWith(key)) {
                    break;
                }
                if (e.getKey().equals(key) || e.getKey().startsWith(childPrefix)) {
                    subtree.put(e.getKey(), e.getValue().value());
                }
            }
            return subtree;
        });
    }

    @Override
    public void put(String key, String value, long ttlSeconds) {
        withEntries(fired -> entries.put(key, new Entry(value, expiry(ttlSeconds))));
    }

    @Override
    public boolean delete(String key) {
        return withEntries(fired -> remove(key, fired));
    }

    @Override
    public boolean putIfAbsent(String key, String value, long ttlSeconds) {
        return withEntries(fired -> entries.putIfAbsent(key, new Entry(value, expiry(ttlSeconds))) == null);
    }

    @Override
    public void refresh(String key, String expectedValue, long ttlSeconds) {
        withEntries(fired -> {
            Entry current = entries.get(key);
            if (current == null) {
                throw new StoreException(StoreException.LOCK_LOST, "Entry " + key + " no longer exists");
            }
            if (!current.value().equals(expectedValue)) {
                throw new StoreException(StoreException.LOCK_LOST, "Entry " + key + " is held by another holder");
            }
            entries.put(key, new Entry(current.value(), expiry(ttlSeconds)));
            return null;
        });
    }

    @Override
    public boolean deleteIfValue(String key, String expectedValue) {
        return withEntries(fired -> {
            Entry current = entries.get(key);
            if (current == null || !current.value().equals(expectedValue)) {
                return false;
            }
            return remove(key, fired);
        });
    }

    /**
     * {@inheritDoc}
     *
     * <p>Expiry is noticed lazily, so an expired entry is reported on the next
     * operation against this store, not at the moment its TTL ends.</p>
     */
    @Override
    public Closeable watchDeletion(String key, Runnable onDeleted) {
        synchronized (monitor) {
            deletionWatchers.computeIfAbsent(key, k -> new CopyOnWriteArrayList<>()).add(onDeleted);
        }
        return () -> {
            synchronized (monitor) {
                List<Runnable> watchers = deletionWatchers.get(key);
                if (watchers != null) {
                    watchers.remove(onDeleted);
                    if (watchers.isEmpty()) {
                        deletionWatchers.remove(key);
                    }
                }
            }
        };
    }

    @Override
    public void ping() {
        // always reachable
    }

    @Override
    public String describe() {
        return "in-memory";
    }

    /**
     * Returns the number of live entries.
     */
    public int size() {
        return withEntries(fired -> entries.size());
    }

    @Override
    public void close() {
        synchronized (monitor) {
            entries.clear();
            deletionWatchers.clear();
        }
    }

    // ========== Internal ==========

    private <T> T withEntries(Function<List<Runnable>, T> action) {
        List<Runnable> fired = new ArrayList<>();
        T result;
        synchronized (monitor) {
            purgeExpired(fired);
            result = action.apply(fired);
        }
        for (Runnable callback : fired) {
            try {
                callback.run();
            } catch (RuntimeException e) {
                log.warn("Deletion watcher failed: {}", e.getMessage());
            }
        }
        return result;
    }

    private void purgeExpired(List<Runnable> fired) {
        Instant now = clock.instant();
        Iterator<Map.Entry<String, Entry>> it = entries.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Entry> e = it.next();
            if (e.getValue().isExpired(now)) {
                it.remove();
                collectWatchers(e.getKey(), fired);
                log.debug("Expired {}", e.getKey());
            }
        }
    }

    private boolean remove(String key, List<Runnable> fired) {
        if (entries.remove(key) == null) {
            return false;
        }
        collectWatchers(key, fired);
        return true;
    }

    private void collectWatchers(String key, List<Runnable> fired) {
        List<Runnable> watchers = deletionWatchers.get(key);
        if (watchers != null) {
            fired.addAll(watchers);
        }
    }

    private Instant expiry(long ttlSeconds) {
        return ttlSeconds > 0 ? clock.instant().plusSeconds(ttlSeconds) : null;
    }
}
