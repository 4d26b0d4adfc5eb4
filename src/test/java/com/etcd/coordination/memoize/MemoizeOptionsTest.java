package com.etcd.coordination.memoize;

import com.etcd.coordination.lock.LockConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MemoizeOptions Tests")
class MemoizeOptionsTest {

    @Test
    @DisplayName("Defaults should cache for 300s with a 10s lease and 30s wait")
    void defaults() {
        MemoizeOptions options = MemoizeOptions.defaults();
        assertEquals(300, options.ttlSeconds());
        assertEquals(10, options.leaseTimeoutSeconds());
        assertEquals(30_000, options.maxWaitMillis());
        assertTrue(options.caches());
    }

    @Test
    @DisplayName("Zero TTL should disable caching")
    void zeroTtl() {
        assertFalse(MemoizeOptions.defaults().withTtlSeconds(0).caches());
    }

    @Test
    @DisplayName("Lock config should take lease and wait from the options and backoff from the base")
    void lockConfig() {
        LockConfig lock = new MemoizeOptions(60, 4, 2000).lockConfig(new LockConfig(10, 30_000, 100, 300));
        assertEquals(4, lock.leaseTimeoutSeconds());
        assertEquals(2000, lock.maxWaitMillis());
        assertEquals(100, lock.backoffStepMillis());
        assertEquals(300, lock.backoffCapMillis());
    }

    @Test
    @DisplayName("Negative values should be rejected")
    void validation() {
        assertThrows(IllegalArgumentException.class, () -> new MemoizeOptions(-1, 10, 1000));
        assertThrows(IllegalArgumentException.class, () -> new MemoizeOptions(300, 0, 1000));
        assertThrows(IllegalArgumentException.class, () -> new MemoizeOptions(300, 10, -5));
    }
}
