package com.etcd.coordination.lock;

import com.etcd.coordination.metrics.MetricsService;
import com.etcd.coordination.store.InMemoryKeyValueStore;
import com.etcd.coordination.store.StoreException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("LeaseRenewer Tests")
class LeaseRenewerTest {

    private ScheduledExecutorService scheduler;
    private InMemoryKeyValueStore store;
    private MetricsService metrics;

    @BeforeEach
    void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
        store = new InMemoryKeyValueStore();
        metrics = mock(MetricsService.class);
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    @DisplayName("Renewals should keep a short lease alive past its TTL")
    void keepsLeaseAlive() throws Exception {
        LockHandle lock = new LockHandle(store, "/lock", 1);
        lock.tryAcquire();

        try (LeaseRenewer renewer = LeaseRenewer.start(lock, scheduler, metrics)) {
            Thread.sleep(2500);
            assertEquals(Optional.of(lock.holderId()), store.get("/lock"));
            assertDoesNotThrow(renewer::throwIfFailed);
        }
        verify(metrics, atLeast(3)).recordLeaseRenewal(true);
    }

    @Test
    @DisplayName("Closed renewer should stop renewing")
    void closeStops() throws Exception {
        LockHandle lock = new LockHandle(store, "/lock", 1);
        lock.tryAcquire();

        LeaseRenewer renewer = LeaseRenewer.start(lock, scheduler, metrics);
        renewer.close();
        Thread.sleep(1500);

        verify(metrics, never()).recordLeaseRenewal(anyBoolean());
        assertTrue(store.get("/lock").isEmpty(), "lease should have expired without renewals");
    }

    @Test
    @DisplayName("Lost lock should stop renewals and be reported by throwIfFailed")
    void lostLockReported() throws Exception {
        LockHandle lock = new LockHandle(store, "/lock", 1);
        lock.tryAcquire();

        try (LeaseRenewer renewer = LeaseRenewer.start(lock, scheduler, metrics)) {
            store.delete("/lock");
            Thread.sleep(1300);

            assertTrue(renewer.failed());
            StoreException e = assertThrows(StoreException.class, renewer::throwIfFailed);
            assertEquals(StoreException.LOCK_LOST, e.statusCode());
        }
        verify(metrics, times(1)).recordLeaseRenewal(false);
    }
}
