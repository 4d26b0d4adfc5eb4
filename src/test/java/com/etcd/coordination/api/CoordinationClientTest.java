package com.etcd.coordination.api;

import com.etcd.coordination.health.HealthStatus;
import com.etcd.coordination.instrument.RecordingListener;
import com.etcd.coordination.lock.LockConfig;
import com.etcd.coordination.lock.LockHandle;
import com.etcd.coordination.lock.LockTimeoutException;
import com.etcd.coordination.memoize.MemoizeOptions;
import com.etcd.coordination.metrics.MicrometerMetricsService;
import com.etcd.coordination.store.InMemoryKeyValueStore;
import com.etcd.coordination.store.KeyValueStore;
import com.etcd.coordination.store.ReadOptions;
import com.fasterxml.jackson.databind.JsonNode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("CoordinationClient Tests")
class CoordinationClientTest {

    private final CallContext ctx = CallContext.of("corr-client");

    private InMemoryKeyValueStore store;
    private RecordingListener listener;
    private CoordinationClient client;

    @BeforeEach
    void setUp() {
        store = new InMemoryKeyValueStore();
        listener = new RecordingListener();
        client = CoordinationClient.builder()
                .store(store)
                .listener(listener)
                .build();
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    @Nested
    @DisplayName("Values")
    class ValueTests {

        @Test
        @DisplayName("set, get and delete should round trip a JSON value")
        void roundTrip() {
            client.set(ctx, "/config/flags", Map.of("beta", true));

            JsonNode flags = client.get(ctx, "/config/flags").orElseThrow();
            assertTrue(flags.get("beta").asBoolean());

            client.delete(ctx, "/config/flags");
            assertEquals(Optional.empty(), client.get(ctx, "/config/flags"));
        }

        @Test
        @DisplayName("Typed get should convert with the client's mapper")
        void typedGet() {
            client.set(ctx, "/limits", Map.of("max", 5), 60);
            @SuppressWarnings("unchecked")
            Map<String, Object> limits = client.get(ctx, "/limits", Map.class).orElseThrow();
            assertEquals(5, limits.get("max"));
        }

        @Test
        @DisplayName("Tree read should fold the subtree")
        void treeRead() {
            client.set(ctx, "/nodes/a", 1);
            client.set(ctx, "/nodes/b", 2);

            JsonNode nodes = client.get(ctx, "/nodes", ReadOptions.tree()).orElseThrow();
            assertEquals(1, nodes.get("nodes").get("a").asInt());
            assertEquals(2, nodes.get("nodes").get("b").asInt());
        }
    }

    @Nested
    @DisplayName("Locks")
    class LockTests {

        @Test
        @DisplayName("acquireLock should use the client's default lock config")
        void defaultConfig() {
            CoordinationClient tight = CoordinationClient.builder()
                    .store(store)
                    .lockConfig(LockConfig.defaults().withMaxWaitMillis(200).withLeaseTimeoutSeconds(3))
                    .build();
            try {
                LockHandle held = tight.acquireLock(ctx, "/lock");
                assertEquals(3, held.leaseTimeoutSeconds());
                assertThrows(LockTimeoutException.class, () -> tight.acquireLock(ctx, "/lock"));
                tight.releaseLock(held);
                assertTrue(store.get("/lock").isEmpty());
            } finally {
                tight.close();
            }
        }

        @Test
        @DisplayName("releaseLock should tolerate null and repeated release")
        void releaseTolerant() {
            LockHandle lock = client.acquireLock(ctx, "/lock");
            assertDoesNotThrow(() -> {
                client.releaseLock(lock);
                client.releaseLock(lock);
                client.releaseLock(null);
            });
        }
    }

    @Nested
    @DisplayName("Memoize")
    class MemoizeTests {

        @Test
        @DisplayName("memoize should emit nested events for probe, lock and cache write")
        void nestedEvents() {
            client.memoize(ctx, "job", () -> "v1");

            assertEquals(List.of(
                    "start memoize job",
                    "start get job-value", "finish get job-value 0",
                    "start acquireLock job-lock", "finish acquireLock job-lock acquired",
                    "start get job-value", "finish get job-value 0",
                    "start set job-value", "finish set job-value 0",
                    "finish memoize job computed"), listener.events());
        }

        @Test
        @DisplayName("Default memoize options should come from the builder")
        void builderOptions() {
            CoordinationClient uncached = CoordinationClient.builder()
                    .store(store)
                    .memoizeOptions(MemoizeOptions.defaults().withTtlSeconds(0))
                    .build();
            try {
                uncached.memoize(ctx, "nocache", () -> 1);
                assertTrue(store.get("nocache-value").isEmpty());
            } finally {
                uncached.close();
            }
        }

        @Test
        @DisplayName("Typed memoize should return the computed type")
        void typed() {
            Integer value = client.memoize(ctx, "answer", () -> 42, Integer.class);
            assertEquals(42, value);
            assertEquals(42, client.memoize(ctx, "answer", () -> 0, Integer.class));
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("Builder should require a store")
        void storeRequired() {
            assertThrows(IllegalStateException.class, () -> CoordinationClient.builder().build());
        }

        @Test
        @DisplayName("Caller-supplied store should not be closed with the client")
        void borrowedStoreStaysOpen() {
            KeyValueStore borrowed = mock(KeyValueStore.class);
            when(borrowed.describe()).thenReturn("mock");

            CoordinationClient.builder().store(borrowed).build().close();

            verify(borrowed, never()).close();
        }

        @Test
        @DisplayName("health() should report the store")
        void health() {
            HealthStatus status = client.health();
            assertTrue(status.isUp());
            assertTrue(status.details().containsKey("store"));
        }

        @Test
        @DisplayName("Metrics service should receive call timings")
        void metricsWired() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            CoordinationClient measured = CoordinationClient.builder()
                    .store(store)
                    .metricsService(new MicrometerMetricsService(registry))
                    .build();
            try {
                measured.get(ctx, "/missing");
            } finally {
                measured.close();
            }

            assertEquals(1, registry.find("coordination.call.duration").tag("method", "get").timer().count());
        }

        @Test
        @DisplayName("Removed listener should stop receiving events")
        void removeListener() {
            client.removeListener(listener);
            client.get(ctx, "/k");
            assertTrue(listener.events().isEmpty());
        }
    }
}
