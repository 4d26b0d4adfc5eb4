package com.etcd.coordination.integration;

import com.etcd.coordination.api.CallContext;
import com.etcd.coordination.api.CoordinationClient;
import com.etcd.coordination.lock.LockConfig;
import com.etcd.coordination.lock.LockHandle;
import com.etcd.coordination.lock.LockTimeoutException;
import com.etcd.coordination.memoize.MemoizeOptions;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests of values, locks and memoize against a live etcd instance.
 */
@Tag("integration")
class EtcdCoordinationIT extends AbstractEtcdIntegrationTest {

    private final CallContext ctx = CallContext.create();
    private CoordinationClient client;

    @BeforeEach
    void setUp() {
        client = createClient("coordination");
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
    }

    @Test
    @DisplayName("Value written with a 1s TTL should read back exactly and then expire")
    void testKeyScenario() throws Exception {
        Map<String, Object> value = new LinkedHashMap<>();
        value.put("a", true);
        value.put("b", 3);
        value.put("c", "four");
        value.put("d", List.of(1, 2, 3));

        client.set(ctx, "test-key", value, 1);
        assertEquals(new ObjectMapper().valueToTree(value), client.get(ctx, "test-key").orElseThrow());

        // etcd enforces a minimum lease TTL of a few seconds
        Thread.sleep(6000);
        assertTrue(client.get(ctx, "test-key").isEmpty());
    }

    @Test
    @DisplayName("Second acquirer should wait for the first to release")
    void mutualExclusion() throws Exception {
        LockHandle first = client.acquireLock(ctx, "/locks/job");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            Future<LockHandle> second = executor.submit(() -> client.acquireLock(ctx, "/locks/job"));
            Thread.sleep(500);
            assertFalse(second.isDone());

            client.releaseLock(first);
            LockHandle acquired = second.get(10, TimeUnit.SECONDS);
            assertTrue(acquired.isHeld());
            client.releaseLock(acquired);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Held lock should time out after approximately maxWait")
    void lockTimeout() {
        LockHandle held = client.acquireLock(ctx, "/locks/busy");
        try {
            long start = System.nanoTime();
            assertThrows(LockTimeoutException.class, () ->
                    client.acquireLock(ctx, "/locks/busy", LockConfig.defaults().withMaxWaitMillis(1500)));
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            assertTrue(elapsedMs >= 1500 && elapsedMs < 3000, "elapsed " + elapsedMs);
        } finally {
            client.releaseLock(held);
        }
    }

    @Test
    @DisplayName("Concurrent memoize callers should compute once")
    void singleFlight() throws Exception {
        int callers = 6;
        AtomicInteger runs = new AtomicInteger();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        try {
            List<Future<JsonNode>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return client.memoize(ctx, "shared", () -> {
                        Thread.sleep(300);
                        return runs.incrementAndGet();
                    });
                }));
            }
            start.countDown();

            for (Future<JsonNode> result : results) {
                assertEquals(1, result.get(60, TimeUnit.SECONDS).asInt());
            }
            assertEquals(1, runs.get());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("job-x should keep its first result")
    void jobXScenario() {
        AtomicBoolean secondInvoked = new AtomicBoolean();

        assertEquals("v1", client.memoize(ctx, "job-x", () -> "v1").asText());
        assertEquals("v1", client.memoize(ctx, "job-x", () -> {
            secondInvoked.set(true);
            return "v2";
        }).asText());
        assertFalse(secondInvoked.get());
    }

    @Test
    @DisplayName("Lease should be renewed while a computation outlives it")
    void renewal() {
        JsonNode result = client.memoize(ctx, "slow", () -> {
            Thread.sleep(5000);
            return "done";
        }, new MemoizeOptions(300, 2, 10_000));

        assertEquals("done", result.asText());
    }

    @Test
    @DisplayName("Health should be UP against a running cluster")
    void health() {
        assertTrue(client.health().isUp());
    }
}
