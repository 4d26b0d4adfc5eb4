package com.etcd.coordination.metrics;

import com.etcd.coordination.api.CallContext;
import com.etcd.coordination.instrument.CallEvents;
import com.etcd.coordination.instrument.CallScope;
import com.etcd.coordination.instrument.CallStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MetricsService Tests")
class MetricsServiceTest {

    @Nested
    @DisplayName("NoOpMetricsService")
    class NoOpTests {

        @Test
        @DisplayName("All methods should be callable without error")
        void allMethodsCallableWithoutError() {
            NoOpMetricsService noOp = new NoOpMetricsService();

            assertDoesNotThrow(() -> {
                noOp.recordCall("get", CallStatus.OK, Duration.ofMillis(3));
                noOp.recordLockContention();
                noOp.recordLockWait(Duration.ofMillis(250));
                noOp.recordLeaseRenewal(true);
                noOp.recordLeaseRenewal(false);
            });
        }
    }

    @Nested
    @DisplayName("MicrometerMetricsService")
    class MicrometerTests {

        private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
        private final MicrometerMetricsService metrics = new MicrometerMetricsService(registry);

        @Test
        @DisplayName("Should time calls per method and status")
        void recordCall() {
            metrics.recordCall("get", CallStatus.OK, Duration.ofMillis(5));
            metrics.recordCall("get", CallStatus.OK, Duration.ofMillis(7));
            metrics.recordCall("get", "unavailable", Duration.ofMillis(1));

            Timer ok = registry.find("coordination.call.duration")
                    .tag("method", "get")
                    .tag("status", "0")
                    .timer();
            Timer failed = registry.find("coordination.call.duration")
                    .tag("method", "get")
                    .tag("status", "unavailable")
                    .timer();

            assertNotNull(ok);
            assertEquals(2, ok.count());
            assertEquals(12, ok.totalTime(TimeUnit.MILLISECONDS), 0.5);
            assertNotNull(failed);
            assertEquals(1, failed.count());
        }

        @Test
        @DisplayName("Should count contention and time lock waits")
        void lockMeters() {
            metrics.recordLockContention();
            metrics.recordLockContention();
            metrics.recordLockWait(Duration.ofMillis(500));

            assertEquals(2.0, registry.find("coordination.lock.contention").counter().count());
            assertEquals(1, registry.find("coordination.lock.wait").timer().count());
        }

        @Test
        @DisplayName("Should count renewals by outcome")
        void renewalOutcome() {
            metrics.recordLeaseRenewal(true);
            metrics.recordLeaseRenewal(true);
            metrics.recordLeaseRenewal(false);

            Counter success = registry.find("coordination.lock.renewal").tag("outcome", "success").counter();
            Counter failure = registry.find("coordination.lock.renewal").tag("outcome", "failure").counter();
            assertEquals(2.0, success.count());
            assertEquals(1.0, failure.count());
        }
    }

    @Nested
    @DisplayName("MetricsCallListener")
    class ListenerTests {

        @Test
        @DisplayName("Should record one timing per finished call and forget it afterwards")
        void recordsOnFinish() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            MetricsCallListener listener = new MetricsCallListener(new MicrometerMetricsService(registry));
            CallEvents events = new CallEvents();
            events.addListener(listener);

            try (CallScope call = events.begin("acquireLock", "/lock", CallContext.create())) {
                assertEquals(1, listener.inFlight());
                call.status(CallStatus.ACQUIRED);
            }

            assertEquals(0, listener.inFlight());
            Timer timer = registry.find("coordination.call.duration")
                    .tag("method", "acquireLock")
                    .tag("status", "acquired")
                    .timer();
            assertNotNull(timer);
            assertEquals(1, timer.count());
        }

        @Test
        @DisplayName("Removing the listener mid-call should drop the pending timing")
        void removedMidCall() {
            SimpleMeterRegistry registry = new SimpleMeterRegistry();
            MetricsCallListener listener = new MetricsCallListener(new MicrometerMetricsService(registry));
            CallEvents events = new CallEvents();
            events.addListener(listener);

            try (CallScope call = events.begin("memoize", "job", CallContext.create())) {
                events.removeListener(listener);
                assertEquals(0, listener.inFlight());
                call.status(CallStatus.COMPUTED);
            }

            assertEquals(0, listener.inFlight());
            assertNull(registry.find("coordination.call.duration").timer());
        }
    }
}
