package com.etcd.coordination.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 * Requires {@code micrometer-core} on the classpath (optional dependency).
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code coordination.call.duration} - Timer (tags: method, status)</li>
 *   <li>{@code coordination.lock.contention} - Counter</li>
 *   <li>{@code coordination.lock.wait} - Timer</li>
 *   <li>{@code coordination.lock.renewal} - Counter (tag: outcome)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> callTimers = new ConcurrentHashMap<>();
    private final Counter contentionCounter;
    private final Timer lockWaitTimer;
    private final Counter renewalSuccessCounter;
    private final Counter renewalFailureCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.contentionCounter = Counter.builder("coordination.lock.contention")
                .description("Lock acquisition attempts that found the lock already held")
                .register(registry);
        this.lockWaitTimer = Timer.builder("coordination.lock.wait")
                .description("Time spent waiting before a lock was acquired")
                .register(registry);
        this.renewalSuccessCounter = renewalCounter("success");
        this.renewalFailureCounter = renewalCounter("failure");
    }

    private Counter renewalCounter(String outcome) {
        return Counter.builder("coordination.lock.renewal")
                .description("Lease renewals of held locks")
                .tag("outcome", outcome)
                .register(registry);
    }

    @Override
    public void recordCall(String method, String status, Duration duration) {
        Timer timer = callTimers.computeIfAbsent(method + ":" + status, k ->
                Timer.builder("coordination.call.duration")
                        .description("Duration of coordination client calls")
                        .tag("method", method)
                        .tag("status", status)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordLockContention() {
        contentionCounter.increment();
    }

    @Override
    public void recordLockWait(Duration waited) {
        lockWaitTimer.record(waited);
    }

    @Override
    public void recordLeaseRenewal(boolean succeeded) {
        (succeeded ? renewalSuccessCounter : renewalFailureCounter).increment();
    }
}
