package com.etcd.coordination.metrics;

import java.time.Duration;

/**
 * Interface for recording coordination client metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the client works
 * without any metrics dependencies on the classpath.
 */
public interface MetricsService {

    /**
     * Records a finished client call.
     *
     * @param method   the operation name
     * @param status   the finish status reported to listeners
     * @param duration wall time between start and finish
     */
    void recordCall(String method, String status, Duration duration);

    void recordLockContention();

    void recordLockWait(Duration waited);

    void recordLeaseRenewal(boolean succeeded);
}
