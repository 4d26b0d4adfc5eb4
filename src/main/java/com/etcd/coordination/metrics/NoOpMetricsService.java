package com.etcd.coordination.metrics;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordCall(String method, String status, Duration duration) {
    }

    @Override
    public void recordLockContention() {
    }

    @Override
    public void recordLockWait(Duration waited) {
    }

    @Override
    public void recordLeaseRenewal(boolean succeeded) {
    }
}
