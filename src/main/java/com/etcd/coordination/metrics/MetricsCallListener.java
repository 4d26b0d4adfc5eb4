package com.etcd.coordination.metrics;

import com.etcd.coordination.instrument.CallInfo;
import com.etcd.coordination.instrument.CallListener;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Times every client call and reports it to a {@link MetricsService}.
 */
public class MetricsCallListener implements CallListener {

    private final MetricsService metrics;
    private final Map<Long, Long> startedAt = new ConcurrentHashMap<>();

    public MetricsCallListener(MetricsService metrics) {
        this.metrics = metrics;
    }

    @Override
    public void onStart(CallInfo call) {
        startedAt.put(call.callId(), System.nanoTime());
    }

    @Override
    public void onFinish(CallInfo call, String status) {
        Long start = startedAt.remove(call.callId());
        if (start != null) {
            metrics.recordCall(call.method(), status, Duration.ofNanos(System.nanoTime() - start));
        }
    }

    @Override
    public void onRemoved() {
        startedAt.clear();
    }

    int inFlight() {
        return startedAt.size();
    }
}
