package com.etcd.coordination.tracing;

import com.etcd.coordination.instrument.CallInfo;
import com.etcd.coordination.instrument.CallListener;
import com.etcd.coordination.instrument.CallStatus;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens a span named {@code coordination.<method>} when a call starts and ends it
 * with the call's status when it finishes.
 */
public class TracingCallListener implements CallListener {

    private final TracingService tracing;
    private final Map<Long, Span> openSpans = new ConcurrentHashMap<>();

    public TracingCallListener(TracingService tracing) {
        this.tracing = tracing;
    }

    @Override
    public void onStart(CallInfo call) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("coordination.key", call.key());
        if (call.context() != null) {
            attributes.put("coordination.correlation_id", call.context().correlationId());
        }
        call.fields().forEach((name, value) -> attributes.put("coordination." + name, String.valueOf(value)));
        openSpans.put(call.callId(), tracing.startSpan("coordination." + call.method(), attributes));
    }

    @Override
    public void onFinish(CallInfo call, String status) {
        Span span = openSpans.remove(call.callId());
        if (span == null) {
            return;
        }
        span.setAttribute("coordination.status", status);
        span.setStatus(CallStatus.isFailure(status) ? Span.SpanStatus.ERROR : Span.SpanStatus.OK);
        span.close();
    }

    /**
     * Ends the spans of calls that were still running; their status is unknown.
     */
    @Override
    public void onRemoved() {
        for (Long callId : openSpans.keySet()) {
            Span span = openSpans.remove(callId);
            if (span != null) {
                span.setAttribute("coordination.status", "unknown");
                span.close();
            }
        }
    }

    int openSpans() {
        return openSpans.size();
    }
}
