package com.etcd.coordination.instrument;

/**
 * One in-flight operation. Closing the scope emits the finish event exactly once,
 * with {@link CallStatus#ERROR} unless a status was recorded first.
 * Confined to the thread running the operation.
 */
public final class CallScope implements AutoCloseable {

    private final CallEvents events;
    private final CallInfo call;
    private String status = CallStatus.ERROR;
    private boolean finished;

    CallScope(CallEvents events, CallInfo call) {
        this.events = events;
        this.call = call;
    }

    public CallInfo call() {
        return call;
    }

    public void status(String status) {
        this.status = status;
    }

    public String status() {
        return status;
    }

    @Override
    public void close() {
        if (!finished) {
            finished = true;
            events.finish(call, status);
        }
    }
}
