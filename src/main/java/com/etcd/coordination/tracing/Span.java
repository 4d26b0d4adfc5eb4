package com.etcd.coordination.tracing;

/**
 * One traced client call.
 * Implements {@link AutoCloseable} so spans can be used in try-with-resources blocks;
 * closing ends the span.
 */
public interface Span extends AutoCloseable {

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setStatus(SpanStatus status);

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
