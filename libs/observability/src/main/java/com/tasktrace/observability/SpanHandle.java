package com.tasktrace.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An open span together with the {@link CorrelationContext} derived for it.
 * <p>
 * Ending is idempotent: the first {@link #end()} closes the span and hands it to the span
 * processor, later calls do nothing. Implements {@link AutoCloseable} so spans are closed on every
 * path through {@code try}-with-resources.
 */
public final class SpanHandle implements AutoCloseable {

    /** Attribute set on spans whose request ran out of time. */
    public static final String ATTR_CANCELLED = "request.cancelled";

    private final Span span;
    private final CorrelationContext context;
    private final AtomicBoolean ended = new AtomicBoolean();

    SpanHandle(Span span, CorrelationContext context) {
        this.span = span;
        this.context = context;
    }

    /**
     * Returns the context to pass to every downstream call made within this span.
     */
    public CorrelationContext context() {
        return context;
    }

    public SpanHandle setAttribute(String key, String value) {
        if (value != null) {
            span.setAttribute(key, value);
        }
        return this;
    }

    public SpanHandle setAttribute(String key, long value) {
        span.setAttribute(key, value);
        return this;
    }

    public SpanHandle setAttribute(String key, boolean value) {
        span.setAttribute(key, value);
        return this;
    }

    public SpanHandle markOk() {
        span.setStatus(StatusCode.OK);
        return this;
    }

    /**
     * Marks the span as failed and records the exception as a span event.
     */
    public SpanHandle fail(Throwable error) {
        span.setStatus(StatusCode.ERROR, error.getMessage() != null ? error.getMessage() : error.toString());
        span.recordException(error);
        return this;
    }

    /**
     * Marks the span as failed with a description and no exception event.
     */
    public SpanHandle fail(String description) {
        span.setStatus(StatusCode.ERROR, description);
        return this;
    }

    /**
     * Marks the span as cancelled because its request deadline passed.
     */
    public SpanHandle cancel(DeadlineExceededException error) {
        span.setAttribute(ATTR_CANCELLED, true);
        return fail(error);
    }

    /**
     * Ends the span if it is still open.
     *
     * @return {@code true} if this call ended the span, {@code false} if it was already ended
     */
    public boolean end() {
        if (!ended.compareAndSet(false, true)) {
            return false;
        }
        span.end();
        return true;
    }

    public boolean isEnded() {
        return ended.get();
    }

    @Override
    public void close() {
        end();
    }
}
