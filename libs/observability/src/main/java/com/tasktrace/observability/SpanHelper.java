package com.tasktrace.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.Tracer;

import java.util.function.Function;

/**
 * Opens spans as children of an explicitly passed {@link CorrelationContext}.
 * <p>
 * Nothing is read from or written to thread-local "current" context: the parent comes from the
 * argument and the child context is returned inside the {@link SpanHandle}. Every span carries the
 * request ID as {@code request.id}.
 */
public final class SpanHelper {

    /** Attribute key for the request ID attached to every span. */
    public static final AttributeKey<String> REQUEST_ID = AttributeKey.stringKey("request.id");

    private final Tracer tracer;

    /**
     * Creates a SpanHelper backed by the given tracer.
     *
     * @param tracer tracer obtained from the tracer provider owned by {@link TelemetryProviders}
     */
    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Opens an INTERNAL span with no extra attributes.
     */
    public SpanHandle startSpan(CorrelationContext parent, String spanName) {
        return startSpan(parent, spanName, SpanKind.INTERNAL, Attributes.empty());
    }

    /**
     * Opens an INTERNAL span with the given attributes.
     */
    public SpanHandle startSpan(CorrelationContext parent, String spanName, Attributes attributes) {
        return startSpan(parent, spanName, SpanKind.INTERNAL, attributes);
    }

    /**
     * Opens a span as a child of the parent's active span (or as a new trace when the parent has
     * none). The caller owns the returned handle and must end it.
     *
     * @param parent     context of the enclosing operation
     * @param spanName   name for the span
     * @param kind       span kind (SERVER for request ingress, INTERNAL otherwise)
     * @param attributes initial span attributes
     * @return the open span and its derived context
     */
    public SpanHandle startSpan(CorrelationContext parent, String spanName, SpanKind kind,
                                Attributes attributes) {
        if (parent == null) {
            throw new IllegalArgumentException("parent context must not be null");
        }
        Span span = tracer.spanBuilder(spanName)
                .setParent(parent.otelContext())
                .setSpanKind(kind)
                .setAllAttributes(attributes)
                .setAttribute(REQUEST_ID, parent.requestId())
                .startSpan();
        return new SpanHandle(span, parent.child(span));
    }

    /**
     * Runs {@code work} inside a new INTERNAL span. The span is marked OK on return, ERROR (or
     * cancelled, for {@link DeadlineExceededException}) on exception, and always ended.
     *
     * @param parent     context of the enclosing operation
     * @param spanName   name for the span
     * @param attributes initial span attributes
     * @param work       receives the open span (whose context is the one to forward) and produces the result
     * @param <T>        result type
     * @return the result of {@code work}
     */
    public <T> T withSpan(CorrelationContext parent, String spanName, Attributes attributes,
                          Function<SpanHandle, T> work) {
        try (SpanHandle handle = startSpan(parent, spanName, attributes)) {
            try {
                T result = work.apply(handle);
                handle.markOk();
                return result;
            } catch (DeadlineExceededException e) {
                handle.cancel(e);
                throw e;
            } catch (RuntimeException e) {
                handle.fail(e);
                throw e;
            }
        }
    }

    /**
     * Returns the underlying tracer.
     */
    public Tracer tracer() {
        return tracer;
    }
}
