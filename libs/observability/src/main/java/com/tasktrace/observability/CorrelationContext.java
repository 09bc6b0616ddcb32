package com.tasktrace.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.context.Context;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Immutable correlation handle that flows through every layer a request traverses.
 * <p>
 * A root context is created at request ingress with the request ID and a deadline. Each nested
 * span derives a new context through {@link #child(Span)}; the parent instance is never
 * modified, so returning from a nested operation means going back to using the parent value.
 * The handle is passed explicitly as a method argument. Code that forgets to forward the derived
 * context still works, but its spans attach to the outer span instead.
 *
 * @param requestId   unique ID for this request (echoed in the {@code X-Request-ID} header)
 * @param otelContext OpenTelemetry context holding the active span (root context if none)
 * @param deadline    instant after which work for this request must stop
 */
public record CorrelationContext(
        String requestId,
        Context otelContext,
        Instant deadline
) {

    /**
     * MDC key for request ID.
     */
    public static final String MDC_REQUEST_ID = "requestId";

    /**
     * MDC key for span ID.
     */
    public static final String MDC_SPAN_ID = "spanId";

    /**
     * MDC key for trace ID.
     */
    public static final String MDC_TRACE_ID = "traceId";

    public CorrelationContext {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId must not be null or blank");
        }
        if (otelContext == null) {
            throw new IllegalArgumentException("otelContext must not be null");
        }
        if (deadline == null) {
            throw new IllegalArgumentException("deadline must not be null");
        }
    }

    /**
     * Creates a root context with no active span.
     *
     * @param requestId request identifier
     * @param timeout   time budget for the request, measured from now
     */
    public static CorrelationContext root(String requestId, Duration timeout) {
        return root(requestId, Context.root(), timeout, Clock.systemUTC());
    }

    /**
     * Creates a root context on top of an extracted remote parent (e.g. a W3C {@code traceparent}).
     */
    public static CorrelationContext root(String requestId, Context remoteParent, Duration timeout, Clock clock) {
        return new CorrelationContext(requestId, remoteParent, clock.instant().plus(timeout));
    }

    /**
     * Derives the context for a nested span. The receiver is left untouched.
     */
    public CorrelationContext child(Span span) {
        return new CorrelationContext(requestId, otelContext.with(span), deadline);
    }

    /**
     * Returns the span context of the active span, which is invalid when no span is active.
     */
    public SpanContext spanContext() {
        return Span.fromContext(otelContext).getSpanContext();
    }

    /**
     * Returns the active trace ID, or {@code null} if no span is active.
     */
    public String traceId() {
        SpanContext spanContext = spanContext();
        return spanContext.isValid() ? spanContext.getTraceId() : null;
    }

    /**
     * Returns the active span ID, or {@code null} if no span is active.
     */
    public String spanId() {
        SpanContext spanContext = spanContext();
        return spanContext.isValid() ? spanContext.getSpanId() : null;
    }

    public boolean isExpired() {
        return isExpired(Clock.systemUTC());
    }

    public boolean isExpired(Clock clock) {
        return !clock.instant().isBefore(deadline);
    }

    /**
     * Throws {@link DeadlineExceededException} if the deadline has passed.
     *
     * @param operation name of the operation about to run, used in the exception message
     */
    public void checkDeadline(String operation) {
        if (isExpired()) {
            throw new DeadlineExceededException(operation, requestId, deadline);
        }
    }
}
