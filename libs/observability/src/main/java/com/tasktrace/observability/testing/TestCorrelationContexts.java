package com.tasktrace.observability.testing;

import com.tasktrace.observability.CorrelationContext;
import io.opentelemetry.context.Context;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Test factory for {@link CorrelationContext} instances with sensible defaults.
 * <p>
 * Placed in {@code src/main/java} so other modules can use it from their tests.
 */
public final class TestCorrelationContexts {

    /** Default request ID for tests. */
    public static final String DEFAULT_REQUEST_ID = "req-test-001";

    /** Default time budget for test contexts. */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofMinutes(1);

    private TestCorrelationContexts() {
        // Utility class, no instantiation
    }

    /**
     * Creates a root context (no active span) with the default request ID.
     */
    public static CorrelationContext createDefault() {
        return CorrelationContext.root(DEFAULT_REQUEST_ID, DEFAULT_TIMEOUT);
    }

    /**
     * Creates a root context with a random request ID.
     */
    public static CorrelationContext createRandom() {
        return CorrelationContext.root(UUID.randomUUID().toString(), DEFAULT_TIMEOUT);
    }

    /**
     * Creates a root context whose deadline has already passed.
     */
    public static CorrelationContext expired() {
        return new CorrelationContext(DEFAULT_REQUEST_ID, Context.root(), Instant.now().minusSeconds(1));
    }
}
