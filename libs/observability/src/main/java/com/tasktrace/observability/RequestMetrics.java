package com.tasktrace.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;

import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.LongSupplier;

/**
 * HTTP request instruments: a request counter, a duration histogram and a task-count gauge.
 * <p>
 * Instances are created once per {@link TelemetryProviders} through
 * {@link TelemetryProviders#registerRequestMetrics(LongSupplier)}. The histogram bucket
 * boundaries are installed as a view when the meter provider is built, so they cannot vary
 * between observations. The gauge has no record call: the periodic reader invokes the
 * registered supplier when it collects, so the value is as fresh as the last collection.
 */
public final class RequestMetrics {

    /** Name of the monotonic request counter. */
    public static final String REQUESTS_TOTAL = "http_requests_total";

    /** Name of the request duration histogram. */
    public static final String REQUEST_DURATION = "http_request_duration_seconds";

    /** Name of the observable task-count gauge. */
    public static final String TASKS_TOTAL = "tasks_total";

    /** Upper bounds (seconds) of the duration histogram buckets. */
    public static final List<Double> DURATION_BUCKETS =
            List.of(0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0);

    public static final AttributeKey<String> HTTP_METHOD = AttributeKey.stringKey("http.method");
    public static final AttributeKey<String> HTTP_ROUTE = AttributeKey.stringKey("http.route");
    public static final AttributeKey<Long> HTTP_STATUS_CODE = AttributeKey.longKey("http.status_code");

    private final LongCounter requestCounter;
    private final DoubleHistogram requestDuration;

    RequestMetrics(Meter meter, LongSupplier taskCount) {
        if (taskCount == null) {
            throw new IllegalArgumentException("taskCount supplier must not be null");
        }
        this.requestCounter = meter.counterBuilder(REQUESTS_TOTAL)
                .setDescription("Total number of HTTP requests")
                .setUnit("{request}")
                .build();
        this.requestDuration = meter.histogramBuilder(REQUEST_DURATION)
                .setDescription("HTTP request duration in seconds")
                .setUnit("s")
                .build();
        meter.gaugeBuilder(TASKS_TOTAL)
                .ofLongs()
                .setDescription("Current number of tasks in the system")
                .setUnit("{task}")
                .buildWithCallback(measurement -> measurement.record(taskCount.getAsLong()));
    }

    /**
     * Records one completed request: one counter increment and one duration observation sharing
     * the same attributes.
     *
     * @param method        HTTP method
     * @param route         route template (e.g. {@code /api/v1/tasks/{id}}), never the raw path
     * @param statusCode    response status code
     * @param durationNanos elapsed time from request entry to response completion
     */
    public void recordRequest(String method, String route, int statusCode, long durationNanos) {
        Attributes attributes = Attributes.of(
                HTTP_METHOD, method,
                HTTP_ROUTE, route,
                HTTP_STATUS_CODE, (long) statusCode);
        requestCounter.add(1, attributes);
        requestDuration.record(durationNanos / (double) TimeUnit.SECONDS.toNanos(1), attributes);
    }
}
