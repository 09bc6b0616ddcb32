package com.tasktrace.observability;

import java.time.Duration;

/**
 * Settings shared by the three telemetry providers.
 * <p>
 * The service name and environment become resource attributes on every span, metric point and
 * log record. Optional tuning values fall back to defaults when {@code null} or non-positive.
 *
 * @param serviceName            logical service name ({@code service.name}), required
 * @param environment            deployment environment ({@code deployment.environment})
 * @param otlpEndpoint           collector address, either {@code host:port} or a URL
 * @param metricInterval         period of the metric reader (default 10s)
 * @param spanScheduleDelay      delay between span batch exports (default 5s)
 * @param spanMaxQueueSize       span queue capacity; spans arriving when full are dropped (default 2048)
 * @param spanMaxExportBatchSize maximum spans per export call (default 512)
 * @param shutdownTimeout        time each shutdown phase may spend flushing (default 10s)
 */
public record TelemetrySettings(
        String serviceName,
        String environment,
        String otlpEndpoint,
        Duration metricInterval,
        Duration spanScheduleDelay,
        int spanMaxQueueSize,
        int spanMaxExportBatchSize,
        Duration shutdownTimeout
) {

    public static final String DEFAULT_ENVIRONMENT = "development";
    public static final String DEFAULT_OTLP_ENDPOINT = "localhost:4317";
    public static final Duration DEFAULT_METRIC_INTERVAL = Duration.ofSeconds(10);
    public static final Duration DEFAULT_SPAN_SCHEDULE_DELAY = Duration.ofSeconds(5);
    public static final int DEFAULT_SPAN_MAX_QUEUE_SIZE = 2048;
    public static final int DEFAULT_SPAN_MAX_EXPORT_BATCH_SIZE = 512;
    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(10);

    public TelemetrySettings {
        if (serviceName == null || serviceName.isBlank()) {
            throw new IllegalArgumentException("serviceName must not be null or blank");
        }
        if (environment == null || environment.isBlank()) {
            environment = DEFAULT_ENVIRONMENT;
        }
        if (otlpEndpoint == null || otlpEndpoint.isBlank()) {
            otlpEndpoint = DEFAULT_OTLP_ENDPOINT;
        }
        metricInterval = positiveOr(metricInterval, DEFAULT_METRIC_INTERVAL);
        spanScheduleDelay = positiveOr(spanScheduleDelay, DEFAULT_SPAN_SCHEDULE_DELAY);
        shutdownTimeout = positiveOr(shutdownTimeout, DEFAULT_SHUTDOWN_TIMEOUT);
        if (spanMaxQueueSize <= 0) {
            spanMaxQueueSize = DEFAULT_SPAN_MAX_QUEUE_SIZE;
        }
        if (spanMaxExportBatchSize <= 0) {
            spanMaxExportBatchSize = DEFAULT_SPAN_MAX_EXPORT_BATCH_SIZE;
        }
        if (spanMaxExportBatchSize > spanMaxQueueSize) {
            throw new IllegalArgumentException("spanMaxExportBatchSize must not exceed spanMaxQueueSize");
        }
    }

    /**
     * Creates settings with default tuning values.
     */
    public static TelemetrySettings of(String serviceName, String environment, String otlpEndpoint) {
        return new TelemetrySettings(serviceName, environment, otlpEndpoint, null, null, 0, 0, null);
    }

    /**
     * Returns the collector endpoint as a URL, prefixing {@code http://} when no scheme is given.
     */
    public String otlpEndpointUrl() {
        if (otlpEndpoint.startsWith("http://") || otlpEndpoint.startsWith("https://")) {
            return otlpEndpoint;
        }
        return "http://" + otlpEndpoint;
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}
