package com.tasktrace.taskservice.config;

import com.tasktrace.observability.TelemetrySettings;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for the task service, bound from {@code tasktrace.service.*}.
 *
 * <p>{@code application.yml} maps the deployment environment variables onto these properties:
 *
 * <pre>
 * tasktrace:
 *   service:
 *     name: ${OTEL_SERVICE_NAME:task-service}
 *     environment: ${ENVIRONMENT:development}
 *     otlp-endpoint: ${OTEL_EXPORTER_OTLP_ENDPOINT:localhost:4317}
 *     request-timeout: 60s
 * </pre>
 *
 * @param name service name reported as {@code service.name}. Required.
 * @param environment deployment environment reported as {@code deployment.environment}.
 * @param otlpEndpoint collector address for all three OTLP/gRPC exporters.
 * @param requestTimeout time budget of one request, measured from filter entry.
 * @param shutdownTimeout time each telemetry shutdown phase may spend flushing.
 * @param metricInterval export period of the metric reader.
 * @param spanScheduleDelay delay between span batch exports.
 * @param spanMaxQueueSize capacity of the span queue.
 * @param spanMaxExportBatchSize maximum spans per export call.
 */
@ConfigurationProperties(prefix = "tasktrace.service")
@Validated
public record TaskServiceProperties(
        @NotBlank String name,
        String environment,
        String otlpEndpoint,
        Duration requestTimeout,
        Duration shutdownTimeout,
        Duration metricInterval,
        Duration spanScheduleDelay,
        int spanMaxQueueSize,
        int spanMaxExportBatchSize) {

    public static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(60);

    /** Applies defaults for optional fields; runs before Bean Validation. */
    public TaskServiceProperties {
        if (environment == null || environment.isBlank()) {
            environment = TelemetrySettings.DEFAULT_ENVIRONMENT;
        }
        if (otlpEndpoint == null || otlpEndpoint.isBlank()) {
            otlpEndpoint = TelemetrySettings.DEFAULT_OTLP_ENDPOINT;
        }
        if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
            requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        }
    }

    /** Settings for the telemetry providers; unset tuning values take the library defaults. */
    public TelemetrySettings toTelemetrySettings() {
        return new TelemetrySettings(
                name,
                environment,
                otlpEndpoint,
                metricInterval,
                spanScheduleDelay,
                spanMaxQueueSize,
                spanMaxExportBatchSize,
                shutdownTimeout);
    }
}
