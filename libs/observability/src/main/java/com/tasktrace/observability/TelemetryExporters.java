package com.tasktrace.observability;

import io.opentelemetry.exporter.otlp.logs.OtlpGrpcLogRecordExporter;
import io.opentelemetry.exporter.otlp.metrics.OtlpGrpcMetricExporter;
import io.opentelemetry.exporter.otlp.trace.OtlpGrpcSpanExporter;
import io.opentelemetry.sdk.logs.export.LogRecordExporter;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.metrics.export.PeriodicMetricReader;
import io.opentelemetry.sdk.trace.export.SpanExporter;

/**
 * The export end of each telemetry pipeline.
 * <p>
 * Production code uses {@link #otlp(TelemetrySettings)}; tests substitute in-memory exporters
 * (see {@code com.tasktrace.observability.testing.InMemoryTelemetry}).
 *
 * @param spanExporter      receives batches from the span processor
 * @param metricReader      collects metrics, invoking gauge callbacks on each collection
 * @param logRecordExporter receives batches from the log record processor
 */
public record TelemetryExporters(
        SpanExporter spanExporter,
        MetricReader metricReader,
        LogRecordExporter logRecordExporter
) {

    public TelemetryExporters {
        if (spanExporter == null) {
            throw new IllegalArgumentException("spanExporter must not be null");
        }
        if (metricReader == null) {
            throw new IllegalArgumentException("metricReader must not be null");
        }
        if (logRecordExporter == null) {
            throw new IllegalArgumentException("logRecordExporter must not be null");
        }
    }

    /**
     * Builds OTLP/gRPC exporters for all three channels against the configured collector. The
     * metric exporter is driven by a periodic reader at {@link TelemetrySettings#metricInterval()}.
     * Connections are established lazily, so an unreachable collector does not fail startup.
     */
    public static TelemetryExporters otlp(TelemetrySettings settings) {
        String endpoint = settings.otlpEndpointUrl();
        SpanExporter spans = OtlpGrpcSpanExporter.builder()
                .setEndpoint(endpoint)
                .build();
        MetricReader metrics = PeriodicMetricReader.builder(
                        OtlpGrpcMetricExporter.builder().setEndpoint(endpoint).build())
                .setInterval(settings.metricInterval())
                .build();
        LogRecordExporter logs = OtlpGrpcLogRecordExporter.builder()
                .setEndpoint(endpoint)
                .build();
        return new TelemetryExporters(spans, metrics, logs);
    }
}
