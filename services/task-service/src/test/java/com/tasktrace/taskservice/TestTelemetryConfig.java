package com.tasktrace.taskservice;

import com.tasktrace.observability.TelemetryExporters;
import com.tasktrace.observability.testing.InMemoryTelemetry;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;

/**
 * Replaces the OTLP exporters with in-memory ones so tests need no collector.
 *
 * <p>Spans and log records are batched: call {@code TelemetryProviders.forceFlush} before reading
 * them from the {@link InMemoryTelemetry} bean.
 */
@TestConfiguration
public class TestTelemetryConfig {

    @Bean
    public InMemoryTelemetry inMemoryTelemetry() {
        return new InMemoryTelemetry();
    }

    @Bean
    public TelemetryExporters telemetryExporters(InMemoryTelemetry inMemoryTelemetry) {
        return inMemoryTelemetry.exporters();
    }
}
