package com.tasktrace.taskservice.config;

import com.tasktrace.observability.RequestMetrics;
import com.tasktrace.observability.SpanHelper;
import com.tasktrace.observability.TelemetryExporters;
import com.tasktrace.observability.TelemetryProviders;
import com.tasktrace.observability.TelemetrySettings;
import com.tasktrace.taskservice.domain.TaskRepository;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the telemetry providers into the application context.
 *
 * <p>The providers are built once from {@link TaskServiceProperties} and shut down when the
 * context closes. Spring stops the web server (graceful shutdown) before destroying singletons, so
 * in-flight requests finish and their telemetry is queued before the providers flush. Any failure
 * here, including a second instrument registration, aborts startup.
 *
 * <p>Exporters default to OTLP/gRPC. A {@link TelemetryExporters} bean, if one is defined
 * (tests do), replaces them.
 */
@Configuration
public class TelemetryConfig {

    @Bean(destroyMethod = "shutdown")
    public TelemetryProviders telemetryProviders(
            TaskServiceProperties properties, ObjectProvider<TelemetryExporters> exporters) {
        TelemetrySettings settings = properties.toTelemetrySettings();
        return TelemetryProviders.create(
                settings, exporters.getIfAvailable(() -> TelemetryExporters.otlp(settings)));
    }

    @Bean
    public SpanHelper spanHelper(TelemetryProviders telemetryProviders) {
        return telemetryProviders.spanHelper();
    }

    @Bean
    public RequestMetrics requestMetrics(
            TelemetryProviders telemetryProviders, TaskRepository taskRepository) {
        return telemetryProviders.registerRequestMetrics(taskRepository::count);
    }
}
