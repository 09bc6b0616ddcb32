package com.tasktrace.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.TextMapPropagator;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.logs.SdkLoggerProvider;
import io.opentelemetry.sdk.logs.export.BatchLogRecordProcessor;
import io.opentelemetry.sdk.metrics.Aggregation;
import io.opentelemetry.sdk.metrics.InstrumentSelector;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.View;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.export.BatchSpanProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongSupplier;

/**
 * Owns the tracer, meter and logger providers of one process.
 * <p>
 * The three providers share a {@link Resource} carrying {@code service.name} and
 * {@code deployment.environment}. Each owns its own background worker: the batch span processor,
 * the metric reader and the batch log record processor. Nothing is registered globally; the
 * instance is handed to the components that need it.
 * <p>
 * {@link #shutdown(Duration)} runs in two phases. The tracer and meter providers flush first
 * (concurrently), then the logger provider, so log records describing the shutdown are still
 * exported. Each phase waits up to the timeout; data still buffered afterwards is lost and a
 * warning is logged. Shutdown happens at most once: later calls return {@code true} without doing
 * anything.
 */
public final class TelemetryProviders implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TelemetryProviders.class);

    /** Instrumentation scope name for tracers and meters handed out by this class. */
    public static final String INSTRUMENTATION_SCOPE = "com.tasktrace";

    public static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
    public static final AttributeKey<String> DEPLOYMENT_ENVIRONMENT =
            AttributeKey.stringKey("deployment.environment");

    private final TelemetrySettings settings;
    private final Resource resource;
    private final SdkTracerProvider tracerProvider;
    private final SdkMeterProvider meterProvider;
    private final SdkLoggerProvider loggerProvider;
    private final SpanHelper spanHelper;
    private final SensitiveDataRedactor redactor = new SensitiveDataRedactor();
    private final CorrelatedLogger lifecycleLog;
    private final AtomicBoolean shutdown = new AtomicBoolean();
    private RequestMetrics requestMetrics;

    private TelemetryProviders(TelemetrySettings settings, TelemetryExporters exporters) {
        this.settings = settings;
        this.resource = Resource.getDefault().merge(Resource.create(Attributes.of(
                SERVICE_NAME, settings.serviceName(),
                DEPLOYMENT_ENVIRONMENT, settings.environment())));

        this.tracerProvider = SdkTracerProvider.builder()
                .setResource(resource)
                .addSpanProcessor(BatchSpanProcessor.builder(exporters.spanExporter())
                        .setScheduleDelay(settings.spanScheduleDelay())
                        .setMaxQueueSize(settings.spanMaxQueueSize())
                        .setMaxExportBatchSize(settings.spanMaxExportBatchSize())
                        .build())
                .build();

        // Bucket boundaries are part of the provider, not of individual observations.
        this.meterProvider = SdkMeterProvider.builder()
                .setResource(resource)
                .registerMetricReader(exporters.metricReader())
                .registerView(
                        InstrumentSelector.builder().setName(RequestMetrics.REQUEST_DURATION).build(),
                        View.builder()
                                .setAggregation(Aggregation.explicitBucketHistogram(RequestMetrics.DURATION_BUCKETS))
                                .build())
                .build();

        this.loggerProvider = SdkLoggerProvider.builder()
                .setResource(resource)
                .addLogRecordProcessor(BatchLogRecordProcessor.builder(exporters.logRecordExporter())
                        .setScheduleDelay(settings.spanScheduleDelay())
                        .build())
                .build();

        this.spanHelper = new SpanHelper(tracerProvider.get(INSTRUMENTATION_SCOPE));
        this.lifecycleLog = logger(TelemetryProviders.class);
    }

    /**
     * Builds the three providers. Any failure here is a setup failure and must abort startup.
     *
     * @param settings  resource and tuning settings
     * @param exporters export end of each pipeline
     */
    public static TelemetryProviders create(TelemetrySettings settings, TelemetryExporters exporters) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (exporters == null) {
            throw new IllegalArgumentException("exporters must not be null");
        }
        TelemetryProviders providers = new TelemetryProviders(settings, exporters);
        log.info("Telemetry providers started for service={} environment={} endpoint={}",
                settings.serviceName(), settings.environment(), settings.otlpEndpointUrl());
        return providers;
    }

    /**
     * Returns the span helper backed by this instance's tracer provider.
     */
    public SpanHelper spanHelper() {
        return spanHelper;
    }

    /**
     * Returns a correlated logger named after {@code owner}, exporting through this instance's
     * logger provider.
     */
    public CorrelatedLogger logger(Class<?> owner) {
        return new CorrelatedLogger(owner.getName(), loggerProvider, redactor, Clock.systemUTC());
    }

    /**
     * Registers the request instruments. Allowed once per instance; a second registration would
     * create duplicate instrument names and is rejected.
     *
     * @param taskCount non-blocking supplier sampled by the gauge on each metric collection
     * @throws IllegalStateException if the instruments are already registered or the providers are shut down
     */
    public synchronized RequestMetrics registerRequestMetrics(LongSupplier taskCount) {
        if (shutdown.get()) {
            throw new IllegalStateException("Telemetry providers are shut down");
        }
        if (requestMetrics != null) {
            throw new IllegalStateException("Instruments already registered: " + RequestMetrics.REQUESTS_TOTAL
                    + ", " + RequestMetrics.REQUEST_DURATION + ", " + RequestMetrics.TASKS_TOTAL);
        }
        requestMetrics = new RequestMetrics(meterProvider.get(INSTRUMENTATION_SCOPE), taskCount);
        return requestMetrics;
    }

    /**
     * Returns the propagator used to read inbound {@code traceparent} headers.
     */
    public TextMapPropagator propagator() {
        return W3CTraceContextPropagator.getInstance();
    }

    public Resource resource() {
        return resource;
    }

    public TelemetrySettings settings() {
        return settings;
    }

    /**
     * Exports everything buffered so far on all three channels, waiting up to {@code timeout}.
     *
     * @return {@code true} if every channel flushed successfully in time
     */
    public boolean forceFlush(Duration timeout) {
        CompletableResultCode all = CompletableResultCode.ofAll(List.of(
                tracerProvider.forceFlush(), meterProvider.forceFlush(), loggerProvider.forceFlush()));
        return all.join(timeout.toMillis(), TimeUnit.MILLISECONDS).isSuccess();
    }

    /**
     * Shuts down using {@link TelemetrySettings#shutdownTimeout()} for each phase.
     */
    public boolean shutdown() {
        return shutdown(settings.shutdownTimeout());
    }

    /**
     * Flushes and stops the providers: tracer and meter first, logger last.
     *
     * @param timeout maximum wait per phase
     * @return {@code true} if every provider flushed successfully in time
     */
    public boolean shutdown(Duration timeout) {
        if (!shutdown.compareAndSet(false, true)) {
            log.debug("Telemetry providers already shut down; ignoring repeated shutdown");
            return true;
        }
        lifecycleLog.info(null, "shutting down telemetry providers",
                Map.of("timeout_ms", timeout.toMillis()));

        CompletableResultCode traces = tracerProvider.shutdown();
        CompletableResultCode metrics = meterProvider.shutdown();
        boolean tracesOk = await("tracer", traces, timeout);
        boolean metricsOk = await("meter", metrics, timeout);

        lifecycleLog.info(null, "tracer and meter providers stopped",
                Map.of("traces_flushed", tracesOk, "metrics_flushed", metricsOk));

        boolean logsOk = await("logger", loggerProvider.shutdown(), timeout);
        log.info("Telemetry providers stopped (traces={}, metrics={}, logs={})", tracesOk, metricsOk, logsOk);
        return tracesOk && metricsOk && logsOk;
    }

    public boolean isShutdown() {
        return shutdown.get();
    }

    @Override
    public void close() {
        shutdown();
    }

    private static boolean await(String provider, CompletableResultCode result, Duration timeout) {
        result.join(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!result.isDone()) {
            log.warn("{} provider did not finish flushing within {}; unexported data was dropped", provider, timeout);
            return false;
        }
        if (!result.isSuccess()) {
            log.warn("{} provider reported an export failure during shutdown; some data was not delivered", provider);
            return false;
        }
        return true;
    }
}
