package com.tasktrace.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tasktrace.observability.testing.InMemoryTelemetry;
import com.tasktrace.observability.testing.TestCorrelationContexts;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.logs.data.LogRecordData;
import io.opentelemetry.sdk.logs.export.LogRecordExporter;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;
import io.opentelemetry.sdk.trace.data.SpanData;
import io.opentelemetry.sdk.trace.export.SpanExporter;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link TelemetryProviders}: validates resource attributes, flush-on-shutdown,
 * shutdown ordering, repeated shutdown and lossy shutdown on timeout.
 */
@DisplayName("TelemetryProviders")
class TelemetryProvidersTest {

    /** Long schedule delay so nothing is exported before shutdown forces it. */
    private static final TelemetrySettings SLOW_EXPORT = new TelemetrySettings(
            "orders", "staging", null, null, Duration.ofMinutes(10), 0, 0, Duration.ofSeconds(5));

    /** Shared journal of exporter events, used to assert ordering across channels. */
    private final List<String> journal = new CopyOnWriteArrayList<>();

    private class RecordingSpanExporter implements SpanExporter {
        final List<SpanData> spans = new CopyOnWriteArrayList<>();

        @Override
        public CompletableResultCode export(Collection<SpanData> batch) {
            spans.addAll(batch);
            return CompletableResultCode.ofSuccess();
        }

        @Override
        public CompletableResultCode flush() {
            return CompletableResultCode.ofSuccess();
        }

        @Override
        public CompletableResultCode shutdown() {
            journal.add("spans-shutdown");
            return CompletableResultCode.ofSuccess();
        }
    }

    private final class RecordingLogExporter implements LogRecordExporter {
        final List<LogRecordData> records = new CopyOnWriteArrayList<>();

        @Override
        public CompletableResultCode export(Collection<LogRecordData> batch) {
            batch.forEach(r -> journal.add("log:" + r.getBody().asString()));
            records.addAll(batch);
            return CompletableResultCode.ofSuccess();
        }

        @Override
        public CompletableResultCode flush() {
            return CompletableResultCode.ofSuccess();
        }

        @Override
        public CompletableResultCode shutdown() {
            journal.add("logs-shutdown");
            return CompletableResultCode.ofSuccess();
        }
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null settings and exporters")
        void shouldRejectNulls() {
            assertThatThrownBy(() -> TelemetryProviders.create(null, new InMemoryTelemetry().exporters()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("settings");
            assertThatThrownBy(() -> TelemetryProviders.create(SLOW_EXPORT, null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("exporters");
        }

        @Test
        @DisplayName("should attach service name and environment to the resource")
        void shouldBuildResource() {
            var telemetry = new InMemoryTelemetry();
            TelemetryProviders providers = telemetry.start(SLOW_EXPORT);
            try {
                assertThat(providers.resource().getAttribute(TelemetryProviders.SERVICE_NAME)).isEqualTo("orders");
                assertThat(providers.resource().getAttribute(TelemetryProviders.DEPLOYMENT_ENVIRONMENT))
                        .isEqualTo("staging");
            } finally {
                telemetry.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("Shutdown")
    class Shutdown {

        @Test
        @DisplayName("should flush buffered spans and logs before stopping")
        void shouldFlushBufferedTelemetry() {
            var spans = new RecordingSpanExporter();
            var logs = new RecordingLogExporter();
            TelemetryProviders providers = TelemetryProviders.create(SLOW_EXPORT,
                    new TelemetryExporters(spans, InMemoryMetricReader.create(), logs));

            try (SpanHandle span = providers.spanHelper().startSpan(TestCorrelationContexts.createDefault(), "buffered")) {
                providers.logger(TelemetryProvidersTest.class).info(span.context(), "buffered line");
            }
            assertThat(spans.spans).isEmpty();

            assertThat(providers.shutdown()).isTrue();

            assertThat(spans.spans).extracting(SpanData::getName).containsExactly("buffered");
            assertThat(logs.records).extracting(r -> r.getBody().asString()).contains("buffered line");
        }

        @Test
        @DisplayName("should stop the logger provider after tracer and meter, exporting shutdown log lines")
        void shouldShutDownLoggerLast() {
            var spans = new RecordingSpanExporter();
            var logs = new RecordingLogExporter();
            TelemetryProviders providers = TelemetryProviders.create(SLOW_EXPORT,
                    new TelemetryExporters(spans, InMemoryMetricReader.create(), logs));

            providers.shutdown();

            assertThat(journal).containsSubsequence(
                    "spans-shutdown", "log:tracer and meter providers stopped", "logs-shutdown");
            assertThat(journal.get(journal.size() - 1)).isEqualTo("logs-shutdown");
        }

        @Test
        @DisplayName("should tolerate a second shutdown")
        void shouldTolerateSecondShutdown() {
            var telemetry = new InMemoryTelemetry();
            TelemetryProviders providers = telemetry.start();

            assertThat(providers.shutdown()).isTrue();
            assertThatCode(providers::shutdown).doesNotThrowAnyException();
            assertThatCode(providers::close).doesNotThrowAnyException();
            assertThat(providers.shutdown(Duration.ofMillis(1))).isTrue();
            assertThat(providers.isShutdown()).isTrue();
        }

        @Test
        @DisplayName("should give up after the timeout when an exporter hangs")
        void shouldGiveUpAfterTimeout() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            SpanExporter hanging = new RecordingSpanExporter() {
                @Override
                public CompletableResultCode export(Collection<SpanData> batch) {
                    CompletableResultCode result = new CompletableResultCode();
                    Thread waiter = new Thread(() -> {
                        try {
                            release.await();
                        } catch (InterruptedException e) {
                            Thread.currentThread().interrupt();
                        }
                        result.succeed();
                    });
                    waiter.setDaemon(true);
                    waiter.start();
                    return result;
                }
            };
            TelemetryProviders providers = TelemetryProviders.create(SLOW_EXPORT,
                    new TelemetryExporters(hanging, InMemoryMetricReader.create(), new RecordingLogExporter()));
            providers.spanHelper().startSpan(TestCorrelationContexts.createDefault(), "stuck").end();

            try {
                assertThat(providers.shutdown(Duration.ofMillis(200))).isFalse();
            } finally {
                release.countDown();
            }
        }

        @Test
        @DisplayName("should refuse instrument registration after shutdown")
        void shouldRefuseRegistrationAfterShutdown() {
            var telemetry = new InMemoryTelemetry();
            TelemetryProviders providers = telemetry.start();
            providers.shutdown();

            assertThatThrownBy(() -> providers.registerRequestMetrics(() -> 0))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
