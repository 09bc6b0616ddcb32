package com.tasktrace.observability;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import com.tasktrace.observability.testing.InMemoryTelemetry;
import io.opentelemetry.sdk.metrics.data.HistogramPointData;
import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.metrics.data.MetricData;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link RequestMetrics}: validates counter attributes, fixed histogram buckets, the
 * pull-based task gauge and single registration.
 */
@DisplayName("RequestMetrics")
class RequestMetricsTest {

    private static final String ROUTE = "/api/v1/tasks/{id}";

    private InMemoryTelemetry telemetry;
    private TelemetryProviders providers;
    private AtomicLong taskCount;
    private RequestMetrics metrics;

    @BeforeEach
    void setUp() {
        telemetry = new InMemoryTelemetry();
        providers = telemetry.start();
        taskCount = new AtomicLong();
        metrics = providers.registerRequestMetrics(taskCount::get);
    }

    @AfterEach
    void cleanup() {
        telemetry.shutdown();
    }

    private static long millis(long ms) {
        return TimeUnit.MILLISECONDS.toNanos(ms);
    }

    private HistogramPointData durationPoint() {
        MetricData metric = telemetry.metric(RequestMetrics.REQUEST_DURATION).orElseThrow();
        return metric.getHistogramData().getPoints().iterator().next();
    }

    private static List<Long> cumulative(HistogramPointData point) {
        List<Long> result = new ArrayList<>();
        long running = 0;
        for (Long count : point.getCounts()) {
            running += count;
            result.add(running);
        }
        return result;
    }

    @Nested
    @DisplayName("Registration")
    class Registration {

        @Test
        @DisplayName("should reject a second registration on the same providers")
        void shouldRejectDuplicateRegistration() {
            assertThatThrownBy(() -> providers.registerRequestMetrics(() -> 0))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining(RequestMetrics.REQUESTS_TOTAL);
        }

        @Test
        @DisplayName("should reject a null task count supplier")
        void shouldRejectNullSupplier() {
            var other = new InMemoryTelemetry();
            try {
                TelemetryProviders fresh = other.start();
                assertThatThrownBy(() -> fresh.registerRequestMetrics(null))
                        .isInstanceOf(IllegalArgumentException.class)
                        .hasMessageContaining("taskCount");
            } finally {
                other.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("Request counter")
    class Counter {

        @Test
        @DisplayName("should count requests per method, route template and status")
        void shouldCountPerAttributeSet() {
            metrics.recordRequest("GET", ROUTE, 200, millis(3));
            metrics.recordRequest("GET", ROUTE, 200, millis(4));
            metrics.recordRequest("GET", ROUTE, 404, millis(1));

            MetricData metric = telemetry.metric(RequestMetrics.REQUESTS_TOTAL).orElseThrow();
            assertThat(metric.getUnit()).isEqualTo("{request}");

            var points = metric.getLongSumData().getPoints();
            assertThat(points).hasSize(2);
            LongPointData ok = points.stream()
                    .filter(p -> p.getAttributes().get(RequestMetrics.HTTP_STATUS_CODE) == 200L)
                    .findFirst()
                    .orElseThrow();
            assertThat(ok.getValue()).isEqualTo(2);
            assertThat(ok.getAttributes().get(RequestMetrics.HTTP_METHOD)).isEqualTo("GET");
            assertThat(ok.getAttributes().get(RequestMetrics.HTTP_ROUTE)).isEqualTo(ROUTE);
            assertThat(metric.getLongSumData().isMonotonic()).isTrue();
        }
    }

    @Nested
    @DisplayName("Duration histogram")
    class Histogram {

        @Test
        @DisplayName("should use the fixed bucket boundaries")
        void shouldUseFixedBoundaries() {
            metrics.recordRequest("GET", ROUTE, 200, millis(1));

            assertThat(durationPoint().getBoundaries()).containsExactlyElementsOf(RequestMetrics.DURATION_BUCKETS);
            assertThat(telemetry.metric(RequestMetrics.REQUEST_DURATION).orElseThrow().getUnit()).isEqualTo("s");
        }

        @Test
        @DisplayName("should count a 0.2s observation in the cumulative 0.25 bucket")
        void shouldPlaceObservationInQuarterSecondBucket() {
            metrics.recordRequest("POST", "/api/v1/tasks", 201, millis(200));

            HistogramPointData point = durationPoint();
            int quarterSecond = RequestMetrics.DURATION_BUCKETS.indexOf(0.25);
            List<Long> cumulative = cumulative(point);

            assertThat(cumulative.get(quarterSecond)).isEqualTo(1);
            assertThat(cumulative.get(quarterSecond - 1)).isZero();
            assertThat(point.getSum()).isCloseTo(0.2, within(1e-9));
        }

        @Test
        @DisplayName("should keep cumulative bucket counts non-decreasing as observations accumulate")
        void shouldKeepBucketCountsMonotonic() {
            long[] samples = {2, 7, 30, 90, 200, 400, 800, 2000, 20000};
            List<Long> previous = null;
            for (long sample : samples) {
                metrics.recordRequest("GET", "/api/v1/tasks", 200, millis(sample));
                List<Long> current = cumulative(durationPoint());

                for (int i = 1; i < current.size(); i++) {
                    assertThat(current.get(i)).isGreaterThanOrEqualTo(current.get(i - 1));
                }
                if (previous != null) {
                    for (int i = 0; i < current.size(); i++) {
                        assertThat(current.get(i)).isGreaterThanOrEqualTo(previous.get(i));
                    }
                }
                previous = current;
            }
            assertThat(durationPoint().getCount()).isEqualTo(samples.length);
        }
    }

    @Nested
    @DisplayName("Task gauge")
    class Gauge {

        @Test
        @DisplayName("should sample the supplier at collection time")
        void shouldSampleAtCollection() {
            taskCount.set(3);
            assertThat(gaugeValue()).isEqualTo(3);

            taskCount.set(7);
            assertThat(gaugeValue()).isEqualTo(7);
        }

        private long gaugeValue() {
            MetricData metric = telemetry.metric(RequestMetrics.TASKS_TOTAL).orElseThrow();
            return metric.getLongGaugeData().getPoints().iterator().next().getValue();
        }
    }
}
