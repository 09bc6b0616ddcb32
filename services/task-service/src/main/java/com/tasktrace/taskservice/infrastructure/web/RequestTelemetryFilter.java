package com.tasktrace.taskservice.infrastructure.web;

import com.tasktrace.observability.CorrelatedLogger;
import com.tasktrace.observability.CorrelationContext;
import com.tasktrace.observability.DeadlineExceededException;
import com.tasktrace.observability.RequestMetrics;
import com.tasktrace.observability.SpanHandle;
import com.tasktrace.observability.TelemetryProviders;
import com.tasktrace.taskservice.config.TaskServiceProperties;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.propagation.TextMapGetter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.time.Clock;
import java.util.Collections;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.HandlerMapping;

/**
 * Servlet filter that opens the telemetry scope of every HTTP request.
 *
 * <p>For each request it:
 *
 * <ol>
 *   <li>propagates {@code X-Request-ID}, or generates one, and echoes it on the response;
 *   <li>extracts a W3C {@code traceparent}, if any, as the remote parent;
 *   <li>builds the root {@link CorrelationContext} with the request deadline and opens the SERVER
 *       span {@code HTTP {method}};
 *   <li>hands the span's context to the controller as the {@link #CONTEXT_ATTRIBUTE} request
 *       attribute;
 *   <li>after the chain, records route template, status and {@link Outcome} on the span, ends it,
 *       and records one counter increment and one duration observation. A request that finished
 *       past its deadline is reported as cancelled with outcome {@code internal_error}, whatever
 *       status the chain wrote.
 * </ol>
 *
 * <p>{@code /health} is not instrumented. Runs at {@link Ordered#HIGHEST_PRECEDENCE} so the
 * duration covers every other filter.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class RequestTelemetryFilter extends OncePerRequestFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    /** Request attribute holding the {@link CorrelationContext} of the server span. */
    public static final String CONTEXT_ATTRIBUTE =
            "com.tasktrace.taskservice.infrastructure.web.RequestTelemetryFilter.context";

    /** Request attribute holding the {@link DeadlineExceededException} that ended the request. */
    public static final String CANCELLED_ATTRIBUTE =
            "com.tasktrace.taskservice.infrastructure.web.RequestTelemetryFilter.cancelled";

    static final String HEALTH_PATH = "/health";
    static final String UNMATCHED_ROUTE = "unmatched";

    private static final TextMapGetter<HttpServletRequest> HEADERS =
            new TextMapGetter<>() {
                @Override
                public Iterable<String> keys(HttpServletRequest carrier) {
                    return Collections.list(carrier.getHeaderNames());
                }

                @Override
                public String get(HttpServletRequest carrier, String key) {
                    return carrier == null ? null : carrier.getHeader(key);
                }
            };

    private final TelemetryProviders telemetry;
    private final RequestMetrics metrics;
    private final TaskServiceProperties properties;
    private final CorrelatedLogger log;

    public RequestTelemetryFilter(
            TelemetryProviders telemetry, RequestMetrics metrics, TaskServiceProperties properties) {
        this.telemetry = telemetry;
        this.metrics = metrics;
        this.properties = properties;
        this.log = telemetry.logger(RequestTelemetryFilter.class);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return HEALTH_PATH.equals(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long start = System.nanoTime();

        String requestId = request.getHeader(REQUEST_ID_HEADER);
        if (requestId == null || requestId.isBlank()) {
            requestId = UUID.randomUUID().toString();
        }
        response.setHeader(REQUEST_ID_HEADER, requestId);

        Context remoteParent = telemetry.propagator().extract(Context.root(), request, HEADERS);
        CorrelationContext root =
                CorrelationContext.root(
                        requestId, remoteParent, properties.requestTimeout(), Clock.systemUTC());
        String method = request.getMethod();

        SpanHandle span =
                telemetry
                        .spanHelper()
                        .startSpan(
                                root,
                                "HTTP " + method,
                                SpanKind.SERVER,
                                Attributes.of(RequestMetrics.HTTP_METHOD, method));
        request.setAttribute(CONTEXT_ATTRIBUTE, span.context());

        int status = HttpServletResponse.SC_INTERNAL_SERVER_ERROR;
        try {
            filterChain.doFilter(request, response);
            status = response.getStatus();
        } catch (IOException | ServletException | RuntimeException e) {
            span.fail(e);
            throw e;
        } finally {
            String route = routeOf(request);
            DeadlineExceededException expired = expiry(request, root, method);
            Outcome outcome = expired != null ? Outcome.INTERNAL_ERROR : Outcome.fromStatus(status);
            span.setAttribute(RequestMetrics.HTTP_ROUTE.getKey(), route)
                    .setAttribute(RequestMetrics.HTTP_STATUS_CODE.getKey(), (long) status)
                    .setAttribute("outcome", outcome.label());
            if (expired != null) {
                span.cancel(expired);
            } else if (outcome == Outcome.INTERNAL_ERROR) {
                span.fail("HTTP " + status);
            }

            long elapsed = System.nanoTime() - start;
            metrics.recordRequest(method, route, status, elapsed);
            log.info(
                    span.context(),
                    "request completed",
                    Map.of(
                            "http.method", method,
                            "http.route", route,
                            "http.status_code", status,
                            "duration_ms", TimeUnit.NANOSECONDS.toMillis(elapsed)));
            span.end();
        }
    }

    /**
     * Returns the deadline failure that ended the request, or one describing the overrun when the
     * chain finished after the deadline without reaching a deadline check. {@code null} otherwise.
     */
    private static DeadlineExceededException expiry(
            HttpServletRequest request, CorrelationContext root, String method) {
        if (request.getAttribute(CANCELLED_ATTRIBUTE) instanceof DeadlineExceededException flagged) {
            return flagged;
        }
        if (root.isExpired()) {
            return new DeadlineExceededException("HTTP " + method, root.requestId(), root.deadline());
        }
        return null;
    }

    /** Route template chosen by Spring MVC, never the raw path, to keep metric cardinality bounded. */
    private static String routeOf(HttpServletRequest request) {
        Object pattern = request.getAttribute(HandlerMapping.BEST_MATCHING_PATTERN_ATTRIBUTE);
        return pattern != null ? pattern.toString() : UNMATCHED_ROUTE;
    }
}
