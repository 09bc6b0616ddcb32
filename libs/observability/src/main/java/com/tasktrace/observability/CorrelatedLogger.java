package com.tasktrace.observability;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.logs.LogRecordBuilder;
import io.opentelemetry.api.logs.LoggerProvider;
import io.opentelemetry.api.logs.Severity;
import io.opentelemetry.context.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.slf4j.event.Level;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Structured logger that tags every record with the trace and span of the context it is given.
 * <p>
 * Each call writes to two channels:
 * <ul>
 *   <li>an OpenTelemetry log record, parented on the context's active span and queued in the
 *       batch log processor of the owning {@link TelemetryProviders};</li>
 *   <li>an SLF4J line, with {@code requestId}, {@code traceId} and {@code spanId} placed in MDC for
 *       the duration of the call so the console pattern can print them.</li>
 * </ul>
 * Passing {@code null}, or a context without an active span, is allowed: the record is emitted
 * without trace and span IDs. The SLF4J level of the owning class gates both channels.
 */
public final class CorrelatedLogger {

    static final AttributeKey<String> EXCEPTION_TYPE = AttributeKey.stringKey("exception.type");
    static final AttributeKey<String> EXCEPTION_MESSAGE = AttributeKey.stringKey("exception.message");

    private final Logger slf4j;
    private final io.opentelemetry.api.logs.Logger otelLogger;
    private final SensitiveDataRedactor redactor;
    private final Clock clock;

    CorrelatedLogger(String name, LoggerProvider loggerProvider, SensitiveDataRedactor redactor, Clock clock) {
        this.slf4j = LoggerFactory.getLogger(name);
        this.otelLogger = loggerProvider.get(name);
        this.redactor = redactor;
        this.clock = clock;
    }

    public void debug(CorrelationContext context, String message) {
        log(Level.DEBUG, context, message, Map.of(), null);
    }

    public void debug(CorrelationContext context, String message, Map<String, ?> fields) {
        log(Level.DEBUG, context, message, fields, null);
    }

    public void info(CorrelationContext context, String message) {
        log(Level.INFO, context, message, Map.of(), null);
    }

    public void info(CorrelationContext context, String message, Map<String, ?> fields) {
        log(Level.INFO, context, message, fields, null);
    }

    public void warn(CorrelationContext context, String message) {
        log(Level.WARN, context, message, Map.of(), null);
    }

    public void warn(CorrelationContext context, String message, Map<String, ?> fields) {
        log(Level.WARN, context, message, fields, null);
    }

    public void error(CorrelationContext context, String message) {
        log(Level.ERROR, context, message, Map.of(), null);
    }

    public void error(CorrelationContext context, String message, Map<String, ?> fields) {
        log(Level.ERROR, context, message, fields, null);
    }

    public void error(CorrelationContext context, String message, Throwable error) {
        log(Level.ERROR, context, message, Map.of(), error);
    }

    private void log(Level level, CorrelationContext context, String message, Map<String, ?> fields,
                     Throwable error) {
        if (!slf4j.isEnabledForLevel(level)) {
            return;
        }
        Attributes attributes = redactor.redact(fields);
        emit(level, context, message, attributes, error);
        write(level, context, message, attributes, error);
    }

    private void emit(Level level, CorrelationContext context, String message, Attributes attributes,
                      Throwable error) {
        LogRecordBuilder record = otelLogger.logRecordBuilder()
                .setContext(context != null ? context.otelContext() : Context.root())
                .setTimestamp(clock.instant())
                .setSeverity(severity(level))
                .setSeverityText(level.name())
                .setBody(message)
                .setAllAttributes(attributes);
        if (context != null) {
            record.setAttribute(SpanHelper.REQUEST_ID, context.requestId());
        }
        if (error != null) {
            record.setAttribute(EXCEPTION_TYPE, error.getClass().getName());
            if (error.getMessage() != null) {
                record.setAttribute(EXCEPTION_MESSAGE, error.getMessage());
            }
        }
        record.emit();
    }

    private void write(Level level, CorrelationContext context, String message, Attributes attributes,
                       Throwable error) {
        List<MDC.MDCCloseable> scopes = new ArrayList<>(3);
        try {
            if (context != null) {
                scopes.add(MDC.putCloseable(CorrelationContext.MDC_REQUEST_ID, context.requestId()));
                if (context.traceId() != null) {
                    scopes.add(MDC.putCloseable(CorrelationContext.MDC_TRACE_ID, context.traceId()));
                    scopes.add(MDC.putCloseable(CorrelationContext.MDC_SPAN_ID, context.spanId()));
                }
            }
            String line = attributes.isEmpty() ? message : message + " " + format(attributes);
            if (error != null) {
                slf4j.atLevel(level).setCause(error).log(line);
            } else {
                slf4j.atLevel(level).log(line);
            }
        } finally {
            scopes.forEach(MDC.MDCCloseable::close);
        }
    }

    private static String format(Attributes attributes) {
        return attributes.asMap().entrySet().stream()
                .map(e -> e.getKey().getKey() + "=" + e.getValue())
                .sorted()
                .collect(Collectors.joining(" "));
    }

    static Severity severity(Level level) {
        return switch (level) {
            case TRACE -> Severity.TRACE;
            case DEBUG -> Severity.DEBUG;
            case INFO -> Severity.INFO;
            case WARN -> Severity.WARN;
            case ERROR -> Severity.ERROR;
        };
    }

    /**
     * Returns the name of the underlying SLF4J logger.
     */
    public String name() {
        return slf4j.getName();
    }
}
