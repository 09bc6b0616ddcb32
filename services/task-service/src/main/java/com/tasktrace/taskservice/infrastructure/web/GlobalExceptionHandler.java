package com.tasktrace.taskservice.infrastructure.web;

import com.tasktrace.observability.CorrelatedLogger;
import com.tasktrace.observability.CorrelationContext;
import com.tasktrace.observability.DeadlineExceededException;
import com.tasktrace.observability.TelemetryProviders;
import com.tasktrace.taskservice.domain.TaskNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import java.net.URI;
import java.time.Instant;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps exceptions to RFC 7807 {@link ProblemDetail} responses.
 *
 * <pre>
 * {
 *   "type": "https://tasktrace.dev/errors/not-found",
 *   "title": "Not Found",
 *   "status": 404,
 *   "detail": "task 5b1f... not found",
 *   "timestamp": "2026-01-01T10:30:00Z",
 *   "requestId": "abc-123"
 * }
 * </pre>
 *
 * <p>Every body carries the request ID, which is also the {@code X-Request-ID} response header and
 * the {@code request.id} attribute of the request's spans and log records.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final String ERROR_TYPE_BASE = "https://tasktrace.dev/errors/";

    private final CorrelatedLogger log;

    public GlobalExceptionHandler(TelemetryProviders telemetry) {
        this.log = telemetry.logger(GlobalExceptionHandler.class);
    }

    @ExceptionHandler(TaskNotFoundException.class)
    public ProblemDetail handleNotFound(TaskNotFoundException ex, HttpServletRequest request) {
        return problem(request, HttpStatus.NOT_FOUND, "Not Found", "not-found", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ProblemDetail handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        String detail =
                ex.getBindingResult().getFieldErrors().stream()
                        .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                        .reduce((a, b) -> a + "; " + b)
                        .orElse("Validation failed");
        log.warn(contextOf(request), "validation failed", Map.of("detail", detail));
        return problem(request, HttpStatus.BAD_REQUEST, "Validation Error", "validation", detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ProblemDetail handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        log.warn(contextOf(request), "invalid request body", Map.of("error", ex.getMostSpecificCause().toString()));
        return problem(
                request, HttpStatus.BAD_REQUEST, "Bad Request", "bad-request", "invalid request body");
    }

    @ExceptionHandler(DeadlineExceededException.class)
    public ProblemDetail handleDeadline(DeadlineExceededException ex, HttpServletRequest request) {
        log.error(contextOf(request), "request deadline exceeded", ex);
        request.setAttribute(RequestTelemetryFilter.CANCELLED_ATTRIBUTE, ex);
        return problem(
                request,
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "deadline-exceeded",
                "request deadline exceeded");
    }

    @ExceptionHandler(Exception.class)
    public ProblemDetail handleGeneric(Exception ex, HttpServletRequest request) {
        if (ex instanceof ErrorResponse errorResponse) {
            // Framework errors (unknown route, unsupported method, ...) keep their own status.
            ProblemDetail body = errorResponse.getBody();
            enrich(body, request);
            return body;
        }
        log.error(contextOf(request), "internal server error", ex);
        return problem(
                request,
                HttpStatus.INTERNAL_SERVER_ERROR,
                "Internal Server Error",
                "internal",
                "An unexpected error occurred");
    }

    private ProblemDetail problem(
            HttpServletRequest request, HttpStatus status, String title, String type, String detail) {
        ProblemDetail problem = ProblemDetail.forStatusAndDetail(status, detail);
        problem.setTitle(title);
        problem.setType(URI.create(ERROR_TYPE_BASE + type));
        enrich(problem, request);
        return problem;
    }

    private static void enrich(ProblemDetail problem, HttpServletRequest request) {
        problem.setProperty("timestamp", Instant.now().toString());
        CorrelationContext context = contextOf(request);
        if (context != null) {
            problem.setProperty("requestId", context.requestId());
        }
    }

    private static CorrelationContext contextOf(HttpServletRequest request) {
        return request.getAttribute(RequestTelemetryFilter.CONTEXT_ATTRIBUTE) instanceof CorrelationContext ctx
                ? ctx
                : null;
    }
}
