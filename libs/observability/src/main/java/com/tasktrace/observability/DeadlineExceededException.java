package com.tasktrace.observability;

import java.time.Instant;

/**
 * Thrown when work is attempted for a request whose deadline has already passed.
 */
public class DeadlineExceededException extends RuntimeException {

    private final String requestId;
    private final Instant deadline;

    public DeadlineExceededException(String operation, String requestId, Instant deadline) {
        super(operation + " aborted: deadline " + deadline + " exceeded for request " + requestId);
        this.requestId = requestId;
        this.deadline = deadline;
    }

    public String requestId() {
        return requestId;
    }

    public Instant deadline() {
        return deadline;
    }
}
