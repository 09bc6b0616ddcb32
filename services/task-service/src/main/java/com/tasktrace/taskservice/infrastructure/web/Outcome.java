package com.tasktrace.taskservice.infrastructure.web;

/**
 * Classification of a finished request, recorded as the {@code outcome} attribute of the server
 * span.
 */
public enum Outcome {
    SUCCESS("success"),
    NOT_FOUND("not_found"),
    BAD_INPUT("bad_input"),
    INTERNAL_ERROR("internal_error");

    private final String label;

    Outcome(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Maps a response status: 2xx and 3xx are successes, 404 is not-found, any other 4xx is bad
     * input and everything else is an internal error.
     */
    public static Outcome fromStatus(int status) {
        if (status >= 200 && status < 400) {
            return SUCCESS;
        }
        if (status == 404) {
            return NOT_FOUND;
        }
        if (status >= 400 && status < 500) {
            return BAD_INPUT;
        }
        return INTERNAL_ERROR;
    }
}
