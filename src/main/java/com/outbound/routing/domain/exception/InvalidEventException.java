package com.outbound.routing.domain.exception;

/**
 * Raw event is malformed and was rejected before any state change.
 * The caller must fix the event before resubmitting; retrying as-is never helps.
 */
public class InvalidEventException extends RuntimeException {

    private final String field;

    public InvalidEventException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * @return name of the offending input field
     */
    public String getField() {
        return field;
    }
}
