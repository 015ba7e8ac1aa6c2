package com.outbound.routing.domain.exception;

/**
 * Bounded ingestion queue is full. Nothing was acknowledged; retry later.
 */
public class IngestionRejectedException extends RuntimeException {

    public IngestionRejectedException(String message) {
        super(message);
    }

    public IngestionRejectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
