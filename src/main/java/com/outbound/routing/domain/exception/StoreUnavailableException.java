package com.outbound.routing.domain.exception;

/**
 * Durability layer is unreachable. Ingestion fails closed: nothing was accepted.
 */
public class StoreUnavailableException extends RuntimeException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
