package com.outbound.routing.adapters.in.rest;

import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import com.outbound.routing.domain.exception.ConflictRetryExhaustedException;
import com.outbound.routing.domain.exception.IngestionRejectedException;
import com.outbound.routing.domain.exception.InvalidEventException;
import com.outbound.routing.domain.exception.LeadNotFoundException;
import com.outbound.routing.domain.exception.StoreUnavailableException;

/**
 * Maps the routing exception taxonomy onto HTTP status codes.
 * <p>
 * Retriable failures answer 503 with {@code Retry-After} so webhook senders
 * back off instead of dropping the event.
 * </p>
 */
@RestControllerAdvice
public class RestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(RestExceptionHandler.class);

    static final String RETRY_AFTER_SECONDS = "5";

    @ExceptionHandler(InvalidEventException.class)
    public ResponseEntity<Map<String, Object>> handleInvalidEvent(InvalidEventException e) {
        Map<String, Object> body = error("invalid_event", e.getMessage());
        body.put("field", e.getField());
        return ResponseEntity.badRequest().body(body);
    }

    @ExceptionHandler({ IllegalArgumentException.class, HttpMessageNotReadableException.class })
    public ResponseEntity<Map<String, Object>> handleBadRequest(Exception e) {
        return ResponseEntity.badRequest().body(error("bad_request", e.getMessage()));
    }

    @ExceptionHandler(LeadNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleLeadNotFound(LeadNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(error("lead_not_found", e.getMessage()));
    }

    /**
     * The store refused the event itself; resubmitting it unchanged fails the same way.
     */
    @ExceptionHandler(NonTransientDataAccessException.class)
    public ResponseEntity<Map<String, Object>> handleStoreRejected(NonTransientDataAccessException e) {
        log.warn("action=request_store_rejected type={} error={}", e.getClass().getSimpleName(), e.getMessage());
        return ResponseEntity.unprocessableEntity().body(error("rejected_by_store", e.getMessage()));
    }

    @ExceptionHandler({ IngestionRejectedException.class, ConflictRetryExhaustedException.class,
            StoreUnavailableException.class, DataAccessResourceFailureException.class,
            DataAccessException.class })
    public ResponseEntity<Map<String, Object>> handleRetriable(RuntimeException e) {
        log.warn("action=request_retriable_failure type={} error={}", e.getClass().getSimpleName(), e.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS)
                .body(error("retry_later", e.getMessage()));
    }

    private static Map<String, Object> error(String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        return body;
    }
}
