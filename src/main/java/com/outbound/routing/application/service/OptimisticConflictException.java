package com.outbound.routing.application.service;

/**
 * Raised inside a unit of work when a version check fails, to roll it back
 * and retry from a fresh read.
 */
class OptimisticConflictException extends RuntimeException {

    OptimisticConflictException(String leadId, long expectedVersion) {
        super("Aggregate for lead " + leadId + " changed since version " + expectedVersion);
    }
}
