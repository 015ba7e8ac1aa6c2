package com.outbound.routing.application.port.out;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import com.outbound.routing.domain.entity.PlatformTransition;

/**
 * Secondary (outbound) port: append-only transition log, doubling as the
 * command outbox.
 */
public interface TransitionLog {

    /**
     * @return false if a transition with the same idempotency key exists
     */
    boolean append(PlatformTransition transition);

    Optional<PlatformTransition> findByIdempotencyKey(String idempotencyKey);

    /**
     * @return the lead's transitions in commit order
     */
    List<PlatformTransition> findByLeadId(String leadId);

    /**
     * Transitions whose commands have not all been handed to the publisher.
     *
     * @param createdBefore only rows older than this
     * @param limit         batch size
     */
    List<PlatformTransition> findUndispatched(Instant createdBefore, int limit);

    void markDispatched(String transitionId, Instant dispatchedAt);

    long countAll();
}
