package com.outbound.routing.application.port.in;

import com.outbound.routing.domain.entity.RawEngagementEvent;
import com.outbound.routing.domain.entity.RoutingOutcome;

/**
 * Primary (inbound) port: ingest one engagement event.
 * <p>
 * Validates, applies to the lead's aggregate, rescores, evaluates the
 * transition rules and executes any resulting transition.
 * </p>
 */
public interface ProcessEventUseCase {

    /**
     * @param raw event as submitted by a platform adapter
     * @return pipeline outcome; {@code apply().applied()} is false for a duplicate
     * @throws com.outbound.routing.domain.exception.InvalidEventException           malformed input
     * @throws com.outbound.routing.domain.exception.ConflictRetryExhaustedException hot-lead contention
     * @throws com.outbound.routing.domain.exception.StoreUnavailableException       store down
     */
    RoutingOutcome process(RawEngagementEvent raw);
}
