package com.outbound.routing.application.port.in;

import com.outbound.routing.domain.valueobject.SweepReport;

/**
 * Primary (inbound) port: re-evaluate every lead against the transition rules.
 */
public interface ReconcileRoutingUseCase {

    /**
     * Runs (or resumes) a sweep until it completes or is cancelled.
     */
    SweepReport reconcile();

    /**
     * Requests cancellation of a running sweep; it stops after the current lead.
     */
    void cancel();
}
