package com.outbound.routing.domain.exception;

import com.outbound.routing.domain.valueobject.Platform;

/**
 * A backward move, a move out of terminal CRM, or a move to NONE was attempted.
 * <p>
 * This is a data-integrity alarm, not a normal error path: it is logged,
 * recorded as an incident and dropped. It is never retried or "fixed".
 * </p>
 */
public class IllegalTransitionException extends RuntimeException {

    private final String leadId;
    private final Platform from;
    private final Platform to;

    public IllegalTransitionException(String leadId, Platform from, Platform to, String detail) {
        super("Illegal transition " + from + " → " + to + " for lead " + leadId + ": " + detail);
        this.leadId = leadId;
        this.from = from;
        this.to = to;
    }

    public String getLeadId() {
        return leadId;
    }

    public Platform getFrom() {
        return from;
    }

    public Platform getTo() {
        return to;
    }
}
