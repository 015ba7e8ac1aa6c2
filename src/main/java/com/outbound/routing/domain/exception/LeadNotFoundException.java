package com.outbound.routing.domain.exception;

/**
 * No aggregate exists for the requested lead.
 */
public class LeadNotFoundException extends RuntimeException {

    private final String leadId;

    public LeadNotFoundException(String leadId) {
        super("No engagement signal for lead " + leadId);
        this.leadId = leadId;
    }

    public String getLeadId() {
        return leadId;
    }
}
