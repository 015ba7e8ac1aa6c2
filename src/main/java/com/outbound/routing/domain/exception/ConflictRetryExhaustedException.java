package com.outbound.routing.domain.exception;

/**
 * Optimistic-version contention on a hot lead exceeded the retry budget.
 * Retriable: the caller should back off and resubmit.
 */
public class ConflictRetryExhaustedException extends RuntimeException {

    private final String leadId;
    private final int attempts;

    public ConflictRetryExhaustedException(String leadId, int attempts) {
        super("Version conflict on lead " + leadId + " not resolved after " + attempts + " attempts");
        this.leadId = leadId;
        this.attempts = attempts;
    }

    public String getLeadId() {
        return leadId;
    }

    public int getAttempts() {
        return attempts;
    }
}
