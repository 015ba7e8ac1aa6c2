package com.outbound.routing.domain.valueobject;

/**
 * Lead whose current snapshot qualifies for a transition not yet committed.
 *
 * @param leadId       lead identifier
 * @param email        primary email, may be null
 * @param current      platform the lead is on
 * @param target       platform the decision engine proposes
 * @param trigger      winning rule
 * @param currentScore score re-evaluated at query time
 * @param level        level at query time
 */
public record EligibleLead(String leadId, String email, Platform current, Platform target,
        TransitionTrigger trigger, double currentScore, EngagementLevel level) {
}
