package com.outbound.routing.application.service;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.entity.TransitionDecision;
import com.outbound.routing.domain.valueobject.DecisionPolicy;
import com.outbound.routing.domain.valueobject.EventSource;
import com.outbound.routing.domain.valueobject.EventType;
import com.outbound.routing.domain.valueobject.Platform;
import com.outbound.routing.domain.valueobject.TransitionTrigger;

/**
 * Stateless transition rule engine.
 * <p>
 * Evaluates the rule table against {@code (current platform, snapshot,
 * triggering event)} and proposes at most one forward move. Never mutates
 * anything; the executor commits.
 * </p>
 *
 * <pre>
 * P1 reply / meeting / form / requested contact       → CRM
 * P2 open burst in trailing window, from OUTREACH     → HYBRID
 * P3 score ≥ high-water mark, from OUTREACH or HYBRID → CRM
 * P4 outreach platform sent to a lead still at NONE   → OUTREACH
 * </pre>
 *
 * <p>
 * When several rules qualify the most forward target wins, ties going to the
 * lower priority number. CRM is terminal: nothing is ever proposed from it.
 * </p>
 *
 * <p>
 * <b>Thread-safe:</b> This service has no mutable state.
 * </p>
 */
public class TransitionDecisionEngine {

    private final DecisionPolicy policy;

    public TransitionDecisionEngine(DecisionPolicy policy) {
        if (policy == null)
            throw new IllegalArgumentException("policy cannot be null");
        this.policy = policy;
    }

    /**
     * Proposes a transition for a snapshot, if one is warranted.
     *
     * @param snapshot        current aggregate (score already computed)
     * @param triggeringEvent event that produced the snapshot, null for sweeps
     * @param asOf            evaluation instant for windowed rules
     * @return decision, or empty if the lead stays where it is
     */
    public Optional<TransitionDecision> decide(EngagementSignal snapshot, EngagementEvent triggeringEvent,
            Instant asOf) {
        Platform current = snapshot.getCurrentPlatform();
        if (current.isTerminal()) {
            return Optional.empty();
        }

        TransitionTrigger winner = null;
        for (TransitionTrigger candidate : qualifyingTriggers(snapshot, triggeringEvent, asOf)) {
            if (candidate == null || !candidate.target().isAheadOf(current)) {
                continue;
            }
            if (winner == null || candidate.target().isAheadOf(winner.target())) {
                winner = candidate;
            }
        }

        if (winner == null) {
            return Optional.empty();
        }
        return Optional.of(TransitionDecision.automated(snapshot, winner.target(), winner,
                triggeringEvent, summarize(snapshot, asOf), asOf));
    }

    /**
     * Structured view of the inputs considered, stored with the decision.
     */
    public Map<String, Object> summarize(EngagementSignal s, Instant asOf) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("email_engagement", s.getEmailsOpened() > 0 || s.getEmailsClicked() > 0);
        summary.put("network_engagement", s.isNetworkConnected() || s.getNetworkMessagesReceived() > 0);
        summary.put("website_engagement", s.getWebsiteVisits() > 0 || s.getPageViews() > 0 || s.isVisitorIdentified());
        summary.put("direct_response", s.hasExplicitReply() || s.getMeetingsBooked() > 0
                || s.getFormsSubmitted() > 0 || s.isRequestedContact());
        summary.put("opens_in_window", s.opensSince(asOf.minus(policy.getOpenBurstWindow())));
        summary.put("score", s.getEngagementScore());
        summary.put("level", s.getEngagementLevel().wireName());
        summary.put("days_since_last_activity", s.getLastEventAt() != null
                ? Math.max(0, Duration.between(s.getLastEventAt(), asOf).toDays())
                : null);
        return summary;
    }

    // ─────────────────── Rules ───────────────────

    /**
     * Returns every qualifying trigger in priority order (nulls for rules that do not hold).
     */
    private TransitionTrigger[] qualifyingTriggers(EngagementSignal s, EngagementEvent event, Instant asOf) {
        return new TransitionTrigger[] {
                positiveIntent(s, event),
                openBurst(s, asOf),
                scoreHighWater(s),
                outreachObserved(s, event)
        };
    }

    /**
     * P1. Prefers the trigger matching the event that just arrived so the
     * recorded reason names it.
     */
    private TransitionTrigger positiveIntent(EngagementSignal s, EngagementEvent event) {
        if (event != null && event.isPositiveIntent()) {
            return switch (event.getEventType()) {
                case EMAIL_REPLIED -> TransitionTrigger.EMAIL_REPLY;
                case NETWORK_MESSAGE_RECEIVED -> TransitionTrigger.NETWORK_REPLY;
                case MEETING_BOOKED -> TransitionTrigger.MEETING_BOOKED;
                case FORM_SUBMITTED -> TransitionTrigger.FORM_SUBMITTED;
                default -> TransitionTrigger.REQUESTED_CONTACT;
            };
        }
        if (s.getEmailsReplied() > 0) {
            return TransitionTrigger.EMAIL_REPLY;
        }
        if (s.getNetworkMessagesReceived() > 0) {
            return TransitionTrigger.NETWORK_REPLY;
        }
        if (s.getMeetingsBooked() > 0 || s.getMeetingsCompleted() > 0) {
            return TransitionTrigger.MEETING_BOOKED;
        }
        if (s.getFormsSubmitted() > 0) {
            return TransitionTrigger.FORM_SUBMITTED;
        }
        if (s.isRequestedContact()) {
            return TransitionTrigger.REQUESTED_CONTACT;
        }
        return null;
    }

    /** P2 */
    private TransitionTrigger openBurst(EngagementSignal s, Instant asOf) {
        if (s.getCurrentPlatform() != Platform.OUTREACH) {
            return null;
        }
        int opens = s.opensSince(asOf.minus(policy.getOpenBurstWindow()));
        return opens >= policy.getOpenBurstCount() ? TransitionTrigger.HIGH_OPEN_ENGAGEMENT : null;
    }

    /** P3 */
    private TransitionTrigger scoreHighWater(EngagementSignal s) {
        Platform current = s.getCurrentPlatform();
        if (current != Platform.OUTREACH && current != Platform.HYBRID) {
            return null;
        }
        return s.getEngagementScore() >= policy.getHighWaterMark() ? TransitionTrigger.SCORE_HIGH_WATER : null;
    }

    /** P4 */
    private TransitionTrigger outreachObserved(EngagementSignal s, EngagementEvent event) {
        if (s.getCurrentPlatform() != Platform.NONE || event == null) {
            return null;
        }
        boolean outreachSend = event.getEventType() == EventType.EMAIL_SENT
                && event.isFrom(EventSource.OUTREACH_PLATFORM);
        return outreachSend ? TransitionTrigger.OUTREACH_ACTIVITY_OBSERVED : null;
    }
}
