package com.outbound.routing.application.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.outbound.routing.application.port.in.OverridePlatformUseCase;
import com.outbound.routing.application.port.in.ProcessEventUseCase;
import com.outbound.routing.application.port.out.IncidentLog;
import com.outbound.routing.application.port.out.SignalStore;
import com.outbound.routing.domain.entity.ApplyResult;
import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.entity.ExecutionResult;
import com.outbound.routing.domain.entity.Incident;
import com.outbound.routing.domain.entity.RawEngagementEvent;
import com.outbound.routing.domain.entity.RoutingOutcome;
import com.outbound.routing.domain.entity.TransitionDecision;
import com.outbound.routing.domain.exception.InvalidEventException;
import com.outbound.routing.domain.exception.LeadNotFoundException;
import com.outbound.routing.domain.valueobject.Platform;

/**
 * Core use-case implementation: engagement event → routing decision.
 * <p>
 * Pipeline:
 * <ol>
 * <li><b>Validate</b>: normalize the raw event, reject malformed input</li>
 * <li><b>Apply</b>: append the event and fold it into the aggregate atomically</li>
 * <li><b>Decide</b>: evaluate the transition rules on the new snapshot</li>
 * <li><b>Execute</b>: commit the transition, then publish its commands</li>
 * </ol>
 * </p>
 *
 * <p>
 * <b>Error Handling:</b>
 * </p>
 * <ul>
 * <li>InvalidEventException → incident recorded, rethrown (caller fixes input)</li>
 * <li>Store / conflict errors → rethrown for upstream retry</li>
 * <li>Duplicates → not an error, rules are still evaluated so a transition
 * lost to a crash after the apply is picked up on redelivery</li>
 * </ul>
 */
public class LeadRoutingOrchestrator implements ProcessEventUseCase, OverridePlatformUseCase {

    private static final Logger log = Logger.getLogger(LeadRoutingOrchestrator.class.getName());

    private final EventValidator validator;
    private final EngagementSignalService signalService;
    private final TransitionDecisionEngine decisionEngine;
    private final TransitionExecutor executor;
    private final SignalStore signalStore;
    private final IncidentLog incidentLog;
    private final Clock clock;

    public LeadRoutingOrchestrator(EventValidator validator,
            EngagementSignalService signalService,
            TransitionDecisionEngine decisionEngine,
            TransitionExecutor executor,
            SignalStore signalStore,
            IncidentLog incidentLog,
            Clock clock) {
        if (validator == null)
            throw new IllegalArgumentException("validator cannot be null");
        if (signalService == null)
            throw new IllegalArgumentException("signalService cannot be null");
        if (decisionEngine == null)
            throw new IllegalArgumentException("decisionEngine cannot be null");
        if (executor == null)
            throw new IllegalArgumentException("executor cannot be null");
        if (signalStore == null)
            throw new IllegalArgumentException("signalStore cannot be null");
        if (incidentLog == null)
            throw new IllegalArgumentException("incidentLog cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");

        this.validator = validator;
        this.signalService = signalService;
        this.decisionEngine = decisionEngine;
        this.executor = executor;
        this.signalStore = signalStore;
        this.incidentLog = incidentLog;
        this.clock = clock;
    }

    @Override
    public RoutingOutcome process(RawEngagementEvent raw) {
        Instant startTime = clock.instant();

        // ── Step 1: VALIDATE ──
        EngagementEvent event;
        try {
            event = validator.validate(raw);
        } catch (InvalidEventException e) {
            recordRejection(raw, e);
            throw e;
        }

        // ── Step 2: APPLY ──
        ApplyResult applied;
        try {
            applied = signalService.apply(event);
        } catch (InvalidEventException e) {
            recordRejection(raw, e);
            throw e;
        }

        EngagementSignal snapshot = applied.snapshot();
        if (!applied.applied()) {
            log.info(String.format("action=duplicate_event leadId=%s dedupKey=%s",
                    snapshot.getLeadId(), event.getDedupKey()));
        }

        // ── Step 3: DECIDE ──
        Optional<TransitionDecision> decision = decisionEngine.decide(snapshot, applied.event(), clock.instant());
        if (decision.isEmpty()) {
            logComplete(applied, snapshot, startTime);
            return RoutingOutcome.noTransition(applied);
        }

        // ── Step 4: EXECUTE ──
        ExecutionResult execution = executor.execute(decision.get());
        RoutingOutcome outcome = new RoutingOutcome(applied, decision.get(), execution);
        logComplete(applied, outcome.snapshot(), startTime);
        return outcome;
    }

    @Override
    public ExecutionResult override(String leadId, Platform target, String operator, String note,
            String requestId) {
        EngagementSignal snapshot = signalStore.findByLeadId(leadId)
                .orElseThrow(() -> new LeadNotFoundException(leadId));

        log.info(String.format("action=manual_override_requested leadId=%s from=%s to=%s operator=%s requestId=%s",
                leadId, snapshot.getCurrentPlatform().wireName(), target.wireName(), operator, requestId));

        TransitionDecision decision = TransitionDecision.manual(snapshot, target, operator, note, requestId,
                clock.instant());
        return executor.execute(decision);
    }

    // ─────────────────── Private Helpers ───────────────────

    private void logComplete(ApplyResult applied, EngagementSignal snapshot, Instant startTime) {
        long latencyMs = Duration.between(startTime, clock.instant()).toMillis();
        log.info(String.format(
                "action=process_complete leadId=%s eventType=%s applied=%s score=%.2f level=%s platform=%s latency=%dms",
                snapshot.getLeadId(), applied.event().getEventType().wireName(), applied.applied(),
                snapshot.getEngagementScore(), snapshot.getEngagementLevel().wireName(),
                snapshot.getCurrentPlatform().wireName(), latencyMs));
    }

    /**
     * Rejected events are surfaced to operators; a failure to record one never
     * masks the rejection itself.
     */
    private void recordRejection(RawEngagementEvent raw, InvalidEventException e) {
        String reportedLeadId = raw != null ? raw.leadId() : null;
        String leadId = reportedLeadId != null && reportedLeadId.length() <= EventValidator.MAX_LEAD_ID_LENGTH
                ? reportedLeadId
                : null;
        log.warning(String.format("action=event_rejected leadId=%s field=%s error=%s",
                leadId, e.getField(), e.getMessage()));

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("field", e.getField());
        if (leadId == null && reportedLeadId != null) {
            detail.put("lead_id_prefix", reportedLeadId.substring(0, EventValidator.MAX_LEAD_ID_LENGTH));
        }
        if (raw != null) {
            detail.put("event_type", raw.eventType());
            detail.put("source", raw.source());
            detail.put("email", raw.email());
            detail.put("occurred_at", raw.occurredAt() != null ? raw.occurredAt().toString() : null);
        }
        try {
            incidentLog.record(Incident.rejectedEvent(leadId, e.getMessage(), detail, clock.instant()));
        } catch (RuntimeException recordFailure) {
            log.log(Level.SEVERE, String.format("action=incident_record_failed leadId=%s error=%s",
                    leadId, recordFailure.getMessage()), recordFailure);
        }
    }
}
