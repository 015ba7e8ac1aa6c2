package com.outbound.routing.application.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.outbound.routing.application.port.out.CommandPublisher;
import com.outbound.routing.application.port.out.EventLog;
import com.outbound.routing.application.port.out.IncidentLog;
import com.outbound.routing.application.port.out.SignalStore;
import com.outbound.routing.application.port.out.TransactionRunner;
import com.outbound.routing.application.port.out.TransitionLog;
import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.entity.ExecutionResult;
import com.outbound.routing.domain.entity.Incident;
import com.outbound.routing.domain.entity.PlatformTransition;
import com.outbound.routing.domain.entity.RoutingCommand;
import com.outbound.routing.domain.entity.TransitionDecision;
import com.outbound.routing.domain.exception.ConflictRetryExhaustedException;
import com.outbound.routing.domain.exception.IllegalTransitionException;
import com.outbound.routing.domain.exception.LeadNotFoundException;
import com.outbound.routing.domain.valueobject.CommandType;
import com.outbound.routing.domain.valueobject.EventSource;
import com.outbound.routing.domain.valueobject.EventType;
import com.outbound.routing.domain.valueobject.Platform;

/**
 * Commits transition decisions and notifies the platform adapters.
 * <p>
 * Commit: in one unit of work the transition row (with its commands, acting
 * as an outbox), a {@code platform_transition} event and the aggregate's
 * routing fields are written. Notify: only after the commit returns are the
 * commands handed to the publisher. A publish failure leaves the row
 * undispatched for the command relay.
 * </p>
 *
 * <p>
 * <b>Error Handling:</b>
 * </p>
 * <ul>
 * <li>IllegalTransitionException → alarm + incident, dropped (never retried)</li>
 * <li>Version conflict → rolled back and retried, then ConflictRetryExhausted</li>
 * <li>Publisher errors → logged, left to the relay (transition already durable)</li>
 * </ul>
 */
public class TransitionExecutor {

    private static final Logger log = Logger.getLogger(TransitionExecutor.class.getName());

    private final SignalStore signalStore;
    private final EventLog eventLog;
    private final TransitionLog transitionLog;
    private final IncidentLog incidentLog;
    private final TransactionRunner transactionRunner;
    private final CommandPublisher commandPublisher;
    private final Clock clock;
    private final int maxConflictRetries;

    public TransitionExecutor(SignalStore signalStore,
            EventLog eventLog,
            TransitionLog transitionLog,
            IncidentLog incidentLog,
            TransactionRunner transactionRunner,
            CommandPublisher commandPublisher,
            Clock clock,
            int maxConflictRetries) {
        if (signalStore == null)
            throw new IllegalArgumentException("signalStore cannot be null");
        if (eventLog == null)
            throw new IllegalArgumentException("eventLog cannot be null");
        if (transitionLog == null)
            throw new IllegalArgumentException("transitionLog cannot be null");
        if (incidentLog == null)
            throw new IllegalArgumentException("incidentLog cannot be null");
        if (transactionRunner == null)
            throw new IllegalArgumentException("transactionRunner cannot be null");
        if (commandPublisher == null)
            throw new IllegalArgumentException("commandPublisher cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");

        this.signalStore = signalStore;
        this.eventLog = eventLog;
        this.transitionLog = transitionLog;
        this.incidentLog = incidentLog;
        this.transactionRunner = transactionRunner;
        this.commandPublisher = commandPublisher;
        this.clock = clock;
        this.maxConflictRetries = maxConflictRetries;
    }

    /**
     * Commits a decision, then publishes its commands.
     *
     * @param decision decision from the rule engine or an operator
     * @return execution outcome
     */
    public ExecutionResult execute(TransitionDecision decision) {
        ExecutionResult result;
        try {
            result = commitWithRetry(decision);
        } catch (IllegalTransitionException e) {
            raiseAlarm(decision, e);
            return ExecutionResult.skipped(ExecutionResult.Status.REJECTED, null, e.getMessage());
        }

        if (!result.isCommitted()) {
            log.info(String.format("action=transition_skipped leadId=%s target=%s status=%s detail=%s",
                    decision.getLeadId(), decision.getTarget().wireName(), result.status(), result.detail()));
            return result;
        }

        PlatformTransition transition = result.transition();
        log.info(String.format(
                "action=transition_committed leadId=%s from=%s to=%s trigger=%s manual=%s transitionId=%s commands=%d",
                transition.getLeadId(), transition.getFromPlatform().wireName(),
                transition.getToPlatform().wireName(), transition.getTrigger().wireName(),
                transition.isManualOverride(), transition.getTransitionId(), transition.getCommands().size()));

        return result.withCommandsDispatched(dispatch(transition));
    }

    /**
     * Hands a committed transition's commands to the publisher and marks the
     * row dispatched once all were accepted.
     *
     * @return true if every command was published
     */
    public boolean dispatch(PlatformTransition transition) {
        if (transition.isDispatched()) {
            return true;
        }
        try {
            for (RoutingCommand command : transition.getCommands()) {
                commandPublisher.publish(command);
            }
            transitionLog.markDispatched(transition.getTransitionId(), clock.instant());
            return true;
        } catch (RuntimeException e) {
            // Transition is durable; the relay redispatches later
            log.log(Level.WARNING, String.format(
                    "action=command_dispatch_deferred leadId=%s transitionId=%s error=%s",
                    transition.getLeadId(), transition.getTransitionId(), e.getMessage()), e);
            return false;
        }
    }

    /**
     * Commands a committed move requires.
     * <p>
     * To CRM: enroll, plus removal from outreach when leaving outreach or
     * hybrid. To HYBRID: mark. To OUTREACH: nothing, the outreach platform is
     * already the sender. An override that keeps the platform emits nothing.
     * </p>
     */
    static List<RoutingCommand> commandsFor(String transitionId, TransitionDecision decision, Instant at) {
        Platform from = decision.getFrom();
        Platform to = decision.getTarget();
        List<CommandType> types = new ArrayList<>();
        if (to == Platform.CRM && from != Platform.CRM) {
            types.add(CommandType.ENROLL_IN_CRM);
            if (from == Platform.OUTREACH || from == Platform.HYBRID) {
                types.add(CommandType.REMOVE_FROM_OUTREACH);
            }
        } else if (to == Platform.HYBRID && from != Platform.HYBRID) {
            types.add(CommandType.MARK_HYBRID);
        }

        List<RoutingCommand> commands = new ArrayList<>();
        for (CommandType type : types) {
            commands.add(RoutingCommand.of(transitionId, type, decision.getLeadId(), decision.getEmail(),
                    from, to, at));
        }
        return commands;
    }

    // ─────────────────── Commit ───────────────────

    private ExecutionResult commitWithRetry(TransitionDecision decision) {
        validateProposal(decision);
        for (int attempt = 1; attempt <= maxConflictRetries; attempt++) {
            try {
                return transactionRunner.inTransaction(() -> commit(decision));
            } catch (OptimisticConflictException e) {
                log.fine(String.format("action=transition_conflict_retry leadId=%s attempt=%d",
                        decision.getLeadId(), attempt));
            }
        }
        throw new ConflictRetryExhaustedException(decision.getLeadId(), maxConflictRetries);
    }

    private ExecutionResult commit(TransitionDecision proposed) {
        Optional<PlatformTransition> existing = transitionLog.findByIdempotencyKey(proposed.idempotencyKey());
        if (existing.isPresent()) {
            return ExecutionResult.skipped(ExecutionResult.Status.DUPLICATE, existing.get(),
                    "decision already committed");
        }

        EngagementSignal current = signalStore.findByLeadId(proposed.getLeadId())
                .orElseThrow(() -> new LeadNotFoundException(proposed.getLeadId()));
        Platform actual = current.getCurrentPlatform();

        // An override onto the current platform still records the operator's decision
        if (actual == proposed.getTarget() && !proposed.isManualOverride()) {
            return ExecutionResult.skipped(ExecutionResult.Status.ALREADY_AT_TARGET, null,
                    "lead already on " + actual.wireName());
        }
        if (!proposed.isManualOverride() && !proposed.getTarget().isAheadOf(actual)) {
            return ExecutionResult.skipped(ExecutionResult.Status.SUPERSEDED, null,
                    "lead moved to " + actual.wireName() + " since the decision");
        }

        TransitionDecision decision = proposed.rebasedOn(actual);
        validateLegality(decision);

        Instant now = clock.instant();
        String transitionId = PlatformTransition.newId();
        PlatformTransition transition = PlatformTransition.record(decision, transitionId,
                commandsFor(transitionId, decision, now), now);

        if (!transitionLog.append(transition)) {
            return ExecutionResult.skipped(ExecutionResult.Status.DUPLICATE,
                    transitionLog.findByIdempotencyKey(decision.idempotencyKey()).orElse(null),
                    "decision already committed");
        }

        eventLog.append(transitionEvent(decision, transition, current, now));

        EngagementSignal updated = current.withTransition(decision.getTarget(), decision.toRecord(), now);
        long expectedVersion = current.getVersion();
        if (!signalStore.compareAndSet(updated, expectedVersion)) {
            throw new OptimisticConflictException(current.getLeadId(), expectedVersion);
        }
        return ExecutionResult.committed(transition, updated.withVersion(expectedVersion + 1));
    }

    private EngagementEvent transitionEvent(TransitionDecision decision, PlatformTransition transition,
            EngagementSignal current, Instant now) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("transition_id", transition.getTransitionId());
        payload.put("from_platform", decision.getFrom().wireName());
        payload.put("to_platform", decision.getTarget().wireName());
        payload.put("trigger", decision.getTrigger().wireName());
        payload.put("manual_override", decision.isManualOverride());
        EventSource source = decision.isManualOverride() ? EventSource.MANUAL : EventSource.ROUTING_ENGINE;
        return EngagementEvent.internal(current.getLeadId(), current.getEmail(), EventType.PLATFORM_TRANSITION,
                source, "transition:" + decision.idempotencyKey(), payload, now);
    }

    // ─────────────────── Legality ───────────────────

    /**
     * Checks the proposal itself: the engine must only ever propose forward moves.
     */
    private void validateProposal(TransitionDecision decision) {
        if (decision.getTarget() == Platform.NONE) {
            throw new IllegalTransitionException(decision.getLeadId(), decision.getFrom(),
                    decision.getTarget(), "no transition may target none");
        }
        if (!decision.isManualOverride() && !decision.getTarget().isAheadOf(decision.getFrom())) {
            throw new IllegalTransitionException(decision.getLeadId(), decision.getFrom(),
                    decision.getTarget(), "automated transitions must move forward");
        }
    }

    /**
     * Checks the move against the lead's platform at commit time. Leaving CRM
     * is never allowed; staying on it is.
     */
    private void validateLegality(TransitionDecision decision) {
        Platform from = decision.getFrom();
        Platform to = decision.getTarget();
        if (from.isTerminal() && to != from) {
            throw new IllegalTransitionException(decision.getLeadId(), from, to,
                    "crm is terminal");
        }
    }

    private void raiseAlarm(TransitionDecision decision, IllegalTransitionException e) {
        log.severe(String.format(
                "action=illegal_transition_alarm leadId=%s from=%s to=%s trigger=%s manual=%s detail=%s",
                decision.getLeadId(), e.getFrom().wireName(), e.getTo().wireName(),
                decision.getTrigger().wireName(), decision.isManualOverride(), e.getMessage()));

        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("from_platform", e.getFrom().wireName());
        detail.put("to_platform", e.getTo().wireName());
        detail.put("trigger", decision.getTrigger().wireName());
        detail.put("snapshot_version", decision.getAuthorizingSnapshotVersion());
        detail.put("manual_override", decision.isManualOverride());
        try {
            incidentLog.record(Incident.illegalTransition(decision.getLeadId(), e.getMessage(), detail,
                    clock.instant()));
        } catch (RuntimeException recordFailure) {
            log.log(Level.SEVERE, String.format("action=incident_record_failed leadId=%s error=%s",
                    decision.getLeadId(), recordFailure.getMessage()), recordFailure);
        }
    }
}
