package com.outbound.routing.application.service;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.logging.Logger;

import com.outbound.routing.application.port.out.EventLog;
import com.outbound.routing.application.port.out.SignalStore;
import com.outbound.routing.application.port.out.TransactionRunner;
import com.outbound.routing.domain.entity.ApplyResult;
import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.exception.ConflictRetryExhaustedException;
import com.outbound.routing.domain.exception.InvalidEventException;

/**
 * Applies validated events to per-lead aggregates.
 * <p>
 * Each apply is one unit of work: the event row is appended (write-ahead,
 * duplicate dedup keys are skipped) and the aggregate is folded, rescored and
 * written with an optimistic version check. A version conflict rolls the whole
 * unit back, including the event row, and retries from a fresh read.
 * </p>
 *
 * <p>
 * <b>Identity:</b> an event with only an email resolves to the lead owning
 * that email, or to a lead id derived from the email when none exists yet.
 * </p>
 */
public class EngagementSignalService {

    private static final Logger log = Logger.getLogger(EngagementSignalService.class.getName());

    private final SignalStore signalStore;
    private final EventLog eventLog;
    private final TransactionRunner transactionRunner;
    private final EngagementScorer scorer;
    private final Clock clock;
    private final int maxConflictRetries;

    public EngagementSignalService(SignalStore signalStore,
            EventLog eventLog,
            TransactionRunner transactionRunner,
            EngagementScorer scorer,
            Clock clock,
            int maxConflictRetries) {
        if (signalStore == null)
            throw new IllegalArgumentException("signalStore cannot be null");
        if (eventLog == null)
            throw new IllegalArgumentException("eventLog cannot be null");
        if (transactionRunner == null)
            throw new IllegalArgumentException("transactionRunner cannot be null");
        if (scorer == null)
            throw new IllegalArgumentException("scorer cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");
        if (maxConflictRetries < 1)
            throw new IllegalArgumentException("maxConflictRetries must be positive");

        this.signalStore = signalStore;
        this.eventLog = eventLog;
        this.transactionRunner = transactionRunner;
        this.scorer = scorer;
        this.clock = clock;
        this.maxConflictRetries = maxConflictRetries;
    }

    /**
     * Applies one event to its lead's aggregate.
     *
     * @param event validated event
     * @return new snapshot, or the unchanged one with {@code applied=false} for a duplicate
     * @throws InvalidEventException           if lead id and email name different leads
     * @throws ConflictRetryExhaustedException if contention outlasts the retry budget
     */
    public ApplyResult apply(EngagementEvent event) {
        for (int attempt = 1; attempt <= maxConflictRetries; attempt++) {
            try {
                return transactionRunner.inTransaction(() -> applyOnce(event));
            } catch (OptimisticConflictException e) {
                log.fine(String.format("action=apply_conflict_retry dedupKey=%s attempt=%d",
                        event.getDedupKey(), attempt));
            }
        }
        String leadId = event.getLeadId() != null ? event.getLeadId() : event.getEmail();
        log.warning(String.format("action=apply_conflict_exhausted leadId=%s dedupKey=%s attempts=%d",
                leadId, event.getDedupKey(), maxConflictRetries));
        throw new ConflictRetryExhaustedException(leadId, maxConflictRetries);
    }

    /**
     * Deterministic lead id for an email seen before any lead id was assigned.
     */
    public static String deriveLeadId(String normalizedEmail) {
        return UUID.nameUUIDFromBytes(("email:" + normalizedEmail).getBytes(StandardCharsets.UTF_8)).toString();
    }

    // ─────────────────── Private Steps ───────────────────

    private ApplyResult applyOnce(EngagementEvent event) {
        Instant now = clock.instant();
        String leadId = resolveLeadId(event);
        EngagementEvent bound = event.withLeadId(leadId);

        EngagementSignal current = signalStore.findByLeadId(leadId)
                .orElseGet(() -> EngagementSignal.initial(leadId, bound.getEmail(), now));

        // ── Write-ahead: the event row goes first, duplicates stop here
        if (!eventLog.append(bound)) {
            log.fine(String.format("action=event_duplicate_skipped leadId=%s dedupKey=%s",
                    leadId, bound.getDedupKey()));
            return ApplyResult.duplicate(current, bound);
        }

        EngagementSignal updated = scorer.rescore(current.apply(bound, now));
        long expectedVersion = current.getVersion();
        if (!signalStore.compareAndSet(updated, expectedVersion)) {
            throw new OptimisticConflictException(leadId, expectedVersion);
        }

        log.fine(String.format("action=event_applied leadId=%s eventType=%s score=%.2f level=%s version=%d",
                leadId, bound.getEventType().wireName(), updated.getEngagementScore(),
                updated.getEngagementLevel().wireName(), expectedVersion + 1));
        return ApplyResult.applied(updated.withVersion(expectedVersion + 1), bound);
    }

    private String resolveLeadId(EngagementEvent event) {
        String email = event.getEmail();
        if (event.getLeadId() != null) {
            if (email != null) {
                Optional<EngagementSignal> owner = signalStore.findByEmail(email);
                if (owner.isPresent() && !owner.get().getLeadId().equals(event.getLeadId())) {
                    throw new InvalidEventException("email", String.format(
                            "email %s belongs to lead %s, not %s", email,
                            owner.get().getLeadId(), event.getLeadId()));
                }
            }
            return event.getLeadId();
        }
        return signalStore.findByEmail(email)
                .map(EngagementSignal::getLeadId)
                .orElseGet(() -> deriveLeadId(email));
    }
}
