package com.outbound.routing.application.service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.outbound.routing.application.port.in.ReconcileRoutingUseCase;
import com.outbound.routing.application.port.out.SignalStore;
import com.outbound.routing.application.port.out.SweepCheckpointStore;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.entity.ExecutionResult;
import com.outbound.routing.domain.entity.TransitionDecision;
import com.outbound.routing.domain.exception.ConflictRetryExhaustedException;
import com.outbound.routing.domain.valueobject.ScoreResult;
import com.outbound.routing.domain.valueobject.SweepReport;

/**
 * Periodic re-evaluation of every lead against the transition rules.
 * <p>
 * Catches leads whose qualifying condition did not coincide with a fresh
 * event (time-windowed rules, transitions lost before commit). Scores are
 * evaluated as of now for the decision only; the stored score is left as
 * computed at apply time.
 * </p>
 *
 * <p>
 * Leads are visited in lead-id order, one page at a time. The cursor is
 * checkpointed after every page, so an interrupted sweep resumes where it
 * stopped; commits go through the executor's idempotency key, so revisiting a
 * lead never emits a second command.
 * </p>
 */
public class ReconciliationSweep implements ReconcileRoutingUseCase {

    private static final Logger log = Logger.getLogger(ReconciliationSweep.class.getName());

    private final SignalStore signalStore;
    private final SweepCheckpointStore checkpointStore;
    private final EngagementScorer scorer;
    private final TransitionDecisionEngine decisionEngine;
    private final TransitionExecutor executor;
    private final Clock clock;
    private final int pageSize;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public ReconciliationSweep(SignalStore signalStore,
            SweepCheckpointStore checkpointStore,
            EngagementScorer scorer,
            TransitionDecisionEngine decisionEngine,
            TransitionExecutor executor,
            Clock clock,
            int pageSize) {
        if (signalStore == null)
            throw new IllegalArgumentException("signalStore cannot be null");
        if (checkpointStore == null)
            throw new IllegalArgumentException("checkpointStore cannot be null");
        if (scorer == null)
            throw new IllegalArgumentException("scorer cannot be null");
        if (decisionEngine == null)
            throw new IllegalArgumentException("decisionEngine cannot be null");
        if (executor == null)
            throw new IllegalArgumentException("executor cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");
        if (pageSize < 1)
            throw new IllegalArgumentException("pageSize must be positive");

        this.signalStore = signalStore;
        this.checkpointStore = checkpointStore;
        this.scorer = scorer;
        this.decisionEngine = decisionEngine;
        this.executor = executor;
        this.clock = clock;
        this.pageSize = pageSize;
    }

    @Override
    public SweepReport reconcile() {
        if (!running.compareAndSet(false, true)) {
            log.info("action=sweep_skipped reason=already_running");
            return new SweepReport(0, 0, false, null);
        }
        cancelRequested.set(false);

        String cursor = checkpointStore.loadCursor().orElse(null);
        long scanned = 0;
        long transitions = 0;
        log.info(String.format("action=sweep_start resumeAfter=%s", cursor));

        try {
            while (true) {
                List<EngagementSignal> page = signalStore.findPageAfter(cursor, pageSize);
                if (page.isEmpty()) {
                    checkpointStore.clear();
                    log.info(String.format("action=sweep_complete scanned=%d transitions=%d", scanned, transitions));
                    return new SweepReport(scanned, transitions, true, cursor);
                }

                for (EngagementSignal signal : page) {
                    if (isCancelled()) {
                        if (cursor != null) {
                            checkpointStore.saveCursor(cursor);
                        }
                        log.info(String.format("action=sweep_cancelled scanned=%d transitions=%d cursor=%s",
                                scanned, transitions, cursor));
                        return new SweepReport(scanned, transitions, false, cursor);
                    }
                    if (reconcileLead(signal)) {
                        transitions++;
                    }
                    cursor = signal.getLeadId();
                    scanned++;
                }
                checkpointStore.saveCursor(cursor);
            }
        } finally {
            running.set(false);
        }
    }

    @Override
    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Evaluates one lead as of now.
     *
     * @return true if a transition was committed
     */
    boolean reconcileLead(EngagementSignal stored) {
        Instant now = clock.instant();
        ScoreResult current = scorer.score(stored, now);
        EngagementSignal view = stored.withScore(current.score(), current.level());

        Optional<TransitionDecision> decision = decisionEngine.decide(view, null, now);
        if (decision.isEmpty()) {
            return false;
        }
        try {
            ExecutionResult result = executor.execute(decision.get());
            return result.isCommitted();
        } catch (ConflictRetryExhaustedException e) {
            // Hot lead; the event path or the next sweep will settle it
            log.log(Level.WARNING, String.format("action=sweep_lead_skipped leadId=%s error=%s",
                    stored.getLeadId(), e.getMessage()), e);
            return false;
        }
    }

    private boolean isCancelled() {
        return cancelRequested.get() || Thread.currentThread().isInterrupted();
    }
}
