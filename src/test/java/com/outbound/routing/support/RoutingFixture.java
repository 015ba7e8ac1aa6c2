package com.outbound.routing.support;

import java.time.Duration;
import java.time.Instant;

import com.outbound.routing.application.service.CommandRelay;
import com.outbound.routing.application.service.EngagementScorer;
import com.outbound.routing.application.service.EngagementSignalService;
import com.outbound.routing.application.service.EventValidator;
import com.outbound.routing.application.service.LeadRoutingOrchestrator;
import com.outbound.routing.application.service.ReconciliationSweep;
import com.outbound.routing.application.service.RoutingQueryService;
import com.outbound.routing.application.service.TransitionDecisionEngine;
import com.outbound.routing.application.service.TransitionExecutor;
import com.outbound.routing.domain.valueobject.DecisionPolicy;
import com.outbound.routing.domain.valueobject.ScoringPolicy;

/**
 * Fully wired engine over in-memory stores with default policies.
 */
public class RoutingFixture {

    public static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");
    public static final int MAX_CONFLICT_RETRIES = 5;

    public final MutableClock clock = new MutableClock(NOW);
    public final JournalingTransactionRunner tx = new JournalingTransactionRunner();
    public final InMemorySignalStore signals = new InMemorySignalStore(tx);
    public final InMemoryEventLog events = new InMemoryEventLog(tx);
    public final InMemoryTransitionLog transitions = new InMemoryTransitionLog(tx);
    public final InMemoryIncidentLog incidents = new InMemoryIncidentLog();
    public final InMemoryCheckpointStore checkpoints = new InMemoryCheckpointStore();
    public final RecordingCommandPublisher publisher = new RecordingCommandPublisher();

    public final EventValidator validator = new EventValidator(clock, Duration.ofMinutes(5));
    public final EngagementScorer scorer = new EngagementScorer(ScoringPolicy.defaults(), DecisionPolicy.defaults());
    public final TransitionDecisionEngine decisionEngine = new TransitionDecisionEngine(DecisionPolicy.defaults());
    public final EngagementSignalService signalService = new EngagementSignalService(signals, events, tx, scorer,
            clock, MAX_CONFLICT_RETRIES);
    public final TransitionExecutor executor = new TransitionExecutor(signals, events, transitions, incidents, tx,
            publisher, clock, MAX_CONFLICT_RETRIES);
    public final LeadRoutingOrchestrator orchestrator = new LeadRoutingOrchestrator(validator, signalService,
            decisionEngine, executor, signals, incidents, clock);
    public final ReconciliationSweep sweep = new ReconciliationSweep(signals, checkpoints, scorer, decisionEngine,
            executor, clock, 2);
    public final CommandRelay relay = new CommandRelay(transitions, executor, clock, Duration.ofSeconds(30), 100);
    public final RoutingQueryService queries = new RoutingQueryService(signals, events, transitions, incidents,
            scorer, decisionEngine, clock);
}
