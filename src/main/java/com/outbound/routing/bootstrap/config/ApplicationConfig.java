package com.outbound.routing.bootstrap.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.outbound.routing.application.port.out.CommandPublisher;
import com.outbound.routing.application.port.out.EventLog;
import com.outbound.routing.application.port.out.IncidentLog;
import com.outbound.routing.application.port.out.SignalStore;
import com.outbound.routing.application.port.out.SweepCheckpointStore;
import com.outbound.routing.application.port.out.TransactionRunner;
import com.outbound.routing.application.port.out.TransitionLog;
import com.outbound.routing.application.service.CommandRelay;
import com.outbound.routing.application.service.EngagementScorer;
import com.outbound.routing.application.service.EngagementSignalService;
import com.outbound.routing.application.service.EventValidator;
import com.outbound.routing.application.service.IngestionGateway;
import com.outbound.routing.application.service.LeadRoutingOrchestrator;
import com.outbound.routing.application.service.ReconciliationSweep;
import com.outbound.routing.application.service.RoutingQueryService;
import com.outbound.routing.application.service.TransitionDecisionEngine;
import com.outbound.routing.application.service.TransitionExecutor;
import com.outbound.routing.domain.valueobject.DecisionPolicy;
import com.outbound.routing.domain.valueobject.LevelThresholds;
import com.outbound.routing.domain.valueobject.ScoringPolicy;
import com.outbound.routing.domain.valueobject.ScoringWeights;

/**
 * Application-level bean configuration.
 * <p>
 * Wires application services (pure Java) with adapter implementations via
 * constructor injection, maintaining hexagonal architecture boundaries.
 * Policy objects validate themselves, so bad thresholds fail the start.
 * </p>
 */
@Configuration
@EnableConfigurationProperties(RoutingProperties.class)
public class ApplicationConfig {

    /**
     * Jackson ObjectMapper configured for production use.
     * - Java 8 Time support (Instant, Duration)
     * - ISO-8601 dates instead of epoch numbers
     * - Lenient deserialization (ignore unknown properties)
     */
    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ─────────────────── Policies ───────────────────

    @Bean
    public ScoringPolicy scoringPolicy(RoutingProperties properties) {
        RoutingProperties.Scoring scoring = properties.getScoring();
        RoutingProperties.Weights w = scoring.getWeights();
        RoutingProperties.Thresholds t = scoring.getThresholds();

        ScoringWeights weights = ScoringWeights.builder()
                .reply(w.getReply())
                .meetingBooked(w.getMeetingBooked())
                .meetingCompleted(w.getMeetingCompleted())
                .formSubmitted(w.getFormSubmitted())
                .requestedContact(w.getRequestedContact())
                .openBurst(w.getOpenBurst())
                .repeatVisits(w.getRepeatVisits())
                .pricingOrDemoViewed(w.getPricingOrDemoViewed())
                .contentDownloaded(w.getContentDownloaded())
                .open(w.getOpen())
                .click(w.getClick())
                .networkConnected(w.getNetworkConnected())
                .visitorIdentified(w.getVisitorIdentified())
                .websiteVisit(w.getWebsiteVisit())
                .noShowPenalty(w.getNoShowPenalty())
                .build();

        return new ScoringPolicy(weights,
                new LevelThresholds(t.getLukewarm(), t.getWarm(), t.getHot()),
                scoring.getFullWeightWindow(), scoring.getReducedWeightWindow(), scoring.getDecayWindow(),
                scoring.getReducedFactor(), scoring.getAgingFactor(), scoring.getStaleFactor());
    }

    @Bean
    public DecisionPolicy decisionPolicy(RoutingProperties properties) {
        RoutingProperties.Decision decision = properties.getDecision();
        return new DecisionPolicy(decision.getHighWaterMark(), decision.getOpenBurstCount(),
                decision.getOpenBurstWindow());
    }

    // ─────────────────── Pure Services ───────────────────

    @Bean
    public EventValidator eventValidator(Clock clock, RoutingProperties properties) {
        return new EventValidator(clock, properties.getIngestion().getClockSkewTolerance());
    }

    @Bean
    public EngagementScorer engagementScorer(ScoringPolicy scoringPolicy, DecisionPolicy decisionPolicy) {
        return new EngagementScorer(scoringPolicy, decisionPolicy);
    }

    @Bean
    public TransitionDecisionEngine transitionDecisionEngine(DecisionPolicy decisionPolicy) {
        return new TransitionDecisionEngine(decisionPolicy);
    }

    // ─────────────────── Use Cases ───────────────────

    @Bean
    public EngagementSignalService engagementSignalService(SignalStore signalStore,
            EventLog eventLog,
            TransactionRunner transactionRunner,
            EngagementScorer engagementScorer,
            Clock clock,
            RoutingProperties properties) {
        return new EngagementSignalService(signalStore, eventLog, transactionRunner, engagementScorer,
                clock, properties.getIngestion().getMaxConflictRetries());
    }

    @Bean
    public TransitionExecutor transitionExecutor(SignalStore signalStore,
            EventLog eventLog,
            TransitionLog transitionLog,
            IncidentLog incidentLog,
            TransactionRunner transactionRunner,
            CommandPublisher commandPublisher,
            Clock clock,
            RoutingProperties properties) {
        return new TransitionExecutor(signalStore, eventLog, transitionLog, incidentLog, transactionRunner,
                commandPublisher, clock, properties.getIngestion().getMaxConflictRetries());
    }

    /**
     * LeadRoutingOrchestrator: the core use-case implementation.
     * Serves both event ingestion and manual overrides.
     */
    @Bean
    public LeadRoutingOrchestrator leadRoutingOrchestrator(EventValidator eventValidator,
            EngagementSignalService engagementSignalService,
            TransitionDecisionEngine transitionDecisionEngine,
            TransitionExecutor transitionExecutor,
            SignalStore signalStore,
            IncidentLog incidentLog,
            Clock clock) {
        return new LeadRoutingOrchestrator(eventValidator, engagementSignalService, transitionDecisionEngine,
                transitionExecutor, signalStore, incidentLog, clock);
    }

    @Bean
    public ReconciliationSweep reconciliationSweep(SignalStore signalStore,
            SweepCheckpointStore sweepCheckpointStore,
            EngagementScorer engagementScorer,
            TransitionDecisionEngine transitionDecisionEngine,
            TransitionExecutor transitionExecutor,
            Clock clock,
            RoutingProperties properties) {
        return new ReconciliationSweep(signalStore, sweepCheckpointStore, engagementScorer,
                transitionDecisionEngine, transitionExecutor, clock, properties.getSweep().getPageSize());
    }

    @Bean
    public CommandRelay commandRelay(TransitionLog transitionLog,
            TransitionExecutor transitionExecutor,
            Clock clock,
            RoutingProperties properties) {
        RoutingProperties.Relay relay = properties.getRelay();
        return new CommandRelay(transitionLog, transitionExecutor, clock, relay.getMinAge(), relay.getBatchSize());
    }

    @Bean
    public RoutingQueryService routingQueryService(SignalStore signalStore,
            EventLog eventLog,
            TransitionLog transitionLog,
            IncidentLog incidentLog,
            EngagementScorer engagementScorer,
            TransitionDecisionEngine transitionDecisionEngine,
            Clock clock) {
        return new RoutingQueryService(signalStore, eventLog, transitionLog, incidentLog, engagementScorer,
                transitionDecisionEngine, clock);
    }

    @Bean(destroyMethod = "shutdown")
    public IngestionGateway ingestionGateway(LeadRoutingOrchestrator leadRoutingOrchestrator,
            RoutingProperties properties) {
        RoutingProperties.Ingestion ingestion = properties.getIngestion();
        return new IngestionGateway(leadRoutingOrchestrator, ingestion.getWorkers(), ingestion.getQueueCapacity(),
                ingestion.getSubmitTimeout());
    }
}
