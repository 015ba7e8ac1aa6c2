package com.outbound.routing.application.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.junit.jupiter.api.Test;

import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.entity.TransitionDecision;
import com.outbound.routing.domain.valueobject.DecisionPolicy;
import com.outbound.routing.domain.valueobject.EngagementLevel;
import com.outbound.routing.domain.valueobject.EventSource;
import com.outbound.routing.domain.valueobject.EventType;
import com.outbound.routing.domain.valueobject.Platform;
import com.outbound.routing.domain.valueobject.TransitionTrigger;

class TransitionDecisionEngineTest {

    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    private final TransitionDecisionEngine engine = new TransitionDecisionEngine(DecisionPolicy.defaults());

    @Test
    void outreachSendMovesUnroutedLeadToOutreach() {
        EngagementSignal s = lead(Platform.NONE).emailsSent(1).build();

        Optional<TransitionDecision> decision = engine.decide(s,
                event(EventType.EMAIL_SENT, EventSource.OUTREACH_PLATFORM), NOW);

        assertThat(decision).isPresent();
        assertThat(decision.get().getTarget()).isEqualTo(Platform.OUTREACH);
        assertThat(decision.get().getTrigger()).isEqualTo(TransitionTrigger.OUTREACH_ACTIVITY_OBSERVED);
    }

    @Test
    void sendReportedByOtherSourceDoesNotRouteToOutreach() {
        EngagementSignal s = lead(Platform.NONE).emailsSent(1).build();

        assertThat(engine.decide(s, event(EventType.EMAIL_SENT, EventSource.UNVERIFIED), NOW)).isEmpty();
    }

    @Test
    void openBurstInOutreachProposesHybrid() {
        List<Instant> opens = List.of(NOW.minus(Duration.ofDays(2)), NOW.minus(Duration.ofDays(1)), NOW);
        EngagementSignal s = lead(Platform.OUTREACH).emailsOpened(3).recentOpens(opens)
                .engagementScore(55).engagementLevel(EngagementLevel.WARM).build();

        Optional<TransitionDecision> decision = engine.decide(s,
                event(EventType.EMAIL_OPENED, EventSource.OUTREACH_PLATFORM), NOW);

        assertThat(decision).isPresent();
        assertThat(decision.get().getTarget()).isEqualTo(Platform.HYBRID);
        assertThat(decision.get().getTrigger()).isEqualTo(TransitionTrigger.HIGH_OPEN_ENGAGEMENT);
        assertThat(decision.get().getSignalsSummary()).containsEntry("opens_in_window", 3);
    }

    @Test
    void openBurstDoesNotApplyOutsideOutreach() {
        List<Instant> opens = List.of(NOW, NOW, NOW);
        EngagementSignal s = lead(Platform.NONE).emailsOpened(3).recentOpens(opens).build();

        assertThat(engine.decide(s, null, NOW)).isEmpty();
    }

    @Test
    void positiveIntentRoutesToCrmAndNamesTheEvent() {
        EngagementSignal s = lead(Platform.HYBRID).formsSubmitted(1).emailsReplied(1).build();

        Optional<TransitionDecision> decision = engine.decide(s,
                event(EventType.FORM_SUBMITTED, EventSource.WEBSITE), NOW);

        assertThat(decision).isPresent();
        assertThat(decision.get().getTarget()).isEqualTo(Platform.CRM);
        assertThat(decision.get().getTrigger()).isEqualTo(TransitionTrigger.FORM_SUBMITTED);
        assertThat(decision.get().getTriggerEventType()).isEqualTo(EventType.FORM_SUBMITTED);
    }

    @Test
    void positiveIntentFromCountersWhenEvaluatedWithoutEvent() {
        EngagementSignal s = lead(Platform.OUTREACH).networkMessagesReceived(1).build();

        Optional<TransitionDecision> decision = engine.decide(s, null, NOW);

        assertThat(decision).map(TransitionDecision::getTrigger).contains(TransitionTrigger.NETWORK_REPLY);
    }

    @Test
    void mostForwardTargetWinsOverHigherPriorityRule() {
        List<Instant> opens = List.of(NOW, NOW, NOW);
        EngagementSignal s = lead(Platform.OUTREACH).emailsOpened(3).recentOpens(opens)
                .engagementScore(70).engagementLevel(EngagementLevel.HOT).build();

        Optional<TransitionDecision> decision = engine.decide(s, null, NOW);

        assertThat(decision).isPresent();
        assertThat(decision.get().getTarget()).isEqualTo(Platform.CRM);
        assertThat(decision.get().getTrigger()).isEqualTo(TransitionTrigger.SCORE_HIGH_WATER);
    }

    @Test
    void scoreBelowHighWaterKeepsHybridLeadInPlace() {
        EngagementSignal s = lead(Platform.HYBRID).engagementScore(64.99)
                .engagementLevel(EngagementLevel.WARM).build();

        assertThat(engine.decide(s, null, NOW)).isEmpty();
    }

    @Test
    void crmIsTerminal() {
        EngagementSignal s = lead(Platform.CRM).emailsReplied(2).engagementScore(100)
                .engagementLevel(EngagementLevel.HOT).build();

        assertThat(engine.decide(s, event(EventType.EMAIL_REPLIED, EventSource.OUTREACH_PLATFORM), NOW))
                .isEmpty();
    }

    @Test
    void decisionCarriesAuthorizingSnapshotVersion() {
        EngagementSignal s = lead(Platform.OUTREACH).emailsReplied(1).version(9).build();

        TransitionDecision decision = engine.decide(s, null, NOW).orElseThrow();

        assertThat(decision.getAuthorizingSnapshotVersion()).isEqualTo(9);
        assertThat(decision.getFrom()).isEqualTo(Platform.OUTREACH);
        assertThat(decision.getDecidedAt()).isEqualTo(NOW);
    }

    private static EngagementSignal.Builder lead(Platform platform) {
        return EngagementSignal.builder("lead-1").email("lead-1@example.com").currentPlatform(platform)
                .version(1).createdAt(NOW.minus(Duration.ofDays(3))).updatedAt(NOW).lastEventAt(NOW);
    }

    private static EngagementEvent event(EventType type, EventSource source) {
        return new EngagementEvent(UUID.randomUUID().toString(), "lead-1", "lead-1@example.com", type, source,
                source.wireName(), UUID.randomUUID().toString(), Map.of(), NOW, null);
    }
}
