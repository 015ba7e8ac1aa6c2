package com.outbound.routing.application.service;

import static com.outbound.routing.support.RoutingFixture.NOW;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.valueobject.EligibleLead;
import com.outbound.routing.domain.valueobject.EngagementLevel;
import com.outbound.routing.domain.valueobject.EventType;
import com.outbound.routing.domain.valueobject.Platform;
import com.outbound.routing.domain.valueobject.ReplayReport;
import com.outbound.routing.domain.valueobject.TransitionTrigger;
import com.outbound.routing.support.Events;
import com.outbound.routing.support.RoutingFixture;

class RoutingQueryServiceTest {

    private RoutingFixture f;

    @BeforeEach
    void setUp() {
        f = new RoutingFixture();
    }

    @Test
    void replayOfEventLogReproducesStoredAggregate() {
        f.orchestrator.process(Events.emailSent("lead-1", "send-1", NOW.minus(Duration.ofDays(3))));
        f.orchestrator.process(Events.emailOpened("lead-1", "open-1", NOW.minus(Duration.ofDays(2))));
        f.orchestrator.process(Events.emailOpened("lead-1", "open-2", NOW.minus(Duration.ofDays(1))));
        f.orchestrator.process(Events.emailOpened("lead-1", "open-3", NOW.minus(Duration.ofHours(2))));
        f.clock.advance(Duration.ofDays(5));

        ReplayReport report = f.queries.replay("lead-1").orElseThrow();

        assertThat(report.eventsReplayed()).isEqualTo(6);
        assertThat(report.replayedScore()).isEqualTo(report.storedScore()).isEqualTo(55.0);
        assertThat(report.replayedLevel()).isEqualTo(EngagementLevel.WARM);
        assertThat(report.consistent()).isTrue();
    }

    @Test
    void replayOfUnknownLeadIsEmpty() {
        assertThat(f.queries.replay("ghost")).isEmpty();
    }

    @Test
    void recentEventsAreNewestFirst() {
        f.orchestrator.process(Events.emailOpened("lead-1", "open-1", NOW.minus(Duration.ofDays(2))));
        f.orchestrator.process(Events.emailClicked("lead-1", "click-1", NOW.minus(Duration.ofDays(1))));

        List<EngagementEvent> recent = f.queries.recentEvents("lead-1", 1);

        assertThat(recent).singleElement()
                .satisfies(e -> assertThat(e.getEventType()).isEqualTo(EventType.EMAIL_CLICKED));
    }

    @Test
    void eligibleListsLeadsWhoseCurrentSnapshotQualifies() {
        f.signals.seed(lead("lead-a", Platform.OUTREACH).emailsReplied(1).lastEmailReplyAt(NOW).build());
        f.signals.seed(lead("lead-b", Platform.OUTREACH).build());
        f.signals.seed(lead("lead-c", Platform.CRM).emailsReplied(1).lastEmailReplyAt(NOW).build());

        List<EligibleLead> eligible = f.queries.eligibleForTransition(10);

        assertThat(eligible).singleElement().satisfies(e -> {
            assertThat(e.leadId()).isEqualTo("lead-a");
            assertThat(e.target()).isEqualTo(Platform.CRM);
            assertThat(e.trigger()).isEqualTo(TransitionTrigger.EMAIL_REPLY);
            assertThat(e.level()).isEqualTo(EngagementLevel.HOT);
        });
        assertThat(f.transitions.all()).isEmpty();
    }

    @Test
    void totalsCountLeadsEventsAndTransitions() {
        f.orchestrator.process(Events.emailSent("lead-1", "send-1", NOW));
        f.orchestrator.process(Events.emailSent("lead-2", "send-2", NOW));

        assertThat(f.queries.totalLeads()).isEqualTo(2);
        assertThat(f.queries.totalEvents()).isEqualTo(4);
        assertThat(f.queries.totalTransitions()).isEqualTo(2);
        assertThat(f.queries.platformLevelCounts()).singleElement().satisfies(c -> {
            assertThat(c.platform()).isEqualTo(Platform.OUTREACH);
            assertThat(c.count()).isEqualTo(2);
        });
    }

    private static EngagementSignal.Builder lead(String leadId, Platform platform) {
        Instant at = NOW.minus(Duration.ofHours(1));
        return EngagementSignal.builder(leadId).currentPlatform(platform).version(1)
                .lastEventAt(at).createdAt(at).updatedAt(at);
    }
}
