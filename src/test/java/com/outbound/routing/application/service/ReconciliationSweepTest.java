package com.outbound.routing.application.service;

import static com.outbound.routing.support.RoutingFixture.NOW;
import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.valueobject.CommandType;
import com.outbound.routing.domain.valueobject.EngagementLevel;
import com.outbound.routing.domain.valueobject.Platform;
import com.outbound.routing.domain.valueobject.SweepReport;
import com.outbound.routing.support.RoutingFixture;

class ReconciliationSweepTest {

    private RoutingFixture f;

    @BeforeEach
    void setUp() {
        f = new RoutingFixture();
        f.signals.seed(replied("lead-a"));
        f.signals.seed(quiet("lead-b"));
        f.signals.seed(replied("lead-c"));
        f.signals.seed(quiet("lead-d"));
    }

    @Test
    void sweepCommitsMissedTransitionsAndClearsCursor() {
        SweepReport report = f.sweep.reconcile();

        assertThat(report.completed()).isTrue();
        assertThat(report.scanned()).isEqualTo(4);
        assertThat(report.transitions()).isEqualTo(2);
        assertThat(f.checkpoints.loadCursor()).isEmpty();
        assertThat(f.checkpoints.savedCursors()).containsExactly("lead-b", "lead-d");
        assertThat(f.signals.findByLeadId("lead-a").orElseThrow().getCurrentPlatform()).isEqualTo(Platform.CRM);
        assertThat(f.signals.findByLeadId("lead-b").orElseThrow().getCurrentPlatform()).isEqualTo(Platform.OUTREACH);
    }

    @Test
    void rerunEmitsNoSecondCommand() {
        f.sweep.reconcile();
        SweepReport second = f.sweep.reconcile();

        assertThat(second.transitions()).isZero();
        assertThat(f.publisher.count(CommandType.ENROLL_IN_CRM)).isEqualTo(2);
    }

    @Test
    void cancelledSweepResumesAfterCheckpoint() {
        AtomicBoolean cancelled = new AtomicBoolean();
        f.publisher.onPublish(command -> {
            if (cancelled.compareAndSet(false, true)) {
                f.sweep.cancel();
            }
        });

        SweepReport first = f.sweep.reconcile();

        assertThat(first.completed()).isFalse();
        assertThat(first.scanned()).isEqualTo(1);
        assertThat(first.lastLeadId()).isEqualTo("lead-a");
        assertThat(f.checkpoints.loadCursor()).contains("lead-a");

        SweepReport resumed = f.sweep.reconcile();

        assertThat(resumed.completed()).isTrue();
        assertThat(resumed.scanned()).isEqualTo(3);
        assertThat(resumed.transitions()).isEqualTo(1);
        assertThat(f.publisher.count(CommandType.ENROLL_IN_CRM)).isEqualTo(2);
        assertThat(f.sweep.isRunning()).isFalse();
    }

    @Test
    void sweepScoresAsOfNowWithoutPersistingDecay() {
        f.clock.advance(Duration.ofDays(40));

        f.sweep.reconcile();

        EngagementSignal b = f.signals.findByLeadId("lead-b").orElseThrow();
        assertThat(b.getEngagementScore()).isEqualTo(15.0);
        assertThat(b.getVersion()).isEqualTo(1);
    }

    private static EngagementSignal replied(String leadId) {
        Instant at = NOW.minus(Duration.ofDays(1));
        return EngagementSignal.builder(leadId)
                .email(leadId + "@example.com")
                .currentPlatform(Platform.OUTREACH)
                .emailsReplied(1)
                .lastEmailReplyAt(at)
                .lastEventAt(at)
                .engagementScore(75)
                .engagementLevel(EngagementLevel.HOT)
                .version(1)
                .createdAt(at)
                .updatedAt(at)
                .build();
    }

    private static EngagementSignal quiet(String leadId) {
        Instant at = NOW.minus(Duration.ofDays(1));
        return EngagementSignal.builder(leadId)
                .email(leadId + "@example.com")
                .currentPlatform(Platform.OUTREACH)
                .emailsOpened(1)
                .lastEmailOpenAt(at)
                .recentOpens(List.of(at))
                .lastEventAt(at)
                .engagementScore(15)
                .engagementLevel(EngagementLevel.LUKEWARM)
                .version(1)
                .createdAt(at)
                .updatedAt(at)
                .build();
    }
}
