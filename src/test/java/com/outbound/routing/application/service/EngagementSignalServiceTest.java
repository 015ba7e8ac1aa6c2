package com.outbound.routing.application.service;

import static com.outbound.routing.support.RoutingFixture.NOW;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.outbound.routing.domain.entity.ApplyResult;
import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.entity.RawEngagementEvent;
import com.outbound.routing.domain.exception.ConflictRetryExhaustedException;
import com.outbound.routing.domain.exception.InvalidEventException;
import com.outbound.routing.domain.valueobject.EngagementLevel;
import com.outbound.routing.support.Events;
import com.outbound.routing.support.RoutingFixture;

class EngagementSignalServiceTest {

    private RoutingFixture f;

    @BeforeEach
    void setUp() {
        f = new RoutingFixture();
    }

    @Test
    void firstEventCreatesAggregateAtVersionOne() {
        ApplyResult result = f.signalService.apply(validated(Events.emailOpened("lead-1", "open-1", NOW)));

        assertThat(result.applied()).isTrue();
        assertThat(result.snapshot().getVersion()).isEqualTo(1);
        assertThat(result.snapshot().getEngagementLevel()).isEqualTo(EngagementLevel.LUKEWARM);
        assertThat(f.signals.findByLeadId("lead-1").orElseThrow().getVersion()).isEqualTo(1);
        assertThat(f.events.all()).singleElement()
                .satisfies(e -> assertThat(e.getSequence()).isNotNull());
    }

    @Test
    void duplicateDedupKeyLeavesAggregateUntouched() {
        EngagementEvent open = validated(Events.emailOpened("lead-1", "open-1", NOW));
        f.signalService.apply(open);

        ApplyResult again = f.signalService.apply(validated(Events.emailOpened("lead-1", "open-1", NOW)));

        assertThat(again.applied()).isFalse();
        assertThat(again.snapshot().getEmailsOpened()).isEqualTo(1);
        assertThat(again.snapshot().getVersion()).isEqualTo(1);
        assertThat(f.events.all()).hasSize(1);
    }

    @Test
    void versionConflictIsRetriedFromFreshRead() {
        f.signals.injectConflicts(2);

        ApplyResult result = f.signalService.apply(validated(Events.emailOpened("lead-1", "open-1", NOW)));

        assertThat(result.applied()).isTrue();
        assertThat(f.tx.rollbacks()).isEqualTo(2);
        assertThat(f.events.all()).hasSize(1);
        assertThat(f.signals.findByLeadId("lead-1").orElseThrow().getEmailsOpened()).isEqualTo(1);
    }

    @Test
    void persistentConflictExhaustsRetryBudgetWithoutPartialWrites() {
        f.signals.injectConflicts(RoutingFixture.MAX_CONFLICT_RETRIES);

        assertThatThrownBy(() -> f.signalService.apply(validated(Events.emailOpened("lead-1", "open-1", NOW))))
                .isInstanceOf(ConflictRetryExhaustedException.class);

        assertThat(f.events.all()).isEmpty();
        assertThat(f.signals.findByLeadId("lead-1")).isEmpty();
    }

    @Test
    void emailOnlyEventResolvesToDerivedLeadThenToOwner() {
        RawEngagementEvent first = new RawEngagementEvent(null, "jane@example.com", "email_opened", "instantly",
                "open-1", null, NOW.minus(Duration.ofHours(1)));
        RawEngagementEvent second = new RawEngagementEvent(null, "JANE@example.com", "email_clicked", "instantly",
                "click-1", null, NOW);

        ApplyResult a = f.signalService.apply(validated(first));
        ApplyResult b = f.signalService.apply(validated(second));

        String derived = EngagementSignalService.deriveLeadId("jane@example.com");
        assertThat(a.snapshot().getLeadId()).isEqualTo(derived);
        assertThat(b.snapshot().getLeadId()).isEqualTo(derived);
        assertThat(b.snapshot().getEmailsClicked()).isEqualTo(1);
        assertThat(f.signals.countAll()).isEqualTo(1);
    }

    @Test
    void emailOwnedByAnotherLeadIsRejected() {
        f.signalService.apply(validated(new RawEngagementEvent("lead-1", "shared@example.com", "email_opened",
                "instantly", "open-1", null, NOW)));

        assertThatThrownBy(() -> f.signalService.apply(validated(new RawEngagementEvent("lead-2",
                "shared@example.com", "email_opened", "instantly", "open-2", null, NOW))))
                .isInstanceOf(InvalidEventException.class)
                .hasFieldOrPropertyWithValue("field", "email");
        assertThat(f.signals.findByLeadId("lead-2")).isEmpty();
    }

    @Test
    void derivedLeadIdIsStable() {
        assertThat(EngagementSignalService.deriveLeadId("a@b.io"))
                .isEqualTo(EngagementSignalService.deriveLeadId("a@b.io"))
                .isNotEqualTo(EngagementSignalService.deriveLeadId("c@b.io"));
    }

    private EngagementEvent validated(RawEngagementEvent raw) {
        return f.validator.validate(raw);
    }
}
