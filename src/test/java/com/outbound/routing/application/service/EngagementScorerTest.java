package com.outbound.routing.application.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.valueobject.DecisionPolicy;
import com.outbound.routing.domain.valueobject.EngagementLevel;
import com.outbound.routing.domain.valueobject.ScoreResult;
import com.outbound.routing.domain.valueobject.ScoringPolicy;

class EngagementScorerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T12:00:00Z");

    private final EngagementScorer scorer = new EngagementScorer(ScoringPolicy.defaults(), DecisionPolicy.defaults());

    @Test
    void leadWithoutSignalsIsColdAtZero() {
        ScoreResult result = scorer.score(EngagementSignal.initial("lead-1", null, NOW));

        assertThat(result.score()).isZero();
        assertThat(result.level()).isEqualTo(EngagementLevel.COLD);
    }

    @Test
    void singleOpenIsLukewarm() {
        EngagementSignal s = base().emailsOpened(1).lastEmailOpenAt(NOW).recentOpens(List.of(NOW))
                .lastEventAt(NOW).build();

        ScoreResult result = scorer.score(s);

        assertThat(result.score()).isEqualTo(15.0);
        assertThat(result.level()).isEqualTo(EngagementLevel.LUKEWARM);
    }

    @Test
    void openBurstWithinWindowIsWarm() {
        List<Instant> opens = List.of(NOW.minus(Duration.ofDays(2)), NOW.minus(Duration.ofDays(1)), NOW);
        EngagementSignal s = base().emailsOpened(3).lastEmailOpenAt(NOW).recentOpens(opens)
                .lastEventAt(NOW).build();

        ScoreResult result = scorer.score(s);

        assertThat(result.repeated()).isEqualTo(40.0);
        assertThat(result.single()).isEqualTo(15.0);
        assertThat(result.score()).isEqualTo(55.0);
        assertThat(result.level()).isEqualTo(EngagementLevel.WARM);
    }

    @Test
    void opensSpreadBeyondBurstWindowDoNotCountAsBurst() {
        List<Instant> opens = List.of(NOW.minus(Duration.ofDays(20)), NOW.minus(Duration.ofDays(10)), NOW);
        EngagementSignal s = base().emailsOpened(3).lastEmailOpenAt(NOW).recentOpens(opens)
                .lastEventAt(NOW).build();

        assertThat(scorer.score(s).score()).isEqualTo(15.0);
    }

    @Test
    void replyAloneIsHot() {
        EngagementSignal s = base().emailsReplied(1).lastEmailReplyAt(NOW).lastEventAt(NOW).build();

        ScoreResult result = scorer.score(s);

        assertThat(result.intent()).isEqualTo(75.0);
        assertThat(result.level()).isEqualTo(EngagementLevel.HOT);
    }

    @Test
    void intentTakesStrongestSignalAndTotalIsClamped() {
        List<Instant> opens = List.of(NOW, NOW, NOW);
        EngagementSignal s = base().emailsReplied(1).lastEmailReplyAt(NOW)
                .meetingsCompleted(1).lastMeetingAt(NOW)
                .emailsOpened(3).lastEmailOpenAt(NOW).recentOpens(opens)
                .lastEventAt(NOW).build();

        ScoreResult result = scorer.score(s);

        assertThat(result.intent()).isEqualTo(85.0);
        assertThat(result.score()).isEqualTo(100.0);
    }

    @Test
    void recencyBandsScaleTimeDecayedSignals() {
        assertThat(scorer.recency(NOW.minus(Duration.ofDays(7)), NOW)).isEqualTo(1.0);
        assertThat(scorer.recency(NOW.minus(Duration.ofDays(10)), NOW)).isEqualTo(0.8);
        assertThat(scorer.recency(NOW.minus(Duration.ofDays(30)), NOW)).isEqualTo(0.6);
        assertThat(scorer.recency(NOW.minus(Duration.ofDays(45)), NOW)).isEqualTo(0.3);
        assertThat(scorer.recency(null, NOW)).isEqualTo(0.3);
    }

    @Test
    void oldReplyDecaysWhenScoredAsOfLaterInstant() {
        Instant replyAt = NOW.minus(Duration.ofDays(10));
        EngagementSignal s = base().emailsReplied(1).lastEmailReplyAt(replyAt).lastEventAt(replyAt).build();

        assertThat(scorer.score(s).score()).isEqualTo(75.0);
        assertThat(scorer.score(s, NOW).score()).isEqualTo(60.0);
    }

    @Test
    void noShowIsPenalizedButNeverBelowZero() {
        EngagementSignal s = base().meetingsNoShow(1).lastMeetingAt(NOW).lastEventAt(NOW).build();

        ScoreResult result = scorer.score(s);

        assertThat(result.penalty()).isEqualTo(15.0);
        assertThat(result.score()).isZero();
    }

    @Test
    void rescoreStoresScoreAndLevelOnSnapshot() {
        EngagementSignal s = base().emailsClicked(1).lastEmailClickAt(NOW).networkConnected(true)
                .lastEventAt(NOW).build();

        EngagementSignal rescored = scorer.rescore(s);

        assertThat(rescored.getEngagementScore()).isEqualTo(40.0);
        assertThat(rescored.getEngagementLevel()).isEqualTo(EngagementLevel.WARM);
    }

    private static EngagementSignal.Builder base() {
        return EngagementSignal.builder("lead-1").createdAt(NOW.minus(Duration.ofDays(60)))
                .updatedAt(NOW);
    }
}
