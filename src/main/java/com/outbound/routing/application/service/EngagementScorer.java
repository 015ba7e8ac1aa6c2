package com.outbound.routing.application.service;

import java.time.Duration;
import java.time.Instant;

import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.valueobject.DecisionPolicy;
import com.outbound.routing.domain.valueobject.EngagementLevel;
import com.outbound.routing.domain.valueobject.ScoreResult;
import com.outbound.routing.domain.valueobject.ScoringPolicy;
import com.outbound.routing.domain.valueobject.ScoringWeights;

/**
 * Maps an aggregate snapshot to an engagement score and level.
 * <p>
 * <b>Deterministic:</b> the result depends only on the snapshot and the
 * evaluation instant. Counters are never decayed; recency is applied by
 * weighting each signal by the age of its last occurrence.
 * </p>
 *
 * <p>
 * Components (summed, then clamped to [0, 100]):
 * </p>
 * <ul>
 * <li><b>intent</b>: strongest of reply, meeting, form, contact request</li>
 * <li><b>repeated</b>: open burst, repeat visits, pricing/demo views, downloads</li>
 * <li><b>single</b>: open, click, connection, identification, one visit</li>
 * <li><b>penalty</b>: meeting no-show</li>
 * </ul>
 */
public class EngagementScorer {

    private final ScoringPolicy policy;
    private final DecisionPolicy decisionPolicy;

    public EngagementScorer(ScoringPolicy policy, DecisionPolicy decisionPolicy) {
        if (policy == null)
            throw new IllegalArgumentException("policy cannot be null");
        if (decisionPolicy == null)
            throw new IllegalArgumentException("decisionPolicy cannot be null");

        this.policy = policy;
        this.decisionPolicy = decisionPolicy;
    }

    /**
     * Scores a snapshot as of its own last event.
     * <p>
     * This is the value stored on the aggregate, so replaying the event log
     * reproduces it regardless of when the replay runs.
     * </p>
     */
    public ScoreResult score(EngagementSignal snapshot) {
        return score(snapshot, evaluationInstant(snapshot));
    }

    /**
     * Scores a snapshot as of an arbitrary instant (reconciliation sweep).
     */
    public ScoreResult score(EngagementSignal snapshot, Instant asOf) {
        ScoringWeights w = policy.getWeights();

        double intent = intentComponent(snapshot, w, asOf);
        double repeated = repeatedComponent(snapshot, w, asOf);
        double single = singleComponent(snapshot, w, asOf);
        double penalty = snapshot.getMeetingsNoShow() > 0 ? w.getNoShowPenalty() : 0;

        double total = clamp(round(intent + repeated + single - penalty));
        EngagementLevel level = policy.getThresholds().classify(total);
        return new ScoreResult(total, level, round(intent), round(repeated), round(single), penalty);
    }

    /**
     * Returns a copy of the snapshot carrying its recomputed stored score.
     */
    public EngagementSignal rescore(EngagementSignal snapshot) {
        ScoreResult result = score(snapshot);
        return snapshot.withScore(result.score(), result.level());
    }

    /**
     * Recency multiplier for a signal last seen at {@code at}.
     */
    double recency(Instant at, Instant asOf) {
        if (at == null) {
            return policy.getStaleFactor();
        }
        Duration age = Duration.between(at, asOf);
        if (age.isNegative() || age.compareTo(policy.getFullWeightWindow()) <= 0) {
            return 1.0;
        }
        if (age.compareTo(policy.getReducedWeightWindow()) <= 0) {
            return policy.getReducedFactor();
        }
        if (age.compareTo(policy.getDecayWindow()) <= 0) {
            return policy.getAgingFactor();
        }
        return policy.getStaleFactor();
    }

    // ─────────────────── Components ───────────────────

    private double intentComponent(EngagementSignal s, ScoringWeights w, Instant asOf) {
        double best = 0;
        if (s.hasExplicitReply()) {
            Instant lastReply = latest(s.getLastEmailReplyAt(), s.getLastNetworkReplyAt());
            best = Math.max(best, w.getReply() * recency(lastReply, asOf));
        }
        if (s.getMeetingsCompleted() > 0) {
            best = Math.max(best, w.getMeetingCompleted() * recency(s.getLastMeetingAt(), asOf));
        } else if (s.getMeetingsBooked() > 0) {
            best = Math.max(best, w.getMeetingBooked() * recency(s.getLastMeetingAt(), asOf));
        }
        if (s.getFormsSubmitted() > 0) {
            best = Math.max(best, w.getFormSubmitted() * recency(s.getLastFormSubmittedAt(), asOf));
        }
        if (s.isRequestedContact()) {
            best = Math.max(best, w.getRequestedContact() * recency(s.getRequestedContactAt(), asOf));
        }
        return best;
    }

    private double repeatedComponent(EngagementSignal s, ScoringWeights w, Instant asOf) {
        double total = 0;
        Instant burstStart = asOf.minus(decisionPolicy.getOpenBurstWindow());
        if (s.opensSince(burstStart) >= decisionPolicy.getOpenBurstCount()) {
            total += w.getOpenBurst();
        }
        if (s.getWebsiteVisits() >= 2) {
            total += w.getRepeatVisits() * recency(s.getLastWebsiteVisitAt(), asOf);
        }
        if (s.isViewedPricing() || s.isViewedDemo()) {
            total += w.getPricingOrDemoViewed();
        }
        if (s.isDownloadedContent()) {
            total += w.getContentDownloaded() * recency(s.getLastContentDownloadAt(), asOf);
        }
        return total;
    }

    private double singleComponent(EngagementSignal s, ScoringWeights w, Instant asOf) {
        double total = 0;
        if (s.getEmailsOpened() > 0) {
            total += w.getOpen() * recency(s.getLastEmailOpenAt(), asOf);
        }
        if (s.getEmailsClicked() > 0) {
            total += w.getClick() * recency(s.getLastEmailClickAt(), asOf);
        }
        if (s.isNetworkConnected()) {
            total += w.getNetworkConnected();
        }
        if (s.isVisitorIdentified()) {
            total += w.getVisitorIdentified() * recency(s.getVisitorIdentifiedAt(), asOf);
        }
        if (s.getWebsiteVisits() == 1) {
            total += w.getWebsiteVisit() * recency(s.getLastWebsiteVisitAt(), asOf);
        }
        return total;
    }

    // ─────────────────── Private Helpers ───────────────────

    private static Instant evaluationInstant(EngagementSignal snapshot) {
        return snapshot.getLastEventAt() != null ? snapshot.getLastEventAt() : snapshot.getCreatedAt();
    }

    private static Instant latest(Instant a, Instant b) {
        if (a == null)
            return b;
        if (b == null)
            return a;
        return a.isAfter(b) ? a : b;
    }

    private static double clamp(double score) {
        return Math.max(0, Math.min(100, score));
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
