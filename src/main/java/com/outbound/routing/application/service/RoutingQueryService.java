package com.outbound.routing.application.service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import com.outbound.routing.application.port.in.QueryRoutingUseCase;
import com.outbound.routing.application.port.out.EventLog;
import com.outbound.routing.application.port.out.IncidentLog;
import com.outbound.routing.application.port.out.SignalStore;
import com.outbound.routing.application.port.out.TransitionLog;
import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.entity.Incident;
import com.outbound.routing.domain.entity.PlatformTransition;
import com.outbound.routing.domain.entity.TransitionDecision;
import com.outbound.routing.domain.valueobject.EligibleLead;
import com.outbound.routing.domain.valueobject.EventTypeCount;
import com.outbound.routing.domain.valueobject.PlatformLevelCount;
import com.outbound.routing.domain.valueobject.ReplayReport;
import com.outbound.routing.domain.valueobject.ScoreResult;

/**
 * Read side: snapshots, histories, dashboard aggregates and replay audit.
 * <p>
 * Never writes. Eligibility is re-derived on demand by running the decision
 * engine over current snapshots scored as of now.
 * </p>
 */
public class RoutingQueryService implements QueryRoutingUseCase {

    private static final int SCAN_PAGE_SIZE = 200;

    private final SignalStore signalStore;
    private final EventLog eventLog;
    private final TransitionLog transitionLog;
    private final IncidentLog incidentLog;
    private final EngagementScorer scorer;
    private final TransitionDecisionEngine decisionEngine;
    private final Clock clock;

    public RoutingQueryService(SignalStore signalStore,
            EventLog eventLog,
            TransitionLog transitionLog,
            IncidentLog incidentLog,
            EngagementScorer scorer,
            TransitionDecisionEngine decisionEngine,
            Clock clock) {
        if (signalStore == null)
            throw new IllegalArgumentException("signalStore cannot be null");
        if (eventLog == null)
            throw new IllegalArgumentException("eventLog cannot be null");
        if (transitionLog == null)
            throw new IllegalArgumentException("transitionLog cannot be null");
        if (incidentLog == null)
            throw new IllegalArgumentException("incidentLog cannot be null");
        if (scorer == null)
            throw new IllegalArgumentException("scorer cannot be null");
        if (decisionEngine == null)
            throw new IllegalArgumentException("decisionEngine cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");

        this.signalStore = signalStore;
        this.eventLog = eventLog;
        this.transitionLog = transitionLog;
        this.incidentLog = incidentLog;
        this.scorer = scorer;
        this.decisionEngine = decisionEngine;
        this.clock = clock;
    }

    @Override
    public Optional<EngagementSignal> snapshot(String leadId) {
        return signalStore.findByLeadId(leadId);
    }

    @Override
    public List<EngagementEvent> recentEvents(String leadId, int limit) {
        return eventLog.findRecentByLeadId(leadId, limit);
    }

    @Override
    public List<PlatformTransition> transitions(String leadId) {
        return transitionLog.findByLeadId(leadId);
    }

    @Override
    public List<EligibleLead> eligibleForTransition(int limit) {
        Instant now = clock.instant();
        List<EligibleLead> eligible = new ArrayList<>();
        String cursor = null;
        while (eligible.size() < limit) {
            List<EngagementSignal> page = signalStore.findPageAfter(cursor, SCAN_PAGE_SIZE);
            if (page.isEmpty()) {
                break;
            }
            for (EngagementSignal stored : page) {
                ScoreResult current = scorer.score(stored, now);
                EngagementSignal view = stored.withScore(current.score(), current.level());
                Optional<TransitionDecision> decision = decisionEngine.decide(view, null, now);
                if (decision.isPresent()) {
                    TransitionDecision d = decision.get();
                    eligible.add(new EligibleLead(stored.getLeadId(), stored.getEmail(),
                            stored.getCurrentPlatform(), d.getTarget(), d.getTrigger(),
                            current.score(), current.level()));
                    if (eligible.size() >= limit) {
                        break;
                    }
                }
                cursor = stored.getLeadId();
            }
        }
        return eligible;
    }

    @Override
    public List<PlatformLevelCount> platformLevelCounts() {
        return signalStore.countByPlatformAndLevel();
    }

    @Override
    public List<EventTypeCount> eventTypeDistribution() {
        return eventLog.countByEventType();
    }

    @Override
    public List<Incident> recentIncidents(int limit) {
        return incidentLog.findRecent(limit);
    }

    @Override
    public Optional<ReplayReport> replay(String leadId) {
        Optional<EngagementSignal> stored = signalStore.findByLeadId(leadId);
        if (stored.isEmpty()) {
            return Optional.empty();
        }
        EngagementSignal original = stored.get();
        List<EngagementEvent> history = eventLog.findAllByLeadId(leadId);

        EngagementSignal replayed = EngagementSignal.initial(leadId, original.getEmail(), original.getCreatedAt());
        for (EngagementEvent event : history) {
            replayed = replayed.apply(event, event.getOccurredAt());
        }
        ScoreResult result = scorer.score(replayed);

        return Optional.of(new ReplayReport(leadId, history.size(),
                original.getEngagementScore(), original.getEngagementLevel(),
                result.score(), result.level(), countersMatch(original, replayed)));
    }

    @Override
    public long totalLeads() {
        return signalStore.countAll();
    }

    @Override
    public long totalEvents() {
        return eventLog.countAll();
    }

    @Override
    public long totalTransitions() {
        return transitionLog.countAll();
    }

    // ─────────────────── Private Helpers ───────────────────

    private static boolean countersMatch(EngagementSignal a, EngagementSignal b) {
        return a.getEmailsSent() == b.getEmailsSent()
                && a.getEmailsOpened() == b.getEmailsOpened()
                && a.getEmailsClicked() == b.getEmailsClicked()
                && a.getEmailsReplied() == b.getEmailsReplied()
                && a.getEmailsBounced() == b.getEmailsBounced()
                && a.getNetworkMessagesSent() == b.getNetworkMessagesSent()
                && a.getNetworkMessagesReceived() == b.getNetworkMessagesReceived()
                && a.getWebsiteVisits() == b.getWebsiteVisits()
                && a.getPageViews() == b.getPageViews()
                && a.getMeetingsBooked() == b.getMeetingsBooked()
                && a.getMeetingsCompleted() == b.getMeetingsCompleted()
                && a.getMeetingsNoShow() == b.getMeetingsNoShow()
                && a.getFormsSubmitted() == b.getFormsSubmitted()
                && a.getContentDownloads() == b.getContentDownloads()
                && a.isNetworkConnected() == b.isNetworkConnected()
                && a.isVisitorIdentified() == b.isVisitorIdentified()
                && a.isRequestedContact() == b.isRequestedContact()
                && a.isDownloadedContent() == b.isDownloadedContent()
                && a.isViewedPricing() == b.isViewedPricing()
                && a.isViewedDemo() == b.isViewedDemo()
                && a.isInCrm() == b.isInCrm();
    }
}
