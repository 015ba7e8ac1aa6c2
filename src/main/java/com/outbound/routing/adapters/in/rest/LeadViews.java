package com.outbound.routing.adapters.in.rest;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.entity.Incident;
import com.outbound.routing.domain.entity.PlatformTransition;
import com.outbound.routing.domain.entity.RoutingCommand;
import com.outbound.routing.domain.valueobject.EligibleLead;
import com.outbound.routing.domain.valueobject.ReplayReport;

/**
 * JSON views of the routing read model, shared by the REST controllers.
 */
final class LeadViews {

    private LeadViews() {
    }

    static Map<String, Object> snapshot(EngagementSignal s) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("leadId", s.getLeadId());
        view.put("email", s.getEmail());
        view.put("currentPlatform", s.getCurrentPlatform().wireName());
        view.put("engagementScore", s.getEngagementScore());
        view.put("engagementLevel", s.getEngagementLevel().wireName());
        view.put("transitionCount", s.getTransitionCount());
        view.put("version", s.getVersion());

        Map<String, Object> email = new LinkedHashMap<>();
        email.put("sent", s.getEmailsSent());
        email.put("opened", s.getEmailsOpened());
        email.put("clicked", s.getEmailsClicked());
        email.put("replied", s.getEmailsReplied());
        email.put("bounced", s.getEmailsBounced());
        email.put("lastOpenAt", text(s.getLastEmailOpenAt()));
        email.put("lastReplyAt", text(s.getLastEmailReplyAt()));
        view.put("emailActivity", email);

        Map<String, Object> network = new LinkedHashMap<>();
        network.put("connected", s.isNetworkConnected());
        network.put("messagesSent", s.getNetworkMessagesSent());
        network.put("messagesReceived", s.getNetworkMessagesReceived());
        network.put("lastReplyAt", text(s.getLastNetworkReplyAt()));
        view.put("networkActivity", network);

        Map<String, Object> website = new LinkedHashMap<>();
        website.put("visits", s.getWebsiteVisits());
        website.put("pageViews", s.getPageViews());
        website.put("visitorIdentified", s.isVisitorIdentified());
        website.put("viewedPricing", s.isViewedPricing());
        website.put("viewedDemo", s.isViewedDemo());
        website.put("contentDownloads", s.getContentDownloads());
        website.put("formsSubmitted", s.getFormsSubmitted());
        website.put("requestedContact", s.isRequestedContact());
        view.put("websiteActivity", website);

        Map<String, Object> meetings = new LinkedHashMap<>();
        meetings.put("booked", s.getMeetingsBooked());
        meetings.put("completed", s.getMeetingsCompleted());
        meetings.put("noShow", s.getMeetingsNoShow());
        meetings.put("lastMeetingAt", text(s.getLastMeetingAt()));
        view.put("meetings", meetings);

        Map<String, Object> crm = new LinkedHashMap<>();
        crm.put("inCrm", s.isInCrm());
        crm.put("stage", s.getCrmStage());
        crm.put("lastActivityAt", text(s.getLastCrmActivityAt()));
        view.put("crm", crm);

        view.put("lastEventAt", text(s.getLastEventAt()));
        view.put("lastRoutingDecision", s.getLastRoutingDecision());
        view.put("lastRoutedAt", text(s.getLastRoutedAt()));
        view.put("createdAt", text(s.getCreatedAt()));
        view.put("updatedAt", text(s.getUpdatedAt()));
        return view;
    }

    static Map<String, Object> event(EngagementEvent e) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("eventId", e.getEventId());
        view.put("sequence", e.getSequence());
        view.put("eventType", e.getEventType() != null ? e.getEventType().wireName() : null);
        view.put("source", e.getSource().wireName());
        view.put("reportedSource", e.getReportedSource());
        view.put("dedupKey", e.getDedupKey());
        view.put("payload", e.getPayload());
        view.put("occurredAt", text(e.getOccurredAt()));
        return view;
    }

    static Map<String, Object> transition(PlatformTransition t) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("transitionId", t.getTransitionId());
        view.put("from", t.getFromPlatform().wireName());
        view.put("to", t.getToPlatform().wireName());
        view.put("trigger", t.getTrigger().wireName());
        view.put("triggerEventType", t.getTriggerEventType());
        view.put("score", t.getScore());
        view.put("level", t.getLevel() != null ? t.getLevel().wireName() : null);
        view.put("manualOverride", t.isManualOverride());
        view.put("idempotencyKey", t.getIdempotencyKey());
        view.put("routingDecision", t.getRoutingDecision());
        List<String> commands = new ArrayList<>();
        for (RoutingCommand command : t.getCommands()) {
            commands.add(command.getType().name());
        }
        view.put("commands", commands);
        view.put("createdAt", text(t.getCreatedAt()));
        view.put("dispatchedAt", text(t.getDispatchedAt()));
        return view;
    }

    static Map<String, Object> eligible(EligibleLead lead) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("leadId", lead.leadId());
        view.put("email", lead.email());
        view.put("currentPlatform", lead.current().wireName());
        view.put("targetPlatform", lead.target().wireName());
        view.put("trigger", lead.trigger().wireName());
        view.put("score", lead.currentScore());
        view.put("level", lead.level().wireName());
        return view;
    }

    static Map<String, Object> incident(Incident incident) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("incidentId", incident.getIncidentId());
        view.put("kind", incident.getKind().name());
        view.put("leadId", incident.getLeadId());
        view.put("reason", incident.getReason());
        view.put("detail", incident.getDetail());
        view.put("occurredAt", text(incident.getOccurredAt()));
        return view;
    }

    static Map<String, Object> replay(ReplayReport report) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("leadId", report.leadId());
        view.put("eventsReplayed", report.eventsReplayed());
        view.put("storedScore", report.storedScore());
        view.put("storedLevel", report.storedLevel().wireName());
        view.put("replayedScore", report.replayedScore());
        view.put("replayedLevel", report.replayedLevel().wireName());
        view.put("countersMatch", report.countersMatch());
        view.put("consistent", report.consistent());
        return view;
    }

    private static String text(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
