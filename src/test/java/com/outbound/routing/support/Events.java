package com.outbound.routing.support;

import java.time.Instant;
import java.util.Map;

import com.outbound.routing.domain.entity.RawEngagementEvent;

/**
 * Raw adapter events for tests.
 */
public final class Events {

    private Events() {
    }

    public static RawEngagementEvent raw(String leadId, String eventType, String source, String externalId,
            Instant occurredAt) {
        return new RawEngagementEvent(leadId, leadId + "@example.com", eventType, source, externalId, Map.of(),
                occurredAt);
    }

    public static RawEngagementEvent raw(String leadId, String eventType, String source, String externalId,
            Map<String, Object> payload, Instant occurredAt) {
        return new RawEngagementEvent(leadId, leadId + "@example.com", eventType, source, externalId, payload,
                occurredAt);
    }

    public static RawEngagementEvent emailSent(String leadId, String externalId, Instant at) {
        return raw(leadId, "email_sent", "outreach_platform", externalId, at);
    }

    public static RawEngagementEvent emailOpened(String leadId, String externalId, Instant at) {
        return raw(leadId, "email_opened", "outreach_platform", externalId, at);
    }

    public static RawEngagementEvent emailReplied(String leadId, String externalId, Instant at) {
        return raw(leadId, "email_replied", "outreach_platform", externalId, at);
    }

    public static RawEngagementEvent emailClicked(String leadId, String externalId, Instant at) {
        return raw(leadId, "email_clicked", "outreach_platform", externalId, at);
    }
}
