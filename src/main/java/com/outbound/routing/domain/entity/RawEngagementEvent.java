package com.outbound.routing.domain.entity;

import java.time.Instant;
import java.util.Map;

/**
 * Unvalidated event as handed over by a platform adapter.
 *
 * @param leadId     opaque lead id, may be null if email is present
 * @param email      primary email, may be null if leadId is present
 * @param eventType  wire name of the event type
 * @param source     originating system as reported
 * @param externalId vendor event id used for deduplication, optional
 * @param payload    arbitrary structured payload, optional
 * @param occurredAt when the interaction happened
 */
public record RawEngagementEvent(
        String leadId,
        String email,
        String eventType,
        String source,
        String externalId,
        Map<String, Object> payload,
        Instant occurredAt) {
}
