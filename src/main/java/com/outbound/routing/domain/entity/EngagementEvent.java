package com.outbound.routing.domain.entity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.outbound.routing.domain.valueobject.EventSource;
import com.outbound.routing.domain.valueobject.EventType;

/**
 * Validated, normalized engagement event.
 * <p>
 * Produced by the event validator from a {@link RawEngagementEvent} and written
 * once to the append-only event log. Never mutated afterwards; the
 * {@code with*} methods return copies.
 * </p>
 *
 * <p>
 * <b>Invariants:</b>
 * </p>
 * <ul>
 * <li>at least one of leadId / email is present</li>
 * <li>eventType, source, dedupKey and occurredAt are non-null</li>
 * <li>payload is never null (empty map if not provided)</li>
 * </ul>
 */
public final class EngagementEvent {

    private final String eventId;
    private final String leadId;
    private final String email;
    private final EventType eventType;
    private final EventSource source;
    private final String reportedSource;
    private final String dedupKey;
    private final Map<String, Object> payload;
    private final Instant occurredAt;
    private final Long sequence;

    public EngagementEvent(String eventId, String leadId, String email, EventType eventType,
            EventSource source, String reportedSource, String dedupKey,
            Map<String, Object> payload, Instant occurredAt, Long sequence) {
        if (eventId == null || eventId.isBlank()) {
            throw new IllegalArgumentException("eventId cannot be null or blank");
        }
        if (isBlank(leadId) && isBlank(email)) {
            throw new IllegalArgumentException("leadId or email must be present");
        }
        if (eventType == null) {
            throw new IllegalArgumentException("eventType cannot be null");
        }
        if (source == null) {
            throw new IllegalArgumentException("source cannot be null");
        }
        if (dedupKey == null || dedupKey.isBlank()) {
            throw new IllegalArgumentException("dedupKey cannot be null or blank");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }

        this.eventId = eventId;
        this.leadId = isBlank(leadId) ? null : leadId;
        this.email = isBlank(email) ? null : email;
        this.eventType = eventType;
        this.source = source;
        this.reportedSource = reportedSource;
        this.dedupKey = dedupKey;
        this.payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Collections.emptyMap();
        this.occurredAt = occurredAt;
        this.sequence = sequence;
    }

    // ─────────────────── Factory Methods ───────────────────

    /**
     * Creates an engine-authored event (platform transitions) with a fresh id.
     */
    public static EngagementEvent internal(String leadId, String email, EventType eventType,
            EventSource source, String dedupKey, Map<String, Object> payload, Instant occurredAt) {
        return new EngagementEvent(UUID.randomUUID().toString(), leadId, email, eventType,
                source, source.wireName(), dedupKey, payload, occurredAt, null);
    }

    // ─────────────────── Copies ───────────────────

    /**
     * Binds the event to a resolved lead identity.
     */
    public EngagementEvent withLeadId(String resolvedLeadId) {
        return new EngagementEvent(eventId, resolvedLeadId, email, eventType, source,
                reportedSource, dedupKey, payload, occurredAt, sequence);
    }

    /**
     * Attaches the log sequence assigned on insert.
     */
    public EngagementEvent withSequence(long assignedSequence) {
        return new EngagementEvent(eventId, leadId, email, eventType, source,
                reportedSource, dedupKey, payload, occurredAt, assignedSequence);
    }

    // ─────────────────── Behavior Methods ───────────────────

    public boolean isPositiveIntent() {
        return eventType.isPositiveIntent();
    }

    public boolean isFrom(EventSource candidate) {
        return source == candidate;
    }

    /**
     * Reads a payload attribute as text.
     *
     * @param key payload key
     * @return string form of the value, or null if absent
     */
    public String payloadText(String key) {
        Object value = payload.get(key);
        return value != null ? value.toString() : null;
    }

    // ─────────────────── Getters ───────────────────

    public String getEventId() {
        return eventId;
    }

    public String getLeadId() {
        return leadId;
    }

    public String getEmail() {
        return email;
    }

    public EventType getEventType() {
        return eventType;
    }

    public EventSource getSource() {
        return source;
    }

    /**
     * @return source string exactly as the adapter reported it
     */
    public String getReportedSource() {
        return reportedSource;
    }

    public String getDedupKey() {
        return dedupKey;
    }

    public Map<String, Object> getPayload() {
        return payload;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    /**
     * @return log sequence, or null if the event has not been written yet
     */
    public Long getSequence() {
        return sequence;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // ─────────────────── Identity ───────────────────

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        EngagementEvent that = (EngagementEvent) o;
        return Objects.equals(dedupKey, that.dedupKey);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dedupKey);
    }

    @Override
    public String toString() {
        return "EngagementEvent{eventId='" + eventId
                + "', leadId='" + leadId
                + "', eventType=" + eventType
                + ", source=" + source
                + ", occurredAt=" + occurredAt + "}";
    }
}
