package com.outbound.routing.domain.entity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Operator-facing record of a rejected event or an illegal-transition alarm.
 */
public final class Incident {

    public enum Kind {
        REJECTED_EVENT,
        ILLEGAL_TRANSITION
    }

    private final String incidentId;
    private final Kind kind;
    private final String leadId;
    private final String reason;
    private final Map<String, Object> detail;
    private final Instant occurredAt;

    public Incident(String incidentId, Kind kind, String leadId, String reason,
            Map<String, Object> detail, Instant occurredAt) {
        if (kind == null || occurredAt == null) {
            throw new IllegalArgumentException("kind and occurredAt are required");
        }
        this.incidentId = incidentId;
        this.kind = kind;
        this.leadId = leadId;
        this.reason = reason;
        this.detail = detail != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(detail))
                : Collections.emptyMap();
        this.occurredAt = occurredAt;
    }

    public static Incident rejectedEvent(String leadId, String reason, Map<String, Object> detail,
            Instant at) {
        return new Incident(UUID.randomUUID().toString(), Kind.REJECTED_EVENT, leadId, reason, detail, at);
    }

    public static Incident illegalTransition(String leadId, String reason, Map<String, Object> detail,
            Instant at) {
        return new Incident(UUID.randomUUID().toString(), Kind.ILLEGAL_TRANSITION, leadId, reason, detail, at);
    }

    public String getIncidentId() {
        return incidentId;
    }

    public Kind getKind() {
        return kind;
    }

    public String getLeadId() {
        return leadId;
    }

    public String getReason() {
        return reason;
    }

    public Map<String, Object> getDetail() {
        return detail;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    @Override
    public String toString() {
        return "Incident{kind=" + kind + ", leadId='" + leadId + "', reason='" + reason + "'}";
    }
}
