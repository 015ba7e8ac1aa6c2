package com.outbound.routing.domain.entity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.outbound.routing.domain.valueobject.EngagementLevel;
import com.outbound.routing.domain.valueobject.EventType;
import com.outbound.routing.domain.valueobject.Platform;
import com.outbound.routing.domain.valueobject.TransitionTrigger;

/**
 * Proposal to move a lead to another platform.
 * <p>
 * A pure value returned by the decision engine (or built from an operator
 * request); it mutates nothing. The executor decides whether it still applies
 * and commits it.
 * </p>
 */
public final class TransitionDecision {

    private final String leadId;
    private final String email;
    private final Platform from;
    private final Platform target;
    private final TransitionTrigger trigger;
    private final long authorizingSnapshotVersion;
    private final double score;
    private final EngagementLevel level;
    private final EventType triggerEventType;
    private final Map<String, Object> triggerPayload;
    private final Map<String, Object> signalsSummary;
    private final Instant decidedAt;
    private final String operator;
    private final String note;
    private final String requestId;

    private TransitionDecision(String leadId, String email, Platform from, Platform target,
            TransitionTrigger trigger, long authorizingSnapshotVersion, double score,
            EngagementLevel level, EventType triggerEventType, Map<String, Object> triggerPayload,
            Map<String, Object> signalsSummary, Instant decidedAt, String operator, String note,
            String requestId) {
        if (leadId == null || leadId.isBlank()) {
            throw new IllegalArgumentException("leadId cannot be null or blank");
        }
        if (from == null || target == null || trigger == null) {
            throw new IllegalArgumentException("from, target and trigger are required");
        }
        if (decidedAt == null) {
            throw new IllegalArgumentException("decidedAt cannot be null");
        }
        this.leadId = leadId;
        this.email = email;
        this.from = from;
        this.target = target;
        this.trigger = trigger;
        this.authorizingSnapshotVersion = authorizingSnapshotVersion;
        this.score = score;
        this.level = level;
        this.triggerEventType = triggerEventType;
        this.triggerPayload = triggerPayload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(triggerPayload))
                : Collections.emptyMap();
        this.signalsSummary = signalsSummary != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(signalsSummary))
                : Collections.emptyMap();
        this.decidedAt = decidedAt;
        this.operator = operator;
        this.note = note;
        this.requestId = requestId;
    }

    // ─────────────────── Factory Methods ───────────────────

    /**
     * Decision proposed by the rule engine from an authorizing snapshot.
     */
    public static TransitionDecision automated(EngagementSignal snapshot, Platform target,
            TransitionTrigger trigger, EngagementEvent triggeringEvent,
            Map<String, Object> signalsSummary, Instant decidedAt) {
        if (trigger.isManual()) {
            throw new IllegalArgumentException("automated decisions cannot use the manual trigger");
        }
        return new TransitionDecision(snapshot.getLeadId(), snapshot.getEmail(),
                snapshot.getCurrentPlatform(), target, trigger, snapshot.getVersion(),
                snapshot.getEngagementScore(), snapshot.getEngagementLevel(),
                triggeringEvent != null ? triggeringEvent.getEventType() : null,
                triggeringEvent != null ? triggeringEvent.getPayload() : null,
                signalsSummary, decidedAt, null, null, null);
    }

    /**
     * Operator-initiated override.
     *
     * @param requestId caller-supplied id that makes the override idempotent
     */
    public static TransitionDecision manual(EngagementSignal snapshot, Platform target,
            String operator, String note, String requestId, Instant decidedAt) {
        if (requestId == null || requestId.isBlank()) {
            throw new IllegalArgumentException("requestId cannot be null or blank");
        }
        return new TransitionDecision(snapshot.getLeadId(), snapshot.getEmail(),
                snapshot.getCurrentPlatform(), target, TransitionTrigger.MANUAL_OVERRIDE,
                snapshot.getVersion(), snapshot.getEngagementScore(), snapshot.getEngagementLevel(),
                null, null, null, decidedAt, operator, note, requestId);
    }

    /**
     * Copy whose origin is the lead's platform at commit time.
     * The authorizing snapshot version, and so the idempotency key, is kept.
     */
    public TransitionDecision rebasedOn(Platform actualFrom) {
        return new TransitionDecision(leadId, email, actualFrom, target, trigger,
                authorizingSnapshotVersion, score, level, triggerEventType, triggerPayload,
                signalsSummary, decidedAt, operator, note, requestId);
    }

    // ─────────────────── Behavior Methods ───────────────────

    public boolean isManualOverride() {
        return trigger.isManual();
    }

    /**
     * Key identifying this decision across redeliveries and sweeps:
     * {@code leadId:target:snapshotVersion}. Overrides use
     * {@code leadId:target:manual:requestId} so a retried request commits once.
     */
    public String idempotencyKey() {
        if (isManualOverride()) {
            return leadId + ":" + target.wireName() + ":manual:" + requestId;
        }
        return leadId + ":" + target.wireName() + ":" + authorizingSnapshotVersion;
    }

    /**
     * Structured record stored as the aggregate's {@code last_routing_decision}.
     */
    public Map<String, Object> toRecord() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("target", target.wireName());
        record.put("from", from.wireName());
        record.put("reason", trigger.wireName());
        record.put("priority", trigger.priority());
        record.put("score", score);
        record.put("level", level != null ? level.wireName() : null);
        record.put("snapshot_version", authorizingSnapshotVersion);
        record.put("trigger_event", triggerEventType != null ? triggerEventType.wireName() : null);
        record.put("signals", signalsSummary);
        record.put("manual_override", isManualOverride());
        if (isManualOverride()) {
            record.put("operator", operator);
            record.put("note", note);
        }
        record.put("decided_at", decidedAt.toString());
        return record;
    }

    // ─────────────────── Getters ───────────────────

    public String getLeadId() {
        return leadId;
    }

    public String getEmail() {
        return email;
    }

    public Platform getFrom() {
        return from;
    }

    public Platform getTarget() {
        return target;
    }

    public TransitionTrigger getTrigger() {
        return trigger;
    }

    public long getAuthorizingSnapshotVersion() {
        return authorizingSnapshotVersion;
    }

    public double getScore() {
        return score;
    }

    public EngagementLevel getLevel() {
        return level;
    }

    public EventType getTriggerEventType() {
        return triggerEventType;
    }

    public Map<String, Object> getTriggerPayload() {
        return triggerPayload;
    }

    public Map<String, Object> getSignalsSummary() {
        return signalsSummary;
    }

    public Instant getDecidedAt() {
        return decidedAt;
    }

    public String getOperator() {
        return operator;
    }

    public String getNote() {
        return note;
    }

    public String getRequestId() {
        return requestId;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        TransitionDecision that = (TransitionDecision) o;
        return Objects.equals(idempotencyKey(), that.idempotencyKey());
    }

    @Override
    public int hashCode() {
        return Objects.hash(idempotencyKey());
    }

    @Override
    public String toString() {
        return "TransitionDecision{leadId='" + leadId
                + "', " + from + "→" + target
                + ", trigger=" + trigger
                + ", snapshotVersion=" + authorizingSnapshotVersion + "}";
    }
}
