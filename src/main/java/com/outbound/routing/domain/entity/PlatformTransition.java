package com.outbound.routing.domain.entity;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.outbound.routing.domain.valueobject.EngagementLevel;
import com.outbound.routing.domain.valueobject.Platform;
import com.outbound.routing.domain.valueobject.TransitionTrigger;

/**
 * Committed platform move, one row in the append-only transition log.
 * <p>
 * Also acts as the outbox for its commands: {@code dispatchedAt} stays null
 * until every command has been handed to the broker.
 * </p>
 */
public final class PlatformTransition {

    private final String transitionId;
    private final String leadId;
    private final Platform fromPlatform;
    private final Platform toPlatform;
    private final TransitionTrigger trigger;
    private final String triggerEventType;
    private final Map<String, Object> triggerPayload;
    private final double score;
    private final EngagementLevel level;
    private final Map<String, Object> routingDecision;
    private final String idempotencyKey;
    private final boolean manualOverride;
    private final List<RoutingCommand> commands;
    private final Instant createdAt;
    private final Instant dispatchedAt;

    public PlatformTransition(String transitionId, String leadId, Platform fromPlatform,
            Platform toPlatform, TransitionTrigger trigger, String triggerEventType,
            Map<String, Object> triggerPayload, double score, EngagementLevel level,
            Map<String, Object> routingDecision, String idempotencyKey, boolean manualOverride,
            List<RoutingCommand> commands, Instant createdAt, Instant dispatchedAt) {
        if (transitionId == null || leadId == null || idempotencyKey == null) {
            throw new IllegalArgumentException("transitionId, leadId and idempotencyKey are required");
        }
        if (toPlatform == null || toPlatform == Platform.NONE) {
            throw new IllegalArgumentException("toPlatform cannot be null or none");
        }
        this.transitionId = transitionId;
        this.leadId = leadId;
        this.fromPlatform = fromPlatform;
        this.toPlatform = toPlatform;
        this.trigger = trigger;
        this.triggerEventType = triggerEventType;
        this.triggerPayload = triggerPayload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(triggerPayload))
                : Collections.emptyMap();
        this.score = score;
        this.level = level;
        this.routingDecision = routingDecision != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(routingDecision))
                : Collections.emptyMap();
        this.idempotencyKey = idempotencyKey;
        this.manualOverride = manualOverride;
        this.commands = commands != null ? List.copyOf(commands) : List.of();
        this.createdAt = createdAt;
        this.dispatchedAt = dispatchedAt;
    }

    /**
     * Builds the log row for a decision about to be committed.
     *
     * @param decision     decision being executed
     * @param transitionId pre-generated id (also the prefix of the command ids)
     * @param commands     commands derived for this move
     * @param at           commit time
     */
    public static PlatformTransition record(TransitionDecision decision, String transitionId,
            List<RoutingCommand> commands, Instant at) {
        return new PlatformTransition(transitionId, decision.getLeadId(), decision.getFrom(),
                decision.getTarget(), decision.getTrigger(),
                decision.getTriggerEventType() != null ? decision.getTriggerEventType().wireName() : null,
                decision.getTriggerPayload(), decision.getScore(), decision.getLevel(),
                decision.toRecord(), decision.idempotencyKey(), decision.isManualOverride(),
                commands, at, commands.isEmpty() ? at : null);
    }

    public static String newId() {
        return UUID.randomUUID().toString();
    }

    public PlatformTransition markDispatched(Instant at) {
        return new PlatformTransition(transitionId, leadId, fromPlatform, toPlatform, trigger,
                triggerEventType, triggerPayload, score, level, routingDecision, idempotencyKey,
                manualOverride, commands, createdAt, at);
    }

    public boolean isDispatched() {
        return dispatchedAt != null;
    }

    public String getTransitionId() {
        return transitionId;
    }

    public String getLeadId() {
        return leadId;
    }

    public Platform getFromPlatform() {
        return fromPlatform;
    }

    public Platform getToPlatform() {
        return toPlatform;
    }

    public TransitionTrigger getTrigger() {
        return trigger;
    }

    public String getTriggerEventType() {
        return triggerEventType;
    }

    public Map<String, Object> getTriggerPayload() {
        return triggerPayload;
    }

    public double getScore() {
        return score;
    }

    public EngagementLevel getLevel() {
        return level;
    }

    public Map<String, Object> getRoutingDecision() {
        return routingDecision;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }

    public boolean isManualOverride() {
        return manualOverride;
    }

    public List<RoutingCommand> getCommands() {
        return commands;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getDispatchedAt() {
        return dispatchedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        PlatformTransition that = (PlatformTransition) o;
        return Objects.equals(transitionId, that.transitionId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(transitionId);
    }

    @Override
    public String toString() {
        return "PlatformTransition{leadId='" + leadId + "', " + fromPlatform + "→" + toPlatform
                + ", trigger=" + trigger + ", manual=" + manualOverride + "}";
    }
}
