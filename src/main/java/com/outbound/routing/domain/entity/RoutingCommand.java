package com.outbound.routing.domain.entity;

import java.time.Instant;
import java.util.Objects;

import com.outbound.routing.domain.valueobject.CommandType;
import com.outbound.routing.domain.valueobject.Platform;

/**
 * Directive for the platform-adapter executors, emitted after a transition
 * has durably committed.
 * <p>
 * The command id is derived from the transition id and the command type, so
 * redispatching the same transition yields the same ids.
 * </p>
 */
public final class RoutingCommand {

    private final String commandId;
    private final String transitionId;
    private final CommandType type;
    private final String leadId;
    private final String email;
    private final Platform fromPlatform;
    private final Platform toPlatform;
    private final Instant issuedAt;

    public RoutingCommand(String commandId, String transitionId, CommandType type, String leadId,
            String email, Platform fromPlatform, Platform toPlatform, Instant issuedAt) {
        if (commandId == null || commandId.isBlank()) {
            throw new IllegalArgumentException("commandId cannot be null or blank");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (leadId == null || leadId.isBlank()) {
            throw new IllegalArgumentException("leadId cannot be null or blank");
        }
        this.commandId = commandId;
        this.transitionId = transitionId;
        this.type = type;
        this.leadId = leadId;
        this.email = email;
        this.fromPlatform = fromPlatform;
        this.toPlatform = toPlatform;
        this.issuedAt = issuedAt;
    }

    public static RoutingCommand of(String transitionId, CommandType type, String leadId, String email,
            Platform fromPlatform, Platform toPlatform, Instant issuedAt) {
        return new RoutingCommand(transitionId + ":" + type.name(), transitionId, type, leadId, email,
                fromPlatform, toPlatform, issuedAt);
    }

    public String getCommandId() {
        return commandId;
    }

    public String getTransitionId() {
        return transitionId;
    }

    public CommandType getType() {
        return type;
    }

    public String getLeadId() {
        return leadId;
    }

    public String getEmail() {
        return email;
    }

    public Platform getFromPlatform() {
        return fromPlatform;
    }

    public Platform getToPlatform() {
        return toPlatform;
    }

    public Instant getIssuedAt() {
        return issuedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        RoutingCommand that = (RoutingCommand) o;
        return Objects.equals(commandId, that.commandId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(commandId);
    }

    @Override
    public String toString() {
        return "RoutingCommand{commandId='" + commandId + "', type=" + type + ", leadId='" + leadId + "'}";
    }
}
