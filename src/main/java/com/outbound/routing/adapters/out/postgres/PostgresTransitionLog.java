package com.outbound.routing.adapters.out.postgres;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outbound.routing.application.port.out.TransitionLog;
import com.outbound.routing.domain.entity.PlatformTransition;
import com.outbound.routing.domain.entity.RoutingCommand;
import com.outbound.routing.domain.valueobject.CommandType;
import com.outbound.routing.domain.valueobject.EngagementLevel;
import com.outbound.routing.domain.valueobject.Platform;
import com.outbound.routing.domain.valueobject.TransitionTrigger;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * PostgreSQL implementation of the TransitionLog outbound port.
 * <p>
 * Doubles as the command outbox: commands are stored with the transition
 * and {@code dispatched_at} stays null until all of them reached the broker.
 * </p>
 */
@Component
public class PostgresTransitionLog implements TransitionLog {

    private static final Logger log = LoggerFactory.getLogger(PostgresTransitionLog.class);

    private static final String INSERT_SQL = "INSERT INTO platform_transitions "
            + "(transition_id, lead_id, from_platform, to_platform, transition_trigger, trigger_event_type, trigger_payload, "
            + "score, engagement_level, routing_decision, idempotency_key, manual_override, commands, "
            + "created_at, dispatched_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?::jsonb, ?, ?, ?::jsonb, ?, ?) "
            + "ON CONFLICT (idempotency_key) DO NOTHING";

    private static final String COLUMNS = "transition_id, lead_id, from_platform, to_platform, transition_trigger, "
            + "trigger_event_type, trigger_payload, score, engagement_level, routing_decision, idempotency_key, "
            + "manual_override, commands, created_at, dispatched_at";

    private static final String SELECT_BY_KEY_SQL = "SELECT " + COLUMNS
            + " FROM platform_transitions WHERE idempotency_key = ?";

    private static final String SELECT_BY_LEAD_SQL = "SELECT " + COLUMNS
            + " FROM platform_transitions WHERE lead_id = ? ORDER BY seq";

    private static final String SELECT_UNDISPATCHED_SQL = "SELECT " + COLUMNS
            + " FROM platform_transitions WHERE dispatched_at IS NULL AND created_at < ? "
            + "ORDER BY seq LIMIT ?";

    private static final String MARK_DISPATCHED_SQL = "UPDATE platform_transitions SET dispatched_at = ? "
            + "WHERE transition_id = ? AND dispatched_at IS NULL";

    private static final String COUNT_ALL_SQL = "SELECT COUNT(*) FROM platform_transitions";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    public PostgresTransitionLog(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper,
            MeterRegistry meterRegistry) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public boolean append(PlatformTransition transition) {
        try {
            List<CommandRow> commandRows = new ArrayList<>();
            for (RoutingCommand command : transition.getCommands()) {
                commandRows.add(CommandRow.fromDomain(command));
            }

            int rows = jdbcTemplate.update(INSERT_SQL,
                    transition.getTransitionId(),
                    transition.getLeadId(),
                    transition.getFromPlatform().wireName(),
                    transition.getToPlatform().wireName(),
                    transition.getTrigger().wireName(),
                    transition.getTriggerEventType(),
                    objectMapper.writeValueAsString(transition.getTriggerPayload()),
                    transition.getScore(),
                    transition.getLevel() != null ? transition.getLevel().wireName() : null,
                    objectMapper.writeValueAsString(transition.getRoutingDecision()),
                    transition.getIdempotencyKey(),
                    transition.isManualOverride(),
                    objectMapper.writeValueAsString(commandRows),
                    Timestamp.from(transition.getCreatedAt()),
                    transition.getDispatchedAt() != null ? Timestamp.from(transition.getDispatchedAt()) : null);

            if (rows == 0) {
                log.debug("action=transition_duplicate_skipped key={}", transition.getIdempotencyKey());
                return false;
            }
            log.debug("action=transition_appended transitionId={} leadId={} key={}",
                    transition.getTransitionId(), transition.getLeadId(), transition.getIdempotencyKey());
            countOnCommit(transition);
            return true;
        } catch (JsonProcessingException e) {
            log.error("action=transition_serialize_error transitionId={} error={}",
                    transition.getTransitionId(), e.getMessage());
            throw new IllegalStateException("Failed to serialize platform transition", e);
        }
    }

    @Override
    public Optional<PlatformTransition> findByIdempotencyKey(String idempotencyKey) {
        return jdbcTemplate.query(SELECT_BY_KEY_SQL, (rs, rowNum) -> mapRow(rs), idempotencyKey)
                .stream().findFirst();
    }

    @Override
    public List<PlatformTransition> findByLeadId(String leadId) {
        return jdbcTemplate.query(SELECT_BY_LEAD_SQL, (rs, rowNum) -> mapRow(rs), leadId);
    }

    @Override
    public List<PlatformTransition> findUndispatched(Instant createdBefore, int limit) {
        return jdbcTemplate.query(SELECT_UNDISPATCHED_SQL, (rs, rowNum) -> mapRow(rs),
                Timestamp.from(createdBefore), limit);
    }

    @Override
    public void markDispatched(String transitionId, Instant dispatchedAt) {
        int rows = jdbcTemplate.update(MARK_DISPATCHED_SQL, Timestamp.from(dispatchedAt), transitionId);
        log.debug("action=transition_marked_dispatched transitionId={} updated={}", transitionId, rows);
    }

    @Override
    public long countAll() {
        Long count = jdbcTemplate.queryForObject(COUNT_ALL_SQL, Long.class);
        return count != null ? count : 0;
    }

    // ─────────────────── Private Helpers ───────────────────

    private void countOnCommit(PlatformTransition transition) {
        String target = transition.getToPlatform().wireName();
        String trigger = transition.getTrigger().wireName();
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            meterRegistry.counter("routing.transitions.committed", "target", target, "trigger", trigger)
                    .increment();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                meterRegistry.counter("routing.transitions.committed", "target", target, "trigger", trigger)
                        .increment();
            }
        });
    }

    private PlatformTransition mapRow(ResultSet rs) throws SQLException {
        String transitionId = rs.getString("transition_id");
        Timestamp dispatchedAt = rs.getTimestamp("dispatched_at");
        String level = rs.getString("engagement_level");
        try {
            List<CommandRow> commandRows = objectMapper.readValue(rs.getString("commands"),
                    new TypeReference<List<CommandRow>>() {
                    });
            List<RoutingCommand> commands = new ArrayList<>();
            for (CommandRow row : commandRows) {
                commands.add(row.toDomain(transitionId, rs.getString("lead_id")));
            }
            return new PlatformTransition(
                    transitionId,
                    rs.getString("lead_id"),
                    Platform.fromWireName(rs.getString("from_platform")),
                    Platform.fromWireName(rs.getString("to_platform")),
                    TransitionTrigger.fromWireName(rs.getString("transition_trigger")),
                    rs.getString("trigger_event_type"),
                    parseMap(rs.getString("trigger_payload")),
                    rs.getDouble("score"),
                    level != null ? EngagementLevel.fromWireName(level) : null,
                    parseMap(rs.getString("routing_decision")),
                    rs.getString("idempotency_key"),
                    rs.getBoolean("manual_override"),
                    commands,
                    rs.getTimestamp("created_at").toInstant(),
                    dispatchedAt != null ? dispatchedAt.toInstant() : null);
        } catch (JsonProcessingException e) {
            log.error("action=transition_deserialize_error transitionId={} error={}", transitionId, e.getMessage());
            throw new IllegalStateException("Failed to deserialize platform transition: " + transitionId, e);
        }
    }

    private Map<String, Object> parseMap(String json) throws JsonProcessingException {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
        });
    }

    // ─────────────────── Inner DTO ───────────────────

    /**
     * Serialization DTO for one entry of the {@code commands} JSONB array.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CommandRow {

        @JsonProperty("command_id")
        public String commandId;
        @JsonProperty("type")
        public String type;
        @JsonProperty("email")
        public String email;
        @JsonProperty("from_platform")
        public String fromPlatform;
        @JsonProperty("to_platform")
        public String toPlatform;
        @JsonProperty("issued_at")
        public String issuedAt;

        public CommandRow() {
        } // Jackson

        public static CommandRow fromDomain(RoutingCommand command) {
            CommandRow row = new CommandRow();
            row.commandId = command.getCommandId();
            row.type = command.getType().name();
            row.email = command.getEmail();
            row.fromPlatform = command.getFromPlatform() != null ? command.getFromPlatform().wireName() : null;
            row.toPlatform = command.getToPlatform() != null ? command.getToPlatform().wireName() : null;
            row.issuedAt = command.getIssuedAt() != null ? command.getIssuedAt().toString() : null;
            return row;
        }

        public RoutingCommand toDomain(String transitionId, String leadId) {
            return new RoutingCommand(commandId, transitionId, CommandType.valueOf(type), leadId, email,
                    fromPlatform != null ? Platform.fromWireName(fromPlatform) : null,
                    toPlatform != null ? Platform.fromWireName(toPlatform) : null,
                    issuedAt != null ? Instant.parse(issuedAt) : null);
        }
    }
}
