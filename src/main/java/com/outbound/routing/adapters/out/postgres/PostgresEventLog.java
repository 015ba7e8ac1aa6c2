package com.outbound.routing.adapters.out.postgres;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outbound.routing.application.port.out.EventLog;
import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.valueobject.EventSource;
import com.outbound.routing.domain.valueobject.EventType;
import com.outbound.routing.domain.valueobject.EventTypeCount;

/**
 * PostgreSQL implementation of the EventLog outbound port.
 * <p>
 * Append-only. ON CONFLICT on the dedup key turns redeliveries into no-ops;
 * {@code seq} gives the log order used for replay.
 * </p>
 */
@Component
public class PostgresEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger(PostgresEventLog.class);

    private static final String INSERT_EVENT_SQL = "INSERT INTO engagement_events "
            + "(event_id, lead_id, email, event_type, source, reported_source, dedup_key, payload, occurred_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?::jsonb, ?) "
            + "ON CONFLICT (dedup_key) DO NOTHING";

    private static final String COLUMNS = "seq, event_id, lead_id, email, event_type, source, reported_source, "
            + "dedup_key, payload, occurred_at";

    private static final String SELECT_RECENT_SQL = "SELECT " + COLUMNS
            + " FROM engagement_events WHERE lead_id = ? ORDER BY seq DESC LIMIT ?";

    private static final String SELECT_ALL_SQL = "SELECT " + COLUMNS
            + " FROM engagement_events WHERE lead_id = ? ORDER BY seq";

    private static final String COUNT_ALL_SQL = "SELECT COUNT(*) FROM engagement_events";

    private static final String COUNT_BY_TYPE_SQL = "SELECT event_type, COUNT(*) AS cnt FROM engagement_events "
            + "GROUP BY event_type ORDER BY cnt DESC";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public PostgresEventLog(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public boolean append(EngagementEvent event) {
        try {
            String payloadJson = objectMapper.writeValueAsString(event.getPayload());

            int rows = jdbcTemplate.update(
                    INSERT_EVENT_SQL,
                    event.getEventId(),
                    event.getLeadId(),
                    event.getEmail(),
                    event.getEventType().wireName(),
                    event.getSource().wireName(),
                    event.getReportedSource(),
                    event.getDedupKey(),
                    payloadJson,
                    Timestamp.from(event.getOccurredAt()));

            if (rows > 0) {
                log.debug("action=event_appended eventId={} leadId={} type={}",
                        event.getEventId(), event.getLeadId(), event.getEventType().wireName());
                return true;
            }
            log.debug("action=event_duplicate_skipped dedupKey={}", event.getDedupKey());
            return false;
        } catch (JsonProcessingException e) {
            log.error("action=event_serialize_error eventId={} error={}",
                    event.getEventId(), e.getMessage());
            throw new IllegalStateException("Failed to serialize event payload", e);
        }
    }

    @Override
    public List<EngagementEvent> findRecentByLeadId(String leadId, int limit) {
        return jdbcTemplate.query(SELECT_RECENT_SQL, (rs, rowNum) -> mapRowToEvent(rs), leadId, limit);
    }

    @Override
    public List<EngagementEvent> findAllByLeadId(String leadId) {
        return jdbcTemplate.query(SELECT_ALL_SQL, (rs, rowNum) -> mapRowToEvent(rs), leadId);
    }

    @Override
    public List<EventTypeCount> countByEventType() {
        return jdbcTemplate.query(COUNT_BY_TYPE_SQL,
                (rs, rowNum) -> new EventTypeCount(rs.getString("event_type"), rs.getLong("cnt")));
    }

    @Override
    public long countAll() {
        Long count = jdbcTemplate.queryForObject(COUNT_ALL_SQL, Long.class);
        return count != null ? count : 0;
    }

    // ─────────────────── Private Helpers ───────────────────

    private EngagementEvent mapRowToEvent(ResultSet rs) throws SQLException {
        return new EngagementEvent(
                rs.getString("event_id"),
                rs.getString("lead_id"),
                rs.getString("email"),
                EventType.fromWireName(rs.getString("event_type")),
                EventSource.fromWireName(rs.getString("source")),
                rs.getString("reported_source"),
                rs.getString("dedup_key"),
                parsePayload(rs.getString("payload")),
                rs.getTimestamp("occurred_at").toInstant(),
                rs.getLong("seq"));
    }

    private Map<String, Object> parsePayload(String payloadStr) {
        if (payloadStr == null || payloadStr.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(payloadStr, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            log.warn("action=payload_parse_error error={}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
