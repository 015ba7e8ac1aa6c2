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
import com.outbound.routing.application.port.out.IncidentLog;
import com.outbound.routing.domain.entity.Incident;

/**
 * PostgreSQL implementation of the IncidentLog outbound port.
 */
@Component
public class PostgresIncidentLog implements IncidentLog {

    private static final Logger log = LoggerFactory.getLogger(PostgresIncidentLog.class);

    private static final String INSERT_SQL = "INSERT INTO routing_incidents "
            + "(incident_id, kind, lead_id, reason, detail, occurred_at) "
            + "VALUES (?, ?, ?, ?, ?::jsonb, ?) "
            + "ON CONFLICT (incident_id) DO NOTHING";

    private static final String SELECT_RECENT_SQL = "SELECT incident_id, kind, lead_id, reason, detail, occurred_at "
            + "FROM routing_incidents ORDER BY occurred_at DESC LIMIT ?";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public PostgresIncidentLog(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void record(Incident incident) {
        try {
            jdbcTemplate.update(INSERT_SQL,
                    incident.getIncidentId(),
                    incident.getKind().name(),
                    incident.getLeadId(),
                    incident.getReason(),
                    objectMapper.writeValueAsString(incident.getDetail()),
                    Timestamp.from(incident.getOccurredAt()));
            log.info("action=incident_recorded kind={} leadId={} reason={}",
                    incident.getKind(), incident.getLeadId(), incident.getReason());
        } catch (JsonProcessingException e) {
            log.error("action=incident_serialize_error incidentId={} error={}",
                    incident.getIncidentId(), e.getMessage());
            throw new IllegalStateException("Failed to serialize incident detail", e);
        }
    }

    @Override
    public List<Incident> findRecent(int limit) {
        return jdbcTemplate.query(SELECT_RECENT_SQL, (rs, rowNum) -> mapRow(rs), limit);
    }

    private Incident mapRow(ResultSet rs) throws SQLException {
        return new Incident(
                rs.getString("incident_id"),
                Incident.Kind.valueOf(rs.getString("kind")),
                rs.getString("lead_id"),
                rs.getString("reason"),
                parseDetail(rs.getString("detail")),
                rs.getTimestamp("occurred_at").toInstant());
    }

    private Map<String, Object> parseDetail(String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            log.warn("action=incident_detail_parse_error error={}", e.getMessage());
            return Collections.emptyMap();
        }
    }
}
