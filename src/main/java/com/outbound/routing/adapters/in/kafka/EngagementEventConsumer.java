package com.outbound.routing.adapters.in.kafka;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outbound.routing.application.port.in.ProcessEventUseCase;
import com.outbound.routing.application.port.out.IncidentLog;
import com.outbound.routing.application.service.EventValidator;
import com.outbound.routing.bootstrap.config.RoutingProperties;
import com.outbound.routing.domain.entity.Incident;
import com.outbound.routing.domain.entity.RawEngagementEvent;
import com.outbound.routing.domain.entity.RoutingOutcome;
import com.outbound.routing.domain.exception.ConflictRetryExhaustedException;
import com.outbound.routing.domain.exception.InvalidEventException;
import com.outbound.routing.domain.exception.StoreUnavailableException;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Kafka inbound adapter: consumes normalized engagement events from the
 * platform adapters' topic.
 * <p>
 * Layered error handling:
 * <ol>
 * <li><b>Parse Error:</b> incident + DLQ + skip</li>
 * <li><b>Invalid Event:</b> DLQ + skip (incident recorded here when rejected
 * while parsing, by the pipeline otherwise)</li>
 * <li><b>Transient Store / Conflict Error:</b> throw → Kafka redelivers</li>
 * <li><b>Store Rejected Event:</b> incident + DLQ + skip (retrying never helps)</li>
 * <li><b>Unknown Error:</b> DLQ + skip</li>
 * </ol>
 * </p>
 */
@Component
public class EngagementEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(EngagementEventConsumer.class);

    private final ProcessEventUseCase processEventUseCase;
    private final IncidentLog incidentLog;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;
    private final String dlqTopic;

    public EngagementEventConsumer(ProcessEventUseCase processEventUseCase,
            IncidentLog incidentLog,
            KafkaTemplate<String, String> kafkaTemplate,
            ObjectMapper objectMapper,
            MeterRegistry meterRegistry,
            RoutingProperties routingProperties) {
        this.processEventUseCase = processEventUseCase;
        this.incidentLog = incidentLog;
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
        this.dlqTopic = routingProperties.getKafka().getTopics().getDlq();
    }

    /**
     * Main listener. Manual acknowledgment: the offset is committed only after
     * the event is durably applied or deliberately dead-lettered.
     */
    @KafkaListener(topics = "${routing.kafka.topics.engagement-events:engagement-events}", groupId = "lead-routing-engine", containerFactory = "kafkaListenerContainerFactory")
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        String key = record.key();
        boolean parsed = false;

        try {
            MDC.put("kafkaTopic", record.topic());
            MDC.put("kafkaPartition", String.valueOf(record.partition()));
            MDC.put("kafkaOffset", String.valueOf(record.offset()));

            log.info("action=event_received key={} partition={} offset={}",
                    key, record.partition(), record.offset());

            // Step 1: Parse
            RawEngagementEvent raw = parseEvent(record.value());
            parsed = true;
            if (raw.leadId() != null) {
                MDC.put("leadId", raw.leadId());
            }
            if (raw.eventType() != null) {
                MDC.put("eventType", raw.eventType());
            }

            // Step 2: Validate, apply, route
            RoutingOutcome outcome = processEventUseCase.process(raw);
            MDC.put("leadId", outcome.snapshot().getLeadId());
            MDC.put("dedupKey", outcome.apply().event().getDedupKey());
            countOutcome(outcome.apply().applied() ? "applied" : "duplicate");

            // Step 3: Acknowledge once durable
            ack.acknowledge();
            log.info("action=event_acknowledged leadId={} applied={} transitioned={}",
                    outcome.snapshot().getLeadId(), outcome.apply().applied(), outcome.transitioned());

        } catch (JsonProcessingException e) {
            log.error("action=parse_error key={} error={}", key, e.getMessage());
            countOutcome("invalid");
            recordIncident(record, "PARSE_ERROR", e);
            sendToDlq(record, "PARSE_ERROR", e);
            ack.acknowledge();

        } catch (InvalidEventException e) {
            log.error("action=invalid_event key={} field={} error={}", key, e.getField(), e.getMessage());
            countOutcome("invalid");
            if (!parsed) {
                recordIncident(record, "INVALID_EVENT", e);
            }
            sendToDlq(record, "INVALID_EVENT", e);
            ack.acknowledge();

        } catch (StoreUnavailableException | ConflictRetryExhaustedException | TransientDataAccessException
                | DataAccessResourceFailureException | RecoverableDataAccessException e) {
            // Not acknowledged: Kafka redelivers after the container's back-off
            log.error("action=transient_error key={} error={}", key, e.getMessage());
            countOutcome("retry");
            throw e;

        } catch (NonTransientDataAccessException e) {
            // The store refused the event itself, redelivery would fail the same way
            log.error("action=store_rejected_event key={} error={}", key, e.getMessage());
            countOutcome("invalid");
            recordIncident(record, "STORE_REJECTED", e);
            sendToDlq(record, "STORE_REJECTED", e);
            ack.acknowledge();

        } catch (Exception e) {
            log.error("action=unknown_error key={} error={}", key, e.getMessage(), e);
            sendToDlq(record, "UNKNOWN_ERROR", e);
            ack.acknowledge();

        } finally {
            MDC.clear();
        }
    }

    // ─────────────────── Private Helpers ───────────────────

    private RawEngagementEvent parseEvent(String json) throws JsonProcessingException {
        EventDto dto = objectMapper.readValue(json, EventDto.class);
        return dto.toRaw();
    }

    private void recordIncident(ConsumerRecord<String, String> record, String errorType, Exception error) {
        String key = record.key();
        String leadId = key != null && key.length() <= EventValidator.MAX_LEAD_ID_LENGTH ? key : null;
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("error_type", errorType);
        if (error instanceof InvalidEventException) {
            detail.put("field", ((InvalidEventException) error).getField());
        }
        detail.put("topic", record.topic());
        detail.put("partition", record.partition());
        detail.put("offset", record.offset());
        try {
            incidentLog.record(Incident.rejectedEvent(leadId, error.getMessage(), detail, Instant.now()));
        } catch (Exception recordError) {
            log.error("action=incident_record_failed key={} error={}", key, recordError.getMessage());
        }
    }

    private void countOutcome(String status) {
        meterRegistry.counter("routing.ingestion.outcome", "status", status, "channel", "kafka").increment();
    }

    /**
     * Sends a failed record to the dead letter topic with error context.
     */
    private void sendToDlq(ConsumerRecord<String, String> record, String errorType, Exception error) {
        try {
            DlqMessage dlqMessage = new DlqMessage(
                    record.topic(),
                    record.partition(),
                    record.offset(),
                    record.key(),
                    record.value(),
                    errorType,
                    error.getMessage(),
                    getStackTrace(error),
                    Instant.now().toString());

            kafkaTemplate.send(dlqTopic, record.key(), objectMapper.writeValueAsString(dlqMessage));
            log.warn("action=sent_to_dlq errorType={} key={} originalTopic={}",
                    errorType, record.key(), record.topic());
        } catch (Exception dlqError) {
            log.error("action=dlq_send_failed key={} error={}", record.key(), dlqError.getMessage());
        }
    }

    private String getStackTrace(Exception e) {
        StringBuilder sb = new StringBuilder();
        for (StackTraceElement element : e.getStackTrace()) {
            sb.append(element.toString()).append("\n");
            if (sb.length() > 500)
                break;
        }
        return sb.toString();
    }

    // ─────────────────── Inner DTO Classes ───────────────────

    /**
     * Wire form of a normalized engagement event.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class EventDto {

        @JsonProperty("lead_id")
        private String leadId;

        @JsonProperty("email")
        private String email;

        @JsonProperty("event_type")
        private String eventType;

        @JsonProperty("source")
        private String source;

        @JsonProperty("external_id")
        @JsonAlias("event_id")
        private String externalId;

        @JsonProperty("payload")
        private Map<String, Object> payload;

        @JsonProperty("occurred_at")
        @JsonAlias("created_at")
        private String occurredAt;

        public RawEngagementEvent toRaw() {
            return new RawEngagementEvent(leadId, email, eventType, source, externalId, payload,
                    parseInstant(occurredAt));
        }

        private static Instant parseInstant(String value) {
            if (value == null || value.isBlank()) {
                return null;
            }
            try {
                return Instant.parse(value);
            } catch (DateTimeParseException e) {
                throw new InvalidEventException("occurred_at", "occurred_at is not an ISO-8601 instant: " + value);
            }
        }

        // Getters/Setters for Jackson
        public String getLeadId() {
            return leadId;
        }

        public void setLeadId(String leadId) {
            this.leadId = leadId;
        }

        public String getEmail() {
            return email;
        }

        public void setEmail(String email) {
            this.email = email;
        }

        public String getEventType() {
            return eventType;
        }

        public void setEventType(String eventType) {
            this.eventType = eventType;
        }

        public String getSource() {
            return source;
        }

        public void setSource(String source) {
            this.source = source;
        }

        public String getExternalId() {
            return externalId;
        }

        public void setExternalId(String externalId) {
            this.externalId = externalId;
        }

        public Map<String, Object> getPayload() {
            return payload;
        }

        public void setPayload(Map<String, Object> payload) {
            this.payload = payload;
        }

        public String getOccurredAt() {
            return occurredAt;
        }

        public void setOccurredAt(String occurredAt) {
            this.occurredAt = occurredAt;
        }
    }

    /**
     * DLQ message envelope with error context.
     */
    public record DlqMessage(
            String originalTopic,
            int originalPartition,
            long originalOffset,
            String originalKey,
            String originalValue,
            String errorType,
            String errorMessage,
            String stackTrace,
            String timestamp) {
    }
}
