package com.outbound.routing.adapters.in.kafka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.Map;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.CannotGetJdbcConnectionException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.Acknowledgment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.outbound.routing.application.port.in.ProcessEventUseCase;
import com.outbound.routing.bootstrap.config.RoutingProperties;
import com.outbound.routing.domain.entity.ApplyResult;
import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.entity.Incident;
import com.outbound.routing.domain.entity.RawEngagementEvent;
import com.outbound.routing.domain.entity.RoutingOutcome;
import com.outbound.routing.domain.exception.InvalidEventException;
import com.outbound.routing.domain.exception.StoreUnavailableException;
import com.outbound.routing.domain.valueobject.EventSource;
import com.outbound.routing.domain.valueobject.EventType;
import com.outbound.routing.support.InMemoryIncidentLog;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class EngagementEventConsumerTest {

    private static final Instant OCCURRED_AT = Instant.parse("2026-03-02T11:00:00Z");
    private static final String VALID_JSON = "{\"lead_id\":\"lead-1\",\"email\":\"lead-1@example.com\","
            + "\"event_type\":\"email_opened\",\"source\":\"instantly\",\"event_id\":\"evt-9\","
            + "\"payload\":{\"campaign\":\"q1\"},\"created_at\":\"2026-03-02T11:00:00Z\",\"extra\":1}";

    private ProcessEventUseCase useCase;
    private InMemoryIncidentLog incidents;
    private KafkaTemplate<String, String> kafkaTemplate;
    private Acknowledgment ack;
    private SimpleMeterRegistry meterRegistry;
    private EngagementEventConsumer consumer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        useCase = mock(ProcessEventUseCase.class);
        incidents = new InMemoryIncidentLog();
        kafkaTemplate = mock(KafkaTemplate.class);
        ack = mock(Acknowledgment.class);
        meterRegistry = new SimpleMeterRegistry();
        consumer = new EngagementEventConsumer(useCase, incidents, kafkaTemplate, new ObjectMapper(), meterRegistry,
                new RoutingProperties());
    }

    @Test
    void appliedEventIsAcknowledged() {
        when(useCase.process(any())).thenReturn(outcome(true));

        consumer.consume(record(VALID_JSON), ack);

        ArgumentCaptor<RawEngagementEvent> raw = ArgumentCaptor.forClass(RawEngagementEvent.class);
        verify(useCase).process(raw.capture());
        assertThat(raw.getValue().leadId()).isEqualTo("lead-1");
        assertThat(raw.getValue().externalId()).isEqualTo("evt-9");
        assertThat(raw.getValue().occurredAt()).isEqualTo(OCCURRED_AT);
        assertThat(raw.getValue().payload()).containsEntry("campaign", "q1");
        verify(ack).acknowledge();
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
        assertThat(count("applied")).isEqualTo(1.0);
    }

    @Test
    void duplicateIsAcknowledgedAndCounted() {
        when(useCase.process(any())).thenReturn(outcome(false));

        consumer.consume(record(VALID_JSON), ack);

        verify(ack).acknowledge();
        assertThat(count("duplicate")).isEqualTo(1.0);
    }

    @Test
    void malformedJsonGoesToDlq() {
        consumer.consume(record("{not json"), ack);

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("engagement-events-dlq"), eq("lead-1"), body.capture());
        assertThat(body.getValue()).contains("PARSE_ERROR");
        verify(useCase, never()).process(any());
        verify(ack).acknowledge();

        assertThat(incidents.all()).singleElement().satisfies(incident -> {
            assertThat(incident.getKind()).isEqualTo(Incident.Kind.REJECTED_EVENT);
            assertThat(incident.getLeadId()).isEqualTo("lead-1");
            assertThat(incident.getDetail())
                    .containsEntry("error_type", "PARSE_ERROR")
                    .containsEntry("topic", "engagement-events")
                    .containsEntry("offset", 42L);
        });
    }

    @Test
    void invalidEventGoesToDlq() {
        when(useCase.process(any())).thenThrow(new InvalidEventException("event_type", "unknown event_type"));

        consumer.consume(record(VALID_JSON), ack);

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("engagement-events-dlq"), eq("lead-1"), body.capture());
        assertThat(body.getValue()).contains("INVALID_EVENT").contains("unknown event_type");
        verify(ack).acknowledge();
        assertThat(count("invalid")).isEqualTo(1.0);
        // the pipeline records its own rejections
        assertThat(incidents.all()).isEmpty();
    }

    @Test
    void unparseableTimestampIsInvalid() {
        consumer.consume(record(VALID_JSON.replace("2026-03-02T11:00:00Z", "last tuesday")), ack);

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("engagement-events-dlq"), eq("lead-1"), body.capture());
        assertThat(body.getValue()).contains("INVALID_EVENT");
        verify(useCase, never()).process(any());

        assertThat(incidents.all()).singleElement().satisfies(incident -> {
            assertThat(incident.getLeadId()).isEqualTo("lead-1");
            assertThat(incident.getDetail())
                    .containsEntry("error_type", "INVALID_EVENT")
                    .containsEntry("field", "occurred_at");
        });
    }

    @Test
    void oversizedKeyIsNotUsedAsIncidentLeadId() {
        String key = "k".repeat(300);

        consumer.consume(new ConsumerRecord<>("engagement-events", 0, 7L, key, "{not json"), ack);

        verify(ack).acknowledge();
        assertThat(incidents.all()).singleElement()
                .satisfies(incident -> assertThat(incident.getLeadId()).isNull());
    }

    @Test
    void storeOutageIsRethrownWithoutAck() {
        when(useCase.process(any())).thenThrow(new StoreUnavailableException("Routing store unavailable",
                new RuntimeException("connection refused")));

        assertThatThrownBy(() -> consumer.consume(record(VALID_JSON), ack))
                .isInstanceOf(StoreUnavailableException.class);

        verify(ack, never()).acknowledge();
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
        assertThat(count("retry")).isEqualTo(1.0);
    }

    @Test
    void storeRejectionGoesToDlqInsteadOfBlockingPartition() {
        when(useCase.process(any())).thenThrow(
                new DataIntegrityViolationException("value too long for type character varying(128)"));

        consumer.consume(record(VALID_JSON), ack);

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("engagement-events-dlq"), eq("lead-1"), body.capture());
        assertThat(body.getValue()).contains("STORE_REJECTED");
        verify(ack).acknowledge();
        assertThat(count("invalid")).isEqualTo(1.0);
        assertThat(count("retry")).isZero();
        assertThat(incidents.all()).singleElement().satisfies(incident -> {
            assertThat(incident.getKind()).isEqualTo(Incident.Kind.REJECTED_EVENT);
            assertThat(incident.getDetail()).containsEntry("error_type", "STORE_REJECTED");
        });
    }

    @Test
    void lostDatabaseConnectionIsRethrownWithoutAck() {
        when(useCase.process(any())).thenThrow(
                new CannotGetJdbcConnectionException("Failed to obtain JDBC Connection"));

        assertThatThrownBy(() -> consumer.consume(record(VALID_JSON), ack))
                .isInstanceOf(CannotGetJdbcConnectionException.class);

        verify(ack, never()).acknowledge();
        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
        assertThat(incidents.all()).isEmpty();
    }

    @Test
    void queryTimeoutIsRethrownWithoutAck() {
        when(useCase.process(any())).thenThrow(new QueryTimeoutException("statement timeout"));

        assertThatThrownBy(() -> consumer.consume(record(VALID_JSON), ack))
                .isInstanceOf(QueryTimeoutException.class);

        verify(ack, never()).acknowledge();
        assertThat(count("retry")).isEqualTo(1.0);
    }

    @Test
    void unexpectedFailureGoesToDlq() {
        when(useCase.process(any())).thenThrow(new IllegalStateException("bug"));

        consumer.consume(record(VALID_JSON), ack);

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq("engagement-events-dlq"), eq("lead-1"), body.capture());
        assertThat(body.getValue()).contains("UNKNOWN_ERROR");
        verify(ack).acknowledge();
    }

    private double count(String status) {
        return meterRegistry.counter("routing.ingestion.outcome", "status", status, "channel", "kafka").count();
    }

    private static ConsumerRecord<String, String> record(String value) {
        return new ConsumerRecord<>("engagement-events", 0, 42L, "lead-1", value);
    }

    private static RoutingOutcome outcome(boolean applied) {
        EngagementSignal snapshot = EngagementSignal.initial("lead-1", "lead-1@example.com", OCCURRED_AT);
        EngagementEvent event = new EngagementEvent("e-1", "lead-1", "lead-1@example.com", EventType.EMAIL_OPENED,
                EventSource.OUTREACH_PLATFORM, "instantly", "outreach_platform:evt-9", Map.of(), OCCURRED_AT, 1L);
        ApplyResult apply = applied ? ApplyResult.applied(snapshot, event) : ApplyResult.duplicate(snapshot, event);
        return RoutingOutcome.noTransition(apply);
    }
}
