package com.outbound.routing.adapters.out.kafka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.outbound.routing.bootstrap.config.RoutingProperties;
import com.outbound.routing.domain.entity.RoutingCommand;
import com.outbound.routing.domain.valueobject.CommandType;
import com.outbound.routing.domain.valueobject.Platform;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

class KafkaCommandPublisherTest {

    private static final String TOPIC = "routing-commands";

    private final RoutingCommand command = RoutingCommand.of("t-1", CommandType.ENROLL_IN_CRM, "lead-1",
            "lead-1@example.com", Platform.HYBRID, Platform.CRM, Instant.parse("2026-03-02T12:00:00Z"));
    private final String statusKey = "routing:command:" + command.getCommandId();

    private KafkaTemplate<String, String> kafkaTemplate;
    private ValueOperations<String, String> valueOps;
    private StringRedisTemplate redisTemplate;
    private SimpleMeterRegistry meterRegistry;
    private KafkaCommandPublisher publisher;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = mock(KafkaTemplate.class);
        valueOps = mock(ValueOperations.class);
        redisTemplate = mock(StringRedisTemplate.class);
        when(redisTemplate.opsForValue()).thenReturn(valueOps);
        meterRegistry = new SimpleMeterRegistry();
        publisher = new KafkaCommandPublisher(kafkaTemplate, redisTemplate, new ObjectMapper(),
                new RoutingProperties(), meterRegistry);
    }

    @Test
    void publishesCommandKeyedByLeadAndMarksDone() {
        when(valueOps.setIfAbsent(eq(statusKey), eq("PROCESSING"), anyLong(), eq(TimeUnit.MINUTES)))
                .thenReturn(true);
        when(kafkaTemplate.send(eq(TOPIC), eq("lead-1"), anyString()))
                .thenReturn(CompletableFuture.completedFuture(sendResult()));

        publisher.publish(command);

        ArgumentCaptor<String> body = ArgumentCaptor.forClass(String.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("lead-1"), body.capture());
        assertThat(body.getValue())
                .contains("\"command_type\":\"ENROLL_IN_CRM\"")
                .contains("\"from_platform\":\"hybrid\"")
                .contains("\"to_platform\":\"crm\"");
        verify(valueOps).set(statusKey, "DONE", 24, TimeUnit.HOURS);
        assertThat(outcome("success")).isEqualTo(1.0);
    }

    @Test
    void commandAlreadyDoneIsNotSentAgain() {
        when(valueOps.setIfAbsent(eq(statusKey), eq("PROCESSING"), anyLong(), eq(TimeUnit.MINUTES)))
                .thenReturn(false);
        when(valueOps.get(statusKey)).thenReturn("DONE");

        publisher.publish(command);

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
        assertThat(outcome("duplicate")).isEqualTo(1.0);
    }

    @Test
    void commandInFlightElsewhereFailsForLaterRelay() {
        when(valueOps.setIfAbsent(eq(statusKey), eq("PROCESSING"), anyLong(), eq(TimeUnit.MINUTES)))
                .thenReturn(false);
        when(valueOps.get(statusKey)).thenReturn("PROCESSING");

        assertThatThrownBy(() -> publisher.publish(command)).isInstanceOf(IllegalStateException.class);

        verify(kafkaTemplate, never()).send(anyString(), anyString(), anyString());
    }

    @Test
    void brokerFailureReleasesMarkerAndThrows() {
        when(valueOps.setIfAbsent(eq(statusKey), eq("PROCESSING"), anyLong(), eq(TimeUnit.MINUTES)))
                .thenReturn(true);
        when(kafkaTemplate.send(eq(TOPIC), eq("lead-1"), anyString()))
                .thenReturn(CompletableFuture.failedFuture(new RuntimeException("broker down")));

        assertThatThrownBy(() -> publisher.publish(command))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(command.getCommandId());

        verify(redisTemplate).delete(statusKey);
        verify(valueOps, never()).set(eq(statusKey), eq("DONE"), anyLong(), eq(TimeUnit.HOURS));
        assertThat(outcome("failure")).isEqualTo(1.0);
    }

    private double outcome(String status) {
        return meterRegistry.counter("routing.command.publish.outcome", "status", status).count();
    }

    private static SendResult<String, String> sendResult() {
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 7L, 0, 0L, 0, 0);
        return new SendResult<>(new ProducerRecord<>(TOPIC, "lead-1", "{}"), metadata);
    }
}
