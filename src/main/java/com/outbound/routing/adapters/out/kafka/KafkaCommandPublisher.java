package com.outbound.routing.adapters.out.kafka;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.outbound.routing.application.port.out.CommandPublisher;
import com.outbound.routing.bootstrap.config.RoutingProperties;
import com.outbound.routing.domain.entity.RoutingCommand;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

/**
 * Publishes routing commands to the platform-integration topic.
 * <p>
 * Records are keyed by lead id so commands for one lead stay ordered. A Redis
 * PROCESSING/DONE marker per command id keeps relayed commands from being
 * published twice.
 * </p>
 */
@Component
public class KafkaCommandPublisher implements CommandPublisher {

    private static final Logger log = LoggerFactory.getLogger(KafkaCommandPublisher.class);

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String commandsTopic;
    private final String idempotencyPrefix;
    private final long idempotencyTtlHours;
    private final long processingTtlMinutes;
    private final long publishAckTimeoutMs;

    private final Counter commandPublishSuccess;
    private final Counter commandPublishFailure;
    private final Counter commandPublishDuplicate;
    private final Timer commandPublishLatency;

    public KafkaCommandPublisher(KafkaTemplate<String, String> kafkaTemplate,
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            RoutingProperties routingProperties,
            MeterRegistry meterRegistry) {
        this.kafkaTemplate = kafkaTemplate;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.commandsTopic = routingProperties.getKafka().getTopics().getRoutingCommands();
        this.idempotencyPrefix = routingProperties.getRedis().getCommandIdempotencyPrefix();
        this.idempotencyTtlHours = routingProperties.getRedis().getIdempotencyTtlHours();
        this.processingTtlMinutes = routingProperties.getRedis().getProcessingTtlMinutes();
        this.publishAckTimeoutMs = routingProperties.getKafka().getPublishAckTimeoutMs();

        this.commandPublishSuccess = meterRegistry.counter("routing.command.publish.outcome", "status", "success");
        this.commandPublishFailure = meterRegistry.counter("routing.command.publish.outcome", "status", "failure");
        this.commandPublishDuplicate = meterRegistry.counter("routing.command.publish.outcome", "status",
                "duplicate");
        this.commandPublishLatency = meterRegistry.timer("routing.command.publish.latency");
    }

    @Override
    public void publish(RoutingCommand command) {
        Timer.Sample sample = Timer.start();
        String commandStatusKey = idempotencyPrefix + command.getCommandId();

        Boolean lockAcquired = redisTemplate.opsForValue()
                .setIfAbsent(commandStatusKey, "PROCESSING", processingTtlMinutes, TimeUnit.MINUTES);

        if (Boolean.FALSE.equals(lockAcquired)) {
            String existingStatus = redisTemplate.opsForValue().get(commandStatusKey);
            if ("DONE".equals(existingStatus)) {
                commandPublishDuplicate.increment();
                log.warn("action=duplicate_command_skipped commandId={} leadId={}",
                        command.getCommandId(), command.getLeadId());
                sample.stop(commandPublishLatency);
                return;
            }
            sample.stop(commandPublishLatency);
            log.warn("action=command_inflight_skipped commandId={} leadId={} status={}",
                    command.getCommandId(), command.getLeadId(), existingStatus);
            throw new IllegalStateException("Command publish already in progress for commandId="
                    + command.getCommandId());
        }

        try {
            String commandJson = serializeCommand(command);
            SendResult<String, String> sendResult = kafkaTemplate
                    .send(commandsTopic, command.getLeadId(), commandJson)
                    .get(publishAckTimeoutMs, TimeUnit.MILLISECONDS);

            log.info("action=command_published commandId={} leadId={} type={} topic={} partition={} offset={}",
                    command.getCommandId(), command.getLeadId(), command.getType(),
                    sendResult.getRecordMetadata().topic(),
                    sendResult.getRecordMetadata().partition(),
                    sendResult.getRecordMetadata().offset());

            redisTemplate.opsForValue().set(commandStatusKey, "DONE", idempotencyTtlHours, TimeUnit.HOURS);
            commandPublishSuccess.increment();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            commandPublishFailure.increment();
            redisTemplate.delete(commandStatusKey);
            throw new IllegalStateException("Interrupted while publishing commandId=" + command.getCommandId(), e);
        } catch (Exception e) {
            commandPublishFailure.increment();
            redisTemplate.delete(commandStatusKey);
            log.error("action=command_publish_failed commandId={} leadId={} error={}",
                    command.getCommandId(), command.getLeadId(), e.getMessage(), e);
            throw new IllegalStateException("Command publish failed for commandId=" + command.getCommandId(), e);
        } finally {
            sample.stop(commandPublishLatency);
        }
    }

    private String serializeCommand(RoutingCommand command) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("command_id", command.getCommandId());
        body.put("transition_id", command.getTransitionId());
        body.put("command_type", command.getType().name());
        body.put("lead_id", command.getLeadId());
        body.put("email", command.getEmail());
        body.put("from_platform", command.getFromPlatform() != null ? command.getFromPlatform().wireName() : null);
        body.put("to_platform", command.getToPlatform() != null ? command.getToPlatform().wireName() : null);
        body.put("issued_at", command.getIssuedAt() != null ? command.getIssuedAt().toString() : null);
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize routing command", e);
        }
    }
}
