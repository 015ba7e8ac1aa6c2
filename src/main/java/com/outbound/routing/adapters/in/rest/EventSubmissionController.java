package com.outbound.routing.adapters.in.rest;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.outbound.routing.adapters.in.kafka.EngagementEventConsumer.EventDto;
import com.outbound.routing.application.port.out.IncidentLog;
import com.outbound.routing.application.service.EventValidator;
import com.outbound.routing.application.service.IngestionGateway;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.entity.Incident;
import com.outbound.routing.domain.entity.PlatformTransition;
import com.outbound.routing.domain.entity.RawEngagementEvent;
import com.outbound.routing.domain.entity.RoutingOutcome;
import com.outbound.routing.domain.exception.IngestionRejectedException;
import com.outbound.routing.domain.exception.InvalidEventException;

import io.micrometer.core.instrument.MeterRegistry;

/**
 * Synchronous submission endpoint for platform webhook adapters.
 * <p>
 * Answers only after the event is durably applied. A full ingestion queue
 * surfaces as 503 so the sender retries with the same external id. Events
 * rejected here, before the pipeline sees them, or refused by the store are
 * recorded as incidents.
 * </p>
 */
@RestController
@RequestMapping("/api/events")
public class EventSubmissionController {

    private static final Logger log = LoggerFactory.getLogger(EventSubmissionController.class);

    private final IngestionGateway ingestionGateway;
    private final IncidentLog incidentLog;
    private final MeterRegistry meterRegistry;

    public EventSubmissionController(IngestionGateway ingestionGateway, IncidentLog incidentLog,
            MeterRegistry meterRegistry) {
        this.ingestionGateway = ingestionGateway;
        this.incidentLog = incidentLog;
        this.meterRegistry = meterRegistry;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> submit(@RequestBody EventDto request) {
        RawEngagementEvent raw;
        try {
            raw = request.toRaw();
        } catch (InvalidEventException e) {
            countOutcome("invalid");
            recordIncident(request, e.getField(), e);
            throw e;
        }

        RoutingOutcome outcome;
        try {
            outcome = ingestionGateway.submit(raw);
        } catch (InvalidEventException e) {
            countOutcome("invalid");
            throw e;
        } catch (IngestionRejectedException e) {
            countOutcome("rejected");
            throw e;
        } catch (NonTransientDataAccessException e) {
            if (!(e instanceof DataAccessResourceFailureException)) {
                countOutcome("invalid");
                recordIncident(request, null, e);
            }
            throw e;
        }
        countOutcome(outcome.apply().applied() ? "applied" : "duplicate");

        EngagementSignal snapshot = outcome.snapshot();
        log.info("action=event_submitted leadId={} applied={} transitioned={}",
                snapshot.getLeadId(), outcome.apply().applied(), outcome.transitioned());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("leadId", snapshot.getLeadId());
        body.put("applied", outcome.apply().applied());
        body.put("engagementScore", snapshot.getEngagementScore());
        body.put("engagementLevel", snapshot.getEngagementLevel().wireName());
        body.put("currentPlatform", snapshot.getCurrentPlatform().wireName());
        body.put("version", snapshot.getVersion());
        if (outcome.execution() != null) {
            body.put("decision", outcome.execution().status().name());
        }
        if (outcome.transitioned()) {
            PlatformTransition transition = outcome.execution().transition();
            Map<String, Object> moved = new LinkedHashMap<>();
            moved.put("transitionId", transition.getTransitionId());
            moved.put("from", transition.getFromPlatform().wireName());
            moved.put("to", transition.getToPlatform().wireName());
            moved.put("trigger", transition.getTrigger().wireName());
            moved.put("commandsDispatched", outcome.execution().commandsDispatched());
            body.put("transition", moved);
        }
        return ResponseEntity.ok(body);
    }

    private void recordIncident(EventDto request, String field, Exception error) {
        String leadId = request.getLeadId();
        if (leadId != null && leadId.length() > EventValidator.MAX_LEAD_ID_LENGTH) {
            leadId = null;
        }
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("field", field);
        detail.put("event_type", request.getEventType());
        detail.put("source", request.getSource());
        detail.put("channel", "rest");
        try {
            incidentLog.record(Incident.rejectedEvent(leadId, error.getMessage(), detail, Instant.now()));
        } catch (Exception recordError) {
            log.error("action=incident_record_failed leadId={} error={}", leadId, recordError.getMessage());
        }
    }

    private void countOutcome(String status) {
        meterRegistry.counter("routing.ingestion.outcome", "status", status, "channel", "rest").increment();
    }
}
