package com.outbound.routing.adapters.in.rest;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.outbound.routing.application.port.in.OverridePlatformUseCase;
import com.outbound.routing.application.port.in.QueryRoutingUseCase;
import com.outbound.routing.bootstrap.config.RoutingProperties;
import com.outbound.routing.domain.entity.ExecutionResult;
import com.outbound.routing.domain.entity.PlatformTransition;
import com.outbound.routing.domain.exception.LeadNotFoundException;
import com.outbound.routing.domain.valueobject.Platform;

/**
 * Per-lead read API and the operator override endpoint.
 */
@RestController
@RequestMapping("/api/leads")
public class LeadController {

    private static final Logger log = LoggerFactory.getLogger(LeadController.class);

    private final QueryRoutingUseCase queryRoutingUseCase;
    private final OverridePlatformUseCase overridePlatformUseCase;
    private final int defaultLimit;
    private final int maxLimit;

    public LeadController(QueryRoutingUseCase queryRoutingUseCase,
            OverridePlatformUseCase overridePlatformUseCase,
            RoutingProperties routingProperties) {
        this.queryRoutingUseCase = queryRoutingUseCase;
        this.overridePlatformUseCase = overridePlatformUseCase;
        this.defaultLimit = Math.max(1, routingProperties.getDashboard().getDefaultLimit());
        this.maxLimit = Math.max(this.defaultLimit, routingProperties.getDashboard().getMaxLimit());
    }

    @GetMapping("/{leadId}")
    public ResponseEntity<Map<String, Object>> getSnapshot(@PathVariable String leadId) {
        return queryRoutingUseCase.snapshot(leadId)
                .map(snapshot -> ResponseEntity.ok(LeadViews.snapshot(snapshot)))
                .orElseThrow(() -> new LeadNotFoundException(leadId));
    }

    @GetMapping("/{leadId}/events")
    public ResponseEntity<Map<String, Object>> getEvents(@PathVariable String leadId,
            @RequestParam(name = "limit", required = false) Integer limit) {
        int effectiveLimit = normalizeLimit(limit);
        List<Map<String, Object>> events = queryRoutingUseCase.recentEvents(leadId, effectiveLimit).stream()
                .map(LeadViews::event)
                .collect(Collectors.toList());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("leadId", leadId);
        body.put("limit", effectiveLimit);
        body.put("events", events);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{leadId}/transitions")
    public ResponseEntity<Map<String, Object>> getTransitions(@PathVariable String leadId) {
        List<Map<String, Object>> transitions = queryRoutingUseCase.transitions(leadId).stream()
                .map(LeadViews::transition)
                .collect(Collectors.toList());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("leadId", leadId);
        body.put("transitions", transitions);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/{leadId}/replay")
    public ResponseEntity<Map<String, Object>> replay(@PathVariable String leadId) {
        return queryRoutingUseCase.replay(leadId)
                .map(report -> ResponseEntity.ok(LeadViews.replay(report)))
                .orElseThrow(() -> new LeadNotFoundException(leadId));
    }

    /**
     * Operator override. Repeating a request id is a no-op; moves out of the
     * CRM are refused with 409.
     */
    @PostMapping("/{leadId}/platform")
    public ResponseEntity<Map<String, Object>> overridePlatform(@PathVariable String leadId,
            @RequestBody OverrideRequest request) {
        if (request.getTarget() == null) {
            throw new IllegalArgumentException("target is required");
        }
        Platform target = Platform.fromWireName(request.getTarget());
        ExecutionResult result = overridePlatformUseCase.override(leadId, target, request.getOperator(),
                request.getNote(), request.getRequestId());

        log.info("action=override_handled leadId={} target={} status={}",
                leadId, target.wireName(), result.status());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("leadId", leadId);
        body.put("status", result.status().name());
        if (result.detail() != null) {
            body.put("detail", result.detail());
        }
        PlatformTransition transition = result.transition();
        if (transition != null) {
            body.put("transition", LeadViews.transition(transition));
        }
        if (result.isCommitted()) {
            body.put("commandsDispatched", result.commandsDispatched());
        }

        HttpStatus status = result.status() == ExecutionResult.Status.REJECTED ? HttpStatus.CONFLICT : HttpStatus.OK;
        return ResponseEntity.status(status).body(body);
    }

    private int normalizeLimit(Integer limit) {
        int candidate = limit != null ? limit : defaultLimit;
        return Math.min(Math.max(candidate, 1), maxLimit);
    }

    // ─────────────────── Inner DTO ───────────────────

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class OverrideRequest {

        @JsonProperty("target")
        private String target;

        @JsonProperty("operator")
        private String operator;

        @JsonProperty("note")
        private String note;

        @JsonProperty("request_id")
        private String requestId;

        public String getTarget() {
            return target;
        }

        public void setTarget(String target) {
            this.target = target;
        }

        public String getOperator() {
            return operator;
        }

        public void setOperator(String operator) {
            this.operator = operator;
        }

        public String getNote() {
            return note;
        }

        public void setNote(String note) {
            this.note = note;
        }

        public String getRequestId() {
            return requestId;
        }

        public void setRequestId(String requestId) {
            this.requestId = requestId;
        }
    }
}
