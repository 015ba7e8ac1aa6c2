package com.outbound.routing.adapters.in.rest;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.outbound.routing.application.port.in.QueryRoutingUseCase;
import com.outbound.routing.application.port.in.ReconcileRoutingUseCase;
import com.outbound.routing.bootstrap.config.RoutingProperties;
import com.outbound.routing.domain.valueobject.PlatformLevelCount;

@RestController
@RequestMapping("/dashboard")
public class DashboardController {

    private static final Logger log = LoggerFactory.getLogger(DashboardController.class);

    private final QueryRoutingUseCase queryRoutingUseCase;
    private final ReconcileRoutingUseCase reconcileRoutingUseCase;
    private final int defaultLimit;
    private final int maxLimit;

    public DashboardController(QueryRoutingUseCase queryRoutingUseCase,
            ReconcileRoutingUseCase reconcileRoutingUseCase,
            RoutingProperties routingProperties) {
        this.queryRoutingUseCase = queryRoutingUseCase;
        this.reconcileRoutingUseCase = reconcileRoutingUseCase;
        this.defaultLimit = Math.max(1, routingProperties.getDashboard().getDefaultLimit());
        this.maxLimit = Math.max(this.defaultLimit, routingProperties.getDashboard().getMaxLimit());
    }

    @GetMapping("/stats")
    public ResponseEntity<Map<String, Object>> getStats(
            @RequestParam(name = "recentLimit", required = false) Integer recentLimit) {
        try {
            int effectiveLimit = normalizeLimit(recentLimit);

            List<Map<String, Object>> eventDistribution = queryRoutingUseCase.eventTypeDistribution().stream()
                    .map(row -> {
                        Map<String, Object> item = new HashMap<>();
                        item.put("eventType", row.eventType());
                        item.put("count", row.count());
                        return item;
                    })
                    .collect(Collectors.toList());

            List<Map<String, Object>> incidents = queryRoutingUseCase.recentIncidents(effectiveLimit).stream()
                    .map(LeadViews::incident)
                    .collect(Collectors.toList());

            Map<String, Object> stats = new LinkedHashMap<>();
            stats.put("totalLeads", queryRoutingUseCase.totalLeads());
            stats.put("totalEvents", queryRoutingUseCase.totalEvents());
            stats.put("totalTransitions", queryRoutingUseCase.totalTransitions());
            stats.put("platformLevels", platformLevels(queryRoutingUseCase.platformLevelCounts()));
            stats.put("eventTypeDistribution", eventDistribution);
            stats.put("recentIncidents", incidents);
            stats.put("recentLimit", effectiveLimit);

            return ResponseEntity.ok(stats);

        } catch (Exception e) {
            log.error("action=dashboard_stats_error error={}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(
                    Map.of("error", "Unable to load dashboard stats"));
        }
    }

    /**
     * Leads whose current snapshot would move if evaluated now.
     */
    @GetMapping("/eligible")
    public ResponseEntity<Map<String, Object>> getEligible(
            @RequestParam(name = "limit", required = false) Integer limit) {
        int effectiveLimit = normalizeLimit(limit);
        List<Map<String, Object>> leads = queryRoutingUseCase.eligibleForTransition(effectiveLimit).stream()
                .map(LeadViews::eligible)
                .collect(Collectors.toList());

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("limit", effectiveLimit);
        body.put("leads", leads);
        return ResponseEntity.ok(body);
    }

    @PostMapping("/reconciliation/cancel")
    public ResponseEntity<Map<String, Object>> cancelReconciliation() {
        reconcileRoutingUseCase.cancel();
        log.info("action=reconciliation_cancel_requested");
        return ResponseEntity.accepted().body(Map.of("status", "cancel_requested"));
    }

    private static List<Map<String, Object>> platformLevels(List<PlatformLevelCount> counts) {
        return counts.stream()
                .map(row -> {
                    Map<String, Object> item = new LinkedHashMap<>();
                    item.put("platform", row.platform().wireName());
                    item.put("level", row.level().wireName());
                    item.put("count", row.count());
                    item.put("averageScore", row.averageScore());
                    return item;
                })
                .collect(Collectors.toList());
    }

    private int normalizeLimit(Integer limit) {
        int candidate = limit != null ? limit : defaultLimit;
        return Math.min(Math.max(candidate, 1), maxLimit);
    }
}
