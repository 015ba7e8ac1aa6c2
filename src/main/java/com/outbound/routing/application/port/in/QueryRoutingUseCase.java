package com.outbound.routing.application.port.in;

import java.util.List;
import java.util.Optional;

import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.entity.EngagementSignal;
import com.outbound.routing.domain.entity.Incident;
import com.outbound.routing.domain.entity.PlatformTransition;
import com.outbound.routing.domain.valueobject.EligibleLead;
import com.outbound.routing.domain.valueobject.EventTypeCount;
import com.outbound.routing.domain.valueobject.PlatformLevelCount;
import com.outbound.routing.domain.valueobject.ReplayReport;

/**
 * Primary (inbound) port: read side for operators and the approval layer.
 */
public interface QueryRoutingUseCase {

    Optional<EngagementSignal> snapshot(String leadId);

    List<EngagementEvent> recentEvents(String leadId, int limit);

    List<PlatformTransition> transitions(String leadId);

    /**
     * Leads whose current snapshot qualifies for a transition, evaluated now.
     */
    List<EligibleLead> eligibleForTransition(int limit);

    List<PlatformLevelCount> platformLevelCounts();

    List<EventTypeCount> eventTypeDistribution();

    List<Incident> recentIncidents(int limit);

    /**
     * Re-folds the lead's event log and compares the result with the stored aggregate.
     */
    Optional<ReplayReport> replay(String leadId);

    long totalLeads();

    long totalEvents();

    long totalTransitions();
}
