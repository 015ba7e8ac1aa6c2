package com.outbound.routing.application.port.out;

import java.util.List;

import com.outbound.routing.domain.entity.Incident;

/**
 * Secondary (outbound) port: rejected events and illegal-transition alarms.
 */
public interface IncidentLog {

    void record(Incident incident);

    List<Incident> findRecent(int limit);
}
