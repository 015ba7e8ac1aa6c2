package com.outbound.routing.support;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import com.outbound.routing.application.port.out.IncidentLog;
import com.outbound.routing.domain.entity.Incident;

public class InMemoryIncidentLog implements IncidentLog {

    private final List<Incident> incidents = new ArrayList<>();

    public synchronized List<Incident> all() {
        return List.copyOf(incidents);
    }

    @Override
    public synchronized void record(Incident incident) {
        incidents.add(incident);
    }

    @Override
    public synchronized List<Incident> findRecent(int limit) {
        return incidents.stream()
                .sorted(Comparator.comparing(Incident::getOccurredAt).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }
}
