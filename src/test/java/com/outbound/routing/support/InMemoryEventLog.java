package com.outbound.routing.support;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import com.outbound.routing.application.port.out.EventLog;
import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.valueobject.EventTypeCount;

public class InMemoryEventLog implements EventLog {

    private final JournalingTransactionRunner tx;
    private final List<EngagementEvent> events = new ArrayList<>();
    private final Set<String> dedupKeys = new HashSet<>();
    private long nextSequence = 1;

    public InMemoryEventLog(JournalingTransactionRunner tx) {
        this.tx = tx;
    }

    public synchronized List<EngagementEvent> all() {
        return List.copyOf(events);
    }

    @Override
    public synchronized boolean append(EngagementEvent event) {
        if (!dedupKeys.add(event.getDedupKey())) {
            return false;
        }
        EngagementEvent stored = event.withSequence(nextSequence++);
        events.add(stored);
        tx.onRollback(() -> {
            synchronized (this) {
                events.remove(stored);
                dedupKeys.remove(event.getDedupKey());
            }
        });
        return true;
    }

    @Override
    public synchronized List<EngagementEvent> findRecentByLeadId(String leadId, int limit) {
        return events.stream()
                .filter(e -> leadId.equals(e.getLeadId()))
                .sorted(Comparator.comparing(EngagementEvent::getSequence).reversed())
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<EngagementEvent> findAllByLeadId(String leadId) {
        return events.stream()
                .filter(e -> leadId.equals(e.getLeadId()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<EventTypeCount> countByEventType() {
        Map<String, Long> counts = events.stream()
                .collect(Collectors.groupingBy(e -> e.getEventType().wireName(), Collectors.counting()));
        return counts.entrySet().stream()
                .map(entry -> new EventTypeCount(entry.getKey(), entry.getValue()))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized long countAll() {
        return events.size();
    }
}
