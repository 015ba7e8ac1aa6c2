package com.outbound.routing.support;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import com.outbound.routing.application.port.out.TransitionLog;
import com.outbound.routing.domain.entity.PlatformTransition;

public class InMemoryTransitionLog implements TransitionLog {

    private final JournalingTransactionRunner tx;
    private final List<PlatformTransition> transitions = new ArrayList<>();

    public InMemoryTransitionLog(JournalingTransactionRunner tx) {
        this.tx = tx;
    }

    public synchronized List<PlatformTransition> all() {
        return List.copyOf(transitions);
    }

    @Override
    public synchronized boolean append(PlatformTransition transition) {
        if (findByIdempotencyKey(transition.getIdempotencyKey()).isPresent()) {
            return false;
        }
        transitions.add(transition);
        tx.onRollback(() -> {
            synchronized (this) {
                transitions.remove(transition);
            }
        });
        return true;
    }

    @Override
    public synchronized Optional<PlatformTransition> findByIdempotencyKey(String idempotencyKey) {
        return transitions.stream()
                .filter(t -> t.getIdempotencyKey().equals(idempotencyKey))
                .findFirst();
    }

    @Override
    public synchronized List<PlatformTransition> findByLeadId(String leadId) {
        return transitions.stream()
                .filter(t -> t.getLeadId().equals(leadId))
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<PlatformTransition> findUndispatched(Instant createdBefore, int limit) {
        return transitions.stream()
                .filter(t -> !t.isDispatched() && t.getCreatedAt().isBefore(createdBefore))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized void markDispatched(String transitionId, Instant dispatchedAt) {
        for (int i = 0; i < transitions.size(); i++) {
            PlatformTransition t = transitions.get(i);
            if (t.getTransitionId().equals(transitionId) && !t.isDispatched()) {
                transitions.set(i, t.markDispatched(dispatchedAt));
            }
        }
    }

    @Override
    public synchronized long countAll() {
        return transitions.size();
    }
}
