package com.outbound.routing.application.service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.logging.Logger;

import com.outbound.routing.application.port.out.TransitionLog;
import com.outbound.routing.domain.entity.PlatformTransition;

/**
 * Redispatches commands of committed transitions that never reached the broker.
 * <p>
 * Only rows older than {@code minAge} are picked up so an in-flight dispatch
 * on the event path is not raced. The publisher's per-command idempotency
 * absorbs the overlap that remains.
 * </p>
 */
public class CommandRelay {

    private static final Logger log = Logger.getLogger(CommandRelay.class.getName());

    private final TransitionLog transitionLog;
    private final TransitionExecutor executor;
    private final Clock clock;
    private final Duration minAge;
    private final int batchSize;

    public CommandRelay(TransitionLog transitionLog, TransitionExecutor executor, Clock clock,
            Duration minAge, int batchSize) {
        if (transitionLog == null)
            throw new IllegalArgumentException("transitionLog cannot be null");
        if (executor == null)
            throw new IllegalArgumentException("executor cannot be null");
        if (clock == null)
            throw new IllegalArgumentException("clock cannot be null");
        if (minAge == null || minAge.isNegative())
            throw new IllegalArgumentException("minAge must be non-negative");
        if (batchSize < 1)
            throw new IllegalArgumentException("batchSize must be positive");

        this.transitionLog = transitionLog;
        this.executor = executor;
        this.clock = clock;
        this.minAge = minAge;
        this.batchSize = batchSize;
    }

    /**
     * @return number of transitions whose commands were delivered in this pass
     */
    public int relayPending() {
        Instant cutoff = clock.instant().minus(minAge);
        List<PlatformTransition> pending = transitionLog.findUndispatched(cutoff, batchSize);
        if (pending.isEmpty()) {
            return 0;
        }

        int delivered = 0;
        for (PlatformTransition transition : pending) {
            if (executor.dispatch(transition)) {
                delivered++;
            }
        }
        log.info(String.format("action=command_relay pending=%d delivered=%d", pending.size(), delivered));
        return delivered;
    }
}
