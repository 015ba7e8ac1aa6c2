package com.outbound.routing.domain.entity;

/**
 * Outcome of executing a transition decision.
 *
 * @param status             what happened
 * @param transition         committed (or previously committed) transition, null otherwise
 * @param snapshot           aggregate after the commit, null unless committed
 * @param commandsDispatched true if every command reached the publisher after commit
 * @param detail             human-readable reason for non-committed outcomes
 */
public record ExecutionResult(Status status, PlatformTransition transition, EngagementSignal snapshot,
        boolean commandsDispatched, String detail) {

    public enum Status {
        COMMITTED,
        /** Lead already sits on the target platform */
        ALREADY_AT_TARGET,
        /** Same idempotency key already committed */
        DUPLICATE,
        /** Lead moved since the decision was taken */
        SUPERSEDED,
        /** Illegal move, alarm raised */
        REJECTED
    }

    public static ExecutionResult committed(PlatformTransition transition, EngagementSignal snapshot) {
        return new ExecutionResult(Status.COMMITTED, transition, snapshot, false, null);
    }

    public static ExecutionResult skipped(Status status, PlatformTransition existing, String detail) {
        return new ExecutionResult(status, existing, null, false, detail);
    }

    public ExecutionResult withCommandsDispatched(boolean dispatched) {
        return new ExecutionResult(status, transition, snapshot, dispatched, detail);
    }

    public boolean isCommitted() {
        return status == Status.COMMITTED;
    }
}
