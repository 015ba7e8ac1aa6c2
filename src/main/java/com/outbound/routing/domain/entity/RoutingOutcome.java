package com.outbound.routing.domain.entity;

/**
 * Result of the full ingest pipeline for one event: apply, score, decide, execute.
 *
 * @param apply     signal store outcome
 * @param decision  decision proposed for the new snapshot, null if none
 * @param execution executor outcome, null if no decision was made
 */
public record RoutingOutcome(ApplyResult apply, TransitionDecision decision, ExecutionResult execution) {

    public static RoutingOutcome noTransition(ApplyResult apply) {
        return new RoutingOutcome(apply, null, null);
    }

    /**
     * @return aggregate after the pipeline, reflecting a committed transition if any
     */
    public EngagementSignal snapshot() {
        if (execution != null && execution.isCommitted()) {
            return execution.snapshot();
        }
        return apply.snapshot();
    }

    public boolean transitioned() {
        return execution != null && execution.isCommitted();
    }
}
