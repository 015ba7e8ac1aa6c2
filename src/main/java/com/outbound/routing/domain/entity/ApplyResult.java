package com.outbound.routing.domain.entity;

/**
 * Outcome of applying one event to its lead's aggregate.
 *
 * @param snapshot aggregate after the apply (unchanged when {@code applied} is false)
 * @param applied  false if the dedup key had already been recorded
 * @param event    the event bound to its resolved lead
 */
public record ApplyResult(EngagementSignal snapshot, boolean applied, EngagementEvent event) {

    public static ApplyResult applied(EngagementSignal snapshot, EngagementEvent event) {
        return new ApplyResult(snapshot, true, event);
    }

    public static ApplyResult duplicate(EngagementSignal snapshot, EngagementEvent event) {
        return new ApplyResult(snapshot, false, event);
    }
}
