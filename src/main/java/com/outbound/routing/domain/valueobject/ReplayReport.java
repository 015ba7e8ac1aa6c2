package com.outbound.routing.domain.valueobject;

/**
 * Result of re-folding a lead's event log and comparing it with the stored aggregate.
 */
public record ReplayReport(String leadId, long eventsReplayed,
        double storedScore, EngagementLevel storedLevel,
        double replayedScore, EngagementLevel replayedLevel,
        boolean countersMatch) {

    public boolean consistent() {
        return countersMatch && Double.compare(storedScore, replayedScore) == 0 && storedLevel == replayedLevel;
    }
}
