package com.outbound.routing.application.port.out;

import java.util.List;

import com.outbound.routing.domain.entity.EngagementEvent;
import com.outbound.routing.domain.valueobject.EventTypeCount;

/**
 * Secondary (outbound) port: append-only engagement event log.
 * <p>
 * Rows are never updated or deleted. The dedup key is unique.
 * </p>
 */
public interface EventLog {

    /**
     * Appends an event unless its dedup key is already recorded.
     *
     * @param event event bound to a lead id
     * @return true if a row was written, false for a duplicate
     */
    boolean append(EngagementEvent event);

    /**
     * @return the lead's events, newest first
     */
    List<EngagementEvent> findRecentByLeadId(String leadId, int limit);

    /**
     * @return the lead's full history in log order, for replay
     */
    List<EngagementEvent> findAllByLeadId(String leadId);

    List<EventTypeCount> countByEventType();

    long countAll();
}
