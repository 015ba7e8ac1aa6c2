package com.outbound.routing.domain.valueobject;

/**
 * Summary of one reconciliation sweep run.
 *
 * @param scanned     leads examined
 * @param transitions transitions committed by the sweep
 * @param completed   false if the sweep was cancelled before reaching the end
 * @param lastLeadId  last lead processed (resume cursor)
 */
public record SweepReport(long scanned, long transitions, boolean completed, String lastLeadId) {
}
