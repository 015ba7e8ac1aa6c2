package com.outbound.routing.application.port.out;

import java.util.Optional;

/**
 * Secondary (outbound) port: resume cursor of the reconciliation sweep.
 */
public interface SweepCheckpointStore {

    Optional<String> loadCursor();

    void saveCursor(String lastLeadId);

    void clear();
}
