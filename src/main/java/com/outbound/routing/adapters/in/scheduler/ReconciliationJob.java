package com.outbound.routing.adapters.in.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import com.outbound.routing.application.port.in.ReconcileRoutingUseCase;
import com.outbound.routing.domain.valueobject.SweepReport;

/**
 * Periodically re-evaluates every lead so time-based rules (score crossing the
 * high-water mark as signals age, missed events) still fire without new input.
 */
@Component
@ConditionalOnProperty(prefix = "routing.sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ReconciliationJob {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationJob.class);

    private final ReconcileRoutingUseCase reconcileRoutingUseCase;

    public ReconciliationJob(ReconcileRoutingUseCase reconcileRoutingUseCase) {
        this.reconcileRoutingUseCase = reconcileRoutingUseCase;
    }

    @Scheduled(fixedDelayString = "${routing.sweep.fixed-delay-ms:900000}", initialDelayString = "${routing.sweep.fixed-delay-ms:900000}")
    public void run() {
        try {
            SweepReport report = reconcileRoutingUseCase.reconcile();
            log.info("action=reconciliation_job_done scanned={} transitions={} completed={}",
                    report.scanned(), report.transitions(), report.completed());
        } catch (RuntimeException e) {
            // The saved cursor lets the next run resume
            log.error("action=reconciliation_job_failed error={}", e.getMessage(), e);
        }
    }
}
