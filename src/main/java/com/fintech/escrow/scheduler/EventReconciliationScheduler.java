package com.fintech.escrow.scheduler;

import com.fintech.escrow.dto.ReconciliationResult;
import com.fintech.escrow.exception.ReconciliationInProgressException;
import com.fintech.escrow.service.EventReconciler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduler for the ledger event reconciler.
 * <p>
 * The interval should be tuned to the ledger's block time: running much
 * more often than blocks are produced only re-reads the same head.
 * <p>
 * Default: every 15 seconds
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EventReconciliationScheduler {

    private final EventReconciler eventReconciler;

    @Value("${escrow.reconciler.scheduler.enabled:true}")
    private boolean schedulerEnabled;

    /**
     * Uses fixedDelay so the next run doesn't start until the previous one
     * completes.
     */
    @Scheduled(fixedDelayString = "${escrow.reconciler.scheduler.interval-ms:15000}")
    public void runScheduledReconciliation() {
        if (!schedulerEnabled) {
            log.debug("Reconciler scheduler is disabled, skipping run");
            return;
        }

        try {
            ReconciliationResult result = eventReconciler.reconcile();
            logResult(result);

            if (result.getConsistencyViolations() > 0) {
                log.error("{} escrow(s) placed on consistency hold during this run, manual review required",
                        result.getConsistencyViolations());
            }
        } catch (ReconciliationInProgressException e) {
            log.warn("Reconciliation skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled reconciliation failed with unexpected error", e);
        }
    }

    private void logResult(ReconciliationResult result) {
        if (result.getEventsFetched() == 0) {
            log.debug("No new ledger events up to block {}", result.getEndCursor());
        } else {
            log.info("Reconciled blocks {}-{} in {}ms: {} events, {} transitions, {} errors",
                    result.getStartCursor() + 1,
                    result.getEndCursor(),
                    result.getDurationMs(),
                    result.getEventsFetched(),
                    result.getTransitionsApplied(),
                    result.getErrors());
        }
    }
}
