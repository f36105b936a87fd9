package com.fintech.escrow.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures the results of an event reconciliation run.
 * Used for reporting, monitoring, and audit trails.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationResult {

    private String connectionName;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    /** Cursor before the run; -1 when nothing was processed yet. */
    private long startCursor;
    private long endCursor;
    private long latestBlock;

    @Builder.Default
    private int batches = 0;

    @Builder.Default
    private int eventsFetched = 0;

    @Builder.Default
    private int transitionsApplied = 0;

    @Builder.Default
    private int noOps = 0;

    @Builder.Default
    private int duplicatesSkipped = 0;

    @Builder.Default
    private int unmatchedEvents = 0;

    @Builder.Default
    private int heldForReview = 0;

    @Builder.Default
    private int conflictsRetried = 0;

    @Builder.Default
    private int consistencyViolations = 0;

    @Builder.Default
    private int errors = 0;

    @Builder.Default
    private List<ReconciliationError> errorDetails = new ArrayList<>();

    /**
     * Individual reconciliation error details.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ReconciliationError {
        private Long fromBlock;
        private Long toBlock;
        private String errorMessage;
        private LocalDateTime occurredAt;
    }

    public void incrementBatches() {
        this.batches++;
    }

    public void addEventsFetched(int count) {
        this.eventsFetched += count;
    }

    public void incrementTransitionsApplied() {
        this.transitionsApplied++;
    }

    public void incrementNoOps() {
        this.noOps++;
    }

    public void incrementDuplicatesSkipped() {
        this.duplicatesSkipped++;
    }

    public void incrementUnmatchedEvents() {
        this.unmatchedEvents++;
    }

    public void incrementHeldForReview() {
        this.heldForReview++;
    }

    public void incrementConflictsRetried() {
        this.conflictsRetried++;
    }

    public void incrementConsistencyViolations() {
        this.consistencyViolations++;
    }

    public void addError(Long fromBlock, Long toBlock, String errorMessage) {
        this.errors++;
        if (this.errorDetails == null) {
            this.errorDetails = new ArrayList<>();
        }
        this.errorDetails.add(ReconciliationError.builder()
                .fromBlock(fromBlock)
                .toBlock(toBlock)
                .errorMessage(errorMessage)
                .occurredAt(LocalDateTime.now(ZoneOffset.UTC))
                .build());
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
