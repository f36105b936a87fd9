package com.fintech.escrow.service;

import com.fintech.escrow.config.LedgerProperties;
import com.fintech.escrow.dto.ReconciliationResult;
import com.fintech.escrow.entity.EscrowState;
import com.fintech.escrow.exception.LedgerSubmissionException;
import com.fintech.escrow.exception.ReconciliationInProgressException;
import com.fintech.escrow.ledger.LedgerClient;
import com.fintech.escrow.ledger.LedgerEvent;
import com.fintech.escrow.ledger.LoggedEvent;
import com.fintech.escrow.ledger.Trade;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Replays ledger events into the local escrow store.
 * <p>
 * Key Design Decisions:
 * 1. Durable cursor: the last fully applied block is stored per ledger connection
 * 2. Finality: only blocks at least {@code confirmations} deep are read
 * 3. Batches: each block range is applied in one transaction together with the cursor
 * 4. Single writer: overlapping runs are refused
 * <p>
 * A failed batch is rolled back and retried on the next run. Later batches
 * are not attempted in the same run so events are never applied out of order.
 */
@Service
@Slf4j
public class EventReconciler {

    private final LedgerClient ledgerClient;
    private final LedgerEventApplier applier;
    private final EscrowRecordStore store;
    private final LedgerProperties ledgerProperties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Value("${escrow.reconciler.batch-blocks:500}")
    private int batchBlocks;

    @Value("${escrow.reconciler.max-batches-per-run:20}")
    private int maxBatchesPerRun;

    @Value("${escrow.reconciler.start-block:0}")
    private long startBlock;

    @Value("${escrow.reconciler.catch-up-wait-ms:5000}")
    private long catchUpWaitMs;

    // Metrics
    private Counter runCounter;
    private Counter eventCounter;
    private Counter transitionCounter;
    private Counter violationCounter;
    private Counter errorCounter;
    private Timer reconciliationTimer;
    private final AtomicLong blockLag = new AtomicLong();

    // Prevents concurrent reconciliation runs and catch-ups
    private final ReentrantLock runLock = new ReentrantLock();

    public EventReconciler(LedgerClient ledgerClient,
                           LedgerEventApplier applier,
                           EscrowRecordStore store,
                           LedgerProperties ledgerProperties,
                           MeterRegistry meterRegistry,
                           Clock clock) {
        this.ledgerClient = ledgerClient;
        this.applier = applier;
        this.store = store;
        this.ledgerProperties = ledgerProperties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void initMetrics() {
        runCounter = Counter.builder("escrow.reconciler.runs")
                .description("Reconciliation runs started")
                .register(meterRegistry);

        eventCounter = Counter.builder("escrow.reconciler.events")
                .description("Ledger events fetched for reconciliation")
                .register(meterRegistry);

        transitionCounter = Counter.builder("escrow.reconciler.transitions")
                .description("Escrow transitions applied from ledger events")
                .register(meterRegistry);

        violationCounter = Counter.builder("escrow.reconciler.consistency_violations")
                .description("Escrows placed on consistency hold by the reconciler")
                .register(meterRegistry);

        errorCounter = Counter.builder("escrow.reconciler.errors")
                .description("Batches rolled back because of an error")
                .register(meterRegistry);

        reconciliationTimer = Timer.builder("escrow.reconciler.duration")
                .description("Time taken to complete a reconciliation run")
                .register(meterRegistry);

        Gauge.builder("escrow.reconciler.lag_blocks", blockLag, AtomicLong::get)
                .description("Final blocks not yet reconciled")
                .register(meterRegistry);
    }

    /**
     * Main reconciliation entry point.
     * Applies all final blocks past the cursor, up to the per-run batch limit.
     *
     * @return ReconciliationResult containing statistics about the run
     * @throws ReconciliationInProgressException if a run is already in progress
     */
    public ReconciliationResult reconcile() {
        if (!runLock.tryLock()) {
            log.warn("Reconciliation already in progress, skipping this run");
            throw new ReconciliationInProgressException("Reconciliation already in progress");
        }

        String connection = ledgerClient.getConnectionName();
        ReconciliationResult result = ReconciliationResult.builder()
                .connectionName(connection)
                .startedAt(LocalDateTime.now(clock))
                .build();
        runCounter.increment();

        try {
            return reconciliationTimer.record(() -> {
                processFinalBlocks(connection, result);
                result.setCompletedAt(LocalDateTime.now(clock));

                eventCounter.increment(result.getEventsFetched());
                transitionCounter.increment(result.getTransitionsApplied());
                violationCounter.increment(result.getConsistencyViolations());

                log.info("Reconciliation of {} completed. Blocks {} -> {} (latest {}), events: {}, " +
                                "transitions: {}, no-ops: {}, duplicates: {}, unmatched: {}, held: {}, " +
                                "violations: {}, errors: {}",
                        connection,
                        result.getStartCursor(),
                        result.getEndCursor(),
                        result.getLatestBlock(),
                        result.getEventsFetched(),
                        result.getTransitionsApplied(),
                        result.getNoOps(),
                        result.getDuplicatesSkipped(),
                        result.getUnmatchedEvents(),
                        result.getHeldForReview(),
                        result.getConsistencyViolations(),
                        result.getErrors());
                return result;
            });
        } finally {
            runLock.unlock();
        }
    }

    /**
     * Folds the events of a trade that was bound to an escrow after the
     * cursor had already passed them. Those events were reconciled as
     * unmatched and are not read again by regular runs.
     * <p>
     * Waits for a running reconciliation to finish first. Blocks past the
     * cursor are left to the regular run.
     *
     * @param fromBlock block of the transaction that funded the trade
     * @return the catch-up statistics, empty when there was nothing to fold
     */
    public Optional<ReconciliationResult> catchUpTrade(long tradeId, long fromBlock) {
        boolean locked;
        try {
            locked = runLock.tryLock(catchUpWaitMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting to catch up trade {}", tradeId);
            return Optional.empty();
        }
        if (!locked) {
            log.warn("Reconciliation still running after {}ms, trade {} not caught up", catchUpWaitMs, tradeId);
            return Optional.empty();
        }

        String connection = ledgerClient.getConnectionName();
        try {
            long cursor = applier.readCursor(connection, startBlock - 1);
            if (fromBlock > cursor) {
                log.debug("Trade {} at block {} not reconciled yet (cursor {})", tradeId, fromBlock, cursor);
                return Optional.empty();
            }

            ReconciliationResult result = ReconciliationResult.builder()
                    .connectionName(connection)
                    .startCursor(cursor)
                    .endCursor(cursor)
                    .startedAt(LocalDateTime.now(clock))
                    .build();
            for (long from = fromBlock; from <= cursor; from += batchBlocks) {
                long to = Math.min(from + batchBlocks - 1, cursor);
                List<LoggedEvent> events = ledgerClient.getEvents(from, to).stream()
                        .filter(logged -> logged.event().tradeId() == tradeId)
                        .toList();
                if (events.isEmpty()) {
                    continue;
                }
                result.addEventsFetched(events.size());
                applier.applyPassedEvents(events, fetchFundedTrades(events), result);
                result.incrementBatches();
            }
            result.setCompletedAt(LocalDateTime.now(clock));
            transitionCounter.increment(result.getTransitionsApplied());
            violationCounter.increment(result.getConsistencyViolations());

            log.info("Caught up trade {} over blocks {}-{}: events: {}, transitions: {}, no-ops: {}, duplicates: {}",
                    tradeId, fromBlock, cursor, result.getEventsFetched(), result.getTransitionsApplied(),
                    result.getNoOps(), result.getDuplicatesSkipped());
            return Optional.of(result);
        } finally {
            runLock.unlock();
        }
    }

    private void processFinalBlocks(String connection, ReconciliationResult result) {
        long cursor = applier.readCursor(connection, startBlock - 1);
        result.setStartCursor(cursor);
        result.setEndCursor(cursor);

        long latest;
        try {
            latest = ledgerClient.latestBlockNumber();
        } catch (LedgerSubmissionException e) {
            log.warn("Ledger {} unreachable, reconciliation postponed: {}", connection, e.getMessage());
            errorCounter.increment();
            result.addError(cursor + 1, null, e.getMessage());
            return;
        }
        result.setLatestBlock(latest);

        long finalHead = latest - ledgerProperties.getConfirmations();

        while (cursor < finalHead && result.getBatches() < maxBatchesPerRun) {
            long from = cursor + 1;
            long to = Math.min(cursor + batchBlocks, finalHead);
            try {
                List<LoggedEvent> events = ledgerClient.getEvents(from, to);
                Map<Long, Trade> trades = fetchFundedTrades(events);
                result.addEventsFetched(events.size());

                applier.applyBatch(connection, cursor, to, events, trades, result);

                result.incrementBatches();
                cursor = to;
                result.setEndCursor(cursor);
            } catch (ReconciliationInProgressException e) {
                log.warn("Batch {}-{} of {} skipped: {}", from, to, connection, e.getMessage());
                result.addError(from, to, e.getMessage());
                break;
            } catch (RuntimeException e) {
                log.error("Batch {}-{} of {} rolled back, retrying next run: {}",
                        from, to, connection, e.getMessage(), e);
                errorCounter.increment();
                result.addError(from, to, e.getMessage());
                break;
            }
        }

        blockLag.set(Math.max(0, finalHead - cursor));
    }

    /**
     * Ledger snapshots of the trades funded in this batch, read before the
     * database transaction opens.
     */
    private Map<Long, Trade> fetchFundedTrades(List<LoggedEvent> events) {
        Map<Long, Trade> trades = new HashMap<>();
        for (LoggedEvent logged : events) {
            if (logged.event() instanceof LedgerEvent.Funded && !trades.containsKey(logged.event().tradeId())) {
                ledgerClient.getTrade(logged.event().tradeId())
                        .ifPresent(trade -> trades.put(trade.getTradeId(), trade));
            }
        }
        return trades;
    }

    /**
     * Get current reconciliation statistics.
     * Useful for monitoring dashboards.
     */
    public ReconcilerStats getStats() {
        String connection = ledgerClient.getConnectionName();
        long cursor = applier.readCursor(connection, startBlock - 1);
        Long latest = null;
        if (ledgerClient.isAvailable()) {
            try {
                latest = ledgerClient.latestBlockNumber();
            } catch (LedgerSubmissionException e) {
                log.warn("Could not read latest block of {}: {}", connection, e.getMessage());
            }
        }

        Map<EscrowState, Long> counts = store.stateCounts();
        return ReconcilerStats.builder()
                .connectionName(connection)
                .lastProcessedBlock(cursor)
                .latestBlock(latest)
                .lagBlocks(latest == null ? null : Math.max(0, latest - ledgerProperties.getConfirmations() - cursor))
                .ledgerAvailable(latest != null)
                .isReconciliationRunning(runLock.isLocked())
                .stateCounts(counts)
                .build();
    }

    public boolean isRunning() {
        return runLock.isLocked();
    }

    @lombok.Data
    @lombok.Builder
    public static class ReconcilerStats {
        private String connectionName;
        private long lastProcessedBlock;
        private Long latestBlock;
        private Long lagBlocks;
        private boolean ledgerAvailable;
        private boolean isReconciliationRunning;
        private Map<EscrowState, Long> stateCounts;
    }
}
