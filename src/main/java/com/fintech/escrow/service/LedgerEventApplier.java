package com.fintech.escrow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.escrow.dto.ReconciliationResult;
import com.fintech.escrow.entity.DisputeResolution;
import com.fintech.escrow.entity.EscrowEventType;
import com.fintech.escrow.entity.EscrowRecord;
import com.fintech.escrow.entity.EscrowState;
import com.fintech.escrow.entity.ReconcilerCursor;
import com.fintech.escrow.entity.ResolutionOutcome;
import com.fintech.escrow.entity.ResolutionStatus;
import com.fintech.escrow.exception.ReconciliationInProgressException;
import com.fintech.escrow.exception.StaleEscrowStateException;
import com.fintech.escrow.ledger.LedgerAddresses;
import com.fintech.escrow.ledger.LedgerEvent;
import com.fintech.escrow.ledger.LoggedEvent;
import com.fintech.escrow.ledger.Trade;
import com.fintech.escrow.repository.DisputeResolutionRepository;
import com.fintech.escrow.repository.ReconcilerCursorRepository;
import com.fintech.escrow.service.EscrowRecordStore.TransitionOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Folds one batch of ledger events into the local store and advances the
 * cursor, all in one database transaction.
 * <p>
 * Any exception rolls the whole batch back, cursor included, so the batch is
 * replayed on the next cycle. Replays are harmless: an event already logged
 * under its (tx reference, log index) is skipped, and a record already at or
 * past an event's target state is left alone.
 */
@Component
@Slf4j
public class LedgerEventApplier {

    static final int MAX_TRANSITION_ATTEMPTS = 3;

    private final EscrowRecordStore store;
    private final ReconcilerCursorRepository cursorRepository;
    private final DisputeResolutionRepository resolutionRepository;
    private final ObjectMapper objectMapper;

    public LedgerEventApplier(EscrowRecordStore store,
                              ReconcilerCursorRepository cursorRepository,
                              DisputeResolutionRepository resolutionRepository,
                              ObjectMapper objectMapper) {
        this.store = store;
        this.cursorRepository = cursorRepository;
        this.resolutionRepository = resolutionRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Last fully applied block for the connection, or {@code initialCursor}
     * when the connection was never reconciled.
     */
    @Transactional(readOnly = true)
    public long readCursor(String connectionName, long initialCursor) {
        return cursorRepository.findById(connectionName)
                .map(ReconcilerCursor::getLastProcessedBlock)
                .orElse(initialCursor);
    }

    /**
     * Applies the events of blocks {@code (expectedCursor, toBlock]} and moves
     * the cursor to {@code toBlock}.
     *
     * @param trades ledger snapshots of funded trades, used to read their timeout
     * @throws ReconciliationInProgressException if another run moved the cursor meanwhile
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public void applyBatch(String connectionName, long expectedCursor, long toBlock,
                           List<LoggedEvent> events, Map<Long, Trade> trades,
                           ReconciliationResult result) {
        ReconcilerCursor cursor = cursorRepository.findById(connectionName)
                .orElseGet(() -> ReconcilerCursor.builder()
                        .connectionName(connectionName)
                        .lastProcessedBlock(expectedCursor)
                        .build());
        if (cursor.getLastProcessedBlock() != expectedCursor) {
            throw new ReconciliationInProgressException(String.format(
                    "Cursor of %s is at block %d, expected %d", connectionName,
                    cursor.getLastProcessedBlock(), expectedCursor));
        }

        applyEvents(events, trades, result);

        cursor.setLastProcessedBlock(toBlock);
        cursorRepository.save(cursor);
        log.debug("Cursor of {} advanced {} -> {} ({} events)", connectionName, expectedCursor, toBlock,
                events.size());
    }

    /**
     * Applies events of blocks the cursor has already passed, without moving
     * the cursor. Used for a trade bound to an escrow after its events were
     * reconciled as unmatched.
     */
    @Transactional(isolation = Isolation.READ_COMMITTED)
    public void applyPassedEvents(List<LoggedEvent> events, Map<Long, Trade> trades, ReconciliationResult result) {
        applyEvents(events, trades, result);
    }

    private void applyEvents(List<LoggedEvent> events, Map<Long, Trade> trades, ReconciliationResult result) {
        for (LoggedEvent logged : events) {
            if (store.isLedgerEventLogged(logged.txReference(), logged.logIndex())) {
                log.debug("Skipping {} at {}#{}, already applied",
                        logged.event().eventName(), logged.txReference(), logged.logIndex());
                result.incrementDuplicatesSkipped();
                continue;
            }
            logged.event().accept(new EventHandler(logged, trades, result));
        }
    }

    /**
     * Applies one ledger event. Every matched event leaves exactly one event
     * row; unmatched events leave none because they have no escrow to attach to.
     */
    private final class EventHandler implements LedgerEvent.Visitor<Void> {

        private final LoggedEvent logged;
        private final Map<Long, Trade> trades;
        private final ReconciliationResult result;

        private EventHandler(LoggedEvent logged, Map<Long, Trade> trades, ReconciliationResult result) {
            this.logged = logged;
            this.trades = trades;
            this.result = result;
        }

        @Override
        public Void visitEscrowCreated(LedgerEvent.EscrowCreated event) {
            Optional<EscrowRecord> bound = store.findByLedgerTradeId(event.tradeId());
            EscrowRecord record;
            if (bound.isPresent()) {
                record = bound.get();
            } else {
                Optional<EscrowRecord> candidate = escrowIdFromMetadata(event.metadata()).flatMap(store::find);
                if (candidate.isEmpty() || !claims(candidate.get(), event)) {
                    unmatched();
                    return null;
                }
                record = candidate.get();
                if (amountMismatch(record, event)) {
                    // Flag the escrow but leave it free for a correct trade
                    violation(record, String.format("Trade %d names the escrow but was created with %s wei, "
                                    + "escrow expects %s wei; not attached",
                            event.tradeId(), event.amount(), record.getAmountWei()));
                    return null;
                }
                store.attachLedgerTrade(record.getId(), event.tradeId());
                log.info("Escrow {} attached to trade {} from creation metadata", record.getId(), event.tradeId());
            }

            if (amountMismatch(record, event)) {
                violation(record, String.format("Trade %d created with %s wei, escrow expects %s wei",
                        event.tradeId(), event.amount(), record.getAmountWei()));
                return null;
            }
            result.incrementNoOps();
            append(record, EscrowEventType.LEDGER_TRADE_ATTACHED, null);
            return null;
        }

        @Override
        public Void visitFunded(LedgerEvent.Funded event) {
            Optional<EscrowRecord> found = lookup(event);
            if (found.isEmpty()) {
                return null;
            }
            EscrowRecord record = found.get();

            if (event.amount().compareTo(record.getAmountWei()) != 0) {
                violation(record, String.format("Trade %d funded with %s wei, escrow expects %s wei",
                        event.tradeId(), event.amount(), record.getAmountWei()));
                return null;
            }
            if (!LedgerAddresses.same(event.payer(), record.effectiveLedgerBuyer())) {
                violation(record, String.format("Trade %d funded by %s, escrow expects buyer %s",
                        event.tradeId(), event.payer(), record.effectiveLedgerBuyer()));
                return null;
            }

            Trade trade = trades.get(event.tradeId());
            boolean applied = transitionTo(record, EscrowState.FUNDED, r -> {
                if (r.getFundedAt() == null) {
                    r.setFundedAt(store.now());
                }
                if (r.getFundingTxReference() == null) {
                    r.setFundingTxReference(logged.txReference());
                }
                if (trade != null) {
                    r.setLedgerTimeoutAt(trade.timeoutAtUtc());
                }
            });
            if (!applied && trade != null) {
                EscrowRecord current = store.getRequired(record.getId());
                if (current.getLedgerTimeoutAt() == null) {
                    store.update(record.getId(), r -> r.setLedgerTimeoutAt(trade.timeoutAtUtc()));
                }
            }
            append(record, EscrowEventType.FUNDED, null);
            return null;
        }

        @Override
        public Void visitDeliveryConfirmed(LedgerEvent.DeliveryConfirmed event) {
            Optional<EscrowRecord> found = lookup(event);
            if (found.isEmpty()) {
                return null;
            }
            transitionTo(found.get(), EscrowState.COMPLETE, r -> r.setCompletedAt(store.now()));
            append(found.get(), EscrowEventType.DELIVERY_CONFIRMED, null);
            return null;
        }

        @Override
        public Void visitReleased(LedgerEvent.Released event) {
            Optional<EscrowRecord> found = lookup(event);
            if (found.isEmpty()) {
                return null;
            }
            EscrowRecord record = found.get();
            BigInteger released = event.amount().add(event.fee());
            if (released.compareTo(record.getAmountWei()) != 0) {
                violation(record, String.format("Trade %d released %s wei (fee included), escrow holds %s wei",
                        event.tradeId(), released, record.getAmountWei()));
                return null;
            }
            result.incrementNoOps();
            append(record, EscrowEventType.RELEASED, null);
            return null;
        }

        @Override
        public Void visitDisputed(LedgerEvent.Disputed event) {
            Optional<EscrowRecord> found = lookup(event);
            if (found.isEmpty()) {
                return null;
            }
            transitionTo(found.get(), EscrowState.DISPUTED, r -> {
                r.setDisputeReason(event.reason());
                r.setDisputedAt(store.now());
            });
            append(found.get(), EscrowEventType.DISPUTED, null);
            return null;
        }

        @Override
        public Void visitResolved(LedgerEvent.Resolved event) {
            Optional<EscrowRecord> found = lookup(event);
            if (found.isEmpty()) {
                return null;
            }
            EscrowRecord record = found.get();
            if (event.amount().compareTo(record.getAmountWei()) > 0) {
                violation(record, String.format("Trade %d resolved with %s wei to %s, escrow holds %s wei",
                        event.tradeId(), event.amount(), event.to(), record.getAmountWei()));
                return null;
            }

            Optional<DisputeResolution> submitted = resolutionRepository
                    .findFirstByEscrowIdAndStatusOrderByIdDesc(record.getId(), ResolutionStatus.SUBMITTED);
            ResolutionOutcome outcome = submitted
                    .filter(resolution -> matches(resolution, event))
                    .map(DisputeResolution::getOutcome)
                    .orElseGet(() -> deriveOutcome(record, event));

            transitionTo(record, EscrowState.COMPLETE, r -> {
                r.setResolutionOutcome(outcome);
                r.setCompletedAt(store.now());
            });

            submitted.filter(resolution -> matches(resolution, event)).ifPresent(resolution -> {
                resolution.setStatus(ResolutionStatus.CONFIRMED);
                resolution.setConfirmedAt(store.now());
                if (resolution.getTxReference() == null) {
                    resolution.setTxReference(logged.txReference());
                }
                resolutionRepository.save(resolution);
                log.info("Dispute resolution {} of escrow {} confirmed by the ledger",
                        resolution.getId(), record.getId());
            });

            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("outcome", outcome.name());
            append(record, EscrowEventType.RESOLVED, extra);
            return null;
        }

        @Override
        public Void visitTimeoutRefund(LedgerEvent.TimeoutRefund event) {
            Optional<EscrowRecord> found = lookup(event);
            if (found.isEmpty()) {
                return null;
            }
            EscrowRecord record = found.get();
            if (event.amount().compareTo(record.getAmountWei()) != 0) {
                violation(record, String.format("Trade %d refunded %s wei, escrow holds %s wei",
                        event.tradeId(), event.amount(), record.getAmountWei()));
                return null;
            }
            transitionTo(record, EscrowState.COMPLETE, r -> r.setCompletedAt(store.now()));
            append(record, EscrowEventType.TIMEOUT_REFUND, null);
            return null;
        }

        /**
         * Moves the record to {@code target}, re-reading it when a concurrent
         * writer got there first.
         *
         * @return true if this event caused the transition
         */
        private boolean transitionTo(EscrowRecord record, EscrowState target, Consumer<EscrowRecord> mutator) {
            EscrowRecord current = record;
            for (int attempt = 1; attempt <= MAX_TRANSITION_ATTEMPTS; attempt++) {
                if (current.isConsistencyHold()) {
                    log.warn("Escrow {} on consistency hold, {} logged without transition",
                            current.getId(), logged.event().eventName());
                    result.incrementHeldForReview();
                    return false;
                }
                if (current.getState().isAtOrPast(target)) {
                    if (current.getState() == target && current.isProvisional()) {
                        store.confirmProvisional(current.getId());
                    }
                    result.incrementNoOps();
                    return false;
                }
                if (!current.getState().canTransitionTo(target)) {
                    violation(current, String.format("Ledger event %s cannot move escrow from %s to %s",
                            logged.event().eventName(), current.getState(), target));
                    return false;
                }

                TransitionOutcome outcome = store.transition(current.getId(), current.getState(), target,
                        mutator.andThen(r -> r.setProvisional(false)));
                if (outcome == TransitionOutcome.APPLIED) {
                    result.incrementTransitionsApplied();
                    return true;
                }

                result.incrementConflictsRetried();
                log.debug("Escrow {} changed underneath the reconciler, re-reading (attempt {})",
                        current.getId(), attempt);
                current = store.refresh(current.getId());
            }
            throw new StaleEscrowStateException(record.getId(), String.format(
                    "Escrow %d kept changing while applying %s", record.getId(), logged.event().eventName()));
        }

        private Optional<EscrowRecord> lookup(LedgerEvent event) {
            Optional<EscrowRecord> record = store.findByLedgerTradeId(event.tradeId());
            if (record.isEmpty()) {
                unmatched();
            }
            return record;
        }

        /**
         * True if the trade was created for this escrow: it is not bound yet
         * and the trade parties are the escrow's.
         */
        private boolean claims(EscrowRecord record, LedgerEvent.EscrowCreated event) {
            if (record.getLedgerTradeId() != null) {
                log.warn("Trade {} names escrow {} which is already bound to trade {}",
                        event.tradeId(), record.getId(), record.getLedgerTradeId());
                return false;
            }
            if (!LedgerAddresses.same(event.buyer(), record.effectiveLedgerBuyer())
                    || !LedgerAddresses.same(event.seller(), record.getSellerAddress())) {
                log.warn("Trade {} names escrow {} but its parties {} / {} do not match",
                        event.tradeId(), record.getId(), event.buyer(), event.seller());
                return false;
            }
            return true;
        }

        private boolean amountMismatch(EscrowRecord record, LedgerEvent.EscrowCreated event) {
            return event.amount().signum() != 0 && event.amount().compareTo(record.getAmountWei()) != 0;
        }

        private void violation(EscrowRecord record, String reason) {
            result.incrementConsistencyViolations();
            store.placeOnHold(record.getId(), reason);
            Map<String, Object> extra = new LinkedHashMap<>();
            extra.put("violation", reason);
            append(record, EscrowEventType.CONSISTENCY_VIOLATION, extra);
        }

        private void unmatched() {
            result.incrementUnmatchedEvents();
            log.debug("No escrow for {} of trade {} at {}#{}", logged.event().eventName(),
                    logged.event().tradeId(), logged.txReference(), logged.logIndex());
        }

        private void append(EscrowRecord record, EscrowEventType type, Map<String, Object> extra) {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("event", logged.event().eventName());
            payload.putAll(logged.event().arguments());
            if (extra != null) {
                payload.putAll(extra);
            }
            store.appendLedgerEvent(record.getId(), type, logged, payload);
        }
    }

    private Optional<Long> escrowIdFromMetadata(String metadata) {
        if (metadata == null || metadata.isBlank()) {
            return Optional.empty();
        }
        try {
            JsonNode escrowId = objectMapper.readTree(metadata).get("escrowId");
            if (escrowId == null || !escrowId.canConvertToLong()) {
                return Optional.empty();
            }
            return Optional.of(escrowId.asLong());
        } catch (JsonProcessingException e) {
            log.debug("Trade metadata is not JSON, cannot derive escrow id: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }

    private static boolean matches(DisputeResolution resolution, LedgerEvent.Resolved event) {
        return LedgerAddresses.same(resolution.getRecipientAddress(), event.to())
                && resolution.getRecipientAmountWei().compareTo(event.amount()) == 0;
    }

    /**
     * Outcome of a resolution submitted outside this service, from what the
     * ledger paid out.
     */
    static ResolutionOutcome deriveOutcome(EscrowRecord record, LedgerEvent.Resolved event) {
        boolean full = event.amount().compareTo(record.getAmountWei()) == 0;
        if (full && LedgerAddresses.same(event.to(), record.effectiveLedgerBuyer())) {
            return ResolutionOutcome.REFUND_TO_BUYER;
        }
        if (full && LedgerAddresses.same(event.to(), record.getSellerAddress())) {
            return ResolutionOutcome.PAYOUT_TO_SELLER;
        }
        return ResolutionOutcome.PARTIAL_SPLIT;
    }
}
