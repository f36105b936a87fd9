package com.fintech.escrow.service;

import com.fintech.escrow.dto.LedgerActionResult;
import com.fintech.escrow.entity.EscrowEventType;
import com.fintech.escrow.entity.EscrowRecord;
import com.fintech.escrow.entity.EscrowState;
import com.fintech.escrow.exception.EscrowConsistencyException;
import com.fintech.escrow.exception.EscrowValidationException;
import com.fintech.escrow.exception.LedgerSubmissionException;
import com.fintech.escrow.ledger.LedgerCall;
import com.fintech.escrow.ledger.LedgerFunction;
import com.fintech.escrow.ledger.LedgerReceipt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Surfaces funded escrows whose delivery was never confirmed and triggers
 * the permissionless ledger refund for them.
 * <p>
 * The ledger decides whether a trade has timed out; the local timeout is
 * only used to list candidates.
 */
@Service
@Slf4j
public class TimeoutRefundService {

    private final EscrowRecordStore store;
    private final LedgerTransactionExecutor executor;

    public TimeoutRefundService(EscrowRecordStore store, LedgerTransactionExecutor executor) {
        this.store = store;
        this.executor = executor;
    }

    /** Funded escrows whose ledger timeout has passed. */
    public List<EscrowRecord> findTimeoutEligible() {
        return store.findTimedOut();
    }

    /** Funded escrows awaiting delivery confirmation for longer than {@code age}. */
    public List<EscrowRecord> findAwaitingConfirmationOlderThan(Duration age) {
        return store.findAwaitingConfirmationOlderThan(age);
    }

    /**
     * Submits {@code timeoutRefund} for the escrow's trade with the platform
     * key. The record completes when the reconciler sees the refund event.
     *
     * @throws LedgerSubmissionException if the submission failed or the ledger refused the refund
     */
    public LedgerActionResult triggerTimeoutRefund(Long escrowId) {
        EscrowRecord record = store.getRequired(escrowId);
        if (record.isConsistencyHold()) {
            throw new EscrowConsistencyException(escrowId,
                    "Escrow " + escrowId + " is on consistency hold: " + record.getHoldReason());
        }
        if (record.getState() != EscrowState.FUNDED) {
            throw new EscrowValidationException(
                    String.format("Escrow %d is %s, only funded escrows can be refunded", escrowId, record.getState()));
        }
        if (record.getLedgerTradeId() == null) {
            throw new EscrowValidationException("Escrow " + escrowId + " is not bound to a ledger trade");
        }

        String txReference = executor.submit(LedgerCall.timeoutRefund(record.getLedgerTradeId()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", LedgerFunction.TIMEOUT_REFUND.getWireName());
        payload.put("txReference", txReference);
        payload.put("submittedBy", executor.platformAddress());
        store.appendLocalEvent(escrowId, EscrowEventType.ACTION_SUBMITTED, payload, false);

        Optional<LedgerReceipt> receipt = executor.awaitReceipt(txReference);
        if (receipt.isPresent() && !receipt.get().success()) {
            log.warn("Timeout refund of escrow {} refused by the ledger: {}", escrowId, receipt.get().revertReason());
            throw new LedgerSubmissionException("timeoutRefund reverted: " + receipt.get().revertReason(),
                    executor.connectionName(), txReference, false);
        }

        log.info("Timeout refund of escrow {} submitted as {}", escrowId, txReference);
        return LedgerActionResult.builder()
                .escrowId(escrowId)
                .action(LedgerFunction.TIMEOUT_REFUND.getWireName())
                .txReference(txReference)
                .mined(receipt.isPresent())
                .message("Refund submitted, escrow completes once the ledger event is reconciled")
                .build();
    }
}
