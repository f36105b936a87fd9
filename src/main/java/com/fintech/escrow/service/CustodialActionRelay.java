package com.fintech.escrow.service;

import com.fintech.escrow.dto.EscrowPermissions;
import com.fintech.escrow.dto.LedgerActionResult;
import com.fintech.escrow.entity.EscrowEventType;
import com.fintech.escrow.entity.EscrowRecord;
import com.fintech.escrow.entity.FundingPath;
import com.fintech.escrow.exception.EscrowConsistencyException;
import com.fintech.escrow.exception.EscrowValidationException;
import com.fintech.escrow.exception.LedgerSubmissionException;
import com.fintech.escrow.ledger.LedgerCall;
import com.fintech.escrow.ledger.LedgerReceipt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Relays buyer actions on custodially funded trades, where the platform key
 * is the buyer on the ledger.
 * <p>
 * Self-custodial buyers and all sellers sign these calls with their own
 * wallets. The local record changes only when the reconciler sees the
 * resulting ledger event.
 */
@Service
@Slf4j
public class CustodialActionRelay {

    private final EscrowRecordStore store;
    private final LedgerTransactionExecutor executor;

    public CustodialActionRelay(EscrowRecordStore store, LedgerTransactionExecutor executor) {
        this.store = store;
        this.executor = executor;
    }

    public LedgerActionResult confirmDelivery(Long escrowId, Long actorId) {
        EscrowRecord record = requireRelayable(escrowId, actorId);
        EscrowPermissions permissions = EscrowPermissions.compute(record, actorId, store.now());
        if (!permissions.isCanConfirmDelivery()) {
            throw new EscrowValidationException(
                    String.format("Delivery cannot be confirmed on escrow %d in state %s", escrowId, record.getState()));
        }
        return relay(record, actorId, LedgerCall.confirmDelivery(record.getLedgerTradeId()), null);
    }

    public LedgerActionResult raiseDispute(Long escrowId, Long actorId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new EscrowValidationException("A dispute needs a reason");
        }
        EscrowRecord record = requireRelayable(escrowId, actorId);
        EscrowPermissions permissions = EscrowPermissions.compute(record, actorId, store.now());
        if (!permissions.isCanRaiseDispute()) {
            throw new EscrowValidationException(
                    String.format("A dispute cannot be raised on escrow %d in state %s", escrowId, record.getState()));
        }
        return relay(record, actorId, LedgerCall.raiseDispute(record.getLedgerTradeId(), reason), reason);
    }

    private EscrowRecord requireRelayable(Long escrowId, Long actorId) {
        EscrowRecord record = store.getRequired(escrowId);
        if (record.isConsistencyHold()) {
            throw new EscrowConsistencyException(escrowId,
                    "Escrow " + escrowId + " is on consistency hold: " + record.getHoldReason());
        }
        if (record.getFundingPath() != FundingPath.CUSTODIAL || record.getLedgerTradeId() == null) {
            throw new EscrowValidationException(String.format(
                    "Escrow %d is not custodially funded; the parties sign this action themselves", escrowId));
        }
        if (!Objects.equals(actorId, record.getBuyerId())) {
            throw new EscrowValidationException("Only the buyer's actions are relayed on custodial escrows");
        }
        return record;
    }

    private LedgerActionResult relay(EscrowRecord record, Long actorId, LedgerCall call, String reason) {
        String action = call.getFunction().getWireName();
        String txReference = executor.submit(call);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", action);
        payload.put("txReference", txReference);
        payload.put("actorId", actorId);
        payload.put("signer", executor.platformAddress());
        if (reason != null) {
            payload.put("reason", reason);
        }
        payload.put("trustReducing", true);
        store.appendLocalEvent(record.getId(), EscrowEventType.ACTION_SUBMITTED, payload, true);

        Optional<LedgerReceipt> receipt = executor.awaitReceipt(txReference);
        if (receipt.isPresent() && !receipt.get().success()) {
            log.warn("Relayed {} on escrow {} reverted: {}", action, record.getId(), receipt.get().revertReason());
            throw new LedgerSubmissionException(action + " reverted: " + receipt.get().revertReason(),
                    executor.connectionName(), txReference, false);
        }

        log.info("Relayed {} for buyer {} on escrow {} as {}", action, actorId, record.getId(), txReference);
        return LedgerActionResult.builder()
                .escrowId(record.getId())
                .action(action)
                .txReference(txReference)
                .mined(receipt.isPresent())
                .message(action + " submitted, escrow updates once the ledger event is reconciled")
                .build();
    }
}
