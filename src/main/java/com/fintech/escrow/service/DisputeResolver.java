package com.fintech.escrow.service;

import com.fintech.escrow.dto.DisputeDecisionRequest;
import com.fintech.escrow.dto.DisputeResolutionResult;
import com.fintech.escrow.dto.PayoutPlan;
import com.fintech.escrow.entity.DisputeResolution;
import com.fintech.escrow.entity.EscrowEventType;
import com.fintech.escrow.entity.EscrowRecord;
import com.fintech.escrow.entity.EscrowState;
import com.fintech.escrow.entity.ResolutionStatus;
import com.fintech.escrow.exception.EscrowConsistencyException;
import com.fintech.escrow.exception.EscrowValidationException;
import com.fintech.escrow.exception.LedgerSubmissionException;
import com.fintech.escrow.ledger.LedgerAddresses;
import com.fintech.escrow.ledger.LedgerCall;
import com.fintech.escrow.ledger.LedgerReceipt;
import com.fintech.escrow.repository.DisputeResolutionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Turns an administrator's decision on a disputed escrow into a ledger payout.
 * <p>
 * The record stays DISPUTED after submission. It completes, and the
 * resolution is marked CONFIRMED, only when the reconciler sees the
 * {@code Resolved} event. A reverted or failed submission marks the
 * resolution FAILED so a new decision can be made.
 */
@Service
@Slf4j
public class DisputeResolver {

    private final EscrowRecordStore store;
    private final DisputeResolutionRepository resolutionRepository;
    private final LedgerTransactionExecutor executor;
    private final MeterRegistry meterRegistry;

    private Counter submittedCounter;
    private Counter failedCounter;

    public DisputeResolver(EscrowRecordStore store,
                           DisputeResolutionRepository resolutionRepository,
                           LedgerTransactionExecutor executor,
                           MeterRegistry meterRegistry) {
        this.store = store;
        this.resolutionRepository = resolutionRepository;
        this.executor = executor;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        submittedCounter = Counter.builder("escrow.disputes.resolutions.submitted")
                .description("Dispute resolutions submitted to the ledger")
                .register(meterRegistry);

        failedCounter = Counter.builder("escrow.disputes.resolutions.failed")
                .description("Dispute resolutions that failed or reverted")
                .register(meterRegistry);
    }

    /**
     * Validates the decision, submits {@code resolveDispute} with the
     * administrator key and waits for the receipt.
     *
     * @throws EscrowValidationException  if the escrow is not disputed or the decision is invalid
     * @throws EscrowConsistencyException if the escrow is on consistency hold
     * @throws LedgerSubmissionException  if the submission failed or reverted
     */
    public DisputeResolutionResult resolve(Long escrowId, DisputeDecisionRequest decision) {
        EscrowRecord record = store.getRequired(escrowId);
        if (record.isConsistencyHold()) {
            throw new EscrowConsistencyException(escrowId,
                    "Escrow " + escrowId + " is on consistency hold: " + record.getHoldReason());
        }
        if (record.getState() != EscrowState.DISPUTED) {
            throw new EscrowValidationException(
                    String.format("Escrow %d is %s, only disputed escrows can be resolved", escrowId, record.getState()));
        }
        if (record.getLedgerTradeId() == null) {
            throw new EscrowValidationException("Escrow " + escrowId + " is not bound to a ledger trade");
        }
        settlePendingSubmission(escrowId);

        PayoutPlan plan = planPayout(record, decision);
        DisputeResolution resolution = resolutionRepository.save(DisputeResolution.builder()
                .escrowId(escrowId)
                .outcome(plan.getOutcome())
                .recipientAddress(plan.getRecipientAddress())
                .recipientAmountWei(plan.getRecipientAmountWei())
                .counterpartyAddress(plan.getCounterpartyAddress())
                .counterpartyAmountWei(plan.getCounterpartyAmountWei())
                .note(decision.getNote())
                .adminId(decision.getAdminId())
                .status(ResolutionStatus.SUBMITTED)
                .build());

        log.info("Admin {} resolving escrow {} as {}: {} wei to {}, {} wei to {}",
                decision.getAdminId(), escrowId, plan.getOutcome(),
                plan.getRecipientAmountWei(), plan.getRecipientAddress(),
                plan.getCounterpartyAmountWei(), plan.getCounterpartyAddress());

        String txReference;
        try {
            txReference = executor.submit(LedgerCall.resolveDispute(record.getLedgerTradeId(),
                    plan.getRecipientAddress(), plan.getRecipientAmountWei(), decision.getNote()));
        } catch (RuntimeException e) {
            // Nothing was broadcast, or nothing we can track
            markFailed(resolution, e.getMessage());
            throw e;
        }

        resolution.setTxReference(txReference);
        resolution = resolutionRepository.save(resolution);
        submittedCounter.increment();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("resolutionId", resolution.getId());
        payload.put("txReference", txReference);
        payload.put("outcome", plan.getOutcome().name());
        payload.put("recipient", plan.getRecipientAddress());
        payload.put("recipientAmountWei", plan.getRecipientAmountWei().toString());
        payload.put("counterparty", plan.getCounterpartyAddress());
        payload.put("counterpartyAmountWei", plan.getCounterpartyAmountWei().toString());
        payload.put("adminId", decision.getAdminId());
        store.appendLocalEvent(escrowId, EscrowEventType.RESOLUTION_SUBMITTED, payload, false);

        Optional<LedgerReceipt> receipt = executor.awaitReceipt(txReference);
        if (receipt.isPresent() && !receipt.get().success()) {
            String reason = receipt.get().revertReason();
            markFailed(resolution, "Reverted: " + reason);
            throw new LedgerSubmissionException("resolveDispute reverted: " + reason,
                    executor.connectionName(), txReference, false);
        }

        return DisputeResolutionResult.builder()
                .resolutionId(resolution.getId())
                .escrowId(escrowId)
                .status(resolution.getStatus())
                .txReference(txReference)
                .payoutPlan(plan)
                .message(receipt.isPresent()
                        ? "Resolution mined, escrow completes once the ledger event is reconciled"
                        : "Resolution submitted, receipt not yet available")
                .build();
    }

    /**
     * Computes who gets what. Refund and payout default to the full amount
     * for the named party; a partial split needs both recipient and amount.
     * The counterparty receives the remainder.
     */
    public PayoutPlan planPayout(EscrowRecord record, DisputeDecisionRequest decision) {
        String buyer = LedgerAddresses.normalize(record.effectiveLedgerBuyer());
        String seller = LedgerAddresses.normalize(record.getSellerAddress());
        BigInteger total = record.getAmountWei();

        String recipient;
        BigInteger amount;
        switch (decision.getOutcome()) {
            case REFUND_TO_BUYER -> {
                recipient = requireNamedParty(decision.getRecipientAddress(), buyer, "buyer");
                amount = requireFullAmount(decision.getAmountWei(), total);
            }
            case PAYOUT_TO_SELLER -> {
                recipient = requireNamedParty(decision.getRecipientAddress(), seller, "seller");
                amount = requireFullAmount(decision.getAmountWei(), total);
            }
            case PARTIAL_SPLIT -> {
                if (decision.getRecipientAddress() == null || decision.getAmountWei() == null) {
                    throw new EscrowValidationException("A partial split needs a recipient and an amount");
                }
                if (!LedgerAddresses.isValid(decision.getRecipientAddress())) {
                    throw new EscrowValidationException("Invalid recipient address: " + decision.getRecipientAddress());
                }
                recipient = LedgerAddresses.normalize(decision.getRecipientAddress());
                if (!recipient.equals(buyer) && !recipient.equals(seller)) {
                    throw new EscrowValidationException("Recipient must be the buyer or the seller of the trade");
                }
                amount = decision.getAmountWei();
                if (amount.signum() < 0 || amount.compareTo(total) > 0) {
                    throw new EscrowValidationException(
                            String.format("Split amount must be between 0 and %s wei", total));
                }
            }
            default -> throw new EscrowValidationException("Unsupported outcome " + decision.getOutcome());
        }

        String counterparty = recipient.equals(buyer) ? seller : buyer;
        return PayoutPlan.builder()
                .outcome(decision.getOutcome())
                .recipientAddress(recipient)
                .recipientAmountWei(amount)
                .counterpartyAddress(counterparty)
                .counterpartyAmountWei(total.subtract(amount))
                .build();
    }

    public Page<EscrowRecord> listDisputed(Pageable pageable) {
        return store.findByState(EscrowState.DISPUTED, pageable);
    }

    public List<DisputeResolution> resolutions(Long escrowId) {
        store.getRequired(escrowId);
        return resolutionRepository.findByEscrowIdOrderByIdAsc(escrowId);
    }

    /**
     * Refuses a new decision while an earlier submission may still pay out.
     * <p>
     * An earlier submission is marked FAILED, and a new decision allowed, when
     * it has no transaction reference (the service stopped before the
     * broadcast returned), when its transaction reverted, or when the node no
     * longer knows its transaction. The contract only resolves a DISPUTED
     * trade once, so a late first submission cannot pay out twice.
     */
    private void settlePendingSubmission(Long escrowId) {
        Optional<DisputeResolution> pending = resolutionRepository
                .findFirstByEscrowIdAndStatusOrderByIdDesc(escrowId, ResolutionStatus.SUBMITTED);
        if (pending.isEmpty()) {
            return;
        }
        DisputeResolution resolution = pending.get();
        if (resolution.getTxReference() == null) {
            markFailed(resolution, "Submission has no transaction reference");
            return;
        }

        Optional<LedgerReceipt> receipt = executor.awaitReceipt(resolution.getTxReference());
        if (receipt.isPresent() && !receipt.get().success()) {
            markFailed(resolution, "Reverted: " + receipt.get().revertReason());
            return;
        }
        if (receipt.isEmpty() && !executor.isKnownTransaction(resolution.getTxReference())) {
            markFailed(resolution, "Transaction " + resolution.getTxReference() + " unknown to the ledger node");
            return;
        }
        throw new EscrowValidationException(String.format(
                "Escrow %d has an unresolved submission (resolution %d)", escrowId, resolution.getId()));
    }

    private void markFailed(DisputeResolution resolution, String reason) {
        resolution.setStatus(ResolutionStatus.FAILED);
        resolution.setFailureReason(reason != null && reason.length() > 500 ? reason.substring(0, 500) : reason);
        resolutionRepository.save(resolution);
        failedCounter.increment();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("resolutionId", resolution.getId());
        payload.put("txReference", resolution.getTxReference());
        payload.put("reason", reason);
        store.appendLocalEvent(resolution.getEscrowId(), EscrowEventType.RESOLUTION_FAILED, payload, false);
        log.warn("Dispute resolution {} of escrow {} failed: {}", resolution.getId(), resolution.getEscrowId(), reason);
    }

    private static String requireNamedParty(String requested, String party, String role) {
        if (requested != null && !LedgerAddresses.same(requested, party)) {
            throw new EscrowValidationException("Recipient of this outcome must be the " + role);
        }
        return party;
    }

    private static BigInteger requireFullAmount(BigInteger requested, BigInteger total) {
        if (requested != null && requested.compareTo(total) != 0) {
            throw new EscrowValidationException("Use PARTIAL_SPLIT to pay out less than the full amount");
        }
        return total;
    }
}
