package com.fintech.escrow.service;

import com.fintech.escrow.dto.AgreementReference;
import com.fintech.escrow.dto.EscrowEventView;
import com.fintech.escrow.dto.EscrowPermissions;
import com.fintech.escrow.dto.EscrowView;
import com.fintech.escrow.entity.EscrowRecord;
import com.fintech.escrow.entity.EscrowState;
import com.fintech.escrow.exception.EscrowNotFoundException;
import com.fintech.escrow.exception.EscrowValidationException;
import com.fintech.escrow.ledger.LedgerAddresses;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * Escrow lifecycle entry points for the marketplace: creation from an
 * agreement, reads with per-actor permissions, and manual review.
 */
@Service
@Slf4j
public class EscrowService {

    private final EscrowRecordStore store;

    @Value("${escrow.max-amount-wei:1000000000000000000000000}")
    private BigInteger maxAmountWei;

    @Value("${escrow.funding.max-verification-attempts:5}")
    private int maxVerificationAttempts;

    public EscrowService(EscrowRecordStore store) {
        this.store = store;
    }

    /**
     * Opens an escrow for an agreement.
     *
     * @throws EscrowValidationException if the agreement is malformed or already has an escrow
     */
    public EscrowView create(AgreementReference agreement) {
        if (Objects.equals(agreement.getBuyerId(), agreement.getSellerId())) {
            throw new EscrowValidationException("Buyer and seller must be different users");
        }
        String buyer = requireAddress(agreement.getBuyerAddress(), "buyer");
        String seller = requireAddress(agreement.getSellerAddress(), "seller");
        if (buyer.equals(seller)) {
            throw new EscrowValidationException("Buyer and seller cannot share a ledger address");
        }
        BigInteger amount = agreement.getAgreedAmountWei();
        if (amount == null || amount.signum() <= 0) {
            throw new EscrowValidationException("Agreed amount must be positive");
        }
        if (amount.compareTo(maxAmountWei) > 0) {
            throw new EscrowValidationException(
                    String.format("Agreed amount %s wei exceeds the limit of %s wei", amount, maxAmountWei));
        }

        EscrowRecord created = store.create(EscrowRecord.builder()
                .agreementId(agreement.getAgreementId())
                .buyerId(agreement.getBuyerId())
                .sellerId(agreement.getSellerId())
                .buyerAddress(buyer)
                .sellerAddress(seller)
                .amountWei(amount)
                .build());
        return toView(created, agreement.getBuyerId());
    }

    public EscrowView getView(Long escrowId, Long actorId) {
        return toView(store.getRequired(escrowId), actorId);
    }

    public EscrowView getViewByAgreement(String agreementId, Long actorId) {
        EscrowRecord record = store.findByAgreementId(agreementId)
                .orElseThrow(() -> new EscrowNotFoundException("No escrow for agreement " + agreementId));
        return toView(record, actorId);
    }

    /**
     * Escrows the actor takes part in as buyer or seller, optionally narrowed
     * to one state. Each view carries the actor's permissions.
     */
    public Page<EscrowView> list(Long actorId, EscrowState state, Pageable pageable) {
        return store.findByParticipant(actorId, state, pageable)
                .map(record -> toView(record, actorId));
    }

    public List<EscrowEventView> events(Long escrowId) {
        store.getRequired(escrowId);
        return store.events(escrowId).stream()
                .map(EscrowEventView::from)
                .toList();
    }

    /** Records on consistency hold or out of verification attempts. */
    public List<EscrowView> needingReview() {
        return toViews(store.findNeedingManualReview(maxVerificationAttempts));
    }

    public EscrowView releaseHold(Long escrowId, Long adminId, String note) {
        return toView(store.releaseHold(escrowId, adminId, note), null);
    }

    public List<EscrowView> toViews(List<EscrowRecord> records) {
        return records.stream()
                .map(record -> toView(record, null))
                .toList();
    }

    /**
     * Snapshot of the record with permissions computed for {@code actorId}
     * at the current instant. Permissions are all false without an actor.
     */
    public EscrowView toView(EscrowRecord record, Long actorId) {
        LocalDateTime now = store.now();
        return EscrowView.builder()
                .id(record.getId())
                .agreementId(record.getAgreementId())
                .buyerId(record.getBuyerId())
                .sellerId(record.getSellerId())
                .buyerAddress(record.getBuyerAddress())
                .sellerAddress(record.getSellerAddress())
                .amountWei(record.getAmountWei())
                .state(record.getState())
                .provisional(record.isProvisional())
                .ledgerTradeId(record.getLedgerTradeId())
                .fundingTxReference(record.getFundingTxReference())
                .fundingPath(record.getFundingPath())
                .ledgerBuyerAddress(record.getLedgerBuyerAddress())
                .verificationAttempts(record.getVerificationAttempts() == null ? 0 : record.getVerificationAttempts())
                .lastError(record.getLastError())
                .consistencyHold(record.isConsistencyHold())
                .holdReason(record.getHoldReason())
                .disputeReason(record.getDisputeReason())
                .resolutionOutcome(record.getResolutionOutcome())
                .ledgerTimeoutAt(record.getLedgerTimeoutAt())
                .createdAt(record.getCreatedAt())
                .fundedAt(record.getFundedAt())
                .disputedAt(record.getDisputedAt())
                .completedAt(record.getCompletedAt())
                .updatedAt(record.getUpdatedAt())
                .permissions(EscrowPermissions.compute(record, actorId, now))
                .build();
    }

    private static String requireAddress(String address, String role) {
        if (!LedgerAddresses.isValid(address) || LedgerAddresses.isZero(address)) {
            throw new EscrowValidationException("Invalid " + role + " address: " + address);
        }
        return LedgerAddresses.normalize(address);
    }
}
