package com.fintech.escrow.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Local mirror of one escrowed trade.
 * <p>
 * The ledger is authoritative for money; this record is authoritative for
 * queries. Amounts are exact integers in wei. Records are never deleted.
 */
@Entity
@Table(name = "escrow_records", indexes = {
        @Index(name = "idx_escrow_state", columnList = "state"),
        @Index(name = "idx_escrow_agreement", columnList = "agreement_id", unique = true),
        @Index(name = "idx_escrow_ledger_trade", columnList = "ledger_trade_id", unique = true),
        @Index(name = "idx_escrow_state_funded_at", columnList = "state, funded_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscrowRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "agreement_id", nullable = false, unique = true, length = 100)
    private String agreementId;

    @Column(name = "buyer_id", nullable = false)
    private Long buyerId;

    @Column(name = "seller_id", nullable = false)
    private Long sellerId;

    @Column(name = "buyer_address", nullable = false, length = 42)
    private String buyerAddress;

    @Column(name = "seller_address", nullable = false, length = 42)
    private String sellerAddress;

    @Column(name = "amount_wei", nullable = false, precision = 38, scale = 0)
    private BigInteger amountWei;

    @Column(name = "ledger_trade_id", unique = true)
    private Long ledgerTradeId;

    @Column(name = "funding_tx_reference", length = 66)
    private String fundingTxReference;

    @Enumerated(EnumType.STRING)
    @Column(name = "funding_path", length = 20)
    private FundingPath fundingPath;

    /** Address recorded as buyer on the ledger; the platform address for custodial funding. */
    @Column(name = "ledger_buyer_address", length = 42)
    private String ledgerBuyerAddress;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private EscrowState state;

    /** Set by local writers, cleared once the ledger event confirming the write is reconciled. */
    @Column(nullable = false)
    @Builder.Default
    private boolean provisional = false;

    @Column(name = "verification_attempts")
    @Builder.Default
    private Integer verificationAttempts = 0;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @Column(name = "consistency_hold", nullable = false)
    @Builder.Default
    private boolean consistencyHold = false;

    @Column(name = "hold_reason", length = 500)
    private String holdReason;

    @Column(name = "dispute_reason", length = 1000)
    private String disputeReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "resolution_outcome", length = 30)
    private ResolutionOutcome resolutionOutcome;

    @Column(name = "ledger_timeout_at")
    private LocalDateTime ledgerTimeoutAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "funded_at")
    private LocalDateTime fundedAt;

    @Column(name = "disputed_at")
    private LocalDateTime disputedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(ZoneOffset.UTC);
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }

    public void incrementVerificationAttempts() {
        this.verificationAttempts = (this.verificationAttempts == null ? 0 : this.verificationAttempts) + 1;
    }

    /**
     * Buyer as seen by the contract: the platform address for custodial
     * funding, otherwise the buyer's own address.
     */
    public String effectiveLedgerBuyer() {
        return ledgerBuyerAddress != null ? ledgerBuyerAddress : buyerAddress;
    }
}
