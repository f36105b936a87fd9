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
 * An administrator's decision on a disputed escrow and its submission to the
 * ledger. Immutable once CONFIRMED.
 */
@Entity
@Table(name = "dispute_resolutions", indexes = {
        @Index(name = "idx_resolution_escrow_status", columnList = "escrow_id, status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DisputeResolution {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "escrow_id", nullable = false)
    private Long escrowId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    private ResolutionOutcome outcome;

    @Column(name = "recipient_address", nullable = false, length = 42)
    private String recipientAddress;

    @Column(name = "recipient_amount_wei", nullable = false, precision = 38, scale = 0)
    private BigInteger recipientAmountWei;

    @Column(name = "counterparty_address", nullable = false, length = 42)
    private String counterpartyAddress;

    @Column(name = "counterparty_amount_wei", nullable = false, precision = 38, scale = 0)
    private BigInteger counterpartyAmountWei;

    @Column(length = 1000)
    private String note;

    @Column(name = "admin_id", nullable = false)
    private Long adminId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ResolutionStatus status;

    @Column(name = "tx_reference", length = 66)
    private String txReference;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "confirmed_at")
    private LocalDateTime confirmedAt;

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
}
