package com.fintech.escrow.dto;

import com.fintech.escrow.entity.EscrowState;
import com.fintech.escrow.entity.FundingPath;
import com.fintech.escrow.entity.ResolutionOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;
import java.time.LocalDateTime;

/**
 * Full state of an escrow as returned to the marketplace and UI layers.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscrowView {
    private Long id;
    private String agreementId;
    private Long buyerId;
    private Long sellerId;
    private String buyerAddress;
    private String sellerAddress;
    private BigInteger amountWei;
    private EscrowState state;
    private boolean provisional;
    private Long ledgerTradeId;
    private String fundingTxReference;
    private FundingPath fundingPath;
    private String ledgerBuyerAddress;
    private int verificationAttempts;
    private String lastError;
    private boolean consistencyHold;
    private String holdReason;
    private String disputeReason;
    private ResolutionOutcome resolutionOutcome;
    private LocalDateTime ledgerTimeoutAt;
    private LocalDateTime createdAt;
    private LocalDateTime fundedAt;
    private LocalDateTime disputedAt;
    private LocalDateTime completedAt;
    private LocalDateTime updatedAt;
    private EscrowPermissions permissions;
}
