package com.fintech.escrow.dto;

import com.fintech.escrow.dto.VerificationResult.FailureReason;
import com.fintech.escrow.entity.EscrowState;
import com.fintech.escrow.entity.FundingPath;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to a funding intent. A record that is not yet verified comes back
 * as PENDING_VERIFICATION with the step and reason that held it up.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FundingResult {
    private Long escrowId;
    private EscrowState state;
    private FundingPath fundingPath;
    private String txReference;
    private Long ledgerTradeId;
    private boolean provisional;
    private int verificationAttempts;
    private String failedStep;
    private FailureReason failureReason;
    private String message;
}
