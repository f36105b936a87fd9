package com.fintech.escrow.exception;

import com.fintech.escrow.dto.VerificationResult.FailureReason;

/**
 * Thrown when a funding transaction could not be verified and the record has
 * used up its verification attempts. The record needs manual review.
 */
public class FundingVerificationException extends EscrowException {

    private final Long escrowId;
    private final FailureReason reason;
    private final int attempts;

    public FundingVerificationException(Long escrowId, FailureReason reason, int attempts, String message) {
        super(message, FailureStep.VERIFICATION);
        this.escrowId = escrowId;
        this.reason = reason;
        this.attempts = attempts;
    }

    public Long getEscrowId() {
        return escrowId;
    }

    public FailureReason getReason() {
        return reason;
    }

    public int getAttempts() {
        return attempts;
    }
}
