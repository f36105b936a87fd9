package com.fintech.escrow.exception;

/**
 * The local record disagrees with the ledger. The record is on consistency
 * hold and automated transitions are halted until an administrator releases it.
 */
public class EscrowConsistencyException extends EscrowException {

    private final Long escrowId;

    public EscrowConsistencyException(Long escrowId, String message) {
        super(message, FailureStep.CONSISTENCY_CHECK);
        this.escrowId = escrowId;
    }

    public Long getEscrowId() {
        return escrowId;
    }
}
