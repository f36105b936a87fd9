package com.fintech.escrow.exception;

public class EscrowNotFoundException extends EscrowException {

    public EscrowNotFoundException(Long escrowId) {
        super("Escrow not found: " + escrowId, FailureStep.LOOKUP);
    }

    public EscrowNotFoundException(String message) {
        super(message, FailureStep.LOOKUP);
    }
}
