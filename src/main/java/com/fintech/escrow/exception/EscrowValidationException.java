package com.fintech.escrow.exception;

/**
 * Input or precondition failure. Nothing was applied locally or submitted
 * to the ledger.
 */
public class EscrowValidationException extends EscrowException {

    public EscrowValidationException(String message) {
        super(message, FailureStep.VALIDATION);
    }
}
