package com.fintech.escrow.exception;

public class ReconciliationInProgressException extends EscrowException {

    public ReconciliationInProgressException(String message) {
        super(message, FailureStep.RECONCILIATION);
    }
}
