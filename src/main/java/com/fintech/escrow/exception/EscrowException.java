package com.fintech.escrow.exception;

/**
 * Base exception for escrow settlement errors.
 */
public class EscrowException extends RuntimeException {

    private final FailureStep step;

    public EscrowException(String message, FailureStep step) {
        super(message);
        this.step = step;
    }

    public EscrowException(String message, FailureStep step, Throwable cause) {
        super(message, cause);
        this.step = step;
    }

    public FailureStep getStep() {
        return step;
    }
}
