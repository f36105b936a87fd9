package com.fintech.escrow.exception;

import com.fintech.escrow.entity.EscrowState;

/**
 * The record moved on since the caller read it. Re-read and decide again.
 */
public class StaleEscrowStateException extends EscrowException {

    private final Long escrowId;
    private final EscrowState expected;
    private final EscrowState actual;

    public StaleEscrowStateException(Long escrowId, EscrowState expected, EscrowState actual) {
        super(String.format("Escrow %d is %s, expected %s", escrowId, actual, expected),
                FailureStep.STATE_CONFLICT);
        this.escrowId = escrowId;
        this.expected = expected;
        this.actual = actual;
    }

    public StaleEscrowStateException(Long escrowId, String message) {
        super(message, FailureStep.STATE_CONFLICT);
        this.escrowId = escrowId;
        this.expected = null;
        this.actual = null;
    }

    public Long getEscrowId() {
        return escrowId;
    }

    public EscrowState getExpected() {
        return expected;
    }

    public EscrowState getActual() {
        return actual;
    }
}
