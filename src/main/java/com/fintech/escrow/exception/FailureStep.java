package com.fintech.escrow.exception;

/**
 * Step of an escrow operation that failed, reported to callers alongside
 * the error message.
 */
public enum FailureStep {
    VALIDATION("validation"),
    LOOKUP("lookup"),
    FUNDING("funding"),
    VERIFICATION("verification"),
    LEDGER_SUBMISSION("ledger_submission"),
    STATE_CONFLICT("state_conflict"),
    CONSISTENCY_CHECK("consistency_check"),
    RECONCILIATION("reconciliation");

    private final String code;

    FailureStep(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
