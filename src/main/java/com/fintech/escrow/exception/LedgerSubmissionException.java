package com.fintech.escrow.exception;

/**
 * Thrown when communication with the ledger fails or a submitted transaction
 * is rejected. This could be due to network issues, timeouts, node downtime
 * or a reverted call.
 */
public class LedgerSubmissionException extends EscrowException {

    private final String connectionName;
    private final String txReference;
    private final boolean isRetryable;

    public LedgerSubmissionException(String message, String connectionName) {
        super(message, FailureStep.LEDGER_SUBMISSION);
        this.connectionName = connectionName;
        this.txReference = null;
        this.isRetryable = true;
    }

    public LedgerSubmissionException(String message, String connectionName, String txReference,
                                     boolean isRetryable) {
        super(message, FailureStep.LEDGER_SUBMISSION);
        this.connectionName = connectionName;
        this.txReference = txReference;
        this.isRetryable = isRetryable;
    }

    public LedgerSubmissionException(String message, String connectionName, Throwable cause) {
        super(message, FailureStep.LEDGER_SUBMISSION, cause);
        this.connectionName = connectionName;
        this.txReference = null;
        this.isRetryable = true;
    }

    public String getConnectionName() {
        return connectionName;
    }

    public String getTxReference() {
        return txReference;
    }

    /**
     * Indicates if this error is transient and the operation can be retried.
     * A reverted transaction is not retryable as-is.
     */
    public boolean isRetryable() {
        return isRetryable;
    }
}
