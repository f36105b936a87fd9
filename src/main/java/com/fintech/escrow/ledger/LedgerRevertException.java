package com.fintech.escrow.ledger;

/**
 * Raised inside the contract when a require check fails. The enclosing
 * transaction is reverted as a whole.
 */
public class LedgerRevertException extends RuntimeException {

    public LedgerRevertException(String reason) {
        super(reason);
    }

    public String getReason() {
        return getMessage();
    }
}
