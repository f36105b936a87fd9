package com.fintech.escrow.ledger;

/**
 * A contract event together with where it was logged on the ledger.
 * (txReference, logIndex) identifies the event uniquely.
 */
public record LoggedEvent(LedgerEvent event,
                          String txReference,
                          long blockNumber,
                          String blockHash,
                          long logIndex) {
}
