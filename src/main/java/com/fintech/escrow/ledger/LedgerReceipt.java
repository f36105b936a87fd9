package com.fintech.escrow.ledger;

import java.math.BigInteger;
import java.util.List;

/**
 * Receipt of a mined ledger transaction. A reverted transaction has
 * {@code success == false} and no events.
 */
public record LedgerReceipt(String txReference,
                            long blockNumber,
                            String blockHash,
                            boolean success,
                            String from,
                            String to,
                            BigInteger value,
                            String revertReason,
                            List<LoggedEvent> events) {
}
