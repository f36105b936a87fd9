package com.fintech.escrow.ledger;

import java.math.BigInteger;

/**
 * Execution environment of one contract call: sender, attached value,
 * block time, plus buffers for outgoing transfers and emitted events.
 * <p>
 * Transfers and events only take effect if the call completes without a
 * {@link LedgerRevertException}.
 */
public interface CallContext {

    String sender();

    BigInteger value();

    /** Block timestamp in epoch seconds. */
    long timestamp();

    /**
     * Queues a transfer out of the contract.
     *
     * @throws LedgerRevertException if the recipient does not accept value
     */
    void transfer(String to, BigInteger amount);

    void emit(LedgerEvent event);
}
