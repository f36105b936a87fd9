package com.fintech.escrow.ledger;

import java.util.List;
import java.util.Optional;

/**
 * Interface to one ledger connection hosting the escrow contract.
 * <p>
 * Implementations:
 * - {@link SimulatedLedger}: in-process chain for local runs and tests
 * - {@link Web3jLedgerClient}: JSON-RPC client for a deployed contract
 * <p>
 * I/O failures surface as
 * {@link com.fintech.escrow.exception.LedgerSubmissionException}.
 */
public interface LedgerClient {

    /** Stable name of this connection, used to key the reconciler cursor. */
    String getConnectionName();

    String getContractAddress();

    long latestBlockNumber();

    /**
     * Receipt of a mined transaction, empty if the ledger does not know the
     * reference or has not mined it yet.
     */
    Optional<LedgerReceipt> getReceipt(String txReference);

    /**
     * Contract events in blocks {@code [fromBlock, toBlock]}, ordered by block
     * then log index.
     */
    List<LoggedEvent> getEvents(long fromBlock, long toBlock);

    /**
     * True if the node has the transaction, mined or pending. False once a
     * broadcast transaction was dropped.
     */
    boolean isKnownTransaction(String txReference);

    /**
     * Signs and broadcasts a contract call.
     *
     * @return the transaction reference
     */
    String submit(LedgerCall call, TransactionSigner signer);

    Optional<Trade> getTrade(long tradeId);

    boolean isAvailable();
}
