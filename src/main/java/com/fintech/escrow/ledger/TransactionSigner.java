package com.fintech.escrow.ledger;

import org.web3j.crypto.RawTransaction;

/**
 * Signing capability for the platform key.
 * <p>
 * The key never leaves the implementation: callers only see the address and
 * the signed bytes, so a hardware-backed signer can replace the default one.
 */
public interface TransactionSigner {

    /** Ledger address controlled by this signer. */
    String getAddress();

    /** Signs the transaction for the given chain (EIP-155). */
    byte[] sign(RawTransaction transaction, long chainId);
}
