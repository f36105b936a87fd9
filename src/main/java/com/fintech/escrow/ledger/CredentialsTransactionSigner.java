package com.fintech.escrow.ledger;

import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;

import java.util.Locale;

/**
 * Signs with an in-memory key pair loaded from configuration.
 */
public class CredentialsTransactionSigner implements TransactionSigner {

    private final Credentials credentials;

    public CredentialsTransactionSigner(String privateKey) {
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalArgumentException("Platform private key is not configured");
        }
        this.credentials = Credentials.create(privateKey);
    }

    @Override
    public String getAddress() {
        return credentials.getAddress().toLowerCase(Locale.ROOT);
    }

    @Override
    public byte[] sign(RawTransaction transaction, long chainId) {
        return TransactionEncoder.signMessage(transaction, chainId, credentials);
    }
}
