package com.fintech.escrow.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigInteger;

/**
 * Configuration for the ledger connection hosting the escrow contract.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "escrow.ledger")
public class LedgerProperties {

    public static final String MODE_SIMULATED = "simulated";
    public static final String MODE_WEB3J = "web3j";

    /** {@code simulated} or {@code web3j}. */
    private String mode = MODE_SIMULATED;
    private String connectionName = "simulated-local";
    private String nodeUrl = "http://localhost:8545";
    private String contractAddress;
    private long chainId = 31337L;
    private String platformPrivateKey;
    private String feeRecipient;
    private long gasPrice = 20_000_000_000L; // 20 Gwei
    private long gasLimit = 500_000L;

    /** Blocks on top of the inclusion block before a transaction counts as final. */
    private int confirmations = 3;

    private long receiptWaitMs = 30_000L;
    private long receiptPollMs = 1_000L;

    /** Balance credited to the platform account when the simulated ledger starts. */
    private BigInteger simulatedPlatformBalanceWei = new BigInteger("1000000000000000000000");
}
