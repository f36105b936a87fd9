package com.fintech.escrow.config;

import com.fintech.escrow.ledger.CredentialsTransactionSigner;
import com.fintech.escrow.ledger.LedgerClient;
import com.fintech.escrow.ledger.SimulatedLedger;
import com.fintech.escrow.ledger.TransactionSigner;
import com.fintech.escrow.ledger.Web3jLedgerClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

import java.time.Clock;

/**
 * Wires the ledger connection selected by {@code escrow.ledger.mode}.
 * <p>
 * In simulated mode the platform signer owns the in-process contract, so it
 * can resolve disputes the same way it would on a deployed contract.
 */
@Configuration
public class LedgerClientConfig {

    @Bean
    public TransactionSigner platformSigner(LedgerProperties properties) {
        return new CredentialsTransactionSigner(properties.getPlatformPrivateKey());
    }

    @Bean
    @ConditionalOnProperty(name = "escrow.ledger.mode", havingValue = LedgerProperties.MODE_SIMULATED,
            matchIfMissing = true)
    public SimulatedLedger simulatedLedger(LedgerProperties properties, TransactionSigner platformSigner,
                                           Clock clock) {
        SimulatedLedger ledger = new SimulatedLedger(
                properties.getConnectionName(),
                properties.getContractAddress(),
                platformSigner.getAddress(),
                properties.getFeeRecipient(),
                clock);
        ledger.credit(platformSigner.getAddress(), properties.getSimulatedPlatformBalanceWei());
        return ledger;
    }

    @Bean(destroyMethod = "shutdown")
    @ConditionalOnProperty(name = "escrow.ledger.mode", havingValue = LedgerProperties.MODE_WEB3J)
    public Web3j web3j(LedgerProperties properties) {
        return Web3j.build(new HttpService(properties.getNodeUrl()));
    }

    @Bean
    @ConditionalOnProperty(name = "escrow.ledger.mode", havingValue = LedgerProperties.MODE_WEB3J)
    public LedgerClient web3jLedgerClient(Web3j web3j, LedgerProperties properties) {
        return new Web3jLedgerClient(web3j, properties);
    }
}
