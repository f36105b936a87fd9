package com.fintech.escrow.service;

import com.fintech.escrow.config.LedgerProperties;
import com.fintech.escrow.exception.LedgerSubmissionException;
import com.fintech.escrow.ledger.LedgerCall;
import com.fintech.escrow.ledger.LedgerClient;
import com.fintech.escrow.ledger.LedgerReceipt;
import com.fintech.escrow.ledger.TransactionSigner;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Submits platform-signed calls through the ledger circuit breaker and waits
 * for their outcome within a bounded time.
 * <p>
 * Never called inside a database transaction.
 */
@Component
@Slf4j
public class LedgerTransactionExecutor {

    private static final String LEDGER_POLL = "ledgerPoll";

    private final LedgerClient ledgerClient;
    private final TransactionSigner platformSigner;
    private final CircuitBreaker ledgerCircuitBreaker;
    private final LedgerProperties properties;

    public LedgerTransactionExecutor(LedgerClient ledgerClient,
                                     TransactionSigner platformSigner,
                                     CircuitBreaker ledgerCircuitBreaker,
                                     LedgerProperties properties) {
        this.ledgerClient = ledgerClient;
        this.platformSigner = platformSigner;
        this.ledgerCircuitBreaker = ledgerCircuitBreaker;
        this.properties = properties;
    }

    public String platformAddress() {
        return platformSigner.getAddress();
    }

    public String connectionName() {
        return ledgerClient.getConnectionName();
    }

    /**
     * Signs with the platform key and broadcasts.
     *
     * @return the transaction reference
     * @throws LedgerSubmissionException if the node is unreachable, rejects the
     *                                   transaction or the circuit is open
     */
    public String submit(LedgerCall call) {
        try {
            return ledgerCircuitBreaker.executeSupplier(() -> ledgerClient.submit(call, platformSigner));
        } catch (CallNotPermittedException e) {
            log.warn("Ledger circuit breaker open, {} not submitted", call.getFunction().getWireName());
            throw new LedgerSubmissionException(
                    "Ledger circuit breaker is open. Submission not attempted.",
                    ledgerClient.getConnectionName(), null, true);
        }
    }

    /**
     * Polls for the receipt until it is mined or the configured wait elapses.
     */
    public Optional<LedgerReceipt> awaitReceipt(String txReference) {
        Optional<LedgerReceipt> receipt = pollUntil(() -> ledgerClient.getReceipt(txReference), Optional::isPresent);
        if (receipt.isEmpty()) {
            log.warn("No receipt for {} within {}ms", txReference, properties.getReceiptWaitMs());
        }
        return receipt;
    }

    /**
     * True if the node has the transaction, mined or still pending. A
     * transaction it does not know was dropped or never broadcast.
     */
    public boolean isKnownTransaction(String txReference) {
        return ledgerClient.isKnownTransaction(txReference);
    }

    /**
     * Calls {@code poll} until {@code done} accepts its value or the
     * configured wait elapses, and returns the last value seen. Exceptions
     * from the poll are not retried.
     */
    public <T> T pollUntil(Supplier<T> poll, Predicate<T> done) {
        long pollMs = Math.max(1L, properties.getReceiptPollMs());
        int maxAttempts = (int) Math.max(1L, properties.getReceiptWaitMs() / pollMs + 1);

        RetryConfig config = RetryConfig.<T>custom()
                .maxAttempts(maxAttempts)
                .waitDuration(Duration.ofMillis(pollMs))
                .retryOnResult(value -> !done.test(value))
                .retryOnException(e -> false)
                .build();
        return Retry.of(LEDGER_POLL, config).executeSupplier(poll);
    }
}
