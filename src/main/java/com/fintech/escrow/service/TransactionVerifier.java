package com.fintech.escrow.service;

import com.fintech.escrow.config.LedgerProperties;
import com.fintech.escrow.dto.ExpectedFunding;
import com.fintech.escrow.dto.VerificationResult;
import com.fintech.escrow.dto.VerificationResult.FailureReason;
import com.fintech.escrow.ledger.LedgerAddresses;
import com.fintech.escrow.ledger.LedgerClient;
import com.fintech.escrow.ledger.LedgerEvent;
import com.fintech.escrow.ledger.LedgerReceipt;
import com.fintech.escrow.ledger.LoggedEvent;
import com.fintech.escrow.ledger.Trade;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Confirms that a submitted transaction funds the expected trade between the
 * expected parties for the exact expected amount.
 * <p>
 * Verification never trusts the caller's claim about a transaction; it only
 * trusts the receipt and the events the escrow contract logged in it.
 * Ledger I/O failures propagate as
 * {@link com.fintech.escrow.exception.LedgerSubmissionException}.
 */
@Service
@Slf4j
public class TransactionVerifier {

    private final LedgerClient ledgerClient;
    private final LedgerProperties ledgerProperties;
    private final MeterRegistry meterRegistry;

    private Counter verifiedCounter;
    private Counter rejectedCounter;

    public TransactionVerifier(LedgerClient ledgerClient,
                               LedgerProperties ledgerProperties,
                               MeterRegistry meterRegistry) {
        this.ledgerClient = ledgerClient;
        this.ledgerProperties = ledgerProperties;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        verifiedCounter = Counter.builder("escrow.funding.verification.verified")
                .description("Funding transactions verified against an escrow record")
                .register(meterRegistry);

        rejectedCounter = Counter.builder("escrow.funding.verification.rejected")
                .description("Funding transactions that failed verification")
                .register(meterRegistry);
    }

    public VerificationResult verify(String txReference, ExpectedFunding expected) {
        log.debug("Verifying funding tx {} against {}", txReference, expected);

        // 1. Receipt and inclusion block
        Optional<LedgerReceipt> found = ledgerClient.getReceipt(txReference);
        if (found.isEmpty()) {
            return reject(txReference, FailureReason.NOT_FOUND, "Transaction not found on ledger");
        }
        LedgerReceipt receipt = found.get();
        if (!receipt.success()) {
            return reject(txReference, FailureReason.REVERTED,
                    "Transaction reverted" + (receipt.revertReason() != null ? ": " + receipt.revertReason() : ""));
        }

        // 2. Confirmation depth
        long confirmations = ledgerClient.latestBlockNumber() - receipt.blockNumber();
        int required = ledgerProperties.getConfirmations();
        if (confirmations < required) {
            return reject(txReference, FailureReason.INSUFFICIENT_CONFIRMATIONS,
                    String.format("Transaction has %d of %d required confirmations", confirmations, required));
        }

        // 3. Funding events logged by the escrow contract in this transaction
        List<LedgerEvent.Funded> fundedEvents = new ArrayList<>();
        List<LedgerEvent.EscrowCreated> createdEvents = new ArrayList<>();
        for (LoggedEvent logged : receipt.events()) {
            if (logged.event() instanceof LedgerEvent.Funded) {
                fundedEvents.add((LedgerEvent.Funded) logged.event());
            } else if (logged.event() instanceof LedgerEvent.EscrowCreated) {
                createdEvents.add((LedgerEvent.EscrowCreated) logged.event());
            }
        }
        if (fundedEvents.isEmpty()) {
            return reject(txReference, FailureReason.NO_FUNDING_EVENT,
                    "Transaction does not fund any escrow trade");
        }

        // 4. Trade, parties and amount
        LedgerEvent.Funded funded = fundedEvents.get(0);
        if (expected.getTradeId() != null) {
            Optional<LedgerEvent.Funded> matching = fundedEvents.stream()
                    .filter(event -> event.tradeId() == expected.getTradeId())
                    .findFirst();
            if (matching.isEmpty()) {
                return reject(txReference, FailureReason.TRADE_MISMATCH,
                        String.format("Transaction funds trade %d, expected trade %d",
                                funded.tradeId(), expected.getTradeId()));
            }
            funded = matching.get();
        }

        if (!LedgerAddresses.same(funded.payer(), expected.getBuyerAddress())) {
            return reject(txReference, FailureReason.PARTY_MISMATCH,
                    String.format("Trade %d was funded by %s, expected buyer %s",
                            funded.tradeId(), funded.payer(), expected.getBuyerAddress()));
        }

        if (funded.amount().compareTo(expected.getAmountWei()) != 0) {
            return reject(txReference, FailureReason.AMOUNT_MISMATCH,
                    String.format("Trade %d was funded with %s wei, expected %s wei",
                            funded.tradeId(), funded.amount(), expected.getAmountWei()));
        }

        long tradeId = funded.tradeId();
        Optional<String> seller = createdEvents.stream()
                .filter(event -> event.tradeId() == tradeId)
                .map(LedgerEvent.EscrowCreated::seller)
                .findFirst();
        if (seller.isEmpty()) {
            seller = ledgerClient.getTrade(tradeId).map(Trade::getSeller);
        }
        if (seller.isEmpty() || !LedgerAddresses.same(seller.get(), expected.getSellerAddress())) {
            return reject(txReference, FailureReason.PARTY_MISMATCH,
                    String.format("Trade %d seller is %s, expected %s",
                            tradeId, seller.orElse("unknown"), expected.getSellerAddress()));
        }

        // 5. Verified
        verifiedCounter.increment();
        log.info("Funding tx {} verified for trade {} with {} confirmations", txReference, tradeId, confirmations);
        return VerificationResult.success(txReference, tradeId, receipt.blockNumber(), confirmations);
    }

    private VerificationResult reject(String txReference, FailureReason reason, String message) {
        rejectedCounter.increment();
        if (reason.isTransient()) {
            log.debug("Funding tx {} not verifiable yet ({}): {}", txReference, reason, message);
        } else {
            log.warn("Funding tx {} rejected ({}): {}", txReference, reason, message);
        }
        return VerificationResult.failure(txReference, reason, message);
    }
}
