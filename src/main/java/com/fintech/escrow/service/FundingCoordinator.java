package com.fintech.escrow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.escrow.dto.ExpectedFunding;
import com.fintech.escrow.dto.FundingRequest;
import com.fintech.escrow.dto.FundingResult;
import com.fintech.escrow.dto.VerificationResult;
import com.fintech.escrow.dto.VerificationResult.FailureReason;
import com.fintech.escrow.entity.EscrowEventType;
import com.fintech.escrow.entity.EscrowRecord;
import com.fintech.escrow.entity.EscrowState;
import com.fintech.escrow.entity.FundingPath;
import com.fintech.escrow.exception.EscrowConsistencyException;
import com.fintech.escrow.exception.EscrowValidationException;
import com.fintech.escrow.exception.FailureStep;
import com.fintech.escrow.exception.FundingVerificationException;
import com.fintech.escrow.exception.LedgerSubmissionException;
import com.fintech.escrow.exception.StaleEscrowStateException;
import com.fintech.escrow.ledger.LedgerCall;
import com.fintech.escrow.ledger.LedgerClient;
import com.fintech.escrow.ledger.Trade;
import com.fintech.escrow.service.EscrowRecordStore.TransitionOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Moves value into escrow and records it locally once verified.
 * <p>
 * Two funding paths:
 * 1. SELF_CUSTODIAL: the buyer signed and broadcast the transaction; we only verify it
 * 2. CUSTODIAL: the platform signs {@code createAndFund} with its own key and becomes
 * the on-ledger buyer. Every audit row of this path is marked custodial
 * <p>
 * A verified funding is written as a provisional FUNDED state. The event
 * reconciler clears the flag when the ledger echo arrives. A failed
 * verification parks the record in PENDING_VERIFICATION until the retry job
 * or a new intent verifies it, up to a bounded number of attempts.
 * <p>
 * Ledger I/O never runs inside a database transaction.
 */
@Service
@Slf4j
public class FundingCoordinator {

    private static final Pattern TX_REFERENCE = Pattern.compile("^0x[0-9a-fA-F]{64}$");

    private final EscrowRecordStore store;
    private final TransactionVerifier verifier;
    private final LedgerTransactionExecutor executor;
    private final LedgerClient ledgerClient;
    private final EventReconciler eventReconciler;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Value("${escrow.funding.max-verification-attempts:5}")
    private int maxVerificationAttempts;

    private Counter selfCustodialIntentCounter;
    private Counter custodialIntentCounter;
    private Counter fundedCounter;
    private Counter pendingCounter;
    private Counter exhaustedCounter;
    private Timer custodialFundingTimer;

    public FundingCoordinator(EscrowRecordStore store,
                              TransactionVerifier verifier,
                              LedgerTransactionExecutor executor,
                              LedgerClient ledgerClient,
                              EventReconciler eventReconciler,
                              ObjectMapper objectMapper,
                              MeterRegistry meterRegistry) {
        this.store = store;
        this.verifier = verifier;
        this.executor = executor;
        this.ledgerClient = ledgerClient;
        this.eventReconciler = eventReconciler;
        this.objectMapper = objectMapper;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        selfCustodialIntentCounter = Counter.builder("escrow.funding.intents")
                .tag("path", FundingPath.SELF_CUSTODIAL.name())
                .description("Funding intents received")
                .register(meterRegistry);

        custodialIntentCounter = Counter.builder("escrow.funding.intents")
                .tag("path", FundingPath.CUSTODIAL.name())
                .description("Funding intents received")
                .register(meterRegistry);

        fundedCounter = Counter.builder("escrow.funding.funded")
                .description("Escrows marked funded after verification")
                .register(meterRegistry);

        pendingCounter = Counter.builder("escrow.funding.pending_verification")
                .description("Funding attempts left pending verification")
                .register(meterRegistry);

        exhaustedCounter = Counter.builder("escrow.funding.attempts_exhausted")
                .description("Escrows that used up their verification attempts")
                .register(meterRegistry);

        custodialFundingTimer = Timer.builder("escrow.funding.custodial.duration")
                .description("Time from custodial submission to a verification outcome")
                .register(meterRegistry);
    }

    /**
     * Handles a funding intent.
     *
     * @return the funded record, or the pending record with the reason verification failed
     * @throws EscrowValidationException    if the intent is malformed or the record cannot be funded
     * @throws EscrowConsistencyException   if the record is on consistency hold
     * @throws FundingVerificationException if verification failed and no attempts remain
     * @throws LedgerSubmissionException    if the custodial submission failed; the record is unchanged
     */
    public FundingResult fund(Long escrowId, FundingRequest request) {
        EscrowRecord record = store.getRequired(escrowId);
        requireNotOnHold(record);

        if (record.getState().isAtOrPast(EscrowState.FUNDED)) {
            if (record.getState() == EscrowState.FUNDED && request.getTxReference() != null
                    && request.getTxReference().equalsIgnoreCase(record.getFundingTxReference())) {
                return fundedResult(record, "Escrow already funded by this transaction");
            }
            throw new EscrowValidationException(
                    String.format("Escrow %d is %s and cannot be funded", escrowId, record.getState()));
        }
        requireAttemptsLeft(record);

        return switch (request.getPath()) {
            case SELF_CUSTODIAL -> {
                selfCustodialIntentCounter.increment();
                yield fundSelfCustodial(record, request.getTxReference());
            }
            case CUSTODIAL -> {
                custodialIntentCounter.increment();
                yield fundCustodial(record);
            }
        };
    }

    /**
     * Re-verifies the stored funding transaction of a pending record once,
     * without waiting. Used by the retry job.
     *
     * @return empty if the record is no longer eligible for a retry
     */
    public Optional<FundingResult> retryVerification(Long escrowId) {
        EscrowRecord record = store.getRequired(escrowId);
        if (record.getState() != EscrowState.PENDING_VERIFICATION
                || record.getFundingTxReference() == null
                || record.isConsistencyHold()
                || record.getVerificationAttempts() >= maxVerificationAttempts) {
            log.debug("Escrow {} no longer eligible for verification retry", escrowId);
            return Optional.empty();
        }

        FundingPath path = record.getFundingPath() != null ? record.getFundingPath() : FundingPath.SELF_CUSTODIAL;
        String txReference = record.getFundingTxReference();
        VerificationResult result = verifier.verify(txReference, expectedFunding(record));
        return Optional.of(applyVerification(record, txReference, path, record.effectiveLedgerBuyer(), result));
    }

    private FundingResult fundSelfCustodial(EscrowRecord record, String txReference) {
        if (txReference == null || !TX_REFERENCE.matcher(txReference).matches()) {
            throw new EscrowValidationException("Self-custodial funding requires a 0x-prefixed 32-byte transaction reference");
        }
        if (record.getFundingPath() == FundingPath.CUSTODIAL && record.getFundingTxReference() != null) {
            throw new EscrowValidationException(String.format(
                    "Escrow %d has a custodial funding transaction awaiting verification", record.getId()));
        }

        log.info("Verifying self-custodial funding of escrow {} with tx {}", record.getId(), txReference);
        ExpectedFunding expected = expectedFunding(record).toBuilder()
                .buyerAddress(record.getBuyerAddress())
                .build();
        VerificationResult result = verifier.verify(txReference, expected);
        return applyVerification(record, txReference, FundingPath.SELF_CUSTODIAL, record.getBuyerAddress(), result);
    }

    private FundingResult fundCustodial(EscrowRecord record) {
        String platform = executor.platformAddress();

        if (record.getFundingTxReference() != null) {
            if (record.getFundingPath() != FundingPath.CUSTODIAL) {
                throw new EscrowValidationException(String.format(
                        "Escrow %d has a self-custodial funding transaction awaiting verification",
                        record.getId()));
            }
            // Already broadcast once: wait on the same transaction, never send a second one
            log.info("Escrow {} already has custodial tx {}, re-verifying", record.getId(),
                    record.getFundingTxReference());
            return awaitCustodialVerification(record, record.getFundingTxReference(), platform);
        }

        LedgerCall call = LedgerCall.createAndFund(record.getSellerAddress(), metadataFor(record), record.getAmountWei());
        String txReference = executor.submit(call);

        EscrowRecord submitted = store.update(record.getId(), r -> {
            r.setFundingTxReference(txReference);
            r.setFundingPath(FundingPath.CUSTODIAL);
            r.setLedgerBuyerAddress(platform);
        });

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("txReference", txReference);
        payload.put("function", call.getFunction().getWireName());
        payload.put("signer", platform);
        payload.put("amountWei", record.getAmountWei().toString());
        payload.put("trustReducing", true);
        store.appendLocalEvent(record.getId(), EscrowEventType.FUNDING_SUBMITTED, payload, true);

        log.info("Submitted custodial funding for escrow {} as {}", record.getId(), txReference);
        return awaitCustodialVerification(submitted, txReference, platform);
    }

    private FundingResult awaitCustodialVerification(EscrowRecord record, String txReference, String platform) {
        ExpectedFunding expected = expectedFunding(record).toBuilder()
                .buyerAddress(platform)
                .build();

        Timer.Sample sample = Timer.start(meterRegistry);
        VerificationResult result = executor.pollUntil(
                () -> verifier.verify(txReference, expected),
                r -> r.isVerified() || !r.getReason().isTransient());
        sample.stop(custodialFundingTimer);

        return applyVerification(record, txReference, FundingPath.CUSTODIAL, platform, result);
    }

    private FundingResult applyVerification(EscrowRecord record, String txReference, FundingPath path,
                                            String ledgerBuyer, VerificationResult result) {
        boolean custodial = path == FundingPath.CUSTODIAL;

        if (result.isVerified()) {
            Optional<EscrowRecord> bound = store.findByLedgerTradeId(result.getTradeId());
            if (bound.isPresent() && !bound.get().getId().equals(record.getId())) {
                result = VerificationResult.failure(txReference, FailureReason.TRADE_ALREADY_BOUND,
                        String.format("Trade %d already funds escrow %d", result.getTradeId(), bound.get().getId()));
            }
        }

        if (!result.isVerified()) {
            return recordFailure(record, txReference, path, ledgerBuyer, result);
        }

        long tradeId = result.getTradeId();
        LocalDateTime ledgerTimeout = fetchLedgerTimeout(tradeId);

        EscrowRecord current = store.getRequired(record.getId());
        if (current.getState().isAtOrPast(EscrowState.FUNDED)) {
            // The reconciler applied the ledger echo first
            log.info("Escrow {} already {} when verification of {} completed",
                    current.getId(), current.getState(), txReference);
            return fundedResult(current, "Escrow already funded");
        }

        EscrowState prior = current.getState();
        TransitionOutcome outcome = store.transition(current.getId(), prior, EscrowState.FUNDED, r -> {
            r.setLedgerTradeId(tradeId);
            r.setFundingTxReference(txReference);
            r.setFundingPath(path);
            r.setLedgerBuyerAddress(ledgerBuyer);
            r.setProvisional(true);
            r.setFundedAt(store.now());
            r.setLastError(null);
            if (ledgerTimeout != null) {
                r.setLedgerTimeoutAt(ledgerTimeout);
            }
        });

        if (outcome == TransitionOutcome.STALE) {
            EscrowRecord fresh = store.refresh(current.getId());
            if (fresh.getState().isAtOrPast(EscrowState.FUNDED)) {
                return fundedResult(fresh, "Escrow already funded");
            }
            throw new StaleEscrowStateException(current.getId(), prior, fresh.getState());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("txReference", txReference);
        payload.put("tradeId", tradeId);
        payload.put("blockNumber", result.getBlockNumber());
        payload.put("confirmations", result.getConfirmations());
        payload.put("path", path.name());
        if (custodial) {
            payload.put("trustReducing", true);
        }
        store.appendLocalEvent(current.getId(), EscrowEventType.FUNDED, payload, custodial);

        fundedCounter.increment();
        log.info("Escrow {} funded via {} on trade {} (provisional)", current.getId(), path, tradeId);

        foldReconciledEvents(current.getId(), tradeId, result.getBlockNumber());
        return fundedResult(store.getRequired(current.getId()), "Funding verified");
    }

    /**
     * The reconciler may have passed the funding blocks before this intent
     * bound the trade, logging its events as unmatched. Folding them now
     * confirms the provisional write; otherwise it is confirmed when the
     * reconciler reaches the blocks.
     */
    private void foldReconciledEvents(Long escrowId, long tradeId, long blockNumber) {
        try {
            eventReconciler.catchUpTrade(tradeId, blockNumber);
        } catch (RuntimeException e) {
            log.warn("Escrow {} stays provisional, catching up trade {} failed: {}",
                    escrowId, tradeId, e.getMessage(), e);
        }
    }

    private FundingResult recordFailure(EscrowRecord record, String txReference, FundingPath path,
                                        String ledgerBuyer, VerificationResult result) {
        String error = result.getReason() + ": " + result.getMessage();
        EscrowRecord updated = store.recordVerificationFailure(record.getId(), txReference, path, ledgerBuyer, error);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("txReference", txReference);
        payload.put("reason", result.getReason().name());
        payload.put("message", result.getMessage());
        payload.put("attempt", updated.getVerificationAttempts());
        if (path == FundingPath.CUSTODIAL) {
            payload.put("trustReducing", true);
        }
        store.appendLocalEvent(record.getId(), EscrowEventType.VERIFICATION_FAILED, payload,
                path == FundingPath.CUSTODIAL);

        if (updated.getVerificationAttempts() >= maxVerificationAttempts) {
            exhaustedCounter.increment();
            log.error("Escrow {} used up {} verification attempts, last failure {}. Needs manual review.",
                    record.getId(), updated.getVerificationAttempts(), error);
            throw new FundingVerificationException(record.getId(), result.getReason(),
                    updated.getVerificationAttempts(),
                    String.format("Funding verification failed after %d attempts: %s",
                            updated.getVerificationAttempts(), result.getMessage()));
        }

        pendingCounter.increment();
        log.warn("Escrow {} pending verification (attempt {}/{}): {}", record.getId(),
                updated.getVerificationAttempts(), maxVerificationAttempts, error);

        return FundingResult.builder()
                .escrowId(updated.getId())
                .state(updated.getState())
                .fundingPath(path)
                .txReference(txReference)
                .ledgerTradeId(updated.getLedgerTradeId())
                .provisional(updated.isProvisional())
                .verificationAttempts(updated.getVerificationAttempts())
                .failedStep(FailureStep.VERIFICATION.getCode())
                .failureReason(result.getReason())
                .message(result.getMessage())
                .build();
    }

    private LocalDateTime fetchLedgerTimeout(long tradeId) {
        try {
            return ledgerClient.getTrade(tradeId).map(Trade::timeoutAtUtc).orElse(null);
        } catch (LedgerSubmissionException e) {
            log.warn("Could not read timeout of trade {}, the reconciler will fill it in: {}",
                    tradeId, e.getMessage());
            return null;
        }
    }

    private ExpectedFunding expectedFunding(EscrowRecord record) {
        return ExpectedFunding.builder()
                .tradeId(record.getLedgerTradeId())
                .buyerAddress(record.effectiveLedgerBuyer())
                .sellerAddress(record.getSellerAddress())
                .amountWei(record.getAmountWei())
                .build();
    }

    private String metadataFor(EscrowRecord record) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("escrowId", record.getId());
        metadata.put("agreementId", record.getAgreementId());
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Trade metadata is not serializable", e);
        }
    }

    private void requireNotOnHold(EscrowRecord record) {
        if (record.isConsistencyHold()) {
            throw new EscrowConsistencyException(record.getId(),
                    "Escrow " + record.getId() + " is on consistency hold: " + record.getHoldReason());
        }
    }

    private void requireAttemptsLeft(EscrowRecord record) {
        if (record.getVerificationAttempts() != null && record.getVerificationAttempts() >= maxVerificationAttempts) {
            throw new FundingVerificationException(record.getId(), null, record.getVerificationAttempts(),
                    String.format("Escrow %d used up its %d verification attempts and needs manual review",
                            record.getId(), maxVerificationAttempts));
        }
    }

    private FundingResult fundedResult(EscrowRecord record, String message) {
        return FundingResult.builder()
                .escrowId(record.getId())
                .state(record.getState())
                .fundingPath(record.getFundingPath())
                .txReference(record.getFundingTxReference())
                .ledgerTradeId(record.getLedgerTradeId())
                .provisional(record.isProvisional())
                .verificationAttempts(record.getVerificationAttempts())
                .message(message)
                .build();
    }
}
