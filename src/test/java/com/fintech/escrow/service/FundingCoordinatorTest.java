package com.fintech.escrow.service;

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
import com.fintech.escrow.exception.FundingVerificationException;
import com.fintech.escrow.exception.LedgerSubmissionException;
import com.fintech.escrow.ledger.LedgerCall;
import com.fintech.escrow.ledger.LedgerClient;
import com.fintech.escrow.ledger.LedgerFunction;
import com.fintech.escrow.ledger.Trade;
import com.fintech.escrow.ledger.TradeState;
import com.fintech.escrow.service.EscrowRecordStore.TransitionOutcome;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for FundingCoordinator.
 * <p>
 * Tests cover:
 * - Self-custodial verification and the provisional FUNDED write
 * - Custodial submission without double submission
 * - Failed verification and the attempt bound
 */
@ExtendWith(MockitoExtension.class)
class FundingCoordinatorTest {

    private static final long ESCROW_ID = 1L;
    private static final String TX = "0x" + "b2".repeat(32);
    private static final String BUYER = "0x1111111111111111111111111111111111111111";
    private static final String SELLER = "0x2222222222222222222222222222222222222222";
    private static final String PLATFORM = "0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266";
    private static final BigInteger AMOUNT = new BigInteger("1000000000000000000");
    private static final LocalDateTime NOW = LocalDateTime.of(2026, 1, 1, 12, 0);

    @Mock
    private EscrowRecordStore store;

    @Mock
    private TransactionVerifier verifier;

    @Mock
    private LedgerTransactionExecutor executor;

    @Mock
    private LedgerClient ledgerClient;

    @Mock
    private EventReconciler eventReconciler;

    private FundingCoordinator coordinator;
    private EscrowRecord record;

    @BeforeEach
    void setUp() {
        coordinator = new FundingCoordinator(store, verifier, executor, ledgerClient, eventReconciler,
            new ObjectMapper(), new SimpleMeterRegistry());
        coordinator.initMetrics();
        ReflectionTestUtils.setField(coordinator, "maxVerificationAttempts", 3);

        record = createRecord();
        lenient().when(store.getRequired(ESCROW_ID)).thenReturn(record);
        lenient().when(store.now()).thenReturn(NOW);
    }

    @Nested
    @DisplayName("Self-Custodial Funding Tests")
    class SelfCustodialTests {

        @Test
        @DisplayName("Should mark the escrow FUNDED provisionally once the transaction verifies")
        void shouldFundProvisionally() {
            // Given
            when(verifier.verify(eq(TX), any(ExpectedFunding.class)))
                .thenReturn(VerificationResult.success(TX, 7L, 100L, 3L));
            when(store.findByLedgerTradeId(7L)).thenReturn(Optional.empty());
            when(ledgerClient.getTrade(7L)).thenReturn(Optional.of(trade(7L, 1_767_225_600L)));
            stubTransitionApplies(EscrowState.AWAITING_FUND);

            // When
            FundingResult result = coordinator.fund(ESCROW_ID, request(FundingPath.SELF_CUSTODIAL, TX));

            // Then
            assertThat(result.getState()).isEqualTo(EscrowState.FUNDED);
            assertThat(result.isProvisional()).isTrue();
            assertThat(result.getLedgerTradeId()).isEqualTo(7L);
            assertThat(record.getFundingPath()).isEqualTo(FundingPath.SELF_CUSTODIAL);
            assertThat(record.getLedgerBuyerAddress()).isEqualTo(BUYER);
            assertThat(record.getFundedAt()).isEqualTo(NOW);
            assertThat(record.getLedgerTimeoutAt()).isEqualTo(LocalDateTime.of(2026, 1, 1, 0, 0));

            ArgumentCaptor<ExpectedFunding> expected = ArgumentCaptor.forClass(ExpectedFunding.class);
            verify(verifier).verify(eq(TX), expected.capture());
            assertThat(expected.getValue().getBuyerAddress()).isEqualTo(BUYER);
            assertThat(expected.getValue().getAmountWei()).isEqualTo(AMOUNT);
            verify(store).appendLocalEvent(eq(ESCROW_ID), eq(EscrowEventType.FUNDED), any(), eq(false));
            verify(executor, never()).submit(any());
            verify(eventReconciler).catchUpTrade(7L, 100L);
        }

        @Test
        @DisplayName("Should keep the provisional funding when folding already reconciled events fails")
        void shouldStayFundedWhenCatchUpFails() {
            // Given
            when(verifier.verify(eq(TX), any(ExpectedFunding.class)))
                .thenReturn(VerificationResult.success(TX, 7L, 100L, 3L));
            when(store.findByLedgerTradeId(7L)).thenReturn(Optional.empty());
            when(ledgerClient.getTrade(7L)).thenReturn(Optional.empty());
            stubTransitionApplies(EscrowState.AWAITING_FUND);
            when(eventReconciler.catchUpTrade(7L, 100L))
                .thenThrow(new LedgerSubmissionException("node unreachable", "simulated-test"));

            // When
            FundingResult result = coordinator.fund(ESCROW_ID, request(FundingPath.SELF_CUSTODIAL, TX));

            // Then
            assertThat(result.getState()).isEqualTo(EscrowState.FUNDED);
            assertThat(result.isProvisional()).isTrue();
        }

        @Test
        @DisplayName("Should reject a malformed transaction reference without touching the ledger")
        void shouldRejectMalformedReference() {
            assertThatThrownBy(() -> coordinator.fund(ESCROW_ID, request(FundingPath.SELF_CUSTODIAL, "0x1234")))
                .isInstanceOf(EscrowValidationException.class);

            verifyNoInteractions(verifier);
        }

        @Test
        @DisplayName("Should leave the escrow pending verification on an amount mismatch")
        void shouldStayPendingOnAmountMismatch() {
            // Given
            when(verifier.verify(eq(TX), any(ExpectedFunding.class))).thenReturn(
                VerificationResult.failure(TX, FailureReason.AMOUNT_MISMATCH, "Trade 7 was funded with 5 wei"));
            when(store.recordVerificationFailure(eq(ESCROW_ID), eq(TX), eq(FundingPath.SELF_CUSTODIAL), eq(BUYER), anyString()))
                .thenReturn(pendingRecord(1));

            // When
            FundingResult result = coordinator.fund(ESCROW_ID, request(FundingPath.SELF_CUSTODIAL, TX));

            // Then
            assertThat(result.getState()).isEqualTo(EscrowState.PENDING_VERIFICATION);
            assertThat(result.getFailureReason()).isEqualTo(FailureReason.AMOUNT_MISMATCH);
            assertThat(result.getFailedStep()).isEqualTo("verification");
            assertThat(result.getVerificationAttempts()).isEqualTo(1);
            verify(store, never()).transition(any(), any(), any(), any());
            verify(store).appendLocalEvent(eq(ESCROW_ID), eq(EscrowEventType.VERIFICATION_FAILED), any(), eq(false));
        }

        @Test
        @DisplayName("Should throw once the last verification attempt fails")
        void shouldThrowWhenAttemptsExhausted() {
            // Given
            when(verifier.verify(eq(TX), any(ExpectedFunding.class))).thenReturn(
                VerificationResult.failure(TX, FailureReason.NO_FUNDING_EVENT, "Transaction does not fund any escrow trade"));
            when(store.recordVerificationFailure(eq(ESCROW_ID), eq(TX), any(), any(), anyString()))
                .thenReturn(pendingRecord(3));

            // When / Then
            assertThatThrownBy(() -> coordinator.fund(ESCROW_ID, request(FundingPath.SELF_CUSTODIAL, TX)))
                .isInstanceOf(FundingVerificationException.class)
                .hasMessageContaining("after 3 attempts");
        }

        @Test
        @DisplayName("Should refuse a new intent once attempts are used up")
        void shouldRefuseIntentWithoutAttemptsLeft() {
            record.setState(EscrowState.PENDING_VERIFICATION);
            record.setVerificationAttempts(3);

            assertThatThrownBy(() -> coordinator.fund(ESCROW_ID, request(FundingPath.SELF_CUSTODIAL, TX)))
                .isInstanceOf(FundingVerificationException.class)
                .hasMessageContaining("manual review");
            verifyNoInteractions(verifier);
        }

        @Test
        @DisplayName("Should not bind a trade that already funds another escrow")
        void shouldRefuseTradeBoundElsewhere() {
            // Given
            EscrowRecord other = createRecord();
            other.setId(2L);
            when(verifier.verify(eq(TX), any(ExpectedFunding.class)))
                .thenReturn(VerificationResult.success(TX, 7L, 100L, 3L));
            when(store.findByLedgerTradeId(7L)).thenReturn(Optional.of(other));
            when(store.recordVerificationFailure(eq(ESCROW_ID), eq(TX), any(), any(), anyString()))
                .thenReturn(pendingRecord(1));

            // When
            FundingResult result = coordinator.fund(ESCROW_ID, request(FundingPath.SELF_CUSTODIAL, TX));

            // Then
            assertThat(result.getFailureReason()).isEqualTo(FailureReason.TRADE_ALREADY_BOUND);
            verify(store, never()).transition(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should answer an already funded escrow with the same transaction without re-verifying")
        void shouldBeIdempotentForSameTransaction() {
            record.setState(EscrowState.FUNDED);
            record.setFundingTxReference(TX);
            record.setLedgerTradeId(7L);

            FundingResult result = coordinator.fund(ESCROW_ID, request(FundingPath.SELF_CUSTODIAL, TX));

            assertThat(result.getState()).isEqualTo(EscrowState.FUNDED);
            verifyNoInteractions(verifier);
        }

        @Test
        @DisplayName("Should refuse funding an escrow on consistency hold")
        void shouldRefuseEscrowOnHold() {
            record.setConsistencyHold(true);
            record.setHoldReason("amount mismatch");

            assertThatThrownBy(() -> coordinator.fund(ESCROW_ID, request(FundingPath.SELF_CUSTODIAL, TX)))
                .isInstanceOf(EscrowConsistencyException.class);
        }
    }

    @Nested
    @DisplayName("Custodial Funding Tests")
    class CustodialTests {

        @BeforeEach
        void platformKey() {
            when(executor.platformAddress()).thenReturn(PLATFORM);
            lenient().when(executor.pollUntil(any(), any())).thenAnswer(invocation -> {
                Supplier<?> poll = invocation.getArgument(0);
                return poll.get();
            });
        }

        @Test
        @DisplayName("Should submit createAndFund with the platform key and record the custodial path")
        void shouldSubmitAndFund() {
            // Given
            when(executor.submit(any(LedgerCall.class))).thenReturn(TX);
            when(store.update(eq(ESCROW_ID), any())).thenAnswer(invocation -> {
                Consumer<EscrowRecord> mutator = invocation.getArgument(1);
                mutator.accept(record);
                return record;
            });
            when(verifier.verify(eq(TX), any(ExpectedFunding.class)))
                .thenReturn(VerificationResult.success(TX, 9L, 120L, 3L));
            when(store.findByLedgerTradeId(9L)).thenReturn(Optional.empty());
            when(ledgerClient.getTrade(9L)).thenReturn(Optional.empty());
            stubTransitionApplies(EscrowState.AWAITING_FUND);

            // When
            FundingResult result = coordinator.fund(ESCROW_ID, request(FundingPath.CUSTODIAL, null));

            // Then
            ArgumentCaptor<LedgerCall> call = ArgumentCaptor.forClass(LedgerCall.class);
            verify(executor).submit(call.capture());
            assertThat(call.getValue().getFunction()).isEqualTo(LedgerFunction.CREATE_AND_FUND);
            assertThat(call.getValue().getValue()).isEqualTo(AMOUNT);
            assertThat(call.getValue().stringArgument(0)).isEqualTo(SELLER);
            assertThat(call.getValue().stringArgument(1)).contains("\"escrowId\":1");

            ArgumentCaptor<ExpectedFunding> expected = ArgumentCaptor.forClass(ExpectedFunding.class);
            verify(verifier).verify(eq(TX), expected.capture());
            assertThat(expected.getValue().getBuyerAddress()).isEqualTo(PLATFORM);

            assertThat(result.getState()).isEqualTo(EscrowState.FUNDED);
            assertThat(result.getFundingPath()).isEqualTo(FundingPath.CUSTODIAL);
            assertThat(record.getLedgerBuyerAddress()).isEqualTo(PLATFORM);
            verify(store).appendLocalEvent(eq(ESCROW_ID), eq(EscrowEventType.FUNDING_SUBMITTED), any(), eq(true));
            verify(store).appendLocalEvent(eq(ESCROW_ID), eq(EscrowEventType.FUNDED), any(), eq(true));
        }

        @Test
        @DisplayName("Should re-verify an earlier custodial transaction instead of submitting again")
        void shouldNotSubmitTwice() {
            // Given
            record.setState(EscrowState.PENDING_VERIFICATION);
            record.setVerificationAttempts(1);
            record.setFundingPath(FundingPath.CUSTODIAL);
            record.setFundingTxReference(TX);
            record.setLedgerBuyerAddress(PLATFORM);
            when(verifier.verify(eq(TX), any(ExpectedFunding.class)))
                .thenReturn(VerificationResult.success(TX, 9L, 120L, 3L));
            when(store.findByLedgerTradeId(9L)).thenReturn(Optional.empty());
            when(ledgerClient.getTrade(9L)).thenReturn(Optional.empty());
            stubTransitionApplies(EscrowState.PENDING_VERIFICATION);

            // When
            FundingResult result = coordinator.fund(ESCROW_ID, request(FundingPath.CUSTODIAL, null));

            // Then
            assertThat(result.getState()).isEqualTo(EscrowState.FUNDED);
            verify(executor, never()).submit(any());
        }

        @Test
        @DisplayName("Should leave the record untouched when the submission fails")
        void shouldPropagateSubmissionFailure() {
            // Given
            when(executor.submit(any(LedgerCall.class)))
                .thenThrow(new LedgerSubmissionException("Ledger node is currently unavailable", "simulated-test"));

            // When / Then
            assertThatThrownBy(() -> coordinator.fund(ESCROW_ID, request(FundingPath.CUSTODIAL, null)))
                .isInstanceOf(LedgerSubmissionException.class);
            verify(store, never()).update(any(), any());
            verify(store, never()).appendLocalEvent(any(), any(), any(), anyBoolean());
        }

        @Test
        @DisplayName("Should refuse a custodial intent while a self-custodial transaction is pending")
        void shouldRefuseMixedPaths() {
            record.setState(EscrowState.PENDING_VERIFICATION);
            record.setVerificationAttempts(1);
            record.setFundingPath(FundingPath.SELF_CUSTODIAL);
            record.setFundingTxReference(TX);

            assertThatThrownBy(() -> coordinator.fund(ESCROW_ID, request(FundingPath.CUSTODIAL, null)))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("self-custodial");
        }
    }

    @Nested
    @DisplayName("Retry Tests")
    class RetryTests {

        @Test
        @DisplayName("Should skip records that are no longer pending")
        void shouldSkipNonPendingRecords() {
            record.setState(EscrowState.FUNDED);

            assertThat(coordinator.retryVerification(ESCROW_ID)).isEmpty();
            verifyNoInteractions(verifier);
        }

        @Test
        @DisplayName("Should fund a pending record once its transaction is deep enough")
        void shouldFundPendingRecord() {
            // Given
            record.setState(EscrowState.PENDING_VERIFICATION);
            record.setVerificationAttempts(1);
            record.setFundingPath(FundingPath.SELF_CUSTODIAL);
            record.setFundingTxReference(TX);
            when(verifier.verify(eq(TX), any(ExpectedFunding.class)))
                .thenReturn(VerificationResult.success(TX, 7L, 100L, 3L));
            when(store.findByLedgerTradeId(7L)).thenReturn(Optional.empty());
            when(ledgerClient.getTrade(7L)).thenReturn(Optional.empty());
            stubTransitionApplies(EscrowState.PENDING_VERIFICATION);

            // When
            Optional<FundingResult> result = coordinator.retryVerification(ESCROW_ID);

            // Then
            assertThat(result).isPresent();
            assertThat(result.get().getState()).isEqualTo(EscrowState.FUNDED);
            assertThat(record.getLastError()).isNull();
        }
    }

    private void stubTransitionApplies(EscrowState prior) {
        when(store.transition(eq(ESCROW_ID), eq(prior), eq(EscrowState.FUNDED), any())).thenAnswer(invocation -> {
            Consumer<EscrowRecord> mutator = invocation.getArgument(3);
            mutator.accept(record);
            record.setState(EscrowState.FUNDED);
            return TransitionOutcome.APPLIED;
        });
    }

    private EscrowRecord pendingRecord(int attempts) {
        EscrowRecord pending = createRecord();
        pending.setState(EscrowState.PENDING_VERIFICATION);
        pending.setVerificationAttempts(attempts);
        pending.setFundingTxReference(TX);
        return pending;
    }

    private static EscrowRecord createRecord() {
        return EscrowRecord.builder()
            .id(ESCROW_ID)
            .agreementId("AGR-1")
            .buyerId(10L)
            .sellerId(20L)
            .buyerAddress(BUYER)
            .sellerAddress(SELLER)
            .amountWei(AMOUNT)
            .state(EscrowState.AWAITING_FUND)
            .build();
    }

    private static Trade trade(long tradeId, long timeoutAt) {
        return Trade.builder()
            .tradeId(tradeId)
            .buyer(BUYER)
            .seller(SELLER)
            .amount(AMOUNT)
            .state(TradeState.FUNDED)
            .timeoutAt(timeoutAt)
            .build();
    }

    private static FundingRequest request(FundingPath path, String txReference) {
        return FundingRequest.builder()
            .path(path)
            .txReference(txReference)
            .build();
    }
}
