package com.fintech.escrow.service;

import com.fintech.escrow.dto.DisputeDecisionRequest;
import com.fintech.escrow.dto.DisputeResolutionResult;
import com.fintech.escrow.dto.PayoutPlan;
import com.fintech.escrow.entity.DisputeResolution;
import com.fintech.escrow.entity.EscrowEventType;
import com.fintech.escrow.entity.EscrowRecord;
import com.fintech.escrow.entity.EscrowState;
import com.fintech.escrow.entity.FundingPath;
import com.fintech.escrow.entity.ResolutionOutcome;
import com.fintech.escrow.entity.ResolutionStatus;
import com.fintech.escrow.exception.EscrowValidationException;
import com.fintech.escrow.exception.LedgerSubmissionException;
import com.fintech.escrow.ledger.LedgerCall;
import com.fintech.escrow.ledger.LedgerFunction;
import com.fintech.escrow.ledger.LedgerReceipt;
import com.fintech.escrow.repository.DisputeResolutionRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigInteger;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DisputeResolver.
 * <p>
 * Tests cover:
 * - Payout planning for each outcome
 * - Submission, reverts and the resolution status
 */
@ExtendWith(MockitoExtension.class)
class DisputeResolverTest {

    private static final long ESCROW_ID = 5L;
    private static final String TX = "0x" + "c3".repeat(32);
    private static final String BUYER = "0x1111111111111111111111111111111111111111";
    private static final String SELLER = "0x2222222222222222222222222222222222222222";
    private static final String PLATFORM = "0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266";
    private static final BigInteger AMOUNT = new BigInteger("1000000000000000000");

    @Mock
    private EscrowRecordStore store;

    @Mock
    private DisputeResolutionRepository resolutionRepository;

    @Mock
    private LedgerTransactionExecutor executor;

    private DisputeResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new DisputeResolver(store, resolutionRepository, executor, new SimpleMeterRegistry());
        resolver.initMetrics();
    }

    @Nested
    @DisplayName("Payout Planning Tests")
    class PayoutPlanningTests {

        @Test
        @DisplayName("Should pay the full amount to the buyer on refund")
        void shouldRefundBuyerInFull() {
            PayoutPlan plan = resolver.planPayout(disputedRecord(), decision(ResolutionOutcome.REFUND_TO_BUYER, null, null));

            assertThat(plan.getRecipientAddress()).isEqualTo(BUYER);
            assertThat(plan.getRecipientAmountWei()).isEqualTo(AMOUNT);
            assertThat(plan.getCounterpartyAddress()).isEqualTo(SELLER);
            assertThat(plan.getCounterpartyAmountWei()).isZero();
        }

        @Test
        @DisplayName("Should refund the platform address for a custodially funded escrow")
        void shouldRefundPlatformForCustodialEscrow() {
            EscrowRecord record = disputedRecord();
            record.setFundingPath(FundingPath.CUSTODIAL);
            record.setLedgerBuyerAddress(PLATFORM);

            PayoutPlan plan = resolver.planPayout(record, decision(ResolutionOutcome.REFUND_TO_BUYER, null, null));

            assertThat(plan.getRecipientAddress()).isEqualTo(PLATFORM);
        }

        @Test
        @DisplayName("Should give the remainder of a partial split to the other party")
        void shouldSplitWithRemainder() {
            // Given
            BigInteger toBuyer = new BigInteger("700000000000000000");

            // When
            PayoutPlan plan = resolver.planPayout(disputedRecord(),
                decision(ResolutionOutcome.PARTIAL_SPLIT, BUYER, toBuyer));

            // Then
            assertThat(plan.getRecipientAddress()).isEqualTo(BUYER);
            assertThat(plan.getRecipientAmountWei()).isEqualTo(toBuyer);
            assertThat(plan.getCounterpartyAddress()).isEqualTo(SELLER);
            assertThat(plan.getCounterpartyAmountWei()).isEqualTo(new BigInteger("300000000000000000"));
            assertThat(plan.total()).isEqualTo(AMOUNT);
        }

        @Test
        @DisplayName("Should accept the boundaries zero and the full amount in a split")
        void shouldAcceptSplitBoundaries() {
            PayoutPlan none = resolver.planPayout(disputedRecord(),
                decision(ResolutionOutcome.PARTIAL_SPLIT, SELLER, BigInteger.ZERO));
            PayoutPlan all = resolver.planPayout(disputedRecord(),
                decision(ResolutionOutcome.PARTIAL_SPLIT, SELLER, AMOUNT));

            assertThat(none.getCounterpartyAmountWei()).isEqualTo(AMOUNT);
            assertThat(all.getCounterpartyAmountWei()).isZero();
        }

        @Test
        @DisplayName("Should reject a split above the escrowed amount")
        void shouldRejectSplitAboveAmount() {
            assertThatThrownBy(() -> resolver.planPayout(disputedRecord(),
                    decision(ResolutionOutcome.PARTIAL_SPLIT, BUYER, AMOUNT.add(BigInteger.ONE))))
                .isInstanceOf(EscrowValidationException.class);
        }

        @Test
        @DisplayName("Should reject a recipient who is not a trade party")
        void shouldRejectOutsideRecipient() {
            assertThatThrownBy(() -> resolver.planPayout(disputedRecord(),
                    decision(ResolutionOutcome.PARTIAL_SPLIT, "0x3333333333333333333333333333333333333333", BigInteger.ONE)))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("buyer or the seller");
        }

        @Test
        @DisplayName("Should reject a payout to seller naming a smaller amount")
        void shouldRejectPartialAmountOnFullOutcome() {
            assertThatThrownBy(() -> resolver.planPayout(disputedRecord(),
                    decision(ResolutionOutcome.PAYOUT_TO_SELLER, SELLER, BigInteger.TEN)))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("PARTIAL_SPLIT");
        }
    }

    @Nested
    @DisplayName("Resolution Submission Tests")
    class SubmissionTests {

        @Test
        @DisplayName("Should refuse an escrow that is not disputed")
        void shouldRefuseUndisputedEscrow() {
            EscrowRecord record = disputedRecord();
            record.setState(EscrowState.FUNDED);
            when(store.getRequired(ESCROW_ID)).thenReturn(record);

            assertThatThrownBy(() -> resolver.resolve(ESCROW_ID, decision(ResolutionOutcome.REFUND_TO_BUYER, null, null)))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("only disputed escrows");
            verifyNoInteractions(executor);
        }

        @Test
        @DisplayName("Should submit resolveDispute and keep the resolution SUBMITTED until the ledger echo")
        void shouldSubmitResolution() {
            // Given
            when(store.getRequired(ESCROW_ID)).thenReturn(disputedRecord());
            when(resolutionRepository.findFirstByEscrowIdAndStatusOrderByIdDesc(ESCROW_ID, ResolutionStatus.SUBMITTED))
                .thenReturn(Optional.empty());
            stubSaveAssignsId();
            when(executor.submit(any(LedgerCall.class))).thenReturn(TX);
            when(executor.awaitReceipt(TX)).thenReturn(Optional.of(receipt(true, null)));

            // When
            DisputeResolutionResult result = resolver.resolve(ESCROW_ID,
                decision(ResolutionOutcome.PARTIAL_SPLIT, BUYER, new BigInteger("700000000000000000")));

            // Then
            assertThat(result.getStatus()).isEqualTo(ResolutionStatus.SUBMITTED);
            assertThat(result.getTxReference()).isEqualTo(TX);

            ArgumentCaptor<LedgerCall> call = ArgumentCaptor.forClass(LedgerCall.class);
            verify(executor).submit(call.capture());
            assertThat(call.getValue().getFunction()).isEqualTo(LedgerFunction.RESOLVE_DISPUTE);
            assertThat(call.getValue().integerArgument(0)).isEqualTo(BigInteger.valueOf(42));
            assertThat(call.getValue().stringArgument(1)).isEqualTo(BUYER);
            assertThat(call.getValue().integerArgument(2)).isEqualTo(new BigInteger("700000000000000000"));
            verify(store).appendLocalEvent(eq(ESCROW_ID), eq(EscrowEventType.RESOLUTION_SUBMITTED), any(), eq(false));
            verify(store, never()).transition(any(), any(), any(), any());
        }

        @Test
        @DisplayName("Should mark the resolution FAILED when the ledger reverts it")
        void shouldMarkFailedOnRevert() {
            // Given
            when(store.getRequired(ESCROW_ID)).thenReturn(disputedRecord());
            when(resolutionRepository.findFirstByEscrowIdAndStatusOrderByIdDesc(ESCROW_ID, ResolutionStatus.SUBMITTED))
                .thenReturn(Optional.empty());
            stubSaveAssignsId();
            when(executor.submit(any(LedgerCall.class))).thenReturn(TX);
            when(executor.awaitReceipt(TX)).thenReturn(Optional.of(receipt(false, "Trade not disputed")));
            when(executor.connectionName()).thenReturn("simulated-test");

            // When / Then
            assertThatThrownBy(() -> resolver.resolve(ESCROW_ID, decision(ResolutionOutcome.PAYOUT_TO_SELLER, null, null)))
                .isInstanceOf(LedgerSubmissionException.class)
                .hasMessageContaining("Trade not disputed");

            ArgumentCaptor<DisputeResolution> saved = ArgumentCaptor.forClass(DisputeResolution.class);
            verify(resolutionRepository, atLeastOnce()).save(saved.capture());
            List<DisputeResolution> saves = saved.getAllValues();
            assertThat(saves.get(saves.size() - 1).getStatus()).isEqualTo(ResolutionStatus.FAILED);
            verify(store).appendLocalEvent(eq(ESCROW_ID), eq(EscrowEventType.RESOLUTION_FAILED), any(), eq(false));
        }

        @Test
        @DisplayName("Should refuse a new decision while an earlier one may still pay out")
        void shouldRefuseWhileSubmissionPending() {
            // Given
            DisputeResolution pending = DisputeResolution.builder()
                .id(3L)
                .escrowId(ESCROW_ID)
                .status(ResolutionStatus.SUBMITTED)
                .txReference(TX)
                .build();
            when(store.getRequired(ESCROW_ID)).thenReturn(disputedRecord());
            when(resolutionRepository.findFirstByEscrowIdAndStatusOrderByIdDesc(ESCROW_ID, ResolutionStatus.SUBMITTED))
                .thenReturn(Optional.of(pending));
            when(executor.awaitReceipt(TX)).thenReturn(Optional.of(receipt(true, null)));

            // When / Then
            assertThatThrownBy(() -> resolver.resolve(ESCROW_ID, decision(ResolutionOutcome.REFUND_TO_BUYER, null, null)))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("unresolved submission");
            verify(executor, never()).submit(any());
        }
    }

    @Nested
    @DisplayName("Abandoned Submission Tests")
    class AbandonedSubmissionTests {

        @Test
        @DisplayName("Should mark the resolution FAILED when signing fails before broadcast")
        void shouldMarkFailedOnUnexpectedSubmitError() {
            // Given
            when(store.getRequired(ESCROW_ID)).thenReturn(disputedRecord());
            when(resolutionRepository.findFirstByEscrowIdAndStatusOrderByIdDesc(ESCROW_ID, ResolutionStatus.SUBMITTED))
                .thenReturn(Optional.empty());
            stubSaveAssignsId();
            when(executor.submit(any(LedgerCall.class))).thenThrow(new IllegalStateException("signer unavailable"));

            // When / Then
            assertThatThrownBy(() -> resolver.resolve(ESCROW_ID, decision(ResolutionOutcome.REFUND_TO_BUYER, null, null)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("signer unavailable");

            ArgumentCaptor<DisputeResolution> saved = ArgumentCaptor.forClass(DisputeResolution.class);
            verify(resolutionRepository, atLeastOnce()).save(saved.capture());
            DisputeResolution last = saved.getAllValues().get(saved.getAllValues().size() - 1);
            assertThat(last.getStatus()).isEqualTo(ResolutionStatus.FAILED);
            assertThat(last.getFailureReason()).isEqualTo("signer unavailable");
            verify(executor, never()).awaitReceipt(any());
        }

        @Test
        @DisplayName("Should fail an earlier submission without a transaction reference and accept the new decision")
        void shouldFailSubmissionWithoutReference() {
            // Given: an earlier run stopped before the broadcast returned
            DisputeResolution orphan = DisputeResolution.builder()
                .id(3L)
                .escrowId(ESCROW_ID)
                .status(ResolutionStatus.SUBMITTED)
                .build();
            when(store.getRequired(ESCROW_ID)).thenReturn(disputedRecord());
            when(resolutionRepository.findFirstByEscrowIdAndStatusOrderByIdDesc(ESCROW_ID, ResolutionStatus.SUBMITTED))
                .thenReturn(Optional.of(orphan));
            stubSaveAssignsId();
            when(executor.submit(any(LedgerCall.class))).thenReturn(TX);
            when(executor.awaitReceipt(TX)).thenReturn(Optional.of(receipt(true, null)));

            // When
            DisputeResolutionResult result = resolver.resolve(ESCROW_ID,
                decision(ResolutionOutcome.REFUND_TO_BUYER, null, null));

            // Then
            assertThat(orphan.getStatus()).isEqualTo(ResolutionStatus.FAILED);
            assertThat(orphan.getFailureReason()).contains("no transaction reference");
            assertThat(result.getStatus()).isEqualTo(ResolutionStatus.SUBMITTED);
            assertThat(result.getTxReference()).isEqualTo(TX);
            verify(executor, never()).isKnownTransaction(any());
        }

        @Test
        @DisplayName("Should fail an earlier submission the node dropped and accept the new decision")
        void shouldFailDroppedSubmission() {
            // Given
            String dropped = "0x" + "d4".repeat(32);
            DisputeResolution earlier = DisputeResolution.builder()
                .id(3L)
                .escrowId(ESCROW_ID)
                .status(ResolutionStatus.SUBMITTED)
                .txReference(dropped)
                .build();
            when(store.getRequired(ESCROW_ID)).thenReturn(disputedRecord());
            when(resolutionRepository.findFirstByEscrowIdAndStatusOrderByIdDesc(ESCROW_ID, ResolutionStatus.SUBMITTED))
                .thenReturn(Optional.of(earlier));
            when(executor.awaitReceipt(dropped)).thenReturn(Optional.empty());
            when(executor.isKnownTransaction(dropped)).thenReturn(false);
            stubSaveAssignsId();
            when(executor.submit(any(LedgerCall.class))).thenReturn(TX);
            when(executor.awaitReceipt(TX)).thenReturn(Optional.of(receipt(true, null)));

            // When
            DisputeResolutionResult result = resolver.resolve(ESCROW_ID,
                decision(ResolutionOutcome.PAYOUT_TO_SELLER, null, null));

            // Then
            assertThat(earlier.getStatus()).isEqualTo(ResolutionStatus.FAILED);
            assertThat(earlier.getFailureReason()).contains("unknown to the ledger node");
            assertThat(result.getTxReference()).isEqualTo(TX);
            verify(store).appendLocalEvent(eq(ESCROW_ID), eq(EscrowEventType.RESOLUTION_FAILED), any(), eq(false));
        }

        @Test
        @DisplayName("Should keep refusing while the earlier transaction is still pending on the node")
        void shouldRefuseWhileTransactionPending() {
            // Given
            DisputeResolution earlier = DisputeResolution.builder()
                .id(3L)
                .escrowId(ESCROW_ID)
                .status(ResolutionStatus.SUBMITTED)
                .txReference(TX)
                .build();
            when(store.getRequired(ESCROW_ID)).thenReturn(disputedRecord());
            when(resolutionRepository.findFirstByEscrowIdAndStatusOrderByIdDesc(ESCROW_ID, ResolutionStatus.SUBMITTED))
                .thenReturn(Optional.of(earlier));
            when(executor.awaitReceipt(TX)).thenReturn(Optional.empty());
            when(executor.isKnownTransaction(TX)).thenReturn(true);

            // When / Then
            assertThatThrownBy(() -> resolver.resolve(ESCROW_ID, decision(ResolutionOutcome.REFUND_TO_BUYER, null, null)))
                .isInstanceOf(EscrowValidationException.class)
                .hasMessageContaining("unresolved submission");
            assertThat(earlier.getStatus()).isEqualTo(ResolutionStatus.SUBMITTED);
            verify(executor, never()).submit(any());
        }
    }

    private void stubSaveAssignsId() {
        when(resolutionRepository.save(any(DisputeResolution.class))).thenAnswer(invocation -> {
            DisputeResolution resolution = invocation.getArgument(0);
            if (resolution.getId() == null) {
                resolution.setId(11L);
            }
            return resolution;
        });
    }

    private static LedgerReceipt receipt(boolean success, String revertReason) {
        return new LedgerReceipt(TX, 200L, "0xblock", success, PLATFORM, SELLER, BigInteger.ZERO,
            revertReason, List.of());
    }

    private static EscrowRecord disputedRecord() {
        return EscrowRecord.builder()
            .id(ESCROW_ID)
            .agreementId("AGR-5")
            .buyerId(10L)
            .sellerId(20L)
            .buyerAddress(BUYER)
            .sellerAddress(SELLER)
            .amountWei(AMOUNT)
            .state(EscrowState.DISPUTED)
            .ledgerTradeId(42L)
            .fundingPath(FundingPath.SELF_CUSTODIAL)
            .ledgerBuyerAddress(BUYER)
            .disputeReason("quality issue")
            .build();
    }

    private static DisputeDecisionRequest decision(ResolutionOutcome outcome, String recipient, BigInteger amount) {
        return DisputeDecisionRequest.builder()
            .outcome(outcome)
            .recipientAddress(recipient)
            .amountWei(amount)
            .note("admin decision")
            .adminId(99L)
            .build();
    }
}
