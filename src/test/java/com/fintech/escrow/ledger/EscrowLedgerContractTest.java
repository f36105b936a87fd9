package com.fintech.escrow.ledger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the in-process escrow contract.
 * <p>
 * Tests cover:
 * - Trade creation and funding
 * - Release with platform fee
 * - Dispute resolution payouts
 * - Timeout refunds
 * - Reverts leaving state untouched
 */
class EscrowLedgerContractTest {

    private static final String OWNER = "0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266";
    private static final String FEE_RECIPIENT = "0x70997970c51812dc3a010c7d01b50e0d17dc79c8";
    private static final String BUYER = "0x1111111111111111111111111111111111111111";
    private static final String SELLER = "0x2222222222222222222222222222222222222222";
    private static final String STRANGER = "0x3333333333333333333333333333333333333333";

    private static final BigInteger ONE_ETHER = new BigInteger("1000000000000000000");
    private static final long NOW = 1_767_225_600L;

    private EscrowLedgerContract contract;

    @BeforeEach
    void setUp() {
        contract = new EscrowLedgerContract(OWNER, FEE_RECIPIENT);
    }

    @Nested
    @DisplayName("Trade Creation Tests")
    class TradeCreationTests {

        @Test
        @DisplayName("Should create a funded trade and emit EscrowCreated then Funded")
        void shouldCreateFundedTrade() {
            // Given
            TestContext ctx = new TestContext(BUYER, ONE_ETHER, NOW);

            // When
            long tradeId = contract.createAndFund(ctx, SELLER, "{\"escrowId\":1}");

            // Then
            Trade trade = contract.getTrade(tradeId);
            assertThat(trade.getState()).isEqualTo(TradeState.FUNDED);
            assertThat(trade.getAmount()).isEqualTo(ONE_ETHER);
            assertThat(trade.getTimeoutAt()).isEqualTo(NOW + EscrowLedgerContract.DEFAULT_TIMEOUT_SECONDS);
            assertThat(contract.getBalance()).isEqualTo(ONE_ETHER);

            assertThat(ctx.events).hasSize(2);
            assertThat(ctx.events.get(0)).isInstanceOf(LedgerEvent.EscrowCreated.class);
            assertThat(ctx.events.get(1)).isEqualTo(new LedgerEvent.Funded(tradeId, BUYER, ONE_ETHER));
        }

        @Test
        @DisplayName("Should reject funding without value")
        void shouldRejectZeroValue() {
            TestContext ctx = new TestContext(BUYER, BigInteger.ZERO, NOW);

            assertThatThrownBy(() -> contract.createAndFund(ctx, SELLER, ""))
                .isInstanceOf(LedgerRevertException.class)
                .hasMessageContaining("Must send value");
            assertThat(contract.getTotalTrades()).isZero();
        }

        @Test
        @DisplayName("Should reject a trade where buyer and seller are the same")
        void shouldRejectSameParties() {
            TestContext ctx = new TestContext(BUYER, ONE_ETHER, NOW);

            assertThatThrownBy(() -> contract.createAndFund(ctx, BUYER, ""))
                .isInstanceOf(LedgerRevertException.class)
                .hasMessageContaining("cannot be same");
        }

        @Test
        @DisplayName("Should fund a trade created without value and restart its timeout")
        void shouldFundTradeCreatedWithoutValue() {
            // Given
            long tradeId = contract.createTradeWithoutFund(new TestContext(BUYER, BigInteger.ZERO, NOW), SELLER, "");
            TestContext fundCtx = new TestContext(BUYER, ONE_ETHER, NOW + 3_600);

            // When
            contract.fundTrade(fundCtx, tradeId);

            // Then
            Trade trade = contract.getTrade(tradeId);
            assertThat(trade.getState()).isEqualTo(TradeState.FUNDED);
            assertThat(trade.getTimeoutAt()).isEqualTo(NOW + 3_600 + EscrowLedgerContract.DEFAULT_TIMEOUT_SECONDS);
            assertThat(fundCtx.events).containsExactly(new LedgerEvent.Funded(tradeId, BUYER, ONE_ETHER));
        }

        @Test
        @DisplayName("Should only let the buyer fund a trade")
        void shouldOnlyLetBuyerFund() {
            long tradeId = contract.createTradeWithoutFund(new TestContext(BUYER, BigInteger.ZERO, NOW), SELLER, "");

            assertThatThrownBy(() -> contract.fundTrade(new TestContext(STRANGER, ONE_ETHER, NOW), tradeId))
                .isInstanceOf(LedgerRevertException.class)
                .hasMessageContaining("Only buyer can fund");
        }
    }

    @Nested
    @DisplayName("Release Tests")
    class ReleaseTests {

        @Test
        @DisplayName("Should pay seller amount minus fee and fee recipient the fee")
        void shouldReleaseWithFee() {
            // Given
            long tradeId = contract.createAndFund(new TestContext(BUYER, ONE_ETHER, NOW), SELLER, "");
            TestContext ctx = new TestContext(SELLER, BigInteger.ZERO, NOW + 60);

            // When
            contract.confirmDelivery(ctx, tradeId);

            // Then
            BigInteger fee = ONE_ETHER.divide(BigInteger.valueOf(100));
            assertThat(ctx.transferTo(SELLER)).isEqualTo(ONE_ETHER.subtract(fee));
            assertThat(ctx.transferTo(FEE_RECIPIENT)).isEqualTo(fee);
            assertThat(contract.getTrade(tradeId).getState()).isEqualTo(TradeState.COMPLETE);
            assertThat(contract.getBalance()).isZero();
            assertThat(ctx.events).containsExactly(
                new LedgerEvent.DeliveryConfirmed(tradeId, SELLER),
                new LedgerEvent.Released(tradeId, SELLER, ONE_ETHER.subtract(fee), fee));
        }

        @Test
        @DisplayName("Should round the fee down for tiny amounts")
        void shouldRoundFeeDown() {
            long tradeId = contract.createAndFund(new TestContext(BUYER, BigInteger.valueOf(99), NOW), SELLER, "");
            TestContext ctx = new TestContext(BUYER, BigInteger.ZERO, NOW);

            contract.confirmDelivery(ctx, tradeId);

            assertThat(ctx.transferTo(SELLER)).isEqualTo(BigInteger.valueOf(99));
            assertThat(ctx.transferTo(FEE_RECIPIENT)).isNull();
        }

        @Test
        @DisplayName("Should refuse delivery confirmation from a non-party")
        void shouldRefuseNonParty() {
            long tradeId = contract.createAndFund(new TestContext(BUYER, ONE_ETHER, NOW), SELLER, "");

            assertThatThrownBy(() -> contract.confirmDelivery(new TestContext(STRANGER, BigInteger.ZERO, NOW), tradeId))
                .isInstanceOf(LedgerRevertException.class)
                .hasMessageContaining("Only trade parties");
        }

        @Test
        @DisplayName("Should leave the trade funded when the seller rejects the transfer")
        void shouldLeaveTradeUntouchedOnFailedTransfer() {
            // Given
            long tradeId = contract.createAndFund(new TestContext(BUYER, ONE_ETHER, NOW), SELLER, "");
            TestContext ctx = new TestContext(SELLER, BigInteger.ZERO, NOW);
            ctx.rejecting.add(SELLER);

            // When / Then
            assertThatThrownBy(() -> contract.confirmDelivery(ctx, tradeId))
                .isInstanceOf(LedgerRevertException.class)
                .hasMessageContaining("Transfer failed");
            assertThat(contract.getTrade(tradeId).getState()).isEqualTo(TradeState.FUNDED);
            assertThat(contract.getBalance()).isEqualTo(ONE_ETHER);
        }
    }

    @Nested
    @DisplayName("Dispute Tests")
    class DisputeTests {

        private long tradeId;

        @BeforeEach
        void fundAndDispute() {
            tradeId = contract.createAndFund(new TestContext(BUYER, ONE_ETHER, NOW), SELLER, "");
            contract.raiseDispute(new TestContext(BUYER, BigInteger.ZERO, NOW), tradeId, "quality issue");
        }

        @Test
        @DisplayName("Should split the amount between recipient and counterparty")
        void shouldSplitPayout() {
            // Given
            BigInteger toBuyer = new BigInteger("700000000000000000");
            TestContext ctx = new TestContext(OWNER, BigInteger.ZERO, NOW);

            // When
            contract.resolveDispute(ctx, tradeId, BUYER, toBuyer, "partial refund");

            // Then
            assertThat(ctx.transferTo(BUYER)).isEqualTo(toBuyer);
            assertThat(ctx.transferTo(SELLER)).isEqualTo(new BigInteger("300000000000000000"));
            assertThat(ctx.transferTo(FEE_RECIPIENT)).isNull();
            assertThat(contract.getTrade(tradeId).getState()).isEqualTo(TradeState.COMPLETE);
            assertThat(ctx.events).containsExactly(
                new LedgerEvent.Resolved(tradeId, BUYER, toBuyer, "partial refund"));
        }

        @Test
        @DisplayName("Should only let the owner resolve")
        void shouldOnlyLetOwnerResolve() {
            assertThatThrownBy(() -> contract.resolveDispute(
                    new TestContext(BUYER, BigInteger.ZERO, NOW), tradeId, BUYER, ONE_ETHER, "mine"))
                .isInstanceOf(LedgerRevertException.class)
                .hasMessageContaining("not the owner");
        }

        @Test
        @DisplayName("Should refuse a recipient outside the trade and an amount above the escrow")
        void shouldRefuseInvalidResolution() {
            TestContext ctx = new TestContext(OWNER, BigInteger.ZERO, NOW);

            assertThatThrownBy(() -> contract.resolveDispute(ctx, tradeId, STRANGER, ONE_ETHER, ""))
                .hasMessageContaining("Invalid recipient");
            assertThatThrownBy(() -> contract.resolveDispute(ctx, tradeId, SELLER, ONE_ETHER.add(BigInteger.ONE), ""))
                .hasMessageContaining("Invalid amount");
            assertThat(contract.getTrade(tradeId).getState()).isEqualTo(TradeState.DISPUTED);
        }

        @Test
        @DisplayName("Should not release a disputed trade")
        void shouldNotReleaseDisputedTrade() {
            assertThatThrownBy(() -> contract.confirmDelivery(new TestContext(BUYER, BigInteger.ZERO, NOW), tradeId))
                .hasMessageContaining("Trade not funded");
        }
    }

    @Nested
    @DisplayName("Timeout Tests")
    class TimeoutTests {

        @Test
        @DisplayName("Should refuse a refund before the timeout")
        void shouldRefuseEarlyRefund() {
            long tradeId = contract.createAndFund(new TestContext(BUYER, ONE_ETHER, NOW), SELLER, "");
            long beforeTimeout = contract.getTrade(tradeId).getTimeoutAt() - 1;

            assertThatThrownBy(() -> contract.timeoutRefund(new TestContext(STRANGER, BigInteger.ZERO, beforeTimeout), tradeId))
                .isInstanceOf(LedgerRevertException.class)
                .hasMessageContaining("not timed out");
        }

        @Test
        @DisplayName("Should refund the full amount to the buyer, triggered by anyone")
        void shouldRefundBuyer() {
            // Given
            long tradeId = contract.createAndFund(new TestContext(BUYER, ONE_ETHER, NOW), SELLER, "");
            TestContext ctx = new TestContext(STRANGER, BigInteger.ZERO, contract.getTrade(tradeId).getTimeoutAt());

            // When
            contract.timeoutRefund(ctx, tradeId);

            // Then
            assertThat(ctx.transferTo(BUYER)).isEqualTo(ONE_ETHER);
            assertThat(contract.getTrade(tradeId).getState()).isEqualTo(TradeState.COMPLETE);
            assertThat(ctx.events).containsExactly(new LedgerEvent.TimeoutRefund(tradeId, BUYER, ONE_ETHER));
        }
    }

    @Nested
    @DisplayName("Administration Tests")
    class AdministrationTests {

        @Test
        @DisplayName("Should cap the platform fee at 10%")
        void shouldCapPlatformFee() {
            TestContext ctx = new TestContext(OWNER, BigInteger.ZERO, NOW);

            contract.updatePlatformFee(ctx, BigInteger.valueOf(EscrowLedgerContract.MAX_FEE_BPS));
            assertThat(contract.getPlatformFeeBps()).isEqualTo(EscrowLedgerContract.MAX_FEE_BPS);

            assertThatThrownBy(() -> contract.updatePlatformFee(ctx, BigInteger.valueOf(1001)))
                .hasMessageContaining("Fee cannot exceed 10%");
        }

        @Test
        @DisplayName("Should keep the timeout duration between one day and one year")
        void shouldBoundTimeoutDuration() {
            TestContext ctx = new TestContext(OWNER, BigInteger.ZERO, NOW);

            assertThatThrownBy(() -> contract.updateTimeoutDuration(ctx, BigInteger.valueOf(3_600)))
                .hasMessageContaining("Invalid duration");

            contract.updateTimeoutDuration(ctx, BigInteger.valueOf(EscrowLedgerContract.MIN_TIMEOUT_SECONDS));
            assertThat(contract.getDefaultTimeoutSeconds()).isEqualTo(EscrowLedgerContract.MIN_TIMEOUT_SECONDS);
        }

        @Test
        @DisplayName("Should refuse value on non-payable functions")
        void shouldRefuseValueOnNonPayable() {
            long tradeId = contract.createAndFund(new TestContext(BUYER, ONE_ETHER, NOW), SELLER, "");

            assertThatThrownBy(() -> contract.execute(new TestContext(BUYER, BigInteger.ONE, NOW),
                    LedgerCall.confirmDelivery(tradeId)))
                .hasMessageContaining("not payable");
        }
    }

    private static final class TestContext implements CallContext {

        private final String sender;
        private final BigInteger value;
        private final long timestamp;
        private final List<String> recipients = new ArrayList<>();
        private final List<BigInteger> amounts = new ArrayList<>();
        private final List<LedgerEvent> events = new ArrayList<>();
        private final Set<String> rejecting = new HashSet<>();

        private TestContext(String sender, BigInteger value, long timestamp) {
            this.sender = sender;
            this.value = value;
            this.timestamp = timestamp;
        }

        @Override
        public String sender() {
            return sender;
        }

        @Override
        public BigInteger value() {
            return value;
        }

        @Override
        public long timestamp() {
            return timestamp;
        }

        @Override
        public void transfer(String to, BigInteger amount) {
            if (rejecting.contains(to)) {
                throw new LedgerRevertException("Transfer failed");
            }
            recipients.add(to);
            amounts.add(amount);
        }

        @Override
        public void emit(LedgerEvent event) {
            events.add(event);
        }

        private BigInteger transferTo(String address) {
            int index = recipients.indexOf(address);
            return index < 0 ? null : amounts.get(index);
        }
    }
}
