package com.fintech.escrow.ledger;

import java.math.BigInteger;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * In-process implementation of the escrow contract state machine.
 * <p>
 * Every operation checks all preconditions and queues every outgoing
 * transfer before it touches contract state, so a revert at any point leaves
 * the trade, the held balance and the event log unchanged.
 */
public class EscrowLedgerContract {

    public static final int DEFAULT_FEE_BPS = 100;
    public static final int MAX_FEE_BPS = 1000;
    public static final BigInteger BPS_DENOMINATOR = BigInteger.valueOf(10_000);
    public static final long DEFAULT_TIMEOUT_SECONDS = Duration.ofDays(30).getSeconds();
    public static final long MIN_TIMEOUT_SECONDS = Duration.ofDays(1).getSeconds();
    public static final long MAX_TIMEOUT_SECONDS = Duration.ofDays(365).getSeconds();

    private final String owner;
    private String feeRecipient;
    private int platformFeeBps = DEFAULT_FEE_BPS;
    private long defaultTimeoutSeconds = DEFAULT_TIMEOUT_SECONDS;

    private final List<Trade> trades = new ArrayList<>();
    private BigInteger balance = BigInteger.ZERO;

    public EscrowLedgerContract(String owner, String feeRecipient) {
        this.owner = LedgerAddresses.normalize(owner);
        this.feeRecipient = LedgerAddresses.normalize(feeRecipient);
    }

    /**
     * Dispatches a submitted call.
     *
     * @return the new trade id for trade-creating calls, otherwise {@code null}
     */
    public Long execute(CallContext ctx, LedgerCall call) {
        LedgerFunction function = call.getFunction();
        if (!function.isPayable() && ctx.value().signum() != 0) {
            throw new LedgerRevertException("Function is not payable");
        }

        switch (function) {
            case CREATE_AND_FUND:
                return createAndFund(ctx, call.stringArgument(0), call.stringArgument(1));
            case CREATE_TRADE_WITHOUT_FUND:
                return createTradeWithoutFund(ctx, call.stringArgument(0), call.stringArgument(1));
            case FUND_TRADE:
                fundTrade(ctx, tradeId(call.integerArgument(0)));
                return null;
            case CONFIRM_DELIVERY:
                confirmDelivery(ctx, tradeId(call.integerArgument(0)));
                return null;
            case RAISE_DISPUTE:
                raiseDispute(ctx, tradeId(call.integerArgument(0)), call.stringArgument(1));
                return null;
            case RESOLVE_DISPUTE:
                resolveDispute(ctx, tradeId(call.integerArgument(0)), call.stringArgument(1),
                        call.integerArgument(2), call.stringArgument(3));
                return null;
            case TIMEOUT_REFUND:
                timeoutRefund(ctx, tradeId(call.integerArgument(0)));
                return null;
            case UPDATE_PLATFORM_FEE:
                updatePlatformFee(ctx, call.integerArgument(0));
                return null;
            case UPDATE_FEE_RECIPIENT:
                updateFeeRecipient(ctx, call.stringArgument(0));
                return null;
            case UPDATE_TIMEOUT_DURATION:
                updateTimeoutDuration(ctx, call.integerArgument(0));
                return null;
            default:
                throw new LedgerRevertException("Unknown function");
        }
    }

    public long createAndFund(CallContext ctx, String seller, String metadata) {
        requireValue(ctx);
        String buyer = LedgerAddresses.normalize(ctx.sender());
        String normalizedSeller = validateSeller(buyer, seller);

        long tradeId = trades.size();
        trades.add(Trade.builder()
                .tradeId(tradeId)
                .buyer(buyer)
                .seller(normalizedSeller)
                .amount(ctx.value())
                .state(TradeState.FUNDED)
                .createdAt(ctx.timestamp())
                .timeoutAt(ctx.timestamp() + defaultTimeoutSeconds)
                .metadata(metadata)
                .build());
        balance = balance.add(ctx.value());

        ctx.emit(new LedgerEvent.EscrowCreated(tradeId, buyer, normalizedSeller, ctx.value(), metadata));
        ctx.emit(new LedgerEvent.Funded(tradeId, buyer, ctx.value()));
        return tradeId;
    }

    public long createTradeWithoutFund(CallContext ctx, String seller, String metadata) {
        String buyer = LedgerAddresses.normalize(ctx.sender());
        String normalizedSeller = validateSeller(buyer, seller);

        long tradeId = trades.size();
        trades.add(Trade.builder()
                .tradeId(tradeId)
                .buyer(buyer)
                .seller(normalizedSeller)
                .amount(BigInteger.ZERO)
                .state(TradeState.AWAITING_FUND)
                .createdAt(ctx.timestamp())
                .timeoutAt(ctx.timestamp() + defaultTimeoutSeconds)
                .metadata(metadata)
                .build());

        ctx.emit(new LedgerEvent.EscrowCreated(tradeId, buyer, normalizedSeller, BigInteger.ZERO, metadata));
        return tradeId;
    }

    public void fundTrade(CallContext ctx, long tradeId) {
        Trade trade = requireTrade(tradeId);
        if (!LedgerAddresses.same(ctx.sender(), trade.getBuyer())) {
            throw new LedgerRevertException("Only buyer can fund");
        }
        if (trade.getState() != TradeState.AWAITING_FUND) {
            throw new LedgerRevertException("Trade not awaiting funding");
        }
        requireValue(ctx);

        trades.set((int) tradeId, trade.toBuilder()
                .amount(ctx.value())
                .state(TradeState.FUNDED)
                .timeoutAt(ctx.timestamp() + defaultTimeoutSeconds)
                .build());
        balance = balance.add(ctx.value());

        ctx.emit(new LedgerEvent.Funded(tradeId, trade.getBuyer(), ctx.value()));
    }

    public void confirmDelivery(CallContext ctx, long tradeId) {
        Trade trade = requireTrade(tradeId);
        requireParty(ctx, trade);
        requireFunded(trade);

        BigInteger fee = trade.getAmount()
                .multiply(BigInteger.valueOf(platformFeeBps))
                .divide(BPS_DENOMINATOR);
        BigInteger sellerAmount = trade.getAmount().subtract(fee);

        transferIfPositive(ctx, trade.getSeller(), sellerAmount);
        transferIfPositive(ctx, feeRecipient, fee);

        complete(trade);

        String confirmer = LedgerAddresses.normalize(ctx.sender());
        ctx.emit(new LedgerEvent.DeliveryConfirmed(tradeId, confirmer));
        ctx.emit(new LedgerEvent.Released(tradeId, trade.getSeller(), sellerAmount, fee));
    }

    public void raiseDispute(CallContext ctx, long tradeId, String reason) {
        Trade trade = requireTrade(tradeId);
        requireParty(ctx, trade);
        requireFunded(trade);

        trades.set((int) tradeId, trade.toBuilder().state(TradeState.DISPUTED).build());

        ctx.emit(new LedgerEvent.Disputed(tradeId, LedgerAddresses.normalize(ctx.sender()), reason));
    }

    public void resolveDispute(CallContext ctx, long tradeId, String recipient, BigInteger amount, String note) {
        requireOwner(ctx);
        Trade trade = requireTrade(tradeId);
        if (trade.getState() != TradeState.DISPUTED) {
            throw new LedgerRevertException("Trade not disputed");
        }
        String other;
        if (LedgerAddresses.same(recipient, trade.getBuyer())) {
            other = trade.getSeller();
        } else if (LedgerAddresses.same(recipient, trade.getSeller())) {
            other = trade.getBuyer();
        } else {
            throw new LedgerRevertException("Invalid recipient");
        }
        if (amount.signum() < 0 || amount.compareTo(trade.getAmount()) > 0) {
            throw new LedgerRevertException("Invalid amount");
        }
        String normalizedRecipient = LedgerAddresses.normalize(recipient);

        transferIfPositive(ctx, normalizedRecipient, amount);
        transferIfPositive(ctx, other, trade.getAmount().subtract(amount));

        complete(trade);

        ctx.emit(new LedgerEvent.Resolved(tradeId, normalizedRecipient, amount, note));
    }

    public void timeoutRefund(CallContext ctx, long tradeId) {
        Trade trade = requireTrade(tradeId);
        requireFunded(trade);
        if (ctx.timestamp() < trade.getTimeoutAt()) {
            throw new LedgerRevertException("Trade not timed out");
        }

        transferIfPositive(ctx, trade.getBuyer(), trade.getAmount());

        complete(trade);

        ctx.emit(new LedgerEvent.TimeoutRefund(tradeId, trade.getBuyer(), trade.getAmount()));
    }

    public void updatePlatformFee(CallContext ctx, BigInteger feeBps) {
        requireOwner(ctx);
        if (feeBps.signum() < 0 || feeBps.compareTo(BigInteger.valueOf(MAX_FEE_BPS)) > 0) {
            throw new LedgerRevertException("Fee cannot exceed 10%");
        }
        platformFeeBps = feeBps.intValueExact();
    }

    public void updateFeeRecipient(CallContext ctx, String recipient) {
        requireOwner(ctx);
        if (!LedgerAddresses.isValid(recipient) || LedgerAddresses.isZero(recipient)) {
            throw new LedgerRevertException("Invalid fee recipient");
        }
        feeRecipient = LedgerAddresses.normalize(recipient);
    }

    public void updateTimeoutDuration(CallContext ctx, BigInteger seconds) {
        requireOwner(ctx);
        if (seconds.compareTo(BigInteger.valueOf(MIN_TIMEOUT_SECONDS)) < 0
                || seconds.compareTo(BigInteger.valueOf(MAX_TIMEOUT_SECONDS)) > 0) {
            throw new LedgerRevertException("Invalid duration");
        }
        defaultTimeoutSeconds = seconds.longValueExact();
    }

    // Views

    public Trade getTrade(long tradeId) {
        return requireTrade(tradeId);
    }

    public long getTotalTrades() {
        return trades.size();
    }

    public BigInteger getBalance() {
        return balance;
    }

    public int getPlatformFeeBps() {
        return platformFeeBps;
    }

    public String getFeeRecipient() {
        return feeRecipient;
    }

    public long getDefaultTimeoutSeconds() {
        return defaultTimeoutSeconds;
    }

    public String getOwner() {
        return owner;
    }

    private void complete(Trade trade) {
        trades.set((int) trade.getTradeId(), trade.toBuilder().state(TradeState.COMPLETE).build());
        balance = balance.subtract(trade.getAmount());
    }

    private Trade requireTrade(long tradeId) {
        if (tradeId < 0 || tradeId >= trades.size()) {
            throw new LedgerRevertException("Trade does not exist");
        }
        return trades.get((int) tradeId);
    }

    private String validateSeller(String buyer, String seller) {
        if (!LedgerAddresses.isValid(seller) || LedgerAddresses.isZero(seller)) {
            throw new LedgerRevertException("Invalid seller address");
        }
        if (LedgerAddresses.same(buyer, seller)) {
            throw new LedgerRevertException("Buyer and seller cannot be same");
        }
        return LedgerAddresses.normalize(seller);
    }

    private void requireValue(CallContext ctx) {
        if (ctx.value().signum() <= 0) {
            throw new LedgerRevertException("Must send value");
        }
    }

    private void requireParty(CallContext ctx, Trade trade) {
        if (!LedgerAddresses.same(ctx.sender(), trade.getBuyer())
                && !LedgerAddresses.same(ctx.sender(), trade.getSeller())) {
            throw new LedgerRevertException("Only trade parties allowed");
        }
    }

    private void requireFunded(Trade trade) {
        if (trade.getState() != TradeState.FUNDED) {
            throw new LedgerRevertException("Trade not funded");
        }
    }

    private void requireOwner(CallContext ctx) {
        if (!LedgerAddresses.same(ctx.sender(), owner)) {
            throw new LedgerRevertException("Ownable: caller is not the owner");
        }
    }

    private void transferIfPositive(CallContext ctx, String to, BigInteger amount) {
        if (amount.signum() > 0) {
            ctx.transfer(to, amount);
        }
    }

    private static long tradeId(BigInteger raw) {
        if (raw.signum() < 0 || raw.bitLength() > 63) {
            throw new LedgerRevertException("Trade does not exist");
        }
        return raw.longValue();
    }
}
