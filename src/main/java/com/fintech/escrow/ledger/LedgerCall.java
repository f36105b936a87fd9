package com.fintech.escrow.ledger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

import java.math.BigInteger;
import java.util.List;

/**
 * A contract call ready to be signed and submitted: function, positional
 * arguments and attached value in wei.
 * <p>
 * Argument types follow the ABI: addresses and strings as {@link String},
 * integers as {@link BigInteger}.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class LedgerCall {

    LedgerFunction function;
    List<Object> arguments;
    BigInteger value;

    public static LedgerCall createAndFund(String seller, String metadata, BigInteger value) {
        return new LedgerCall(LedgerFunction.CREATE_AND_FUND, List.of(seller, metadata), value);
    }

    public static LedgerCall createTradeWithoutFund(String seller, String metadata) {
        return new LedgerCall(LedgerFunction.CREATE_TRADE_WITHOUT_FUND, List.of(seller, metadata), BigInteger.ZERO);
    }

    public static LedgerCall fundTrade(long tradeId, BigInteger value) {
        return new LedgerCall(LedgerFunction.FUND_TRADE, List.of(BigInteger.valueOf(tradeId)), value);
    }

    public static LedgerCall confirmDelivery(long tradeId) {
        return new LedgerCall(LedgerFunction.CONFIRM_DELIVERY, List.of(BigInteger.valueOf(tradeId)), BigInteger.ZERO);
    }

    public static LedgerCall raiseDispute(long tradeId, String reason) {
        return new LedgerCall(LedgerFunction.RAISE_DISPUTE, List.of(BigInteger.valueOf(tradeId), reason), BigInteger.ZERO);
    }

    public static LedgerCall resolveDispute(long tradeId, String recipient, BigInteger amount, String note) {
        return new LedgerCall(LedgerFunction.RESOLVE_DISPUTE,
                List.of(BigInteger.valueOf(tradeId), recipient, amount, note), BigInteger.ZERO);
    }

    public static LedgerCall timeoutRefund(long tradeId) {
        return new LedgerCall(LedgerFunction.TIMEOUT_REFUND, List.of(BigInteger.valueOf(tradeId)), BigInteger.ZERO);
    }

    public static LedgerCall updatePlatformFee(int feeBps) {
        return new LedgerCall(LedgerFunction.UPDATE_PLATFORM_FEE, List.of(BigInteger.valueOf(feeBps)), BigInteger.ZERO);
    }

    public static LedgerCall updateFeeRecipient(String feeRecipient) {
        return new LedgerCall(LedgerFunction.UPDATE_FEE_RECIPIENT, List.of(feeRecipient), BigInteger.ZERO);
    }

    public static LedgerCall updateTimeoutDuration(long seconds) {
        return new LedgerCall(LedgerFunction.UPDATE_TIMEOUT_DURATION, List.of(BigInteger.valueOf(seconds)), BigInteger.ZERO);
    }

    public String stringArgument(int index) {
        return (String) arguments.get(index);
    }

    public BigInteger integerArgument(int index) {
        return (BigInteger) arguments.get(index);
    }
}
