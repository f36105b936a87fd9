package com.fintech.escrow.ledger;

/**
 * State-changing entry points of the escrow contract, by wire name.
 */
public enum LedgerFunction {
    CREATE_AND_FUND("createAndFund", true),
    CREATE_TRADE_WITHOUT_FUND("createTradeWithoutFund", false),
    FUND_TRADE("fundTrade", true),
    CONFIRM_DELIVERY("confirmDelivery", false),
    RAISE_DISPUTE("raiseDispute", false),
    RESOLVE_DISPUTE("resolveDispute", false),
    TIMEOUT_REFUND("timeoutRefund", false),
    UPDATE_PLATFORM_FEE("updatePlatformFee", false),
    UPDATE_FEE_RECIPIENT("updateFeeRecipient", false),
    UPDATE_TIMEOUT_DURATION("updateTimeoutDuration", false);

    private final String wireName;
    private final boolean payable;

    LedgerFunction(String wireName, boolean payable) {
        this.wireName = wireName;
        this.payable = payable;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isPayable() {
        return payable;
    }
}
