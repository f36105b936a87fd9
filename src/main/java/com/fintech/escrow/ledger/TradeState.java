package com.fintech.escrow.ledger;

import java.util.Arrays;

/**
 * Trade states as stored by the escrow contract. The ordinal is the value
 * returned on the wire by {@code getTrade}.
 */
public enum TradeState {
    AWAITING_FUND(0),
    FUNDED(1),
    /** Reserved by the contract ABI, no transition leads here. */
    AWAITING_DELIVERY(2),
    COMPLETE(3),
    DISPUTED(4);

    private final int code;

    TradeState(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static TradeState fromCode(int code) {
        return Arrays.stream(values())
                .filter(state -> state.code == code)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown trade state code: " + code));
    }
}
