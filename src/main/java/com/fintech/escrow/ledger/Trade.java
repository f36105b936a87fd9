package com.fintech.escrow.ledger;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Snapshot of a trade as held by the escrow contract.
 * Timestamps are ledger seconds since the epoch.
 */
@Value
@Builder(toBuilder = true)
public class Trade {
    long tradeId;
    String buyer;
    String seller;
    BigInteger amount;
    TradeState state;
    long createdAt;
    long timeoutAt;
    String metadata;

    public LocalDateTime timeoutAtUtc() {
        return LocalDateTime.ofEpochSecond(timeoutAt, 0, ZoneOffset.UTC);
    }
}
