package com.fintech.escrow.dto;

import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * What a funding transaction must show to count as funding an escrow.
 * {@code tradeId} is null when the escrow is not yet bound to a ledger trade.
 */
@Value
@Builder(toBuilder = true)
public class ExpectedFunding {
    Long tradeId;
    String buyerAddress;
    String sellerAddress;
    BigInteger amountWei;
}
