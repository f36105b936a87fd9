package com.fintech.escrow.dto;

import com.fintech.escrow.entity.ResolutionOutcome;
import lombok.Builder;
import lombok.Value;

import java.math.BigInteger;

/**
 * Split of an escrowed amount between the named recipient and the other
 * party. The two amounts always add up to the escrowed amount.
 */
@Value
@Builder
public class PayoutPlan {
    ResolutionOutcome outcome;
    String recipientAddress;
    BigInteger recipientAmountWei;
    String counterpartyAddress;
    BigInteger counterpartyAmountWei;

    public BigInteger total() {
        return recipientAmountWei.add(counterpartyAmountWei);
    }
}
