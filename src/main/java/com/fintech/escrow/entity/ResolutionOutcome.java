package com.fintech.escrow.entity;

public enum ResolutionOutcome {
    REFUND_TO_BUYER,
    PAYOUT_TO_SELLER,
    PARTIAL_SPLIT
}
