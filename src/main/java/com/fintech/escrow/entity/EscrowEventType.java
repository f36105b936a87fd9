package com.fintech.escrow.entity;

public enum EscrowEventType {
    CREATED,
    FUNDING_SUBMITTED,
    VERIFICATION_FAILED,
    LEDGER_TRADE_ATTACHED,
    FUNDED,
    DELIVERY_CONFIRMED,
    RELEASED,
    DISPUTED,
    RESOLUTION_SUBMITTED,
    RESOLUTION_FAILED,
    RESOLVED,
    TIMEOUT_REFUND,
    ACTION_SUBMITTED,
    CONSISTENCY_VIOLATION,
    HOLD_RELEASED
}
