package com.fintech.escrow.entity;

public enum FundingPath {
    /** The buyer signs and submits with their own key. */
    SELF_CUSTODIAL,
    /** The platform key submits on the buyer's behalf and becomes the on-ledger buyer. */
    CUSTODIAL
}
