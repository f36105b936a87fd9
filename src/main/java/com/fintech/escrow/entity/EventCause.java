package com.fintech.escrow.entity;

public enum EventCause {
    /** Observed on the ledger by the reconciler. */
    LEDGER_EVENT,
    /** Written by a local actor (coordinator, resolver, relay, admin). */
    LOCAL_ACTION
}
