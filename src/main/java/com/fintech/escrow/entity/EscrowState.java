package com.fintech.escrow.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a local escrow record.
 * <p>
 * awaiting_fund -> [pending_verification ->] funded -> (complete | disputed),
 * disputed -> complete. No backward transitions.
 */
public enum EscrowState {
    AWAITING_FUND(0),
    PENDING_VERIFICATION(1),
    FUNDED(2),
    DISPUTED(3),
    COMPLETE(4);

    private final int rank;

    EscrowState(int rank) {
        this.rank = rank;
    }

    public int getRank() {
        return rank;
    }

    public boolean isTerminal() {
        return this == COMPLETE;
    }

    /**
     * True if this state already reflects {@code target} or a later stage.
     * DISPUTED counts as past FUNDED and COMPLETE as past everything.
     */
    public boolean isAtOrPast(EscrowState target) {
        return rank >= target.rank;
    }

    public boolean canTransitionTo(EscrowState target) {
        return allowedTargets().contains(target);
    }

    private Set<EscrowState> allowedTargets() {
        return switch (this) {
            case AWAITING_FUND -> EnumSet.of(PENDING_VERIFICATION, FUNDED);
            case PENDING_VERIFICATION -> EnumSet.of(FUNDED);
            case FUNDED -> EnumSet.of(DISPUTED, COMPLETE);
            case DISPUTED -> EnumSet.of(COMPLETE);
            case COMPLETE -> EnumSet.noneOf(EscrowState.class);
        };
    }
}
