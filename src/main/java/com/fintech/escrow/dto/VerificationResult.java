package com.fintech.escrow.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of verifying a funding transaction against an escrow record.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResult {

    public enum FailureReason {
        NOT_FOUND,
        REVERTED,
        INSUFFICIENT_CONFIRMATIONS,
        NO_FUNDING_EVENT,
        TRADE_MISMATCH,
        PARTY_MISMATCH,
        AMOUNT_MISMATCH,
        TRADE_ALREADY_BOUND;

        /** The transaction may still verify once it is mined deeper. */
        public boolean isTransient() {
            return this == NOT_FOUND || this == INSUFFICIENT_CONFIRMATIONS;
        }
    }

    private boolean verified;
    private String txReference;
    private Long tradeId;
    private long blockNumber;
    private long confirmations;
    private FailureReason reason;
    private String message;

    public static VerificationResult success(String txReference, long tradeId, long blockNumber,
                                             long confirmations) {
        return VerificationResult.builder()
                .verified(true)
                .txReference(txReference)
                .tradeId(tradeId)
                .blockNumber(blockNumber)
                .confirmations(confirmations)
                .build();
    }

    public static VerificationResult failure(String txReference, FailureReason reason, String message) {
        return VerificationResult.builder()
                .verified(false)
                .txReference(txReference)
                .reason(reason)
                .message(message)
                .build();
    }
}
