package com.fintech.escrow.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of a ledger call submitted on behalf of a user or anyone
 * (timeout refund). The local record follows once the event is reconciled.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerActionResult {
    private Long escrowId;
    private String action;
    private String txReference;
    private boolean mined;
    private String message;
}
