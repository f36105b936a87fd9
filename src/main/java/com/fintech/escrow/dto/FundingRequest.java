package com.fintech.escrow.dto;

import com.fintech.escrow.entity.FundingPath;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Funding intent for an escrow. Self-custodial funding carries the reference
 * of the transaction the buyer already submitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FundingRequest {

    @NotNull
    private FundingPath path;

    private String txReference;
}
