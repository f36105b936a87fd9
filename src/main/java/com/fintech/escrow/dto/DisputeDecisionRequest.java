package com.fintech.escrow.dto;

import com.fintech.escrow.entity.ResolutionOutcome;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Administrator decision on a disputed escrow. Recipient and amount are
 * required for a partial split and default to the named party and the full
 * amount otherwise.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DisputeDecisionRequest {

    @NotNull
    private ResolutionOutcome outcome;

    private String recipientAddress;

    private BigInteger amountWei;

    @NotBlank
    @Size(max = 1000)
    private String note;

    @NotNull
    private Long adminId;
}
