package com.fintech.escrow.dto;

import com.fintech.escrow.entity.ResolutionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DisputeResolutionResult {
    private Long resolutionId;
    private Long escrowId;
    private ResolutionStatus status;
    private String txReference;
    private PayoutPlan payoutPlan;
    private String message;
}
