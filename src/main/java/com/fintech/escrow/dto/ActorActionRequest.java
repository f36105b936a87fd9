package com.fintech.escrow.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Action requested by a trade party. {@code reason} is only used when
 * raising a dispute.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActorActionRequest {

    @NotNull
    private Long actorId;

    @Size(max = 1000)
    private String reason;
}
