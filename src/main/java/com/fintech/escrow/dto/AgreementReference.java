package com.fintech.escrow.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigInteger;

/**
 * Agreement handed over by the marketplace once buyer and seller have
 * agreed on a trade. One escrow is created per agreement.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AgreementReference {

    @NotBlank
    private String agreementId;

    @NotNull
    private Long buyerId;

    @NotNull
    private Long sellerId;

    @NotBlank
    private String buyerAddress;

    @NotBlank
    private String sellerAddress;

    /** Agreed amount in wei. */
    @NotNull
    @Positive
    private BigInteger agreedAmountWei;
}
