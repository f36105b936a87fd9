package com.fintech.escrow.dto;

import com.fintech.escrow.entity.EscrowRecord;
import com.fintech.escrow.entity.EscrowState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * What an actor may do with an escrow right now. Computed on every read and
 * never stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscrowPermissions {

    private boolean canBeFunded;
    private boolean canConfirmDelivery;
    private boolean canRaiseDispute;
    private boolean canTimeoutRefund;

    public static EscrowPermissions compute(EscrowRecord record, Long actorId, LocalDateTime now) {
        if (record.isConsistencyHold()) {
            return new EscrowPermissions(false, false, false, false);
        }
        boolean isBuyer = actorId != null && Objects.equals(actorId, record.getBuyerId());
        boolean isSeller = actorId != null && Objects.equals(actorId, record.getSellerId());
        boolean funded = record.getState() == EscrowState.FUNDED;
        boolean timedOut = record.getLedgerTimeoutAt() != null && !now.isBefore(record.getLedgerTimeoutAt());

        return EscrowPermissions.builder()
                .canBeFunded(isBuyer && (record.getState() == EscrowState.AWAITING_FUND
                        || record.getState() == EscrowState.PENDING_VERIFICATION))
                .canConfirmDelivery(funded && (isBuyer || isSeller))
                .canRaiseDispute(funded && (isBuyer || isSeller))
                .canTimeoutRefund(funded && timedOut)
                .build();
    }
}
