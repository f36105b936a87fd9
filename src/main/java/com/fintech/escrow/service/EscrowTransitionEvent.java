package com.fintech.escrow.service;

import com.fintech.escrow.entity.EscrowState;

import java.time.LocalDateTime;

/**
 * Published whenever an escrow record changes state. Delivered to
 * notification sinks after the surrounding transaction commits.
 */
public record EscrowTransitionEvent(Long escrowId,
                                    String agreementId,
                                    Long buyerId,
                                    Long sellerId,
                                    EscrowState from,
                                    EscrowState to,
                                    boolean provisional,
                                    LocalDateTime occurredAt) {
}
