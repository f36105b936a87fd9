package com.fintech.escrow.dto;

import com.fintech.escrow.entity.EscrowEvent;
import com.fintech.escrow.entity.EscrowEventType;
import com.fintech.escrow.entity.EventCause;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscrowEventView {
    private Long id;
    private EscrowEventType eventType;
    private EventCause cause;
    private String payload;
    private String txReference;
    private Long blockNumber;
    private Long logIndex;
    private boolean custodial;
    private LocalDateTime createdAt;

    public static EscrowEventView from(EscrowEvent event) {
        return EscrowEventView.builder()
                .id(event.getId())
                .eventType(event.getEventType())
                .cause(event.getCause())
                .payload(event.getPayload())
                .txReference(event.getTxReference())
                .blockNumber(event.getBlockNumber())
                .logIndex(event.getLogIndex())
                .custodial(event.isCustodial())
                .createdAt(event.getCreatedAt())
                .build();
    }
}
