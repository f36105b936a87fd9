package com.fintech.escrow.entity;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Append-only audit row for a transition or an observed ledger event.
 * <p>
 * Ledger-originated rows carry their ledger location; (tx_reference,
 * log_index) is unique so a replayed event cannot be logged twice.
 */
@Entity
@Immutable
@Table(name = "escrow_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_escrow_event_location",
                columnNames = {"tx_reference", "log_index"}),
        indexes = @Index(name = "idx_escrow_event_escrow", columnList = "escrow_id"))
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
public class EscrowEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "escrow_id", nullable = false, updatable = false)
    private Long escrowId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, updatable = false, length = 40)
    private EscrowEventType eventType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private EventCause cause;

    @Column(length = 4000, updatable = false)
    private String payload;

    @Column(name = "tx_reference", length = 66, updatable = false)
    private String txReference;

    @Column(name = "block_number", updatable = false)
    private Long blockNumber;

    @Column(name = "block_hash", length = 66, updatable = false)
    private String blockHash;

    @Column(name = "log_index", updatable = false)
    private Long logIndex;

    @Column(nullable = false, updatable = false)
    private boolean custodial;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
