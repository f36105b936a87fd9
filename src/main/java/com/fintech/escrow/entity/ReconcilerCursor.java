package com.fintech.escrow.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Last ledger block whose events are fully applied, per ledger connection.
 */
@Entity
@Table(name = "reconciler_cursors")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconcilerCursor {

    @Id
    @Column(name = "connection_name", length = 100)
    private String connectionName;

    @Column(name = "last_processed_block", nullable = false)
    private long lastProcessedBlock;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    @PreUpdate
    protected void touch() {
        updatedAt = LocalDateTime.now(ZoneOffset.UTC);
    }
}
