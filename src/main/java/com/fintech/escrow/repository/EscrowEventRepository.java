package com.fintech.escrow.repository;

import com.fintech.escrow.entity.EscrowEvent;
import com.fintech.escrow.entity.EscrowEventType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EscrowEventRepository extends JpaRepository<EscrowEvent, Long> {

    boolean existsByTxReferenceAndLogIndex(String txReference, Long logIndex);

    List<EscrowEvent> findByEscrowIdOrderByIdAsc(Long escrowId);

    long countByEscrowIdAndEventType(Long escrowId, EscrowEventType eventType);
}
