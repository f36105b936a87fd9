package com.fintech.escrow.repository;

import com.fintech.escrow.entity.DisputeResolution;
import com.fintech.escrow.entity.ResolutionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface DisputeResolutionRepository extends JpaRepository<DisputeResolution, Long> {

    Optional<DisputeResolution> findFirstByEscrowIdAndStatusOrderByIdDesc(Long escrowId, ResolutionStatus status);

    List<DisputeResolution> findByEscrowIdOrderByIdAsc(Long escrowId);

    boolean existsByEscrowIdAndStatus(Long escrowId, ResolutionStatus status);
}
