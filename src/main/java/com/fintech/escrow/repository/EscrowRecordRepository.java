package com.fintech.escrow.repository;

import com.fintech.escrow.entity.EscrowRecord;
import com.fintech.escrow.entity.EscrowState;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Repository for escrow records.
 */
@Repository
public interface EscrowRecordRepository extends JpaRepository<EscrowRecord, Long> {

    Optional<EscrowRecord> findByAgreementId(String agreementId);

    Optional<EscrowRecord> findByLedgerTradeId(Long ledgerTradeId);

    boolean existsByAgreementId(String agreementId);

    Page<EscrowRecord> findByState(EscrowState state, Pageable pageable);

    long countByState(EscrowState state);

    /**
     * Records where the user is buyer or seller, newest first. A null state
     * matches every state.
     */
    @Query("SELECT r FROM EscrowRecord r WHERE (r.buyerId = :actorId OR r.sellerId = :actorId) " +
            "AND (:state IS NULL OR r.state = :state) " +
            "ORDER BY r.createdAt DESC, r.id DESC")
    Page<EscrowRecord> findByParticipant(
            @Param("actorId") Long actorId,
            @Param("state") EscrowState state,
            Pageable pageable
    );

    /**
     * Funded records still awaiting delivery confirmation that were funded
     * before the given instant. Excludes records on consistency hold.
     */
    @Query("SELECT r FROM EscrowRecord r WHERE r.state = :state " +
            "AND r.fundedAt < :fundedBefore " +
            "AND r.consistencyHold = false " +
            "ORDER BY r.fundedAt ASC")
    List<EscrowRecord> findAwaitingConfirmationFundedBefore(
            @Param("state") EscrowState state,
            @Param("fundedBefore") LocalDateTime fundedBefore
    );

    /**
     * Funded records whose ledger timeout has passed.
     */
    @Query("SELECT r FROM EscrowRecord r WHERE r.state = :state " +
            "AND r.ledgerTimeoutAt IS NOT NULL AND r.ledgerTimeoutAt <= :now " +
            "AND r.consistencyHold = false " +
            "ORDER BY r.ledgerTimeoutAt ASC")
    List<EscrowRecord> findTimedOut(
            @Param("state") EscrowState state,
            @Param("now") LocalDateTime now
    );

    /**
     * Records with a stored funding transaction that have not used up their
     * verification attempts. Prevents infinite retry loops.
     */
    @Query("SELECT r FROM EscrowRecord r WHERE r.state = :state " +
            "AND r.fundingTxReference IS NOT NULL " +
            "AND r.consistencyHold = false " +
            "AND (r.verificationAttempts IS NULL OR r.verificationAttempts < :maxAttempts) " +
            "ORDER BY r.updatedAt ASC")
    Page<EscrowRecord> findRetryableVerifications(
            @Param("state") EscrowState state,
            @Param("maxAttempts") int maxAttempts,
            Pageable pageable
    );

    /**
     * Records an administrator has to look at: verification attempts used up,
     * or placed on consistency hold.
     */
    @Query("SELECT r FROM EscrowRecord r WHERE r.consistencyHold = true " +
            "OR (r.state = :pendingState AND r.verificationAttempts >= :maxAttempts) " +
            "ORDER BY r.updatedAt ASC")
    List<EscrowRecord> findNeedingManualReview(
            @Param("pendingState") EscrowState pendingState,
            @Param("maxAttempts") int maxAttempts
    );

    @Query("SELECT r.state, COUNT(r) FROM EscrowRecord r GROUP BY r.state")
    List<Object[]> getStateCounts();
}
