package com.fintech.escrow.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.escrow.entity.EscrowEvent;
import com.fintech.escrow.entity.EscrowEventType;
import com.fintech.escrow.entity.EscrowRecord;
import com.fintech.escrow.entity.EscrowState;
import com.fintech.escrow.entity.EventCause;
import com.fintech.escrow.entity.FundingPath;
import com.fintech.escrow.exception.EscrowConsistencyException;
import com.fintech.escrow.exception.EscrowNotFoundException;
import com.fintech.escrow.exception.EscrowValidationException;
import com.fintech.escrow.exception.StaleEscrowStateException;
import com.fintech.escrow.ledger.LoggedEvent;
import com.fintech.escrow.repository.EscrowEventRepository;
import com.fintech.escrow.repository.EscrowRecordRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Durable local mirror of escrowed trades and their append-only event log.
 * <p>
 * Every state change goes through {@link #transition}: the caller names the
 * state it read, and the write is refused when the record has moved on since.
 * The JPA version column catches writers that race past that check; a lost
 * race surfaces as {@link StaleEscrowStateException}.
 */
@Service
@Slf4j
public class EscrowRecordStore {

    public enum TransitionOutcome {
        APPLIED,
        /** The record was no longer in the expected prior state. Nothing was written. */
        STALE
    }

    private final EscrowRecordRepository recordRepository;
    private final EscrowEventRepository eventRepository;
    private final ApplicationEventPublisher eventPublisher;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @PersistenceContext
    private EntityManager entityManager;

    public EscrowRecordStore(EscrowRecordRepository recordRepository,
                             EscrowEventRepository eventRepository,
                             ApplicationEventPublisher eventPublisher,
                             ObjectMapper objectMapper,
                             Clock clock) {
        this.recordRepository = recordRepository;
        this.eventRepository = eventRepository;
        this.eventPublisher = eventPublisher;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Persists a new record in AWAITING_FUND and logs its creation.
     *
     * @throws EscrowValidationException if an escrow already exists for the agreement
     */
    @Transactional
    public EscrowRecord create(EscrowRecord record) {
        if (recordRepository.existsByAgreementId(record.getAgreementId())) {
            throw new EscrowValidationException("Escrow already exists for agreement " + record.getAgreementId());
        }
        record.setState(EscrowState.AWAITING_FUND);
        EscrowRecord saved;
        try {
            saved = recordRepository.saveAndFlush(record);
        } catch (DataIntegrityViolationException e) {
            throw new EscrowValidationException("Escrow already exists for agreement " + record.getAgreementId());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("agreementId", saved.getAgreementId());
        payload.put("buyerAddress", saved.getBuyerAddress());
        payload.put("sellerAddress", saved.getSellerAddress());
        payload.put("amountWei", saved.getAmountWei().toString());
        appendLocalEvent(saved.getId(), EscrowEventType.CREATED, payload, false);

        log.info("Created escrow {} for agreement {} ({} wei)",
                saved.getId(), saved.getAgreementId(), saved.getAmountWei());
        return saved;
    }

    @Transactional(readOnly = true)
    public EscrowRecord getRequired(Long escrowId) {
        return recordRepository.findById(escrowId)
                .orElseThrow(() -> new EscrowNotFoundException(escrowId));
    }

    @Transactional(readOnly = true)
    public Optional<EscrowRecord> find(Long escrowId) {
        return recordRepository.findById(escrowId);
    }

    @Transactional(readOnly = true)
    public Optional<EscrowRecord> findByAgreementId(String agreementId) {
        return recordRepository.findByAgreementId(agreementId);
    }

    @Transactional(readOnly = true)
    public Optional<EscrowRecord> findByLedgerTradeId(long tradeId) {
        return recordRepository.findByLedgerTradeId(tradeId);
    }

    /**
     * Re-reads a record from the database, discarding any state cached in the
     * current persistence context.
     */
    @Transactional(readOnly = true)
    public EscrowRecord refresh(Long escrowId) {
        EscrowRecord record = getRequired(escrowId);
        entityManager.refresh(record);
        return record;
    }

    /**
     * Moves a record from {@code expectedPrior} to {@code target}, applying
     * {@code mutator} to the record first.
     *
     * @return STALE without writing if the record is not in {@code expectedPrior}
     * @throws EscrowValidationException  if the transition goes backwards or skips the lifecycle
     * @throws StaleEscrowStateException if a concurrent writer committed first
     */
    @Transactional
    public TransitionOutcome transition(Long escrowId, EscrowState expectedPrior, EscrowState target,
                                        Consumer<EscrowRecord> mutator) {
        if (!expectedPrior.canTransitionTo(target)) {
            throw new EscrowValidationException(
                    String.format("Illegal escrow transition %s -> %s", expectedPrior, target));
        }

        EscrowRecord record = getRequired(escrowId);
        if (record.getState() != expectedPrior) {
            log.debug("Stale transition on escrow {}: expected {}, found {} (target {})",
                    escrowId, expectedPrior, record.getState(), target);
            return TransitionOutcome.STALE;
        }

        mutator.accept(record);
        record.setState(target);
        try {
            recordRepository.saveAndFlush(record);
        } catch (ConcurrencyFailureException e) {
            throw new StaleEscrowStateException(escrowId,
                    String.format("Escrow %d was modified concurrently while moving %s -> %s",
                            escrowId, expectedPrior, target));
        }

        log.info("Escrow {} moved {} -> {}{}", escrowId, expectedPrior, target,
                record.isProvisional() ? " (provisional)" : "");

        eventPublisher.publishEvent(new EscrowTransitionEvent(
                record.getId(),
                record.getAgreementId(),
                record.getBuyerId(),
                record.getSellerId(),
                expectedPrior,
                target,
                record.isProvisional(),
                now()));
        return TransitionOutcome.APPLIED;
    }

    /**
     * Records a failed verification attempt. A record still awaiting funds
     * moves to PENDING_VERIFICATION; a pending one stays there.
     */
    @Transactional
    public EscrowRecord recordVerificationFailure(Long escrowId, String txReference, FundingPath path,
                                                  String ledgerBuyerAddress, String error) {
        Consumer<EscrowRecord> mutator = record -> {
            record.setFundingTxReference(txReference);
            record.setFundingPath(path);
            record.setLedgerBuyerAddress(ledgerBuyerAddress);
            record.incrementVerificationAttempts();
            record.setLastError(truncate(error, 500));
        };

        EscrowRecord record = getRequired(escrowId);
        switch (record.getState()) {
            case AWAITING_FUND -> {
                if (transition(escrowId, EscrowState.AWAITING_FUND, EscrowState.PENDING_VERIFICATION, mutator)
                        == TransitionOutcome.STALE) {
                    throw new StaleEscrowStateException(escrowId, EscrowState.AWAITING_FUND, record.getState());
                }
            }
            case PENDING_VERIFICATION -> {
                mutator.accept(record);
                saveOrStale(record);
            }
            default -> throw new StaleEscrowStateException(escrowId, EscrowState.PENDING_VERIFICATION,
                    record.getState());
        }
        return getRequired(escrowId);
    }

    /**
     * Binds the record to its ledger trade. A record bound to another trade is
     * an inconsistency.
     *
     * @return true if the binding was written, false if it already existed
     */
    @Transactional
    public boolean attachLedgerTrade(Long escrowId, long tradeId) {
        EscrowRecord record = getRequired(escrowId);
        if (record.getLedgerTradeId() != null) {
            if (record.getLedgerTradeId() != tradeId) {
                throw new EscrowConsistencyException(escrowId, String.format(
                        "Escrow %d is bound to trade %d, ledger reports trade %d",
                        escrowId, record.getLedgerTradeId(), tradeId));
            }
            return false;
        }
        record.setLedgerTradeId(tradeId);
        saveOrStale(record);
        log.info("Escrow {} bound to ledger trade {}", escrowId, tradeId);
        return true;
    }

    /**
     * Clears the provisional flag once the ledger echo of a local write has
     * been reconciled.
     */
    @Transactional
    public boolean confirmProvisional(Long escrowId) {
        EscrowRecord record = getRequired(escrowId);
        if (!record.isProvisional()) {
            return false;
        }
        record.setProvisional(false);
        saveOrStale(record);
        log.debug("Escrow {} confirmed by ledger, provisional flag cleared", escrowId);
        return true;
    }

    /**
     * Applies a field update that does not change state, such as the ledger
     * timeout or the dispute reason.
     */
    @Transactional
    public EscrowRecord update(Long escrowId, Consumer<EscrowRecord> mutator) {
        EscrowRecord record = getRequired(escrowId);
        mutator.accept(record);
        return saveOrStale(record);
    }

    /**
     * Halts automated transitions on a record until an administrator releases it.
     */
    @Transactional
    public void placeOnHold(Long escrowId, String reason) {
        EscrowRecord record = getRequired(escrowId);
        if (record.isConsistencyHold()) {
            return;
        }
        record.setConsistencyHold(true);
        record.setHoldReason(truncate(reason, 500));
        saveOrStale(record);
        log.error("Escrow {} placed on consistency hold: {}", escrowId, reason);
    }

    /**
     * Lifts a consistency hold. A record that never reached FUNDED is also
     * unbound from its ledger trade so a new funding can bind another one.
     */
    @Transactional
    public EscrowRecord releaseHold(Long escrowId, Long adminId, String note) {
        EscrowRecord record = getRequired(escrowId);
        if (!record.isConsistencyHold()) {
            throw new EscrowValidationException("Escrow " + escrowId + " is not on hold");
        }
        String previousReason = record.getHoldReason();
        record.setConsistencyHold(false);
        record.setHoldReason(null);

        // A trade that never funded the escrow must not block a correct one
        Long unboundTradeId = null;
        if (!record.getState().isAtOrPast(EscrowState.FUNDED) && record.getLedgerTradeId() != null) {
            unboundTradeId = record.getLedgerTradeId();
            record.setLedgerTradeId(null);
            record.setFundingTxReference(null);
        }
        saveOrStale(record);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("adminId", adminId);
        payload.put("note", note);
        payload.put("previousReason", previousReason);
        if (unboundTradeId != null) {
            payload.put("unboundTradeId", unboundTradeId);
            log.warn("Escrow {} released from unfunded trade {}", escrowId, unboundTradeId);
        }
        appendLocalEvent(escrowId, EscrowEventType.HOLD_RELEASED, payload, false);

        log.warn("Consistency hold on escrow {} released by admin {}: {}", escrowId, adminId, note);
        return record;
    }

    // Event log

    @Transactional
    public EscrowEvent appendLocalEvent(Long escrowId, EscrowEventType type, Map<String, Object> payload,
                                        boolean custodial) {
        return eventRepository.save(EscrowEvent.builder()
                .escrowId(escrowId)
                .eventType(type)
                .cause(EventCause.LOCAL_ACTION)
                .payload(toJson(payload))
                .custodial(custodial)
                .build());
    }

    @Transactional
    public EscrowEvent appendLedgerEvent(Long escrowId, EscrowEventType type, LoggedEvent logged,
                                         Map<String, Object> payload) {
        return eventRepository.save(EscrowEvent.builder()
                .escrowId(escrowId)
                .eventType(type)
                .cause(EventCause.LEDGER_EVENT)
                .payload(toJson(payload))
                .txReference(logged.txReference())
                .blockNumber(logged.blockNumber())
                .blockHash(logged.blockHash())
                .logIndex(logged.logIndex())
                .custodial(false)
                .build());
    }

    @Transactional(readOnly = true)
    public boolean isLedgerEventLogged(String txReference, long logIndex) {
        return eventRepository.existsByTxReferenceAndLogIndex(txReference, logIndex);
    }

    @Transactional(readOnly = true)
    public List<EscrowEvent> events(Long escrowId) {
        return eventRepository.findByEscrowIdOrderByIdAsc(escrowId);
    }

    // Queries

    /**
     * Funded records not yet delivered or disputed that were funded more
     * than {@code age} ago.
     */
    @Transactional(readOnly = true)
    public List<EscrowRecord> findAwaitingConfirmationOlderThan(Duration age) {
        return recordRepository.findAwaitingConfirmationFundedBefore(EscrowState.FUNDED, now().minus(age));
    }

    @Transactional(readOnly = true)
    public List<EscrowRecord> findTimedOut() {
        return recordRepository.findTimedOut(EscrowState.FUNDED, now());
    }

    @Transactional(readOnly = true)
    public Page<EscrowRecord> findRetryableVerifications(int maxAttempts, Pageable pageable) {
        return recordRepository.findRetryableVerifications(EscrowState.PENDING_VERIFICATION, maxAttempts, pageable);
    }

    @Transactional(readOnly = true)
    public List<EscrowRecord> findNeedingManualReview(int maxAttempts) {
        return recordRepository.findNeedingManualReview(EscrowState.PENDING_VERIFICATION, maxAttempts);
    }

    @Transactional(readOnly = true)
    public Page<EscrowRecord> findByState(EscrowState state, Pageable pageable) {
        return recordRepository.findByState(state, pageable);
    }

    @Transactional(readOnly = true)
    public Page<EscrowRecord> findByParticipant(Long actorId, EscrowState state, Pageable pageable) {
        return recordRepository.findByParticipant(actorId, state, pageable);
    }

    @Transactional(readOnly = true)
    public Map<EscrowState, Long> stateCounts() {
        Map<EscrowState, Long> counts = new EnumMap<>(EscrowState.class);
        for (EscrowState state : EscrowState.values()) {
            counts.put(state, 0L);
        }
        for (Object[] row : recordRepository.getStateCounts()) {
            counts.put((EscrowState) row[0], (Long) row[1]);
        }
        return counts;
    }

    public LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private EscrowRecord saveOrStale(EscrowRecord record) {
        try {
            return recordRepository.saveAndFlush(record);
        } catch (ConcurrencyFailureException e) {
            throw new StaleEscrowStateException(record.getId(),
                    "Escrow " + record.getId() + " was modified concurrently");
        }
    }

    private String toJson(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Event payload is not serializable", e);
        }
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
