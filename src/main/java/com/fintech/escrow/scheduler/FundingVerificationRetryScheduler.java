package com.fintech.escrow.scheduler;

import com.fintech.escrow.dto.FundingResult;
import com.fintech.escrow.entity.EscrowRecord;
import com.fintech.escrow.entity.EscrowState;
import com.fintech.escrow.exception.EscrowException;
import com.fintech.escrow.exception.FundingVerificationException;
import com.fintech.escrow.service.EscrowRecordStore;
import com.fintech.escrow.service.FundingCoordinator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Re-verifies funding transactions of records stuck in PENDING_VERIFICATION,
 * typically because they were not deep enough yet when first checked.
 * <p>
 * Records that run out of attempts drop out of the query and show up in the
 * manual review list instead.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FundingVerificationRetryScheduler {

    private final EscrowRecordStore store;
    private final FundingCoordinator fundingCoordinator;

    @Value("${escrow.funding.retry.enabled:true}")
    private boolean retryEnabled;

    @Value("${escrow.funding.retry.batch-size:50}")
    private int batchSize;

    @Value("${escrow.funding.max-verification-attempts:5}")
    private int maxVerificationAttempts;

    @Scheduled(fixedDelayString = "${escrow.funding.retry.interval-ms:60000}")
    public void retryPendingVerifications() {
        if (!retryEnabled) {
            log.debug("Funding verification retry is disabled, skipping run");
            return;
        }

        List<EscrowRecord> pending = store
                .findRetryableVerifications(maxVerificationAttempts, PageRequest.of(0, batchSize))
                .getContent();
        if (pending.isEmpty()) {
            return;
        }
        log.info("Retrying verification of {} pending funding transaction(s)", pending.size());

        int funded = 0;
        for (EscrowRecord record : pending) {
            try {
                Optional<FundingResult> result = fundingCoordinator.retryVerification(record.getId());
                if (result.isPresent() && result.get().getState() == EscrowState.FUNDED) {
                    funded++;
                }
            } catch (FundingVerificationException e) {
                log.error("Escrow {} needs manual review: {}", record.getId(), e.getMessage());
            } catch (EscrowException e) {
                log.warn("Verification retry of escrow {} failed at {}: {}",
                        record.getId(), e.getStep().getCode(), e.getMessage());
            } catch (Exception e) {
                log.error("Unexpected error retrying verification of escrow {}", record.getId(), e);
            }
        }
        log.info("Verification retry finished: {} of {} escrow(s) funded", funded, pending.size());
    }
}
