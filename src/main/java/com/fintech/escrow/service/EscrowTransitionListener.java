package com.fintech.escrow.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.util.List;

/**
 * Fans committed transitions out to every notification sink. A failing sink
 * does not affect the others or the already committed transition.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EscrowTransitionListener {

    private final List<EscrowNotificationSink> sinks;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onTransition(EscrowTransitionEvent event) {
        for (EscrowNotificationSink sink : sinks) {
            try {
                sink.onTransition(event);
            } catch (RuntimeException e) {
                log.error("Notification sink {} failed for escrow {} ({} -> {})",
                        sink.getClass().getSimpleName(), event.escrowId(), event.from(), event.to(), e);
            }
        }
    }
}
