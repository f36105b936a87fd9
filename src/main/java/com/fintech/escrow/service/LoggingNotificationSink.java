package com.fintech.escrow.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default sink: writes each transition to the log.
 */
@Component
@Slf4j
public class LoggingNotificationSink implements EscrowNotificationSink {

    @Override
    public void onTransition(EscrowTransitionEvent event) {
        log.info("Escrow {} (agreement {}) moved {} -> {}{}",
                event.escrowId(), event.agreementId(), event.from(), event.to(),
                event.provisional() ? " [provisional]" : "");
    }
}
