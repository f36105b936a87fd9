package com.fintech.escrow;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Escrow Settlement Service
 * <p>
 * Settles bilateral trades through value held by a ledger escrow contract
 * and keeps a local record of every trade consistent with the ledger.
 * <p>
 * Key Features:
 * - Self-custodial and custodial funding with on-ledger verification
 * - Scheduled replay of ledger events into the local record
 * - Dispute resolution driven by administrator decisions
 * - Resilient ledger communication with retry and circuit breaker
 */
@SpringBootApplication
@EnableScheduling
@EnableRetry
public class EscrowSettlementApplication {

    public static void main(String[] args) {
        SpringApplication.run(EscrowSettlementApplication.class, args);
    }
}
