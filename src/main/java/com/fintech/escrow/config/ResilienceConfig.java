package com.fintech.escrow.config;

import com.fintech.escrow.exception.LedgerSubmissionException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Circuit breaker around platform-signed ledger submissions.
 * <p>
 * While the node keeps failing, custodial funding, dispute resolutions and
 * relayed actions fail fast instead of broadcasting. Reads are not wrapped;
 * callers retry them.
 * <p>
 * A reverted call says nothing about node health and is not counted as a
 * failure. Only retryable submission errors are.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    public static final String LEDGER_RPC = "ledgerRpc";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig submissions = CircuitBreakerConfig.custom()
                .slidingWindowSize(10)
                .minimumNumberOfCalls(5)
                .failureRateThreshold(50)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .recordException(ResilienceConfig::isNodeFailure)
                .build();

        return CircuitBreakerRegistry.of(submissions);
    }

    @Bean
    public CircuitBreaker ledgerCircuitBreaker(CircuitBreakerRegistry circuitBreakerRegistry) {
        CircuitBreaker breaker = circuitBreakerRegistry.circuitBreaker(LEDGER_RPC);
        breaker.getEventPublisher().onStateTransition(event ->
                log.warn("Ledger circuit breaker {}", event.getStateTransition()));
        return breaker;
    }

    static boolean isNodeFailure(Throwable error) {
        if (error instanceof LedgerSubmissionException) {
            return ((LedgerSubmissionException) error).isRetryable();
        }
        return true;
    }
}
