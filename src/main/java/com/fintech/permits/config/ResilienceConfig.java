package com.fintech.permits.config;

import com.fintech.permits.exception.PermanentGatewayException;
import com.fintech.permits.exception.TransientGatewayException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.policy.SimpleRetryPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.Map;

/**
 * Resilience settings for outbound calls and ledger writes.
 * <p>
 * Circuit breaker: protects against cascading failures when the payment gateway
 * or the issuance backend is down.
 * <p>
 * Time limiters: every outbound call has an explicit deadline. A call that runs
 * past it counts as a transient failure.
 * <p>
 * Retry templates: bounded retries with backoff for transient issuance failures
 * and for lock conflicts on the idempotency ledger.
 */
@Configuration
public class ResilienceConfig {

    public static final String PAYMENT_GATEWAY = "paymentGateway";
    public static final String ISSUANCE_BACKEND = "issuanceBackend";

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerConfig config = CircuitBreakerConfig.custom()
                // Number of calls to record before calculating failure rate
                .slidingWindowSize(10)
                // Failure rate threshold to open the circuit (50%)
                .failureRateThreshold(50)
                // Time to wait before transitioning from OPEN to HALF_OPEN
                .waitDurationInOpenState(Duration.ofSeconds(30))
                // Number of calls permitted in HALF_OPEN state
                .permittedNumberOfCallsInHalfOpenState(3)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                // A rejected request says nothing about backend health
                .ignoreExceptions(PermanentGatewayException.class)
                .build();

        return CircuitBreakerRegistry.of(config);
    }

    @Bean
    public TimeLimiterRegistry timeLimiterRegistry(PipelineProperties properties) {
        TimeLimiterRegistry registry = TimeLimiterRegistry.ofDefaults();

        registry.timeLimiter(PAYMENT_GATEWAY, TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(properties.getRecovery().getGatewayTimeoutMs()))
                .cancelRunningFuture(true)
                .build());

        registry.timeLimiter(ISSUANCE_BACKEND, TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofMillis(properties.getIssuance().getTimeoutMs()))
                .cancelRunningFuture(true)
                .build());

        return registry;
    }

    /**
     * Retries for the permit issuance call. Only transient failures are retried;
     * permanent rejections surface on the first attempt.
     */
    @Bean
    public RetryTemplate issuanceRetryTemplate(PipelineProperties properties) {
        PipelineProperties.Queue queue = properties.getQueue();
        return RetryTemplate.builder()
                .maxAttempts(queue.getMaxAttempts())
                .exponentialBackoff(queue.getInitialBackoffMs(), queue.getBackoffMultiplier(), queue.getMaxBackoffMs())
                .retryOn(TransientGatewayException.class)
                .traversingCauses()
                .build();
    }

    /**
     * Retries for idempotency ledger inserts that hit a lock conflict with a concurrent,
     * uncommitted insert. Unique-constraint violations are final and not retried.
     */
    @Bean
    public RetryTemplate ledgerRetryTemplate(PipelineProperties properties) {
        PipelineProperties.Webhook webhook = properties.getWebhook();

        SimpleRetryPolicy retryPolicy = new SimpleRetryPolicy(webhook.getLedgerWriteAttempts(), Map.of(
                DataIntegrityViolationException.class, false,
                DataAccessException.class, true), true);

        FixedBackOffPolicy backOffPolicy = new FixedBackOffPolicy();
        backOffPolicy.setBackOffPeriod(webhook.getLedgerWriteBackoffMs());

        RetryTemplate template = new RetryTemplate();
        template.setRetryPolicy(retryPolicy);
        template.setBackOffPolicy(backOffPolicy);
        return template;
    }
}
