package com.fintech.permits.client;

import com.fintech.permits.config.ResilienceConfig;
import com.fintech.permits.dto.GatewayPaymentStatus;
import com.fintech.permits.dto.GatewayPaymentStatus.Status;
import com.fintech.permits.exception.GatewayException;
import com.fintech.permits.exception.TransientGatewayException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mock implementation of the payment gateway client.
 * <p>
 * Simulates realistic gateway behavior including:
 * - Payment intent status lookups
 * - Intermittent failures (for testing resilience)
 * - Network latency simulation
 * <p>
 * In production, this would be replaced with the actual gateway integration.
 */
@Component
@Slf4j
public class MockPaymentGatewayClient implements PaymentGatewayClient {

    private static final String GATEWAY_NAME = "MockGateway";

    // Simulated gateway-side payment intents
    private final Map<String, GatewayPaymentStatus> intents = new ConcurrentHashMap<>();

    private final Map<String, AtomicInteger> callCounts = new ConcurrentHashMap<>();

    private final Random random = new Random();

    private final Clock clock;

    @Value("${gateway.mock.failure-rate:0.1}")
    private double failureRate;

    @Value("${gateway.mock.latency-ms:50}")
    private int latencyMs;

    private volatile boolean simulateOutage = false;

    public MockPaymentGatewayClient(Clock clock) {
        this.clock = clock;
        initializeMockData();
    }

    private void initializeMockData() {
        addIntent("pi_demo_succeeded", Status.SUCCEEDED, new BigDecimal("150.00"), "MXN");
        addIntent("pi_demo_processing", Status.PROCESSING, new BigDecimal("150.00"), "MXN");
        addIntent("pi_demo_voucher", Status.REQUIRES_ACTION, new BigDecimal("150.00"), "MXN");
        addIntent("pi_demo_failed", Status.FAILED, new BigDecimal("150.00"), "MXN");

        log.info("Mock gateway initialized with {} payment intents", intents.size());
    }

    @Override
    @CircuitBreaker(name = ResilienceConfig.PAYMENT_GATEWAY, fallbackMethod = "getPaymentStatusFallback")
    @Retryable(
            retryFor = TransientGatewayException.class,
            maxAttemptsExpression = "${gateway.retry.max-attempts:3}",
            backoff = @Backoff(delayExpression = "${gateway.retry.delay-ms:1000}", multiplier = 2)
    )
    public GatewayPaymentStatus getPaymentStatus(String paymentIntentId) throws GatewayException {
        log.debug("Fetching payment intent {} from gateway", paymentIntentId);
        callCounts.computeIfAbsent(paymentIntentId, k -> new AtomicInteger()).incrementAndGet();

        simulateLatency();

        if (simulateOutage) {
            throw new TransientGatewayException(
                    "Payment gateway is currently unavailable", GATEWAY_NAME, paymentIntentId);
        }

        // Simulate random failures (network issues, timeouts)
        if (random.nextDouble() < failureRate) {
            throw new TransientGatewayException(
                    "Simulated network failure while contacting gateway", GATEWAY_NAME, paymentIntentId);
        }

        GatewayPaymentStatus status = intents.get(paymentIntentId);
        if (status == null) {
            log.warn("Payment intent not found at gateway: {}", paymentIntentId);
            return GatewayPaymentStatus.builder()
                    .paymentIntentId(paymentIntentId)
                    .status(Status.NOT_FOUND)
                    .build();
        }

        log.debug("Gateway returned status {} for intent {}", status.getStatus(), paymentIntentId);
        return status;
    }

    /**
     * Fallback when the circuit breaker is open or the call failed after retries.
     */
    public GatewayPaymentStatus getPaymentStatusFallback(String paymentIntentId, Throwable throwable) {
        if (throwable instanceof GatewayException) {
            throw (GatewayException) throwable;
        }
        log.warn("Circuit breaker triggered for payment intent {}: {}", paymentIntentId, throwable.getMessage());

        throw new TransientGatewayException(
                "Payment gateway circuit breaker is open. Service temporarily unavailable.",
                GATEWAY_NAME, paymentIntentId, throwable);
    }

    private void simulateLatency() {
        if (latencyMs > 0) {
            try {
                Thread.sleep(random.nextInt(latencyMs));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public String getGatewayName() {
        return GATEWAY_NAME;
    }

    @Override
    public boolean isAvailable() {
        return !simulateOutage;
    }

    // Methods for testing/simulation control

    public void addIntent(String paymentIntentId, Status status, BigDecimal amount, String currency) {
        intents.put(paymentIntentId, GatewayPaymentStatus.builder()
                .paymentIntentId(paymentIntentId)
                .status(status)
                .amount(amount)
                .currency(currency)
                .updatedAt(LocalDateTime.now(clock))
                .failureCode(status == Status.FAILED ? "card_declined" : null)
                .failureMessage(status == Status.FAILED ? "Your card was declined" : null)
                .build());
    }

    public void updateIntentStatus(String paymentIntentId, Status newStatus) {
        GatewayPaymentStatus existing = intents.get(paymentIntentId);
        BigDecimal amount = existing != null ? existing.getAmount() : null;
        String currency = existing != null ? existing.getCurrency() : null;
        addIntent(paymentIntentId, newStatus, amount, currency);
    }

    public int getCallCount(String paymentIntentId) {
        AtomicInteger count = callCounts.get(paymentIntentId);
        return count == null ? 0 : count.get();
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Gateway outage simulation set to: {}", outage);
    }

    public void clearMockData() {
        intents.clear();
        callCounts.clear();
    }
}
