package com.fintech.permits.client;

import com.fintech.permits.config.ResilienceConfig;
import com.fintech.permits.dto.IssuanceRequest;
import com.fintech.permits.dto.IssuanceResult;
import com.fintech.permits.exception.GatewayException;
import com.fintech.permits.exception.PermanentGatewayException;
import com.fintech.permits.exception.TransientGatewayException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Mock issuance backend.
 * <p>
 * Issues a permit for every request unless told otherwise. Tests can script
 * transient failures, permanent rejections, outages and slow responses per application.
 */
@Component
@Slf4j
public class MockIssuanceBackendClient implements IssuanceBackendClient {

    private static final String BACKEND_NAME = "MockIssuanceBackend";

    private final Map<Long, AtomicInteger> transientFailuresRemaining = new ConcurrentHashMap<>();
    private final Map<Long, String> permanentRejections = new ConcurrentHashMap<>();
    private final Map<Long, AtomicInteger> callCounts = new ConcurrentHashMap<>();

    private final Random random = new Random();
    private final Clock clock;

    @Value("${issuance.mock.latency-ms:200}")
    private volatile int latencyMs;

    private volatile boolean simulateOutage = false;
    private volatile boolean reportExpiry = false;
    private volatile int reportedValidityDays = 30;

    public MockIssuanceBackendClient(Clock clock) {
        this.clock = clock;
    }

    @Override
    @CircuitBreaker(name = ResilienceConfig.ISSUANCE_BACKEND, fallbackMethod = "issueFallback")
    public IssuanceResult issue(IssuanceRequest request) {
        Long applicationId = request.getApplicationId();
        callCounts.computeIfAbsent(applicationId, k -> new AtomicInteger()).incrementAndGet();
        log.debug("Issuing permit for application {} (attempt {})", applicationId, request.getAttempt());

        simulateLatency();

        if (simulateOutage) {
            throw new TransientGatewayException(
                    "Issuance backend is currently unavailable", BACKEND_NAME, String.valueOf(applicationId));
        }

        String rejection = permanentRejections.get(applicationId);
        if (rejection != null) {
            throw new PermanentGatewayException(rejection, BACKEND_NAME, String.valueOf(applicationId));
        }

        AtomicInteger remaining = transientFailuresRemaining.get(applicationId);
        if (remaining != null && remaining.getAndUpdate(n -> Math.max(0, n - 1)) > 0) {
            throw new TransientGatewayException(
                    "Simulated issuance portal error", BACKEND_NAME, String.valueOf(applicationId));
        }

        LocalDateTime issuedAt = LocalDateTime.now(clock);
        String permitNumber = String.format("PRM-%d-%04d", applicationId, random.nextInt(10000));

        return IssuanceResult.builder()
                .permitNumber(permitNumber)
                .artifactLocation("permits/" + applicationId + "/" + permitNumber + ".pdf")
                .expiresAt(reportExpiry ? issuedAt.plusDays(reportedValidityDays) : null)
                .issuedAt(issuedAt)
                .build();
    }

    public IssuanceResult issueFallback(IssuanceRequest request, Throwable throwable) {
        if (throwable instanceof GatewayException) {
            throw (GatewayException) throwable;
        }
        log.warn("Circuit breaker triggered for issuance of application {}: {}",
                request.getApplicationId(), throwable.getMessage());

        throw new TransientGatewayException(
                "Issuance backend circuit breaker is open. Service temporarily unavailable.",
                BACKEND_NAME, String.valueOf(request.getApplicationId()), throwable);
    }

    private void simulateLatency() {
        if (latencyMs > 0) {
            try {
                Thread.sleep(latencyMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public String getBackendName() {
        return BACKEND_NAME;
    }

    // Methods for testing/simulation control

    public void failTransiently(Long applicationId, int times) {
        transientFailuresRemaining.put(applicationId, new AtomicInteger(times));
    }

    public void rejectPermanently(Long applicationId, String reason) {
        permanentRejections.put(applicationId, reason);
    }

    public int getCallCount(Long applicationId) {
        AtomicInteger count = callCounts.get(applicationId);
        return count == null ? 0 : count.get();
    }

    public void setLatencyMs(int latencyMs) {
        this.latencyMs = latencyMs;
    }

    public void setSimulateOutage(boolean outage) {
        this.simulateOutage = outage;
        log.info("Issuance backend outage simulation set to: {}", outage);
    }

    public void setReportExpiry(boolean reportExpiry, int validityDays) {
        this.reportExpiry = reportExpiry;
        this.reportedValidityDays = validityDays;
    }

    public void reset() {
        transientFailuresRemaining.clear();
        permanentRejections.clear();
        callCounts.clear();
        simulateOutage = false;
        reportExpiry = false;
    }
}
