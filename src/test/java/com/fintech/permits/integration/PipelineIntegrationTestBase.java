package com.fintech.permits.integration;

import com.fintech.permits.client.MockIssuanceBackendClient;
import com.fintech.permits.client.MockPaymentGatewayClient;
import com.fintech.permits.entity.Application;
import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.repository.ApplicationRepository;
import com.fintech.permits.repository.PaymentEventRepository;
import com.fintech.permits.repository.PaymentStateTokenRepository;
import com.fintech.permits.repository.QueueMetricsSampleRepository;
import com.fintech.permits.repository.RecoveryAttemptRepository;
import com.fintech.permits.repository.ReminderRecordRepository;
import com.fintech.permits.repository.WebhookEventRepository;
import com.fintech.permits.support.MutableClock;
import com.fintech.permits.support.TestClockConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Shared setup for tests running the full pipeline against H2 with the mock backends.
 * All schedulers are disabled in the test profile; tests drive scans and dispatch directly.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@Import(TestClockConfig.class)
public abstract class PipelineIntegrationTestBase {

    @Autowired
    protected ApplicationRepository applicationRepository;

    @Autowired
    protected PaymentEventRepository paymentEventRepository;

    @Autowired
    protected WebhookEventRepository webhookEventRepository;

    @Autowired
    protected RecoveryAttemptRepository recoveryAttemptRepository;

    @Autowired
    protected ReminderRecordRepository reminderRecordRepository;

    @Autowired
    protected QueueMetricsSampleRepository sampleRepository;

    @Autowired
    protected PaymentStateTokenRepository stateTokenRepository;

    @Autowired
    protected MockPaymentGatewayClient mockGateway;

    @Autowired
    protected MockIssuanceBackendClient mockIssuance;

    @Autowired
    protected CircuitBreakerRegistry circuitBreakerRegistry;

    @Autowired
    protected MutableClock clock;

    @BeforeEach
    void resetPipeline() {
        paymentEventRepository.deleteAll();
        reminderRecordRepository.deleteAll();
        recoveryAttemptRepository.deleteAll();
        webhookEventRepository.deleteAll();
        sampleRepository.deleteAll();
        stateTokenRepository.deleteAll();
        applicationRepository.deleteAll();

        clock.reset();
        mockGateway.clearMockData();
        mockGateway.setSimulateOutage(false);
        mockIssuance.reset();
        circuitBreakerRegistry.getAllCircuitBreakers().forEach(CircuitBreaker::reset);
    }

    protected LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    protected Application createApplication(ApplicationStatus status, String orderId, String intentId) {
        LocalDateTime now = now();
        return applicationRepository.save(Application.builder()
                .status(status)
                .paymentOrderId(orderId)
                .paymentIntentId(intentId)
                .amount(new BigDecimal("150.00"))
                .currency("MXN")
                .createdAt(now)
                .updatedAt(now)
                .build());
    }

    protected Application reload(Long applicationId) {
        return applicationRepository.findById(applicationId).orElseThrow();
    }
}
