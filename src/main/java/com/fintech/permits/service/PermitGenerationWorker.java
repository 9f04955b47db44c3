package com.fintech.permits.service;

import com.fintech.permits.client.IssuanceBackendClient;
import com.fintech.permits.config.PipelineProperties;
import com.fintech.permits.config.ResilienceConfig;
import com.fintech.permits.dto.IssuanceRequest;
import com.fintech.permits.dto.IssuanceResult;
import com.fintech.permits.dto.StateChange;
import com.fintech.permits.entity.Application;
import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.entity.PaymentEvent;
import com.fintech.permits.entity.QueueStatus;
import com.fintech.permits.exception.GatewayException;
import com.fintech.permits.exception.PermanentGatewayException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns a claimed permit job into a permit.
 * <p>
 * Flow per job:
 * 1. PAYMENT_RECEIVED -> GENERATING_PERMIT
 * 2. Issuance backend call under a time limit, transient failures retried with backoff
 * 3. GENERATING_PERMIT -> PERMIT_READY, or FAILED with a reason the applicant can read
 * 4. Queue bookkeeping written with the final transition, notification, metrics sample
 */
@Service
@Slf4j
public class PermitGenerationWorker {

    static final String BACKEND_UNAVAILABLE_REASON =
            "The permit issuing service is temporarily unavailable. Our team will complete your permit manually.";
    static final String UNEXPECTED_ERROR_REASON =
            "An internal error prevented permit generation. Our team has been notified.";

    private final ApplicationStateService stateService;
    private final PermitJobQueue jobQueue;
    private final IssuanceBackendClient issuanceBackend;
    private final RetryTemplate issuanceRetryTemplate;
    private final OutboundCallGuard callGuard;
    private final QueueMetricsCollector metricsCollector;
    private final NotificationService notificationService;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter readyCounter;
    private Counter failedCounter;
    private Timer generationTimer;

    public PermitGenerationWorker(ApplicationStateService stateService,
                                  PermitJobQueue jobQueue,
                                  IssuanceBackendClient issuanceBackend,
                                  @Qualifier("issuanceRetryTemplate") RetryTemplate issuanceRetryTemplate,
                                  OutboundCallGuard callGuard,
                                  QueueMetricsCollector metricsCollector,
                                  NotificationService notificationService,
                                  PipelineProperties properties,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.stateService = stateService;
        this.jobQueue = jobQueue;
        this.issuanceBackend = issuanceBackend;
        this.issuanceRetryTemplate = issuanceRetryTemplate;
        this.callGuard = callGuard;
        this.metricsCollector = metricsCollector;
        this.notificationService = notificationService;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void initMetrics() {
        readyCounter = Counter.builder("permits.generation.ready")
                .description("Permits generated successfully")
                .register(meterRegistry);
        failedCounter = Counter.builder("permits.generation.failed")
                .description("Permit jobs that ended in FAILED")
                .register(meterRegistry);
        generationTimer = Timer.builder("permits.generation.duration")
                .description("Time from job start to final status")
                .register(meterRegistry);
    }

    /**
     * Run a job claimed from the queue. Never throws; every outcome is recorded on the application.
     */
    public Application process(Application job) {
        Long applicationId = job.getId();
        LocalDateTime startedAt = job.getQueueStartedAt() != null ? job.getQueueStartedAt() : now();
        AtomicInteger attempts = new AtomicInteger();

        log.info("Starting permit generation for application {} (waited {}ms)", applicationId, job.getQueueWaitMs());

        try {
            Map<String, Object> startData = new LinkedHashMap<>();
            startData.put("queueWaitMs", job.getQueueWaitMs());
            Application application = stateService.transition(applicationId, ApplicationStatus.GENERATING_PERMIT,
                    PaymentEvent.PERMIT_GENERATION_STARTED, startData);

            IssuanceResult result;
            try {
                result = issuanceRetryTemplate.execute(context -> {
                    int attempt = attempts.incrementAndGet();
                    if (attempt > 1) {
                        log.info("Retrying permit issuance for application {} (attempt {})", applicationId, attempt);
                    }
                    IssuanceRequest request = IssuanceRequest.builder()
                            .applicationId(applicationId)
                            .paymentOrderId(application.getPaymentOrderId())
                            .amount(application.getAmount())
                            .currency(application.getCurrency())
                            .attempt(attempt)
                            .build();
                    return callGuard.call(ResilienceConfig.ISSUANCE_BACKEND, issuanceBackend.getBackendName(),
                            String.valueOf(applicationId), () -> issuanceBackend.issue(request));
                });
            } catch (GatewayException e) {
                String reason = e instanceof PermanentGatewayException ? e.getMessage() : BACKEND_UNAVAILABLE_REASON;
                log.warn("Permit issuance failed for application {} after {} attempt(s): {}",
                        applicationId, attempts.get(), e.getMessage());
                return finishFailed(applicationId, startedAt, attempts.get(), reason, e.getMessage());
            }

            return finishReady(applicationId, startedAt, attempts.get(), result);

        } catch (Exception e) {
            return handleUnexpectedError(applicationId, startedAt, attempts.get(), e);
        } finally {
            recordSample();
        }
    }

    private Application finishReady(Long applicationId, LocalDateTime startedAt, int attempts, IssuanceResult result) {
        LocalDateTime completedAt = now();
        long durationMs = durationMs(startedAt, completedAt);

        LocalDateTime issuedAt = result.getIssuedAt() != null ? result.getIssuedAt() : completedAt;
        LocalDateTime expiresAt = result.getExpiresAt() != null
                ? result.getExpiresAt()
                : issuedAt.plusDays(properties.getIssuance().getPermitValidityDays());

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("permitNumber", result.getPermitNumber());
        data.put("attempts", attempts);
        data.put("durationMs", durationMs);

        Application ready = stateService.transition(applicationId, StateChange.builder()
                .targetStatus(ApplicationStatus.PERMIT_READY)
                .eventType(PaymentEvent.PERMIT_READY)
                .permitArtifactLocation(result.getArtifactLocation())
                .permitExpiresAt(expiresAt)
                .queueStatus(QueueStatus.COMPLETED)
                .queueCompletedAt(completedAt)
                .durationMs(durationMs)
                .queueAttempts(attempts)
                .data(data)
                .build());

        readyCounter.increment();
        generationTimer.record(Duration.ofMillis(durationMs));
        log.info("Permit ready for application {} in {}ms ({} attempt(s))", applicationId, durationMs, attempts);

        notificationService.permitReady(ready);
        return ready;
    }

    private Application finishFailed(Long applicationId, LocalDateTime startedAt, int attempts,
                                     String userReason, String internalError) {
        LocalDateTime completedAt = now();
        long durationMs = durationMs(startedAt, completedAt);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("error", internalError);
        data.put("attempts", attempts);

        Application failed = stateService.transition(applicationId, StateChange.builder()
                .targetStatus(ApplicationStatus.FAILED)
                .eventType(PaymentEvent.PERMIT_FAILED)
                .failureReason(userReason)
                .queueStatus(QueueStatus.FAILED)
                .queueCompletedAt(completedAt)
                .durationMs(durationMs)
                .queueAttempts(attempts)
                .queueError(truncate(internalError))
                .data(data)
                .build());

        failedCounter.increment();
        generationTimer.record(Duration.ofMillis(durationMs));

        notificationService.permitFailed(failed);
        return failed;
    }

    /**
     * Failures outside the issuance call: state transition errors, database errors.
     * The application is failed if it already reached GENERATING_PERMIT, otherwise only
     * the job is closed and the application keeps its status for the stuck-job query.
     */
    private Application handleUnexpectedError(Long applicationId, LocalDateTime startedAt, int attempts, Exception e) {
        log.error("Unexpected error generating permit for application {}: {}", applicationId, e.getMessage(), e);
        try {
            Application current = stateService.getApplication(applicationId);
            if (current.getStatus() == ApplicationStatus.GENERATING_PERMIT) {
                return finishFailed(applicationId, startedAt, attempts, UNEXPECTED_ERROR_REASON, e.getMessage());
            }
            failedCounter.increment();
            jobQueue.markJobFailed(applicationId, durationMs(startedAt, now()), attempts, truncate(e.getMessage()));
            return current;
        } catch (Exception saveError) {
            log.error("Failed to record failure state for application {}", applicationId, saveError);
            return null;
        }
    }

    private void recordSample() {
        try {
            metricsCollector.collectSample();
        } catch (Exception e) {
            log.warn("Failed to record queue metrics sample: {}", e.getMessage());
        }
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }

    private static long durationMs(LocalDateTime start, LocalDateTime end) {
        return Math.max(0, Duration.between(start, end).toMillis());
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= 500) {
            return value;
        }
        return value.substring(0, 500);
    }
}
