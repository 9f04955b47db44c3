package com.fintech.permits.service;

import com.fintech.permits.client.PaymentGatewayClient;
import com.fintech.permits.config.PipelineProperties;
import com.fintech.permits.config.ResilienceConfig;
import com.fintech.permits.dto.GatewayPaymentStatus;
import com.fintech.permits.dto.RecoveryScanResult;
import com.fintech.permits.dto.RecoveryStats;
import com.fintech.permits.dto.StateChange;
import com.fintech.permits.entity.Application;
import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.entity.PaymentEvent;
import com.fintech.permits.entity.RecoveryAttempt;
import com.fintech.permits.entity.RecoveryStatus;
import com.fintech.permits.exception.GatewayException;
import com.fintech.permits.exception.InvalidStateTransitionException;
import com.fintech.permits.exception.NotFoundException;
import com.fintech.permits.exception.ScanInProgressException;
import com.fintech.permits.repository.ApplicationRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Recovers payments whose webhook never arrived or could not be processed.
 * <p>
 * Each scan registers newly stuck payments, closes out exhausted attempts, then re-queries
 * the gateway for every due attempt it manages to claim. Claims are compare-and-set on the
 * attempt counter, so scanners on several instances never work the same row twice.
 * A failure on one payment never stops the scan.
 */
@Service
@Slf4j
public class PaymentRecoveryService {

    static final String SCAN_NAME = "Payment recovery scan";

    private static final Set<ApplicationStatus> PAYMENT_SETTLED = EnumSet.of(
            ApplicationStatus.PAYMENT_RECEIVED, ApplicationStatus.GENERATING_PERMIT, ApplicationStatus.PERMIT_READY);

    private final RecoveryAttemptService attemptService;
    private final ApplicationRepository applicationRepository;
    private final ApplicationStateService stateService;
    private final PaymentGatewayClient gatewayClient;
    private final OutboundCallGuard callGuard;
    private final PermitJobQueue jobQueue;
    private final NotificationService notificationService;
    private final OperationalAlerts alerts;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter attemptCounter;
    private Counter recoveredCounter;
    private Counter failedCounter;
    private Counter exhaustedCounter;
    private Counter gatewayErrorCounter;
    private Timer scanTimer;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public PaymentRecoveryService(RecoveryAttemptService attemptService,
                                  ApplicationRepository applicationRepository,
                                  ApplicationStateService stateService,
                                  PaymentGatewayClient gatewayClient,
                                  OutboundCallGuard callGuard,
                                  PermitJobQueue jobQueue,
                                  NotificationService notificationService,
                                  OperationalAlerts alerts,
                                  PipelineProperties properties,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.attemptService = attemptService;
        this.applicationRepository = applicationRepository;
        this.stateService = stateService;
        this.gatewayClient = gatewayClient;
        this.callGuard = callGuard;
        this.jobQueue = jobQueue;
        this.notificationService = notificationService;
        this.alerts = alerts;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void initMetrics() {
        attemptCounter = Counter.builder("payments.recovery.attempts")
                .description("Recovery attempts made against the payment gateway")
                .register(meterRegistry);

        recoveredCounter = Counter.builder("payments.recovery.recovered")
                .description("Payments recovered as succeeded")
                .register(meterRegistry);

        failedCounter = Counter.builder("payments.recovery.failed")
                .description("Payments resolved as failed by recovery")
                .register(meterRegistry);

        exhaustedCounter = Counter.builder("payments.recovery.exhausted")
                .description("Payments that used every recovery attempt")
                .register(meterRegistry);

        gatewayErrorCounter = Counter.builder("payments.recovery.gateway.errors")
                .description("Errors querying the payment gateway during recovery")
                .register(meterRegistry);

        scanTimer = Timer.builder("payments.recovery.duration")
                .description("Time taken to complete a recovery scan")
                .register(meterRegistry);
    }

    /**
     * Run one recovery scan.
     *
     * @throws ScanInProgressException if a scan is already running in this instance
     */
    public RecoveryScanResult runRecoveryScan() {
        if (!isRunning.compareAndSet(false, true)) {
            log.warn("Recovery scan already in progress, skipping this run");
            throw new ScanInProgressException(SCAN_NAME);
        }

        RecoveryScanResult result = RecoveryScanResult.builder()
                .startedAt(now())
                .build();

        try {
            return scanTimer.record(() -> {
                result.setNewlyTracked(detectStalePayments());
                result.setExhaustedBeforeScan(closeOutExhausted());

                List<RecoveryAttempt> due = attemptService.findDue();
                log.info("Recovery scan started: {} attempts due, {} newly tracked", due.size(), result.getNewlyTracked());

                for (RecoveryAttempt attempt : due) {
                    processAttempt(attempt, result);
                }

                result.setCompletedAt(now());
                log.info("Recovery scan completed. Processed: {}, Recovered: {}, Failed: {}, " +
                                "Still pending: {}, Max attempts reached: {}, Skipped: {}, Errors: {}",
                        result.getTotalProcessed(),
                        result.getRecovered(),
                        result.getMarkedFailed(),
                        result.getStillPending(),
                        result.getMaxAttemptsReached(),
                        result.getSkippedClaimedElsewhere(),
                        result.getErrors());
                return result;
            });
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Register payments waiting on the gateway past the stale threshold that recovery
     * does not track yet.
     *
     * @return number of payments newly tracked
     */
    public int detectStalePayments() {
        PipelineProperties.Recovery recovery = properties.getRecovery();
        LocalDateTime updatedBefore = now().minusMinutes(recovery.getStaleThresholdMinutes());

        List<Application> stale = applicationRepository.findUntrackedStalePayments(
                ApplicationStatus.awaitingGateway(), updatedBefore, PageRequest.of(0, recovery.getBatchSize()));

        int tracked = 0;
        for (Application application : stale) {
            try {
                if (attemptService.track(application.getId(), application.getPaymentIntentId(),
                        application.getUpdatedAt())) {
                    tracked++;
                }
            } catch (Exception e) {
                log.error("Failed to track stale payment for application {}: {}",
                        application.getId(), e.getMessage(), e);
            }
        }
        if (tracked > 0) {
            log.info("Detected {} stale payments waiting on the gateway", tracked);
        }
        return tracked;
    }

    private int closeOutExhausted() {
        int exhausted = attemptService.markExhausted();
        if (exhausted > 0) {
            exhaustedCounter.increment(exhausted);
            alerts.raise(OperationalAlerts.RECOVERY_EXHAUSTED,
                    exhausted + " payment recoveries reached the attempt limit and need manual review");
        }
        return exhausted;
    }

    private void processAttempt(RecoveryAttempt attempt, RecoveryScanResult result) {
        if (!attemptService.claim(attempt)) {
            log.debug("Recovery attempt {} claimed by another scanner", attempt.getId());
            result.incrementSkipped();
            return;
        }

        result.incrementProcessed();
        attemptCounter.increment();
        int attemptNumber = attempt.getAttemptCount() + 1;

        try {
            recover(attempt, attemptNumber, result);
        } catch (Exception e) {
            log.error("Unexpected error recovering application {} / {}: {}",
                    attempt.getApplicationId(), attempt.getPaymentIntentId(), e.getMessage(), e);
            result.addError(attempt.getApplicationId(), attempt.getPaymentIntentId(),
                    "Unexpected error: " + e.getMessage(), now());
            try {
                unresolved(attempt, attemptNumber, "Unexpected error: " + e.getMessage(), result);
            } catch (Exception saveError) {
                log.error("Failed to save recovery state for attempt {}", attempt.getId(), saveError);
            }
        }
    }

    private void recover(RecoveryAttempt attempt, int attemptNumber, RecoveryScanResult result) {
        Long applicationId = attempt.getApplicationId();
        String intentId = attempt.getPaymentIntentId();

        GatewayPaymentStatus gatewayStatus;
        try {
            gatewayStatus = callGuard.call(ResilienceConfig.PAYMENT_GATEWAY, gatewayClient.getGatewayName(),
                    intentId, () -> gatewayClient.getPaymentStatus(intentId));
        } catch (GatewayException e) {
            log.warn("Gateway error recovering application {} / {} (attempt {}): {}",
                    applicationId, intentId, attemptNumber, e.getMessage());
            gatewayErrorCounter.increment();
            result.addError(applicationId, intentId, e.getMessage(), now());
            unresolved(attempt, attemptNumber, e.getMessage(), result);
            return;
        }

        GatewayPaymentStatus.Status status = gatewayStatus.getStatus();
        log.debug("Gateway reports {} for application {} / {}", status, applicationId, intentId);

        if (status == null) {
            unresolved(attempt, attemptNumber, "Gateway returned no status", result);
            return;
        }

        try {
            switch (status) {
                case SUCCEEDED -> markRecovered(attempt, gatewayStatus, result);
                case FAILED, CANCELED -> markPaymentFailed(attempt, gatewayStatus, result);
                default -> unresolved(attempt, attemptNumber, "Gateway status " + status, result);
            }
        } catch (InvalidStateTransitionException e) {
            // The application moved on through another path (usually a late webhook)
            if (PAYMENT_SETTLED.contains(e.getFrom())) {
                log.info("Application {} already {}, closing recovery as succeeded", applicationId, e.getFrom());
                close(attempt, RecoveryStatus.SUCCEEDED, null);
                result.incrementRecovered();
            } else {
                log.info("Application {} is {}, gateway reports {}; closing recovery as failed",
                        applicationId, e.getFrom(), status);
                close(attempt, RecoveryStatus.FAILED, e.getMessage());
                result.incrementMarkedFailed();
            }
        } catch (NotFoundException e) {
            log.warn("Application {} no longer exists, closing recovery attempt {}", applicationId, attempt.getId());
            close(attempt, RecoveryStatus.FAILED, e.getMessage());
            result.incrementMarkedFailed();
        }
    }

    private void markRecovered(RecoveryAttempt attempt, GatewayPaymentStatus gatewayStatus, RecoveryScanResult result) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("source", "recovery");
        data.put("gatewayStatus", gatewayStatus.getStatus().name());
        data.put("attempt", attempt.getAttemptCount() + 1);

        stateService.transition(attempt.getApplicationId(), StateChange.builder()
                .targetStatus(ApplicationStatus.PAYMENT_RECEIVED)
                .eventType(PaymentEvent.PAYMENT_RECOVERED)
                .paymentIntentId(attempt.getPaymentIntentId())
                .amount(gatewayStatus.getAmount())
                .currency(gatewayStatus.getCurrency())
                .data(data)
                .build());

        jobQueue.enqueue(attempt.getApplicationId());
        close(attempt, RecoveryStatus.SUCCEEDED, null);

        recoveredCounter.increment();
        result.incrementRecovered();
        log.info("Recovered payment for application {} / {}", attempt.getApplicationId(), attempt.getPaymentIntentId());
    }

    private void markPaymentFailed(RecoveryAttempt attempt, GatewayPaymentStatus gatewayStatus,
                                   RecoveryScanResult result) {
        GatewayPaymentStatus.Status status = gatewayStatus.getStatus();
        String reason = gatewayStatus.getFailureMessage() != null
                ? gatewayStatus.getFailureMessage()
                : "Payment " + status.name().toLowerCase();

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("source", "recovery");
        data.put("gatewayStatus", status.name());
        if (gatewayStatus.getFailureCode() != null) {
            data.put("failureCode", gatewayStatus.getFailureCode());
        }

        ApplicationStatus before = stateService.getApplication(attempt.getApplicationId()).getStatus();
        Application application = stateService.transition(attempt.getApplicationId(), StateChange.builder()
                .targetStatus(ApplicationStatus.PAYMENT_FAILED)
                .eventType(status == GatewayPaymentStatus.Status.CANCELED
                        ? PaymentEvent.PAYMENT_CANCELED
                        : PaymentEvent.PAYMENT_FAILED)
                .failureReason(reason)
                .data(data)
                .build());

        if (before != ApplicationStatus.PAYMENT_FAILED) {
            notificationService.paymentFailed(application, reason);
        }
        close(attempt, RecoveryStatus.FAILED, reason);

        failedCounter.increment();
        result.incrementMarkedFailed();
        log.info("Payment for application {} / {} resolved as {} by recovery",
                attempt.getApplicationId(), attempt.getPaymentIntentId(), status);
    }

    private void unresolved(RecoveryAttempt attempt, int attemptNumber, String error, RecoveryScanResult result) {
        int maxAttempts = properties.getRecovery().getMaxAttempts();
        if (attemptNumber >= maxAttempts) {
            attemptService.recordOutcome(attempt.getId(), RecoveryStatus.MAX_ATTEMPTS_REACHED, error);
            exhaustedCounter.increment();
            result.incrementMaxAttemptsReached();
            alerts.raise(OperationalAlerts.RECOVERY_EXHAUSTED, String.format(
                    "Payment recovery for application %d / %s gave up after %d attempts: %s",
                    attempt.getApplicationId(), attempt.getPaymentIntentId(), attemptNumber, error));
        } else {
            attemptService.recordOutcome(attempt.getId(), RecoveryStatus.RECOVERING, error);
            result.incrementStillPending();
        }
    }

    private void close(RecoveryAttempt attempt, RecoveryStatus status, String error) {
        attemptService.recordOutcome(attempt.getId(), status, error);
    }

    /**
     * Attempt counts per status for attempts created within the window.
     */
    public RecoveryStats getStats(int windowHours) {
        LocalDateTime since = now().minusHours(windowHours);

        Map<String, Long> countsByStatus = new LinkedHashMap<>();
        for (RecoveryStatus status : RecoveryStatus.values()) {
            countsByStatus.put(status.name(), attemptService.countCreatedSince(status, since));
        }

        return RecoveryStats.builder()
                .windowHours(windowHours)
                .totalAttempts(attemptService.countCreatedSince(since))
                .countsByStatus(countsByStatus)
                .averageAttempts(attemptService.averageAttemptsSince(since))
                .needingReview(attemptService.findNeedingReview().size())
                .scanRunning(isRunning.get())
                .build();
    }

    /**
     * Payments that exhausted their recovery attempts, oldest first.
     */
    public List<RecoveryAttempt> getNeedingReview() {
        return attemptService.findNeedingReview();
    }

    public boolean isScanRunning() {
        return isRunning.get();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
