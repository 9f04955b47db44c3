package com.fintech.permits.service;

import com.fintech.permits.dto.GatewayWebhookEvent;
import com.fintech.permits.dto.StateChange;
import com.fintech.permits.dto.WebhookResult;
import com.fintech.permits.entity.Application;
import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.entity.PaymentEvent;
import com.fintech.permits.entity.WebhookProcessingStatus;
import com.fintech.permits.exception.InvalidStateTransitionException;
import com.fintech.permits.exception.NotFoundException;
import com.fintech.permits.repository.ApplicationRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Processes verified gateway webhook deliveries.
 * <p>
 * Flow per delivery:
 * 1. Claim the event in the idempotency ledger (first delivery, or redelivery of a failed one)
 * 2. Route by event type to a state machine transition
 * 3. Record the outcome in the ledger
 * <p>
 * Unknown orders and rejected transitions are acknowledged; the gateway gets a 2xx and stops
 * redelivering. Any other failure marks the event FAILED, hands the payment to recovery and
 * propagates so the gateway retries.
 */
@Service
@Slf4j
public class WebhookIngestionService {

    private final WebhookEventLedger ledger;
    private final ApplicationStateService stateService;
    private final ApplicationRepository applicationRepository;
    private final PermitJobQueue jobQueue;
    private final NotificationService notificationService;
    private final RecoveryAttemptService recoveryAttemptService;
    private final OperationalAlerts alerts;
    private final MeterRegistry meterRegistry;

    private Counter receivedCounter;
    private Counter duplicateCounter;
    private Counter failedCounter;

    public WebhookIngestionService(WebhookEventLedger ledger,
                                   ApplicationStateService stateService,
                                   ApplicationRepository applicationRepository,
                                   PermitJobQueue jobQueue,
                                   NotificationService notificationService,
                                   RecoveryAttemptService recoveryAttemptService,
                                   OperationalAlerts alerts,
                                   MeterRegistry meterRegistry) {
        this.ledger = ledger;
        this.stateService = stateService;
        this.applicationRepository = applicationRepository;
        this.jobQueue = jobQueue;
        this.notificationService = notificationService;
        this.recoveryAttemptService = recoveryAttemptService;
        this.alerts = alerts;
        this.meterRegistry = meterRegistry;
    }

    @PostConstruct
    public void initMetrics() {
        receivedCounter = Counter.builder("webhooks.received")
                .description("Webhook deliveries received")
                .register(meterRegistry);

        duplicateCounter = Counter.builder("webhooks.duplicates")
                .description("Webhook deliveries dropped as duplicates")
                .register(meterRegistry);

        failedCounter = Counter.builder("webhooks.failed")
                .description("Webhook deliveries whose processing failed")
                .register(meterRegistry);
    }

    /**
     * Process one webhook delivery.
     *
     * @throws IllegalArgumentException if the event has no id or type
     */
    public WebhookResult handle(GatewayWebhookEvent event) {
        if (event == null || isBlank(event.getId()) || isBlank(event.getType())) {
            throw new IllegalArgumentException("Webhook event id and type are required");
        }
        receivedCounter.increment();

        String eventId = event.getId();
        if (!ledger.recordIfNew(eventId, event.getType()) && !ledger.reclaimFailed(eventId)) {
            duplicateCounter.increment();
            return WebhookResult.DUPLICATE;
        }

        try {
            WebhookResult result = route(event);
            ledger.markProcessed(eventId, WebhookProcessingStatus.PROCESSED, null);
            countOutcome(result);
            return result;
        } catch (NotFoundException e) {
            log.warn("Webhook {} ({}) references an unknown order: {}", eventId, event.getType(), e.getMessage());
            ledger.markProcessed(eventId, WebhookProcessingStatus.PROCESSED, e.getMessage());
            countOutcome(WebhookResult.NOT_FOUND);
            return WebhookResult.NOT_FOUND;
        } catch (InvalidStateTransitionException e) {
            log.info("Webhook {} ({}) ignored: {}", eventId, event.getType(), e.getMessage());
            ledger.markProcessed(eventId, WebhookProcessingStatus.PROCESSED, e.getMessage());
            countOutcome(WebhookResult.IGNORED);
            return WebhookResult.IGNORED;
        } catch (RuntimeException e) {
            handleFailure(event, e);
            throw e;
        }
    }

    private WebhookResult route(GatewayWebhookEvent event) {
        String orderId = event.orderId();
        switch (event.getType()) {
            case PaymentEvent.PAYMENT_PROCESSING -> {
                apply(orderId, event, StateChange.builder()
                        .targetStatus(ApplicationStatus.PROCESSING_PAYMENT)
                        .eventType(PaymentEvent.PAYMENT_PROCESSING));
                return WebhookResult.PROCESSED;
            }
            case PaymentEvent.VOUCHER_CREATED -> {
                GatewayWebhookEvent.Payload data = event.getData();
                apply(orderId, event, StateChange.builder()
                        .targetStatus(ApplicationStatus.AWAITING_VOUCHER_PAYMENT)
                        .eventType(PaymentEvent.VOUCHER_CREATED)
                        .voucherReference(data != null ? data.getVoucherReference() : null)
                        .voucherExpiresAt(data != null ? data.getExpiresAt() : null));
                return WebhookResult.PROCESSED;
            }
            case PaymentEvent.PAYMENT_SUCCEEDED -> {
                Application application = apply(orderId, event, StateChange.builder()
                        .targetStatus(ApplicationStatus.PAYMENT_RECEIVED)
                        .eventType(PaymentEvent.PAYMENT_SUCCEEDED));
                jobQueue.enqueue(application.getId());
                return WebhookResult.PROCESSED;
            }
            case PaymentEvent.PAYMENT_FAILED, PaymentEvent.PAYMENT_CANCELED -> {
                String reason = failureReason(event);
                boolean alreadyFailed = !isBlank(orderId) && applicationRepository.findByPaymentOrderId(orderId)
                        .map(existing -> existing.getStatus() == ApplicationStatus.PAYMENT_FAILED)
                        .orElse(false);
                Application application = apply(orderId, event, StateChange.builder()
                        .targetStatus(ApplicationStatus.PAYMENT_FAILED)
                        .eventType(event.getType())
                        .failureReason(reason));
                // at most one failure notice per payment
                if (!alreadyFailed) {
                    notificationService.paymentFailed(application, reason);
                } else {
                    log.debug("Application {} already failed, not notifying again for webhook {}",
                            application.getId(), event.getId());
                }
                return WebhookResult.PROCESSED;
            }
            default -> {
                log.info("Ignoring webhook {} of unhandled type {}", event.getId(), event.getType());
                return WebhookResult.IGNORED;
            }
        }
    }

    private Application apply(String orderId, GatewayWebhookEvent event, StateChange.StateChangeBuilder change) {
        if (isBlank(orderId)) {
            throw new NotFoundException("Webhook " + event.getId() + " carries no payment order id");
        }

        GatewayWebhookEvent.Payload data = event.getData();
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("webhookEventId", event.getId());
        if (data.getFailureCode() != null) {
            details.put("failureCode", data.getFailureCode());
        }

        return stateService.applyGatewayEvent(orderId, change
                .paymentIntentId(data.getPaymentIntentId())
                .amount(data.getAmount())
                .currency(data.getCurrency())
                .data(details)
                .build());
    }

    private void handleFailure(GatewayWebhookEvent event, RuntimeException e) {
        failedCounter.increment();
        try {
            ledger.markProcessed(event.getId(), WebhookProcessingStatus.FAILED, e.getMessage());
        } catch (RuntimeException markError) {
            log.error("Could not record failure of webhook {} in the ledger", event.getId(), markError);
        }

        alerts.raise(OperationalAlerts.WEBHOOK_PROCESSING_FAILED,
                "Processing of webhook " + event.getId() + " (" + event.getType() + ") failed", e);

        String intentId = event.paymentIntentId();
        if (isBlank(intentId) || isBlank(event.orderId())) {
            return;
        }
        try {
            Optional<Application> application = applicationRepository.findByPaymentOrderId(event.orderId());
            application.ifPresent(app ->
                    recoveryAttemptService.upsertAttempt(app.getId(), intentId, e.getMessage()));
        } catch (RuntimeException recoveryError) {
            log.error("Could not hand webhook {} to payment recovery", event.getId(), recoveryError);
        }
    }

    private void countOutcome(WebhookResult result) {
        meterRegistry.counter("webhooks.outcomes", "result", result.name()).increment();
    }

    private static String failureReason(GatewayWebhookEvent event) {
        GatewayWebhookEvent.Payload data = event.getData();
        if (data != null && !isBlank(data.getFailureMessage())) {
            return data.getFailureMessage();
        }
        return PaymentEvent.PAYMENT_CANCELED.equals(event.getType()) ? "Payment canceled" : "Payment declined";
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
