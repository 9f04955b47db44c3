package com.fintech.permits.service;

import com.fintech.permits.dto.GatewayWebhookEvent;
import com.fintech.permits.dto.StateChange;
import com.fintech.permits.dto.WebhookResult;
import com.fintech.permits.entity.Application;
import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.entity.WebhookProcessingStatus;
import com.fintech.permits.exception.InvalidStateTransitionException;
import com.fintech.permits.exception.NotFoundException;
import com.fintech.permits.repository.ApplicationRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for WebhookIngestionService.
 * <p>
 * Tests cover:
 * - Deduplication through the ledger
 * - Routing of each event type
 * - Acknowledged outcomes (unknown order, rejected transition)
 * - Failure handling and hand-off to recovery
 */
@ExtendWith(MockitoExtension.class)
class WebhookIngestionServiceTest {

    @Mock
    private WebhookEventLedger ledger;

    @Mock
    private ApplicationStateService stateService;

    @Mock
    private ApplicationRepository applicationRepository;

    @Mock
    private PermitJobQueue jobQueue;

    @Mock
    private NotificationService notificationService;

    @Mock
    private RecoveryAttemptService recoveryAttemptService;

    private SimpleMeterRegistry meterRegistry;
    private OperationalAlerts alerts;
    private WebhookIngestionService service;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        alerts = new OperationalAlerts(meterRegistry);
        service = new WebhookIngestionService(ledger, stateService, applicationRepository, jobQueue,
                notificationService, recoveryAttemptService, alerts, meterRegistry);
        service.initMetrics();
    }

    @Nested
    @DisplayName("Deduplication")
    class Deduplication {

        @Test
        @DisplayName("Should drop a delivery already in the ledger")
        void shouldReturnDuplicate() {
            // Given
            when(ledger.recordIfNew("evt_1", "payment.succeeded")).thenReturn(false);
            when(ledger.reclaimFailed("evt_1")).thenReturn(false);

            // When
            WebhookResult result = service.handle(event("evt_1", "payment.succeeded", "ord_1"));

            // Then
            assertThat(result).isEqualTo(WebhookResult.DUPLICATE);
            verifyNoInteractions(stateService, jobQueue);
            verify(ledger, never()).markProcessed(any(), any(), any());
            assertThat(meterRegistry.counter("webhooks.duplicates").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should reprocess a redelivery of a failed event")
        void shouldReprocessFailedEvent() {
            // Given
            when(ledger.recordIfNew("evt_1", "payment.succeeded")).thenReturn(false);
            when(ledger.reclaimFailed("evt_1")).thenReturn(true);
            when(stateService.applyGatewayEvent(eq("ord_1"), any(StateChange.class)))
                    .thenReturn(application(ApplicationStatus.PAYMENT_RECEIVED));

            // When
            WebhookResult result = service.handle(event("evt_1", "payment.succeeded", "ord_1"));

            // Then
            assertThat(result).isEqualTo(WebhookResult.PROCESSED);
            verify(jobQueue).enqueue(42L);
            verify(ledger).markProcessed("evt_1", WebhookProcessingStatus.PROCESSED, null);
        }
    }

    @Nested
    @DisplayName("Routing")
    class Routing {

        @BeforeEach
        void newEvents() {
            lenient().when(ledger.recordIfNew(anyString(), anyString())).thenReturn(true);
        }

        @Test
        @DisplayName("payment.succeeded moves to PAYMENT_RECEIVED and enqueues the permit job")
        void shouldEnqueueOnSuccess() {
            // Given
            when(stateService.applyGatewayEvent(eq("ord_1"), any(StateChange.class)))
                    .thenReturn(application(ApplicationStatus.PAYMENT_RECEIVED));

            // When
            WebhookResult result = service.handle(event("evt_1", "payment.succeeded", "ord_1"));

            // Then
            assertThat(result).isEqualTo(WebhookResult.PROCESSED);
            ArgumentCaptor<StateChange> captor = ArgumentCaptor.forClass(StateChange.class);
            verify(stateService).applyGatewayEvent(eq("ord_1"), captor.capture());
            StateChange change = captor.getValue();
            assertThat(change.getTargetStatus()).isEqualTo(ApplicationStatus.PAYMENT_RECEIVED);
            assertThat(change.getEventType()).isEqualTo("payment.succeeded");
            assertThat(change.getPaymentIntentId()).isEqualTo("pi_1");
            assertThat(change.getAmount()).isEqualByComparingTo("150.00");
            assertThat(change.getData()).containsEntry("webhookEventId", "evt_1");
            verify(jobQueue).enqueue(42L);
            verify(ledger).markProcessed("evt_1", WebhookProcessingStatus.PROCESSED, null);
        }

        @Test
        @DisplayName("voucher.created carries the voucher reference and expiry")
        void shouldRecordVoucher() {
            // Given
            LocalDateTime expiresAt = LocalDateTime.of(2024, 5, 3, 10, 0);
            GatewayWebhookEvent event = event("evt_2", "voucher.created", "ord_1");
            event.getData().setVoucherReference("VCH-123");
            event.getData().setExpiresAt(expiresAt);
            when(stateService.applyGatewayEvent(eq("ord_1"), any(StateChange.class)))
                    .thenReturn(application(ApplicationStatus.AWAITING_VOUCHER_PAYMENT));

            // When
            WebhookResult result = service.handle(event);

            // Then
            assertThat(result).isEqualTo(WebhookResult.PROCESSED);
            ArgumentCaptor<StateChange> captor = ArgumentCaptor.forClass(StateChange.class);
            verify(stateService).applyGatewayEvent(eq("ord_1"), captor.capture());
            assertThat(captor.getValue().getTargetStatus()).isEqualTo(ApplicationStatus.AWAITING_VOUCHER_PAYMENT);
            assertThat(captor.getValue().getVoucherReference()).isEqualTo("VCH-123");
            assertThat(captor.getValue().getVoucherExpiresAt()).isEqualTo(expiresAt);
            verifyNoInteractions(jobQueue);
        }

        @Test
        @DisplayName("payment.failed records the gateway message and notifies the customer")
        void shouldNotifyOnFailure() {
            // Given
            GatewayWebhookEvent event = event("evt_3", "payment.failed", "ord_1");
            event.getData().setFailureCode("card_declined");
            event.getData().setFailureMessage("Insufficient funds");
            Application failed = application(ApplicationStatus.PAYMENT_FAILED);
            when(stateService.applyGatewayEvent(eq("ord_1"), any(StateChange.class))).thenReturn(failed);

            // When
            WebhookResult result = service.handle(event);

            // Then
            assertThat(result).isEqualTo(WebhookResult.PROCESSED);
            ArgumentCaptor<StateChange> captor = ArgumentCaptor.forClass(StateChange.class);
            verify(stateService).applyGatewayEvent(eq("ord_1"), captor.capture());
            assertThat(captor.getValue().getFailureReason()).isEqualTo("Insufficient funds");
            assertThat(captor.getValue().getData()).containsEntry("failureCode", "card_declined");
            verify(notificationService).paymentFailed(failed, "Insufficient funds");
        }

        @Test
        @DisplayName("payment.canceled without a message uses a default reason")
        void shouldUseDefaultCancelReason() {
            Application failed = application(ApplicationStatus.PAYMENT_FAILED);
            when(stateService.applyGatewayEvent(eq("ord_1"), any(StateChange.class))).thenReturn(failed);

            service.handle(event("evt_4", "payment.canceled", "ord_1"));

            verify(notificationService).paymentFailed(failed, "Payment canceled");
        }

        @Test
        @DisplayName("Repeated failure for an already failed payment does not notify again")
        void shouldNotNotifyTwiceForFailedPayment() {
            // Given
            Application failed = application(ApplicationStatus.PAYMENT_FAILED);
            when(applicationRepository.findByPaymentOrderId("ord_1")).thenReturn(Optional.of(failed));
            when(stateService.applyGatewayEvent(eq("ord_1"), any(StateChange.class))).thenReturn(failed);

            // When
            WebhookResult result = service.handle(event("evt_12", "payment.failed", "ord_1"));

            // Then
            assertThat(result).isEqualTo(WebhookResult.PROCESSED);
            verify(ledger).markProcessed("evt_12", WebhookProcessingStatus.PROCESSED, null);
            verifyNoInteractions(notificationService);
        }

        @Test
        @DisplayName("Unknown event type is ignored but recorded")
        void shouldIgnoreUnknownType() {
            WebhookResult result = service.handle(event("evt_5", "charge.refunded", "ord_1"));

            assertThat(result).isEqualTo(WebhookResult.IGNORED);
            verifyNoInteractions(stateService);
            verify(ledger).markProcessed("evt_5", WebhookProcessingStatus.PROCESSED, null);
        }
    }

    @Nested
    @DisplayName("Acknowledged outcomes")
    class AcknowledgedOutcomes {

        @BeforeEach
        void newEvents() {
            lenient().when(ledger.recordIfNew(anyString(), anyString())).thenReturn(true);
        }

        @Test
        @DisplayName("Unknown order is recorded as processed and reported NOT_FOUND")
        void shouldReportUnknownOrder() {
            // Given
            when(stateService.applyGatewayEvent(eq("ord_123"), any(StateChange.class)))
                    .thenThrow(new NotFoundException("No application for payment order ord_123"));

            // When
            WebhookResult result = service.handle(event("evt_6", "payment.succeeded", "ord_123"));

            // Then
            assertThat(result).isEqualTo(WebhookResult.NOT_FOUND);
            verify(ledger).markProcessed(eq("evt_6"), eq(WebhookProcessingStatus.PROCESSED), contains("ord_123"));
            verifyNoInteractions(jobQueue);
        }

        @Test
        @DisplayName("Missing order id is reported NOT_FOUND")
        void shouldReportMissingOrderId() {
            WebhookResult result = service.handle(event("evt_7", "payment.succeeded", null));

            assertThat(result).isEqualTo(WebhookResult.NOT_FOUND);
            verifyNoInteractions(stateService);
        }

        @Test
        @DisplayName("Voucher event without data is reported NOT_FOUND")
        void shouldReportVoucherWithoutData() {
            // Given
            GatewayWebhookEvent event = GatewayWebhookEvent.builder()
                    .id("evt_v")
                    .type("voucher.created")
                    .build();

            // When
            WebhookResult first = service.handle(event);

            // Then
            assertThat(first).isEqualTo(WebhookResult.NOT_FOUND);
            verify(ledger).markProcessed(eq("evt_v"), eq(WebhookProcessingStatus.PROCESSED), anyString());
            verify(ledger, never()).markProcessed(any(), eq(WebhookProcessingStatus.FAILED), any());
            verifyNoInteractions(stateService, recoveryAttemptService);
        }

        @Test
        @DisplayName("Late failure after success is ignored")
        void shouldIgnoreRejectedTransition() {
            // Given
            when(stateService.applyGatewayEvent(eq("ord_1"), any(StateChange.class)))
                    .thenThrow(new InvalidStateTransitionException(42L, ApplicationStatus.PERMIT_READY,
                            ApplicationStatus.PAYMENT_FAILED, "PERMIT_READY is terminal"));

            // When
            WebhookResult result = service.handle(event("evt_8", "payment.failed", "ord_1"));

            // Then
            assertThat(result).isEqualTo(WebhookResult.IGNORED);
            verify(ledger).markProcessed(eq("evt_8"), eq(WebhookProcessingStatus.PROCESSED), anyString());
            verifyNoInteractions(notificationService);
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("Processing error marks the event FAILED, hands off to recovery and propagates")
        void shouldHandOffToRecovery() {
            // Given
            when(ledger.recordIfNew("evt_9", "payment.succeeded")).thenReturn(true);
            when(stateService.applyGatewayEvent(eq("ord_1"), any(StateChange.class)))
                    .thenThrow(new QueryTimeoutException("statement timeout"));
            when(applicationRepository.findByPaymentOrderId("ord_1"))
                    .thenReturn(Optional.of(application(ApplicationStatus.PENDING_PAYMENT)));

            // When / Then
            assertThatThrownBy(() -> service.handle(event("evt_9", "payment.succeeded", "ord_1")))
                    .isInstanceOf(QueryTimeoutException.class);

            verify(ledger).markProcessed("evt_9", WebhookProcessingStatus.FAILED, "statement timeout");
            verify(recoveryAttemptService).upsertAttempt(42L, "pi_1", "statement timeout");
            assertThat(alerts.count(OperationalAlerts.WEBHOOK_PROCESSING_FAILED)).isEqualTo(1.0);
            assertThat(meterRegistry.counter("webhooks.failed").count()).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Failure of the recovery hand-off does not mask the original error")
        void shouldPropagateOriginalError() {
            when(ledger.recordIfNew("evt_10", "payment.succeeded")).thenReturn(true);
            when(stateService.applyGatewayEvent(eq("ord_1"), any(StateChange.class)))
                    .thenThrow(new IllegalStateException("boom"));
            when(applicationRepository.findByPaymentOrderId("ord_1"))
                    .thenThrow(new QueryTimeoutException("db down"));

            assertThatThrownBy(() -> service.handle(event("evt_10", "payment.succeeded", "ord_1")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("boom");
        }

        @Test
        @DisplayName("Events without id or type are rejected")
        void shouldRejectIncompleteEvent() {
            assertThatThrownBy(() -> service.handle(event(" ", "payment.succeeded", "ord_1")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.handle(event("evt_11", null, "ord_1")))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> service.handle(null))
                    .isInstanceOf(IllegalArgumentException.class);
            verifyNoInteractions(ledger);
        }
    }

    private static GatewayWebhookEvent event(String id, String type, String orderId) {
        return GatewayWebhookEvent.builder()
                .id(id)
                .type(type)
                .data(GatewayWebhookEvent.Payload.builder()
                        .orderId(orderId)
                        .paymentIntentId("pi_1")
                        .amount(new BigDecimal("150.00"))
                        .currency("MXN")
                        .build())
                .build();
    }

    private static Application application(ApplicationStatus status) {
        return Application.builder()
                .id(42L)
                .status(status)
                .paymentOrderId("ord_1")
                .paymentIntentId("pi_1")
                .build();
    }
}
