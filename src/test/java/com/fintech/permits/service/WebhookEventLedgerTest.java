package com.fintech.permits.service;

import com.fintech.permits.config.PipelineProperties;
import com.fintech.permits.config.ResilienceConfig;
import com.fintech.permits.entity.WebhookEvent;
import com.fintech.permits.entity.WebhookProcessingStatus;
import com.fintech.permits.repository.WebhookEventRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class WebhookEventLedgerTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

    @Mock
    private WebhookEventRepository repository;

    @Mock
    private PlatformTransactionManager transactionManager;

    private OperationalAlerts alerts;
    private WebhookEventLedger ledger;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        properties.getWebhook().setLedgerWriteAttempts(3);
        properties.getWebhook().setLedgerWriteBackoffMs(1);

        alerts = new OperationalAlerts(new SimpleMeterRegistry());
        ledger = new WebhookEventLedger(repository, transactionManager,
                new ResilienceConfig().ledgerRetryTemplate(properties), alerts, CLOCK);
    }

    @Nested
    @DisplayName("Recording deliveries")
    class RecordIfNew {

        @Test
        @DisplayName("First delivery creates a PENDING row")
        void shouldRecordFirstDelivery() {
            // Given
            when(repository.saveAndFlush(any(WebhookEvent.class))).thenAnswer(inv -> inv.getArgument(0));

            // When
            boolean recorded = ledger.recordIfNew("evt_1", "payment.succeeded");

            // Then
            assertThat(recorded).isTrue();
            ArgumentCaptor<WebhookEvent> captor = ArgumentCaptor.forClass(WebhookEvent.class);
            verify(repository).saveAndFlush(captor.capture());
            WebhookEvent saved = captor.getValue();
            assertThat(saved.getEventId()).isEqualTo("evt_1");
            assertThat(saved.getEventType()).isEqualTo("payment.succeeded");
            assertThat(saved.getProcessingStatus()).isEqualTo(WebhookProcessingStatus.PENDING);
            assertThat(saved.getCreatedAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 0));
        }

        @Test
        @DisplayName("Unique constraint violation means duplicate and is not retried")
        void shouldReportDuplicate() {
            // Given
            when(repository.saveAndFlush(any(WebhookEvent.class)))
                    .thenThrow(new DataIntegrityViolationException("uk_webhook_event_id"));

            // When
            boolean recorded = ledger.recordIfNew("evt_1", "payment.succeeded");

            // Then
            assertThat(recorded).isFalse();
            verify(repository, times(1)).saveAndFlush(any(WebhookEvent.class));
            assertThat(alerts.count(OperationalAlerts.LEDGER_UNAVAILABLE)).isZero();
        }

        @Test
        @DisplayName("Lock conflict is retried")
        void shouldRetryLockConflict() {
            // Given
            when(repository.saveAndFlush(any(WebhookEvent.class)))
                    .thenThrow(new CannotAcquireLockException("lock timeout"))
                    .thenAnswer(inv -> inv.getArgument(0));

            // When
            boolean recorded = ledger.recordIfNew("evt_2", "payment.succeeded");

            // Then
            assertThat(recorded).isTrue();
            verify(repository, times(2)).saveAndFlush(any(WebhookEvent.class));
            assertThat(alerts.count(OperationalAlerts.LEDGER_UNAVAILABLE)).isZero();
        }

        @Test
        @DisplayName("Lock conflict followed by a committed duplicate resolves to duplicate")
        void shouldResolveRetriedConflictAsDuplicate() {
            // Given
            when(repository.saveAndFlush(any(WebhookEvent.class)))
                    .thenThrow(new CannotAcquireLockException("lock timeout"))
                    .thenThrow(new DataIntegrityViolationException("uk_webhook_event_id"));

            // When / Then
            assertThat(ledger.recordIfNew("evt_3", "payment.succeeded")).isFalse();
        }

        @Test
        @DisplayName("Unavailable ledger fails open and raises an alert")
        void shouldFailOpenWhenLedgerUnavailable() {
            // Given
            when(repository.saveAndFlush(any(WebhookEvent.class)))
                    .thenThrow(new DataAccessResourceFailureException("connection refused"));

            // When
            boolean recorded = ledger.recordIfNew("evt_4", "payment.succeeded");

            // Then
            assertThat(recorded).isTrue();
            verify(repository, times(3)).saveAndFlush(any(WebhookEvent.class));
            assertThat(alerts.count(OperationalAlerts.LEDGER_UNAVAILABLE)).isEqualTo(1.0);
        }
    }

    @Nested
    @DisplayName("Recording outcomes")
    class Outcomes {

        @Test
        @DisplayName("FAILED outcome increments the retry count")
        void shouldIncrementRetryCountOnFailure() {
            when(repository.updateOutcome(eq("evt_1"), eq(WebhookProcessingStatus.FAILED), eq("boom"),
                    eq(1), any(LocalDateTime.class))).thenReturn(1);

            ledger.markProcessed("evt_1", WebhookProcessingStatus.FAILED, "boom");

            verify(repository).updateOutcome(eq("evt_1"), eq(WebhookProcessingStatus.FAILED), eq("boom"),
                    eq(1), any(LocalDateTime.class));
        }

        @Test
        @DisplayName("PROCESSED outcome leaves the retry count and truncates long errors")
        void shouldTruncateError() {
            String longError = "x".repeat(800);

            ledger.markProcessed("evt_1", WebhookProcessingStatus.PROCESSED, longError);

            ArgumentCaptor<String> errorCaptor = ArgumentCaptor.forClass(String.class);
            verify(repository).updateOutcome(eq("evt_1"), eq(WebhookProcessingStatus.PROCESSED),
                    errorCaptor.capture(), eq(0), any(LocalDateTime.class));
            assertThat(errorCaptor.getValue()).hasSize(500);
        }

        @Test
        @DisplayName("Only a FAILED event can be reclaimed")
        void shouldReclaimFailedEvent() {
            when(repository.reclaim("evt_1", WebhookProcessingStatus.FAILED, WebhookProcessingStatus.PENDING))
                    .thenReturn(1);
            when(repository.reclaim("evt_2", WebhookProcessingStatus.FAILED, WebhookProcessingStatus.PENDING))
                    .thenReturn(0);

            assertThat(ledger.reclaimFailed("evt_1")).isTrue();
            assertThat(ledger.reclaimFailed("evt_2")).isFalse();
        }
    }
}
