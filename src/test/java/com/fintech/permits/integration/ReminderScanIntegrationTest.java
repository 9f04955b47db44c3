package com.fintech.permits.integration;

import com.fintech.permits.dto.ReminderScanResult;
import com.fintech.permits.dto.ReminderStats;
import com.fintech.permits.entity.Application;
import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.entity.PaymentEvent;
import com.fintech.permits.entity.ReminderRecord;
import com.fintech.permits.service.ReminderScanService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Expiry reminders against H2, moving the clock between scans.
 */
class ReminderScanIntegrationTest extends PipelineIntegrationTestBase {

    @Autowired
    private ReminderScanService reminderService;

    @Nested
    @DisplayName("Voucher reminders")
    class VoucherReminders {

        @Test
        @DisplayName("Reminder is sent once when the voucher enters the horizon")
        void sentOnceInsideHorizon() {
            // Given: a voucher expiring in 48 hours
            Application application = voucherApplication(ApplicationStatus.AWAITING_VOUCHER_PAYMENT, "ord_1");
            voucherEvent(application, now().plusHours(48));

            // When / Then: outside the 24 hour horizon
            assertThat(reminderService.scanVoucherExpirations().getSent()).isZero();

            // When / Then: 25 hours later it expires within the horizon
            clock.advance(Duration.ofHours(25));
            assertThat(reminderService.scanVoucherExpirations().getSent()).isEqualTo(1);

            // When / Then: rescanning sends nothing
            assertThat(reminderService.scanVoucherExpirations().getSent()).isZero();
            assertThat(reminderRecordRepository.countByApplicationIdAndReminderType(
                    application.getId(), ReminderRecord.VOUCHER_EXPIRATION)).isEqualTo(1L);
        }

        @Test
        @DisplayName("Only the latest voucher of an application counts")
        void latestVoucherWins() {
            // Given: the first voucher expires soon but was replaced by one expiring in three days
            Application application = voucherApplication(ApplicationStatus.AWAITING_VOUCHER_PAYMENT, "ord_2");
            voucherEvent(application, now().plusHours(10));
            voucherEvent(application, now().plusHours(72));

            // When
            ReminderScanResult result = reminderService.scanVoucherExpirations();

            // Then
            assertThat(result.getCandidates()).isZero();
            assertThat(reminderRecordRepository.count()).isZero();
        }

        @Test
        @DisplayName("Paid applications get no voucher reminder")
        void paidApplicationSkipped() {
            Application application = voucherApplication(ApplicationStatus.PAYMENT_RECEIVED, "ord_3");
            voucherEvent(application, now().plusHours(10));

            assertThat(reminderService.scanVoucherExpirations().getCandidates()).isZero();
        }
    }

    @Nested
    @DisplayName("Permit reminders")
    class PermitReminders {

        @Test
        @DisplayName("Permit expiring in two days gets the 3-day reminder, then the 1-day reminder")
        void smallestMatchingOffset() {
            // Given
            Application permit = permitExpiringIn(Duration.ofDays(2));

            // When / Then
            assertThat(reminderService.scanPermitExpirations().getSent()).isEqualTo(1);
            assertThat(sentTypes(permit)).containsExactly("permit_expiry_3d");

            clock.advance(Duration.ofHours(36));
            assertThat(reminderService.scanPermitExpirations().getSent()).isEqualTo(1);
            assertThat(reminderService.scanPermitExpirations().getSent()).isZero();

            assertThat(sentTypes(permit)).containsExactlyInAnyOrder("permit_expiry_3d", "permit_expiry_1d");
        }

        @Test
        @DisplayName("Permit expiring in five days gets only the 7-day reminder")
        void sevenDayReminder() {
            Application permit = permitExpiringIn(Duration.ofDays(5));

            reminderService.scanPermitExpirations();

            assertThat(sentTypes(permit)).containsExactly("permit_expiry_7d");
        }

        @Test
        @DisplayName("Concurrent scans send each reminder exactly once")
        void concurrentScans() throws Exception {
            // Given
            Application permit = permitExpiringIn(Duration.ofHours(12));
            int scanners = 4;
            ExecutorService pool = Executors.newFixedThreadPool(scanners);
            CountDownLatch start = new CountDownLatch(1);
            List<Future<ReminderScanResult>> futures = new ArrayList<>();

            // When
            try {
                for (int i = 0; i < scanners; i++) {
                    futures.add(pool.submit(() -> {
                        start.await();
                        return reminderService.scanPermitExpirations();
                    }));
                }
                start.countDown();

                int sent = 0;
                for (Future<ReminderScanResult> future : futures) {
                    sent += future.get(30, TimeUnit.SECONDS).getSent();
                }

                // Then
                assertThat(sent).isEqualTo(1);
            } finally {
                pool.shutdownNow();
            }
            assertThat(sentTypes(permit)).containsExactly("permit_expiry_1d");
        }

        @Test
        @DisplayName("Stats count reminders per type")
        void statsPerType() {
            permitExpiringIn(Duration.ofDays(2));
            permitExpiringIn(Duration.ofDays(6));
            reminderService.scanPermitExpirations();

            ReminderStats stats = reminderService.getStats(7);

            assertThat(stats.getTotal()).isEqualTo(2L);
            assertThat(stats.getCountsByType())
                    .containsEntry("permit_expiry_3d", 1L)
                    .containsEntry("permit_expiry_7d", 1L);
        }
    }

    private Application voucherApplication(ApplicationStatus status, String orderId) {
        Application application = createApplication(status, orderId, "pi_" + orderId);
        application.setPaymentReference("VCH-" + orderId);
        return applicationRepository.save(application);
    }

    private void voucherEvent(Application application, LocalDateTime expiresAt) {
        paymentEventRepository.save(PaymentEvent.builder()
                .applicationId(application.getId())
                .orderId(application.getPaymentOrderId())
                .eventType(PaymentEvent.VOUCHER_CREATED)
                .eventData("{}")
                .expiresAt(expiresAt)
                .createdAt(now())
                .build());
    }

    private Application permitExpiringIn(Duration remaining) {
        Application application = createApplication(ApplicationStatus.PERMIT_READY,
                "ord_" + System.nanoTime(), "pi_permit");
        application.setPermitExpiresAt(now().plus(remaining));
        return applicationRepository.save(application);
    }

    private List<String> sentTypes(Application application) {
        List<String> types = new ArrayList<>();
        for (ReminderRecord record : reminderService.getHistory(application.getId())) {
            types.add(record.getReminderType());
        }
        return types;
    }
}
