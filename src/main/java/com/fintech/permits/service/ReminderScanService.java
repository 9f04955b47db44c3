package com.fintech.permits.service;

import com.fintech.permits.config.PipelineProperties;
import com.fintech.permits.dto.ReminderScanResult;
import com.fintech.permits.dto.ReminderStats;
import com.fintech.permits.entity.Application;
import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.entity.PaymentEvent;
import com.fintech.permits.entity.ReminderRecord;
import com.fintech.permits.exception.ScanInProgressException;
import com.fintech.permits.repository.ApplicationRepository;
import com.fintech.permits.repository.PaymentEventRepository;
import com.fintech.permits.repository.ReminderRecordRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Collectors;

/**
 * Sends expiry reminders for unpaid vouchers and issued permits.
 * <p>
 * A reminder is claimed by inserting its {@link ReminderRecord} before the notification
 * goes out. The unique (application, type) constraint lets exactly one scanner win, so a
 * reminder is sent at most once even with several instances scanning. Applications are
 * only read, never modified.
 */
@Service
@Slf4j
public class ReminderScanService {

    static final String SCAN_NAME = "Reminder scan";

    private final PaymentEventRepository paymentEventRepository;
    private final ApplicationRepository applicationRepository;
    private final ReminderRecordRepository reminderRepository;
    private final NotificationService notificationService;
    private final TransactionTemplate requiresNew;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicBoolean isRunning = new AtomicBoolean(false);

    public ReminderScanService(PaymentEventRepository paymentEventRepository,
                               ApplicationRepository applicationRepository,
                               ReminderRecordRepository reminderRepository,
                               NotificationService notificationService,
                               PlatformTransactionManager transactionManager,
                               PipelineProperties properties,
                               MeterRegistry meterRegistry,
                               Clock clock) {
        this.paymentEventRepository = paymentEventRepository;
        this.applicationRepository = applicationRepository;
        this.reminderRepository = reminderRepository;
        this.notificationService = notificationService;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    /**
     * Run both scans.
     *
     * @throws ScanInProgressException if a scan is already running in this instance
     */
    public ReminderScanResult runAll() {
        if (!isRunning.compareAndSet(false, true)) {
            throw new ScanInProgressException(SCAN_NAME);
        }
        try {
            ReminderScanResult vouchers = scanVoucherExpirations();
            ReminderScanResult permits = scanPermitExpirations();
            ReminderScanResult total = vouchers.plus(permits);
            if (total.getCandidates() > 0) {
                log.info("Reminder scan completed: {} candidates, {} sent, {} already claimed, {} errors",
                        total.getCandidates(), total.getSent(), total.getAlreadyClaimed(), total.getErrors());
            }
            return total;
        } finally {
            isRunning.set(false);
        }
    }

    /**
     * Remind customers whose latest voucher expires within the voucher horizon.
     */
    public ReminderScanResult scanVoucherExpirations() {
        LocalDateTime now = now();
        LocalDateTime horizon = now.plusHours(properties.getReminders().getVoucherHorizonHours());
        ReminderScanResult result = ReminderScanResult.builder().scannedAt(now).build();

        List<PaymentEvent> expiring = paymentEventRepository.findLatestExpiringVoucherEvents(
                PaymentEvent.VOUCHER_CREATED, ApplicationStatus.AWAITING_VOUCHER_PAYMENT, now, horizon,
                ReminderRecord.VOUCHER_EXPIRATION, PageRequest.of(0, properties.getReminders().getBatchSize()));

        for (PaymentEvent event : expiring) {
            result.incrementCandidates();
            try {
                if (!claim(event.getApplicationId(), ReminderRecord.VOUCHER_EXPIRATION, event.getExpiresAt(), now)) {
                    result.incrementAlreadyClaimed();
                    continue;
                }
                String voucherReference = applicationRepository.findById(event.getApplicationId())
                        .map(Application::getPaymentReference)
                        .orElse(null);
                notificationService.voucherExpiring(event.getApplicationId(), voucherReference, event.getExpiresAt());
                result.incrementSent();
                countSent(ReminderRecord.VOUCHER_EXPIRATION);
                log.debug("Voucher expiration reminder sent for application {}", event.getApplicationId());
            } catch (Exception e) {
                result.incrementErrors();
                log.error("Failed to send voucher reminder for application {}: {}",
                        event.getApplicationId(), e.getMessage(), e);
            }
        }
        return result;
    }

    /**
     * Remind permit holders before their permit expires.
     * <p>
     * Offsets are checked smallest first and each offset only covers the slice of time
     * beyond the next smaller one, so a permit receives the reminder of the smallest offset
     * whose window it falls in and never a larger one afterwards.
     */
    public ReminderScanResult scanPermitExpirations() {
        LocalDateTime now = now();
        ReminderScanResult result = ReminderScanResult.builder().scannedAt(now).build();

        List<Integer> offsets = properties.getReminders().getPermitOffsetsDays().stream()
                .filter(days -> days != null && days > 0)
                .distinct()
                .sorted()
                .collect(Collectors.toList());

        int previousOffset = 0;
        for (int days : offsets) {
            String reminderType = ReminderRecord.permitExpiryType(days);
            List<Application> expiring = applicationRepository.findPermitsExpiringWithoutReminder(
                    ApplicationStatus.PERMIT_READY, now.plusDays(previousOffset), now.plusDays(days),
                    reminderType, PageRequest.of(0, properties.getReminders().getBatchSize()));

            for (Application application : expiring) {
                result.incrementCandidates();
                try {
                    if (!claim(application.getId(), reminderType, application.getPermitExpiresAt(), now)) {
                        result.incrementAlreadyClaimed();
                        continue;
                    }
                    notificationService.permitExpiring(application, days);
                    result.incrementSent();
                    countSent(reminderType);
                    log.debug("Permit expiry reminder ({}) sent for application {}", reminderType, application.getId());
                } catch (Exception e) {
                    result.incrementErrors();
                    log.error("Failed to send permit reminder {} for application {}: {}",
                            reminderType, application.getId(), e.getMessage(), e);
                }
            }
            previousOffset = days;
        }
        return result;
    }

    /**
     * Claim a reminder by inserting its record.
     *
     * @return false if the reminder was already claimed
     */
    private boolean claim(Long applicationId, String reminderType, LocalDateTime subjectExpiresAt, LocalDateTime now) {
        try {
            requiresNew.executeWithoutResult(status -> reminderRepository.saveAndFlush(ReminderRecord.builder()
                    .applicationId(applicationId)
                    .reminderType(reminderType)
                    .subjectExpiresAt(subjectExpiresAt)
                    .sentAt(now)
                    .build()));
            return true;
        } catch (DataIntegrityViolationException e) {
            log.debug("Reminder {} for application {} already claimed", reminderType, applicationId);
            return false;
        }
    }

    public ReminderStats getStats(int windowDays) {
        Map<String, Long> countsByType = new TreeMap<>();
        long total = 0;
        for (Object[] row : reminderRepository.countByTypeSince(now().minusDays(windowDays))) {
            long count = ((Number) row[1]).longValue();
            countsByType.put((String) row[0], count);
            total += count;
        }
        return ReminderStats.builder()
                .windowDays(windowDays)
                .total(total)
                .countsByType(countsByType)
                .build();
    }

    public List<ReminderRecord> getHistory(Long applicationId) {
        return reminderRepository.findByApplicationIdOrderBySentAtDesc(applicationId);
    }

    public int purgeSentBefore(LocalDateTime before) {
        return reminderRepository.deleteSentBefore(before);
    }

    private void countSent(String reminderType) {
        meterRegistry.counter("reminders.sent", "type", reminderType).increment();
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
