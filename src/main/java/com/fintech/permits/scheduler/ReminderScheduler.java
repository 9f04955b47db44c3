package com.fintech.permits.scheduler;

import com.fintech.permits.exception.ScanInProgressException;
import com.fintech.permits.service.ReminderScanService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduler for voucher and permit expiry reminders.
 * <p>
 * Default: Every 15 minutes
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReminderScheduler {

    private final ReminderScanService reminderScanService;

    @Value("${pipeline.scheduler.reminders.enabled:true}")
    private boolean schedulerEnabled;

    @Scheduled(fixedDelayString = "${pipeline.scheduler.reminders.interval-ms:900000}",
            initialDelayString = "${pipeline.scheduler.reminders.initial-delay-ms:60000}")
    public void runScheduledReminders() {
        if (!schedulerEnabled) {
            log.debug("Reminder scheduler is disabled, skipping run");
            return;
        }
        try {
            reminderScanService.runAll();
        } catch (ScanInProgressException e) {
            log.warn("Reminder scan skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled reminder scan failed with unexpected error", e);
        }
    }
}
