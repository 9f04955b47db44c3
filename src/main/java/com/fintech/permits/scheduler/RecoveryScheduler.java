package com.fintech.permits.scheduler;

import com.fintech.permits.dto.RecoveryScanResult;
import com.fintech.permits.exception.ScanInProgressException;
import com.fintech.permits.service.PaymentRecoveryService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Scheduler for payment recovery scans.
 * <p>
 * fixedDelay keeps runs from overlapping within an instance; claims on the attempt rows
 * keep instances from working the same payment.
 * <p>
 * Default: Every 5 minutes
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecoveryScheduler {

    private final PaymentRecoveryService recoveryService;

    @Value("${pipeline.scheduler.recovery.enabled:true}")
    private boolean schedulerEnabled;

    @Scheduled(fixedDelayString = "${pipeline.scheduler.recovery.interval-ms:300000}",
            initialDelayString = "${pipeline.scheduler.recovery.initial-delay-ms:60000}")
    public void runScheduledRecovery() {
        if (!schedulerEnabled) {
            log.debug("Recovery scheduler is disabled, skipping run");
            return;
        }

        try {
            RecoveryScanResult result = recoveryService.runRecoveryScan();

            if (result.getTotalProcessed() > 0 && result.getErrors() > result.getTotalProcessed() * 0.1) {
                log.warn("High error rate in payment recovery: {} errors out of {} processed",
                        result.getErrors(), result.getTotalProcessed());
            }
        } catch (ScanInProgressException e) {
            log.warn("Recovery scan skipped: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Scheduled recovery scan failed with unexpected error", e);
        }
    }
}
