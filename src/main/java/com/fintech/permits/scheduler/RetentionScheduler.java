package com.fintech.permits.scheduler;

import com.fintech.permits.entity.Application;
import com.fintech.permits.service.OperationalAlerts;
import com.fintech.permits.service.PermitJobQueue;
import com.fintech.permits.service.RetentionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Hourly housekeeping: retention purge and the stuck application check.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RetentionScheduler {

    private final RetentionService retentionService;
    private final PermitJobQueue jobQueue;
    private final OperationalAlerts alerts;

    @Value("${pipeline.scheduler.housekeeping.enabled:true}")
    private boolean schedulerEnabled;

    @Scheduled(fixedDelayString = "${pipeline.scheduler.housekeeping.interval-ms:3600000}",
            initialDelayString = "${pipeline.scheduler.housekeeping.initial-delay-ms:120000}")
    public void runHousekeeping() {
        if (!schedulerEnabled) {
            log.debug("Housekeeping scheduler is disabled, skipping run");
            return;
        }

        try {
            retentionService.purge();
        } catch (Exception e) {
            log.error("Retention purge failed", e);
        }

        try {
            List<Application> stuck = jobQueue.findStuck();
            if (!stuck.isEmpty()) {
                alerts.raise(OperationalAlerts.STUCK_APPLICATIONS, String.format(
                        "%d applications have not progressed past the stuck threshold: %s", stuck.size(),
                        stuck.stream().map(a -> a.getId() + "=" + a.getStatus()).collect(Collectors.joining(", "))));
            }
        } catch (Exception e) {
            log.error("Stuck application check failed", e);
        }
    }
}
