package com.fintech.permits.service;

import com.fintech.permits.config.PipelineProperties;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;

/**
 * Purges bookkeeping rows past their retention period. Applications and payment events are
 * never purged.
 */
@Service
@Slf4j
public class RetentionService {

    private final WebhookEventLedger webhookEventLedger;
    private final RecoveryAttemptService recoveryAttemptService;
    private final QueueMetricsCollector metricsCollector;
    private final ReminderScanService reminderScanService;
    private final PaymentStateTokenService tokenService;
    private final PipelineProperties properties;
    private final Clock clock;

    public RetentionService(WebhookEventLedger webhookEventLedger,
                            RecoveryAttemptService recoveryAttemptService,
                            QueueMetricsCollector metricsCollector,
                            ReminderScanService reminderScanService,
                            PaymentStateTokenService tokenService,
                            PipelineProperties properties,
                            Clock clock) {
        this.webhookEventLedger = webhookEventLedger;
        this.recoveryAttemptService = recoveryAttemptService;
        this.metricsCollector = metricsCollector;
        this.reminderScanService = reminderScanService;
        this.tokenService = tokenService;
        this.properties = properties;
        this.clock = clock;
    }

    public PurgeResult purge() {
        LocalDateTime now = LocalDateTime.now(clock);
        PipelineProperties.Retention retention = properties.getRetention();

        PurgeResult result = PurgeResult.builder()
                .webhookEvents(webhookEventLedger.purgeProcessedBefore(now.minusDays(retention.getWebhookEventsDays())))
                .recoveryAttempts(recoveryAttemptService.purgeFinishedBefore(
                        now.minusDays(retention.getRecoveryAttemptsDays())))
                .metricsSamples(metricsCollector.purgeOlderThan(now.minusDays(retention.getMetricsDays())))
                .reminders(reminderScanService.purgeSentBefore(now.minusDays(retention.getRemindersDays())))
                .stateTokens(tokenService.purgeExpired(now))
                .build();

        if (result.getTotal() > 0) {
            log.info("Retention purge removed {} webhook events, {} recovery attempts, {} metrics samples, " +
                            "{} reminders, {} state tokens",
                    result.getWebhookEvents(), result.getRecoveryAttempts(), result.getMetricsSamples(),
                    result.getReminders(), result.getStateTokens());
        }
        return result;
    }

    @Data
    @Builder
    public static class PurgeResult {
        private int webhookEvents;
        private int recoveryAttempts;
        private int metricsSamples;
        private int reminders;
        private int stateTokens;

        public int getTotal() {
            return webhookEvents + recoveryAttempts + metricsSamples + reminders + stateTokens;
        }
    }
}
