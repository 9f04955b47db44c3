package com.fintech.permits.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the payment and permit pipeline, bound from {@code pipeline.*}.
 * <p>
 * Example:
 * <pre>
 * pipeline:
 *   webhook:
 *     secret: whsec_...
 *   recovery:
 *     stale-threshold-minutes: 30
 *     max-attempts: 3
 *   queue:
 *     max-concurrent: 2
 * </pre>
 * Scheduler enablement and intervals are read separately with {@code @Value}.
 */
@Data
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    private Webhook webhook = new Webhook();
    private Recovery recovery = new Recovery();
    private Queue queue = new Queue();
    private Issuance issuance = new Issuance();
    private Metrics metrics = new Metrics();
    private Reminders reminders = new Reminders();
    private Retention retention = new Retention();
    private StateToken stateToken = new StateToken();

    @Data
    public static class Webhook {
        /**
         * Shared secret for the HMAC signature the gateway puts on each delivery.
         */
        private String secret = "change-me";
        /**
         * Turn off only for local testing against a gateway simulator.
         */
        private boolean verifySignature = true;
        private int ledgerWriteAttempts = 3;
        private long ledgerWriteBackoffMs = 50;
    }

    @Data
    public static class Recovery {
        /**
         * Minimum time since the last attempt before a payment is re-queried.
         */
        private int staleThresholdMinutes = 30;
        private int maxAttempts = 3;
        private int batchSize = 100;
        private long gatewayTimeoutMs = 10000;
    }

    @Data
    public static class Queue {
        /**
         * Size of the permit generation worker pool.
         */
        private int maxConcurrent = 2;
        private int maxAttempts = 3;
        private long initialBackoffMs = 1000;
        private double backoffMultiplier = 2.0;
        private long maxBackoffMs = 10000;
        private int stuckThresholdMinutes = 60;
        private int defaultPriority = 0;
    }

    @Data
    public static class Issuance {
        private long timeoutMs = 120000;
        /**
         * Validity of an issued permit when the backend does not report an expiry.
         */
        private int permitValidityDays = 30;
    }

    @Data
    public static class Metrics {
        private int queueLengthWarning = 10;
        private int unhealthyQueueLength = 20;
        private double degradedFailureRatePercent = 10.0;
    }

    @Data
    public static class Reminders {
        private int voucherHorizonHours = 24;
        private List<Integer> permitOffsetsDays = new ArrayList<>(List.of(7, 3, 1));
        private int batchSize = 500;
    }

    @Data
    public static class Retention {
        private int webhookEventsDays = 30;
        private int recoveryAttemptsDays = 7;
        private int metricsDays = 30;
        private int remindersDays = 90;
    }

    @Data
    public static class StateToken {
        private int ttlMinutes = 30;
    }
}
