package com.fintech.permits.service;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Raises alerts for conditions that need an operator: an ERROR log line plus a
 * {@code pipeline.alerts} counter tagged with the alert type, for alerting rules to pick up.
 */
@Component
@Slf4j
public class OperationalAlerts {

    public static final String LEDGER_UNAVAILABLE = "ledger_unavailable";
    public static final String WEBHOOK_PROCESSING_FAILED = "webhook_processing_failed";
    public static final String RECOVERY_EXHAUSTED = "recovery_max_attempts";
    public static final String QUEUE_BACKLOG = "queue_backlog";
    public static final String STUCK_APPLICATIONS = "stuck_applications";

    private static final String METRIC = "pipeline.alerts";

    private final MeterRegistry meterRegistry;

    public OperationalAlerts(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    public void raise(String alertType, String message) {
        raise(alertType, message, null);
    }

    public void raise(String alertType, String message, Throwable cause) {
        if (cause != null) {
            log.error("ALERT [{}] {}", alertType, message, cause);
        } else {
            log.error("ALERT [{}] {}", alertType, message);
        }
        meterRegistry.counter(METRIC, "type", alertType).increment();
    }

    public double count(String alertType) {
        return meterRegistry.counter(METRIC, "type", alertType).count();
    }
}
