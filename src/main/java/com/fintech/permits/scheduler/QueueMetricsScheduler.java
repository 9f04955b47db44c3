package com.fintech.permits.scheduler;

import com.fintech.permits.config.PipelineProperties;
import com.fintech.permits.entity.QueueMetricsSample;
import com.fintech.permits.service.OperationalAlerts;
import com.fintech.permits.service.QueueMetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Records a queue metrics sample every minute in addition to the samples taken after
 * each finished job, so idle periods still show up in the history.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class QueueMetricsScheduler {

    private final QueueMetricsCollector metricsCollector;
    private final OperationalAlerts alerts;
    private final PipelineProperties properties;

    @Value("${pipeline.scheduler.metrics.enabled:true}")
    private boolean schedulerEnabled;

    @Scheduled(fixedDelayString = "${pipeline.scheduler.metrics.interval-ms:60000}")
    public void sample() {
        if (!schedulerEnabled) {
            return;
        }
        try {
            QueueMetricsSample sample = metricsCollector.collectSample();
            if (sample.getQueueLength() > properties.getMetrics().getUnhealthyQueueLength()) {
                alerts.raise(OperationalAlerts.QUEUE_BACKLOG, String.format(
                        "Permit queue backlog of %d jobs with %d active", sample.getQueueLength(), sample.getActiveJobs()));
            }
        } catch (Exception e) {
            log.error("Scheduled queue metrics sample failed", e);
        }
    }
}
