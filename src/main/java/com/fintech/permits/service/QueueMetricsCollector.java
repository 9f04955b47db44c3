package com.fintech.permits.service;

import com.fintech.permits.config.PipelineProperties;
import com.fintech.permits.dto.QueueHealth;
import com.fintech.permits.dto.QueueMetricsAggregate;
import com.fintech.permits.dto.QueueMetricsSummary;
import com.fintech.permits.entity.QueueMetricsSample;
import com.fintech.permits.entity.QueueStatus;
import com.fintech.permits.repository.ApplicationRepository;
import com.fintech.permits.repository.QueueMetricsSampleRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Persists point-in-time samples of the permit queue and reports on them.
 * <p>
 * Summaries are computed from the stored time series, not from in-memory state,
 * so they survive restarts and cover every instance sharing the database.
 */
@Service
@Slf4j
public class QueueMetricsCollector {

    private static final Set<QueueStatus> FINISHED = EnumSet.of(QueueStatus.COMPLETED, QueueStatus.FAILED);

    private final QueueMetricsSampleRepository sampleRepository;
    private final ApplicationRepository applicationRepository;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicLong lastQueueLength = new AtomicLong();
    private final AtomicLong lastActiveJobs = new AtomicLong();

    public QueueMetricsCollector(QueueMetricsSampleRepository sampleRepository,
                                 ApplicationRepository applicationRepository,
                                 PipelineProperties properties,
                                 MeterRegistry meterRegistry,
                                 Clock clock) {
        this.sampleRepository = sampleRepository;
        this.applicationRepository = applicationRepository;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void initMetrics() {
        Gauge.builder("permits.queue.length", lastQueueLength, AtomicLong::get)
                .description("Queued permit jobs at the last sample")
                .register(meterRegistry);
        Gauge.builder("permits.queue.active", lastActiveJobs, AtomicLong::get)
                .description("Running permit jobs at the last sample")
                .register(meterRegistry);
    }

    /**
     * Record a sample of the current queue state.
     */
    public QueueMetricsSample collectSample() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime lastHour = now.minusHours(1);

        long queueLength = applicationRepository.countByQueueStatus(QueueStatus.QUEUED);
        long activeJobs = applicationRepository.countByQueueStatus(QueueStatus.PROCESSING);
        Double avgWait = applicationRepository.averageWaitMsSince(lastHour, FINISHED);
        Double avgProcessing = applicationRepository.averageProcessingMsSince(lastHour, FINISHED);

        QueueMetricsSample sample = sampleRepository.save(QueueMetricsSample.builder()
                .queueLength((int) queueLength)
                .activeJobs((int) activeJobs)
                .avgWaitMs(avgWait != null ? Math.round(avgWait) : 0)
                .avgProcessingMs(avgProcessing != null ? Math.round(avgProcessing) : 0)
                .totalCompleted(applicationRepository.countByQueueStatus(QueueStatus.COMPLETED))
                .totalFailed(applicationRepository.countByQueueStatus(QueueStatus.FAILED))
                .createdAt(now)
                .build());

        lastQueueLength.set(queueLength);
        lastActiveJobs.set(activeJobs);

        if (queueLength > properties.getMetrics().getQueueLengthWarning()) {
            log.warn("Permit queue backlog: {} jobs waiting, {} active", queueLength, activeJobs);
        } else {
            log.debug("Queue sample recorded: {}", sample);
        }
        return sample;
    }

    /**
     * Aggregate the samples recorded within the window ending now.
     */
    public QueueMetricsSummary summarize(Duration window) {
        LocalDateTime end = LocalDateTime.now(clock);
        LocalDateTime start = end.minus(window);

        QueueMetricsAggregate aggregate = sampleRepository.aggregateSince(start);
        long sampleCount = aggregate.getSampleCount() != null ? aggregate.getSampleCount() : 0;

        QueueMetricsSummary.QueueMetricsSummaryBuilder summary = QueueMetricsSummary.builder()
                .windowStart(start)
                .windowEnd(end)
                .sampleCount(sampleCount);

        if (sampleCount == 0) {
            return summary.build();
        }

        double avgActive = valueOrZero(aggregate.getAvgActiveJobs());
        int workers = Math.max(1, properties.getQueue().getMaxConcurrent());

        long completed = 0;
        long failed = 0;
        // baseline is the last sample before the window, or the first inside it when none is older
        Optional<QueueMetricsSample> baseline = sampleRepository.findFirstByCreatedAtLessThanOrderByCreatedAtDescIdDesc(start);
        if (baseline.isEmpty()) {
            baseline = sampleRepository.findFirstByCreatedAtGreaterThanEqualOrderByCreatedAtAscIdAsc(start);
        }
        Optional<QueueMetricsSample> last = sampleRepository.findFirstByOrderByCreatedAtDescIdDesc();
        if (baseline.isPresent() && last.isPresent()) {
            completed = Math.max(0, last.get().getTotalCompleted() - baseline.get().getTotalCompleted());
            failed = Math.max(0, last.get().getTotalFailed() - baseline.get().getTotalFailed());
        }

        return summary
                .avgQueueLength(round(valueOrZero(aggregate.getAvgQueueLength())))
                .maxQueueLength(aggregate.getMaxQueueLength() != null ? aggregate.getMaxQueueLength() : 0)
                .avgActiveJobs(round(avgActive))
                .utilizationPercent(round(avgActive / workers * 100))
                .avgWaitMs(Math.round(valueOrZero(aggregate.getAvgWaitMs())))
                .avgProcessingMs(Math.round(valueOrZero(aggregate.getAvgProcessingMs())))
                .completedInWindow(completed)
                .failedInWindow(failed)
                .failureRatePercent(failureRate(completed, failed))
                .build();
    }

    /**
     * Health verdict from the latest sample and the last hour's failure rate.
     */
    public QueueHealth health() {
        Optional<QueueMetricsSample> latest = sampleRepository.findFirstByOrderByCreatedAtDescIdDesc();
        if (latest.isEmpty()) {
            return QueueHealth.builder().status(QueueHealth.Status.UNKNOWN).build();
        }

        QueueMetricsSample sample = latest.get();
        PipelineProperties.Metrics thresholds = properties.getMetrics();
        List<String> issues = new ArrayList<>();
        QueueHealth.Status status = QueueHealth.Status.HEALTHY;

        if (sample.getQueueLength() > thresholds.getUnhealthyQueueLength()) {
            issues.add("Queue backlog of " + sample.getQueueLength() + " jobs");
            status = QueueHealth.Status.UNHEALTHY;
        }
        if (sample.getQueueLength() > 0 && sample.getActiveJobs() == 0) {
            issues.add("Jobs are queued but no worker is active");
            status = worst(status, QueueHealth.Status.DEGRADED);
        }
        QueueMetricsSummary lastHour = summarize(Duration.ofHours(1));
        if (lastHour.getFailureRatePercent() > thresholds.getDegradedFailureRatePercent()) {
            issues.add("Failure rate " + lastHour.getFailureRatePercent() + "% in the last hour");
            status = worst(status, QueueHealth.Status.DEGRADED);
        }

        return QueueHealth.builder()
                .status(status)
                .issues(issues)
                .sampledAt(sample.getCreatedAt())
                .build();
    }

    public int purgeOlderThan(LocalDateTime before) {
        return sampleRepository.deleteOlderThan(before);
    }

    private static QueueHealth.Status worst(QueueHealth.Status a, QueueHealth.Status b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    private static double failureRate(long completed, long failed) {
        long total = completed + failed;
        return total == 0 ? 0.0 : round(failed * 100.0 / total);
    }

    private static double valueOrZero(Double value) {
        return value != null ? value : 0.0;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
