package com.fintech.permits.service;

import com.fintech.permits.config.PipelineProperties;
import com.fintech.permits.dto.QueuePosition;
import com.fintech.permits.dto.QueueStatusSnapshot;
import com.fintech.permits.entity.Application;
import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.entity.QueueStatus;
import com.fintech.permits.exception.JobInProgressException;
import com.fintech.permits.exception.NotFoundException;
import com.fintech.permits.repository.ApplicationRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Durable permit generation queue backed by the queue_* columns of permit_applications.
 * <p>
 * Every queue transition is a conditional UPDATE, so the queue survives restarts and
 * several instances can share it:
 * <pre>
 * (none|FAILED|CANCELLED) -enqueue-> QUEUED -claim-> PROCESSING -finish-> COMPLETED|FAILED
 *                                    QUEUED -cancel-> CANCELLED
 * </pre>
 */
@Service
@Slf4j
public class PermitJobQueue {

    private static final Set<ApplicationStatus> ENQUEUEABLE = EnumSet.of(ApplicationStatus.PAYMENT_RECEIVED);
    private static final Set<QueueStatus> REQUEUEABLE = EnumSet.of(QueueStatus.FAILED, QueueStatus.CANCELLED);
    private static final Set<QueueStatus> FINISHED = EnumSet.of(QueueStatus.COMPLETED, QueueStatus.FAILED);
    private static final long DEFAULT_PROCESSING_ESTIMATE_MS = 60_000;
    private static final int STUCK_QUERY_LIMIT = 100;

    private final ApplicationRepository applicationRepository;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private Counter enqueuedCounter;
    private Counter cancelledCounter;

    public PermitJobQueue(ApplicationRepository applicationRepository,
                          PipelineProperties properties,
                          MeterRegistry meterRegistry,
                          Clock clock) {
        this.applicationRepository = applicationRepository;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    @PostConstruct
    public void initMetrics() {
        enqueuedCounter = Counter.builder("permits.queue.enqueued")
                .description("Permit jobs put on the queue")
                .register(meterRegistry);
        cancelledCounter = Counter.builder("permits.queue.cancelled")
                .description("Permit jobs cancelled before starting")
                .register(meterRegistry);
    }

    public boolean enqueue(Long applicationId) {
        return enqueue(applicationId, properties.getQueue().getDefaultPriority());
    }

    /**
     * Queue permit generation for a paid application. Idempotent: an application that is
     * already queued, running or completed is left alone.
     *
     * @param priority higher values run first
     * @return true if this call queued the job
     */
    public boolean enqueue(Long applicationId, int priority) {
        int updated = applicationRepository.markQueued(applicationId, priority, now(),
                QueueStatus.QUEUED, ENQUEUEABLE, REQUEUEABLE);

        if (updated == 1) {
            enqueuedCounter.increment();
            log.info("Queued permit generation for application {} with priority {}", applicationId, priority);
            return true;
        }
        log.debug("Application {} not queued: already queued/running/completed or not awaiting a permit",
                applicationId);
        return false;
    }

    /**
     * Claim up to {@code maxJobs} queued jobs, highest priority first and FIFO within a priority.
     * Jobs claimed concurrently by another dispatcher are skipped.
     */
    public List<Application> claimNext(int maxJobs) {
        if (maxJobs <= 0) {
            return List.of();
        }

        List<Application> candidates = applicationRepository.findQueued(QueueStatus.QUEUED, PageRequest.of(0, maxJobs));
        List<Application> claimed = new ArrayList<>(candidates.size());

        for (Application candidate : candidates) {
            LocalDateTime now = now();
            long waitMs = candidate.getQueueEnteredAt() != null
                    ? Math.max(0, Duration.between(candidate.getQueueEnteredAt(), now).toMillis())
                    : 0;

            if (applicationRepository.claimQueued(candidate.getId(), now, waitMs,
                    QueueStatus.QUEUED, QueueStatus.PROCESSING) == 1) {
                candidate.setQueueStatus(QueueStatus.PROCESSING);
                candidate.setQueueStartedAt(now);
                candidate.setQueueWaitMs(waitMs);
                claimed.add(candidate);
                log.debug("Claimed permit job for application {} after {}ms in queue", candidate.getId(), waitMs);
            } else {
                log.debug("Permit job for application {} already claimed elsewhere", candidate.getId());
            }
        }
        return claimed;
    }

    /**
     * Return a claimed job to the queue when no worker could take it.
     */
    public void release(Long applicationId) {
        applicationRepository.releaseClaim(applicationId, QueueStatus.QUEUED, QueueStatus.PROCESSING);
    }

    /**
     * Close a running job that could not reach a final application status.
     */
    public void markJobFailed(Long applicationId, long durationMs, int attempts, String error) {
        applicationRepository.finishJob(applicationId, QueueStatus.FAILED, now(), durationMs, attempts,
                error, QueueStatus.PROCESSING);
    }

    /**
     * Cancel a queued job.
     *
     * @return true if the job was removed from the queue, false if it was not queued
     * @throws JobInProgressException if a worker already started the job
     */
    public boolean cancel(Long applicationId) {
        if (applicationRepository.cancelQueued(applicationId, now(), QueueStatus.QUEUED, QueueStatus.CANCELLED) == 1) {
            cancelledCounter.increment();
            log.info("Cancelled permit job for application {}", applicationId);
            return true;
        }

        Application application = applicationRepository.findById(applicationId)
                .orElseThrow(() -> NotFoundException.application(applicationId));
        if (application.getQueueStatus() == QueueStatus.PROCESSING) {
            throw new JobInProgressException(applicationId);
        }
        return false;
    }

    public QueuePosition position(Long applicationId) {
        Application application = applicationRepository.findById(applicationId)
                .orElseThrow(() -> NotFoundException.application(applicationId));

        if (application.getQueueStatus() != QueueStatus.QUEUED) {
            return QueuePosition.builder()
                    .applicationId(applicationId)
                    .queueStatus(application.getQueueStatus())
                    .position(0)
                    .estimatedWaitMs(0)
                    .build();
        }

        long ahead = applicationRepository.countQueuedAhead(QueueStatus.QUEUED,
                application.getQueuePriority() != null ? application.getQueuePriority() : 0,
                application.getQueueEnteredAt());
        long position = ahead + 1;

        Double avgProcessing = applicationRepository.averageProcessingMsSince(now().minusHours(1), FINISHED);
        long perJobMs = avgProcessing != null ? avgProcessing.longValue() : DEFAULT_PROCESSING_ESTIMATE_MS;
        int workers = Math.max(1, properties.getQueue().getMaxConcurrent());
        long rounds = (position + workers - 1) / workers;

        return QueuePosition.builder()
                .applicationId(applicationId)
                .queueStatus(QueueStatus.QUEUED)
                .position(position)
                .estimatedWaitMs(rounds * perJobMs)
                .build();
    }

    public QueueStatusSnapshot snapshot() {
        return QueueStatusSnapshot.builder()
                .queued(applicationRepository.countByQueueStatus(QueueStatus.QUEUED))
                .processing(applicationRepository.countByQueueStatus(QueueStatus.PROCESSING))
                .completed(applicationRepository.countByQueueStatus(QueueStatus.COMPLETED))
                .failed(applicationRepository.countByQueueStatus(QueueStatus.FAILED))
                .maxConcurrent(properties.getQueue().getMaxConcurrent())
                .build();
    }

    /**
     * Applications in an in-flight status with no update for the stuck threshold.
     */
    public List<Application> findStuck() {
        LocalDateTime threshold = now().minusMinutes(properties.getQueue().getStuckThresholdMinutes());
        return applicationRepository.findStuck(ApplicationStatus.inFlight(), threshold,
                PageRequest.of(0, STUCK_QUERY_LIMIT));
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
