package com.fintech.permits.scheduler;

import com.fintech.permits.config.PipelineProperties;
import com.fintech.permits.entity.Application;
import com.fintech.permits.service.PermitGenerationWorker;
import com.fintech.permits.service.PermitJobQueue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Polls the durable queue and hands claimed jobs to the worker pool.
 * <p>
 * Claims never exceed the free worker slots of this instance, so a claimed job starts
 * right away instead of sitting in the executor's queue as PROCESSING.
 */
@Component
@Slf4j
public class PermitJobDispatcher {

    private final PermitJobQueue jobQueue;
    private final PermitGenerationWorker worker;
    private final ThreadPoolTaskExecutor permitWorkerExecutor;
    private final PipelineProperties properties;

    private final AtomicInteger inFlight = new AtomicInteger();

    @Value("${pipeline.scheduler.dispatcher.enabled:true}")
    private boolean dispatcherEnabled;

    public PermitJobDispatcher(PermitJobQueue jobQueue,
                               PermitGenerationWorker worker,
                               @Qualifier("permitWorkerExecutor") ThreadPoolTaskExecutor permitWorkerExecutor,
                               PipelineProperties properties) {
        this.jobQueue = jobQueue;
        this.worker = worker;
        this.permitWorkerExecutor = permitWorkerExecutor;
        this.properties = properties;
    }

    @Scheduled(fixedDelayString = "${pipeline.scheduler.dispatcher.interval-ms:2000}")
    public void poll() {
        if (!dispatcherEnabled) {
            return;
        }
        try {
            dispatch();
        } catch (Exception e) {
            log.error("Permit job dispatch failed", e);
        }
    }

    /**
     * Claim and start as many queued jobs as there are free workers.
     *
     * @return number of jobs started
     */
    public int dispatch() {
        int free = properties.getQueue().getMaxConcurrent() - inFlight.get();
        if (free <= 0) {
            return 0;
        }

        List<Application> claimed = jobQueue.claimNext(free);
        int started = 0;
        for (Application job : claimed) {
            inFlight.incrementAndGet();
            try {
                permitWorkerExecutor.execute(() -> {
                    try {
                        worker.process(job);
                    } finally {
                        inFlight.decrementAndGet();
                    }
                });
                started++;
            } catch (TaskRejectedException e) {
                inFlight.decrementAndGet();
                log.warn("Worker pool rejected job for application {}, returning it to the queue", job.getId());
                jobQueue.release(job.getId());
            }
        }
        if (started > 0) {
            log.debug("Dispatched {} permit jobs ({} in flight)", started, inFlight.get());
        }
        return started;
    }

    public int getActiveWorkers() {
        return inFlight.get();
    }
}
