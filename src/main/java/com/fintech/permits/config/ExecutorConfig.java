package com.fintech.permits.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools and the clock used by the pipeline.
 * <p>
 * - permitWorkerExecutor: the bounded permit generation pool (queue.max-concurrent threads)
 * - outboundCallExecutor: runs gateway/backend calls so a TimeLimiter can abandon them
 * - notificationExecutor: fire-and-forget notification dispatch
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean(name = "permitWorkerExecutor")
    public ThreadPoolTaskExecutor permitWorkerExecutor(PipelineProperties properties) {
        int workers = properties.getQueue().getMaxConcurrent();

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        // The dispatcher only claims as many jobs as there are free workers
        executor.setQueueCapacity(workers);
        executor.setThreadNamePrefix("permit-worker-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(150);
        executor.initialize();

        log.info("Initialized permit worker pool with {} workers", workers);
        return executor;
    }

    @Bean(name = "outboundCallExecutor")
    public ThreadPoolTaskExecutor outboundCallExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(4);
        executor.setMaxPoolSize(16);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("outbound-call-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean(name = "notificationExecutor")
    public ThreadPoolTaskExecutor notificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("notification-");
        executor.setRejectedExecutionHandler(new DropWithLogging());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();
        return executor;
    }

    /**
     * Notifications are best effort: a saturated pool drops the task instead of
     * blocking the pipeline thread that produced it.
     */
    static class DropWithLogging implements RejectedExecutionHandler {

        @Override
        public void rejectedExecution(Runnable task, ThreadPoolExecutor executor) {
            log.warn("Notification executor saturated (active: {}, queued: {}), dropping notification",
                    executor.getActiveCount(), executor.getQueue().size());
        }
    }
}
