package com.fintech.permits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Queue performance over a time window, derived from stored samples.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueMetricsSummary {

    private LocalDateTime windowStart;
    private LocalDateTime windowEnd;
    private long sampleCount;
    private double avgQueueLength;
    private int maxQueueLength;
    private double avgActiveJobs;
    /**
     * Average active jobs as a percentage of the worker pool size.
     */
    private double utilizationPercent;
    private long avgWaitMs;
    private long avgProcessingMs;
    private long completedInWindow;
    private long failedInWindow;
    private double failureRatePercent;
}
