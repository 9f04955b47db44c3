package com.fintech.permits.dto;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Raw aggregate over stored queue metrics samples, built by a JPQL constructor expression.
 * Every value except the sample count is null when the window holds no samples.
 */
@Getter
@ToString
@AllArgsConstructor
public class QueueMetricsAggregate {

    private Long sampleCount;
    private Double avgQueueLength;
    private Integer maxQueueLength;
    private Double avgActiveJobs;
    private Double avgWaitMs;
    private Double avgProcessingMs;
}
