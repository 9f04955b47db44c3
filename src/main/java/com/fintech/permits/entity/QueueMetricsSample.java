package com.fintech.permits.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * Immutable point-in-time sample of permit queue health.
 */
@Entity
@Table(name = "queue_metrics", indexes = {
        @Index(name = "idx_qm_created_at", columnList = "created_at")
})
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueMetricsSample {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "queue_length", nullable = false, updatable = false)
    private int queueLength;

    @Column(name = "active_jobs", nullable = false, updatable = false)
    private int activeJobs;

    @Column(name = "avg_wait_ms", nullable = false, updatable = false)
    private long avgWaitMs;

    @Column(name = "avg_processing_ms", nullable = false, updatable = false)
    private long avgProcessingMs;

    @Column(name = "total_completed", nullable = false, updatable = false)
    private long totalCompleted;

    @Column(name = "total_failed", nullable = false, updatable = false)
    private long totalFailed;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
