package com.fintech.permits.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * A vehicle permit application and its payment / permit generation state.
 * <p>
 * The status is mutated only by {@link com.fintech.permits.service.ApplicationStateService}
 * (together with a {@link PaymentEvent} append) and by the permit generation worker.
 * The queue_* columns hold the durable job queue state.
 */
@Entity
@Table(name = "permit_applications", indexes = {
        @Index(name = "idx_app_status", columnList = "status"),
        @Index(name = "idx_app_payment_order_id", columnList = "payment_order_id", unique = true),
        @Index(name = "idx_app_queue_status", columnList = "queue_status, queue_priority, queue_entered_at"),
        @Index(name = "idx_app_status_updated_at", columnList = "status, updated_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Application {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ApplicationStatus status;

    @Column(name = "payment_order_id", unique = true, length = 100)
    private String paymentOrderId;

    /**
     * Gateway payment intent, used for status reconciliation.
     */
    @Column(name = "payment_intent_id", length = 100)
    private String paymentIntentId;

    /**
     * Voucher reference for cash payments.
     */
    @Column(name = "payment_reference", length = 100)
    private String paymentReference;

    @Column(nullable = false, precision = 19, scale = 4)
    private BigDecimal amount;

    @Column(nullable = false, length = 3)
    private String currency;

    @Column(name = "voucher_expires_at")
    private LocalDateTime voucherExpiresAt;

    @Column(name = "permit_expires_at")
    private LocalDateTime permitExpiresAt;

    @Column(name = "permit_artifact_location", length = 500)
    private String permitArtifactLocation;

    /**
     * User-facing explanation for PAYMENT_FAILED / FAILED.
     */
    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Enumerated(EnumType.STRING)
    @Column(name = "queue_status", length = 20)
    private QueueStatus queueStatus;

    @Column(name = "queue_priority")
    @Builder.Default
    private Integer queuePriority = 0;

    @Column(name = "queue_entered_at")
    private LocalDateTime queueEnteredAt;

    @Column(name = "queue_started_at")
    private LocalDateTime queueStartedAt;

    @Column(name = "queue_completed_at")
    private LocalDateTime queueCompletedAt;

    @Column(name = "queue_wait_ms")
    private Long queueWaitMs;

    @Column(name = "duration_ms")
    private Long durationMs;

    @Column(name = "queue_attempts")
    @Builder.Default
    private Integer queueAttempts = 0;

    @Column(name = "queue_error", length = 500)
    private String queueError;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Version
    private Long version;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (updatedAt == null) {
            updatedAt = createdAt;
        }
    }
}
