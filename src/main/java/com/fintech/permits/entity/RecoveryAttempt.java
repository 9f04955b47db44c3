package com.fintech.permits.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Tracks reconciliation of a payment intent whose local transition never completed.
 * <p>
 * attempt_count is only ever changed through conditional UPDATE statements in
 * {@link com.fintech.permits.repository.RecoveryAttemptRepository}.
 */
@Entity
@Table(name = "payment_recovery_attempts", uniqueConstraints = {
        @UniqueConstraint(name = "uk_recovery_app_intent", columnNames = {"application_id", "payment_intent_id"})
}, indexes = {
        @Index(name = "idx_recovery_status_last_attempt", columnList = "status, last_attempt_time")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryAttempt {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "application_id", nullable = false)
    private Long applicationId;

    @Column(name = "payment_intent_id", nullable = false, length = 100)
    private String paymentIntentId;

    @Column(name = "attempt_count", nullable = false)
    @Builder.Default
    private Integer attemptCount = 0;

    @Column(name = "last_attempt_time", nullable = false)
    private LocalDateTime lastAttemptTime;

    @Column(name = "last_error", length = 500)
    private String lastError;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 30)
    @Builder.Default
    private RecoveryStatus status = RecoveryStatus.PENDING;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

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
