package com.fintech.permits.dto;

import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.entity.QueueStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A requested status change plus the fields and ledger event that go with it.
 * Null fields leave the application's current value untouched.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StateChange {

    private ApplicationStatus targetStatus;

    /**
     * Ledger event type appended with the change.
     */
    private String eventType;

    private String orderId;
    private String paymentIntentId;
    private String voucherReference;
    private LocalDateTime voucherExpiresAt;
    private BigDecimal amount;
    private String currency;
    private String failureReason;
    private String permitArtifactLocation;
    private LocalDateTime permitExpiresAt;

    // Queue bookkeeping written with the final transition of a permit job
    private QueueStatus queueStatus;
    private LocalDateTime queueCompletedAt;
    private Long durationMs;
    private Integer queueAttempts;
    private String queueError;

    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();
}
