package com.fintech.permits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Captures the results of a payment recovery scan.
 * Used for reporting, monitoring, and audit trails.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryScanResult {

    private LocalDateTime startedAt;
    private LocalDateTime completedAt;

    /**
     * Stale payments newly registered for recovery in this scan.
     */
    @Builder.Default
    private int newlyTracked = 0;

    /**
     * Rows closed out as MAX_ATTEMPTS_REACHED before selection.
     */
    @Builder.Default
    private int exhaustedBeforeScan = 0;

    @Builder.Default
    private int totalProcessed = 0;

    @Builder.Default
    private int skippedClaimedElsewhere = 0;

    @Builder.Default
    private int recovered = 0;

    @Builder.Default
    private int markedFailed = 0;

    @Builder.Default
    private int stillPending = 0;

    @Builder.Default
    private int maxAttemptsReached = 0;

    @Builder.Default
    private int errors = 0;

    @Builder.Default
    private List<RecoveryError> errorDetails = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class RecoveryError {
        private Long applicationId;
        private String paymentIntentId;
        private String errorMessage;
        private LocalDateTime occurredAt;
    }

    public void incrementProcessed() {
        this.totalProcessed++;
    }

    public void incrementSkipped() {
        this.skippedClaimedElsewhere++;
    }

    public void incrementRecovered() {
        this.recovered++;
    }

    public void incrementMarkedFailed() {
        this.markedFailed++;
    }

    public void incrementStillPending() {
        this.stillPending++;
    }

    public void incrementMaxAttemptsReached() {
        this.maxAttemptsReached++;
    }

    public void addError(Long applicationId, String paymentIntentId, String errorMessage, LocalDateTime at) {
        this.errors++;
        if (this.errorDetails == null) {
            this.errorDetails = new ArrayList<>();
        }
        this.errorDetails.add(RecoveryError.builder()
                .applicationId(applicationId)
                .paymentIntentId(paymentIntentId)
                .errorMessage(errorMessage)
                .occurredAt(at)
                .build());
    }

    public long getDurationMs() {
        if (startedAt == null || completedAt == null) {
            return 0;
        }
        return Duration.between(startedAt, completedAt).toMillis();
    }
}
