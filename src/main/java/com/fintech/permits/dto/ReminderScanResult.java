package com.fintech.permits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReminderScanResult {

    private LocalDateTime scannedAt;

    @Builder.Default
    private int candidates = 0;

    @Builder.Default
    private int sent = 0;

    /**
     * Candidates whose reminder was claimed by a concurrent scan.
     */
    @Builder.Default
    private int alreadyClaimed = 0;

    @Builder.Default
    private int errors = 0;

    public void incrementCandidates() {
        this.candidates++;
    }

    public void incrementSent() {
        this.sent++;
    }

    public void incrementAlreadyClaimed() {
        this.alreadyClaimed++;
    }

    public void incrementErrors() {
        this.errors++;
    }

    public ReminderScanResult plus(ReminderScanResult other) {
        return ReminderScanResult.builder()
                .scannedAt(scannedAt)
                .candidates(candidates + other.candidates)
                .sent(sent + other.sent)
                .alreadyClaimed(alreadyClaimed + other.alreadyClaimed)
                .errors(errors + other.errors)
                .build();
    }
}
