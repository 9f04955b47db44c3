package com.fintech.permits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecoveryStats {

    private int windowHours;
    private long totalAttempts;
    private Map<String, Long> countsByStatus;
    private double averageAttempts;
    private long needingReview;
    private boolean scanRunning;
}
