package com.fintech.permits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueHealth {

    private Status status;

    @Builder.Default
    private List<String> issues = new ArrayList<>();

    private LocalDateTime sampledAt;

    public enum Status {
        HEALTHY,
        DEGRADED,
        UNHEALTHY,
        /**
         * No sample recorded yet.
         */
        UNKNOWN
    }
}
