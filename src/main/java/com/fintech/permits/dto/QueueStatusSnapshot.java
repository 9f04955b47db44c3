package com.fintech.permits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatusSnapshot {

    private long queued;
    private long processing;
    private long completed;
    private long failed;
    private int maxConcurrent;
    private int localActiveWorkers;
}
