package com.fintech.permits.dto;

import com.fintech.permits.entity.QueueStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Where an application's permit job sits in the queue.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueuePosition {

    private Long applicationId;
    private QueueStatus queueStatus;
    /**
     * 1-based position among queued jobs; 0 when not queued.
     */
    private long position;
    private long estimatedWaitMs;
}
