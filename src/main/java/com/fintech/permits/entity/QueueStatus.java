package com.fintech.permits.entity;

/**
 * Position of an application in the permit generation queue.
 */
public enum QueueStatus {
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED
}
