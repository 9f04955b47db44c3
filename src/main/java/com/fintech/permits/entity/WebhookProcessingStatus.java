package com.fintech.permits.entity;

public enum WebhookProcessingStatus {
    PENDING,
    PROCESSED,
    FAILED
}
