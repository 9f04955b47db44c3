package com.fintech.permits.dto;

/**
 * Outcome of handling one webhook delivery. All outcomes are acknowledged with 200.
 */
public enum WebhookResult {

    PROCESSED,

    /**
     * Event id already handled; nothing was done.
     */
    DUPLICATE,

    /**
     * No application for the referenced order. Recorded so redeliveries are not reprocessed.
     */
    NOT_FOUND,

    /**
     * Unknown event type or a transition the state machine rejects.
     */
    IGNORED
}
