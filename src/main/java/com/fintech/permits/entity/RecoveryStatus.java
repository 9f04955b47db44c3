package com.fintech.permits.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of a payment recovery attempt.
 */
public enum RecoveryStatus {

    /**
     * Registered by stuck-payment detection, not yet attempted.
     */
    PENDING,

    /**
     * At least one attempt made; the gateway has not reached a final state.
     */
    RECOVERING,

    SUCCEEDED,

    FAILED,

    /**
     * Attempts exhausted. Needs manual review.
     */
    MAX_ATTEMPTS_REACHED;

    public static Set<RecoveryStatus> active() {
        return EnumSet.of(PENDING, RECOVERING);
    }

    public static Set<RecoveryStatus> finished() {
        return EnumSet.of(SUCCEEDED, FAILED, MAX_ATTEMPTS_REACHED);
    }
}
