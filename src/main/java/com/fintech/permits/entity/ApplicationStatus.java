package com.fintech.permits.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a permit application.
 * <p>
 * Transitions are validated by {@link com.fintech.permits.service.PaymentStateMachine}.
 */
public enum ApplicationStatus {

    /**
     * Application submitted, no payment order exists yet.
     */
    INITIATED,

    /**
     * Payment order created at the gateway, waiting for the customer.
     */
    PENDING_PAYMENT,

    /**
     * Gateway reported the payment as in progress.
     */
    PROCESSING_PAYMENT,

    /**
     * Cash voucher issued; waits for the customer to pay at a retail counter.
     */
    AWAITING_VOUCHER_PAYMENT,

    /**
     * Payment confirmed by the gateway. Triggers permit generation.
     */
    PAYMENT_RECEIVED,

    /**
     * A worker is producing the permit through the issuance backend.
     */
    GENERATING_PERMIT,

    /**
     * Permit artifacts are available.
     */
    PERMIT_READY,

    /**
     * Payment was declined or cancelled at the gateway.
     */
    PAYMENT_FAILED,

    /**
     * Permit generation failed permanently.
     */
    FAILED;

    private static final Set<ApplicationStatus> TERMINAL =
            EnumSet.of(PERMIT_READY, PAYMENT_FAILED, FAILED);

    private static final Set<ApplicationStatus> AWAITING_GATEWAY =
            EnumSet.of(PENDING_PAYMENT, PROCESSING_PAYMENT, AWAITING_VOUCHER_PAYMENT);

    private static final Set<ApplicationStatus> IN_FLIGHT =
            EnumSet.of(PROCESSING_PAYMENT, PAYMENT_RECEIVED, GENERATING_PERMIT);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * Statuses in which the local state still waits for a gateway outcome.
     */
    public static Set<ApplicationStatus> awaitingGateway() {
        return EnumSet.copyOf(AWAITING_GATEWAY);
    }

    /**
     * Statuses considered in flight by the stuck-job health query.
     */
    public static Set<ApplicationStatus> inFlight() {
        return EnumSet.copyOf(IN_FLIGHT);
    }

    public static Set<ApplicationStatus> terminal() {
        return EnumSet.copyOf(TERMINAL);
    }
}
