package com.fintech.permits.service;

import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.exception.InvalidStateTransitionException;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

import static com.fintech.permits.entity.ApplicationStatus.*;

/**
 * Transition rules of the application lifecycle.
 * <pre>
 * INITIATED -> PENDING_PAYMENT -> PROCESSING_PAYMENT -> PAYMENT_RECEIVED -> GENERATING_PERMIT -> PERMIT_READY
 *                    \                  \
 *                     +-> AWAITING_VOUCHER_PAYMENT -> PAYMENT_RECEIVED
 * </pre>
 * PAYMENT_FAILED, FAILED and PERMIT_READY are terminal. Moving to the current status is
 * always allowed and is a no-op for callers.
 */
@Component
public class PaymentStateMachine {

    private static final Map<ApplicationStatus, Set<ApplicationStatus>> TRANSITIONS =
            new EnumMap<>(ApplicationStatus.class);

    private static final Set<ApplicationStatus> REQUIRES_ORDER =
            EnumSet.of(PAYMENT_RECEIVED, GENERATING_PERMIT, PERMIT_READY);

    static {
        TRANSITIONS.put(INITIATED, EnumSet.of(PENDING_PAYMENT, FAILED));
        TRANSITIONS.put(PENDING_PAYMENT,
                EnumSet.of(PROCESSING_PAYMENT, AWAITING_VOUCHER_PAYMENT, PAYMENT_RECEIVED, PAYMENT_FAILED));
        TRANSITIONS.put(PROCESSING_PAYMENT,
                EnumSet.of(AWAITING_VOUCHER_PAYMENT, PAYMENT_RECEIVED, PAYMENT_FAILED));
        TRANSITIONS.put(AWAITING_VOUCHER_PAYMENT,
                EnumSet.of(PROCESSING_PAYMENT, PAYMENT_RECEIVED, PAYMENT_FAILED));
        TRANSITIONS.put(PAYMENT_RECEIVED, EnumSet.of(GENERATING_PERMIT, FAILED));
        TRANSITIONS.put(GENERATING_PERMIT, EnumSet.of(PERMIT_READY, FAILED));
        TRANSITIONS.put(PERMIT_READY, EnumSet.noneOf(ApplicationStatus.class));
        TRANSITIONS.put(PAYMENT_FAILED, EnumSet.noneOf(ApplicationStatus.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(ApplicationStatus.class));
    }

    public boolean canTransition(ApplicationStatus from, ApplicationStatus to) {
        return from == to || TRANSITIONS.get(from).contains(to);
    }

    public Set<ApplicationStatus> allowedTargets(ApplicationStatus from) {
        return Collections.unmodifiableSet(TRANSITIONS.get(from));
    }

    public boolean requiresOrder(ApplicationStatus status) {
        return REQUIRES_ORDER.contains(status);
    }

    /**
     * @param orderId payment order the application will carry after the transition
     * @throws InvalidStateTransitionException if the move is not allowed
     */
    public void validate(Long applicationId, ApplicationStatus from, ApplicationStatus to, String orderId) {
        if (!canTransition(from, to)) {
            String reason = from.isTerminal()
                    ? from + " is terminal"
                    : "allowed targets are " + TRANSITIONS.get(from);
            throw new InvalidStateTransitionException(applicationId, from, to, reason);
        }
        if (requiresOrder(to) && (orderId == null || orderId.isBlank())) {
            throw new InvalidStateTransitionException(applicationId, from, to, "no payment order attached");
        }
    }
}
