package com.fintech.permits.service;

import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import static com.fintech.permits.entity.ApplicationStatus.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PaymentStateMachineTest {

    private final PaymentStateMachine stateMachine = new PaymentStateMachine();

    @Nested
    @DisplayName("Allowed transitions")
    class AllowedTransitions {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "INITIATED, PENDING_PAYMENT",
                "PENDING_PAYMENT, PROCESSING_PAYMENT",
                "PENDING_PAYMENT, AWAITING_VOUCHER_PAYMENT",
                "PENDING_PAYMENT, PAYMENT_RECEIVED",
                "PROCESSING_PAYMENT, AWAITING_VOUCHER_PAYMENT",
                "PROCESSING_PAYMENT, PAYMENT_FAILED",
                "AWAITING_VOUCHER_PAYMENT, PAYMENT_RECEIVED",
                "PAYMENT_RECEIVED, GENERATING_PERMIT",
                "GENERATING_PERMIT, PERMIT_READY",
                "GENERATING_PERMIT, FAILED"
        })
        void shouldAllowLifecycleTransitions(ApplicationStatus from, ApplicationStatus to) {
            assertThat(stateMachine.canTransition(from, to)).isTrue();
        }

        @ParameterizedTest
        @EnumSource(ApplicationStatus.class)
        @DisplayName("Moving to the current status is always allowed")
        void shouldAllowSameState(ApplicationStatus status) {
            assertThat(stateMachine.canTransition(status, status)).isTrue();
        }
    }

    @Nested
    @DisplayName("Rejected transitions")
    class RejectedTransitions {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
                "INITIATED, PAYMENT_RECEIVED",
                "PENDING_PAYMENT, PERMIT_READY",
                "PAYMENT_RECEIVED, PAYMENT_FAILED",
                "GENERATING_PERMIT, PAYMENT_RECEIVED",
                "PERMIT_READY, GENERATING_PERMIT",
                "PAYMENT_FAILED, PAYMENT_RECEIVED",
                "FAILED, GENERATING_PERMIT"
        })
        void shouldRejectTransition(ApplicationStatus from, ApplicationStatus to) {
            assertThat(stateMachine.canTransition(from, to)).isFalse();
            assertThatThrownBy(() -> stateMachine.validate(1L, from, to, "ord_1"))
                    .isInstanceOf(InvalidStateTransitionException.class)
                    .satisfies(e -> {
                        InvalidStateTransitionException ex = (InvalidStateTransitionException) e;
                        assertThat(ex.getFrom()).isEqualTo(from);
                        assertThat(ex.getTo()).isEqualTo(to);
                    });
        }

        @Test
        @DisplayName("Terminal statuses have no outgoing transitions")
        void terminalStatusesHaveNoTargets() {
            for (ApplicationStatus status : ApplicationStatus.terminal()) {
                assertThat(stateMachine.allowedTargets(status)).isEmpty();
                assertThat(status.isTerminal()).isTrue();
            }
        }

        @Test
        @DisplayName("Late failure after success is rejected with a terminal-aware reason")
        void shouldExplainTerminalRejection() {
            assertThatThrownBy(() -> stateMachine.validate(7L, PERMIT_READY, PAYMENT_FAILED, "ord_7"))
                    .isInstanceOf(InvalidStateTransitionException.class)
                    .hasMessageContaining("PERMIT_READY is terminal");
        }
    }

    @Nested
    @DisplayName("Payment order requirement")
    class OrderRequirement {

        @Test
        @DisplayName("States from PAYMENT_RECEIVED on require a payment order")
        void shouldRequireOrderForPaidStates() {
            assertThat(stateMachine.requiresOrder(PAYMENT_RECEIVED)).isTrue();
            assertThat(stateMachine.requiresOrder(GENERATING_PERMIT)).isTrue();
            assertThat(stateMachine.requiresOrder(PERMIT_READY)).isTrue();
            assertThat(stateMachine.requiresOrder(PENDING_PAYMENT)).isFalse();

            assertThatThrownBy(() -> stateMachine.validate(3L, PENDING_PAYMENT, PAYMENT_RECEIVED, null))
                    .isInstanceOf(InvalidStateTransitionException.class)
                    .hasMessageContaining("no payment order attached");
        }

        @Test
        void shouldAcceptPaidTransitionWithOrder() {
            assertThatCode(() -> stateMachine.validate(3L, PENDING_PAYMENT, PAYMENT_RECEIVED, "ord_3"))
                    .doesNotThrowAnyException();
        }
    }
}
