package com.fintech.permits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * The payment gateway's view of a payment intent, as returned by its status API.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GatewayPaymentStatus {

    private String paymentIntentId;

    private Status status;

    /**
     * Order the intent belongs to, when the gateway reports it.
     */
    private String orderId;

    private BigDecimal amount;

    private String currency;

    private LocalDateTime updatedAt;

    private String failureCode;

    private String failureMessage;

    public enum Status {
        /**
         * Funds captured (maps to PAYMENT_RECEIVED)
         */
        SUCCEEDED,

        /**
         * Still being processed by the gateway
         */
        PROCESSING,

        /**
         * Waiting on the customer (3-D Secure, voucher not yet paid)
         */
        REQUIRES_ACTION,

        /**
         * Declined (maps to PAYMENT_FAILED)
         */
        FAILED,

        /**
         * Cancelled or expired (maps to PAYMENT_FAILED)
         */
        CANCELED,

        /**
         * Intent unknown to the gateway
         */
        NOT_FOUND;

        public boolean isFinal() {
            return this == SUCCEEDED || this == FAILED || this == CANCELED;
        }
    }
}
