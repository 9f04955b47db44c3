package com.fintech.permits.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Inbound gateway webhook delivery.
 * <pre>
 * {
 *   "id": "evt_99",
 *   "type": "payment.succeeded",
 *   "data": { "orderId": "ord_123", "paymentIntentId": "pi_1", "amount": 150.00, "currency": "MXN" }
 * }
 * </pre>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class GatewayWebhookEvent {

    /**
     * Gateway-assigned event id. Unique per event, repeated on redelivery.
     */
    private String id;

    private String type;

    private LocalDateTime createdAt;

    private Payload data;

    public String orderId() {
        return data != null ? data.getOrderId() : null;
    }

    public String paymentIntentId() {
        return data != null ? data.getPaymentIntentId() : null;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Payload {
        private String orderId;
        private String paymentIntentId;
        private BigDecimal amount;
        private String currency;
        /**
         * Cash voucher reference (voucher.created only).
         */
        private String voucherReference;
        /**
         * Voucher expiry (voucher.created only).
         */
        private LocalDateTime expiresAt;
        private String failureCode;
        private String failureMessage;
    }
}
