package com.fintech.permits.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * Append-only audit ledger of payment and permit events.
 * <p>
 * Rows are written in the same transaction as the status change they describe
 * and are never updated afterwards.
 */
@Entity
@Table(name = "payment_events", indexes = {
        @Index(name = "idx_pe_application_id", columnList = "application_id"),
        @Index(name = "idx_pe_type_application", columnList = "event_type, application_id")
})
@Getter
@ToString
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentEvent {

    public static final String PAYMENT_PROCESSING = "payment.processing";
    public static final String PAYMENT_SUCCEEDED = "payment.succeeded";
    public static final String PAYMENT_FAILED = "payment.failed";
    public static final String PAYMENT_CANCELED = "payment.canceled";
    public static final String VOUCHER_CREATED = "voucher.created";
    public static final String ORDER_CREATED = "order.created";
    public static final String PAYMENT_RECOVERED = "payment.recovered";
    public static final String PERMIT_GENERATION_STARTED = "permit.generation_started";
    public static final String PERMIT_READY = "permit.ready";
    public static final String PERMIT_FAILED = "permit.failed";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "application_id", nullable = false, updatable = false)
    private Long applicationId;

    @Column(name = "order_id", length = 100, updatable = false)
    private String orderId;

    @Column(name = "event_type", nullable = false, length = 50, updatable = false)
    private String eventType;

    /**
     * Structured payload serialized as JSON.
     */
    @Column(name = "event_data", columnDefinition = "TEXT", updatable = false)
    private String eventData;

    @Column(precision = 19, scale = 4, updatable = false)
    private BigDecimal amount;

    @Column(length = 3, updatable = false)
    private String currency;

    /**
     * Expiry of the payment instrument, set for voucher events.
     */
    @Column(name = "expires_at", updatable = false)
    private LocalDateTime expiresAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
    }
}
