package com.fintech.permits.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Short-lived, single-use token binding a client payment request to an application.
 */
@Entity
@Table(name = "payment_state_tokens", uniqueConstraints = {
        @UniqueConstraint(name = "uk_payment_state_token", columnNames = "token")
}, indexes = {
        @Index(name = "idx_pst_application_id", columnList = "application_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentStateToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "application_id", nullable = false)
    private Long applicationId;

    @Column(nullable = false, length = 64)
    private String token;

    @Column(name = "expires_at", nullable = false)
    private LocalDateTime expiresAt;

    @Column(nullable = false)
    @Builder.Default
    private boolean used = false;

    @Column(name = "used_at")
    private LocalDateTime usedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
