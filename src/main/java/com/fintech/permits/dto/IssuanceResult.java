package com.fintech.permits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Result of a successful permit issuance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssuanceResult {

    private String permitNumber;

    /**
     * Where the permit artifacts were stored.
     */
    private String artifactLocation;

    /**
     * Permit expiry reported by the backend; null when it does not report one.
     */
    private LocalDateTime expiresAt;

    private LocalDateTime issuedAt;
}
