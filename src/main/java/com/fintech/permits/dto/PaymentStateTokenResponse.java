package com.fintech.permits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentStateTokenResponse {

    private Long applicationId;
    private String token;
    private LocalDateTime expiresAt;
}
