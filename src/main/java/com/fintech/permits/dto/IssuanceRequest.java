package com.fintech.permits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IssuanceRequest {

    private Long applicationId;
    private String paymentOrderId;
    private BigDecimal amount;
    private String currency;
    /**
     * 1-based attempt number within one worker run.
     */
    private int attempt;
}
