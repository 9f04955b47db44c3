package com.fintech.permits.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Client request binding a gateway payment order to an application.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AttachOrderRequest {

    @NotBlank
    @Size(max = 100)
    private String orderId;

    @Size(max = 100)
    private String paymentIntentId;

    @NotNull
    @DecimalMin(value = "0.01")
    private BigDecimal amount;

    @NotBlank
    @Size(min = 3, max = 3)
    private String currency;

    /**
     * Single-use token issued for this application's payment flow.
     */
    @NotBlank
    private String stateToken;
}
