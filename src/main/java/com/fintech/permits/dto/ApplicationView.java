package com.fintech.permits.dto;

import com.fintech.permits.entity.Application;
import com.fintech.permits.entity.ApplicationStatus;
import com.fintech.permits.entity.QueueStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ApplicationView {

    private Long id;
    private ApplicationStatus status;
    private String paymentOrderId;
    private String paymentReference;
    private BigDecimal amount;
    private String currency;
    private LocalDateTime voucherExpiresAt;
    private LocalDateTime permitExpiresAt;
    private String permitArtifactLocation;
    private String failureReason;
    private QueueStatus queueStatus;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ApplicationView from(Application application) {
        return ApplicationView.builder()
                .id(application.getId())
                .status(application.getStatus())
                .paymentOrderId(application.getPaymentOrderId())
                .paymentReference(application.getPaymentReference())
                .amount(application.getAmount())
                .currency(application.getCurrency())
                .voucherExpiresAt(application.getVoucherExpiresAt())
                .permitExpiresAt(application.getPermitExpiresAt())
                .permitArtifactLocation(application.getPermitArtifactLocation())
                .failureReason(application.getFailureReason())
                .queueStatus(application.getQueueStatus())
                .createdAt(application.getCreatedAt())
                .updatedAt(application.getUpdatedAt())
                .build();
    }
}
