package com.fintech.permits.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Message handed to the notification transport. Rendering and delivery happen elsewhere.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineNotification {

    private Long applicationId;

    private Type type;

    private String message;

    @Builder.Default
    private Map<String, Object> attributes = new HashMap<>();

    private LocalDateTime createdAt;

    public enum Type {
        PAYMENT_FAILED,
        PERMIT_READY,
        PERMIT_FAILED,
        VOUCHER_EXPIRING,
        PERMIT_EXPIRING
    }
}
