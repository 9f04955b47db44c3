package com.fintech.permits.service;

import com.fintech.permits.client.NotificationDispatcher;
import com.fintech.permits.dto.PipelineNotification;
import com.fintech.permits.entity.Application;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

/**
 * Fire-and-forget notifications. Dispatch runs on the notification executor; a failing
 * transport is logged and never affects the caller.
 */
@Service
@Slf4j
public class NotificationService {

    private final NotificationDispatcher dispatcher;
    private final TaskExecutor notificationExecutor;
    private final Clock clock;

    public NotificationService(NotificationDispatcher dispatcher,
                               @Qualifier("notificationExecutor") TaskExecutor notificationExecutor,
                               Clock clock) {
        this.dispatcher = dispatcher;
        this.notificationExecutor = notificationExecutor;
        this.clock = clock;
    }

    public void paymentFailed(Application application, String reason) {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("orderId", application.getPaymentOrderId());
        attributes.put("reason", reason);
        send(application.getId(), PipelineNotification.Type.PAYMENT_FAILED,
                "Your payment could not be completed (" + reason + "). You can try again with another "
                        + "payment method, or contact support if the charge appears on your statement.",
                attributes);
    }

    public void permitReady(Application application) {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("artifactLocation", application.getPermitArtifactLocation());
        attributes.put("permitExpiresAt", application.getPermitExpiresAt());
        send(application.getId(), PipelineNotification.Type.PERMIT_READY,
                "Your vehicle permit is ready to download.", attributes);
    }

    public void permitFailed(Application application) {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("reason", application.getFailureReason());
        send(application.getId(), PipelineNotification.Type.PERMIT_FAILED,
                "We could not generate your permit: " + application.getFailureReason()
                        + " Our support team has been notified.", attributes);
    }

    public void voucherExpiring(Long applicationId, String voucherReference, LocalDateTime expiresAt) {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("voucherReference", voucherReference);
        attributes.put("expiresAt", expiresAt);
        send(applicationId, PipelineNotification.Type.VOUCHER_EXPIRING,
                "Your payment voucher expires soon. Pay it at any participating store before it expires.",
                attributes);
    }

    public void permitExpiring(Application application, int daysBefore) {
        Map<String, Object> attributes = new HashMap<>();
        attributes.put("permitExpiresAt", application.getPermitExpiresAt());
        attributes.put("daysBefore", daysBefore);
        send(application.getId(), PipelineNotification.Type.PERMIT_EXPIRING,
                "Your vehicle permit expires in " + daysBefore + (daysBefore == 1 ? " day." : " days."),
                attributes);
    }

    private void send(Long applicationId, PipelineNotification.Type type, String message,
                      Map<String, Object> attributes) {
        PipelineNotification notification = PipelineNotification.builder()
                .applicationId(applicationId)
                .type(type)
                .message(message)
                .attributes(attributes)
                .createdAt(LocalDateTime.now(clock))
                .build();

        notificationExecutor.execute(() -> {
            try {
                dispatcher.dispatch(notification);
            } catch (Exception e) {
                log.warn("Failed to dispatch {} notification for application {}: {}",
                        type, applicationId, e.getMessage());
            }
        });
    }
}
