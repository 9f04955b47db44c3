package com.fintech.permits.client;

import com.fintech.permits.dto.PipelineNotification;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default transport: writes the notification to the log.
 */
@Component
@Slf4j
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    @Override
    public void dispatch(PipelineNotification notification) {
        log.info("Notification {} for application {}: {} {}",
                notification.getType(),
                notification.getApplicationId(),
                notification.getMessage(),
                notification.getAttributes());
    }
}
