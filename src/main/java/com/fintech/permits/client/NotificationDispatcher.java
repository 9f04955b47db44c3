package com.fintech.permits.client;

import com.fintech.permits.dto.PipelineNotification;

/**
 * Outbound notification transport (email, SMS, chat). Delivery and rendering live behind it.
 */
public interface NotificationDispatcher {

    void dispatch(PipelineNotification notification);
}
