package com.fintech.permits.client;

import com.fintech.permits.dto.IssuanceRequest;
import com.fintech.permits.dto.IssuanceResult;
import com.fintech.permits.exception.PermanentGatewayException;
import com.fintech.permits.exception.TransientGatewayException;

/**
 * The opaque backend that produces permit artifacts for a paid application.
 */
public interface IssuanceBackendClient {

    /**
     * Issue the permit for a paid application. May take minutes.
     *
     * @throws TransientGatewayException on outages and timeouts; the caller may retry
     * @throws PermanentGatewayException when the backend rejects the application
     */
    IssuanceResult issue(IssuanceRequest request);

    String getBackendName();
}
