package com.fintech.permits.exception;

/**
 * Network failures, timeouts, outages. Retried a bounded number of times.
 */
public class TransientGatewayException extends GatewayException {

    public TransientGatewayException(String message, String backendName, String reference) {
        super(message, backendName, reference);
    }

    public TransientGatewayException(String message, String backendName, String reference, Throwable cause) {
        super(message, backendName, reference, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
