package com.fintech.permits.exception;

/**
 * Rejections that will not succeed on retry: invalid data, refused issuance, unknown references.
 * The message is shown to the applicant.
 */
public class PermanentGatewayException extends GatewayException {

    public PermanentGatewayException(String message, String backendName, String reference) {
        super(message, backendName, reference);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
