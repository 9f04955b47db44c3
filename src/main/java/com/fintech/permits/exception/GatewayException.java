package com.fintech.permits.exception;

/**
 * Thrown when an outbound call to the payment gateway or the issuance backend fails.
 */
public abstract class GatewayException extends PipelineException {

    private final String backendName;
    private final String reference;

    protected GatewayException(String message, String backendName, String reference) {
        super(message);
        this.backendName = backendName;
        this.reference = reference;
    }

    protected GatewayException(String message, String backendName, String reference, Throwable cause) {
        super(message, cause);
        this.backendName = backendName;
        this.reference = reference;
    }

    public String getBackendName() {
        return backendName;
    }

    public String getReference() {
        return reference;
    }

    /**
     * Indicates if this error is transient and the operation can be retried.
     */
    public abstract boolean isRetryable();
}
