package com.fintech.permits.exception;

public class InvalidWebhookSignatureException extends PipelineException {

    public InvalidWebhookSignatureException(String message) {
        super(message);
    }
}
