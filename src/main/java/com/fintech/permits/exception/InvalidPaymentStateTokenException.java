package com.fintech.permits.exception;

public class InvalidPaymentStateTokenException extends PipelineException {

    public InvalidPaymentStateTokenException(Long applicationId) {
        super("Payment state token is invalid, expired or already used for application " + applicationId);
    }
}
