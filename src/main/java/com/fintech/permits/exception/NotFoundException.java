package com.fintech.permits.exception;

/**
 * A referenced application or payment order does not exist.
 */
public class NotFoundException extends PipelineException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException application(Long applicationId) {
        return new NotFoundException("Application " + applicationId + " not found");
    }

    public static NotFoundException order(String orderId) {
        return new NotFoundException("No application for payment order " + orderId);
    }
}
