package com.fintech.permits.exception;

/**
 * Thrown when a client tries to cancel a permit job whose issuance call already started.
 */
public class JobInProgressException extends PipelineException {

    public JobInProgressException(Long applicationId) {
        super("Permit generation for application " + applicationId
                + " is in progress and cannot be cancelled until it finishes");
    }
}
