package com.fintech.permits.exception;

import com.fintech.permits.entity.ApplicationStatus;

public class InvalidStateTransitionException extends PipelineException {

    private final Long applicationId;
    private final ApplicationStatus from;
    private final ApplicationStatus to;

    public InvalidStateTransitionException(Long applicationId, ApplicationStatus from,
                                           ApplicationStatus to, String reason) {
        super(String.format("Application %d cannot move from %s to %s: %s", applicationId, from, to, reason));
        this.applicationId = applicationId;
        this.from = from;
        this.to = to;
    }

    public Long getApplicationId() {
        return applicationId;
    }

    public ApplicationStatus getFrom() {
        return from;
    }

    public ApplicationStatus getTo() {
        return to;
    }
}
