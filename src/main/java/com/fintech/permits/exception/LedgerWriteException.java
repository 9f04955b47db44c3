package com.fintech.permits.exception;

/**
 * The idempotency ledger could not be written. Never thrown to callers of the ledger:
 * the event is treated as new and the failure is raised as an operational alert.
 */
public class LedgerWriteException extends PipelineException {

    private final String eventId;

    public LedgerWriteException(String eventId, Throwable cause) {
        super("Failed to write idempotency ledger for event " + eventId, cause);
        this.eventId = eventId;
    }

    public String getEventId() {
        return eventId;
    }
}
