package com.fintech.permits.exception;

/**
 * A scheduled scan was triggered while a previous run of the same scan is still going.
 */
public class ScanInProgressException extends PipelineException {

    public ScanInProgressException(String scanName) {
        super(scanName + " already in progress");
    }
}
