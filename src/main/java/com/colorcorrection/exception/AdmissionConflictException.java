package com.colorcorrection.exception;

import lombok.Getter;

/**
 * A batch is already running; the new one was not started.
 */
@Getter
public class AdmissionConflictException extends RuntimeException {

    private final String activeBatchId;

    public AdmissionConflictException(String activeBatchId) {
        super("Batch processing already in progress");
        this.activeBatchId = activeBatchId;
    }
}
