package com.colorcorrection.exception;

/**
 * The request was rejected before any work started (bad index, unknown method, no images...).
 */
public class BatchValidationException extends RuntimeException {

    public BatchValidationException(String message) {
        super(message);
    }

    public BatchValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
