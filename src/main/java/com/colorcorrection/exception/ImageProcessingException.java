package com.colorcorrection.exception;

/**
 * Loading, running or encoding failed for an interactive (non-batch) request.
 * Batch items never throw this; their failures are recorded as item status.
 */
public class ImageProcessingException extends RuntimeException {

    public ImageProcessingException(String message, Throwable cause) {
        super(message, cause);
    }
}
