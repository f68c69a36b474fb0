package com.colorcorrection.exception;

public class PipelineUnavailableException extends RuntimeException {

    public PipelineUnavailableException(String message) {
        super(message);
    }
}
