package com.insightreel.pipeline.exception;

/**
 * Base class for content pipeline errors.
 */
public class PipelineException extends RuntimeException {

    private final String errorCode;

    public PipelineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public PipelineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
