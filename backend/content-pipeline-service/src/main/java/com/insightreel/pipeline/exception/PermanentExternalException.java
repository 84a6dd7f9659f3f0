package com.insightreel.pipeline.exception;

/**
 * Non-retryable failure of an external collaborator: bad credentials,
 * invalid input, provider-side rejection.
 */
public class PermanentExternalException extends PipelineException {

    private final Integer statusCode;

    public PermanentExternalException(String message) {
        this(message, null, null);
    }

    public PermanentExternalException(String message, Integer statusCode) {
        this(message, statusCode, null);
    }

    public PermanentExternalException(String message, Integer statusCode, Throwable cause) {
        super("EXTERNAL_PERMANENT", message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }
}
