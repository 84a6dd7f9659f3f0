package com.insightreel.pipeline.exception;

/**
 * Retryable failure of an external collaborator: timeouts, rate limits, 5xx.
 */
public class TransientExternalException extends PipelineException {

    private final Integer statusCode;

    public TransientExternalException(String message) {
        this(message, null, null);
    }

    public TransientExternalException(String message, Integer statusCode) {
        this(message, statusCode, null);
    }

    public TransientExternalException(String message, Integer statusCode, Throwable cause) {
        super("EXTERNAL_TRANSIENT", message, cause);
        this.statusCode = statusCode;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return statusCode != null && statusCode == 429;
    }
}
