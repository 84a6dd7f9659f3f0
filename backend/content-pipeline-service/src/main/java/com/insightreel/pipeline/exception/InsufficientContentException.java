package com.insightreel.pipeline.exception;

/**
 * The analysis did not yield a script within the extraction bounds.
 * Callers skip the item; this is not a pipeline fault.
 */
public class InsufficientContentException extends PipelineException {

    private final int contentLength;
    private final int requiredLength;

    public InsufficientContentException(String message, int contentLength, int requiredLength) {
        super("INSUFFICIENT_CONTENT", message);
        this.contentLength = contentLength;
        this.requiredLength = requiredLength;
    }

    public int getContentLength() {
        return contentLength;
    }

    public int getRequiredLength() {
        return requiredLength;
    }
}
