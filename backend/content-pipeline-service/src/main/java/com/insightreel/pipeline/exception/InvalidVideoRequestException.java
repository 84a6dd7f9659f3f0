package com.insightreel.pipeline.exception;

/**
 * Video request rejected before anything was submitted to the provider.
 */
public class InvalidVideoRequestException extends PipelineException {

    public InvalidVideoRequestException(String message) {
        super("INVALID_VIDEO_REQUEST", message);
    }
}
