package com.insightreel.pipeline.exception;

/**
 * Operation not allowed in the entity's current state.
 */
public class StateConflictException extends PipelineException {

    public StateConflictException(String message) {
        super("STATE_CONFLICT", message);
    }
}
