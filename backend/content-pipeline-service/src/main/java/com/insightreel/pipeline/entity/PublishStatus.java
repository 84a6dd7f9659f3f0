package com.insightreel.pipeline.entity;

/**
 * Outcome of a publish attempt, per platform (SUCCESS/ERROR) or overall.
 */
public enum PublishStatus {
    SUCCESS,
    PARTIAL,
    ERROR
}
