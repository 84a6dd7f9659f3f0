package com.insightreel.pipeline.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Status of an avatar video generation.
 * QUEUED -> PROCESSING -> {COMPLETED | FAILED | TIMEOUT}
 */
public enum VideoStatus {
    /**
     * Accepted locally, provider has not assigned a job id yet
     */
    QUEUED,

    /**
     * Provider accepted the render request
     */
    PROCESSING,

    COMPLETED,

    FAILED,

    /**
     * Polling budget exhausted without a terminal signal from the provider
     */
    TIMEOUT;

    public static final Set<VideoStatus> ACTIVE = EnumSet.of(QUEUED, PROCESSING);

    public boolean isTerminal() {
        return !ACTIVE.contains(this);
    }
}
