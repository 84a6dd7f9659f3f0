package com.insightreel.pipeline.entity;

/**
 * Lifecycle phase of a research job.
 */
public enum ResearchPhase {
    /**
     * Collection started or raw data stored, analysis not finished yet
     */
    RAW,

    /**
     * Analysis stored; terminal
     */
    ANALYZED,

    /**
     * Collection or analysis failed; terminal
     */
    FAILED;

    public boolean isTerminal() {
        return this != RAW;
    }
}
