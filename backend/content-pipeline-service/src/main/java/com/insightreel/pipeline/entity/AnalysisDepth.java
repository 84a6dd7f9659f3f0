package com.insightreel.pipeline.entity;

/**
 * How much language-model work the analyzer spends on a raw dataset.
 */
public enum AnalysisDepth {
    BASIC,
    STANDARD,
    COMPREHENSIVE
}
