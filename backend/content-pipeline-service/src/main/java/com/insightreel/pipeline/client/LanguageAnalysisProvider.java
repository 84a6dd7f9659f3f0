package com.insightreel.pipeline.client;

import com.insightreel.pipeline.dto.AnalysisResult;
import com.insightreel.pipeline.dto.RawDataset;
import com.insightreel.pipeline.entity.AnalysisDepth;

/**
 * Insight analyzer contract: turns raw items into a structured analysis.
 */
public interface LanguageAnalysisProvider {

    AnalysisResult analyze(RawDataset dataset, AnalysisDepth depth);
}
