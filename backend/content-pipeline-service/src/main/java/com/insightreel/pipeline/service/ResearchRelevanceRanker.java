package com.insightreel.pipeline.service;

import com.insightreel.pipeline.config.PipelineProperties;
import com.insightreel.pipeline.dto.AnalysisResult;
import com.insightreel.pipeline.entity.ResearchJob;
import com.insightreel.pipeline.entity.ResearchSource;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;

/**
 * Relevance score stored with an analyzed job, and the ordering campaigns select by.
 */
@Component
@RequiredArgsConstructor
public class ResearchRelevanceRanker {

    /**
     * Relevance desc, then newest first, then id for a stable order.
     */
    public static final Comparator<ResearchJob> RANKING = Comparator
            .comparing((ResearchJob j) -> j.getRelevanceScore() == null ? 0.0 : j.getRelevanceScore(),
                    Comparator.reverseOrder())
            .thenComparing(ResearchJob::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(ResearchJob::getId);

    private final PipelineProperties properties;

    /**
     * Analyzer score (clamped to 0-100) or, when absent, 10 points per extracted
     * item capped at 100; multiplied by the configured source weight.
     */
    public double score(ResearchSource source, AnalysisResult analysis) {
        double base;
        if (analysis.getRelevanceScore() != null) {
            base = Math.max(0.0, Math.min(100.0, analysis.getRelevanceScore()));
        } else {
            base = Math.min(100.0, analysis.itemCount() * 10.0);
        }
        Double weight = properties.getResearch().getSourceWeights().get(source.getKey());
        return base * (weight != null ? weight : 1.0);
    }
}
