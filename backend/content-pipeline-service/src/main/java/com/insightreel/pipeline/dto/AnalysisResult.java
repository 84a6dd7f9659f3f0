package com.insightreel.pipeline.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Source-agnostic output of the insight analyzer.
 * Source-specific sections (trending_topics, breakout topics, ...) are kept in
 * {@code details} and serialized at the top level, so extraction paths can
 * address them directly.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AnalysisResult {

    private String topic;

    private String summary;

    @Builder.Default
    private List<String> insights = new ArrayList<>();

    @Builder.Default
    private List<String> opportunities = new ArrayList<>();

    @Builder.Default
    private List<String> recommendations = new ArrayList<>();

    /**
     * Relevance as judged by the analyzer, 0-100. Null when not provided.
     */
    @JsonAlias("relevance_score")
    private Double relevanceScore;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();

    @JsonAnyGetter
    public Map<String, Object> getDetails() {
        return details;
    }

    @JsonAnySetter
    public void putDetail(String key, Object value) {
        if (details == null) {
            details = new LinkedHashMap<>();
        }
        details.put(key, value);
    }

    public int itemCount() {
        return size(insights) + size(opportunities) + size(recommendations);
    }

    private static int size(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
