package com.insightreel.pipeline.dto;

import com.insightreel.pipeline.entity.ResearchSource;

import java.util.List;

/**
 * Per-source mapping from analysis paths to a script template.
 *
 * @param source            source this rule applies to, null for the generic rule
 * @param contentPaths      dot paths into the analysis, walked in order
 * @param titleTemplate     title with {topic} and {source} placeholders
 * @param bodyTemplate      body with a {content} placeholder
 * @param minContentLength  shortest acceptable body
 * @param maxContentLength  longest acceptable body
 */
public record ExtractionRule(
        ResearchSource source,
        List<String> contentPaths,
        String titleTemplate,
        String bodyTemplate,
        int minContentLength,
        int maxContentLength
) {
    public ExtractionRule {
        contentPaths = contentPaths == null ? List.of() : List.copyOf(contentPaths);
        if (minContentLength < 0 || maxContentLength < minContentLength) {
            throw new IllegalArgumentException(
                    "Invalid content bounds: min=" + minContentLength + ", max=" + maxContentLength);
        }
    }

    public ExtractionRule withBounds(int min, int max) {
        return new ExtractionRule(source, contentPaths, titleTemplate, bodyTemplate, min, max);
    }
}
