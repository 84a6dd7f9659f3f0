package com.insightreel.pipeline.entity;

import java.util.Arrays;

/**
 * External research sources a research job can collect from.
 */
public enum ResearchSource {
    REDDIT("reddit", "Reddit"),
    GITHUB("github", "GitHub"),
    HACKERNEWS("hackernews", "Hacker News"),
    GOOGLE_TRENDS("google_trends", "Google Trends");

    private final String key;
    private final String displayName;

    ResearchSource(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolve a source from its key ("reddit") or enum name ("REDDIT").
     */
    public static ResearchSource fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Research source is required");
        }
        String normalized = value.trim();
        return Arrays.stream(values())
                .filter(s -> s.key.equalsIgnoreCase(normalized) || s.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown research source: " + value));
    }
}
