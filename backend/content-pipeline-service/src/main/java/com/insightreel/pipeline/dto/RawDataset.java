package com.insightreel.pipeline.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.insightreel.pipeline.entity.ResearchSource;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Normalized items pulled from one source for one query.
 */
public record RawDataset(
        ResearchSource source,
        String query,
        List<Map<String, Object>> items,
        LocalDateTime collectedAt
) {
    public RawDataset {
        items = items == null ? List.of() : List.copyOf(items);
    }

    @JsonIgnore
    public int size() {
        return items.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return items.isEmpty();
    }
}
