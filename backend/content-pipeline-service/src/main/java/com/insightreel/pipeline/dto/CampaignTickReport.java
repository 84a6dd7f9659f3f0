package com.insightreel.pipeline.dto;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Result of one scheduler tick: one report per campaign that fired.
 */
public record CampaignTickReport(LocalDateTime tickAt, List<CampaignRunReport> runs) {

    public CampaignTickReport {
        runs = runs == null ? List.of() : List.copyOf(runs);
    }

    public int totalSubmitted() {
        return runs.stream().mapToInt(CampaignRunReport::submittedCount).sum();
    }
}
