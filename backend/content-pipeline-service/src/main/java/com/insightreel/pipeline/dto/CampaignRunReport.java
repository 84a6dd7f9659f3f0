package com.insightreel.pipeline.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-item outcome of one fired campaign run.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignRunReport {

    private Long campaignId;
    private LocalDateTime firedAt;
    private LocalDateTime nextRunAt;
    private int candidates;
    private int selected;

    @Builder.Default
    private List<String> submittedVideoIds = new ArrayList<>();

    @Builder.Default
    private List<ItemOutcome> skipped = new ArrayList<>();

    @Builder.Default
    private List<ItemOutcome> failed = new ArrayList<>();

    /**
     * Why the run selected nothing although candidates existed (e.g. daily quota), else null
     */
    private String note;

    public int submittedCount() {
        return submittedVideoIds.size();
    }

    public record ItemOutcome(String researchJobId, String reason) {
    }
}
