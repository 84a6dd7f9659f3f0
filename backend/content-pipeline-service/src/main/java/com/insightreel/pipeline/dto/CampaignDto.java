package com.insightreel.pipeline.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignDto {
    private Long campaignId;
    private String userId;
    private String workspaceId;
    private String name;
    private String researchConfigRef;
    private String avatarProfileId;
    private String aspectRatio;
    private String frequency;
    private Integer maxItemsPerRun;
    private Integer maxVideosPerDay;
    private boolean autoPostEnabled;
    private List<String> postPlatforms;
    private boolean active;
    private LocalDateTime lastRunAt;
    private LocalDateTime nextRunAt;
    private Integer totalGenerated;
    private LocalDateTime createdAt;
}
