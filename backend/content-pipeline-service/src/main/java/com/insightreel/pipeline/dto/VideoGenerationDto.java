package com.insightreel.pipeline.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoGenerationDto {
    private String videoId;
    private String researchJobId;
    private Long campaignId;
    private String scriptTitle;
    private String scriptContent;
    private String avatarProfileId;
    private String aspectRatio;
    private String providerJobId;
    private String status;
    private String assetUrl;
    private String thumbnailUrl;
    private Double durationSeconds;
    private String errorReason;
    private Integer pollAttempts;
    private String approvalStatus;
    private String reviewedBy;
    private String reviewNote;
    private LocalDateTime reviewedAt;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;
}
