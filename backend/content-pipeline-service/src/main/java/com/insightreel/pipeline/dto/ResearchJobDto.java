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
public class ResearchJobDto {
    private String jobId;
    private String source;
    private String query;
    private String phase;
    private String analysisDepth;
    private Integer rawItemCount;
    private AnalysisResult analysis;
    private Double relevanceScore;
    private String errorMessage;
    private Integer attemptCount;
    private boolean running;
    private String userId;
    private String workspaceId;
    private LocalDateTime createdAt;
    private LocalDateTime completedAt;
}
