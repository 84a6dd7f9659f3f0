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
public class PublishResultDto {
    private Long publishResultId;
    private String overallStatus;
    private String postContent;
    private String mediaUrl;
    private String videoGenerationId;
    private List<PlatformResultDto> platformResults;
    private int successCount;
    private int errorCount;
    private LocalDateTime createdAt;
    private LocalDateTime scheduledFor;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlatformResultDto {
        private String platform;
        private String status;
        private String platformPostId;
        private String postUrl;
        private String errorMessage;
    }
}
