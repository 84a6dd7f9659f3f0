package com.insightreel.pipeline.mapper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightreel.pipeline.dto.AnalysisResult;
import com.insightreel.pipeline.dto.CampaignDto;
import com.insightreel.pipeline.dto.PublishResultDto;
import com.insightreel.pipeline.dto.ResearchJobDto;
import com.insightreel.pipeline.dto.VideoGenerationDto;
import com.insightreel.pipeline.entity.Campaign;
import com.insightreel.pipeline.entity.PlatformResult;
import com.insightreel.pipeline.entity.PublishResult;
import com.insightreel.pipeline.entity.ResearchJob;
import com.insightreel.pipeline.entity.SocialPlatform;
import com.insightreel.pipeline.entity.VideoGeneration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class EntityMapper {

    private static final Logger log = LoggerFactory.getLogger(EntityMapper.class);

    private final ObjectMapper objectMapper;

    public EntityMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ResearchJobDto toResearchJobDto(ResearchJob job, boolean running) {
        return ResearchJobDto.builder()
                .jobId(job.getId())
                .source(job.getSource() != null ? job.getSource().getKey() : null)
                .query(job.getConfigRef())
                .phase(job.getPhase() != null ? job.getPhase().name() : null)
                .analysisDepth(job.getAnalysisDepth() != null ? job.getAnalysisDepth().name() : null)
                .rawItemCount(countRawItems(job.getRawData()))
                .analysis(parseAnalysis(job.getAnalyzedData()))
                .relevanceScore(job.getRelevanceScore())
                .errorMessage(job.getErrorMessage())
                .attemptCount(job.getAttemptCount())
                .running(running)
                .userId(job.getUserId())
                .workspaceId(job.getWorkspaceId())
                .createdAt(job.getCreatedAt())
                .completedAt(job.getCompletedAt())
                .build();
    }

    public VideoGenerationDto toVideoDto(VideoGeneration video) {
        return VideoGenerationDto.builder()
                .videoId(video.getId())
                .researchJobId(video.getResearchJobId())
                .campaignId(video.getCampaignId())
                .scriptTitle(video.getScriptTitle())
                .scriptContent(video.getScriptContent())
                .avatarProfileId(video.getAvatarProfileId())
                .aspectRatio(video.getAspectRatio() != null ? video.getAspectRatio().name() : null)
                .providerJobId(video.getProviderJobId())
                .status(video.getStatus() != null ? video.getStatus().name() : null)
                .assetUrl(video.getAssetUrl())
                .thumbnailUrl(video.getThumbnailUrl())
                .durationSeconds(video.getDurationSeconds())
                .errorReason(video.getErrorReason())
                .pollAttempts(video.getPollAttempts())
                .approvalStatus(video.getApprovalStatus() != null ? video.getApprovalStatus().name() : null)
                .reviewedBy(video.getReviewedBy())
                .reviewNote(video.getReviewNote())
                .reviewedAt(video.getReviewedAt())
                .createdAt(video.getCreatedAt())
                .completedAt(video.getCompletedAt())
                .build();
    }

    public CampaignDto toCampaignDto(Campaign campaign) {
        return CampaignDto.builder()
                .campaignId(campaign.getId())
                .userId(campaign.getUserId())
                .workspaceId(campaign.getWorkspaceId())
                .name(campaign.getName())
                .researchConfigRef(campaign.getResearchConfigRef())
                .avatarProfileId(campaign.getAvatarProfileId())
                .aspectRatio(campaign.getAspectRatio() != null ? campaign.getAspectRatio().name() : null)
                .frequency(campaign.getFrequency() != null ? campaign.getFrequency().name() : null)
                .maxItemsPerRun(campaign.getMaxItemsPerRun())
                .maxVideosPerDay(campaign.getMaxVideosPerDay())
                .autoPostEnabled(Boolean.TRUE.equals(campaign.getAutoPostEnabled()))
                .postPlatforms(campaign.getPostPlatforms() == null ? List.of()
                        : campaign.getPostPlatforms().stream().map(SocialPlatform::getKey).sorted().toList())
                .active(Boolean.TRUE.equals(campaign.getActive()))
                .lastRunAt(campaign.getLastRunAt())
                .nextRunAt(campaign.getNextRunAt())
                .totalGenerated(campaign.getTotalGenerated())
                .createdAt(campaign.getCreatedAt())
                .build();
    }

    public PublishResultDto toPublishResultDto(PublishResult result) {
        List<PlatformResult> entries = result.getPlatformResults() == null ? List.of() : result.getPlatformResults();
        List<PublishResultDto.PlatformResultDto> platformDtos = entries.stream()
                .map(entry -> PublishResultDto.PlatformResultDto.builder()
                        .platform(entry.getPlatform().getKey())
                        .status(entry.getStatus().name())
                        .platformPostId(entry.getPlatformPostId())
                        .postUrl(entry.getPostUrl())
                        .errorMessage(entry.getErrorMessage())
                        .build())
                .toList();
        int successCount = (int) entries.stream().filter(PlatformResult::isSuccess).count();

        return PublishResultDto.builder()
                .publishResultId(result.getId())
                .overallStatus(result.getOverallStatus() != null ? result.getOverallStatus().name() : null)
                .postContent(result.getPostContent())
                .mediaUrl(result.getMediaUrl())
                .videoGenerationId(result.getVideoGenerationId())
                .platformResults(platformDtos)
                .successCount(successCount)
                .errorCount(entries.size() - successCount)
                .createdAt(result.getCreatedAt())
                .scheduledFor(result.getScheduledFor())
                .build();
    }

    private AnalysisResult parseAnalysis(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, AnalysisResult.class);
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse stored analysis: {}", e.getOriginalMessage());
            return null;
        }
    }

    private Integer countRawItems(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            JsonNode items = objectMapper.readTree(json).path("items");
            return items.isArray() ? items.size() : 0;
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse stored raw data: {}", e.getOriginalMessage());
            return null;
        }
    }
}
