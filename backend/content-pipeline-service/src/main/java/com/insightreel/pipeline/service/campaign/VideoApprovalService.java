package com.insightreel.pipeline.service.campaign;

import com.insightreel.pipeline.dto.PublishRequest;
import com.insightreel.pipeline.dto.PublishResultDto;
import com.insightreel.pipeline.dto.VideoApprovalRequest;
import com.insightreel.pipeline.dto.VideoGenerationDto;
import com.insightreel.pipeline.entity.ApprovalStatus;
import com.insightreel.pipeline.entity.SocialPlatform;
import com.insightreel.pipeline.entity.VideoGeneration;
import com.insightreel.pipeline.exception.PipelineException;
import com.insightreel.pipeline.exception.StateConflictException;
import com.insightreel.pipeline.mapper.EntityMapper;
import com.insightreel.pipeline.repository.CampaignRepository;
import com.insightreel.pipeline.repository.VideoGenerationRepository;
import com.insightreel.pipeline.service.publish.PublishService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Human review of completed campaign videos that do not auto-post.
 *
 * A video enters review once (PENDING) and is decided once: approving hands it
 * to the publisher, rejecting just records the decision. Both decisions are
 * compare-and-set writes, so two reviewers racing on the same video cannot
 * publish it twice.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VideoApprovalService {

    private final VideoGenerationRepository videoRepository;
    private final CampaignRepository campaignRepository;
    private final PublishService publishService;
    private final EntityMapper entityMapper;

    /**
     * @return true if the video entered review; false if it is not completed or was already queued
     */
    public boolean requestApproval(String videoId) {
        if (videoRepository.markApprovalPending(videoId, LocalDateTime.now()) == 0) {
            log.debug("Video {} not queued for approval (not completed or already reviewed)", videoId);
            return false;
        }
        log.info("Video {} awaiting approval", videoId);
        return true;
    }

    public List<VideoGenerationDto> listPendingApprovals(String userId) {
        return videoRepository.findByUserIdAndApprovalStatusOrderByCompletedAtAsc(userId, ApprovalStatus.PENDING)
                .stream()
                .map(entityMapper::toVideoDto)
                .toList();
    }

    /**
     * Approve a pending video and publish it.
     *
     * @throws IllegalArgumentException if the video does not exist
     * @throws StateConflictException   if the video is not awaiting approval
     * @throws PipelineException        if no valid platform is given or configured on the campaign
     */
    public PublishResultDto approveAndPublish(String videoId, VideoApprovalRequest decision, String reviewer) {
        VideoGeneration video = pendingVideo(videoId);
        VideoApprovalRequest request = decision != null ? decision : new VideoApprovalRequest();
        List<String> platforms = resolvePlatforms(video, request.getPlatforms());
        String caption = request.getCaption() != null && !request.getCaption().isBlank()
                ? request.getCaption()
                : CampaignAutoPostListener.buildCaption(video.getScriptTitle(), video.getScriptContent());

        decide(video, ApprovalStatus.APPROVED, reviewer, request.getNote());

        PublishResultDto result = publishService.publishAndAggregate(PublishRequest.builder()
                .content(caption)
                .platforms(platforms)
                .mediaUrl(video.getAssetUrl())
                .videoGenerationId(video.getId())
                .scheduledFor(request.getScheduledFor())
                .build());
        log.info("Video {} approved by {} and published: {}", videoId, reviewer, result.getOverallStatus());
        return result;
    }

    /**
     * @throws IllegalArgumentException if the video does not exist
     * @throws StateConflictException   if the video is not awaiting approval
     */
    public VideoGenerationDto reject(String videoId, String reviewer, String note) {
        VideoGeneration video = pendingVideo(videoId);
        decide(video, ApprovalStatus.REJECTED, reviewer, note);
        log.info("Video {} rejected by {}", videoId, reviewer);
        return videoRepository.findById(videoId)
                .map(entityMapper::toVideoDto)
                .orElseThrow(() -> new IllegalArgumentException("Video generation not found: " + videoId));
    }

    private VideoGeneration pendingVideo(String videoId) {
        VideoGeneration video = videoRepository.findById(videoId)
                .orElseThrow(() -> new IllegalArgumentException("Video generation not found: " + videoId));
        if (video.getApprovalStatus() != ApprovalStatus.PENDING) {
            throw new StateConflictException("Video " + videoId + " is not awaiting approval ("
                    + (video.getApprovalStatus() != null ? video.getApprovalStatus() : "not under review") + ")");
        }
        return video;
    }

    private void decide(VideoGeneration video, ApprovalStatus decision, String reviewer, String note) {
        if (videoRepository.decideApproval(video.getId(), decision, reviewer, note, LocalDateTime.now()) == 0) {
            throw new StateConflictException("Video " + video.getId() + " was already reviewed");
        }
    }

    /**
     * Requested platforms win; otherwise the owning campaign's platforms are used.
     */
    private List<String> resolvePlatforms(VideoGeneration video, List<String> requested) {
        if (requested != null && !requested.isEmpty()) {
            for (String key : requested) {
                try {
                    SocialPlatform.fromKey(key);
                } catch (IllegalArgumentException e) {
                    throw new PipelineException("INVALID_REQUEST", "Unsupported platform: " + key, e);
                }
            }
            return requested;
        }
        List<String> configured = video.getCampaignId() == null ? List.of()
                : campaignRepository.findById(video.getCampaignId())
                        .map(campaign -> campaign.getPostPlatforms().stream().map(SocialPlatform::getKey).toList())
                        .orElse(List.of());
        if (configured.isEmpty()) {
            throw new PipelineException("INVALID_REQUEST",
                    "No platforms to publish to: pass platforms or configure them on the campaign");
        }
        return configured;
    }
}
