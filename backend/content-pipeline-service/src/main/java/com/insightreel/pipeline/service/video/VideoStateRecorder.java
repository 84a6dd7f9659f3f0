package com.insightreel.pipeline.service.video;

import com.insightreel.pipeline.dto.RenderStatus;
import com.insightreel.pipeline.entity.VideoGeneration;
import com.insightreel.pipeline.entity.VideoStatus;
import com.insightreel.pipeline.repository.VideoGenerationRepository;
import com.insightreel.pipeline.service.PipelineEventPublisher;
import com.insightreel.pipeline.service.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;

/**
 * Single write path for video generation state changes.
 *
 * Every method is a compare-and-set against the stored status; losing writers
 * (a late callback, a poll after timeout) get {@code false} and change nothing.
 * Terminal side effects fire only for the writer that won.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VideoStateRecorder {

    private final VideoGenerationRepository videoRepository;
    private final PipelineMetrics metrics;
    private final PipelineEventPublisher eventPublisher;
    private final ApplicationEventPublisher applicationEventPublisher;

    public boolean assignProviderJob(VideoGeneration video, String providerJobId) {
        int updated = videoRepository.assignProviderJob(video.getId(), providerJobId, LocalDateTime.now());
        if (updated == 0) {
            log.warn("Provider job {} not assigned to video {}: no longer QUEUED", providerJobId, video.getId());
            return false;
        }
        log.info("Video {} PROCESSING with providerJobId={}", video.getId(), providerJobId);
        return true;
    }

    /**
     * @return false once the row is no longer active, so a poller can stop
     */
    public boolean recordPollAttempts(VideoGeneration video, int attempts) {
        return videoRepository.recordPollAttempts(video.getId(), attempts, LocalDateTime.now()) > 0;
    }

    /**
     * Apply a terminal provider status (COMPLETED or FAILED).
     */
    public boolean applyTerminal(VideoGeneration video, RenderStatus status) {
        if (status.state() == RenderStatus.State.COMPLETED) {
            if (status.assetUrl() == null || status.assetUrl().isBlank()) {
                return fail(video, VideoStatus.FAILED, "Provider reported completion without an asset URL");
            }
            return complete(video, status);
        }
        if (status.state() == RenderStatus.State.FAILED) {
            String reason = status.errorMessage() != null && !status.errorMessage().isBlank()
                    ? status.errorMessage() : "Render failed at provider";
            return fail(video, VideoStatus.FAILED, reason);
        }
        throw new IllegalArgumentException("Not a terminal render status: " + status.state());
    }

    public boolean complete(VideoGeneration video, RenderStatus status) {
        int updated = videoRepository.markCompleted(video.getId(), status.assetUrl(), status.thumbnailUrl(),
                status.durationSeconds(), LocalDateTime.now());
        if (updated == 0) {
            log.info("Video {} already terminal, completion ignored", video.getId());
            return false;
        }
        log.info("Video {} COMPLETED: {}", video.getId(), status.assetUrl());
        onTerminal(video, VideoStatus.COMPLETED, status.assetUrl(), null);
        return true;
    }

    public boolean fail(VideoGeneration video, VideoStatus status, String reason) {
        String message = reason == null || reason.isBlank() ? "Unknown error" : truncate(reason, 1000);
        int updated = videoRepository.markTerminalFailure(video.getId(), status, message, LocalDateTime.now());
        if (updated == 0) {
            log.info("Video {} already terminal, {} ignored: {}", video.getId(), status, message);
            return false;
        }
        log.info("Video {} {}: {}", video.getId(), status, message);
        onTerminal(video, status, null, message);
        return true;
    }

    private void onTerminal(VideoGeneration video, VideoStatus status, String assetUrl, String errorReason) {
        metrics.videoTerminal(status);
        eventPublisher.videoFinished(video.getId(), status.name(), video.getUserId(),
                assetUrl != null ? assetUrl : errorReason);
        applicationEventPublisher.publishEvent(new VideoTerminalEvent(
                video.getId(), status, assetUrl, errorReason, video.getCampaignId(), video.getUserId(),
                video.getScriptTitle(), video.getScriptContent()));
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }
}
