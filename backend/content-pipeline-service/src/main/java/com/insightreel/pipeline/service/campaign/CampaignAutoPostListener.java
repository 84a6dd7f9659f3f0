package com.insightreel.pipeline.service.campaign;

import com.insightreel.pipeline.dto.PublishRequest;
import com.insightreel.pipeline.dto.PublishResultDto;
import com.insightreel.pipeline.entity.Campaign;
import com.insightreel.pipeline.entity.SocialPlatform;
import com.insightreel.pipeline.repository.CampaignRepository;
import com.insightreel.pipeline.service.publish.PublishService;
import com.insightreel.pipeline.service.video.VideoTerminalEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Routes completed campaign videos: posted right away when the campaign auto-posts,
 * otherwise queued for review in {@link VideoApprovalService}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CampaignAutoPostListener {

    private static final int CAPTION_BODY_LENGTH = 200;

    private final CampaignRepository campaignRepository;
    private final PublishService publishService;
    private final VideoApprovalService approvalService;

    @Async
    @EventListener
    public void onVideoTerminal(VideoTerminalEvent event) {
        if (!event.isCompleted() || event.campaignId() == null) {
            return;
        }
        Optional<Campaign> found = campaignRepository.findById(event.campaignId());
        if (found.isEmpty()) {
            log.warn("Completed video {} references missing campaign {}", event.videoId(), event.campaignId());
            return;
        }
        Campaign campaign = found.get();
        if (!Boolean.TRUE.equals(campaign.getAutoPostEnabled())) {
            try {
                approvalService.requestApproval(event.videoId());
            } catch (RuntimeException e) {
                log.error("Could not queue video {} for approval: {}", event.videoId(), e.getMessage(), e);
            }
            return;
        }
        if (campaign.getPostPlatforms().isEmpty()) {
            log.warn("Campaign {} auto-posts without platforms, video {} not posted", campaign.getId(), event.videoId());
            return;
        }

        PublishRequest request = PublishRequest.builder()
                .content(buildCaption(event))
                .platforms(campaign.getPostPlatforms().stream().map(SocialPlatform::getKey).toList())
                .mediaUrl(event.assetUrl())
                .videoGenerationId(event.videoId())
                .build();

        try {
            PublishResultDto result = publishService.publishAndAggregate(request);
            log.info("Auto-posted video {} for campaign {}: {}", event.videoId(), campaign.getId(), result.getOverallStatus());
        } catch (RuntimeException e) {
            log.error("Auto-post of video {} failed: {}", event.videoId(), e.getMessage(), e);
        }
    }

    /**
     * Title plus the start of the script, cut at a word boundary.
     */
    static String buildCaption(VideoTerminalEvent event) {
        return buildCaption(event.scriptTitle(), event.scriptContent());
    }

    static String buildCaption(String title, String body) {
        StringBuilder caption = new StringBuilder();
        if (title != null) {
            caption.append(title);
        }
        if (body != null && !body.isBlank()) {
            String flat = body.replaceAll("\\s+", " ").trim();
            if (flat.length() > CAPTION_BODY_LENGTH) {
                int cut = flat.lastIndexOf(' ', CAPTION_BODY_LENGTH);
                flat = flat.substring(0, cut > 0 ? cut : CAPTION_BODY_LENGTH) + "...";
            }
            if (caption.length() > 0) {
                caption.append("\n\n");
            }
            caption.append(flat);
        }
        return caption.toString();
    }
}
