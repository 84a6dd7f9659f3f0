package com.insightreel.pipeline.service.campaign;

import com.insightreel.pipeline.client.AvatarProfileAccess;
import com.insightreel.pipeline.config.PipelineProperties;
import com.insightreel.pipeline.dto.CampaignCreateRequest;
import com.insightreel.pipeline.dto.CampaignDto;
import com.insightreel.pipeline.entity.AspectRatio;
import com.insightreel.pipeline.entity.Campaign;
import com.insightreel.pipeline.entity.CampaignFrequency;
import com.insightreel.pipeline.entity.SocialPlatform;
import com.insightreel.pipeline.entity.SubscriptionTier;
import com.insightreel.pipeline.exception.InvalidVideoRequestException;
import com.insightreel.pipeline.exception.PipelineException;
import com.insightreel.pipeline.mapper.EntityMapper;
import com.insightreel.pipeline.repository.CampaignRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * User-facing campaign management. Scheduling fields are only written by
 * {@link CampaignRunService}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignService {

    private final CampaignRepository campaignRepository;
    private final AvatarProfileAccess avatarProfileAccess;
    private final PipelineProperties properties;
    private final EntityMapper entityMapper;

    public CampaignDto createCampaign(CampaignCreateRequest request) {
        SubscriptionTier tier = request.getSubscriptionTier() != null ? request.getSubscriptionTier() : SubscriptionTier.FREE;
        if (!avatarProfileAccess.isPermitted(tier, request.getAvatarProfileId())) {
            throw new InvalidVideoRequestException(
                    "Avatar profile " + request.getAvatarProfileId() + " is not available for tier " + tier);
        }

        boolean autoPost = Boolean.TRUE.equals(request.getAutoPostEnabled());
        Set<SocialPlatform> platforms = request.getPostPlatforms() != null
                ? new LinkedHashSet<>(request.getPostPlatforms()) : new LinkedHashSet<>();
        if (autoPost && platforms.isEmpty()) {
            throw new PipelineException("INVALID_REQUEST", "Auto-posting requires at least one platform");
        }

        LocalDateTime now = LocalDateTime.now();
        Campaign campaign = Campaign.builder()
                .userId(request.getUserId())
                .workspaceId(request.getWorkspaceId())
                .name(request.getName() != null && !request.getName().isBlank()
                        ? request.getName() : "Campaign - " + request.getResearchConfigRef())
                .researchConfigRef(request.getResearchConfigRef().trim())
                .avatarProfileId(request.getAvatarProfileId())
                .aspectRatio(request.getAspectRatio() != null ? request.getAspectRatio() : AspectRatio.PORTRAIT)
                .subscriptionTier(tier)
                .frequency(request.getFrequency() != null ? request.getFrequency() : CampaignFrequency.DAILY)
                .maxItemsPerRun(request.getMaxItemsPerRun() != null ? request.getMaxItemsPerRun() : 3)
                .maxVideosPerDay(request.getMaxVideosPerDay())
                .autoPostEnabled(autoPost)
                .postPlatforms(platforms)
                .active(true)
                .nextRunAt(now.plus(properties.getCampaign().getInitialDelay()))
                .totalGenerated(0)
                .build();

        Campaign saved = campaignRepository.save(campaign);
        log.info("Created campaign: id={}, user={}, config='{}', frequency={}, firstRun={}",
                saved.getId(), saved.getUserId(), saved.getResearchConfigRef(), saved.getFrequency(), saved.getNextRunAt());
        return entityMapper.toCampaignDto(saved);
    }

    public CampaignDto getCampaign(Long campaignId) {
        return entityMapper.toCampaignDto(findCampaign(campaignId));
    }

    public List<CampaignDto> listCampaigns(String userId) {
        return campaignRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(entityMapper::toCampaignDto)
                .toList();
    }

    /**
     * Stop firing; history and counters are kept.
     */
    public CampaignDto deactivateCampaign(Long campaignId) {
        findCampaign(campaignId);
        campaignRepository.updateActive(campaignId, false, LocalDateTime.now());
        log.info("Campaign {} deactivated", campaignId);
        return getCampaign(campaignId);
    }

    public CampaignDto activateCampaign(Long campaignId) {
        findCampaign(campaignId);
        campaignRepository.updateActive(campaignId, true, LocalDateTime.now());
        log.info("Campaign {} activated", campaignId);
        return getCampaign(campaignId);
    }

    Campaign findCampaign(Long campaignId) {
        return campaignRepository.findById(campaignId)
                .orElseThrow(() -> new IllegalArgumentException("Campaign not found: " + campaignId));
    }
}
