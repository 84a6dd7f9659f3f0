package com.insightreel.pipeline.dto;

import com.insightreel.pipeline.entity.AspectRatio;
import com.insightreel.pipeline.entity.CampaignFrequency;
import com.insightreel.pipeline.entity.SocialPlatform;
import com.insightreel.pipeline.entity.SubscriptionTier;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Request to create an automated video campaign.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CampaignCreateRequest {

    @NotBlank(message = "userId is required")
    private String userId;

    private String workspaceId;

    private String name;

    @NotBlank(message = "researchConfigRef is required")
    private String researchConfigRef;

    @NotBlank(message = "avatarProfileId is required")
    private String avatarProfileId;

    private AspectRatio aspectRatio;

    private SubscriptionTier subscriptionTier;

    private CampaignFrequency frequency;

    @Min(1)
    @Max(50)
    private Integer maxItemsPerRun;

    @Min(1)
    private Integer maxVideosPerDay;

    private Boolean autoPostEnabled;

    private Set<SocialPlatform> postPlatforms;
}
