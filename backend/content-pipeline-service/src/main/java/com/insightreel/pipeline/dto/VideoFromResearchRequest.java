package com.insightreel.pipeline.dto;

import com.insightreel.pipeline.entity.AspectRatio;
import com.insightreel.pipeline.entity.SubscriptionTier;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to render a video from an analyzed research job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoFromResearchRequest {

    @NotBlank(message = "researchJobId is required")
    private String researchJobId;

    @NotBlank(message = "avatarProfileId is required")
    private String avatarProfileId;

    private AspectRatio aspectRatio;

    private SubscriptionTier subscriptionTier;

    private String customTitle;
}
