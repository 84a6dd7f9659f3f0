package com.insightreel.pipeline.dto;

import com.insightreel.pipeline.entity.SubscriptionTier;
import lombok.Builder;

/**
 * Caller context and render tweaks for a video submission.
 */
@Builder
public record VideoOptions(
        String userId,
        String workspaceId,
        SubscriptionTier subscriptionTier,
        String researchJobId,
        Long campaignId,
        Double voiceSpeed,
        Boolean captions
) {
    public static VideoOptions defaults() {
        return VideoOptions.builder().build();
    }

    public SubscriptionTier tierOrDefault() {
        return subscriptionTier != null ? subscriptionTier : SubscriptionTier.FREE;
    }

    public double voiceSpeedOrDefault() {
        return voiceSpeed != null ? voiceSpeed : 1.0;
    }

    public boolean captionsOrDefault() {
        return captions == null || captions;
    }
}
