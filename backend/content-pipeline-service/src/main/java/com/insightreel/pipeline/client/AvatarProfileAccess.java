package com.insightreel.pipeline.client;

import com.insightreel.pipeline.entity.AvatarProfile;
import com.insightreel.pipeline.entity.SubscriptionTier;

import java.util.List;
import java.util.Optional;

/**
 * Which avatar profiles a subscription tier may use.
 */
public interface AvatarProfileAccess {

    boolean isPermitted(SubscriptionTier tier, String avatarProfileId);

    Optional<AvatarProfile> resolve(String avatarProfileId);

    List<AvatarProfile> availableProfiles(SubscriptionTier tier);
}
