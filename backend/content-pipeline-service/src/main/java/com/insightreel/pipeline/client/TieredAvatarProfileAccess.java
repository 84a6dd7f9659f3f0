package com.insightreel.pipeline.client;

import com.insightreel.pipeline.entity.AvatarProfile;
import com.insightreel.pipeline.entity.SubscriptionTier;
import com.insightreel.pipeline.repository.AvatarProfileRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Avatar access by subscription tier: free ⊂ pro ⊂ enterprise.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class TieredAvatarProfileAccess implements AvatarProfileAccess {

    private final AvatarProfileRepository avatarProfileRepository;

    @Override
    public boolean isPermitted(SubscriptionTier tier, String avatarProfileId) {
        if (tier == null || avatarProfileId == null) {
            return false;
        }
        return avatarProfileRepository.findById(avatarProfileId)
                .filter(profile -> Boolean.TRUE.equals(profile.getActive()))
                .map(profile -> tier.includes(profile.getSubscriptionTier()))
                .orElseGet(() -> {
                    log.debug("Unknown or inactive avatar profile: {}", avatarProfileId);
                    return false;
                });
    }

    @Override
    public Optional<AvatarProfile> resolve(String avatarProfileId) {
        return avatarProfileRepository.findById(avatarProfileId);
    }

    @Override
    public List<AvatarProfile> availableProfiles(SubscriptionTier tier) {
        List<SubscriptionTier> tiers = Arrays.stream(SubscriptionTier.values())
                .filter(tier::includes)
                .toList();
        return avatarProfileRepository.findByActiveTrueAndSubscriptionTierInOrderByDisplayOrderAsc(tiers);
    }
}
