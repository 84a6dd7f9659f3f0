package com.insightreel.pipeline.repository;

import com.insightreel.pipeline.entity.AvatarProfile;
import com.insightreel.pipeline.entity.SubscriptionTier;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface AvatarProfileRepository extends JpaRepository<AvatarProfile, String> {

    List<AvatarProfile> findByActiveTrueAndSubscriptionTierInOrderByDisplayOrderAsc(Collection<SubscriptionTier> tiers);
}
