package com.insightreel.pipeline.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Selectable rendering identity (avatar + voice) offered by the render provider.
 */
@Entity
@Table(name = "avatar_profiles", indexes = {
        @Index(name = "idx_avatar_profiles_tier", columnList = "subscription_tier")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AvatarProfile {

    @Id
    @Column(name = "profile_id", length = 64)
    private String id;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(name = "provider_avatar_id", nullable = false, length = 128)
    private String providerAvatarId;

    @Column(name = "voice_id", nullable = false, length = 128)
    private String voiceId;

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_tier", nullable = false, length = 16)
    @Builder.Default
    private SubscriptionTier subscriptionTier = SubscriptionTier.FREE;

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;

    @Column(name = "default_profile", nullable = false)
    @Builder.Default
    private Boolean defaultProfile = false;

    @Column(name = "display_order")
    @Builder.Default
    private Integer displayOrder = 0;
}
