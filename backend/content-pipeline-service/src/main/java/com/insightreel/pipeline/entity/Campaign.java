package com.insightreel.pipeline.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Recurring policy that turns fresh research into avatar videos.
 * lastRunAt, nextRunAt and totalGenerated are advanced only by the campaign run service.
 */
@Entity
@Table(name = "video_campaigns", indexes = {
        @Index(name = "idx_video_campaigns_active_next_run", columnList = "active, next_run_at"),
        @Index(name = "idx_video_campaigns_user_id", columnList = "user_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Campaign {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, length = 64)
    private String userId;

    @Column(name = "workspace_id", length = 64)
    private String workspaceId;

    @Column(nullable = false, length = 255)
    private String name;

    @Column(name = "research_config_ref", nullable = false, length = 512)
    private String researchConfigRef;

    @Column(name = "avatar_profile_id", nullable = false, length = 64)
    private String avatarProfileId;

    @Enumerated(EnumType.STRING)
    @Column(name = "aspect_ratio", nullable = false, length = 16)
    @Builder.Default
    private AspectRatio aspectRatio = AspectRatio.PORTRAIT;

    @Enumerated(EnumType.STRING)
    @Column(name = "subscription_tier", nullable = false, length = 16)
    @Builder.Default
    private SubscriptionTier subscriptionTier = SubscriptionTier.FREE;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private CampaignFrequency frequency = CampaignFrequency.DAILY;

    @Column(name = "max_items_per_run", nullable = false)
    @Builder.Default
    private Integer maxItemsPerRun = 3;

    @Column(name = "max_videos_per_day")
    private Integer maxVideosPerDay;

    @Column(name = "auto_post_enabled", nullable = false)
    @Builder.Default
    private Boolean autoPostEnabled = false;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "video_campaign_platforms", joinColumns = @JoinColumn(name = "campaign_id"))
    @Enumerated(EnumType.STRING)
    @Column(name = "platform", length = 32)
    @Builder.Default
    private Set<SocialPlatform> postPlatforms = new LinkedHashSet<>();

    @Column(nullable = false)
    @Builder.Default
    private Boolean active = true;

    @Column(name = "last_run_at")
    private LocalDateTime lastRunAt;

    @Column(name = "next_run_at", nullable = false)
    private LocalDateTime nextRunAt;

    @Column(name = "total_generated", nullable = false)
    @Builder.Default
    private Integer totalGenerated = 0;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isDue(LocalDateTime now) {
        return Boolean.TRUE.equals(active) && nextRunAt != null && !now.isBefore(nextRunAt);
    }
}
