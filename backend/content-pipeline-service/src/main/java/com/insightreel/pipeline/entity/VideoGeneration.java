package com.insightreel.pipeline.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One request to render a script into an avatar video.
 * State changes after creation go through the compare-and-set updates in
 * {@link com.insightreel.pipeline.repository.VideoGenerationRepository}.
 */
@Entity
@Table(name = "video_generations", indexes = {
        @Index(name = "idx_video_generations_status", columnList = "status"),
        @Index(name = "idx_video_generations_provider_job_id", columnList = "provider_job_id", unique = true),
        @Index(name = "idx_video_generations_research_job_id", columnList = "research_job_id"),
        @Index(name = "idx_video_generations_user_created", columnList = "user_id, created_at"),
        @Index(name = "idx_video_generations_approval", columnList = "user_id, approval_status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoGeneration {

    @Id
    @Column(name = "video_id", length = 64)
    private String id;

    @Column(name = "research_job_id", length = 64)
    private String researchJobId;

    @Column(name = "campaign_id")
    private Long campaignId;

    @Column(name = "user_id", length = 64)
    private String userId;

    @Column(name = "workspace_id", length = 64)
    private String workspaceId;

    @Column(name = "script_title", nullable = false, length = 512)
    private String scriptTitle;

    @Column(name = "script_content", nullable = false, columnDefinition = "TEXT")
    private String scriptContent;

    @Column(name = "avatar_profile_id", nullable = false, length = 64)
    private String avatarProfileId;

    @Enumerated(EnumType.STRING)
    @Column(name = "aspect_ratio", nullable = false, length = 16)
    @Builder.Default
    private AspectRatio aspectRatio = AspectRatio.PORTRAIT;

    @Column(name = "provider_job_id", length = 128)
    private String providerJobId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private VideoStatus status = VideoStatus.QUEUED;

    @Column(name = "asset_url", length = 2048)
    private String assetUrl;

    @Column(name = "thumbnail_url", length = 2048)
    private String thumbnailUrl;

    @Column(name = "duration_seconds")
    private Double durationSeconds;

    @Column(name = "error_reason", length = 1024)
    private String errorReason;

    @Column(name = "poll_attempts")
    @Builder.Default
    private Integer pollAttempts = 0;

    /**
     * Set once a completed campaign video needs review; null outside the review flow
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "approval_status", length = 16)
    private ApprovalStatus approvalStatus;

    @Column(name = "reviewed_by", length = 64)
    private String reviewedBy;

    @Column(name = "review_note", length = 1024)
    private String reviewNote;

    @Column(name = "reviewed_at")
    private LocalDateTime reviewedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public boolean isTerminal() {
        return status != null && status.isTerminal();
    }

    public static String generateVideoId() {
        return "vid_" + UUID.randomUUID().toString()
                .replace("-", "").substring(0, 16);
    }
}
