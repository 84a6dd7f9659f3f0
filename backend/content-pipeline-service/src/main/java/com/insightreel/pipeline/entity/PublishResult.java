package com.insightreel.pipeline.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one post attempt across several platforms.
 * overallStatus is derived from platformResults by the aggregator.
 */
@Entity
@Table(name = "publish_results", indexes = {
        @Index(name = "idx_publish_results_created_at", columnList = "created_at"),
        @Index(name = "idx_publish_results_video_id", columnList = "video_generation_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishResult {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "overall_status", nullable = false, length = 16)
    private PublishStatus overallStatus;

    @Column(name = "post_content", columnDefinition = "TEXT")
    private String postContent;

    @Column(name = "media_url", length = 2048)
    private String mediaUrl;

    @Column(name = "video_generation_id", length = 64)
    private String videoGenerationId;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "publish_platform_results", joinColumns = @JoinColumn(name = "publish_result_id"))
    @OrderColumn(name = "entry_index")
    @Builder.Default
    private List<PlatformResult> platformResults = new ArrayList<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "scheduled_for")
    private LocalDateTime scheduledFor;
}
