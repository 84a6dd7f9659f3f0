package com.insightreel.pipeline.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;

/**
 * One execution of collect + analyze against one external source.
 * The job is created in RAW and transitions exactly once, to ANALYZED or FAILED.
 * Terminal jobs are never mutated; a retry is a new job.
 */
@Entity
@Table(name = "research_jobs", indexes = {
        @Index(name = "idx_research_jobs_phase", columnList = "phase"),
        @Index(name = "idx_research_jobs_dedup_key", columnList = "dedup_key"),
        @Index(name = "idx_research_jobs_config_ref", columnList = "config_ref"),
        @Index(name = "idx_research_jobs_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchJob {

    @Id
    @Column(name = "job_id", length = 64)
    private String id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private ResearchSource source;

    @Column(name = "config_ref", nullable = false, length = 512)
    private String configRef;

    @Column(name = "dedup_key", nullable = false, length = 600)
    private String dedupKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private ResearchPhase phase = ResearchPhase.RAW;

    @Enumerated(EnumType.STRING)
    @Column(name = "analysis_depth", nullable = false, length = 16)
    @Builder.Default
    private AnalysisDepth analysisDepth = AnalysisDepth.STANDARD;

    @Column(name = "max_items")
    private Integer maxItems;

    @Column(name = "raw_data", columnDefinition = "TEXT")
    private String rawData;

    @Column(name = "analyzed_data", columnDefinition = "TEXT")
    private String analyzedData;

    @Column(name = "relevance_score")
    private Double relevanceScore;

    @Column(name = "error_message", length = 1024)
    private String errorMessage;

    @Column(name = "attempt_count")
    @Builder.Default
    private Integer attemptCount = 0;

    @Column(name = "workspace_id", length = 64)
    private String workspaceId;

    @Column(name = "user_id", length = 64)
    private String userId;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    public boolean isTerminal() {
        return phase != null && phase.isTerminal();
    }

    public boolean hasRawData() {
        return rawData != null && !rawData.isBlank();
    }

    /**
     * Key shared by all requests that would run the same collection.
     */
    public static String dedupKey(ResearchSource source, String configRef) {
        String normalized = configRef == null ? "" : configRef.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
        return source.name() + ":" + normalized;
    }

    public static String generateJobId() {
        return "rjob_" + UUID.randomUUID().toString()
                .replace("-", "").substring(0, 16);
    }
}
