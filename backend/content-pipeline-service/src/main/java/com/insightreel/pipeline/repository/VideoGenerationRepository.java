package com.insightreel.pipeline.repository;

import com.insightreel.pipeline.entity.ApprovalStatus;
import com.insightreel.pipeline.entity.VideoGeneration;
import com.insightreel.pipeline.entity.VideoStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Every state change after creation is a conditional update that only applies
 * while the stored status is still active (QUEUED or PROCESSING). The returned
 * row count tells the caller whether its write won.
 */
@Repository
public interface VideoGenerationRepository extends JpaRepository<VideoGeneration, String> {

    Optional<VideoGeneration> findByProviderJobId(String providerJobId);

    List<VideoGeneration> findByUserIdOrderByCreatedAtDesc(String userId);

    List<VideoGeneration> findByUserIdAndApprovalStatusOrderByCompletedAtAsc(String userId, ApprovalStatus approvalStatus);

    List<VideoGeneration> findByStatus(VideoStatus status);

    List<VideoGeneration> findByStatusAndCreatedAtBefore(VideoStatus status, LocalDateTime before);

    long countByUserIdAndCreatedAtBetween(String userId, LocalDateTime start, LocalDateTime end);

    @Query("SELECT v FROM VideoGeneration v WHERE v.status = :status AND v.providerJobId IS NULL " +
            "AND v.createdAt < :before")
    List<VideoGeneration> findUnsubmittedBefore(
            @Param("status") VideoStatus status,
            @Param("before") LocalDateTime before
    );

    /**
     * QUEUED -> PROCESSING, assigning the provider job id exactly once
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE VideoGeneration v SET v.status = :processing, v.providerJobId = :providerJobId, v.updatedAt = :now " +
            "WHERE v.id = :id AND v.status = :queued AND v.providerJobId IS NULL")
    int assignProviderJob(
            @Param("id") String id,
            @Param("providerJobId") String providerJobId,
            @Param("now") LocalDateTime now,
            @Param("processing") VideoStatus processing,
            @Param("queued") VideoStatus queued
    );

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE VideoGeneration v SET v.status = :completed, v.assetUrl = :assetUrl, " +
            "v.thumbnailUrl = :thumbnailUrl, v.durationSeconds = :durationSeconds, v.errorReason = null, " +
            "v.completedAt = :now, v.updatedAt = :now " +
            "WHERE v.id = :id AND v.status IN :active")
    int markCompleted(
            @Param("id") String id,
            @Param("assetUrl") String assetUrl,
            @Param("thumbnailUrl") String thumbnailUrl,
            @Param("durationSeconds") Double durationSeconds,
            @Param("now") LocalDateTime now,
            @Param("completed") VideoStatus completed,
            @Param("active") Collection<VideoStatus> active
    );

    /**
     * Terminal failure write (FAILED or TIMEOUT)
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE VideoGeneration v SET v.status = :status, v.errorReason = :reason, " +
            "v.completedAt = :now, v.updatedAt = :now " +
            "WHERE v.id = :id AND v.status IN :active")
    int markTerminalFailure(
            @Param("id") String id,
            @Param("status") VideoStatus status,
            @Param("reason") String reason,
            @Param("now") LocalDateTime now,
            @Param("active") Collection<VideoStatus> active
    );

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE VideoGeneration v SET v.pollAttempts = :attempts, v.updatedAt = :now " +
            "WHERE v.id = :id AND v.status IN :active")
    int recordPollAttempts(
            @Param("id") String id,
            @Param("attempts") int attempts,
            @Param("now") LocalDateTime now,
            @Param("active") Collection<VideoStatus> active
    );

    /**
     * Completed video without a review state -> PENDING
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE VideoGeneration v SET v.approvalStatus = :pending, v.updatedAt = :now " +
            "WHERE v.id = :id AND v.status = :completed AND v.approvalStatus IS NULL")
    int markApprovalPending(
            @Param("id") String id,
            @Param("now") LocalDateTime now,
            @Param("pending") ApprovalStatus pending,
            @Param("completed") VideoStatus completed
    );

    /**
     * PENDING -> APPROVED | REJECTED, decided exactly once
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE VideoGeneration v SET v.approvalStatus = :decision, v.reviewedBy = :reviewer, " +
            "v.reviewNote = :note, v.reviewedAt = :now, v.updatedAt = :now " +
            "WHERE v.id = :id AND v.approvalStatus = :pending")
    int decideApproval(
            @Param("id") String id,
            @Param("decision") ApprovalStatus decision,
            @Param("reviewer") String reviewer,
            @Param("note") String note,
            @Param("now") LocalDateTime now,
            @Param("pending") ApprovalStatus pending
    );

    default int assignProviderJob(String id, String providerJobId, LocalDateTime now) {
        return assignProviderJob(id, providerJobId, now, VideoStatus.PROCESSING, VideoStatus.QUEUED);
    }

    default int markCompleted(String id, String assetUrl, String thumbnailUrl, Double durationSeconds, LocalDateTime now) {
        return markCompleted(id, assetUrl, thumbnailUrl, durationSeconds, now, VideoStatus.COMPLETED, VideoStatus.ACTIVE);
    }

    default int markTerminalFailure(String id, VideoStatus status, String reason, LocalDateTime now) {
        if (!status.isTerminal() || status == VideoStatus.COMPLETED) {
            throw new IllegalArgumentException("Not a failure status: " + status);
        }
        return markTerminalFailure(id, status, reason, now, VideoStatus.ACTIVE);
    }

    default int markApprovalPending(String id, LocalDateTime now) {
        return markApprovalPending(id, now, ApprovalStatus.PENDING, VideoStatus.COMPLETED);
    }

    default int decideApproval(String id, ApprovalStatus decision, String reviewer, String note, LocalDateTime now) {
        if (decision == ApprovalStatus.PENDING) {
            throw new IllegalArgumentException("Not a review decision: " + decision);
        }
        return decideApproval(id, decision, reviewer, note, now, ApprovalStatus.PENDING);
    }

    default int recordPollAttempts(String id, int attempts, LocalDateTime now) {
        return recordPollAttempts(id, attempts, now, VideoStatus.ACTIVE);
    }
}
