package com.insightreel.pipeline.repository;

import com.insightreel.pipeline.entity.ResearchJob;
import com.insightreel.pipeline.entity.ResearchPhase;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public interface ResearchJobRepository extends JpaRepository<ResearchJob, String> {

    /**
     * Find the most recent job for a dedup key in the given phase
     */
    Optional<ResearchJob> findFirstByDedupKeyAndPhaseOrderByCreatedAtDesc(String dedupKey, ResearchPhase phase);

    Page<ResearchJob> findByPhase(ResearchPhase phase, Pageable pageable);

    List<ResearchJob> findByPhaseOrderByCreatedAtAsc(ResearchPhase phase);

    /**
     * Analyzed jobs for a research config created in (since, until]
     */
    @Query("SELECT j FROM ResearchJob j WHERE j.phase = :phase AND j.configRef = :configRef " +
            "AND j.createdAt > :since AND j.createdAt <= :until")
    List<ResearchJob> findCandidates(
            @Param("phase") ResearchPhase phase,
            @Param("configRef") String configRef,
            @Param("since") LocalDateTime since,
            @Param("until") LocalDateTime until
    );

    /**
     * RAW jobs created before the cutoff (staleness sweep)
     */
    @Query("SELECT j FROM ResearchJob j WHERE j.phase = :phase AND j.createdAt < :before")
    List<ResearchJob> findByPhaseAndCreatedAtBefore(
            @Param("phase") ResearchPhase phase,
            @Param("before") LocalDateTime before
    );

    /**
     * Store raw data while the job is still RAW
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ResearchJob j SET j.rawData = :rawData, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.phase = :expected")
    int storeRawData(
            @Param("id") String id,
            @Param("rawData") String rawData,
            @Param("now") LocalDateTime now,
            @Param("expected") ResearchPhase expected
    );

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ResearchJob j SET j.attemptCount = j.attemptCount + 1, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.phase = :expected")
    int incrementAttempt(
            @Param("id") String id,
            @Param("now") LocalDateTime now,
            @Param("expected") ResearchPhase expected
    );

    /**
     * Compare-and-set transition RAW -> ANALYZED
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ResearchJob j SET j.phase = :analyzed, j.analyzedData = :analyzedData, " +
            "j.relevanceScore = :score, j.errorMessage = null, j.completedAt = :now, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.phase = :expected")
    int completeAnalysis(
            @Param("id") String id,
            @Param("analyzedData") String analyzedData,
            @Param("score") Double score,
            @Param("now") LocalDateTime now,
            @Param("analyzed") ResearchPhase analyzed,
            @Param("expected") ResearchPhase expected
    );

    /**
     * Compare-and-set transition RAW -> FAILED
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ResearchJob j SET j.phase = :failed, j.errorMessage = :errorMessage, " +
            "j.completedAt = :now, j.updatedAt = :now " +
            "WHERE j.id = :id AND j.phase = :expected")
    int failJob(
            @Param("id") String id,
            @Param("errorMessage") String errorMessage,
            @Param("now") LocalDateTime now,
            @Param("failed") ResearchPhase failed,
            @Param("expected") ResearchPhase expected
    );

    default int storeRawData(String id, String rawData, LocalDateTime now) {
        return storeRawData(id, rawData, now, ResearchPhase.RAW);
    }

    default int incrementAttempt(String id, LocalDateTime now) {
        return incrementAttempt(id, now, ResearchPhase.RAW);
    }

    default int completeAnalysis(String id, String analyzedData, Double score, LocalDateTime now) {
        return completeAnalysis(id, analyzedData, score, now, ResearchPhase.ANALYZED, ResearchPhase.RAW);
    }

    default int failJob(String id, String errorMessage, LocalDateTime now) {
        return failJob(id, errorMessage, now, ResearchPhase.FAILED, ResearchPhase.RAW);
    }
}
