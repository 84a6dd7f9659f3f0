package com.insightreel.pipeline.repository;

import com.insightreel.pipeline.entity.Campaign;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface CampaignRepository extends JpaRepository<Campaign, Long> {

    List<Campaign> findByUserIdOrderByCreatedAtDesc(String userId);

    /**
     * Active campaigns whose next run is due
     */
    @Query("SELECT c FROM Campaign c WHERE c.active = true AND c.nextRunAt <= :now ORDER BY c.id ASC")
    List<Campaign> findDueCampaigns(@Param("now") LocalDateTime now);

    /**
     * Claim a run: only succeeds if nobody advanced nextRunAt since it was read
     */
    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Campaign c SET c.lastRunAt = :now, c.nextRunAt = :nextRunAt, c.updatedAt = :now " +
            "WHERE c.id = :id AND c.active = true AND c.nextRunAt = :expectedNextRunAt")
    int claimRun(
            @Param("id") Long id,
            @Param("expectedNextRunAt") LocalDateTime expectedNextRunAt,
            @Param("now") LocalDateTime now,
            @Param("nextRunAt") LocalDateTime nextRunAt
    );

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Campaign c SET c.totalGenerated = c.totalGenerated + :count WHERE c.id = :id")
    int addGenerated(@Param("id") Long id, @Param("count") int count);

    @Transactional
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE Campaign c SET c.active = :active, c.updatedAt = :now WHERE c.id = :id")
    int updateActive(@Param("id") Long id, @Param("active") boolean active, @Param("now") LocalDateTime now);
}
