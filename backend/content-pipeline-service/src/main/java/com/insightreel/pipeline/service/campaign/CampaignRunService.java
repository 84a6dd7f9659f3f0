package com.insightreel.pipeline.service.campaign;

import com.insightreel.pipeline.config.PipelineProperties;
import com.insightreel.pipeline.dto.CampaignRunReport;
import com.insightreel.pipeline.dto.CampaignTickReport;
import com.insightreel.pipeline.dto.ScriptDraft;
import com.insightreel.pipeline.dto.VideoOptions;
import com.insightreel.pipeline.entity.Campaign;
import com.insightreel.pipeline.entity.ResearchJob;
import com.insightreel.pipeline.entity.ResearchPhase;
import com.insightreel.pipeline.exception.InsufficientContentException;
import com.insightreel.pipeline.repository.CampaignRepository;
import com.insightreel.pipeline.repository.ResearchJobRepository;
import com.insightreel.pipeline.repository.VideoGenerationRepository;
import com.insightreel.pipeline.service.ResearchRelevanceRanker;
import com.insightreel.pipeline.service.video.AvatarVideoService;
import com.insightreel.pipeline.service.video.ResearchToVideoService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * One scheduler tick over all due campaigns.
 *
 * Per campaign: claim the run (compare-and-set on nextRunAt), select the top
 * ranked analyzed jobs created since the previous run, extract and submit each
 * one independently, then add the submitted count to totalGenerated.
 * Item failures are reported in the run report, never thrown.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CampaignRunService {

    static final String QUOTA_REACHED = "Daily video quota reached";

    private final CampaignRepository campaignRepository;
    private final ResearchJobRepository researchJobRepository;
    private final VideoGenerationRepository videoRepository;
    private final ResearchToVideoService researchToVideoService;
    private final AvatarVideoService avatarVideoService;
    private final PipelineProperties properties;

    public CampaignTickReport tick(LocalDateTime now) {
        // DB timestamps keep microseconds; the claim compares nextRunAt exactly
        LocalDateTime tickAt = now.truncatedTo(ChronoUnit.MICROS);
        List<Campaign> due = campaignRepository.findDueCampaigns(tickAt);
        List<CampaignRunReport> runs = new ArrayList<>();

        for (Campaign campaign : due) {
            try {
                runCampaign(campaign, tickAt).ifPresent(runs::add);
            } catch (RuntimeException e) {
                log.error("Campaign {} run failed: {}", campaign.getId(), e.getMessage(), e);
            }
        }

        CampaignTickReport report = new CampaignTickReport(tickAt, runs);
        if (!due.isEmpty()) {
            log.info("Campaign tick at {}: {} due, {} fired, {} videos submitted",
                    tickAt, due.size(), runs.size(), report.totalSubmitted());
        }
        return report;
    }

    Optional<CampaignRunReport> runCampaign(Campaign campaign, LocalDateTime now) {
        if (!campaign.isDue(now)) {
            return Optional.empty();
        }
        LocalDateTime nextRunAt = campaign.getFrequency().advance(now);
        if (campaignRepository.claimRun(campaign.getId(), campaign.getNextRunAt(), now, nextRunAt) == 0) {
            log.info("Campaign {} already claimed by another tick", campaign.getId());
            return Optional.empty();
        }

        LocalDateTime since = campaign.getLastRunAt() != null
                ? campaign.getLastRunAt()
                : now.minus(properties.getCampaign().getSelectionWindow());
        List<ResearchJob> ranked = researchJobRepository
                .findCandidates(ResearchPhase.ANALYZED, campaign.getResearchConfigRef(), since, now)
                .stream()
                .sorted(ResearchRelevanceRanker.RANKING)
                .toList();

        int limit = Math.max(0, campaign.getMaxItemsPerRun() != null ? campaign.getMaxItemsPerRun() : 0);
        String note = null;
        if (campaign.getMaxVideosPerDay() != null) {
            // the quota is the owner's: every campaign of the same user draws from it
            long today = videoRepository.countByUserIdAndCreatedAtBetween(
                    campaign.getUserId(), now.toLocalDate().atStartOfDay(), now);
            int remaining = (int) Math.max(0, campaign.getMaxVideosPerDay() - today);
            if (remaining < limit) {
                limit = remaining;
                if (remaining == 0 && !ranked.isEmpty()) {
                    note = QUOTA_REACHED;
                }
            }
        }
        List<ResearchJob> selected = ranked.subList(0, Math.min(limit, ranked.size()));

        CampaignRunReport report = CampaignRunReport.builder()
                .campaignId(campaign.getId())
                .firedAt(now)
                .nextRunAt(nextRunAt)
                .candidates(ranked.size())
                .selected(selected.size())
                .note(note)
                .build();

        for (ResearchJob job : selected) {
            processItem(campaign, job, report);
        }

        if (report.submittedCount() > 0) {
            campaignRepository.addGenerated(campaign.getId(), report.submittedCount());
        }

        log.info("Campaign {} fired: candidates={}, selected={}, submitted={}, skipped={}, failed={}, next={}",
                campaign.getId(), ranked.size(), selected.size(), report.submittedCount(),
                report.getSkipped().size(), report.getFailed().size(), nextRunAt);
        return Optional.of(report);
    }

    private void processItem(Campaign campaign, ResearchJob job, CampaignRunReport report) {
        try {
            ScriptDraft draft = researchToVideoService.draftFor(job);
            VideoOptions options = VideoOptions.builder()
                    .userId(campaign.getUserId())
                    .workspaceId(campaign.getWorkspaceId())
                    .subscriptionTier(campaign.getSubscriptionTier())
                    .researchJobId(job.getId())
                    .campaignId(campaign.getId())
                    .build();
            String videoId = avatarVideoService.submit(draft, campaign.getAvatarProfileId(),
                    campaign.getAspectRatio(), options);
            report.getSubmittedVideoIds().add(videoId);
        } catch (InsufficientContentException e) {
            log.info("Campaign {} skipped job {}: {}", campaign.getId(), job.getId(), e.getMessage());
            report.getSkipped().add(new CampaignRunReport.ItemOutcome(job.getId(), e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Campaign {} failed on job {}: {}", campaign.getId(), job.getId(), e.getMessage());
            report.getFailed().add(new CampaignRunReport.ItemOutcome(job.getId(), e.getMessage()));
        }
    }
}
