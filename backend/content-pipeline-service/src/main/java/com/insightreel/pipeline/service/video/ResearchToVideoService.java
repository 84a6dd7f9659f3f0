package com.insightreel.pipeline.service.video;

import com.insightreel.pipeline.dto.AnalysisResult;
import com.insightreel.pipeline.dto.ExtractionRule;
import com.insightreel.pipeline.dto.ScriptDraft;
import com.insightreel.pipeline.dto.VideoFromResearchRequest;
import com.insightreel.pipeline.dto.VideoGenerationDto;
import com.insightreel.pipeline.dto.VideoOptions;
import com.insightreel.pipeline.entity.AspectRatio;
import com.insightreel.pipeline.entity.ResearchJob;
import com.insightreel.pipeline.entity.ResearchPhase;
import com.insightreel.pipeline.exception.StateConflictException;
import com.insightreel.pipeline.repository.ResearchJobRepository;
import com.insightreel.pipeline.service.ResearchJobService;
import com.insightreel.pipeline.service.extraction.ContentExtractionService;
import com.insightreel.pipeline.service.extraction.ExtractionRuleRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Analyzed research job -> script -> video submission.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ResearchToVideoService {

    private final ResearchJobRepository researchJobRepository;
    private final ResearchJobService researchJobService;
    private final ExtractionRuleRegistry ruleRegistry;
    private final ContentExtractionService extractionService;
    private final AvatarVideoService avatarVideoService;

    public String createVideoFromResearchJob(String researchJobId, String avatarProfileId) {
        return createVideoFromResearchJob(researchJobId, avatarProfileId, AspectRatio.PORTRAIT, VideoOptions.defaults(), null);
    }

    /**
     * @throws IllegalArgumentException if the job does not exist
     * @throws StateConflictException if the job is not ANALYZED
     * @throws com.insightreel.pipeline.exception.InsufficientContentException if the analysis yields no usable script
     */
    public String createVideoFromResearchJob(String researchJobId, String avatarProfileId, AspectRatio aspectRatio,
                                             VideoOptions options, String customTitle) {
        ResearchJob job = researchJobRepository.findById(researchJobId)
                .orElseThrow(() -> new IllegalArgumentException("Research job not found: " + researchJobId));
        if (job.getPhase() != ResearchPhase.ANALYZED) {
            throw new StateConflictException("Research job " + researchJobId + " is " + job.getPhase() + ", not ANALYZED");
        }

        ScriptDraft draft = draftFor(job);
        if (customTitle != null && !customTitle.isBlank()) {
            draft = new ScriptDraft(customTitle, draft.body());
        }

        VideoOptions base = options != null ? options : VideoOptions.defaults();
        VideoOptions withJob = VideoOptions.builder()
                .userId(base.userId() != null ? base.userId() : job.getUserId())
                .workspaceId(base.workspaceId() != null ? base.workspaceId() : job.getWorkspaceId())
                .subscriptionTier(base.subscriptionTier())
                .researchJobId(job.getId())
                .campaignId(base.campaignId())
                .voiceSpeed(base.voiceSpeed())
                .captions(base.captions())
                .build();

        String videoId = avatarVideoService.submit(draft, avatarProfileId, aspectRatio, withJob);
        log.info("Video {} requested from research job {} ({})", videoId, researchJobId, job.getSource().getKey());
        return videoId;
    }

    public VideoGenerationDto createVideoFromResearchJob(VideoFromResearchRequest request, String userId) {
        VideoOptions options = VideoOptions.builder()
                .userId(userId)
                .subscriptionTier(request.getSubscriptionTier())
                .build();
        String videoId = createVideoFromResearchJob(request.getResearchJobId(), request.getAvatarProfileId(),
                request.getAspectRatio() != null ? request.getAspectRatio() : AspectRatio.PORTRAIT,
                options, request.getCustomTitle());
        return avatarVideoService.getVideo(videoId);
    }

    public ScriptDraft previewScript(String researchJobId) {
        return draftFor(researchJobRepository.findById(researchJobId)
                .orElseThrow(() -> new IllegalArgumentException("Research job not found: " + researchJobId)));
    }

    /**
     * Script for an analyzed job using its source's extraction rule.
     */
    public ScriptDraft draftFor(ResearchJob job) {
        AnalysisResult analysis = researchJobService.getAnalysis(job);
        ExtractionRule rule = ruleRegistry.ruleFor(job.getSource());
        return extractionService.extract(analysis, rule, job.getConfigRef());
    }
}
