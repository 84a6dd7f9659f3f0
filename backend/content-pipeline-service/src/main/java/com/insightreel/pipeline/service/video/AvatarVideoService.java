package com.insightreel.pipeline.service.video;

import com.insightreel.pipeline.client.AvatarProfileAccess;
import com.insightreel.pipeline.client.AvatarRenderProvider;
import com.insightreel.pipeline.config.PipelineProperties;
import com.insightreel.pipeline.dto.RenderRequest;
import com.insightreel.pipeline.dto.ScriptDraft;
import com.insightreel.pipeline.dto.VideoCallbackRequest;
import com.insightreel.pipeline.dto.VideoFromScriptRequest;
import com.insightreel.pipeline.dto.VideoGenerationDto;
import com.insightreel.pipeline.dto.VideoOptions;
import com.insightreel.pipeline.entity.AspectRatio;
import com.insightreel.pipeline.entity.AvatarProfile;
import com.insightreel.pipeline.entity.SubscriptionTier;
import com.insightreel.pipeline.entity.VideoGeneration;
import com.insightreel.pipeline.entity.VideoStatus;
import com.insightreel.pipeline.exception.InvalidVideoRequestException;
import com.insightreel.pipeline.exception.PipelineException;
import com.insightreel.pipeline.exception.TransientExternalException;
import com.insightreel.pipeline.mapper.EntityMapper;
import com.insightreel.pipeline.repository.VideoGenerationRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Avatar video generation: QUEUED -> PROCESSING -> COMPLETED | FAILED | TIMEOUT.
 *
 * Submission returns as soon as the QUEUED row is stored; the provider call and
 * the polling loop run on the video executor. Provider callbacks and polling
 * race freely, the state recorder lets exactly one terminal write win.
 */
@Service
@Slf4j
public class AvatarVideoService {

    private static final String DEFAULT_SCRIPT_TITLE = "InsightReel Video";

    private final VideoGenerationRepository videoRepository;
    private final AvatarProfileAccess avatarProfileAccess;
    private final AvatarRenderProvider renderProvider;
    private final VideoStateRecorder stateRecorder;
    private final VideoStatusPoller statusPoller;
    private final PipelineProperties properties;
    private final EntityMapper entityMapper;
    private final AsyncTaskExecutor videoExecutor;

    public AvatarVideoService(VideoGenerationRepository videoRepository,
                              AvatarProfileAccess avatarProfileAccess,
                              AvatarRenderProvider renderProvider,
                              VideoStateRecorder stateRecorder,
                              VideoStatusPoller statusPoller,
                              PipelineProperties properties,
                              EntityMapper entityMapper,
                              @Qualifier("videoExecutor") AsyncTaskExecutor videoExecutor) {
        this.videoRepository = videoRepository;
        this.avatarProfileAccess = avatarProfileAccess;
        this.renderProvider = renderProvider;
        this.stateRecorder = stateRecorder;
        this.statusPoller = statusPoller;
        this.properties = properties;
        this.entityMapper = entityMapper;
        this.videoExecutor = videoExecutor;
    }

    /**
     * Validate, store a QUEUED generation and hand it to the provider asynchronously.
     *
     * @return the video generation id
     * @throws InvalidVideoRequestException if the script is empty or the avatar is not
     *                                      available to the caller's tier; no row is created
     */
    public String submit(ScriptDraft draft, String avatarProfileId, AspectRatio aspectRatio, VideoOptions options) {
        VideoOptions opts = options != null ? options : VideoOptions.defaults();
        if (draft == null || !draft.hasBody()) {
            throw new InvalidVideoRequestException("Script body must not be empty");
        }
        if (avatarProfileId == null || avatarProfileId.isBlank()) {
            throw new InvalidVideoRequestException("avatarProfileId is required");
        }
        SubscriptionTier tier = opts.tierOrDefault();
        if (!avatarProfileAccess.isPermitted(tier, avatarProfileId)) {
            throw new InvalidVideoRequestException(
                    "Avatar profile " + avatarProfileId + " is not available for tier " + tier);
        }
        AvatarProfile profile = avatarProfileAccess.resolve(avatarProfileId)
                .orElseThrow(() -> new InvalidVideoRequestException("Avatar profile not found: " + avatarProfileId));

        VideoGeneration video = VideoGeneration.builder()
                .id(VideoGeneration.generateVideoId())
                .researchJobId(opts.researchJobId())
                .campaignId(opts.campaignId())
                .userId(opts.userId())
                .workspaceId(opts.workspaceId())
                .scriptTitle(draft.title() != null && !draft.title().isBlank() ? draft.title() : DEFAULT_SCRIPT_TITLE)
                .scriptContent(draft.body())
                .avatarProfileId(avatarProfileId)
                .aspectRatio(aspectRatio != null ? aspectRatio : AspectRatio.PORTRAIT)
                .status(VideoStatus.QUEUED)
                .pollAttempts(0)
                .build();
        videoRepository.save(video);
        log.info("Video generation queued: id={}, avatar={}, researchJob={}, campaign={}",
                video.getId(), avatarProfileId, opts.researchJobId(), opts.campaignId());

        RenderRequest request = RenderRequest.builder()
                .videoId(video.getId())
                .title(video.getScriptTitle())
                .script(video.getScriptContent())
                .providerAvatarId(profile.getProviderAvatarId())
                .voiceId(profile.getVoiceId())
                .aspectRatio(video.getAspectRatio())
                .voiceSpeed(opts.voiceSpeedOrDefault())
                .captions(opts.captionsOrDefault())
                .callbackUrl(properties.getVideo().getCallbackUrl())
                .build();

        try {
            videoExecutor.submit(() -> guarded(video, () -> runGeneration(video, request)));
        } catch (TaskRejectedException e) {
            log.error("Video executor rejected {}: {}", video.getId(), e.getMessage());
            stateRecorder.fail(video, VideoStatus.FAILED, "Video executor saturated");
        }
        return video.getId();
    }

    public VideoGenerationDto createVideoFromScript(VideoFromScriptRequest request) {
        ScriptDraft draft = new ScriptDraft(request.getTitle(), request.getContent());
        VideoOptions options = VideoOptions.builder()
                .userId(request.getUserId())
                .workspaceId(request.getWorkspaceId())
                .subscriptionTier(request.getSubscriptionTier())
                .build();
        String videoId = submit(draft, request.getAvatarProfileId(), request.getAspectRatio(), options);
        return getVideo(videoId);
    }

    public VideoGenerationDto getVideo(String videoId) {
        return videoRepository.findById(videoId)
                .map(entityMapper::toVideoDto)
                .orElseThrow(() -> new IllegalArgumentException("Video generation not found: " + videoId));
    }

    public List<VideoGenerationDto> listVideos(String userId) {
        return videoRepository.findByUserIdOrderByCreatedAtDesc(userId).stream()
                .map(entityMapper::toVideoDto)
                .toList();
    }

    /**
     * Provider push notification. Unknown provider ids and non-terminal
     * statuses are dropped; duplicates after the terminal write are no-ops.
     *
     * @return true if this callback recorded the terminal state
     */
    public boolean handleCallback(VideoCallbackRequest callback) {
        if (callback.providerJobId() == null || callback.providerJobId().isBlank()) {
            log.warn("Video callback without provider job id dropped");
            return false;
        }
        Optional<VideoGeneration> found = videoRepository.findByProviderJobId(callback.providerJobId());
        if (found.isEmpty()) {
            log.warn("Video callback for unknown provider job {} dropped", callback.providerJobId());
            return false;
        }

        VideoGeneration video = found.get();
        if (video.isTerminal()) {
            log.info("Duplicate callback for video {} ignored (already {})", video.getId(), video.getStatus());
            return false;
        }
        if (!callback.isSuccess() && !callback.isFailed()) {
            log.debug("Non-terminal callback for video {}: {}", video.getId(), callback.status());
            return false;
        }
        return stateRecorder.applyTerminal(video, callback.toRenderStatus());
    }

    /**
     * Resume polling for PROCESSING rows and fail QUEUED rows whose submission was lost.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void reconcileOnStartup() {
        List<VideoGeneration> processing = videoRepository.findByStatus(VideoStatus.PROCESSING);
        for (VideoGeneration video : processing) {
            int used = video.getPollAttempts() != null ? video.getPollAttempts() : 0;
            try {
                videoExecutor.submit(() -> guarded(video,
                        () -> statusPoller.pollUntilTerminal(video, video.getProviderJobId(), used)));
            } catch (TaskRejectedException e) {
                log.warn("Could not resume polling for video {}: {}", video.getId(), e.getMessage());
            }
        }
        int failed = failLostSubmissions();
        if (!processing.isEmpty() || failed > 0) {
            log.info("Video reconciliation: {} polls resumed, {} lost submissions failed", processing.size(), failed);
        }
    }

    /**
     * Fails lost submissions and times out PROCESSING rows past their polling
     * budget that no loop in this process is polling.
     */
    @Scheduled(fixedDelayString = "${pipeline.video.sweep-interval-ms:300000}",
            initialDelayString = "${pipeline.video.sweep-initial-delay-ms:300000}")
    public void sweepStalledVideos() {
        int lost = failLostSubmissions();
        int stalled = timeOutStalledPolls();
        if (lost > 0 || stalled > 0) {
            log.info("Video sweep: {} lost submissions failed, {} stalled renders timed out", lost, stalled);
        }
    }

    // ========== Execution ==========

    private void runGeneration(VideoGeneration video, RenderRequest request) {
        String providerJobId;
        try {
            providerJobId = submitWithRetry(request);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Submission of video {} interrupted", video.getId());
            return;
        } catch (PipelineException e) {
            stateRecorder.fail(video, VideoStatus.FAILED, "Provider submission failed: " + e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("Unexpected error submitting video {}: {}", video.getId(), e.getMessage(), e);
            stateRecorder.fail(video, VideoStatus.FAILED, "Provider submission failed: " + e.getMessage());
            return;
        }

        if (!stateRecorder.assignProviderJob(video, providerJobId)) {
            return;
        }
        video.setProviderJobId(providerJobId);
        video.setStatus(VideoStatus.PROCESSING);
        statusPoller.pollUntilTerminal(video, providerJobId, 0);
    }

    /**
     * One resubmission after a fixed backoff for transient errors (e.g. HTTP 429).
     */
    private String submitWithRetry(RenderRequest request) throws InterruptedException {
        try {
            return renderProvider.submitRender(request);
        } catch (TransientExternalException e) {
            long backoff = properties.getVideo().getSubmitRetryBackoff().toMillis();
            log.warn("Render submit for {} failed transiently ({}), retrying in {}ms",
                    request.videoId(), e.getMessage(), backoff);
            Thread.sleep(backoff);
            return renderProvider.submitRender(request);
        }
    }

    /**
     * Last-resort guard for executor tasks: the returned Future is never read.
     */
    private void guarded(VideoGeneration video, Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Video task for {} failed unexpectedly: {}", video.getId(), e.getMessage(), e);
            stateRecorder.fail(video, VideoStatus.FAILED, "Video generation aborted: " + e.getMessage());
        }
    }

    private int timeOutStalledPolls() {
        PipelineProperties.Video settings = properties.getVideo();
        LocalDateTime before = LocalDateTime.now()
                .minus(settings.getTimeout())
                .minus(settings.getPollGracePeriod());
        int timedOut = 0;
        for (VideoGeneration video : videoRepository.findByStatusAndCreatedAtBefore(VideoStatus.PROCESSING, before)) {
            if (statusPoller.isPolling(video.getId())) {
                continue;
            }
            if (stateRecorder.fail(video, VideoStatus.TIMEOUT,
                    "Render did not complete within " + settings.getTimeout().toSeconds() + "s (no active status polling)")) {
                timedOut++;
            }
        }
        return timedOut;
    }

    private int failLostSubmissions() {
        LocalDateTime before = LocalDateTime.now().minus(properties.getVideo().getSubmitGracePeriod());
        int failed = 0;
        for (VideoGeneration video : videoRepository.findUnsubmittedBefore(VideoStatus.QUEUED, before)) {
            if (stateRecorder.fail(video, VideoStatus.FAILED, "Submission to provider was lost before acceptance")) {
                failed++;
            }
        }
        return failed;
    }
}
