package com.insightreel.pipeline.service.video;

import com.insightreel.pipeline.client.AvatarRenderProvider;
import com.insightreel.pipeline.config.PipelineProperties;
import com.insightreel.pipeline.dto.RenderStatus;
import com.insightreel.pipeline.entity.VideoGeneration;
import com.insightreel.pipeline.entity.VideoStatus;
import com.insightreel.pipeline.exception.PermanentExternalException;
import com.insightreel.pipeline.exception.TransientExternalException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed-interval status polling for one provider job. Runs on the calling
 * (video executor) thread until the row is terminal or the attempt budget is spent.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VideoStatusPoller {

    private final AvatarRenderProvider renderProvider;
    private final VideoStateRecorder stateRecorder;
    private final PipelineProperties properties;

    private final Set<String> activePolls = ConcurrentHashMap.newKeySet();

    /**
     * @param attemptsUsed attempts already spent (non-zero when resuming after a restart)
     */
    public void pollUntilTerminal(VideoGeneration video, String providerJobId, int attemptsUsed) {
        activePolls.add(video.getId());
        try {
            poll(video, providerJobId, attemptsUsed);
        } catch (RuntimeException e) {
            log.error("Polling of video {} aborted: {}", video.getId(), e.getMessage(), e);
            stateRecorder.fail(video, VideoStatus.FAILED, "Status polling aborted: " + e.getMessage());
        } finally {
            activePolls.remove(video.getId());
        }
    }

    /**
     * True while a polling loop for this video runs in this process.
     */
    public boolean isPolling(String videoId) {
        return activePolls.contains(videoId);
    }

    private void poll(VideoGeneration video, String providerJobId, int attemptsUsed) {
        Duration interval = properties.getVideo().getPollInterval();
        int maxAttempts = properties.getVideo().maxPollAttempts();
        int attempts = attemptsUsed;

        while (attempts < maxAttempts) {
            if (!pause(interval)) {
                log.info("Polling of video {} interrupted after {} attempts", video.getId(), attempts);
                return;
            }
            attempts++;

            RenderStatus status;
            try {
                status = renderProvider.getStatus(providerJobId);
            } catch (TransientExternalException e) {
                log.warn("Status check {}/{} for video {} failed: {}", attempts, maxAttempts, video.getId(), e.getMessage());
                if (!stateRecorder.recordPollAttempts(video, attempts)) {
                    return;
                }
                continue;
            } catch (PermanentExternalException e) {
                stateRecorder.fail(video, VideoStatus.FAILED, "Status check failed: " + e.getMessage());
                return;
            } catch (RuntimeException e) {
                log.error("Unexpected error checking status of video {}: {}", video.getId(), e.getMessage(), e);
                stateRecorder.fail(video, VideoStatus.FAILED, "Status check failed: " + e.getMessage());
                return;
            }

            if (status == null) {
                stateRecorder.fail(video, VideoStatus.FAILED, "Status check returned no status");
                return;
            }
            if (status.isTerminal()) {
                stateRecorder.applyTerminal(video, status);
                return;
            }
            if (!stateRecorder.recordPollAttempts(video, attempts)) {
                log.debug("Video {} finished elsewhere, polling stopped", video.getId());
                return;
            }
        }

        stateRecorder.fail(video, VideoStatus.TIMEOUT,
                "Render did not complete within " + properties.getVideo().getTimeout().toSeconds()
                        + "s (" + maxAttempts + " status checks)");
    }

    private static boolean pause(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
