package com.insightreel.pipeline.service.video;

import com.insightreel.pipeline.entity.VideoStatus;

/**
 * Published in-process once a video generation durably reaches a terminal status.
 */
public record VideoTerminalEvent(
        String videoId,
        VideoStatus status,
        String assetUrl,
        String errorReason,
        Long campaignId,
        String userId,
        String scriptTitle,
        String scriptContent
) {
    public boolean isCompleted() {
        return status == VideoStatus.COMPLETED;
    }
}
