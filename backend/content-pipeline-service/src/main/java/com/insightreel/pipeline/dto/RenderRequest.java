package com.insightreel.pipeline.dto;

import com.insightreel.pipeline.entity.AspectRatio;
import lombok.Builder;

/**
 * Payload handed to the avatar render provider.
 */
@Builder
public record RenderRequest(
        String videoId,
        String title,
        String script,
        String providerAvatarId,
        String voiceId,
        AspectRatio aspectRatio,
        double voiceSpeed,
        boolean captions,
        String callbackUrl
) {
}
