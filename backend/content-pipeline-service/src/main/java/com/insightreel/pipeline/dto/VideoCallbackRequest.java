package com.insightreel.pipeline.dto;

/**
 * Completion notification pushed by the render provider.
 * Received at /api/v1/videos/callback.
 */
public record VideoCallbackRequest(
        /**
         * Provider-side job id; the only key used to find the generation
         */
        String providerJobId,

        /**
         * Provider status (completed, failed, ...)
         */
        String status,

        String assetUrl,

        String thumbnailUrl,

        Double durationSeconds,

        String errorMessage,

        /**
         * Callback authentication token
         */
        String callbackToken
) {
    public boolean isSuccess() {
        return RenderStatus.State.fromProvider(status) == RenderStatus.State.COMPLETED;
    }

    public boolean isFailed() {
        return RenderStatus.State.fromProvider(status) == RenderStatus.State.FAILED;
    }

    public RenderStatus toRenderStatus() {
        return new RenderStatus(RenderStatus.State.fromProvider(status), assetUrl, thumbnailUrl,
                durationSeconds, errorMessage);
    }
}
