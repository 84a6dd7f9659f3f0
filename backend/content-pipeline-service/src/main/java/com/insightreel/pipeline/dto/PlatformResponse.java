package com.insightreel.pipeline.dto;

/**
 * Raw per-platform response from the multi-platform publisher.
 */
public record PlatformResponse(
        String platform,
        String status,
        String postId,
        String postUrl,
        String errorMessage
) {
    public boolean isSuccess() {
        return "success".equalsIgnoreCase(status) || "scheduled".equalsIgnoreCase(status);
    }

    public static PlatformResponse success(String platform, String postId, String postUrl) {
        return new PlatformResponse(platform, "success", postId, postUrl, null);
    }

    public static PlatformResponse error(String platform, String errorMessage) {
        return new PlatformResponse(platform, "error", null, null, errorMessage);
    }
}
