package com.insightreel.pipeline.entity;

/**
 * Social platforms the publisher can post to.
 */
public enum SocialPlatform {
    TWITTER,
    FACEBOOK,
    INSTAGRAM,
    LINKEDIN,
    BLUESKY,
    PINTEREST,
    TIKTOK,
    YOUTUBE;

    public String getKey() {
        return name().toLowerCase();
    }

    public static SocialPlatform fromKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Platform is required");
        }
        return SocialPlatform.valueOf(key.trim().toUpperCase());
    }
}
