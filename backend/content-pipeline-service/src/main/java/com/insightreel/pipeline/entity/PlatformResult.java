package com.insightreel.pipeline.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of a publish attempt on a single platform.
 */
@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PlatformResult {

    @Enumerated(EnumType.STRING)
    @Column(name = "platform", nullable = false, length = 32)
    private SocialPlatform platform;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private PublishStatus status;

    @Column(name = "platform_post_id", length = 255)
    private String platformPostId;

    @Column(name = "post_url", length = 2048)
    private String postUrl;

    @Column(name = "error_message", length = 1024)
    private String errorMessage;

    public boolean isSuccess() {
        return status == PublishStatus.SUCCESS;
    }
}
