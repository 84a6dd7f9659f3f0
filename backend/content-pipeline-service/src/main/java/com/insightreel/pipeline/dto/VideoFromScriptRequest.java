package com.insightreel.pipeline.dto;

import com.insightreel.pipeline.entity.AspectRatio;
import com.insightreel.pipeline.entity.SubscriptionTier;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to render a manually written script.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoFromScriptRequest {

    @Size(max = 512)
    private String title;

    @NotBlank(message = "script content is required")
    @Size(max = 5000, message = "script content must be at most 5000 characters")
    private String content;

    @NotBlank(message = "avatarProfileId is required")
    private String avatarProfileId;

    private AspectRatio aspectRatio;

    private SubscriptionTier subscriptionTier;

    private String userId;

    private String workspaceId;
}
