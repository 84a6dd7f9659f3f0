package com.insightreel.pipeline.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Request to post content to several platforms.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PublishRequest {

    @NotBlank(message = "content is required")
    @Size(max = 2200, message = "content must be at most 2200 characters")
    private String content;

    @NotEmpty(message = "at least one platform is required")
    private List<String> platforms;

    private String mediaUrl;

    private String videoGenerationId;

    private LocalDateTime scheduledFor;
}
