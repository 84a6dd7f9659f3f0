package com.insightreel.pipeline.dto;

import com.insightreel.pipeline.entity.AnalysisDepth;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request to start a research job.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ResearchJobRequest {

    @NotBlank(message = "source is required")
    private String source;

    @NotBlank(message = "query is required")
    @Size(max = 512, message = "query must be at most 512 characters")
    private String query;

    private AnalysisDepth analysisDepth;

    @Min(1)
    @Max(500)
    private Integer maxItems;

    private String userId;

    private String workspaceId;
}
