package com.insightreel.pipeline.dto;

import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Reviewer's decision on a pending video. Empty fields fall back to the campaign's
 * platforms and the caption built from the script.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VideoApprovalRequest {

    private List<String> platforms;

    @Size(max = 2200, message = "caption must be at most 2200 characters")
    private String caption;

    private LocalDateTime scheduledFor;

    @Size(max = 1024, message = "note must be at most 1024 characters")
    private String note;
}
