package com.insightreel.pipeline.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Kafka message announcing a terminal transition of a pipeline entity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PipelineEventMessage {
    private String eventType;
    private String entityType;
    private String entityId;
    private String status;
    private String userId;
    private String detail;
    private LocalDateTime occurredAt;
}
