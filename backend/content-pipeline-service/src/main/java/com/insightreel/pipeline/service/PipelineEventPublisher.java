package com.insightreel.pipeline.service;

import com.insightreel.pipeline.dto.PipelineEventMessage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Publishes terminal transitions to Kafka. Delivery failures are logged and
 * never affect the pipeline state that was already committed.
 */
@Service
@Slf4j
public class PipelineEventPublisher {

    private final ObjectProvider<KafkaTemplate<String, PipelineEventMessage>> kafkaTemplateProvider;

    @Value("${pipeline.events.enabled:true}")
    private boolean enabled;

    @Value("${pipeline.events.topic:pipeline.events}")
    private String topic;

    public PipelineEventPublisher(ObjectProvider<KafkaTemplate<String, PipelineEventMessage>> kafkaTemplateProvider) {
        this.kafkaTemplateProvider = kafkaTemplateProvider;
    }

    public void researchJobFinished(String jobId, String phase, String userId, String detail) {
        send(PipelineEventMessage.builder()
                .eventType("RESEARCH_JOB_" + phase)
                .entityType("research_job")
                .entityId(jobId)
                .status(phase)
                .userId(userId)
                .detail(detail)
                .occurredAt(LocalDateTime.now())
                .build());
    }

    public void videoFinished(String videoId, String status, String userId, String detail) {
        send(PipelineEventMessage.builder()
                .eventType("VIDEO_" + status)
                .entityType("video_generation")
                .entityId(videoId)
                .status(status)
                .userId(userId)
                .detail(detail)
                .occurredAt(LocalDateTime.now())
                .build());
    }

    public void publishFinished(Long publishResultId, String status, String detail) {
        send(PipelineEventMessage.builder()
                .eventType("PUBLISH_" + status)
                .entityType("publish_result")
                .entityId(String.valueOf(publishResultId))
                .status(status)
                .detail(detail)
                .occurredAt(LocalDateTime.now())
                .build());
    }

    private void send(PipelineEventMessage message) {
        if (!enabled) {
            return;
        }
        KafkaTemplate<String, PipelineEventMessage> kafkaTemplate = kafkaTemplateProvider.getIfAvailable();
        if (kafkaTemplate == null) {
            log.debug("No Kafka template, dropping event {} for {}", message.getEventType(), message.getEntityId());
            return;
        }
        try {
            kafkaTemplate.send(topic, message.getEntityId(), message)
                    .whenComplete((result, ex) -> {
                        if (ex != null) {
                            log.warn("Failed to publish {} for {}: {}", message.getEventType(),
                                    message.getEntityId(), ex.getMessage());
                        } else {
                            log.debug("Published {} for {}", message.getEventType(), message.getEntityId());
                        }
                    });
        } catch (RuntimeException e) {
            log.warn("Failed to publish {} for {}: {}", message.getEventType(), message.getEntityId(), e.getMessage());
        }
    }
}
