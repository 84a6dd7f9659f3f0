package com.insightreel.pipeline.service.publish;

import com.insightreel.pipeline.client.MultiPlatformPublisher;
import com.insightreel.pipeline.dto.PlatformResponse;
import com.insightreel.pipeline.dto.PublishRequest;
import com.insightreel.pipeline.dto.PublishResultDto;
import com.insightreel.pipeline.entity.PublishResult;
import com.insightreel.pipeline.entity.SocialPlatform;
import com.insightreel.pipeline.exception.PipelineException;
import com.insightreel.pipeline.mapper.EntityMapper;
import com.insightreel.pipeline.repository.PublishResultRepository;
import com.insightreel.pipeline.service.PipelineEventPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Publishes content through the multi-platform publisher and stores the aggregated outcome.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PublishService {

    private final MultiPlatformPublisher publisher;
    private final PublishResultAggregator aggregator;
    private final PublishResultRepository publishResultRepository;
    private final PipelineEventPublisher eventPublisher;
    private final EntityMapper entityMapper;

    public PublishResultDto publishAndAggregate(PublishRequest request) {
        List<SocialPlatform> platforms = parsePlatforms(request.getPlatforms());

        PublishResult result;
        try {
            List<PlatformResponse> responses = publisher.publish(
                    request.getContent(), platforms, request.getMediaUrl(), request.getScheduledFor());
            result = aggregator.aggregate(platforms, responses);
        } catch (RuntimeException e) {
            log.warn("Publisher call failed for platforms {}: {}", platforms, e.getMessage());
            result = aggregator.allFailed(platforms, e.getMessage() != null ? e.getMessage() : "Publisher call failed");
        }

        result.setPostContent(request.getContent());
        result.setMediaUrl(request.getMediaUrl());
        result.setVideoGenerationId(request.getVideoGenerationId());
        result.setScheduledFor(request.getScheduledFor());

        PublishResult saved = publishResultRepository.save(result);
        eventPublisher.publishFinished(saved.getId(), saved.getOverallStatus().name(),
                platforms.size() + " platforms");
        log.info("Publish result {}: {} across {}", saved.getId(), saved.getOverallStatus(), platforms);
        return entityMapper.toPublishResultDto(saved);
    }

    public PublishResultDto getPublishResult(Long publishResultId) {
        return publishResultRepository.findById(publishResultId)
                .map(entityMapper::toPublishResultDto)
                .orElseThrow(() -> new IllegalArgumentException("Publish result not found: " + publishResultId));
    }

    /**
     * Request order is kept; duplicates collapse to their first occurrence.
     */
    private static List<SocialPlatform> parsePlatforms(List<String> keys) {
        if (keys == null || keys.isEmpty()) {
            throw new PipelineException("INVALID_REQUEST", "At least one platform is required");
        }
        LinkedHashSet<SocialPlatform> platforms = new LinkedHashSet<>();
        for (String key : keys) {
            try {
                platforms.add(SocialPlatform.fromKey(key));
            } catch (IllegalArgumentException e) {
                throw new PipelineException("INVALID_REQUEST", "Unsupported platform: " + key, e);
            }
        }
        return new ArrayList<>(platforms);
    }
}
