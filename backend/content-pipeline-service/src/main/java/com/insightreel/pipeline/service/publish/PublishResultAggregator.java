package com.insightreel.pipeline.service.publish;

import com.insightreel.pipeline.dto.PlatformResponse;
import com.insightreel.pipeline.entity.PlatformResult;
import com.insightreel.pipeline.entity.PublishResult;
import com.insightreel.pipeline.entity.PublishStatus;
import com.insightreel.pipeline.entity.SocialPlatform;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Folds raw publisher responses into one entry per requested platform and
 * derives the overall status: SUCCESS if all succeeded, ERROR if none did,
 * PARTIAL otherwise.
 */
@Component
@Slf4j
public class PublishResultAggregator {

    static final String NO_RESPONSE = "No response from platform";

    /**
     * @return an unsaved result; content, media and timestamps are left to the caller
     */
    public PublishResult aggregate(List<SocialPlatform> requestedPlatforms, List<PlatformResponse> responses) {
        Map<SocialPlatform, PlatformResponse> byPlatform = new EnumMap<>(SocialPlatform.class);
        if (responses != null) {
            for (PlatformResponse response : responses) {
                SocialPlatform platform = platformOf(response);
                if (platform == null || !requestedPlatforms.contains(platform)) {
                    log.debug("Ignoring response for unrequested platform: {}", response.platform());
                    continue;
                }
                byPlatform.putIfAbsent(platform, response);
            }
        }

        List<PlatformResult> entries = new ArrayList<>(requestedPlatforms.size());
        for (SocialPlatform platform : requestedPlatforms) {
            PlatformResponse response = byPlatform.get(platform);
            entries.add(response == null ? errorEntry(platform, NO_RESPONSE) : toEntry(platform, response));
        }

        return PublishResult.builder()
                .overallStatus(overallStatus(entries))
                .platformResults(entries)
                .build();
    }

    /**
     * Every requested platform recorded as ERROR with the same message.
     */
    public PublishResult allFailed(List<SocialPlatform> requestedPlatforms, String message) {
        List<PlatformResult> entries = requestedPlatforms.stream()
                .map(platform -> errorEntry(platform, message))
                .toList();
        return PublishResult.builder()
                .overallStatus(overallStatus(entries))
                .platformResults(new ArrayList<>(entries))
                .build();
    }

    public static PublishStatus overallStatus(List<PlatformResult> entries) {
        long successes = entries.stream().filter(PlatformResult::isSuccess).count();
        if (!entries.isEmpty() && successes == entries.size()) {
            return PublishStatus.SUCCESS;
        }
        return successes == 0 ? PublishStatus.ERROR : PublishStatus.PARTIAL;
    }

    private static PlatformResult toEntry(SocialPlatform platform, PlatformResponse response) {
        if (response.isSuccess()) {
            return PlatformResult.builder()
                    .platform(platform)
                    .status(PublishStatus.SUCCESS)
                    .platformPostId(response.postId())
                    .postUrl(response.postUrl())
                    .build();
        }
        String message = response.errorMessage() != null && !response.errorMessage().isBlank()
                ? response.errorMessage()
                : "Platform returned status '" + response.status() + "'";
        return errorEntry(platform, message);
    }

    private static PlatformResult errorEntry(SocialPlatform platform, String message) {
        return PlatformResult.builder()
                .platform(platform)
                .status(PublishStatus.ERROR)
                .errorMessage(message)
                .build();
    }

    private static SocialPlatform platformOf(PlatformResponse response) {
        if (response == null || response.platform() == null) {
            return null;
        }
        try {
            return SocialPlatform.fromKey(response.platform());
        } catch (IllegalArgumentException e) {
            log.debug("Unknown platform in publisher response: {}", response.platform());
            return null;
        }
    }
}
