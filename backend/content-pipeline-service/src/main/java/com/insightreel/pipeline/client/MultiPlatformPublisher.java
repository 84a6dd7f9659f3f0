package com.insightreel.pipeline.client;

import com.insightreel.pipeline.dto.PlatformResponse;
import com.insightreel.pipeline.entity.SocialPlatform;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Posts one piece of content to several social platforms in a single call.
 * May return fewer or more responses than requested platforms.
 */
public interface MultiPlatformPublisher {

    List<PlatformResponse> publish(String content, List<SocialPlatform> platforms,
                                   String mediaUrl, LocalDateTime scheduledFor);
}
