package com.insightreel.pipeline.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.insightreel.pipeline.dto.PlatformResponse;
import com.insightreel.pipeline.entity.SocialPlatform;
import com.insightreel.pipeline.exception.PermanentExternalException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ayrshare multi-platform posting API ({@code POST /post}).
 * Per-platform outcomes come from {@code postIds[]} (successes) and
 * {@code errors[]} (failures).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AyrshareClient implements MultiPlatformPublisher {

    private final WebClient webClient;

    @Value("${AYRSHARE_API_KEY:}")
    private String apiKey;

    @Value("${AYRSHARE_BASE_URL:https://api.ayrshare.com/api}")
    private String baseUrl;

    @Value("${pipeline.publisher.timeout-seconds:30}")
    private int timeoutSeconds;

    @Override
    public List<PlatformResponse> publish(String content, List<SocialPlatform> platforms,
                                          String mediaUrl, LocalDateTime scheduledFor) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new PermanentExternalException("Ayrshare API key is not configured");
        }

        Map<String, Object> payload = new HashMap<>();
        payload.put("post", content);
        payload.put("platforms", platforms.stream().map(SocialPlatform::getKey).toList());
        if (mediaUrl != null && !mediaUrl.isBlank()) {
            payload.put("mediaUrls", List.of(mediaUrl));
        }
        if (scheduledFor != null) {
            payload.put("scheduleDate", scheduledFor.atOffset(ZoneOffset.UTC).format(DateTimeFormatter.ISO_OFFSET_DATE_TIME));
        }

        log.info("Posting to platforms={}, hasMedia={}, scheduled={}", platforms, mediaUrl != null, scheduledFor != null);

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(baseUrl + "/post")
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (RuntimeException e) {
            throw ExternalCallErrors.translate("Ayrshare", e);
        }
        if (response == null) {
            throw new PermanentExternalException("Ayrshare returned an empty body");
        }
        return parseResponse(response);
    }

    List<PlatformResponse> parseResponse(JsonNode response) {
        List<PlatformResponse> results = new ArrayList<>();
        String overall = response.path("status").asText("");

        for (JsonNode post : response.path("postIds")) {
            String status = post.path("status").asText(overall.isBlank() ? "success" : overall);
            results.add(new PlatformResponse(
                    post.path("platform").asText(null),
                    status,
                    post.path("id").asText(null),
                    post.path("postUrl").asText(null),
                    null));
        }
        for (JsonNode error : response.path("errors")) {
            results.add(PlatformResponse.error(
                    error.path("platform").asText(null),
                    error.path("message").asText("Unknown error")));
        }
        return results;
    }
}
