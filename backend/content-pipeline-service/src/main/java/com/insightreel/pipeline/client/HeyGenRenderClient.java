package com.insightreel.pipeline.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.insightreel.pipeline.dto.RenderRequest;
import com.insightreel.pipeline.dto.RenderStatus;
import com.insightreel.pipeline.exception.PermanentExternalException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * HeyGen avatar video API.
 * - POST /v2/video/generate returns data.video_id
 * - GET /v1/video_status.get?video_id= returns data.status, video_url, thumbnail_url, duration, error
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HeyGenRenderClient implements AvatarRenderProvider {

    private static final int MAX_SCRIPT_LENGTH = 5000;
    private static final Pattern EMOJI = Pattern.compile(
            "[\\x{1F600}-\\x{1F64F}\\x{1F300}-\\x{1F5FF}\\x{1F680}-\\x{1F6FF}\\x{1F1E0}-\\x{1F1FF}\\x{2702}-\\x{27B0}]+");

    private final WebClient webClient;

    @Value("${HEYGEN_API_KEY:}")
    private String apiKey;

    @Value("${pipeline.heygen.base-url:https://api.heygen.com}")
    private String baseUrl;

    @Value("${pipeline.heygen.timeout-seconds:60}")
    private int timeoutSeconds;

    @Override
    public String submitRender(RenderRequest request) {
        requireApiKey();
        Map<String, Object> payload = buildPayload(request);

        JsonNode response = execute("submit", webClient.post()
                .uri(baseUrl + "/v2/video/generate")
                .contentType(MediaType.APPLICATION_JSON)
                .header("X-Api-Key", apiKey)
                .bodyValue(payload));

        String providerJobId = response.path("data").path("video_id").asText(null);
        if (providerJobId == null || providerJobId.isBlank()) {
            String message = response.path("error").path("message").asText("No video_id in response");
            throw new PermanentExternalException("HeyGen rejected render: " + message);
        }
        log.info("HeyGen render accepted: videoId={}, providerJobId={}", request.videoId(), providerJobId);
        return providerJobId;
    }

    @Override
    public RenderStatus getStatus(String providerJobId) {
        requireApiKey();
        JsonNode response = execute("status", webClient.get()
                .uri(baseUrl + "/v1/video_status.get?video_id={id}", providerJobId)
                .header("X-Api-Key", apiKey));

        JsonNode data = response.path("data");
        RenderStatus.State state = RenderStatus.State.fromProvider(data.path("status").asText(null));
        String error = null;
        if (state == RenderStatus.State.FAILED) {
            JsonNode errorNode = data.path("error");
            error = errorNode.isObject()
                    ? errorNode.path("message").asText("Render failed")
                    : errorNode.asText("Render failed");
        }
        Double duration = data.hasNonNull("duration") ? data.get("duration").asDouble() : null;
        return new RenderStatus(state,
                data.path("video_url").asText(null),
                data.path("thumbnail_url").asText(null),
                duration,
                error);
    }

    Map<String, Object> buildPayload(RenderRequest request) {
        Map<String, Object> character = new HashMap<>();
        character.put("type", "avatar");
        character.put("avatar_id", request.providerAvatarId());
        character.put("scale", 1.0);
        character.put("avatar_style", "normal");

        Map<String, Object> voice = new HashMap<>();
        voice.put("type", "text");
        voice.put("input_text", cleanScript(request.script()));
        voice.put("voice_id", request.voiceId());
        voice.put("speed", Math.max(0.5, Math.min(2.0, request.voiceSpeed())));

        Map<String, Object> payload = new HashMap<>();
        payload.put("video_inputs", List.of(Map.of(
                "character", character,
                "voice", voice,
                "background", Map.of("type", "color", "value", "#ffffff"))));
        payload.put("dimension", Map.of(
                "width", request.aspectRatio().getWidth(),
                "height", request.aspectRatio().getHeight()));
        payload.put("caption", request.captions());
        payload.put("title", request.title() != null ? request.title() : "InsightReel Video");
        payload.put("callback_id", request.videoId());
        if (request.callbackUrl() != null && !request.callbackUrl().isBlank()) {
            payload.put("callback_url", request.callbackUrl());
        }
        return payload;
    }

    static String cleanScript(String script) {
        String cleaned = EMOJI.matcher(script == null ? "" : script).replaceAll("");
        cleaned = cleaned.replaceAll("\\s+", " ").trim();
        if (cleaned.length() > MAX_SCRIPT_LENGTH) {
            cleaned = cleaned.substring(0, MAX_SCRIPT_LENGTH);
        }
        return cleaned;
    }

    private JsonNode execute(String operation, WebClient.RequestHeadersSpec<?> spec) {
        JsonNode response;
        try {
            response = spec.retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (RuntimeException e) {
            throw ExternalCallErrors.translate("HeyGen " + operation, e);
        }
        if (response == null) {
            throw new PermanentExternalException("HeyGen " + operation + " returned an empty body");
        }
        return response;
    }

    private void requireApiKey() {
        if (apiKey == null || apiKey.isBlank()) {
            throw new PermanentExternalException("HeyGen API key is not configured");
        }
    }
}
