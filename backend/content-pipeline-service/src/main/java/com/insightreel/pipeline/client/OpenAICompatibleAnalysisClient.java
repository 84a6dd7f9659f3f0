package com.insightreel.pipeline.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightreel.pipeline.dto.AnalysisResult;
import com.insightreel.pipeline.dto.RawDataset;
import com.insightreel.pipeline.entity.AnalysisDepth;
import com.insightreel.pipeline.exception.PermanentExternalException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Insight analyzer backed by an OpenAI-compatible chat completions endpoint
 * (OpenAI, OpenRouter, Ollama, ...). The model is asked for a JSON object
 * matching {@link AnalysisResult}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OpenAICompatibleAnalysisClient implements LanguageAnalysisProvider {

    private static final int MAX_ITEMS_IN_PROMPT = 100;
    private static final int MAX_ITEM_CHARS = 600;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Value("${LLM_OPENAI_API_KEY:${OPENAI_API_KEY:}}")
    private String apiKey;

    @Value("${LLM_OPENAI_BASE_URL:https://api.openai.com/v1}")
    private String baseUrl;

    @Value("${LLM_OPENAI_MODEL:gpt-4o-mini}")
    private String model;

    @Value("${pipeline.analyzer.timeout-seconds:120}")
    private int timeoutSeconds;

    @Override
    public AnalysisResult analyze(RawDataset dataset, AnalysisDepth depth) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new PermanentExternalException("OpenAI API key is not configured");
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("temperature", 0.3);
        body.put("response_format", Map.of("type", "json_object"));
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt(depth)),
                Map.of("role", "user", "content", buildUserPrompt(dataset))
        ));

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(baseUrl + "/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (RuntimeException e) {
            throw ExternalCallErrors.translate("Analyzer", e);
        }

        String content = response == null ? null
                : response.path("choices").path(0).path("message").path("content").asText(null);
        if (content == null || content.isBlank()) {
            throw new PermanentExternalException("Analyzer returned no content");
        }

        try {
            AnalysisResult result = objectMapper.readValue(stripCodeFence(content), AnalysisResult.class);
            if (result.getTopic() == null || result.getTopic().isBlank()) {
                result.setTopic(dataset.query());
            }
            log.info("Analyzed {} items from {} (depth={}): {} insights",
                    dataset.size(), dataset.source().getKey(), depth, result.itemCount());
            return result;
        } catch (JsonProcessingException e) {
            throw new PermanentExternalException("Analyzer returned malformed JSON: " + e.getOriginalMessage(), null, e);
        }
    }

    private String systemPrompt(AnalysisDepth depth) {
        String detail = switch (depth) {
            case BASIC -> "Give 3 short insights and 2 recommendations.";
            case STANDARD -> "Give 5 insights, 3 opportunities and 3 recommendations.";
            case COMPREHENSIVE -> "Give 8 insights, 5 opportunities and 5 recommendations, "
                    + "and add any source-specific sections you find (trending_topics, key_insights, ...).";
        };
        return "You are a research analyst for content creators. "
                + "Analyze the collected items and answer with a single JSON object with the fields "
                + "topic (string), summary (string), insights (string[]), opportunities (string[]), "
                + "recommendations (string[]) and relevance_score (number 0-100). "
                + detail;
    }

    private String buildUserPrompt(RawDataset dataset) {
        StringBuilder sb = new StringBuilder();
        sb.append("Source: ").append(dataset.source().getDisplayName()).append('\n');
        sb.append("Query: ").append(dataset.query()).append('\n');
        sb.append("Items:\n");
        dataset.items().stream().limit(MAX_ITEMS_IN_PROMPT).forEach(item -> {
            String text;
            try {
                text = objectMapper.writeValueAsString(item);
            } catch (JsonProcessingException e) {
                text = String.valueOf(item);
            }
            if (text.length() > MAX_ITEM_CHARS) {
                text = text.substring(0, MAX_ITEM_CHARS);
            }
            sb.append("- ").append(text).append('\n');
        });
        return sb.toString();
    }

    private static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }
}
