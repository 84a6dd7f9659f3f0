package com.insightreel.pipeline.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.core.type.TypeReference;
import com.insightreel.pipeline.dto.RawDataset;
import com.insightreel.pipeline.entity.ResearchSource;
import com.insightreel.pipeline.exception.PermanentExternalException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Collects raw items through the per-source collector workers.
 * Each worker exposes {@code POST /collect/{source}} and answers with
 * {@code {"items": [...]}}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class HttpSourceDataProvider implements SourceDataProvider {

    private static final TypeReference<Map<String, Object>> ITEM_TYPE = new TypeReference<>() {};

    private final WebClient webClient;
    private final ObjectMapper objectMapper;

    @Value("${pipeline.collector.base-url:http://localhost:8091}")
    private String baseUrl;

    @Value("${pipeline.collector.api-key:}")
    private String apiKey;

    @Value("${pipeline.collector.timeout-seconds:120}")
    private int timeoutSeconds;

    @Override
    public RawDataset collect(ResearchSource source, String query, int maxItems) {
        String url = baseUrl + "/collect/" + source.getKey();
        log.debug("Collecting from {}: query='{}', maxItems={}", source.getKey(), query, maxItems);

        JsonNode response;
        try {
            response = webClient.post()
                    .uri(url)
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> {
                        if (apiKey != null && !apiKey.isBlank()) {
                            h.setBearerAuth(apiKey);
                        }
                    })
                    .bodyValue(Map.of("query", query, "max_items", maxItems))
                    .retrieve()
                    .bodyToMono(JsonNode.class)
                    .timeout(Duration.ofSeconds(timeoutSeconds))
                    .block();
        } catch (RuntimeException e) {
            throw ExternalCallErrors.translate("Collector[" + source.getKey() + "]", e);
        }

        if (response == null) {
            throw new PermanentExternalException("Collector[" + source.getKey() + "] returned an empty body");
        }

        List<Map<String, Object>> items = new ArrayList<>();
        JsonNode itemsNode = response.path("items");
        if (itemsNode.isArray()) {
            for (JsonNode item : itemsNode) {
                if (item.isObject()) {
                    items.add(objectMapper.convertValue(item, ITEM_TYPE));
                } else if (!item.isNull()) {
                    items.add(Map.of("text", item.asText()));
                }
                if (items.size() >= maxItems) {
                    break;
                }
            }
        }

        log.info("Collected {} items from {} for query='{}'", items.size(), source.getKey(), query);
        return new RawDataset(source, query, items, LocalDateTime.now());
    }
}
