package com.insightreel.pipeline.service.extraction;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightreel.pipeline.dto.AnalysisResult;
import com.insightreel.pipeline.dto.ExtractionRule;
import com.insightreel.pipeline.dto.ScriptDraft;
import com.insightreel.pipeline.exception.InsufficientContentException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Turns an analysis into a bounded-length video script.
 *
 * <ul>
 *   <li>walks the rule's content paths in order, skipping missing ones</li>
 *   <li>collects strings, lists of strings and formatted objects</li>
 *   <li>numbers the items ("1. item.") and renders them into the body template</li>
 *   <li>rejects analyses with no items and bodies below the minimum</li>
 *   <li>cuts longer bodies at the last sentence end</li>
 * </ul>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ContentExtractionService {

    private static final int MAX_GENERIC_PAIRS = 3;
    private static final int MAX_GENERIC_VALUE_LENGTH = 100;

    private final ObjectMapper objectMapper;

    public ScriptDraft extract(AnalysisResult analysis, ExtractionRule rule) {
        return extract(analysis, rule, null);
    }

    /**
     * @param topic overrides the analysis topic in the title, may be null
     */
    public ScriptDraft extract(AnalysisResult analysis, ExtractionRule rule, String topic) {
        JsonNode root = objectMapper.valueToTree(analysis);

        List<String> items = new ArrayList<>();
        for (String path : rule.contentPaths()) {
            JsonNode node = resolvePath(root, path);
            if (node != null) {
                collectItems(node, items);
            }
        }

        if (items.isEmpty()) {
            throw new InsufficientContentException("No content items found at " + rule.contentPaths(),
                    0, rule.minContentLength());
        }

        String body = rule.bodyTemplate().replace("{content}", numberItems(items)).strip();
        body = enforceBounds(body, rule);

        String resolvedTopic = topic != null && !topic.isBlank() ? topic
                : analysis.getTopic() != null && !analysis.getTopic().isBlank() ? analysis.getTopic() : "Latest Trends";
        String sourceName = rule.source() != null ? rule.source().getDisplayName() : "Research";
        String title = rule.titleTemplate()
                .replace("{topic}", resolvedTopic)
                .replace("{source}", sourceName);

        log.debug("Extracted script: title='{}', items={}, length={}", title, items.size(), body.length());
        return new ScriptDraft(title, body);
    }

    /**
     * Dot-path lookup; null when any segment is missing.
     */
    static JsonNode resolvePath(JsonNode root, String path) {
        JsonNode current = root;
        for (String key : path.split("\\.")) {
            if (current == null || !current.isObject() || !current.has(key)) {
                return null;
            }
            current = current.get(key);
        }
        return current == null || current.isNull() ? null : current;
    }

    private void collectItems(JsonNode node, List<String> items) {
        if (node.isArray()) {
            for (JsonNode element : node) {
                if (element.isTextual()) {
                    addIfPresent(items, element.asText());
                } else if (element.isObject()) {
                    addIfPresent(items, formatObject(element));
                }
            }
        } else if (node.isObject()) {
            addIfPresent(items, formatObject(node));
        } else if (node.isTextual()) {
            addIfPresent(items, node.asText());
        }
    }

    /**
     * Known shapes first, then up to three short scalar fields as "key: value".
     */
    static String formatObject(JsonNode item) {
        if (has(item, "title") && has(item, "description")) {
            return item.get("title").asText() + ": " + item.get("description").asText();
        }
        if (has(item, "query") && has(item, "growth")) {
            return item.get("query").asText() + " showing " + item.get("growth").asText() + " growth";
        }
        if (has(item, "action") && has(item, "description")) {
            return item.get("action").asText() + " - " + item.get("description").asText();
        }
        if (has(item, "name") && has(item, "description")) {
            return item.get("name").asText() + ": " + item.get("description").asText();
        }

        List<String> pairs = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = item.fields();
        while (fields.hasNext() && pairs.size() < MAX_GENERIC_PAIRS) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if ((value.isTextual() || value.isNumber()) && value.asText().length() < MAX_GENERIC_VALUE_LENGTH) {
                pairs.add(field.getKey() + ": " + value.asText());
            }
        }
        return String.join(", ", pairs);
    }

    static String numberItems(List<String> items) {
        List<String> numbered = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            String item = items.get(i).strip();
            if (!item.endsWith(".")) {
                item = item + ".";
            }
            numbered.add((i + 1) + ". " + item);
        }
        return String.join("\n\n", numbered);
    }

    private String enforceBounds(String body, ExtractionRule rule) {
        if (body.length() < rule.minContentLength()) {
            throw new InsufficientContentException(
                    "Extracted script is too short (" + body.length() + " < " + rule.minContentLength() + ")",
                    body.length(), rule.minContentLength());
        }
        if (body.length() <= rule.maxContentLength()) {
            return body;
        }

        int cut = lastSentenceBoundary(body, rule.maxContentLength());
        if (cut < 0) {
            throw new InsufficientContentException(
                    "No sentence boundary within " + rule.maxContentLength() + " characters",
                    body.length(), rule.minContentLength());
        }
        String truncated = body.substring(0, cut).strip();
        if (truncated.length() < rule.minContentLength()) {
            throw new InsufficientContentException(
                    "Script truncated at a sentence boundary is too short (" + truncated.length()
                            + " < " + rule.minContentLength() + ")",
                    truncated.length(), rule.minContentLength());
        }
        log.debug("Script truncated from {} to {} characters", body.length(), truncated.length());
        return truncated;
    }

    /**
     * End index (exclusive) of the last sentence that ends at or before {@code max}.
     * A sentence ends with '.', '!' or '?' followed by whitespace or the end of text;
     * list markers ("12." at line start) do not count.
     */
    static int lastSentenceBoundary(String text, int max) {
        for (int i = Math.min(max, text.length()) - 1; i >= 0; i--) {
            char c = text.charAt(i);
            if (c != '.' && c != '!' && c != '?') {
                continue;
            }
            boolean atEnd = i + 1 >= text.length();
            if (!atEnd && !Character.isWhitespace(text.charAt(i + 1))) {
                continue;
            }
            if (c == '.' && isListMarker(text, i)) {
                continue;
            }
            return i + 1;
        }
        return -1;
    }

    private static boolean isListMarker(String text, int dotIndex) {
        int start = dotIndex;
        while (start > 0 && Character.isDigit(text.charAt(start - 1))) {
            start--;
        }
        if (start == dotIndex) {
            return false;
        }
        return start == 0 || text.charAt(start - 1) == '\n';
    }

    private static boolean has(JsonNode node, String field) {
        return node.hasNonNull(field) && !node.get(field).asText().isBlank();
    }

    private static void addIfPresent(List<String> items, String value) {
        if (value != null && !value.isBlank()) {
            items.add(value.strip());
        }
    }
}
