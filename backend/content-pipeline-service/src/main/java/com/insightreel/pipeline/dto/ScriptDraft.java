package com.insightreel.pipeline.dto;

/**
 * Video script produced by the content extractor.
 */
public record ScriptDraft(String title, String body) {

    public boolean hasBody() {
        return body != null && !body.isBlank();
    }
}
