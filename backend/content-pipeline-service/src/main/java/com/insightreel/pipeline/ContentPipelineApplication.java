package com.insightreel.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * InsightReel content pipeline service.
 *
 * - Research jobs: collect raw items from a source, then analyze them with an LLM
 * - Script extraction from analyzed research
 * - Avatar video generation driven by polling and provider callbacks
 * - Recurring campaigns and multi-platform publishing
 */
@SpringBootApplication
public class ContentPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(ContentPipelineApplication.class, args);
    }
}
