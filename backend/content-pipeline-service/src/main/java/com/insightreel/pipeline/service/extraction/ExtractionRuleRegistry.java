package com.insightreel.pipeline.service.extraction;

import com.insightreel.pipeline.dto.ExtractionRule;
import com.insightreel.pipeline.entity.ResearchSource;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Extraction rules keyed by research source. Sources without a dedicated rule
 * fall back to {@link #GENERIC_RULE}.
 *
 * Source rules first address the source-specific sections an analysis may
 * carry (kept as top-level detail keys), then the common insight lists.
 */
@Component
public class ExtractionRuleRegistry {

    public static final int DEFAULT_MIN_LENGTH = 150;
    public static final int DEFAULT_MAX_LENGTH = 1800;

    public static final ExtractionRule GENERIC_RULE = new ExtractionRule(
            null,
            List.of("recommendations", "insights", "opportunities"),
            "{source} Research Analysis - {topic}",
            "Based on our latest {source} research analysis, here is what stands out:\n\n"
                    + "{content}\n\n"
                    + "These findings provide actionable intelligence for content strategy, "
                    + "market positioning and audience engagement.",
            DEFAULT_MIN_LENGTH,
            DEFAULT_MAX_LENGTH);

    private final Map<ResearchSource, ExtractionRule> rules;

    public ExtractionRuleRegistry() {
        Map<ResearchSource, ExtractionRule> map = new EnumMap<>(ResearchSource.class);
        map.put(ResearchSource.REDDIT, new ExtractionRule(
                ResearchSource.REDDIT,
                List.of("actionable_recommendations", "key_insights", "trending_topics",
                        "recommendations", "insights"),
                "Reddit Research Insights - {topic}",
                "Based on our latest Reddit research, here are the key insights we discovered:\n\n"
                        + "{content}\n\n"
                        + "These trends represent significant opportunities for content creators and businesses "
                        + "looking to engage with their audience and capitalize on emerging discussions.",
                DEFAULT_MIN_LENGTH,
                DEFAULT_MAX_LENGTH));
        map.put(ResearchSource.HACKERNEWS, new ExtractionRule(
                ResearchSource.HACKERNEWS,
                List.of("trending_stories", "top_discussions", "emerging_technologies", "insights"),
                "Hacker News Tech Trends - {topic}",
                "Our Hacker News analysis reveals the latest technology trends and discussions:\n\n"
                        + "{content}\n\n"
                        + "These insights from the tech community highlight emerging opportunities "
                        + "and innovations that are shaping the future of technology.",
                DEFAULT_MIN_LENGTH,
                DEFAULT_MAX_LENGTH));
        map.put(ResearchSource.GITHUB, new ExtractionRule(
                ResearchSource.GITHUB,
                List.of("trending_repositories", "popular_languages", "emerging_projects", "insights"),
                "GitHub Development Trends - {topic}",
                "GitHub trending analysis shows these exciting developments in software:\n\n"
                        + "{content}\n\n"
                        + "These repositories and projects represent the cutting edge of software development "
                        + "and offer valuable insights into where the industry is heading.",
                DEFAULT_MIN_LENGTH,
                DEFAULT_MAX_LENGTH));
        map.put(ResearchSource.GOOGLE_TRENDS, new ExtractionRule(
                ResearchSource.GOOGLE_TRENDS,
                List.of("content_opportunities.breakout_topics", "content_opportunities.question_opportunities",
                        "trend_insights", "opportunities", "insights"),
                "Google Trends Analysis - {topic}",
                "Google Trends analysis reveals these viral opportunities and search insights:\n\n"
                        + "{content}\n\n"
                        + "These trending topics and search patterns provide valuable intelligence "
                        + "for content strategy and market positioning.",
                DEFAULT_MIN_LENGTH,
                DEFAULT_MAX_LENGTH));
        this.rules = Collections.unmodifiableMap(map);
    }

    public ExtractionRule ruleFor(ResearchSource source) {
        if (source == null) {
            return GENERIC_RULE;
        }
        return rules.getOrDefault(source, GENERIC_RULE);
    }

    public boolean hasDedicatedRule(ResearchSource source) {
        return source != null && rules.containsKey(source);
    }
}
