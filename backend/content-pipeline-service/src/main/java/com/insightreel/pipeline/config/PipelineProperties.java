package com.insightreel.pipeline.config;

import com.insightreel.pipeline.entity.AnalysisDepth;
import com.insightreel.pipeline.entity.SubscriptionTier;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Tunables of the content pipeline, bound from {@code pipeline.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "pipeline")
@Data
public class PipelineProperties {

    private Research research = new Research();

    private RetryPolicy retry = new RetryPolicy();

    private Video video = new Video();

    private CampaignSettings campaign = new CampaignSettings();

    private Avatars avatars = new Avatars();

    @Data
    public static class Research {
        private AnalysisDepth defaultDepth = AnalysisDepth.STANDARD;

        private int defaultMaxItems = 50;

        /** RAW jobs older than this are failed by the reconciliation sweep */
        private Duration stalenessThreshold = Duration.ofHours(2);

        /** Ranking weight per source key (reddit, github, ...); missing means 1.0 */
        private Map<String, Double> sourceWeights = new HashMap<>();
    }

    /**
     * Backoff for collector and analyzer calls. Delay doubles per retry.
     */
    @Data
    public static class RetryPolicy {
        private int maxAttempts = 3;

        private Duration baseBackoff = Duration.ofSeconds(2);

        private Duration maxBackoff = Duration.ofSeconds(30);
    }

    @Data
    public static class Video {
        private Duration pollInterval = Duration.ofSeconds(5);

        /** Total polling budget; attempts = timeout / pollInterval */
        private Duration timeout = Duration.ofMinutes(10);

        /** Delay before the single resubmission after a transient submit error */
        private Duration submitRetryBackoff = Duration.ofSeconds(5);

        /** QUEUED rows without a provider id older than this are failed at startup */
        private Duration submitGracePeriod = Duration.ofMinutes(15);

        /** PROCESSING rows older than timeout + this grace, with no active poll, are timed out by the sweep */
        private Duration pollGracePeriod = Duration.ofMinutes(5);

        private String callbackUrl;

        public int maxPollAttempts() {
            long interval = Math.max(1, pollInterval.toMillis());
            return (int) Math.max(1, timeout.toMillis() / interval);
        }
    }

    @Data
    public static class CampaignSettings {
        private boolean schedulingEnabled = true;

        /** Lookback for a campaign's first run, when it has no lastRunAt */
        private Duration selectionWindow = Duration.ofDays(1);

        /** Delay between campaign creation and its first run */
        private Duration initialDelay = Duration.ofHours(1);
    }

    @Data
    public static class Avatars {
        private boolean seedEnabled = true;

        private List<Seed> seed = new ArrayList<>();
    }

    @Data
    public static class Seed {
        private String id;
        private String name;
        private String providerAvatarId;
        private String voiceId;
        private SubscriptionTier tier = SubscriptionTier.FREE;
        private boolean defaultProfile;
    }
}
