package com.insightreel.pipeline.scheduler;

import com.insightreel.pipeline.config.PipelineProperties;
import com.insightreel.pipeline.dto.CampaignTickReport;
import com.insightreel.pipeline.service.campaign.CampaignRunService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Fires due campaigns on a cron (default: top of every hour).
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CampaignScheduler {

    private final CampaignRunService campaignRunService;
    private final PipelineProperties properties;

    @Scheduled(cron = "${pipeline.campaign.cron:0 0 * * * ?}")
    public void scheduledTick() {
        if (!properties.getCampaign().isSchedulingEnabled()) {
            log.debug("Campaign scheduling is disabled");
            return;
        }

        try {
            CampaignTickReport report = campaignRunService.tick(LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS));
            if (report.runs().isEmpty()) {
                log.debug("No campaigns due");
            }
        } catch (Exception e) {
            log.error("Campaign tick failed: {}", e.getMessage(), e);
        }
    }
}
