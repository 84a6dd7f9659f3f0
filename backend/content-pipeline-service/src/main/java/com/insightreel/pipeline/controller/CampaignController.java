package com.insightreel.pipeline.controller;

import com.insightreel.pipeline.dto.CampaignCreateRequest;
import com.insightreel.pipeline.dto.CampaignDto;
import com.insightreel.pipeline.dto.CampaignTickReport;
import com.insightreel.pipeline.service.campaign.CampaignRunService;
import com.insightreel.pipeline.service.campaign.CampaignService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

@RestController
@RequestMapping("/api/v1/campaigns")
@RequiredArgsConstructor
@Slf4j
public class CampaignController {

    private final CampaignService campaignService;
    private final CampaignRunService campaignRunService;

    @PostMapping
    public ResponseEntity<CampaignDto> createCampaign(@Valid @RequestBody CampaignCreateRequest request) {
        log.info("Creating campaign for user {} on '{}'", request.getUserId(), request.getResearchConfigRef());
        return ResponseEntity.status(HttpStatus.CREATED).body(campaignService.createCampaign(request));
    }

    @GetMapping("/{campaignId}")
    public ResponseEntity<CampaignDto> getCampaign(@PathVariable Long campaignId) {
        return ResponseEntity.ok(campaignService.getCampaign(campaignId));
    }

    @GetMapping
    public ResponseEntity<List<CampaignDto>> listCampaigns(@RequestParam String userId) {
        return ResponseEntity.ok(campaignService.listCampaigns(userId));
    }

    @PostMapping("/{campaignId}/deactivate")
    public ResponseEntity<CampaignDto> deactivate(@PathVariable Long campaignId) {
        return ResponseEntity.ok(campaignService.deactivateCampaign(campaignId));
    }

    @PostMapping("/{campaignId}/activate")
    public ResponseEntity<CampaignDto> activate(@PathVariable Long campaignId) {
        return ResponseEntity.ok(campaignService.activateCampaign(campaignId));
    }

    /**
     * Run one scheduler tick now (operations use).
     */
    @PostMapping("/tick")
    public ResponseEntity<CampaignTickReport> tick() {
        return ResponseEntity.ok(campaignRunService.tick(LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS)));
    }
}
