package com.insightreel.pipeline.controller;

import com.insightreel.pipeline.dto.AnalysisResult;
import com.insightreel.pipeline.dto.ResearchJobDto;
import com.insightreel.pipeline.dto.ResearchJobRequest;
import com.insightreel.pipeline.dto.ScriptDraft;
import com.insightreel.pipeline.entity.ResearchPhase;
import com.insightreel.pipeline.service.ResearchJobService;
import com.insightreel.pipeline.service.video.ResearchToVideoService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Research job API: start, inspect, cancel and preview scripts.
 */
@RestController
@RequestMapping("/api/v1/research/jobs")
@RequiredArgsConstructor
@Slf4j
public class ResearchJobController {

    private final ResearchJobService researchJobService;
    private final ResearchToVideoService researchToVideoService;

    /**
     * Start (or join) a research job. Identical in-flight requests share one job id.
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> startJob(
            @Valid @RequestBody ResearchJobRequest request,
            @RequestHeader(value = "X-User-Id", required = false) String userId
    ) {
        if (request.getUserId() == null) {
            request.setUserId(userId);
        }
        log.info("Starting research job: source={}, query='{}', userId={}",
                request.getSource(), request.getQuery(), request.getUserId());

        String jobId = researchJobService.startJob(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "jobId", jobId,
                "phase", researchJobService.getJob(jobId).getPhase()
        ));
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<ResearchJobDto> getJob(@PathVariable String jobId) {
        return ResponseEntity.ok(researchJobService.getJob(jobId));
    }

    @GetMapping
    public ResponseEntity<Page<ResearchJobDto>> listJobs(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "20") int size,
            @RequestParam(required = false) ResearchPhase phase
    ) {
        return ResponseEntity.ok(researchJobService.listJobs(page, Math.min(Math.max(size, 1), 100), phase));
    }

    @GetMapping("/{jobId}/analysis")
    public ResponseEntity<AnalysisResult> getAnalysis(@PathVariable String jobId) {
        return ResponseEntity.ok(researchJobService.getAnalysis(jobId));
    }

    /**
     * Script that would be rendered for this job, without creating a video.
     */
    @GetMapping("/{jobId}/script")
    public ResponseEntity<ScriptDraft> previewScript(@PathVariable String jobId) {
        return ResponseEntity.ok(researchToVideoService.previewScript(jobId));
    }

    @PostMapping("/{jobId}/cancel")
    public ResponseEntity<ResearchJobDto> cancelJob(@PathVariable String jobId) {
        return ResponseEntity.ok(researchJobService.cancelJob(jobId));
    }
}
