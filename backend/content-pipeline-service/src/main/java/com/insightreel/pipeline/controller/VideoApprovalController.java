package com.insightreel.pipeline.controller;

import com.insightreel.pipeline.dto.PublishResultDto;
import com.insightreel.pipeline.dto.VideoApprovalRequest;
import com.insightreel.pipeline.dto.VideoGenerationDto;
import com.insightreel.pipeline.service.campaign.VideoApprovalService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Review queue for campaign videos that wait for approval before posting.
 */
@RestController
@RequestMapping("/api/v1/videos")
@RequiredArgsConstructor
public class VideoApprovalController {

    private final VideoApprovalService approvalService;

    @GetMapping("/approvals")
    public ResponseEntity<List<VideoGenerationDto>> listPending(@RequestParam String userId) {
        return ResponseEntity.ok(approvalService.listPendingApprovals(userId));
    }

    /**
     * Approve and publish; the body is optional.
     */
    @PostMapping("/{videoId}/approve")
    public ResponseEntity<PublishResultDto> approve(
            @PathVariable String videoId,
            @Valid @RequestBody(required = false) VideoApprovalRequest request,
            @RequestHeader(value = "X-User-Id", required = false) String reviewer
    ) {
        return ResponseEntity.ok(approvalService.approveAndPublish(videoId, request, reviewer));
    }

    @PostMapping("/{videoId}/reject")
    public ResponseEntity<VideoGenerationDto> reject(
            @PathVariable String videoId,
            @RequestBody(required = false) VideoApprovalRequest request,
            @RequestHeader(value = "X-User-Id", required = false) String reviewer
    ) {
        String note = request != null ? request.getNote() : null;
        return ResponseEntity.ok(approvalService.reject(videoId, reviewer, note));
    }
}
