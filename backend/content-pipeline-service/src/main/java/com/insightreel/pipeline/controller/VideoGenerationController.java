package com.insightreel.pipeline.controller;

import com.insightreel.pipeline.dto.VideoCallbackRequest;
import com.insightreel.pipeline.dto.VideoFromResearchRequest;
import com.insightreel.pipeline.dto.VideoFromScriptRequest;
import com.insightreel.pipeline.dto.VideoGenerationDto;
import com.insightreel.pipeline.service.video.AvatarVideoService;
import com.insightreel.pipeline.service.video.ResearchToVideoService;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Avatar video API and the render provider's callback endpoint.
 */
@RestController
@RequestMapping("/api/v1/videos")
@Slf4j
public class VideoGenerationController {

    private final AvatarVideoService avatarVideoService;
    private final ResearchToVideoService researchToVideoService;
    private final String callbackToken;

    public VideoGenerationController(AvatarVideoService avatarVideoService,
                                     ResearchToVideoService researchToVideoService,
                                     @Value("${pipeline.video.callback-token:}") String callbackToken) {
        this.avatarVideoService = avatarVideoService;
        this.researchToVideoService = researchToVideoService;
        this.callbackToken = callbackToken;
    }

    @PostMapping("/script")
    public ResponseEntity<VideoGenerationDto> createFromScript(
            @Valid @RequestBody VideoFromScriptRequest request,
            @RequestHeader(value = "X-User-Id", required = false) String userId
    ) {
        if (request.getUserId() == null) {
            request.setUserId(userId);
        }
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(avatarVideoService.createVideoFromScript(request));
    }

    @PostMapping("/research")
    public ResponseEntity<VideoGenerationDto> createFromResearch(
            @Valid @RequestBody VideoFromResearchRequest request,
            @RequestHeader(value = "X-User-Id", required = false) String userId
    ) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(researchToVideoService.createVideoFromResearchJob(request, userId));
    }

    @GetMapping("/{videoId}")
    public ResponseEntity<VideoGenerationDto> getVideo(@PathVariable String videoId) {
        return ResponseEntity.ok(avatarVideoService.getVideo(videoId));
    }

    @GetMapping
    public ResponseEntity<List<VideoGenerationDto>> listVideos(@RequestParam String userId) {
        return ResponseEntity.ok(avatarVideoService.listVideos(userId));
    }

    /**
     * Render provider completion callback.
     *
     * @param headerToken token from the X-Callback-Token header; the body field is accepted as fallback
     */
    @PostMapping("/callback")
    public ResponseEntity<Map<String, Object>> handleCallback(
            @RequestHeader(value = "X-Callback-Token", required = false) String headerToken,
            @RequestBody VideoCallbackRequest payload
    ) {
        log.info("Received render callback: providerJobId={}, status={}", payload.providerJobId(), payload.status());

        String presented = headerToken != null ? headerToken : payload.callbackToken();
        if (!callbackToken.isBlank() && !callbackToken.equals(presented)) {
            log.warn("Callback authentication failed for provider job {}", payload.providerJobId());
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(Map.of("error", "Invalid callback token"));
        }

        boolean applied = avatarVideoService.handleCallback(payload);
        return ResponseEntity.ok(Map.of(
                "status", "received",
                "applied", applied
        ));
    }
}
