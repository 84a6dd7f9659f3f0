package com.insightreel.pipeline.controller;

import com.insightreel.pipeline.dto.PublishRequest;
import com.insightreel.pipeline.dto.PublishResultDto;
import com.insightreel.pipeline.service.publish.PublishService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/publish")
@RequiredArgsConstructor
public class PublishController {

    private final PublishService publishService;

    /**
     * Post to every requested platform; partial failures are reported per platform, not as an HTTP error.
     */
    @PostMapping
    public ResponseEntity<PublishResultDto> publish(@Valid @RequestBody PublishRequest request) {
        return ResponseEntity.ok(publishService.publishAndAggregate(request));
    }

    @GetMapping("/{publishResultId}")
    public ResponseEntity<PublishResultDto> getPublishResult(@PathVariable Long publishResultId) {
        return ResponseEntity.ok(publishService.getPublishResult(publishResultId));
    }
}
