package com.insightreel.pipeline.controller;

import com.insightreel.pipeline.dto.VideoCallbackRequest;
import com.insightreel.pipeline.dto.VideoFromScriptRequest;
import com.insightreel.pipeline.dto.VideoGenerationDto;
import com.insightreel.pipeline.exception.InvalidVideoRequestException;
import com.insightreel.pipeline.service.video.AvatarVideoService;
import com.insightreel.pipeline.service.video.ResearchToVideoService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * VideoGenerationController 단위 테스트
 */
@WebFluxTest(VideoGenerationController.class)
@ActiveProfiles("test")
class VideoGenerationControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private AvatarVideoService avatarVideoService;

    @MockBean
    private ResearchToVideoService researchToVideoService;

    @Nested
    @DisplayName("POST /api/v1/videos/callback")
    class Callback {

        @Test
        @DisplayName("토큰이 틀리면 401을 반환하고 상태를 바꾸지 않는다")
        void rejectsBadToken() {
            webTestClient.post()
                    .uri("/api/v1/videos/callback")
                    .header("X-Callback-Token", "wrong")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("providerJobId", "hg_1", "status", "completed"))
                    .exchange()
                    .expectStatus().isUnauthorized()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("Invalid callback token");

            verify(avatarVideoService, never()).handleCallback(any());
        }

        @Test
        @DisplayName("본문의 토큰도 인정하고 적용 여부를 돌려준다")
        void acceptsBodyToken() {
            when(avatarVideoService.handleCallback(any(VideoCallbackRequest.class))).thenReturn(true);

            webTestClient.post()
                    .uri("/api/v1/videos/callback")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of(
                            "providerJobId", "hg_1",
                            "status", "completed",
                            "assetUrl", "https://cdn/v.mp4",
                            "callbackToken", "test-token"))
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.status").isEqualTo("received")
                    .jsonPath("$.applied").isEqualTo(true);
        }
    }

    @Nested
    @DisplayName("POST /api/v1/videos/script")
    class FromScript {

        @Test
        @DisplayName("생성 요청은 202와 QUEUED 상태를 반환한다")
        void acceptsScript() {
            when(avatarVideoService.createVideoFromScript(any(VideoFromScriptRequest.class)))
                    .thenReturn(VideoGenerationDto.builder().videoId("vid_1").status("QUEUED").build());

            webTestClient.post()
                    .uri("/api/v1/videos/script")
                    .header("X-User-Id", "user-1")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("content", "Three things changed this week.", "avatarProfileId", "avatar_1"))
                    .exchange()
                    .expectStatus().isAccepted()
                    .expectBody()
                    .jsonPath("$.videoId").isEqualTo("vid_1")
                    .jsonPath("$.status").isEqualTo("QUEUED");
        }

        @Test
        @DisplayName("본문이 비어 있으면 400")
        void rejectsMissingContent() {
            webTestClient.post()
                    .uri("/api/v1/videos/script")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("avatarProfileId", "avatar_1"))
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("VALIDATION_ERROR");
        }

        @Test
        @DisplayName("등급에 없는 아바타는 400")
        void rejectsAvatarOutsideTier() {
            when(avatarVideoService.createVideoFromScript(any(VideoFromScriptRequest.class)))
                    .thenThrow(new InvalidVideoRequestException("Avatar profile avatar_pro is not available for tier FREE"));

            webTestClient.post()
                    .uri("/api/v1/videos/script")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(Map.of("content", "Three things changed.", "avatarProfileId", "avatar_pro"))
                    .exchange()
                    .expectStatus().isBadRequest();
        }
    }

    @Test
    @DisplayName("없는 영상 조회는 404")
    void unknownVideoIsNotFound() {
        when(avatarVideoService.getVideo("missing"))
                .thenThrow(new IllegalArgumentException("Video generation not found: missing"));

        webTestClient.get()
                .uri("/api/v1/videos/missing")
                .exchange()
                .expectStatus().isNotFound();
    }
}
