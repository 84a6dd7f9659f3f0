package com.insightreel.pipeline;

import com.insightreel.pipeline.client.AvatarRenderProvider;
import com.insightreel.pipeline.client.LanguageAnalysisProvider;
import com.insightreel.pipeline.client.MultiPlatformPublisher;
import com.insightreel.pipeline.client.SourceDataProvider;
import com.insightreel.pipeline.dto.AnalysisResult;
import com.insightreel.pipeline.dto.RawDataset;
import com.insightreel.pipeline.dto.RenderStatus;
import com.insightreel.pipeline.dto.ResearchJobDto;
import com.insightreel.pipeline.dto.ResearchJobRequest;
import com.insightreel.pipeline.dto.VideoGenerationDto;
import com.insightreel.pipeline.entity.ResearchSource;
import com.insightreel.pipeline.repository.AvatarProfileRepository;
import com.insightreel.pipeline.service.ResearchJobService;
import com.insightreel.pipeline.service.video.AvatarVideoService;
import com.insightreel.pipeline.service.video.ResearchToVideoService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * 스프링 컨텍스트 로드 및 리서치 -> 영상 전체 흐름 테스트
 * 외부 제공자(수집, 분석, 렌더링, 게시)만 목으로 대체합니다.
 */
@SpringBootTest
@ActiveProfiles("test")
class ContentPipelineApplicationTests {

    @MockBean
    private SourceDataProvider sourceDataProvider;

    @MockBean
    private LanguageAnalysisProvider analysisProvider;

    @MockBean
    private AvatarRenderProvider renderProvider;

    @MockBean
    private MultiPlatformPublisher publisher;

    @Autowired
    private ResearchJobService researchJobService;

    @Autowired
    private ResearchToVideoService researchToVideoService;

    @Autowired
    private AvatarVideoService avatarVideoService;

    @Autowired
    private AvatarProfileRepository avatarProfileRepository;

    @Test
    void contextLoads() {
        // 시드된 아바타 프로필 확인
        assertThat(avatarProfileRepository.existsById("avatar_1")).isTrue();
    }

    @Test
    @DisplayName("리서치 작업이 분석되고, 그 결과로 만든 영상이 완료된다")
    void researchToCompletedVideo() throws InterruptedException {
        // given
        when(sourceDataProvider.collect(eq(ResearchSource.REDDIT), anyString(), anyInt()))
                .thenReturn(new RawDataset(ResearchSource.REDDIT, "ai tools",
                        List.of(Map.of("title", "New AI editor", "score", 1200)), LocalDateTime.now()));
        when(analysisProvider.analyze(any(RawDataset.class), any()))
                .thenReturn(AnalysisResult.builder()
                        .topic("ai tools")
                        .insights(List.of("AI coding assistants grew 300% in discussion volume",
                                "Developers prefer tools that run locally"))
                        .recommendations(List.of("Publish short comparison videos of popular assistants"))
                        .relevanceScore(80.0)
                        .build());
        when(renderProvider.submitRender(any())).thenReturn("hg_1");
        when(renderProvider.getStatus("hg_1"))
                .thenReturn(RenderStatus.processing())
                .thenReturn(new RenderStatus(RenderStatus.State.COMPLETED,
                        "https://cdn.example.com/v.mp4", null, 30.0, null));

        // when
        String jobId = researchJobService.startJob(ResearchJobRequest.builder()
                .source("reddit")
                .query("AI tools")
                .userId("user-1")
                .build());
        ResearchJobDto job = await(() -> researchJobService.getJob(jobId), j -> "ANALYZED".equals(j.getPhase()));

        String videoId = researchToVideoService.createVideoFromResearchJob(jobId, "avatar_1");
        VideoGenerationDto video = await(() -> avatarVideoService.getVideo(videoId), v -> "COMPLETED".equals(v.getStatus()));

        // then
        assertThat(job.getRelevanceScore()).isNotNull();
        assertThat(video.getResearchJobId()).isEqualTo(jobId);
        assertThat(video.getProviderJobId()).isEqualTo("hg_1");
        assertThat(video.getAssetUrl()).isEqualTo("https://cdn.example.com/v.mp4");
        assertThat(video.getScriptTitle()).isEqualTo("Reddit Research Insights - AI tools");
        assertThat(video.getScriptContent()).contains("AI coding assistants grew 300% in discussion volume");
    }

    private static <T> T await(Supplier<T> supplier, Predicate<T> done) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        T value = supplier.get();
        while (!done.test(value) && System.nanoTime() < deadline) {
            Thread.sleep(50);
            value = supplier.get();
        }
        assertThat(done.test(value)).as("condition reached before timeout, last value: %s", value).isTrue();
        return value;
    }
}
