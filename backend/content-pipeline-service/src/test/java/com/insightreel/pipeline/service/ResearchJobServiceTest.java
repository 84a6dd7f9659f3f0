package com.insightreel.pipeline.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightreel.pipeline.client.LanguageAnalysisProvider;
import com.insightreel.pipeline.client.SourceDataProvider;
import com.insightreel.pipeline.config.PipelineProperties;
import com.insightreel.pipeline.dto.AnalysisResult;
import com.insightreel.pipeline.dto.RawDataset;
import com.insightreel.pipeline.dto.ResearchJobRequest;
import com.insightreel.pipeline.entity.AnalysisDepth;
import com.insightreel.pipeline.entity.ResearchJob;
import com.insightreel.pipeline.entity.ResearchPhase;
import com.insightreel.pipeline.entity.ResearchSource;
import com.insightreel.pipeline.exception.PermanentExternalException;
import com.insightreel.pipeline.exception.PipelineException;
import com.insightreel.pipeline.exception.StateConflictException;
import com.insightreel.pipeline.exception.TransientExternalException;
import com.insightreel.pipeline.mapper.EntityMapper;
import com.insightreel.pipeline.repository.ResearchJobRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ConcurrentTaskExecutor;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * ResearchJobService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class ResearchJobServiceTest {

    @Mock
    private ResearchJobRepository researchJobRepository;

    @Mock
    private SourceDataProvider sourceDataProvider;

    @Mock
    private LanguageAnalysisProvider analysisProvider;

    @Mock
    private PipelineEventPublisher eventPublisher;

    private PipelineProperties properties;
    private SimpleMeterRegistry meterRegistry;
    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        properties = new PipelineProperties();
        properties.getRetry().setMaxAttempts(3);
        properties.getRetry().setBaseBackoff(Duration.ofMillis(1));
        properties.getRetry().setMaxBackoff(Duration.ofMillis(5));
        meterRegistry = new SimpleMeterRegistry();
        objectMapper = new ObjectMapper().findAndRegisterModules();
    }

    private ResearchJobService service(AsyncTaskExecutor executor) {
        return new ResearchJobService(
                researchJobRepository,
                sourceDataProvider,
                analysisProvider,
                new ExternalCallExecutor(properties),
                new ResearchRelevanceRanker(properties),
                eventPublisher,
                new PipelineMetrics(meterRegistry),
                properties,
                new EntityMapper(objectMapper),
                objectMapper,
                executor);
    }

    private static AsyncTaskExecutor synchronousExecutor() {
        return new ConcurrentTaskExecutor(Runnable::run);
    }

    private static ResearchJobRequest request(String source, String query) {
        return ResearchJobRequest.builder().source(source).query(query).userId("user-1").build();
    }

    private static RawDataset dataset(String query, int size) {
        List<Map<String, Object>> items = new java.util.ArrayList<>();
        for (int i = 0; i < size; i++) {
            items.add(Map.of("title", "post " + i));
        }
        return new RawDataset(ResearchSource.REDDIT, query, items, LocalDateTime.now());
    }

    private double terminalCount(ResearchPhase phase) {
        return meterRegistry.counter("pipeline.research.terminal", "phase", phase.name()).count();
    }

    @Nested
    @DisplayName("작업 시작과 중복 제거")
    class StartTests {

        @Test
        @DisplayName("같은 소스와 쿼리로 두 번 시작하면 같은 작업 ID를 반환한다")
        void duplicateStartReturnsSameJob() {
            // given: executor that never runs the job, so it stays in flight
            AsyncTaskExecutor idle = mock(AsyncTaskExecutor.class);
            ResearchJobService service = service(idle);

            // when
            String first = service.startJob(request("reddit", "AI tools"));
            String second = service.startJob(request("REDDIT", "  ai   TOOLS "));

            // then
            assertThat(second).isEqualTo(first);
            assertThat(service.isRunning(first)).isTrue();
            verify(researchJobRepository, times(1)).save(any(ResearchJob.class));
            verify(idle, times(1)).submit(any(Runnable.class));
        }

        @Test
        @DisplayName("다른 쿼리는 별도의 작업이 된다")
        void differentQueriesAreSeparateJobs() {
            ResearchJobService service = service(mock(AsyncTaskExecutor.class));

            String first = service.startJob(request("reddit", "AI tools"));
            String second = service.startJob(request("reddit", "robotics"));

            assertThat(second).isNotEqualTo(first);
        }

        @Test
        @DisplayName("DB에 RAW 상태로 남은 작업이 있으면 그 ID를 반환한다")
        void persistedRawJobIsJoined() {
            ResearchJob existing = ResearchJob.builder().id("rjob_existing").phase(ResearchPhase.RAW).build();
            when(researchJobRepository.findFirstByDedupKeyAndPhaseOrderByCreatedAtDesc("REDDIT:ai tools", ResearchPhase.RAW))
                    .thenReturn(Optional.of(existing));
            ResearchJobService service = service(mock(AsyncTaskExecutor.class));

            assertThat(service.startJob(request("reddit", "AI tools"))).isEqualTo("rjob_existing");
            verify(researchJobRepository, never()).save(any());
        }

        @Test
        @DisplayName("알 수 없는 소스와 빈 쿼리는 거부된다")
        void invalidRequestsAreRejected() {
            ResearchJobService service = service(mock(AsyncTaskExecutor.class));

            assertThatThrownBy(() -> service.startJob(request("myspace", "AI tools")))
                    .isInstanceOf(PipelineException.class)
                    .extracting("errorCode").isEqualTo("INVALID_REQUEST");
            assertThatThrownBy(() -> service.startJob(request("reddit", "   ")))
                    .isInstanceOf(PipelineException.class);
        }
    }

    @Nested
    @DisplayName("실행")
    class ExecutionTests {

        @Test
        @DisplayName("수집과 분석이 성공하면 ANALYZED로 전이하고 분석 결과를 저장한다")
        void successfulRunCompletesAnalysis() throws Exception {
            // given
            RawDataset raw = dataset("AI tools", 3);
            AnalysisResult analysis = AnalysisResult.builder()
                    .insights(List.of("X grew 300%"))
                    .relevanceScore(80.0)
                    .build();
            when(sourceDataProvider.collect(eq(ResearchSource.REDDIT), eq("AI tools"), anyInt())).thenReturn(raw);
            when(researchJobRepository.storeRawData(anyString(), anyString(), any(LocalDateTime.class))).thenReturn(1);
            when(analysisProvider.analyze(any(RawDataset.class), eq(AnalysisDepth.STANDARD))).thenReturn(analysis);
            when(researchJobRepository.completeAnalysis(anyString(), anyString(), anyDouble(), any(LocalDateTime.class)))
                    .thenReturn(1);
            ResearchJobService service = service(synchronousExecutor());

            // when
            String jobId = service.startJob(request("reddit", "AI tools"));

            // then
            ArgumentCaptor<String> stored = ArgumentCaptor.forClass(String.class);
            verify(researchJobRepository).completeAnalysis(eq(jobId), stored.capture(), eq(80.0), any(LocalDateTime.class));
            AnalysisResult saved = objectMapper.readValue(stored.getValue(), AnalysisResult.class);
            assertThat(saved.getInsights()).containsExactly("X grew 300%");
            assertThat(saved.getTopic()).isEqualTo("AI tools");
            verify(researchJobRepository, never()).failJob(anyString(), anyString(), any(LocalDateTime.class));
            verify(eventPublisher).researchJobFinished(eq(jobId), eq("ANALYZED"), eq("user-1"), anyString());
            assertThat(terminalCount(ResearchPhase.ANALYZED)).isEqualTo(1.0);
            assertThat(service.isRunning(jobId)).isFalse();
        }

        @Test
        @DisplayName("수집 결과가 비어 있으면 분석 없이 FAILED")
        void emptyDatasetFailsJob() {
            when(sourceDataProvider.collect(any(), anyString(), anyInt())).thenReturn(dataset("AI tools", 0));
            when(researchJobRepository.failJob(anyString(), anyString(), any(LocalDateTime.class))).thenReturn(1);
            ResearchJobService service = service(synchronousExecutor());

            String jobId = service.startJob(request("reddit", "AI tools"));

            verify(researchJobRepository).failJob(eq(jobId), eq(ResearchJobService.NO_ITEMS_MESSAGE), any(LocalDateTime.class));
            verify(researchJobRepository, never()).storeRawData(anyString(), anyString(), any(LocalDateTime.class));
            verifyNoInteractions(analysisProvider);
            assertThat(terminalCount(ResearchPhase.FAILED)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("일시적 수집 오류는 재시도한다")
        void transientCollectFailureIsRetried() {
            when(sourceDataProvider.collect(any(), anyString(), anyInt()))
                    .thenThrow(new TransientExternalException("HTTP 503 from collector", 503))
                    .thenReturn(dataset("AI tools", 2));
            when(researchJobRepository.storeRawData(anyString(), anyString(), any(LocalDateTime.class))).thenReturn(1);
            when(analysisProvider.analyze(any(), any())).thenReturn(
                    AnalysisResult.builder().insights(List.of("one", "two")).build());
            when(researchJobRepository.completeAnalysis(anyString(), anyString(), anyDouble(), any(LocalDateTime.class)))
                    .thenReturn(1);
            ResearchJobService service = service(synchronousExecutor());

            String jobId = service.startJob(request("reddit", "AI tools"));

            verify(sourceDataProvider, times(2)).collect(any(), anyString(), anyInt());
            // two insights, no analyzer score: 10 points each
            verify(researchJobRepository).completeAnalysis(eq(jobId), anyString(), eq(20.0), any(LocalDateTime.class));
        }

        @Test
        @DisplayName("영구적 분석 오류는 재시도 없이 FAILED")
        void permanentAnalyzeFailureFailsJob() {
            when(sourceDataProvider.collect(any(), anyString(), anyInt())).thenReturn(dataset("AI tools", 2));
            when(researchJobRepository.storeRawData(anyString(), anyString(), any(LocalDateTime.class))).thenReturn(1);
            when(analysisProvider.analyze(any(), any()))
                    .thenThrow(new PermanentExternalException("HTTP 401: invalid key", 401));
            when(researchJobRepository.failJob(anyString(), anyString(), any(LocalDateTime.class))).thenReturn(1);
            ResearchJobService service = service(synchronousExecutor());

            String jobId = service.startJob(request("reddit", "AI tools"));

            verify(analysisProvider, times(1)).analyze(any(), any());
            verify(researchJobRepository).failJob(eq(jobId), contains("invalid key"), any(LocalDateTime.class));
            verify(researchJobRepository, never()).completeAnalysis(anyString(), anyString(), anyDouble(), any(LocalDateTime.class));
        }

        @Test
        @DisplayName("이미 종료된 작업에 대한 실패 기록은 무시된다")
        void lostFailureRaceHasNoSideEffects() {
            when(sourceDataProvider.collect(any(), anyString(), anyInt())).thenReturn(dataset("AI tools", 0));
            when(researchJobRepository.failJob(anyString(), anyString(), any(LocalDateTime.class))).thenReturn(0);
            ResearchJobService service = service(synchronousExecutor());

            service.startJob(request("reddit", "AI tools"));

            verifyNoInteractions(eventPublisher);
            assertThat(terminalCount(ResearchPhase.FAILED)).isZero();
        }
    }

    @Nested
    @DisplayName("조회와 취소")
    class QueryTests {

        @Test
        @DisplayName("ANALYZED가 아닌 작업의 분석 결과는 조회할 수 없다")
        void analysisRequiresAnalyzedPhase() {
            ResearchJob raw = ResearchJob.builder().id("rjob_1").phase(ResearchPhase.RAW).build();

            assertThatThrownBy(() -> service(mock(AsyncTaskExecutor.class)).getAnalysis(raw))
                    .isInstanceOf(StateConflictException.class);
        }

        @Test
        @DisplayName("종료된 작업은 취소할 수 없다")
        void terminalJobCannotBeCancelled() {
            ResearchJob done = ResearchJob.builder().id("rjob_1").phase(ResearchPhase.ANALYZED).build();
            when(researchJobRepository.findById("rjob_1")).thenReturn(Optional.of(done));

            assertThatThrownBy(() -> service(mock(AsyncTaskExecutor.class)).cancelJob("rjob_1"))
                    .isInstanceOf(StateConflictException.class);
        }

        @Test
        @DisplayName("오래된 RAW 작업은 기동 시 FAILED, 나머지는 재개된다")
        void reconcileAbandonsStaleAndResumesFresh() {
            ResearchJob stale = ResearchJob.builder().id("rjob_old").source(ResearchSource.REDDIT)
                    .configRef("old").dedupKey("REDDIT:old").phase(ResearchPhase.RAW)
                    .createdAt(LocalDateTime.now().minusHours(5)).build();
            ResearchJob fresh = ResearchJob.builder().id("rjob_new").source(ResearchSource.REDDIT)
                    .configRef("new").dedupKey("REDDIT:new").phase(ResearchPhase.RAW)
                    .createdAt(LocalDateTime.now().minusMinutes(5)).build();
            when(researchJobRepository.findByPhaseOrderByCreatedAtAsc(ResearchPhase.RAW)).thenReturn(List.of(stale, fresh));
            when(researchJobRepository.failJob(eq("rjob_old"), anyString(), any(LocalDateTime.class))).thenReturn(1);
            AsyncTaskExecutor idle = mock(AsyncTaskExecutor.class);
            ResearchJobService service = service(idle);

            service.reconcileOnStartup();

            verify(researchJobRepository).failJob(eq("rjob_old"), eq(ResearchJobService.STALE_MESSAGE), any(LocalDateTime.class));
            verify(idle, times(1)).submit(any(Runnable.class));
            assertThat(service.isRunning("rjob_new")).isTrue();
        }


        @Test
        @DisplayName("주기 점검은 이 프로세스에서 실행 중이지 않은 오래된 RAW 작업만 FAILED로 만든다")
        void sweepFailsOnlyOrphanedStaleJobs() {
            // given
            ResearchJob running = ResearchJob.builder().id("rjob_run").source(ResearchSource.REDDIT)
                    .configRef("run").dedupKey("REDDIT:run").phase(ResearchPhase.RAW)
                    .createdAt(LocalDateTime.now().minusMinutes(1)).build();
            ResearchJob orphan = ResearchJob.builder().id("rjob_orphan").source(ResearchSource.REDDIT)
                    .configRef("orphan").dedupKey("REDDIT:orphan").phase(ResearchPhase.RAW)
                    .createdAt(LocalDateTime.now().minusHours(5)).build();
            when(researchJobRepository.findByPhaseOrderByCreatedAtAsc(ResearchPhase.RAW)).thenReturn(List.of(running));
            ResearchJobService service = service(mock(AsyncTaskExecutor.class));
            service.reconcileOnStartup();

            when(researchJobRepository.findByPhaseAndCreatedAtBefore(eq(ResearchPhase.RAW), any(LocalDateTime.class)))
                    .thenReturn(List.of(running, orphan));
            when(researchJobRepository.failJob(eq("rjob_orphan"), anyString(), any(LocalDateTime.class))).thenReturn(1);

            // when
            service.sweepStaleJobs();

            // then
            verify(researchJobRepository).failJob(eq("rjob_orphan"), eq(ResearchJobService.STALE_MESSAGE), any(LocalDateTime.class));
            verify(researchJobRepository, never()).failJob(eq("rjob_run"), anyString(), any(LocalDateTime.class));
            assertThat(terminalCount(ResearchPhase.FAILED)).isEqualTo(1.0);
        }

        @Test
        @DisplayName("점검 기준 시각은 현재에서 만료 임계값을 뺀 시각이다")
        void sweepUsesStalenessThreshold() {
            properties.getResearch().setStalenessThreshold(Duration.ofHours(2));
            LocalDateTime before = LocalDateTime.now();

            service(mock(AsyncTaskExecutor.class)).sweepStaleJobs();

            ArgumentCaptor<LocalDateTime> cutoff = ArgumentCaptor.forClass(LocalDateTime.class);
            verify(researchJobRepository).findByPhaseAndCreatedAtBefore(eq(ResearchPhase.RAW), cutoff.capture());
            assertThat(cutoff.getValue()).isBetween(before.minusHours(2), LocalDateTime.now().minusHours(2));
        }
    }
}
