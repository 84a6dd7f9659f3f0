package com.insightreel.pipeline.service.campaign;

import com.insightreel.pipeline.config.PipelineProperties;
import com.insightreel.pipeline.dto.CampaignRunReport;
import com.insightreel.pipeline.dto.CampaignTickReport;
import com.insightreel.pipeline.dto.ScriptDraft;
import com.insightreel.pipeline.dto.VideoOptions;
import com.insightreel.pipeline.entity.AspectRatio;
import com.insightreel.pipeline.entity.Campaign;
import com.insightreel.pipeline.entity.CampaignFrequency;
import com.insightreel.pipeline.entity.ResearchJob;
import com.insightreel.pipeline.entity.ResearchPhase;
import com.insightreel.pipeline.entity.ResearchSource;
import com.insightreel.pipeline.exception.InsufficientContentException;
import com.insightreel.pipeline.repository.CampaignRepository;
import com.insightreel.pipeline.repository.ResearchJobRepository;
import com.insightreel.pipeline.repository.VideoGenerationRepository;
import com.insightreel.pipeline.service.video.AvatarVideoService;
import com.insightreel.pipeline.service.video.ResearchToVideoService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * CampaignRunService 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class CampaignRunServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2026, 3, 2, 9, 0);

    @Mock
    private CampaignRepository campaignRepository;

    @Mock
    private ResearchJobRepository researchJobRepository;

    @Mock
    private VideoGenerationRepository videoRepository;

    @Mock
    private ResearchToVideoService researchToVideoService;

    @Mock
    private AvatarVideoService avatarVideoService;

    private CampaignRunService runService;

    @BeforeEach
    void setUp() {
        runService = new CampaignRunService(campaignRepository, researchJobRepository, videoRepository,
                researchToVideoService, avatarVideoService, new PipelineProperties());
    }

    private static Campaign campaign() {
        return Campaign.builder()
                .id(1L)
                .userId("user-1")
                .name("AI daily")
                .researchConfigRef("AI tools")
                .avatarProfileId("avatar_1")
                .aspectRatio(AspectRatio.PORTRAIT)
                .frequency(CampaignFrequency.DAILY)
                .maxItemsPerRun(3)
                .active(true)
                .lastRunAt(NOW.minusDays(1))
                .nextRunAt(NOW)
                .build();
    }

    private static List<ResearchJob> analyzedJobs(int count) {
        List<ResearchJob> jobs = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            jobs.add(ResearchJob.builder()
                    .id("rjob_" + i)
                    .source(ResearchSource.REDDIT)
                    .configRef("AI tools")
                    .phase(ResearchPhase.ANALYZED)
                    .relevanceScore(10.0 * i)
                    .createdAt(NOW.minusHours(i + 1))
                    .build());
        }
        return jobs;
    }

    private void claimSucceeds() {
        when(campaignRepository.claimRun(eq(1L), eq(NOW), eq(NOW), eq(NOW.plusDays(1)))).thenReturn(1);
    }

    private void submissionsSucceed() {
        when(researchToVideoService.draftFor(any(ResearchJob.class)))
                .thenAnswer(inv -> new ScriptDraft("t", "body of " + ((ResearchJob) inv.getArgument(0)).getId()));
        when(avatarVideoService.submit(any(ScriptDraft.class), eq("avatar_1"), eq(AspectRatio.PORTRAIT), any(VideoOptions.class)))
                .thenAnswer(inv -> "vid_for_" + ((VideoOptions) inv.getArgument(3)).researchJobId());
    }

    @Test
    @DisplayName("후보 10개 중 관련도 상위 3개만 제출하고, 재실행해도 같은 3개를 고른다")
    void selectsTopRankedDeterministically() {
        // given
        claimSucceeds();
        submissionsSucceed();
        List<ResearchJob> jobs = analyzedJobs(10);
        Collections.shuffle(jobs);
        when(researchJobRepository.findCandidates(ResearchPhase.ANALYZED, "AI tools", NOW.minusDays(1), NOW))
                .thenReturn(jobs);

        // when
        CampaignRunReport first = runService.runCampaign(campaign(), NOW).orElseThrow();
        Collections.shuffle(jobs);
        CampaignRunReport replay = runService.runCampaign(campaign(), NOW).orElseThrow();

        // then
        assertThat(first.getSubmittedVideoIds()).containsExactly("vid_for_rjob_9", "vid_for_rjob_8", "vid_for_rjob_7");
        assertThat(replay.getSubmittedVideoIds()).isEqualTo(first.getSubmittedVideoIds());
        assertThat(first.getCandidates()).isEqualTo(10);
        verify(campaignRepository, times(2)).addGenerated(1L, 3);
    }

    @Test
    @DisplayName("후보가 없어도 다음 실행 시각은 전진한다")
    void zeroCandidatesStillAdvances() {
        claimSucceeds();
        when(researchJobRepository.findCandidates(any(), anyString(), any(), any())).thenReturn(List.of());

        CampaignRunReport report = runService.runCampaign(campaign(), NOW).orElseThrow();

        assertThat(report.submittedCount()).isZero();
        assertThat(report.getNextRunAt()).isEqualTo(NOW.plusDays(1));
        verify(campaignRepository).claimRun(1L, NOW, NOW, NOW.plusDays(1));
        verify(campaignRepository, never()).addGenerated(anyLong(), anyInt());
        verifyNoInteractions(avatarVideoService);
    }

    @Test
    @DisplayName("내용이 부족한 항목은 건너뛰고 나머지는 제출한다")
    void insufficientContentIsSkipped() {
        claimSucceeds();
        submissionsSucceed();
        List<ResearchJob> jobs = analyzedJobs(3);
        when(researchJobRepository.findCandidates(any(), anyString(), any(), any())).thenReturn(jobs);
        when(researchToVideoService.draftFor(jobs.get(2)))
                .thenThrow(new InsufficientContentException("too short", 90, 150));

        CampaignRunReport report = runService.runCampaign(campaign(), NOW).orElseThrow();

        assertThat(report.getSkipped()).extracting(CampaignRunReport.ItemOutcome::researchJobId)
                .containsExactly("rjob_2");
        assertThat(report.submittedCount()).isEqualTo(2);
        verify(campaignRepository).addGenerated(1L, 2);
    }

    @Test
    @DisplayName("제출 오류는 실패로 기록되고 실행을 멈추지 않는다")
    void submissionErrorIsRecordedAsFailure() {
        claimSucceeds();
        when(researchJobRepository.findCandidates(any(), anyString(), any(), any())).thenReturn(analyzedJobs(2));
        when(researchToVideoService.draftFor(any(ResearchJob.class))).thenReturn(new ScriptDraft("t", "b"));
        when(avatarVideoService.submit(any(), anyString(), any(), any()))
                .thenThrow(new IllegalStateException("db down"))
                .thenReturn("vid_ok");

        CampaignRunReport report = runService.runCampaign(campaign(), NOW).orElseThrow();

        assertThat(report.getFailed()).hasSize(1);
        assertThat(report.getSubmittedVideoIds()).containsExactly("vid_ok");
    }

    @Test
    @DisplayName("다른 틱이 먼저 선점하면 아무것도 하지 않는다")
    void lostClaimDoesNothing() {
        when(campaignRepository.claimRun(any(), any(), any(), any())).thenReturn(0);

        assertThat(runService.runCampaign(campaign(), NOW)).isEmpty();
        verifyNoInteractions(researchJobRepository, avatarVideoService);
    }

    @Test
    @DisplayName("아직 때가 아닌 캠페인은 건드리지 않는다")
    void notDueIsIgnored() {
        Campaign later = campaign();
        later.setNextRunAt(NOW.plusHours(1));

        assertThat(runService.runCampaign(later, NOW)).isEmpty();
        verifyNoInteractions(campaignRepository);
    }

    @Test
    @DisplayName("일일 할당량을 다 쓰면 선택 없이 전진하고 사유를 남긴다")
    void dailyQuotaLimitsSelection() {
        claimSucceeds();
        Campaign capped = campaign();
        capped.setMaxVideosPerDay(5);
        when(researchJobRepository.findCandidates(any(), anyString(), any(), any())).thenReturn(analyzedJobs(4));
        when(videoRepository.countByUserIdAndCreatedAtBetween("user-1", NOW.toLocalDate().atStartOfDay(), NOW))
                .thenReturn(5L);

        CampaignRunReport report = runService.runCampaign(capped, NOW).orElseThrow();

        assertThat(report.getSelected()).isZero();
        assertThat(report.getNote()).isEqualTo(CampaignRunService.QUOTA_REACHED);
        verifyNoInteractions(avatarVideoService);
    }

    @Test
    @DisplayName("같은 사용자의 두 캠페인은 일일 할당량을 함께 쓴다")
    void dailyQuotaIsSharedAcrossUserCampaigns() {
        // given
        Campaign first = campaign();
        first.setMaxVideosPerDay(3);
        Campaign second = campaign();
        second.setId(2L);
        second.setMaxVideosPerDay(3);
        claimSucceeds();
        when(campaignRepository.claimRun(eq(2L), eq(NOW), eq(NOW), eq(NOW.plusDays(1)))).thenReturn(1);
        submissionsSucceed();
        when(researchJobRepository.findCandidates(any(), anyString(), any(), any())).thenReturn(analyzedJobs(4));
        // the first campaign's two submissions are visible to the second one's count
        when(videoRepository.countByUserIdAndCreatedAtBetween("user-1", NOW.toLocalDate().atStartOfDay(), NOW))
                .thenReturn(1L, 3L);

        // when
        CampaignRunReport firstRun = runService.runCampaign(first, NOW).orElseThrow();
        CampaignRunReport secondRun = runService.runCampaign(second, NOW).orElseThrow();

        // then
        assertThat(firstRun.submittedCount()).isEqualTo(2);
        assertThat(secondRun.getSelected()).isZero();
        assertThat(secondRun.getNote()).isEqualTo(CampaignRunService.QUOTA_REACHED);
        verify(videoRepository, times(2))
                .countByUserIdAndCreatedAtBetween("user-1", NOW.toLocalDate().atStartOfDay(), NOW);
    }

    @Test
    @DisplayName("틱은 한 캠페인의 예외가 다른 캠페인을 막지 않게 한다")
    void tickIsolatesCampaignFailures() {
        Campaign broken = campaign();
        broken.setId(2L);
        when(campaignRepository.findDueCampaigns(NOW)).thenReturn(List.of(broken, campaign()));
        when(campaignRepository.claimRun(eq(2L), any(), any(), any())).thenThrow(new IllegalStateException("lock timeout"));
        claimSucceeds();
        when(researchJobRepository.findCandidates(any(), anyString(), any(), any())).thenReturn(List.of());

        CampaignTickReport report = runService.tick(NOW);

        assertThat(report.runs()).extracting(CampaignRunReport::getCampaignId).containsExactly(1L);
    }

    @Test
    @DisplayName("첫 실행은 선택 창만큼 거슬러 올라가 후보를 찾는다")
    void firstRunUsesSelectionWindow() {
        claimSucceeds();
        Campaign fresh = campaign();
        fresh.setLastRunAt(null);
        when(researchJobRepository.findCandidates(any(), anyString(), any(), any())).thenReturn(List.of());

        runService.runCampaign(fresh, NOW);

        ArgumentCaptor<LocalDateTime> since = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(researchJobRepository).findCandidates(eq(ResearchPhase.ANALYZED), eq("AI tools"), since.capture(), eq(NOW));
        assertThat(since.getValue()).isEqualTo(NOW.minusDays(1));
    }
}
