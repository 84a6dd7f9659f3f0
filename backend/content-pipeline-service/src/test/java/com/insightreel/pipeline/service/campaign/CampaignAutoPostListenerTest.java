package com.insightreel.pipeline.service.campaign;

import com.insightreel.pipeline.dto.PublishRequest;
import com.insightreel.pipeline.dto.PublishResultDto;
import com.insightreel.pipeline.entity.Campaign;
import com.insightreel.pipeline.entity.SocialPlatform;
import com.insightreel.pipeline.entity.VideoStatus;
import com.insightreel.pipeline.repository.CampaignRepository;
import com.insightreel.pipeline.service.publish.PublishService;
import com.insightreel.pipeline.service.video.VideoTerminalEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * CampaignAutoPostListener 단위 테스트
 */
@ExtendWith(MockitoExtension.class)
class CampaignAutoPostListenerTest {

    @Mock
    private CampaignRepository campaignRepository;

    @Mock
    private PublishService publishService;

    @Mock
    private VideoApprovalService approvalService;

    private CampaignAutoPostListener listener;

    @BeforeEach
    void setUp() {
        listener = new CampaignAutoPostListener(campaignRepository, publishService, approvalService);
    }

    private static VideoTerminalEvent completed(Long campaignId) {
        return new VideoTerminalEvent("vid_1", VideoStatus.COMPLETED, "https://cdn/v.mp4", null, campaignId,
                "user-1", "Reddit Research Insights - AI tools", "1. X grew 300%.");
    }

    @Test
    @DisplayName("자동 게시가 켜진 캠페인의 완료 영상을 게시한다")
    void postsCompletedCampaignVideo() {
        // given
        Campaign campaign = Campaign.builder()
                .id(3L)
                .autoPostEnabled(true)
                .postPlatforms(new LinkedHashSet<>(List.of(SocialPlatform.TWITTER, SocialPlatform.LINKEDIN)))
                .build();
        when(campaignRepository.findById(3L)).thenReturn(Optional.of(campaign));
        when(publishService.publishAndAggregate(any())).thenReturn(
                PublishResultDto.builder().overallStatus("SUCCESS").build());

        // when
        listener.onVideoTerminal(completed(3L));

        // then
        ArgumentCaptor<PublishRequest> request = ArgumentCaptor.forClass(PublishRequest.class);
        verify(publishService).publishAndAggregate(request.capture());
        assertThat(request.getValue().getPlatforms()).containsExactly("twitter", "linkedin");
        assertThat(request.getValue().getMediaUrl()).isEqualTo("https://cdn/v.mp4");
        assertThat(request.getValue().getVideoGenerationId()).isEqualTo("vid_1");
        assertThat(request.getValue().getContent()).startsWith("Reddit Research Insights - AI tools\n\n1. X grew");
        verifyNoInteractions(approvalService);
    }

    @Test
    @DisplayName("자동 게시가 꺼진 캠페인의 완료 영상은 게시하지 않고 승인 대기로 보낸다")
    void queuesForApprovalWhenAutoPostIsOff() {
        // given
        when(campaignRepository.findById(3L)).thenReturn(Optional.of(Campaign.builder()
                .id(3L)
                .postPlatforms(new LinkedHashSet<>(List.of(SocialPlatform.TWITTER)))
                .build()));

        // when
        listener.onVideoTerminal(completed(3L));

        // then
        verify(approvalService).requestApproval("vid_1");
        verifyNoInteractions(publishService);
    }

    @Test
    @DisplayName("실패했거나 캠페인 밖의 영상은 게시도 승인 대기도 하지 않는다")
    void skipsFailedAndStandaloneVideos() {
        listener.onVideoTerminal(new VideoTerminalEvent("vid_2", VideoStatus.FAILED, null, "boom", 3L,
                "user-1", "t", "b"));
        listener.onVideoTerminal(completed(null));

        verifyNoInteractions(publishService, approvalService, campaignRepository);
    }

    @Test
    @DisplayName("캡션 본문은 단어 경계에서 잘린다")
    void captionIsCutAtWordBoundary() {
        String longBody = "word ".repeat(100);
        VideoTerminalEvent event = new VideoTerminalEvent("vid_1", VideoStatus.COMPLETED, "u", null, 1L,
                "user-1", "Title", longBody);

        String caption = CampaignAutoPostListener.buildCaption(event);

        assertThat(caption).startsWith("Title\n\nword word").endsWith("...");
        assertThat(caption.length()).isLessThanOrEqualTo("Title\n\n".length() + 203);
    }
}
