package com.insightreel.pipeline.client;

import com.insightreel.pipeline.exception.PermanentExternalException;
import com.insightreel.pipeline.exception.PipelineException;
import com.insightreel.pipeline.exception.TransientExternalException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * ExternalCallErrors 단위 테스트
 */
class ExternalCallErrorsTest {

    @Test
    @DisplayName("408, 429와 모든 5xx는 재시도 대상이고 나머지 4xx는 아니다")
    void classifiesStatuses() {
        assertThat(ExternalCallErrors.isTransientStatus(408)).isTrue();
        assertThat(ExternalCallErrors.isTransientStatus(429)).isTrue();
        assertThat(ExternalCallErrors.isTransientStatus(500)).isTrue();
        assertThat(ExternalCallErrors.isTransientStatus(503)).isTrue();
        assertThat(ExternalCallErrors.isTransientStatus(400)).isFalse();
        assertThat(ExternalCallErrors.isTransientStatus(404)).isFalse();
    }

    @Test
    @DisplayName("응답 예외는 상태 코드와 본문 일부를 담아 변환된다")
    void translatesResponseErrors() {
        // given
        WebClientResponseException unavailable = WebClientResponseException.create(
                503, "Service Unavailable", HttpHeaders.EMPTY, "try later".getBytes(StandardCharsets.UTF_8),
                StandardCharsets.UTF_8);
        WebClientResponseException badRequest = WebClientResponseException.create(
                400, "Bad Request", HttpHeaders.EMPTY, new byte[0], StandardCharsets.UTF_8);

        // when
        PipelineException transientError = ExternalCallErrors.translate("HeyGen", unavailable);
        PipelineException permanentError = ExternalCallErrors.translate("HeyGen", new RuntimeException(badRequest));

        // then
        assertThat(transientError).isInstanceOf(TransientExternalException.class)
                .hasMessage("HeyGen returned HTTP 503: try later");
        assertThat(permanentError).isInstanceOf(PermanentExternalException.class)
                .hasMessage("HeyGen returned HTTP 400");
    }
}
