package com.insightreel.pipeline.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightreel.pipeline.dto.PlatformResponse;
import com.insightreel.pipeline.entity.SocialPlatform;
import com.insightreel.pipeline.exception.PermanentExternalException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * AyrshareClient 응답 파싱 테스트
 */
class AyrshareClientTest {

    private final AyrshareClient client = new AyrshareClient(WebClient.create());

    @Test
    @DisplayName("postIds와 errors를 플랫폼별 응답으로 펼친다")
    void parsesSuccessesAndErrors() throws Exception {
        String body = """
                {
                  "status": "error",
                  "postIds": [
                    {"platform": "twitter", "status": "success", "id": "123", "postUrl": "https://x.com/i/123"}
                  ],
                  "errors": [
                    {"platform": "linkedin", "message": "Token expired", "code": 156}
                  ]
                }
                """;

        List<PlatformResponse> responses = client.parseResponse(new ObjectMapper().readTree(body));

        assertThat(responses).hasSize(2);
        assertThat(responses.get(0).isSuccess()).isTrue();
        assertThat(responses.get(0).postId()).isEqualTo("123");
        assertThat(responses.get(1).platform()).isEqualTo("linkedin");
        assertThat(responses.get(1).isSuccess()).isFalse();
        assertThat(responses.get(1).errorMessage()).isEqualTo("Token expired");
    }

    @Test
    @DisplayName("API 키가 없으면 호출하지 않고 영구적 오류")
    void missingKeyIsPermanent() {
        assertThatThrownBy(() -> client.publish("hi", List.of(SocialPlatform.TWITTER), null, null))
                .isInstanceOf(PermanentExternalException.class);
    }
}
