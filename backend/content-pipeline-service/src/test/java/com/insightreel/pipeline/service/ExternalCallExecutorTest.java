package com.insightreel.pipeline.service;

import com.insightreel.pipeline.config.PipelineProperties;
import com.insightreel.pipeline.exception.PermanentExternalException;
import com.insightreel.pipeline.exception.TransientExternalException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ExternalCallExecutor 재시도 정책 테스트
 */
class ExternalCallExecutorTest {

    private ExternalCallExecutor executor;

    @BeforeEach
    void setUp() {
        PipelineProperties properties = new PipelineProperties();
        properties.getRetry().setMaxAttempts(3);
        properties.getRetry().setBaseBackoff(Duration.ofMillis(1));
        properties.getRetry().setMaxBackoff(Duration.ofMillis(4));
        executor = new ExternalCallExecutor(properties);
    }

    @Test
    @DisplayName("일시적 오류 후 성공하면 결과를 반환한다")
    void transientFailureThenSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.call("collect", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientExternalException("HTTP 429", 429);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("재시도 시에도 호출 안에서 블로킹 응답 대기가 가능하다")
    void retriedCallMayBlock() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.call("collect", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new TransientExternalException("HTTP 503", 503);
            }
            // same shape as the WebClient clients: block on a delayed response
            return Mono.just("ok").delayElement(Duration.ofMillis(1)).block();
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls).hasValue(2);
    }

    @Test
    @DisplayName("재시도 횟수를 넘으면 마지막 일시적 오류를 그대로 던진다")
    void exhaustedRetriesRethrowOriginal() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.call("collect", () -> {
            calls.incrementAndGet();
            throw new TransientExternalException("HTTP 503", 503);
        }))
                .isInstanceOf(TransientExternalException.class)
                .hasMessage("HTTP 503");
        assertThat(calls).hasValue(3);
    }

    @Test
    @DisplayName("영구적 오류는 재시도하지 않는다")
    void permanentFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> executor.call("analyze", () -> {
            calls.incrementAndGet();
            throw new PermanentExternalException("HTTP 401", 401);
        })).isInstanceOf(PermanentExternalException.class);
        assertThat(calls).hasValue(1);
    }
}
