package com.insightreel.pipeline.service;

import com.insightreel.pipeline.config.PipelineProperties;
import com.insightreel.pipeline.exception.TransientExternalException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.util.function.Supplier;

/**
 * Runs a blocking external call with exponential backoff on transient failures.
 * Delay doubles from {@code pipeline.retry.base-backoff} up to {@code max-backoff};
 * permanent failures are rethrown on the first attempt.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ExternalCallExecutor {

    private final PipelineProperties properties;

    public <T> T call(String operation, Supplier<T> call) {
        PipelineProperties.RetryPolicy policy = properties.getRetry();
        int maxRetries = Math.max(0, policy.getMaxAttempts() - 1);

        try {
            // clients block inside the supplier; resubscriptions must not land on the parallel scheduler
            return Mono.fromSupplier(call)
                    .subscribeOn(Schedulers.boundedElastic())
                    .retryWhen(Retry.backoff(maxRetries, policy.getBaseBackoff())
                            .maxBackoff(policy.getMaxBackoff())
                            .jitter(0)
                            .filter(TransientExternalException.class::isInstance)
                            .doBeforeRetry(signal -> log.warn("{} failed (attempt {}/{}), retrying: {}",
                                    operation, signal.totalRetries() + 1, maxRetries + 1,
                                    signal.failure().getMessage()))
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .block();
        } catch (RuntimeException e) {
            throw unwrap(e);
        }
    }

    private static RuntimeException unwrap(RuntimeException e) {
        Throwable cause = Exceptions.unwrap(e);
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        return e;
    }
}
