package com.insightreel.pipeline.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.aop.interceptor.AsyncUncaughtExceptionHandler;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

@Configuration
@EnableAsync
@EnableScheduling
@Slf4j
public class AsyncConfig implements AsyncConfigurer {

    @Value("${async.executor.core-pool-size:5}")
    private int corePoolSize;

    @Value("${async.executor.max-pool-size:20}")
    private int maxPoolSize;

    @Value("${async.executor.queue-capacity:100}")
    private int queueCapacity;

    @Value("${async.research.core-pool-size:4}")
    private int researchCorePoolSize;

    @Value("${async.research.max-pool-size:8}")
    private int researchMaxPoolSize;

    @Value("${async.research.queue-capacity:50}")
    private int researchQueueCapacity;

    @Value("${async.video.core-pool-size:8}")
    private int videoCorePoolSize;

    @Value("${async.video.max-pool-size:32}")
    private int videoMaxPoolSize;

    @Value("${async.video.queue-capacity:200}")
    private int videoQueueCapacity;

    /**
     * Default executor for @Async event listeners.
     */
    @Bean(name = "taskExecutor")
    @Primary
    public ThreadPoolTaskExecutor taskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("async-pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.setRejectedExecutionHandler((r, e) ->
                log.warn("Task rejected from taskExecutor: {}", r.toString()));
        executor.initialize();
        return executor;
    }

    /**
     * One task per in-flight research job (collect + analyze).
     * Rejections surface as TaskRejectedException so the job can be failed.
     */
    @Bean(name = "researchExecutor")
    public ThreadPoolTaskExecutor researchExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(researchCorePoolSize);
        executor.setMaxPoolSize(researchMaxPoolSize);
        executor.setQueueCapacity(researchQueueCapacity);
        executor.setThreadNamePrefix("research-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(120);
        executor.initialize();
        return executor;
    }

    /**
     * One task per in-flight video generation (submit + polling loop).
     * Polling loops are interrupted on shutdown and resumed at the next startup.
     */
    @Bean(name = "videoExecutor")
    public ThreadPoolTaskExecutor videoExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(videoCorePoolSize);
        executor.setMaxPoolSize(videoMaxPoolSize);
        executor.setQueueCapacity(videoQueueCapacity);
        executor.setThreadNamePrefix("video-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Override
    public Executor getAsyncExecutor() {
        return taskExecutor();
    }

    @Override
    public AsyncUncaughtExceptionHandler getAsyncUncaughtExceptionHandler() {
        return (ex, method, params) ->
                log.error("Uncaught async exception in method {}: {}", method.getName(), ex.getMessage(), ex);
    }
}
