package com.insightreel.pipeline.service;

import com.insightreel.pipeline.entity.ResearchPhase;
import com.insightreel.pipeline.entity.VideoStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;

/**
 * Terminal-state counters for research jobs and video generations.
 */
@Component
public class PipelineMetrics {

    private final Map<ResearchPhase, Counter> researchCounters = new EnumMap<>(ResearchPhase.class);
    private final Map<VideoStatus, Counter> videoCounters = new EnumMap<>(VideoStatus.class);

    public PipelineMetrics(MeterRegistry meterRegistry) {
        for (ResearchPhase phase : ResearchPhase.values()) {
            if (phase.isTerminal()) {
                researchCounters.put(phase, Counter.builder("pipeline.research.terminal")
                        .description("Research jobs reaching a terminal phase")
                        .tag("phase", phase.name())
                        .register(meterRegistry));
            }
        }
        for (VideoStatus status : VideoStatus.values()) {
            if (status.isTerminal()) {
                videoCounters.put(status, Counter.builder("pipeline.video.terminal")
                        .description("Video generations reaching a terminal status")
                        .tag("status", status.name())
                        .register(meterRegistry));
            }
        }
    }

    public void researchTerminal(ResearchPhase phase) {
        Counter counter = researchCounters.get(phase);
        if (counter != null) {
            counter.increment();
        }
    }

    public void videoTerminal(VideoStatus status) {
        Counter counter = videoCounters.get(status);
        if (counter != null) {
            counter.increment();
        }
    }
}
