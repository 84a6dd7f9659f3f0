package com.insightreel.pipeline.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.insightreel.pipeline.client.LanguageAnalysisProvider;
import com.insightreel.pipeline.client.SourceDataProvider;
import com.insightreel.pipeline.config.PipelineProperties;
import com.insightreel.pipeline.dto.AnalysisResult;
import com.insightreel.pipeline.dto.RawDataset;
import com.insightreel.pipeline.dto.ResearchJobDto;
import com.insightreel.pipeline.dto.ResearchJobRequest;
import com.insightreel.pipeline.entity.AnalysisDepth;
import com.insightreel.pipeline.entity.ResearchJob;
import com.insightreel.pipeline.entity.ResearchPhase;
import com.insightreel.pipeline.entity.ResearchSource;
import com.insightreel.pipeline.exception.PipelineException;
import com.insightreel.pipeline.exception.StateConflictException;
import com.insightreel.pipeline.mapper.EntityMapper;
import com.insightreel.pipeline.repository.ResearchJobRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;

/**
 * Research job orchestration: RAW -> (collect, analyze) -> ANALYZED | FAILED.
 *
 * At most one job runs per (source, normalized query). Duplicate starts while a
 * job is in flight return the existing job id. All writes after creation are
 * conditional on the job still being RAW, so a late writer (cancel, staleness
 * sweep, a duplicate runner) can never overwrite a terminal job.
 */
@Service
@Slf4j
public class ResearchJobService {

    static final String NO_ITEMS_MESSAGE = "No items collected for query";
    static final String STALE_MESSAGE = "Stale research job abandoned";
    static final String CANCELLED_MESSAGE = "Cancelled by user";

    private final ResearchJobRepository researchJobRepository;
    private final SourceDataProvider sourceDataProvider;
    private final LanguageAnalysisProvider analysisProvider;
    private final ExternalCallExecutor externalCallExecutor;
    private final ResearchRelevanceRanker relevanceRanker;
    private final PipelineEventPublisher eventPublisher;
    private final PipelineMetrics metrics;
    private final PipelineProperties properties;
    private final EntityMapper entityMapper;
    private final ObjectMapper objectMapper;
    private final AsyncTaskExecutor researchExecutor;

    /**
     * In-flight jobs keyed by dedup key
     */
    private final ConcurrentHashMap<String, JobHandle> inFlight = new ConcurrentHashMap<>();

    public ResearchJobService(ResearchJobRepository researchJobRepository,
                              SourceDataProvider sourceDataProvider,
                              LanguageAnalysisProvider analysisProvider,
                              ExternalCallExecutor externalCallExecutor,
                              ResearchRelevanceRanker relevanceRanker,
                              PipelineEventPublisher eventPublisher,
                              PipelineMetrics metrics,
                              PipelineProperties properties,
                              EntityMapper entityMapper,
                              ObjectMapper objectMapper,
                              @Qualifier("researchExecutor") AsyncTaskExecutor researchExecutor) {
        this.researchJobRepository = researchJobRepository;
        this.sourceDataProvider = sourceDataProvider;
        this.analysisProvider = analysisProvider;
        this.externalCallExecutor = externalCallExecutor;
        this.relevanceRanker = relevanceRanker;
        this.eventPublisher = eventPublisher;
        this.metrics = metrics;
        this.properties = properties;
        this.entityMapper = entityMapper;
        this.objectMapper = objectMapper;
        this.researchExecutor = researchExecutor;
    }

    /**
     * Start (or join) a research job.
     *
     * @return the id of the new job, or of the job already running for the same source and query
     */
    public String startJob(ResearchJobRequest request) {
        ResearchSource source = parseSource(request.getSource());
        String query = request.getQuery() == null ? "" : request.getQuery().trim();
        if (query.isEmpty()) {
            throw new PipelineException("INVALID_REQUEST", "query is required");
        }
        String dedupKey = ResearchJob.dedupKey(source, query);

        JobHandle running = inFlight.get(dedupKey);
        if (running != null) {
            log.info("Research job already in flight for {}: jobId={}", dedupKey, running.jobId());
            return running.jobId();
        }

        Optional<ResearchJob> persisted = researchJobRepository
                .findFirstByDedupKeyAndPhaseOrderByCreatedAtDesc(dedupKey, ResearchPhase.RAW);
        if (persisted.isPresent()) {
            log.info("Research job already pending for {}: jobId={}", dedupKey, persisted.get().getId());
            return persisted.get().getId();
        }

        ResearchJob job = ResearchJob.builder()
                .id(ResearchJob.generateJobId())
                .source(source)
                .configRef(query)
                .dedupKey(dedupKey)
                .phase(ResearchPhase.RAW)
                .analysisDepth(request.getAnalysisDepth() != null
                        ? request.getAnalysisDepth() : properties.getResearch().getDefaultDepth())
                .maxItems(request.getMaxItems() != null
                        ? request.getMaxItems() : properties.getResearch().getDefaultMaxItems())
                .userId(request.getUserId())
                .workspaceId(request.getWorkspaceId())
                .build();

        JobHandle handle = new JobHandle(job.getId(), dedupKey);
        JobHandle raced = inFlight.putIfAbsent(dedupKey, handle);
        if (raced != null) {
            return raced.jobId();
        }

        try {
            researchJobRepository.save(job);
        } catch (RuntimeException e) {
            inFlight.remove(dedupKey, handle);
            throw e;
        }

        log.info("Created research job: id={}, source={}, query='{}', depth={}",
                job.getId(), source.getKey(), query, job.getAnalysisDepth());
        dispatch(job, handle);
        return job.getId();
    }

    public ResearchJobDto getJob(String jobId) {
        ResearchJob job = researchJobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Research job not found: " + jobId));
        return entityMapper.toResearchJobDto(job, isRunning(jobId));
    }

    public Page<ResearchJobDto> listJobs(int page, int size, ResearchPhase phase) {
        PageRequest pageRequest = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        Page<ResearchJob> jobs = phase != null
                ? researchJobRepository.findByPhase(phase, pageRequest)
                : researchJobRepository.findAll(pageRequest);
        return jobs.map(job -> entityMapper.toResearchJobDto(job, isRunning(job.getId())));
    }

    public AnalysisResult getAnalysis(String jobId) {
        return getAnalysis(researchJobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Research job not found: " + jobId)));
    }

    /**
     * Analysis of an ANALYZED job, parsed back from storage.
     */
    public AnalysisResult getAnalysis(ResearchJob job) {
        if (job.getPhase() != ResearchPhase.ANALYZED || job.getAnalyzedData() == null) {
            throw new StateConflictException("Research job " + job.getId() + " is not analyzed (phase=" + job.getPhase() + ")");
        }
        try {
            return objectMapper.readValue(job.getAnalyzedData(), AnalysisResult.class);
        } catch (JsonProcessingException e) {
            throw new PipelineException("CORRUPT_ANALYSIS",
                    "Stored analysis of job " + job.getId() + " is unreadable", e);
        }
    }

    public boolean isRunning(String jobId) {
        return findHandle(jobId).isPresent();
    }

    /**
     * Fail a RAW job and interrupt its task if it runs in this process.
     */
    public ResearchJobDto cancelJob(String jobId) {
        ResearchJob job = researchJobRepository.findById(jobId)
                .orElseThrow(() -> new IllegalArgumentException("Research job not found: " + jobId));
        if (job.isTerminal()) {
            throw new StateConflictException("Research job " + jobId + " is already " + job.getPhase());
        }

        if (failJob(job, CANCELLED_MESSAGE)) {
            findHandle(jobId).ifPresent(handle -> {
                Future<?> future = handle.future;
                if (future != null) {
                    future.cancel(true);
                }
                inFlight.remove(handle.dedupKey(), handle);
            });
            log.info("Research job cancelled: {}", jobId);
        }
        return getJob(jobId);
    }

    /**
     * Resume or abandon RAW jobs left over from a previous run.
     */
    @EventListener(ApplicationReadyEvent.class)
    public void reconcileOnStartup() {
        List<ResearchJob> pending = researchJobRepository.findByPhaseOrderByCreatedAtAsc(ResearchPhase.RAW);
        if (pending.isEmpty()) {
            return;
        }
        LocalDateTime cutoff = LocalDateTime.now().minus(properties.getResearch().getStalenessThreshold());
        int abandoned = 0;
        int resumed = 0;
        for (ResearchJob job : pending) {
            if (job.getCreatedAt() != null && job.getCreatedAt().isBefore(cutoff)) {
                if (failJob(job, STALE_MESSAGE)) {
                    abandoned++;
                }
                continue;
            }
            JobHandle handle = new JobHandle(job.getId(), job.getDedupKey());
            if (inFlight.putIfAbsent(job.getDedupKey(), handle) == null) {
                dispatch(job, handle);
                resumed++;
            }
        }
        log.info("Research reconciliation: {} RAW jobs, {} resumed, {} abandoned", pending.size(), resumed, abandoned);
    }

    /**
     * Fail RAW jobs past the staleness threshold that are not running here.
     */
    @Scheduled(fixedDelayString = "${pipeline.research.sweep-interval-ms:600000}",
            initialDelayString = "${pipeline.research.sweep-initial-delay-ms:600000}")
    public void sweepStaleJobs() {
        LocalDateTime cutoff = LocalDateTime.now().minus(properties.getResearch().getStalenessThreshold());
        List<ResearchJob> stale = researchJobRepository.findByPhaseAndCreatedAtBefore(ResearchPhase.RAW, cutoff);
        int failed = 0;
        for (ResearchJob job : stale) {
            if (!isRunning(job.getId()) && failJob(job, STALE_MESSAGE)) {
                failed++;
            }
        }
        if (failed > 0) {
            log.info("Staleness sweep: {} research jobs abandoned", failed);
        }
    }

    // ========== Execution ==========

    private void dispatch(ResearchJob job, JobHandle handle) {
        try {
            handle.future = researchExecutor.submit(() -> run(job, handle));
        } catch (TaskRejectedException e) {
            log.error("Research executor rejected job {}: {}", job.getId(), e.getMessage());
            inFlight.remove(handle.dedupKey(), handle);
            failJob(job, "Research executor saturated");
        }
    }

    private void run(ResearchJob job, JobHandle handle) {
        try {
            execute(job);
        } catch (PipelineException e) {
            log.warn("Research job {} failed: [{}] {}", job.getId(), e.getErrorCode(), e.getMessage());
            failJob(job, e.getMessage());
        } catch (RuntimeException e) {
            if (Thread.currentThread().isInterrupted()) {
                log.info("Research job {} interrupted", job.getId());
            } else {
                log.error("Research job {} failed unexpectedly: {}", job.getId(), e.getMessage(), e);
            }
            failJob(job, "Unexpected error: " + e.getMessage());
        } finally {
            inFlight.remove(handle.dedupKey(), handle);
        }
    }

    private void execute(ResearchJob job) {
        String jobId = job.getId();
        RawDataset dataset;

        if (job.hasRawData()) {
            dataset = readRawData(job);
            log.info("Resuming analysis for research job {} ({} raw items)", jobId, dataset.size());
        } else {
            researchJobRepository.incrementAttempt(jobId, LocalDateTime.now());
            int maxItems = job.getMaxItems() != null ? job.getMaxItems() : properties.getResearch().getDefaultMaxItems();
            dataset = externalCallExecutor.call("collect " + jobId,
                    () -> sourceDataProvider.collect(job.getSource(), job.getConfigRef(), maxItems));

            if (dataset == null || dataset.isEmpty()) {
                failJob(job, NO_ITEMS_MESSAGE);
                return;
            }
            if (researchJobRepository.storeRawData(jobId, writeJson(dataset), LocalDateTime.now()) == 0) {
                log.info("Research job {} left RAW during collection, dropping result", jobId);
                return;
            }
        }

        AnalysisDepth depth = job.getAnalysisDepth() != null ? job.getAnalysisDepth() : AnalysisDepth.STANDARD;
        RawDataset collected = dataset;
        AnalysisResult analysis = externalCallExecutor.call("analyze " + jobId,
                () -> analysisProvider.analyze(collected, depth));
        if (analysis == null) {
            failJob(job, "Analyzer returned no result");
            return;
        }
        if (analysis.getTopic() == null || analysis.getTopic().isBlank()) {
            analysis.setTopic(job.getConfigRef());
        }

        double score = relevanceRanker.score(job.getSource(), analysis);
        int updated = researchJobRepository.completeAnalysis(jobId, writeJson(analysis), score, LocalDateTime.now());
        if (updated == 0) {
            log.info("Research job {} already terminal, analysis discarded", jobId);
            return;
        }

        metrics.researchTerminal(ResearchPhase.ANALYZED);
        eventPublisher.researchJobFinished(jobId, ResearchPhase.ANALYZED.name(), job.getUserId(),
                analysis.itemCount() + " insights, relevance " + score);
        log.info("Research job analyzed: id={}, items={}, relevance={}", jobId, analysis.itemCount(), score);
    }

    /**
     * @return true if this call moved the job to FAILED
     */
    private boolean failJob(ResearchJob job, String message) {
        String reason = message == null || message.isBlank() ? "Unknown error" : truncate(message, 1000);
        int updated = researchJobRepository.failJob(job.getId(), reason, LocalDateTime.now());
        if (updated == 0) {
            log.debug("Research job {} already terminal, failure '{}' ignored", job.getId(), reason);
            return false;
        }
        metrics.researchTerminal(ResearchPhase.FAILED);
        eventPublisher.researchJobFinished(job.getId(), ResearchPhase.FAILED.name(), job.getUserId(), reason);
        log.info("Research job failed: id={}, reason={}", job.getId(), reason);
        return true;
    }

    private RawDataset readRawData(ResearchJob job) {
        try {
            return objectMapper.readValue(job.getRawData(), RawDataset.class);
        } catch (JsonProcessingException e) {
            throw new PipelineException("CORRUPT_RAW_DATA", "Stored raw data is unreadable: " + e.getOriginalMessage(), e);
        }
    }

    private String writeJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PipelineException("SERIALIZATION_ERROR", "Failed to serialize " + value.getClass().getSimpleName(), e);
        }
    }

    private Optional<JobHandle> findHandle(String jobId) {
        return inFlight.values().stream()
                .filter(handle -> handle.jobId().equals(jobId))
                .findFirst();
    }

    private static ResearchSource parseSource(String value) {
        try {
            return ResearchSource.fromValue(value);
        } catch (IllegalArgumentException e) {
            throw new PipelineException("INVALID_REQUEST", e.getMessage(), e);
        }
    }

    private static String truncate(String value, int max) {
        return value.length() <= max ? value : value.substring(0, max);
    }

    private static final class JobHandle {
        private final String jobId;
        private final String dedupKey;
        private volatile Future<?> future;

        private JobHandle(String jobId, String dedupKey) {
            this.jobId = jobId;
            this.dedupKey = dedupKey;
        }

        String jobId() {
            return jobId;
        }

        String dedupKey() {
            return dedupKey;
        }
    }
}
