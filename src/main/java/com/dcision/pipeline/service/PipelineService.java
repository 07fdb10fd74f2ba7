package com.dcision.pipeline.service;

import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.domain.PipelineRun;
import com.dcision.pipeline.domain.ProblemRequest;
import com.dcision.pipeline.domain.RunStatus;
import com.dcision.pipeline.exception.RunNotFoundException;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Entry points of the pipeline: submit a problem, poll its run, cancel it.
 * <p>
 * Runs execute on the pipeline worker pool and stay queryable for the configured
 * retention after submission.
 */
@Slf4j
@Service
public class PipelineService {

    private final PipelineOrchestrator orchestrator;
    private final ExecutorService workers;
    private final PipelineProperties properties;
    private final Clock clock;
    private final Cache<String, RunHandle> runs;

    @Autowired
    public PipelineService(PipelineOrchestrator orchestrator,
                           @Qualifier("pipelineExecutor") ExecutorService workers,
                           PipelineProperties properties,
                           Clock clock) {
        this(orchestrator, workers, properties, clock, Ticker.systemTicker());
    }

    public PipelineService(PipelineOrchestrator orchestrator, ExecutorService workers,
                           PipelineProperties properties, Clock clock, Ticker ticker) {
        this.orchestrator = orchestrator;
        this.workers = workers;
        this.properties = properties;
        this.clock = clock;
        this.runs = Caffeine.newBuilder()
                .expireAfterWrite(properties.getRunRetention())
                .ticker(ticker)
                .build();
    }

    public String submit(String text, Map<String, String> hints) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Problem text must not be blank");
        }
        return submit(ProblemRequest.builder()
                .id(UUID.randomUUID().toString())
                .rawText(text)
                .hints(hints == null ? Map.of() : hints)
                .submittedAt(clock.instant())
                .build());
    }

    public String submit(ProblemRequest request) {
        RunHandle handle = new RunHandle(request, clock.instant());
        if (runs.asMap().putIfAbsent(handle.getRunId(), handle) != null) {
            throw new IllegalArgumentException("Run " + handle.getRunId() + " already exists");
        }
        handle.attachWorker(workers.submit(() -> {
            if (handle.claimForExecution()) {
                orchestrator.run(handle);
            }
        }));
        log.info("Submitted run {}", handle.getRunId());
        return handle.getRunId();
    }

    /**
     * @throws RunNotFoundException if the run is unknown or past retention
     */
    public PipelineRun getStatus(String runId) {
        return handle(runId).snapshot();
    }

    /**
     * Cancels a run and waits up to the cancellation grace period for its in-flight call
     * to stop. A run still busy after that is reported cancelled anyway; its late output
     * is discarded.
     *
     * @throws RunNotFoundException if the run is unknown or past retention
     */
    public CancellationAck cancel(String runId) {
        RunHandle handle = handle(runId);
        if (handle.snapshot().isTerminal()) {
            return ack(handle, false);
        }

        handle.requestCancel();
        if (handle.claimBeforeStart()) {
            log.info("Run {} cancelled before it started", runId);
            return ack(handle, markCancelled(handle));
        }

        try {
            if (!handle.awaitTerminal(properties.getCancellationGrace())) {
                log.warn("Run {} did not stop within {}, marking it cancelled", runId,
                        properties.getCancellationGrace());
                markCancelled(handle);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            markCancelled(handle);
        }
        return ack(handle, handle.snapshot().getStatus() == RunStatus.CANCELLED);
    }

    private boolean markCancelled(RunHandle handle) {
        PipelineRun run = handle.update(r -> r.toBuilder()
                .status(RunStatus.CANCELLED)
                .finishedAt(clock.instant())
                .build());
        return run.getStatus() == RunStatus.CANCELLED;
    }

    private static CancellationAck ack(RunHandle handle, boolean cancelled) {
        return new CancellationAck(handle.getRunId(), cancelled, handle.snapshot().getStatus());
    }

    private RunHandle handle(String runId) {
        RunHandle handle = runs.getIfPresent(runId);
        if (handle == null) {
            throw new RunNotFoundException(runId);
        }
        return handle;
    }
}
