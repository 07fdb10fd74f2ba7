package com.dcision.pipeline.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of one pipeline run. Stage outputs are absent for stages that have not run,
 * either because the run is still in progress or because it halted earlier.
 */
@Value
@Builder(toBuilder = true)
public class PipelineRun {
    String runId;
    ProblemRequest request;
    RunStatus status;

    // set only when status is FAILED
    StageName failedStage;
    StageError error;

    IntentResult intent;
    DataAnalysisResult dataAnalysis;
    OptimizationModel model;
    SolutionRecord solution;

    @Singular
    List<StageEvent> events;

    @Builder.Default
    InferenceUsage usage = InferenceUsage.NONE;

    Instant startedAt;
    Instant finishedAt;

    public static PipelineRun started(ProblemRequest request, Instant now) {
        return PipelineRun.builder()
                .runId(request.getId())
                .request(request)
                .status(RunStatus.RUNNING)
                .startedAt(now)
                .build();
    }

    public boolean isTerminal() {
        return status != RunStatus.RUNNING;
    }
}
