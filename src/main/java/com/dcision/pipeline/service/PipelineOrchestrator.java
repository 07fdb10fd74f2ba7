package com.dcision.pipeline.service;

import com.dcision.pipeline.cache.CacheLookup;
import com.dcision.pipeline.cache.Fingerprinter;
import com.dcision.pipeline.cache.ResultCache;
import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.domain.DataAnalysisResult;
import com.dcision.pipeline.domain.InferenceUsage;
import com.dcision.pipeline.domain.IntentResult;
import com.dcision.pipeline.domain.OptimizationModel;
import com.dcision.pipeline.domain.PipelineRun;
import com.dcision.pipeline.domain.ProblemRequest;
import com.dcision.pipeline.domain.RunStatus;
import com.dcision.pipeline.domain.SolutionRecord;
import com.dcision.pipeline.domain.StageContext;
import com.dcision.pipeline.domain.StageError;
import com.dcision.pipeline.domain.StageEvent;
import com.dcision.pipeline.domain.StageName;
import com.dcision.pipeline.domain.StageOutcome;
import com.dcision.pipeline.exception.ErrorKind;
import com.dcision.pipeline.exception.InferenceException;
import com.dcision.pipeline.exception.PipelineCancelledException;
import com.dcision.pipeline.exception.PipelineException;
import com.dcision.pipeline.stage.DataAnalysisStage;
import com.dcision.pipeline.stage.IntentStage;
import com.dcision.pipeline.stage.ModelBuildingStage;
import com.dcision.pipeline.stage.PipelineStage;
import com.dcision.pipeline.stage.SolvingStage;
import com.dcision.pipeline.stage.StageAttempt;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Executes one run through Intent, DataAnalysis, ModelBuilding and Solving, strictly in
 * that order.
 * <p>
 * Each stage is looked up in the {@link ResultCache} by fingerprint first. On a miss the
 * stage call runs on the stage-call executor under the stage timeout, its output is
 * validated, and retryable failures are retried with a fresh call on another region.
 * Only validated outputs reach the cache, and nothing is cached once the run has been
 * cancelled.
 */
@Slf4j
@Service
public class PipelineOrchestrator {

    private final List<PipelineStage<?>> stages;
    private final ResultCache cache;
    private final Fingerprinter fingerprinter;
    private final ExecutorService callExecutor;
    private final List<StageEventListener> listeners;
    private final PipelineProperties properties;
    private final Clock clock;

    @Autowired
    public PipelineOrchestrator(IntentStage intentStage,
                                DataAnalysisStage dataAnalysisStage,
                                ModelBuildingStage modelBuildingStage,
                                SolvingStage solvingStage,
                                ResultCache cache,
                                Fingerprinter fingerprinter,
                                @Qualifier("stageCallExecutor") ExecutorService callExecutor,
                                List<StageEventListener> listeners,
                                PipelineProperties properties,
                                Clock clock) {
        this(List.of(intentStage, dataAnalysisStage, modelBuildingStage, solvingStage),
                cache, fingerprinter, callExecutor, listeners, properties, clock);
    }

    PipelineOrchestrator(List<PipelineStage<?>> stages,
                         ResultCache cache,
                         Fingerprinter fingerprinter,
                         ExecutorService callExecutor,
                         List<StageEventListener> listeners,
                         PipelineProperties properties,
                         Clock clock) {
        this.stages = List.copyOf(stages);
        this.cache = cache;
        this.fingerprinter = fingerprinter;
        this.callExecutor = callExecutor;
        this.listeners = List.copyOf(listeners);
        this.properties = properties;
        this.clock = clock;
    }

    public PipelineRun run(ProblemRequest request) {
        return run(new RunHandle(request, clock.instant()));
    }

    public PipelineRun run(RunHandle handle) {
        log.info("Starting run {}", handle.getRunId());
        StageContext context = StageContext.of(handle.getRequest());

        for (PipelineStage<?> stage : stages) {
            try {
                context = execute(stage, context, handle);
            } catch (PipelineCancelledException e) {
                log.info("Run {} cancelled during {}", handle.getRunId(), stage.name().wireName());
                return handle.update(run -> run.toBuilder()
                        .status(RunStatus.CANCELLED)
                        .finishedAt(clock.instant())
                        .build());
            } catch (PipelineException e) {
                log.warn("Run {} failed at {} with {}: {}", handle.getRunId(), stage.name().wireName(),
                        e.getKind().code(), e.getMessage());
                return fail(handle, stage.name(), StageError.from(e));
            } catch (RuntimeException e) {
                log.error("Unexpected failure in {} of run {}", stage.name().wireName(), handle.getRunId(), e);
                return fail(handle, stage.name(), StageError.builder()
                        .kind(ErrorKind.INTERNAL)
                        .message(e.toString())
                        .build());
            }
        }

        PipelineRun completed = handle.update(run -> run.toBuilder()
                .status(RunStatus.COMPLETED)
                .finishedAt(clock.instant())
                .build());
        log.info("Run {} finished with status {}", handle.getRunId(), completed.getStatus().wireName());
        return completed;
    }

    private PipelineRun fail(RunHandle handle, StageName stage, StageError error) {
        return handle.update(run -> run.toBuilder()
                .status(RunStatus.FAILED)
                .failedStage(stage)
                .error(error)
                .finishedAt(clock.instant())
                .build());
    }

    private <T> StageContext execute(PipelineStage<T> stage, StageContext context, RunHandle handle) {
        handle.checkNotCancelled();
        String fingerprint = fingerprinter.fingerprint(stage.name(), stage.fingerprintInputs(context),
                stage.parameters());

        StageExecution execution = new StageExecution();
        long start = System.nanoTime();
        try {
            CacheLookup<T> lookup = lookup(stage, context, handle, fingerprint, execution);
            execution.cacheHit = lookup.isHit();
            record(handle, stage.name(), lookup.getValue(), execution);
            emit(handle, stage.name(), StageOutcome.SUCCEEDED, start, execution, null);
            return context.withOutput(stage.name(), lookup.getValue());
        } catch (PipelineCancelledException e) {
            chargeUsage(handle, execution);
            emit(handle, stage.name(), StageOutcome.CANCELLED, start, execution, e.getKind());
            throw e;
        } catch (PipelineException e) {
            chargeUsage(handle, execution);
            emit(handle, stage.name(), StageOutcome.FAILED, start, execution, e.getKind());
            throw e;
        } catch (RuntimeException e) {
            chargeUsage(handle, execution);
            emit(handle, stage.name(), StageOutcome.FAILED, start, execution, ErrorKind.INTERNAL);
            throw e;
        }
    }

    private <T> CacheLookup<T> lookup(PipelineStage<T> stage, StageContext context, RunHandle handle,
                                      String fingerprint, StageExecution execution) {
        while (true) {
            try {
                return cache.getOrCompute(fingerprint, stage.name(), stage.outputType(),
                        () -> runWithRetries(stage, context, handle, execution));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PipelineCancelledException("Run " + handle.getRunId() + " interrupted while waiting for "
                        + stage.name().wireName());
            } catch (PipelineCancelledException e) {
                if (handle.isCancelRequested() || Thread.currentThread().isInterrupted()) {
                    throw e;
                }
                // another run computing the same fingerprint was cancelled; this one carries on
                log.debug("Shared {} computation was cancelled, retrying for run {}",
                        stage.name().wireName(), handle.getRunId());
            }
        }
    }

    private <T> T runWithRetries(PipelineStage<T> stage, StageContext context, RunHandle handle,
                                 StageExecution execution) {
        int maxAttempts = 1 + properties.getMaxRetries();
        Set<String> excluded = new LinkedHashSet<>();
        for (int number = 1; ; number++) {
            handle.checkNotCancelled();
            StageAttempt attempt = new StageAttempt(number, excluded, handle::isCancelRequested);
            execution.attempts = number;
            try {
                T output = invoke(stage, context, attempt, handle);
                stage.validator().validate(output, context).throwIfInvalid();
                handle.checkNotCancelled();
                return output;
            } catch (PipelineCancelledException e) {
                throw e;
            } catch (PipelineException e) {
                handle.checkNotCancelled();
                if (!e.isRetryable() || number >= maxAttempts) {
                    throw e;
                }
                log.warn("Run {} {} attempt {}/{} failed with {}: {}", handle.getRunId(), stage.name().wireName(),
                        number, maxAttempts, e.getKind().code(), e.getMessage());
                if (e.getKind() == ErrorKind.NO_AVAILABLE_REGION) {
                    excluded.clear();
                } else if (attempt.getRegionId() != null) {
                    excluded.add(attempt.getRegionId());
                }
            } finally {
                execution.absorb(attempt);
            }
        }
    }

    private <T> T invoke(PipelineStage<T> stage, StageContext context, StageAttempt attempt, RunHandle handle) {
        Future<T> call = callExecutor.submit(() -> stage.produce(context, attempt));
        handle.attachCall(call);
        try {
            return call.get(stage.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            call.cancel(true);
            throw new InferenceException(ErrorKind.TIMEOUT, attempt.getRegionId(),
                    stage.name().wireName() + " did not finish within " + stage.timeout());
        } catch (InterruptedException e) {
            call.cancel(true);
            Thread.currentThread().interrupt();
            throw new PipelineCancelledException("Run " + handle.getRunId() + " interrupted during "
                    + stage.name().wireName());
        } catch (CancellationException e) {
            throw new PipelineCancelledException("Run " + handle.getRunId() + " cancelled during "
                    + stage.name().wireName());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new PipelineException(ErrorKind.INTERNAL, stage.name().wireName() + " call failed", cause);
        } finally {
            handle.detachCall();
        }
    }

    private void record(RunHandle handle, StageName stage, Object output, StageExecution execution) {
        handle.update(run -> {
            PipelineRun.PipelineRunBuilder builder = run.toBuilder()
                    .usage(run.getUsage().plus(execution.usage));
            switch (stage) {
                case INTENT -> builder.intent((IntentResult) output);
                case DATA_ANALYSIS -> builder.dataAnalysis((DataAnalysisResult) output);
                case MODEL_BUILDING -> builder.model((OptimizationModel) output);
                case SOLVING -> builder.solution((SolutionRecord) output);
            }
            return builder.build();
        });
    }

    private void chargeUsage(RunHandle handle, StageExecution execution) {
        if (!execution.usage.equals(InferenceUsage.NONE)) {
            handle.update(run -> run.toBuilder().usage(run.getUsage().plus(execution.usage)).build());
        }
    }

    private void emit(RunHandle handle, StageName stage, StageOutcome outcome, long startNanos,
                      StageExecution execution, ErrorKind errorKind) {
        StageEvent event = StageEvent.builder()
                .runId(handle.getRunId())
                .stage(stage)
                .outcome(outcome)
                .durationMs((System.nanoTime() - startNanos) / 1_000_000)
                .regionId(execution.regionId)
                .cacheHit(execution.cacheHit)
                .attempts(execution.attempts)
                .errorKind(errorKind)
                .build();
        handle.update(run -> run.toBuilder().event(event).build());
        for (StageEventListener listener : listeners) {
            try {
                listener.onStageEvent(event);
            } catch (RuntimeException e) {
                log.warn("Stage event listener {} failed", listener.getClass().getSimpleName(), e);
            }
        }
    }

    /**
     * What the attempts of one stage did, as far as this run is concerned.
     */
    private static final class StageExecution {
        int attempts;
        String regionId;
        boolean cacheHit;
        InferenceUsage usage = InferenceUsage.NONE;

        void absorb(StageAttempt attempt) {
            if (attempt.getRegionId() != null) {
                regionId = attempt.getRegionId();
            }
            usage = usage.plus(attempt.getUsage());
        }
    }
}
