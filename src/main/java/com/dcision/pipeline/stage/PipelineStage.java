package com.dcision.pipeline.stage;

import com.dcision.pipeline.domain.StageContext;
import com.dcision.pipeline.domain.StageName;
import com.dcision.pipeline.validation.StageValidator;

import java.time.Duration;
import java.util.Map;

/**
 * One step of the pipeline: its input/output contract, what makes two invocations
 * equivalent for caching, and the external call that produces its output.
 *
 * @param <T> the validated output type
 */
public interface PipelineStage<T> {

    StageName name();

    Class<T> outputType();

    /**
     * The upstream values this stage's output depends on. Request ids and timestamps
     * are never part of it, so identical problems share cache entries.
     */
    Object fingerprintInputs(StageContext context);

    /**
     * Settings that change the output for identical inputs (model id, prompt version, ...).
     */
    Map<String, Object> parameters();

    Duration timeout();

    /**
     * Performs the external call. Blocking; runs on a stage-call thread and must stop
     * promptly when that thread is interrupted.
     */
    T produce(StageContext context, StageAttempt attempt);

    StageValidator<T> validator();
}
