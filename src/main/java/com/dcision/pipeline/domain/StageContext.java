package com.dcision.pipeline.domain;

import lombok.Builder;
import lombok.Value;
import lombok.With;

/**
 * Accumulated, immutable inputs available to a stage: the original request plus the
 * validated outputs of every stage before it.
 */
@Value
@Builder
@With
public class StageContext {
    ProblemRequest request;
    IntentResult intent;
    DataAnalysisResult dataAnalysis;
    OptimizationModel model;

    public static StageContext of(ProblemRequest request) {
        return StageContext.builder().request(request).build();
    }

    /**
     * Returns a copy carrying {@code output} as the result of {@code stage}.
     */
    public StageContext withOutput(StageName stage, Object output) {
        return switch (stage) {
            case INTENT -> withIntent((IntentResult) output);
            case DATA_ANALYSIS -> withDataAnalysis((DataAnalysisResult) output);
            case MODEL_BUILDING -> withModel((OptimizationModel) output);
            case SOLVING -> this;
        };
    }
}
