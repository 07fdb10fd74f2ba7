package com.dcision.pipeline.domain;

import lombok.Value;

/**
 * Tokens and estimated cost of the inference calls a run actually executed.
 */
@Value
public class InferenceUsage {
    public static final InferenceUsage NONE = new InferenceUsage(0, 0, 0.0);

    long inputTokens;
    long outputTokens;
    double estimatedCost;

    public InferenceUsage plus(InferenceUsage other) {
        return new InferenceUsage(inputTokens + other.inputTokens,
                outputTokens + other.outputTokens,
                estimatedCost + other.estimatedCost);
    }
}
