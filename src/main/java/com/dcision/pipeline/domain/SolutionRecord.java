package com.dcision.pipeline.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Normalized solver output. Variable values and the objective value are only present
 * when the status is {@link SolveStatus#OPTIMAL}.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class SolutionRecord {
    SolveStatus status;

    @Singular
    Map<String, Double> variableValues;

    Double objectiveValue;
    long solveTimeMs;
    String solverUsed;
}
