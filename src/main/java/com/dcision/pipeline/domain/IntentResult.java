package com.dcision.pipeline.domain;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

@Value
@Builder(toBuilder = true)
@Jacksonized
public class IntentResult {
    String intentLabel;
    String industryLabel;
    Complexity complexity;
    Double confidence;

    @Singular
    List<String> entities;

    String optimizationType;
    SolverRequirements solverCapabilityRequirements;
}
