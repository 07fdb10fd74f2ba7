package com.dcision.pipeline.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Mathematical program produced by the model-building stage.
 * <p>
 * Once accepted by {@code ModelValidator}, every identifier used in a constraint or in the
 * objective is a declared variable and every declared variable is used somewhere.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class OptimizationModel {
    String modelType;

    @Singular
    List<Variable> variables;

    @Singular
    List<Constraint> constraints;

    Objective objective;

    @Singular("reasoningStep")
    List<ReasoningStep> reasoningTrace;

    @JsonIgnore
    public boolean hasIntegerVariables() {
        return variables.stream()
                .anyMatch(v -> v.getKind() == VariableKind.INTEGER || v.getKind() == VariableKind.BINARY);
    }
}
