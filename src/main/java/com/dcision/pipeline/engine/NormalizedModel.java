package com.dcision.pipeline.engine;

import com.dcision.pipeline.domain.ObjectiveDirection;
import com.dcision.pipeline.domain.VariableKind;
import com.dcision.pipeline.expression.LinearForm;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Solver-neutral algebraic form of an optimization model: resolved variable bounds,
 * two-sided linear rows and a linear objective.
 */
@Value
@Builder
public class NormalizedModel {

    @Singular
    List<NormalizedVariable> variables;

    @Singular
    List<Row> rows;

    ObjectiveDirection direction;

    LinearForm objective;

    public boolean isIntegral() {
        return variables.stream().anyMatch(NormalizedVariable::isIntegral);
    }

    @Value
    public static class NormalizedVariable {
        String name;
        VariableKind kind;
        double lowerBound;
        double upperBound;

        public boolean isIntegral() {
            return kind == VariableKind.INTEGER || kind == VariableKind.BINARY;
        }
    }

    /**
     * {@code lowerBound <= sum(coefficients) <= upperBound}; an open side is infinite.
     */
    @Value
    public static class Row {
        String name;
        Map<String, Double> coefficients;
        double lowerBound;
        double upperBound;
    }
}
