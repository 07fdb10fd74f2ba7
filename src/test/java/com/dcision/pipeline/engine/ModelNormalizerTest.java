package com.dcision.pipeline.engine;

import com.dcision.pipeline.domain.Constraint;
import com.dcision.pipeline.domain.Objective;
import com.dcision.pipeline.domain.ObjectiveDirection;
import com.dcision.pipeline.domain.OptimizationModel;
import com.dcision.pipeline.domain.Variable;
import com.dcision.pipeline.domain.VariableKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelNormalizerTest {

    @Test
    void boundsDefaultToNonNegativeAndBinaryIsAlwaysZeroOne() {
        OptimizationModel model = OptimizationModel.builder()
                .modelType("mixed_integer_programming")
                .variable(Variable.builder().name("x").kind(VariableKind.CONTINUOUS).build())
                .variable(Variable.builder().name("n").kind(VariableKind.INTEGER).upperBound(7.0).build())
                .variable(Variable.builder().name("open").kind(VariableKind.BINARY).lowerBound(-5.0).upperBound(9.0).build())
                .constraint(Constraint.builder().expression("x <= 100 * open").build())
                .constraint(Constraint.builder().expression("x + n = 12").build())
                .objective(Objective.builder().direction(ObjectiveDirection.MAXIMIZE).expression("3*x + n - 20*open + 4").build())
                .build();

        NormalizedModel normalized = ModelNormalizer.normalize(model);

        NormalizedModel.NormalizedVariable x = normalized.getVariables().get(0);
        assertEquals(0.0, x.getLowerBound());
        assertEquals(Double.POSITIVE_INFINITY, x.getUpperBound());
        assertEquals(7.0, normalized.getVariables().get(1).getUpperBound());
        NormalizedModel.NormalizedVariable open = normalized.getVariables().get(2);
        assertEquals(0.0, open.getLowerBound());
        assertEquals(1.0, open.getUpperBound());
        assertTrue(normalized.isIntegral());

        NormalizedModel.Row linking = normalized.getRows().get(0);
        assertEquals(-100.0, linking.getCoefficients().get("open"));
        assertEquals(Double.NEGATIVE_INFINITY, linking.getLowerBound());
        assertEquals(0.0, linking.getUpperBound());

        NormalizedModel.Row equality = normalized.getRows().get(1);
        assertEquals(12.0, equality.getLowerBound());
        assertEquals(12.0, equality.getUpperBound());

        assertEquals(4.0, normalized.getObjective().getConstant());
        assertEquals(ObjectiveDirection.MAXIMIZE, normalized.getDirection());
    }

    @Test
    void demandConstraintBecomesLowerBoundedRow() {
        NormalizedModel normalized = ModelNormalizer.normalize(ProductionModels.threeLines(800, VariableKind.CONTINUOUS));

        NormalizedModel.Row demand = normalized.getRows().get(3);
        assertEquals(800.0, demand.getLowerBound());
        assertEquals(Double.POSITIVE_INFINITY, demand.getUpperBound());
        assertFalse(normalized.isIntegral());
    }
}
