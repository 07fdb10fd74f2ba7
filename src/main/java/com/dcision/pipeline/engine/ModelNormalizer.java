package com.dcision.pipeline.engine;

import com.dcision.pipeline.domain.Constraint;
import com.dcision.pipeline.domain.OptimizationModel;
import com.dcision.pipeline.domain.Variable;
import com.dcision.pipeline.domain.VariableKind;
import com.dcision.pipeline.exception.ErrorKind;
import com.dcision.pipeline.exception.PipelineException;
import com.dcision.pipeline.expression.ExpressionException;
import com.dcision.pipeline.expression.ExpressionParser;
import com.dcision.pipeline.expression.LinearForm;
import com.dcision.pipeline.expression.Relation;

import java.util.List;

/**
 * Turns a validated {@link OptimizationModel} into a {@link NormalizedModel}.
 * <p>
 * Continuous and integer variables default to {@code [0, +inf)}; binary variables are
 * always {@code [0, 1]}. Strict comparators are solved as their non-strict counterparts.
 */
public final class ModelNormalizer {

    private ModelNormalizer() {
    }

    public static NormalizedModel normalize(OptimizationModel model) {
        NormalizedModel.NormalizedModelBuilder builder = NormalizedModel.builder();
        for (Variable variable : model.getVariables()) {
            builder.variable(normalize(variable));
        }

        List<Constraint> constraints = model.getConstraints();
        for (int i = 0; i < constraints.size(); i++) {
            builder.row(toRow("c" + i, constraints.get(i)));
        }

        try {
            builder.objective(ExpressionParser.parseExpression(model.getObjective().getExpression()).toLinear());
        } catch (ExpressionException e) {
            throw new PipelineException(ErrorKind.VALIDATION_FAILURE, "Objective is not linear: " + e.getMessage(), e);
        }
        return builder.direction(model.getObjective().getDirection()).build();
    }

    private static NormalizedModel.NormalizedVariable normalize(Variable variable) {
        VariableKind kind = variable.getKind() == null ? VariableKind.CONTINUOUS : variable.getKind();
        if (kind == VariableKind.BINARY) {
            return new NormalizedModel.NormalizedVariable(variable.getName(), kind, 0.0, 1.0);
        }
        double lower = variable.getLowerBound() == null ? 0.0 : variable.getLowerBound();
        double upper = variable.getUpperBound() == null ? Double.POSITIVE_INFINITY : variable.getUpperBound();
        return new NormalizedModel.NormalizedVariable(variable.getName(), kind, lower, upper);
    }

    private static NormalizedModel.Row toRow(String name, Constraint constraint) {
        Relation relation;
        LinearForm form;
        try {
            relation = ExpressionParser.parseRelation(constraint.getExpression());
            form = relation.toLinear();
        } catch (ExpressionException e) {
            throw new PipelineException(ErrorKind.VALIDATION_FAILURE,
                    "Constraint '" + constraint.getExpression() + "' is not linear: " + e.getMessage(), e);
        }

        // left - right (op) 0  =>  sum(coefficients) (op) -constant
        double bound = -form.getConstant();
        return switch (relation.getOperator()) {
            case LESS_OR_EQUAL, LESS -> new NormalizedModel.Row(name, form.getCoefficients(),
                    Double.NEGATIVE_INFINITY, bound);
            case GREATER_OR_EQUAL, GREATER -> new NormalizedModel.Row(name, form.getCoefficients(),
                    bound, Double.POSITIVE_INFINITY);
            case EQUAL -> new NormalizedModel.Row(name, form.getCoefficients(), bound, bound);
        };
    }
}
