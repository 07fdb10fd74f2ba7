package com.dcision.pipeline.validation;

import com.dcision.pipeline.domain.Constraint;
import com.dcision.pipeline.domain.Objective;
import com.dcision.pipeline.domain.OptimizationModel;
import com.dcision.pipeline.domain.ReasoningStep;
import com.dcision.pipeline.domain.StageContext;
import com.dcision.pipeline.domain.Variable;
import com.dcision.pipeline.expression.Expression;
import com.dcision.pipeline.expression.ExpressionException;
import com.dcision.pipeline.expression.ExpressionParser;
import com.dcision.pipeline.expression.Relation;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

import static com.dcision.pipeline.validation.ValidationSupport.isBlank;

/**
 * Checks the model-building output: well-formed fields, every expression parses in the
 * restricted grammar and is linear, every identifier is a declared variable, and every
 * declared variable is used by at least one constraint or by the objective.
 */
@Component
public class ModelValidator implements StageValidator<OptimizationModel> {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    @Override
    public ValidationResult validate(OptimizationModel model, StageContext context) {
        ValidationResult result = ValidationResult.ok();
        if (model == null) {
            return result.fail("model", "missing");
        }
        if (isBlank(model.getModelType())) {
            result.fail("model_type", "must not be empty");
        }

        Set<String> declared = checkVariables(model.getVariables(), result);
        Set<String> used = new HashSet<>();

        List<Constraint> constraints = model.getConstraints();
        for (int i = 0; i < constraints.size(); i++) {
            String field = "constraints[" + i + "].expression";
            Constraint constraint = constraints.get(i);
            if (constraint == null || isBlank(constraint.getExpression())) {
                result.fail(field, "must not be empty");
                continue;
            }
            try {
                Relation relation = ExpressionParser.parseRelation(constraint.getExpression());
                relation.toLinear();
                checkIdentifiers(relation.identifiers(), declared, field, result);
                used.addAll(relation.identifiers());
            } catch (ExpressionException e) {
                result.fail(field, e.getMessage());
            }
        }

        Objective objective = model.getObjective();
        if (objective == null) {
            result.fail("objective", "missing");
        } else {
            if (objective.getDirection() == null) {
                result.fail("objective.direction", "must be minimize or maximize");
            }
            if (isBlank(objective.getExpression())) {
                result.fail("objective.expression", "must not be empty");
            } else {
                try {
                    Expression expression = ExpressionParser.parseExpression(objective.getExpression());
                    expression.toLinear();
                    Set<String> ids = new LinkedHashSet<>();
                    expression.collectIdentifiers(ids);
                    checkIdentifiers(ids, declared, "objective.expression", result);
                    used.addAll(ids);
                } catch (ExpressionException e) {
                    result.fail("objective.expression", e.getMessage());
                }
            }
        }

        for (String name : declared) {
            if (!used.contains(name)) {
                result.fail("variables." + name, "declared but not used in any constraint or the objective");
            }
        }

        List<ReasoningStep> trace = model.getReasoningTrace();
        for (int i = 0; i < trace.size(); i++) {
            if (trace.get(i) == null || isBlank(trace.get(i).getStepName())) {
                result.fail("reasoning_trace[" + i + "].step_name", "must not be empty");
            }
        }
        return result;
    }

    private Set<String> checkVariables(List<Variable> variables, ValidationResult result) {
        Set<String> declared = new LinkedHashSet<>();
        for (int i = 0; i < variables.size(); i++) {
            String field = "variables[" + i + "]";
            Variable v = variables.get(i);
            if (v == null) {
                result.fail(field, "missing");
                continue;
            }
            if (isBlank(v.getName()) || !IDENTIFIER.matcher(v.getName()).matches()) {
                result.fail(field + ".name", "'" + v.getName() + "' is not a valid identifier");
                continue;
            }
            if (!declared.add(v.getName())) {
                result.fail(field + ".name", "duplicate variable '" + v.getName() + "'");
            }
            if (v.getKind() == null) {
                result.fail(field + ".kind", "must be one of continuous, integer, binary");
            }
            Double lower = v.getLowerBound();
            Double upper = v.getUpperBound();
            if ((lower != null && lower.isNaN()) || (upper != null && upper.isNaN())) {
                result.fail(field, "bounds must be numbers");
            } else if (lower != null && upper != null && lower > upper) {
                result.fail(field, "lower bound " + lower + " exceeds upper bound " + upper);
            }
        }
        return declared;
    }

    private void checkIdentifiers(Set<String> ids, Set<String> declared, String field, ValidationResult result) {
        for (String id : ids) {
            if (!declared.contains(id)) {
                result.fail(field, "identifier '" + id + "' is not a declared variable");
            }
        }
    }
}
