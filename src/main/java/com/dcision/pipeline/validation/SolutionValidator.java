package com.dcision.pipeline.validation;

import com.dcision.pipeline.domain.SolutionRecord;
import com.dcision.pipeline.domain.SolveStatus;
import com.dcision.pipeline.domain.SolverRequirements;
import com.dcision.pipeline.domain.StageContext;
import org.springframework.stereotype.Component;

/**
 * Keeps a run auditable against its declared requirement: the solver that produced the
 * solution must be one the intent stage declared, even if the adapter supports others.
 */
@Component
public class SolutionValidator implements StageValidator<SolutionRecord> {

    @Override
    public ValidationResult validate(SolutionRecord solution, StageContext context) {
        ValidationResult result = ValidationResult.ok();
        if (solution == null) {
            return result.fail("solution", "missing");
        }
        SolverRequirements declared = context.getIntent() == null
                ? null : context.getIntent().getSolverCapabilityRequirements();
        if (declared == null || !declared.declaredSolvers().contains(solution.getSolverUsed())) {
            result.fail("solver_used", "solver '" + solution.getSolverUsed()
                    + "' is not among the declared capabilities "
                    + (declared == null ? "[]" : declared.declaredSolvers()));
        }
        if (solution.getStatus() == null) {
            result.fail("status", "missing");
        } else if (solution.getStatus() == SolveStatus.OPTIMAL) {
            if (solution.getObjectiveValue() == null) {
                result.fail("objective_value", "required when status is optimal");
            }
            if (context.getModel() != null) {
                context.getModel().getVariables().stream()
                        .filter(v -> !solution.getVariableValues().containsKey(v.getName()))
                        .forEach(v -> result.fail("variable_values", "no value for '" + v.getName() + "'"));
            }
        } else if (!solution.getVariableValues().isEmpty() || solution.getObjectiveValue() != null) {
            result.fail("variable_values", "values are only reported for optimal solutions");
        }
        return result;
    }
}
