package com.dcision.pipeline.validation;

import com.dcision.pipeline.domain.IntentResult;
import com.dcision.pipeline.domain.StageContext;
import com.dcision.pipeline.domain.SolverRequirements;
import org.springframework.stereotype.Component;

import static com.dcision.pipeline.validation.ValidationSupport.isBlank;
import static com.dcision.pipeline.validation.ValidationSupport.isUnitInterval;

@Component
public class IntentValidator implements StageValidator<IntentResult> {

    @Override
    public ValidationResult validate(IntentResult intent, StageContext context) {
        ValidationResult result = ValidationResult.ok();
        if (intent == null) {
            return result.fail("intent", "missing");
        }
        if (isBlank(intent.getIntentLabel())) {
            result.fail("intent_label", "must not be empty");
        }
        if (isBlank(intent.getIndustryLabel())) {
            result.fail("industry_label", "must not be empty");
        }
        if (intent.getComplexity() == null) {
            result.fail("complexity", "must be one of low, medium, high");
        }
        if (!isUnitInterval(intent.getConfidence())) {
            result.fail("confidence", "must be within [0,1] but was " + intent.getConfidence());
        }
        SolverRequirements requirements = intent.getSolverCapabilityRequirements();
        if (requirements == null || requirements.getPrimary().isEmpty()) {
            result.fail("solver_capability_requirements.primary", "must declare at least one solver");
        } else if (requirements.declaredSolvers().stream().anyMatch(ValidationSupport::isBlank)) {
            result.fail("solver_capability_requirements", "solver ids must not be blank");
        }
        return result;
    }
}
