package com.dcision.pipeline.stage;

import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.domain.SolutionRecord;
import com.dcision.pipeline.domain.StageContext;
import com.dcision.pipeline.domain.StageName;
import com.dcision.pipeline.engine.SolverAdapter;
import com.dcision.pipeline.validation.SolutionValidator;
import com.dcision.pipeline.validation.StageValidator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands the validated model to the solver adapter with the solvers the intent declared.
 */
@Component
@RequiredArgsConstructor
public class SolvingStage implements PipelineStage<SolutionRecord> {

    private final SolverAdapter solverAdapter;
    private final SolutionValidator validator;
    private final PipelineProperties properties;

    @Override
    public StageName name() {
        return StageName.SOLVING;
    }

    @Override
    public Class<SolutionRecord> outputType() {
        return SolutionRecord.class;
    }

    @Override
    public Object fingerprintInputs(StageContext context) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("model", context.getModel());
        inputs.put("solver_requirements", context.getIntent().getSolverCapabilityRequirements());
        return inputs;
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        properties.getSolvers().forEach(s -> parameters.put(s.getId(), s.getEngine()));
        return parameters;
    }

    @Override
    public Duration timeout() {
        return properties.getSolveTimeout();
    }

    @Override
    public SolutionRecord produce(StageContext context, StageAttempt attempt) {
        return solverAdapter.solve(context.getModel(), context.getIntent().getSolverCapabilityRequirements());
    }

    @Override
    public StageValidator<SolutionRecord> validator() {
        return validator;
    }
}
