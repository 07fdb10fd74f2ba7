package com.dcision.pipeline.stage;

import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.domain.IntentResult;
import com.dcision.pipeline.domain.ProblemRequest;
import com.dcision.pipeline.domain.StageContext;
import com.dcision.pipeline.domain.StageName;
import com.dcision.pipeline.inference.JsonPayloadExtractor;
import com.dcision.pipeline.validation.IntentValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

@Component
public class IntentStage extends InferenceStage<IntentResult> {

    public IntentStage(InferenceGateway gateway, JsonPayloadExtractor extractor, ObjectMapper objectMapper,
                       PipelineProperties properties, ResponseSchemas schemas, IntentValidator validator) {
        super(gateway, extractor, objectMapper, properties, schemas, validator);
    }

    @Override
    public StageName name() {
        return StageName.INTENT;
    }

    @Override
    public Class<IntentResult> outputType() {
        return IntentResult.class;
    }

    @Override
    protected String modelId() {
        return properties.getModels().getIntent();
    }

    @Override
    public Object fingerprintInputs(StageContext context) {
        return requestInputs(context.getRequest());
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> parameters = super.parameters();
        // the prompt lists the configured solvers
        parameters.put("solvers", properties.getSolvers().stream().map(PipelineProperties.Solver::getId).toList());
        return parameters;
    }

    @Override
    protected String prompt(StageContext context) {
        ProblemRequest request = context.getRequest();
        return PromptTemplates.INTENT.formatted(request.getRawText(), json(request.getHints()),
                properties.getSolvers().stream().map(PipelineProperties.Solver::getId).toList());
    }

    static Map<String, Object> requestInputs(ProblemRequest request) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        inputs.put("text", request.getRawText());
        inputs.put("hints", new TreeMap<>(request.getHints()));
        return inputs;
    }
}
