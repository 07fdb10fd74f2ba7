package com.dcision.pipeline.stage;

import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.domain.DataAnalysisResult;
import com.dcision.pipeline.domain.StageContext;
import com.dcision.pipeline.domain.StageName;
import com.dcision.pipeline.inference.JsonPayloadExtractor;
import com.dcision.pipeline.validation.DataAnalysisValidator;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
public class DataAnalysisStage extends InferenceStage<DataAnalysisResult> {

    public DataAnalysisStage(InferenceGateway gateway, JsonPayloadExtractor extractor, ObjectMapper objectMapper,
                             PipelineProperties properties, ResponseSchemas schemas,
                             DataAnalysisValidator validator) {
        super(gateway, extractor, objectMapper, properties, schemas, validator);
    }

    @Override
    public StageName name() {
        return StageName.DATA_ANALYSIS;
    }

    @Override
    public Class<DataAnalysisResult> outputType() {
        return DataAnalysisResult.class;
    }

    @Override
    protected String modelId() {
        return properties.getModels().getDataAnalysis();
    }

    @Override
    public Object fingerprintInputs(StageContext context) {
        Map<String, Object> inputs = IntentStage.requestInputs(context.getRequest());
        inputs.put("intent", context.getIntent());
        return inputs;
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> parameters = super.parameters();
        parameters.put("readiness_threshold", properties.getReadinessThreshold());
        return parameters;
    }

    @Override
    protected String prompt(StageContext context) {
        return PromptTemplates.DATA_ANALYSIS.formatted(context.getRequest().getRawText(), json(context.getIntent()));
    }
}
