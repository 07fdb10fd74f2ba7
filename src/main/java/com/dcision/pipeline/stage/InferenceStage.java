package com.dcision.pipeline.stage;

import com.dcision.pipeline.config.PipelineProperties;
import com.dcision.pipeline.domain.StageContext;
import com.dcision.pipeline.exception.ErrorKind;
import com.dcision.pipeline.exception.PipelineException;
import com.dcision.pipeline.exception.StageValidationException;
import com.dcision.pipeline.inference.InferenceResponse;
import com.dcision.pipeline.inference.JsonPayloadExtractor;
import com.dcision.pipeline.validation.StageValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of the stages answered by a language model: render a prompt, route the call,
 * then pull a typed result out of the untrusted text that comes back.
 */
public abstract class InferenceStage<T> implements PipelineStage<T> {

    protected final InferenceGateway gateway;
    protected final JsonPayloadExtractor extractor;
    protected final ObjectMapper objectMapper;
    protected final PipelineProperties properties;
    private final ResponseSchemas schemas;
    private final StageValidator<T> validator;

    protected InferenceStage(InferenceGateway gateway, JsonPayloadExtractor extractor, ObjectMapper objectMapper,
                             PipelineProperties properties, ResponseSchemas schemas, StageValidator<T> validator) {
        this.gateway = gateway;
        this.extractor = extractor;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.schemas = schemas;
        this.validator = validator;
    }

    protected abstract String modelId();

    protected abstract String prompt(StageContext context);

    /**
     * Hook for fixing known shape deviations before binding. The default keeps the payload.
     */
    protected ObjectNode repair(ObjectNode payload) {
        return payload;
    }

    @Override
    public Map<String, Object> parameters() {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("model_id", modelId());
        parameters.put("prompt_version", PromptTemplates.VERSION);
        parameters.put("max_tokens", properties.getInference().getMaxTokens());
        parameters.put("temperature", properties.getInference().getTemperature());
        return parameters;
    }

    @Override
    public Duration timeout() {
        return properties.getInferenceTimeout();
    }

    @Override
    public StageValidator<T> validator() {
        return validator;
    }

    @Override
    public T produce(StageContext context, StageAttempt attempt) {
        InferenceResponse response = gateway.call(modelId(), prompt(context), schemas.forStage(name()), attempt);
        JsonNode payload = extractor.extract(response.getRawPayload())
                .orElseThrow(() -> StageValidationException.malformed("response: no JSON object found"));
        try {
            return objectMapper.treeToValue(repair((ObjectNode) payload), outputType());
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw StageValidationException.malformed("response: does not match the "
                    + name().wireName() + " schema: " + e.getMessage());
        }
    }

    protected String json(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PipelineException(ErrorKind.INTERNAL, "Cannot render prompt input", e);
        }
    }
}
