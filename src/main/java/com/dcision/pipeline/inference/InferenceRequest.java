package com.dcision.pipeline.inference;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InferenceRequest {
    String modelId;
    String regionId;
    String prompt;
    JsonNode responseSchema;
    int maxTokens;
    double temperature;
}
