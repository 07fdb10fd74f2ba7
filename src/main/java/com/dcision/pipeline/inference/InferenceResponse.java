package com.dcision.pipeline.inference;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class InferenceResponse {
    String regionId;
    String rawPayload;
    long latencyMs;
    long inputTokens;
    long outputTokens;
}
