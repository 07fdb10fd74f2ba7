package com.dcision.pipeline.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ReasoningStep {
    String stepName;
    String text;
}
