package com.dcision.pipeline.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class Constraint {
    String expression; // relation, e.g. "x1 + x2 + x3 >= 800"
    String description;
}
