package com.dcision.pipeline.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * A decision variable. A null bound means "not declared": the lower bound then
 * defaults to 0 and the upper bound to +infinity.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Variable {
    String name;
    VariableKind kind;
    Double lowerBound;
    Double upperBound;
    String description;
}
