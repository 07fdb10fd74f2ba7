package com.dcision.pipeline.validation;

import lombok.Value;

/**
 * One finding of a validator, addressed to a field path such as {@code variables[2].name}.
 */
@Value
public class Diagnostic {
    String field;
    String message;

    @Override
    public String toString() {
        return field + ": " + message;
    }
}
