package com.dcision.pipeline.expression;

import lombok.Value;

import java.util.Set;

@Value
public class NumberLiteral implements Expression {
    double value;

    @Override
    public void collectIdentifiers(Set<String> into) {
    }

    @Override
    public LinearForm toLinear() {
        return LinearForm.constant(value);
    }
}
