package com.dcision.pipeline.expression;

import lombok.Value;

import java.util.Set;

@Value
public class Negation implements Expression {
    Expression operand;

    @Override
    public void collectIdentifiers(Set<String> into) {
        operand.collectIdentifiers(into);
    }

    @Override
    public LinearForm toLinear() {
        return operand.toLinear().scale(-1.0);
    }
}
