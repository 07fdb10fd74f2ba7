package com.dcision.pipeline.expression;

import lombok.Value;

import java.util.Set;

@Value
public class VariableRef implements Expression {
    String name;

    @Override
    public void collectIdentifiers(Set<String> into) {
        into.add(name);
    }

    @Override
    public LinearForm toLinear() {
        return LinearForm.variable(name);
    }
}
