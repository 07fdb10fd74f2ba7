package com.dcision.pipeline.expression;

import lombok.Value;

import java.util.Set;

@Value
public class BinaryOp implements Expression {

    public enum Operator { ADD, SUBTRACT, MULTIPLY, DIVIDE }

    Operator operator;
    Expression left;
    Expression right;

    @Override
    public void collectIdentifiers(Set<String> into) {
        left.collectIdentifiers(into);
        right.collectIdentifiers(into);
    }

    @Override
    public LinearForm toLinear() {
        LinearForm l = left.toLinear();
        LinearForm r = right.toLinear();
        return switch (operator) {
            case ADD -> l.plus(r);
            case SUBTRACT -> l.plus(r.scale(-1.0));
            case MULTIPLY -> {
                if (!l.isConstant() && !r.isConstant()) {
                    throw new ExpressionException("non-linear term: product of variables");
                }
                yield l.isConstant() ? r.scale(l.getConstant()) : l.scale(r.getConstant());
            }
            case DIVIDE -> {
                if (!r.isConstant()) {
                    throw new ExpressionException("non-linear term: division by a variable");
                }
                if (r.getConstant() == 0.0) {
                    throw new ExpressionException("division by zero");
                }
                yield l.scale(1.0 / r.getConstant());
            }
        };
    }
}
