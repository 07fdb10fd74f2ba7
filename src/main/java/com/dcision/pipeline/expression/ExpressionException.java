package com.dcision.pipeline.expression;

/**
 * An expression is not in the restricted algebraic grammar, or is not linear.
 */
public class ExpressionException extends RuntimeException {

    public ExpressionException(String message) {
        super(message);
    }
}
