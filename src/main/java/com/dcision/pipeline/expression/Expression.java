package com.dcision.pipeline.expression;

import java.util.Set;

/**
 * Node of the algebraic AST.
 */
public interface Expression {

    void collectIdentifiers(Set<String> into);

    /**
     * Reduces this node to a linear form.
     *
     * @throws ExpressionException if the node multiplies two variables or divides by one
     */
    LinearForm toLinear();
}
