package com.dcision.pipeline.expression;

import lombok.Value;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * {@code left operator right}, the shape of every constraint.
 */
@Value
public class Relation {
    Expression left;
    RelationOperator operator;
    Expression right;

    public Set<String> identifiers() {
        Set<String> ids = new LinkedHashSet<>();
        left.collectIdentifiers(ids);
        right.collectIdentifiers(ids);
        return ids;
    }

    /**
     * Moves everything to the left-hand side: {@code left - right operator 0}.
     */
    public LinearForm toLinear() {
        return left.toLinear().plus(right.toLinear().scale(-1.0));
    }
}
