package com.dcision.pipeline.expression;

public enum RelationOperator {
    LESS_OR_EQUAL("<="),
    GREATER_OR_EQUAL(">="),
    EQUAL("="),
    // strict comparisons are solved as their non-strict counterparts
    LESS("<"),
    GREATER(">");

    private final String symbol;

    RelationOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
