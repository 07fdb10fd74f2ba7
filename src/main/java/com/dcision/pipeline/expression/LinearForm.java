package com.dcision.pipeline.expression;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code sum(coefficient_i * variable_i) + constant}. Immutable; zero coefficients are dropped.
 */
@EqualsAndHashCode
@ToString
public final class LinearForm {

    private static final double EPSILON = 1e-12;

    private final Map<String, Double> coefficients;
    @Getter
    private final double constant;

    private LinearForm(Map<String, Double> coefficients, double constant) {
        if (!Double.isFinite(constant) || coefficients.values().stream().anyMatch(v -> !Double.isFinite(v))) {
            throw new ExpressionException("coefficient out of range");
        }
        this.coefficients = Collections.unmodifiableMap(coefficients);
        this.constant = constant;
    }

    public static LinearForm constant(double value) {
        return new LinearForm(new LinkedHashMap<>(), value);
    }

    public static LinearForm variable(String name) {
        Map<String, Double> c = new LinkedHashMap<>();
        c.put(name, 1.0);
        return new LinearForm(c, 0.0);
    }

    public Map<String, Double> getCoefficients() {
        return coefficients;
    }

    public double coefficient(String name) {
        return coefficients.getOrDefault(name, 0.0);
    }

    public boolean isConstant() {
        return coefficients.isEmpty();
    }

    public LinearForm plus(LinearForm other) {
        Map<String, Double> sum = new LinkedHashMap<>(coefficients);
        other.coefficients.forEach((name, value) -> sum.merge(name, value, Double::sum));
        sum.values().removeIf(v -> Math.abs(v) < EPSILON);
        return new LinearForm(sum, constant + other.constant);
    }

    public LinearForm scale(double factor) {
        Map<String, Double> scaled = new LinkedHashMap<>();
        if (factor != 0.0) {
            coefficients.forEach((name, value) -> scaled.put(name, value * factor));
        }
        return new LinearForm(scaled, constant * factor);
    }
}
