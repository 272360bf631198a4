package com.enterprise.wholesale.forecast.domain;

import java.math.BigDecimal;
import java.util.List;

/**
 * Validation shared by seasonality curves and monthly splits.
 */
final class WeightSet {

    static final BigDecimal TOLERANCE = new BigDecimal("0.0001");

    private WeightSet() {}

    static List<BigDecimal> validate(String kind, List<BigDecimal> weights, int arity) {
        if (weights == null || weights.size() != arity) {
            throw new IllegalArgumentException(kind + " needs " + arity + " weights, got "
                    + (weights == null ? "none" : weights.size()));
        }
        BigDecimal sum = BigDecimal.ZERO;
        for (BigDecimal w : weights) {
            if (w == null || w.signum() < 0) {
                throw new IllegalArgumentException(kind + " weights must be non-negative: " + weights);
            }
            sum = sum.add(w);
        }
        if (sum.subtract(BigDecimal.ONE).abs().compareTo(TOLERANCE) > 0) {
            throw new IllegalArgumentException(kind + " weights must sum to 1.0, got " + sum);
        }
        return List.copyOf(weights);
    }

    static List<BigDecimal> of(String... weights) {
        return java.util.Arrays.stream(weights).map(BigDecimal::new).toList();
    }
}
