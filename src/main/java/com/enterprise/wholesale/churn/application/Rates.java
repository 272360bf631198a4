package com.enterprise.wholesale.churn.application;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Percentage and average helpers shared by the churn analyzers.
 * Results carry one decimal place.
 */
final class Rates {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Rates() {}

    /** {@code part / whole * 100}, or zero when {@code whole} is not positive. */
    static BigDecimal percent(long part, long whole) {
        if (whole <= 0) {
            return BigDecimal.ZERO.setScale(1);
        }
        return BigDecimal.valueOf(part)
            .multiply(HUNDRED)
            .divide(BigDecimal.valueOf(whole), 1, RoundingMode.HALF_UP);
    }

    static BigDecimal average(Collection<Integer> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO.setScale(1);
        }
        long sum = values.stream().mapToLong(Integer::longValue).sum();
        return BigDecimal.valueOf(sum)
            .divide(BigDecimal.valueOf(values.size()), 1, RoundingMode.HALF_UP);
    }
}
