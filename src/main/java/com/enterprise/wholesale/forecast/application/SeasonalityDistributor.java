package com.enterprise.wholesale.forecast.application;

import com.enterprise.wholesale.forecast.domain.MonthlySplit;
import com.enterprise.wholesale.forecast.domain.SeasonalDistribution;
import com.enterprise.wholesale.forecast.domain.SeasonalityCurve;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Spreads an annual amount over quarters, then each quarter over its months.
 *
 * <p>Every slot is a whole number of cents, never negative, and the slots
 * of each level add back up to the whole exactly.
 */
public class SeasonalityDistributor {

    private static final int CENTS = 2;
    private static final BigDecimal CENT = new BigDecimal("0.01");

    public SeasonalDistribution distribute(BigDecimal annual,
                                           SeasonalityCurve curve,
                                           List<MonthlySplit> monthlySplits) {
        Objects.requireNonNull(curve, "curve");
        if (annual == null || annual.signum() < 0) {
            throw new IllegalArgumentException("annual amount must be non-negative: " + annual);
        }
        if (monthlySplits == null || monthlySplits.size() != 4) {
            throw new IllegalArgumentException("one monthly split per quarter is required, got "
                    + (monthlySplits == null ? "none" : monthlySplits.size()));
        }

        BigDecimal total = annual.setScale(CENTS, RoundingMode.HALF_UP);
        List<BigDecimal> quarterly = allocate(total, curve.weights());
        List<BigDecimal> monthly = new ArrayList<>(12);
        for (int q = 0; q < 4; q++) {
            monthly.addAll(allocate(quarterly.get(q), monthlySplits.get(q).weights()));
        }
        return new SeasonalDistribution(total, quarterly, monthly);
    }

    /** Convenience overload using the standard monthly splits. */
    public SeasonalDistribution distribute(BigDecimal annual, SeasonalityCurve curve) {
        return distribute(annual, curve, MonthlySplit.standardYear());
    }

    /**
     * Largest-remainder allocation: every slot gets its share rounded down to
     * the cent, then the leftover cents go one at a time to the slots with the
     * biggest rounding loss (earlier slot first on ties). No slot is negative
     * and the slots add up to {@code amount} exactly.
     */
    static List<BigDecimal> allocate(BigDecimal amount, List<BigDecimal> weights) {
        BigDecimal weightSum = weights.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
        int n = weights.size();
        BigDecimal[] parts = new BigDecimal[n];
        BigDecimal[] losses = new BigDecimal[n];
        BigDecimal allocated = BigDecimal.ZERO;
        for (int i = 0; i < n; i++) {
            BigDecimal exact = weightSum.signum() == 0
                    ? BigDecimal.ZERO
                    : amount.multiply(weights.get(i)).divide(weightSum, MathContext.DECIMAL128);
            parts[i] = exact.setScale(CENTS, RoundingMode.DOWN);
            losses[i] = exact.subtract(parts[i]);
            allocated = allocated.add(parts[i]);
        }

        List<Integer> order = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            order.add(i);
        }
        order.sort(Comparator.comparing((Integer i) -> losses[i]).reversed()
                .thenComparing((Integer i) -> weights.get(i), Comparator.reverseOrder())
                .thenComparing(Comparator.naturalOrder()));

        int leftoverCents = amount.subtract(allocated).movePointRight(CENTS).intValueExact();
        for (int k = 0; k < leftoverCents; k++) {
            int slot = order.get(k % n);
            parts[slot] = parts[slot].add(CENT);
        }
        return List.of(parts);
    }
}
