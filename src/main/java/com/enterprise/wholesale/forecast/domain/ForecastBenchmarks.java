package com.enterprise.wholesale.forecast.domain;

import com.enterprise.wholesale.customer.domain.CustomerSegment;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Historical door economics used when a forecast does not supply its own.
 *
 * @param churnPct               share of starting doors lost per year, as a fraction
 * @param sameStoreGrowthPct     organic growth of retained doors, as a fraction
 * @param newDoorFirstYearYield  first-year revenue of a door opened on January 1
 * @param returningDoorAvgYield  annual revenue of a retained door
 * @param segmentYields          first-year revenue per new door by segment
 */
public record ForecastBenchmarks(
    BigDecimal churnPct,
    BigDecimal sameStoreGrowthPct,
    BigDecimal newDoorFirstYearYield,
    BigDecimal returningDoorAvgYield,
    Map<CustomerSegment, BigDecimal> segmentYields
) {

    public ForecastBenchmarks {
        Objects.requireNonNull(churnPct, "churnPct");
        Objects.requireNonNull(sameStoreGrowthPct, "sameStoreGrowthPct");
        requireNonNegative("newDoorFirstYearYield", newDoorFirstYearYield);
        requireNonNegative("returningDoorAvgYield", returningDoorAvgYield);
        if (churnPct.signum() < 0 || churnPct.compareTo(BigDecimal.ONE) > 0) {
            throw new IllegalArgumentException("churnPct must be within [0, 1]: " + churnPct);
        }
        Map<CustomerSegment, BigDecimal> yields = new EnumMap<>(CustomerSegment.class);
        for (CustomerSegment segment : CustomerSegment.values()) {
            BigDecimal yield = segmentYields.get(segment);
            requireNonNegative("segment yield " + segment, yield);
            yields.put(segment, yield);
        }
        segmentYields = Map.copyOf(yields);
    }

    public static ForecastBenchmarks defaults() {
        return new ForecastBenchmarks(
            new BigDecimal("0.17"),
            new BigDecimal("0.11"),
            new BigDecimal("6000"),
            new BigDecimal("11500"),
            Map.of(CustomerSegment.MAJOR, new BigDecimal("25000"),
                   CustomerSegment.MID, new BigDecimal("8000"),
                   CustomerSegment.SMALL, new BigDecimal("2500")));
    }

    public BigDecimal segmentYield(CustomerSegment segment) {
        return segmentYields.get(segment);
    }

    private static void requireNonNegative(String name, BigDecimal value) {
        if (value == null || value.signum() < 0) {
            throw new IllegalArgumentException(name + " must be non-negative: " + value);
        }
    }
}
