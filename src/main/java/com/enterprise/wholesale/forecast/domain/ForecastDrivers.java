package com.enterprise.wholesale.forecast.domain;

import com.enterprise.wholesale.customer.domain.CustomerSegment;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Door-level planning inputs for one fiscal year. Percentages are fractions
 * ({@code 0.17} for 17%).
 *
 * @param fiscalYear            calendar year being planned
 * @param existingDoorsStart    doors at the start of the year; null to use the current door count
 * @param expectedChurnPct      share of starting doors expected to churn; null to use the benchmark
 * @param expectedChurnDoors    absolute churn count, wins over {@code expectedChurnPct} when set
 * @param organicGrowthPct      same-store growth of retained doors
 * @param newDoorTargets        doors to open per segment
 * @param segmentYields         first-year yield per segment; missing segments use the benchmark
 * @param doorsAcquiredToDate   doors already opened this year, null when not tracked
 * @param b2bAnnualTarget       B2B revenue target the projection is measured against
 * @param corporateAnnualTarget corporate gifting revenue target
 */
public record ForecastDrivers(
    int fiscalYear,
    Integer existingDoorsStart,
    BigDecimal expectedChurnPct,
    Integer expectedChurnDoors,
    BigDecimal organicGrowthPct,
    Map<CustomerSegment, Integer> newDoorTargets,
    Map<CustomerSegment, BigDecimal> segmentYields,
    Integer doorsAcquiredToDate,
    BigDecimal b2bAnnualTarget,
    BigDecimal corporateAnnualTarget
) {

    public ForecastDrivers {
        if (organicGrowthPct == null) {
            throw new IllegalArgumentException("organicGrowthPct is required");
        }
        if (organicGrowthPct.compareTo(BigDecimal.ONE.negate()) < 0) {
            throw new IllegalArgumentException("organicGrowthPct must be at least -1: " + organicGrowthPct);
        }
        if (expectedChurnPct != null
                && (expectedChurnPct.signum() < 0 || expectedChurnPct.compareTo(BigDecimal.ONE) > 0)) {
            throw new IllegalArgumentException("expectedChurnPct must be within [0, 1]: " + expectedChurnPct);
        }
        requireNonNegative("existingDoorsStart", existingDoorsStart);
        requireNonNegative("expectedChurnDoors", expectedChurnDoors);
        requireNonNegative("doorsAcquiredToDate", doorsAcquiredToDate);
        requireNonNegative("b2bAnnualTarget", b2bAnnualTarget);
        requireNonNegative("corporateAnnualTarget", corporateAnnualTarget);

        Map<CustomerSegment, Integer> targets = new EnumMap<>(CustomerSegment.class);
        Map<CustomerSegment, BigDecimal> yields = new EnumMap<>(CustomerSegment.class);
        for (CustomerSegment segment : CustomerSegment.values()) {
            Integer target = newDoorTargets == null ? null : newDoorTargets.get(segment);
            requireNonNegative("newDoorTargets." + segment, target);
            targets.put(segment, target == null ? 0 : target);

            BigDecimal yield = segmentYields == null ? null : segmentYields.get(segment);
            requireNonNegative("segmentYields." + segment, yield);
            if (yield != null) {
                yields.put(segment, yield);
            }
        }
        newDoorTargets = Map.copyOf(targets);
        segmentYields = Map.copyOf(yields);
        b2bAnnualTarget = Objects.requireNonNullElse(b2bAnnualTarget, BigDecimal.ZERO);
        corporateAnnualTarget = Objects.requireNonNullElse(corporateAnnualTarget, BigDecimal.ZERO);
    }

    public int totalNewDoors() {
        return newDoorTargets.values().stream().mapToInt(Integer::intValue).sum();
    }

    public int newDoorTarget(CustomerSegment segment) {
        return newDoorTargets.get(segment);
    }

    public ForecastDrivers withOrganicGrowthPct(BigDecimal pct) {
        return new ForecastDrivers(fiscalYear, existingDoorsStart, expectedChurnPct, expectedChurnDoors,
                pct, newDoorTargets, segmentYields, doorsAcquiredToDate,
                b2bAnnualTarget, corporateAnnualTarget);
    }

    public ForecastDrivers withNewDoorTargets(Map<CustomerSegment, Integer> targets) {
        return new ForecastDrivers(fiscalYear, existingDoorsStart, expectedChurnPct, expectedChurnDoors,
                organicGrowthPct, targets, segmentYields, doorsAcquiredToDate,
                b2bAnnualTarget, corporateAnnualTarget);
    }

    public ForecastDrivers withChurn(BigDecimal pct, Integer doors) {
        return new ForecastDrivers(fiscalYear, existingDoorsStart, pct, doors,
                organicGrowthPct, newDoorTargets, segmentYields, doorsAcquiredToDate,
                b2bAnnualTarget, corporateAnnualTarget);
    }

    private static void requireNonNegative(String name, Integer value) {
        if (value != null && value < 0) {
            throw new IllegalArgumentException(name + " must be non-negative: " + value);
        }
    }

    private static void requireNonNegative(String name, BigDecimal value) {
        if (value != null && value.signum() < 0) {
            throw new IllegalArgumentException(name + " must be non-negative: " + value);
        }
    }
}
