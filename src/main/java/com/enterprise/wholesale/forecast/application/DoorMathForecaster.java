package com.enterprise.wholesale.forecast.application;

import com.enterprise.wholesale.customer.domain.CustomerSegment;
import com.enterprise.wholesale.forecast.domain.ForecastBenchmarks;
import com.enterprise.wholesale.forecast.domain.ForecastDrivers;
import com.enterprise.wholesale.forecast.domain.ForecastProjection;
import com.enterprise.wholesale.forecast.domain.NewDoorFactors;

import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.Objects;

/**
 * Projects B2B revenue for a fiscal year from door counts.
 *
 * <pre>
 * retained   = starting - churn
 * existing   = retained * returningDoorAvgYield * (1 + organicGrowth)
 * newDoors   = Σ target * yield * contribution factor
 * projected  = existing + newDoors
 * gap        = target - projected
 * </pre>
 */
@Slf4j
public class DoorMathForecaster {

    private static final int SCALE = 10;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ForecastBenchmarks benchmarks;

    public DoorMathForecaster(ForecastBenchmarks benchmarks) {
        this.benchmarks = Objects.requireNonNull(benchmarks, "benchmarks");
    }

    public ForecastProjection projectForecast(ForecastDrivers drivers, int startingDoors, LocalDate asOf) {
        Objects.requireNonNull(drivers, "drivers");
        Objects.requireNonNull(asOf, "asOf");
        if (startingDoors < 0) {
            throw new IllegalArgumentException("startingDoors must be non-negative: " + startingDoors);
        }

        int churnDoors = expectedChurnDoors(drivers, startingDoors);
        int retained = startingDoors - churnDoors;

        BigDecimal existingBase = BigDecimal.valueOf(retained).multiply(benchmarks.returningDoorAvgYield());
        BigDecimal organicGrowth = existingBase.multiply(drivers.organicGrowthPct());
        BigDecimal existingTotal = existingBase.add(organicGrowth);

        NewDoorFactors factors = NewDoorContributionFactors.compute(drivers.fiscalYear(), asOf);
        int totalNewDoors = drivers.totalNewDoors();
        BigDecimal newDoorRevenue = newDoorRevenue(drivers, totalNewDoors, factors);

        BigDecimal projected = existingTotal.add(newDoorRevenue);
        BigDecimal target = drivers.b2bAnnualTarget();
        BigDecimal gap = target.subtract(projected);

        ForecastProjection projection = new ForecastProjection(
            drivers.fiscalYear(),
            asOf,
            startingDoors,
            churnDoors,
            retained,
            existingBase,
            organicGrowth,
            existingTotal,
            totalNewDoors,
            factors,
            newDoorRevenue,
            projected,
            startingDoors - churnDoors + totalNewDoors,
            target,
            gap,
            gapPct(gap, target),
            doorsNeeded(gap, factors));

        log.debug("Projection {}: {} doors → {} retained, projected {} against {}",
                drivers.fiscalYear(), startingDoors, retained, projected, target);
        return projection;
    }

    private int expectedChurnDoors(ForecastDrivers drivers, int startingDoors) {
        int churnDoors;
        if (drivers.expectedChurnDoors() != null) {
            churnDoors = drivers.expectedChurnDoors();
        } else {
            BigDecimal pct = drivers.expectedChurnPct() != null
                    ? drivers.expectedChurnPct()
                    : benchmarks.churnPct();
            churnDoors = BigDecimal.valueOf(startingDoors).multiply(pct)
                    .setScale(0, RoundingMode.HALF_UP)
                    .intValueExact();
        }
        if (churnDoors > startingDoors) {
            throw new IllegalArgumentException("expectedChurnDoors " + churnDoors
                    + " exceeds starting doors " + startingDoors);
        }
        return churnDoors;
    }

    private BigDecimal newDoorRevenue(ForecastDrivers drivers, int totalNewDoors, NewDoorFactors factors) {
        BigDecimal plannedYield = BigDecimal.ZERO;
        for (CustomerSegment segment : CustomerSegment.values()) {
            plannedYield = plannedYield.add(
                    BigDecimal.valueOf(drivers.newDoorTarget(segment)).multiply(yieldFor(drivers, segment)));
        }

        Integer acquired = drivers.doorsAcquiredToDate();
        if (acquired == null) {
            return plannedYield.multiply(factors.remainingFactor());
        }

        // no planned doors means no planned yield to spread over acquisitions
        BigDecimal blendedYield = totalNewDoors > 0
                ? plannedYield.divide(BigDecimal.valueOf(totalNewDoors), SCALE, RoundingMode.HALF_UP)
                : BigDecimal.ZERO;
        int stillToOpen = Math.max(0, totalNewDoors - acquired);
        BigDecimal acquiredRevenue = BigDecimal.valueOf(acquired)
                .multiply(blendedYield).multiply(factors.acquiredFactor());
        BigDecimal remainingRevenue = BigDecimal.valueOf(stillToOpen)
                .multiply(blendedYield).multiply(factors.remainingFactor());
        return acquiredRevenue.add(remainingRevenue);
    }

    private BigDecimal yieldFor(ForecastDrivers drivers, CustomerSegment segment) {
        BigDecimal override = drivers.segmentYields().get(segment);
        return override != null ? override : benchmarks.segmentYield(segment);
    }

    private static BigDecimal gapPct(BigDecimal gap, BigDecimal target) {
        if (target.signum() == 0) {
            return BigDecimal.ZERO.setScale(1);
        }
        return gap.multiply(HUNDRED).divide(target, 1, RoundingMode.HALF_UP);
    }

    private Integer doorsNeeded(BigDecimal gap, NewDoorFactors factors) {
        if (gap.signum() <= 0) {
            return 0;
        }
        BigDecimal perDoor = benchmarks.newDoorFirstYearYield().multiply(factors.remainingFactor());
        if (perDoor.signum() <= 0) {
            return null;
        }
        return gap.divide(perDoor, 0, RoundingMode.CEILING).intValueExact();
    }
}
