package com.enterprise.wholesale.forecast.domain;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;

/**
 * A {@link ForecastProjection} rounded to whole currency units for publishing.
 */
public record ForecastProjectionRow(
    Long forecastId,
    LocalDate asOfDate,
    int fiscalYear,
    int startingDoors,
    int expectedChurnDoors,
    int retainedDoors,
    BigDecimal existingDoorBase,
    BigDecimal organicGrowth,
    BigDecimal existingDoorTotal,
    int totalNewDoors,
    BigDecimal newDoorRevenue,
    BigDecimal projectedRevenue,
    int endingDoors,
    BigDecimal annualTarget,
    BigDecimal gap,
    BigDecimal gapPct,
    Integer doorsNeeded
) {

    public static ForecastProjectionRow of(Long forecastId, ForecastProjection p) {
        return new ForecastProjectionRow(
            forecastId,
            p.asOfDate(),
            p.fiscalYear(),
            p.startingDoors(),
            p.expectedChurnDoors(),
            p.retainedDoors(),
            whole(p.existingDoorBase()),
            whole(p.organicGrowth()),
            whole(p.existingDoorTotal()),
            p.totalNewDoors(),
            whole(p.newDoorRevenue()),
            whole(p.projectedRevenue()),
            p.endingDoors(),
            whole(p.annualTarget()),
            whole(p.gap()),
            p.gapPct(),
            p.doorsNeeded());
    }

    static BigDecimal whole(BigDecimal amount) {
        return amount.setScale(0, RoundingMode.HALF_UP);
    }
}
