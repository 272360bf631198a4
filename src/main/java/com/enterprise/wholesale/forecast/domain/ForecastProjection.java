package com.enterprise.wholesale.forecast.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Bottom-up B2B revenue projection for one fiscal year.
 *
 * <p>Money is unrounded; callers round for presentation.
 *
 * @param doorsNeeded extra new doors required to close a positive gap, zero
 *                    when there is no gap, null when no months remain to open them
 */
public record ForecastProjection(
    int fiscalYear,
    LocalDate asOfDate,
    int startingDoors,
    int expectedChurnDoors,
    int retainedDoors,
    BigDecimal existingDoorBase,
    BigDecimal organicGrowth,
    BigDecimal existingDoorTotal,
    int totalNewDoors,
    NewDoorFactors factors,
    BigDecimal newDoorRevenue,
    BigDecimal projectedRevenue,
    int endingDoors,
    BigDecimal annualTarget,
    BigDecimal gap,
    BigDecimal gapPct,
    Integer doorsNeeded
) {}
