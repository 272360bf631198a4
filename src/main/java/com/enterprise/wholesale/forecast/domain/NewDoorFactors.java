package com.enterprise.wholesale.forecast.domain;

import java.math.BigDecimal;

/**
 * Fraction of a full year's yield that new doors contribute in the fiscal
 * year, assuming openings are spread evenly within each sub-period.
 *
 * @param monthsElapsed   months of the fiscal year completed before the as-of month
 * @param monthsRemaining months left, the as-of month included
 * @param acquiredFactor  average contribution of a door opened in the elapsed months
 * @param remainingFactor average contribution of a door opened in the remaining months
 */
public record NewDoorFactors(
    int monthsElapsed,
    int monthsRemaining,
    BigDecimal acquiredFactor,
    BigDecimal remainingFactor
) {}
