package com.enterprise.wholesale.forecast.domain;

import java.math.BigDecimal;

/**
 * Actual revenue against target for one quarter.
 *
 * @param variancePct {@code (actual - target) / target * 100}, zero when target is zero
 * @param daysElapsed days of the quarter up to and including the as-of date
 */
public record QuarterPacing(
    int quarter,
    BigDecimal target,
    BigDecimal actual,
    BigDecimal variance,
    BigDecimal variancePct,
    boolean complete,
    boolean current,
    int daysElapsed,
    int daysTotal,
    PacingStatus status
) {}
