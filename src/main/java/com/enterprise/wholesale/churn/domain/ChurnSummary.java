package com.enterprise.wholesale.churn.domain;

import java.math.BigDecimal;

/**
 * Headline churn metrics for the as-of year and the year before it.
 *
 * <p>Year rates divide by the static door total, unlike {@link YearChurn}.
 *
 * @param totalDoors          doors with order history
 * @param lostRevenue         lifetime revenue of all churned doors
 * @param revenueAtRisk       lifetime revenue of at-risk and churning doors
 */
public record ChurnSummary(
    int totalDoors,
    int activeDoors,
    int inactiveDoors,
    int churnedDoors,
    BigDecimal rollingChurnRate,
    BigDecimal churnRateYtd,
    BigDecimal churnRatePriorYear,
    BigDecimal churnRateChange,
    BigDecimal avgLifespanMonths,
    BigDecimal avgLifespanMonthsPriorYear,
    BigDecimal lostRevenue,
    BigDecimal revenueAtRisk
) {}
