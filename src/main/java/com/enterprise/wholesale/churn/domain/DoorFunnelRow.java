package com.enterprise.wholesale.churn.domain;

import com.enterprise.wholesale.customer.domain.Funnel;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Funnel counts and headline churn metrics, one row per as-of date.
 */
public record DoorFunnelRow(
    LocalDate asOfDate,
    int active,
    int atRisk,
    int churning,
    int churned,
    int healthyDeclining,
    int reactivated,
    int totalDoors,
    int activeDoors,
    BigDecimal rollingChurnRate,
    BigDecimal churnRateYtd,
    BigDecimal churnRatePriorYear,
    BigDecimal churnRateChange,
    BigDecimal avgLifespanMonths,
    BigDecimal avgLifespanMonthsPriorYear,
    BigDecimal lostRevenue,
    BigDecimal revenueAtRisk
) {

    public static DoorFunnelRow of(DoorHealthReport report) {
        Funnel f = report.funnel();
        ChurnSummary s = report.summary();
        return new DoorFunnelRow(
            report.asOfDate(),
            f.active(),
            f.atRisk(),
            f.churning(),
            f.churned(),
            f.healthyDeclining(),
            f.reactivated(),
            s.totalDoors(),
            f.activeDoors(),
            s.rollingChurnRate(),
            s.churnRateYtd(),
            s.churnRatePriorYear(),
            s.churnRateChange(),
            s.avgLifespanMonths(),
            s.avgLifespanMonthsPriorYear(),
            s.lostRevenue(),
            s.revenueAtRisk());
    }
}
