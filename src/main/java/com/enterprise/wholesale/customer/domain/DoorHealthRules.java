package com.enterprise.wholesale.customer.domain;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Business thresholds used by the classifier and the cohort analyzers.
 *
 * <p>Day thresholds form half-open buckets
 * {@code [0, atRisk) [atRisk, churning) [churning, churned) [churned, ∞)}.
 *
 * @param atRiskDays          first day counted as at risk
 * @param churningDays        first day counted as churning
 * @param churnedDays         first day counted as churned
 * @param majorRevenue        lifetime revenue at which an account is {@link CustomerSegment#MAJOR}
 * @param midRevenue          lifetime revenue at which an account is {@link CustomerSegment#MID}
 * @param decliningYoyPct     year-over-year change below which an account is declining
 * @param dudMaturityDays     days after first sale before a one-order account counts as a dud
 */
public record DoorHealthRules(
    int atRiskDays,
    int churningDays,
    int churnedDays,
    BigDecimal majorRevenue,
    BigDecimal midRevenue,
    BigDecimal decliningYoyPct,
    int dudMaturityDays
) {

    public static final int DEFAULT_AT_RISK_DAYS = 180;
    public static final int DEFAULT_CHURNING_DAYS = 270;
    public static final int DEFAULT_CHURNED_DAYS = 365;
    public static final int DEFAULT_DUD_MATURITY_DAYS = 133;

    public DoorHealthRules {
        Objects.requireNonNull(majorRevenue, "majorRevenue");
        Objects.requireNonNull(midRevenue, "midRevenue");
        Objects.requireNonNull(decliningYoyPct, "decliningYoyPct");
        if (atRiskDays <= 0 || atRiskDays >= churningDays || churningDays >= churnedDays) {
            throw new IllegalArgumentException(
                    "Day thresholds must satisfy 0 < atRisk < churning < churned, got "
                    + atRiskDays + "/" + churningDays + "/" + churnedDays);
        }
        if (midRevenue.signum() <= 0 || majorRevenue.compareTo(midRevenue) <= 0) {
            throw new IllegalArgumentException(
                    "Segment thresholds must satisfy major > mid > 0, got "
                    + majorRevenue + "/" + midRevenue);
        }
        if (dudMaturityDays <= 0) {
            throw new IllegalArgumentException("dudMaturityDays must be positive: " + dudMaturityDays);
        }
    }

    public static DoorHealthRules defaults() {
        return new DoorHealthRules(
                DEFAULT_AT_RISK_DAYS,
                DEFAULT_CHURNING_DAYS,
                DEFAULT_CHURNED_DAYS,
                new BigDecimal("20000"),
                new BigDecimal("5000"),
                new BigDecimal("-20"),
                DEFAULT_DUD_MATURITY_DAYS);
    }
}
