package com.enterprise.wholesale.churn.domain;

import java.math.BigDecimal;

/**
 * Current status breakdown of the doors acquired in one calendar year.
 *
 * @param maturing fewer than 365 days have passed since the end of the
 *                 acquisition year, so the cohort can still produce churn
 */
public record CohortRetention(
    int cohortYear,
    int acquired,
    int healthy,
    int atRisk,
    int churning,
    int churned,
    int retained,
    BigDecimal retentionPct,
    boolean maturing
) {}
