package com.enterprise.wholesale.churn.domain;

import java.math.BigDecimal;

/**
 * One-time-buyer rate for an acquisition cohort.
 *
 * @param cohort         {@code "YYYY"}, or {@code "YYYY H1"/"YYYY H2"} for the current year
 * @param dudRate        percent of mature members with a single order;
 *                       null when no member is mature yet
 * @param mature         every member has passed the maturity window
 */
public record DudCohort(
    String cohort,
    int totalAcquired,
    int matureCustomers,
    int matureOneTime,
    BigDecimal dudRate,
    boolean mature
) {}
