package com.enterprise.wholesale.churn.domain;

import java.math.BigDecimal;

/**
 * Doors that crossed the churn threshold in one calendar year, measured
 * against the pool of doors still eligible to churn at the start of that year.
 *
 * @param integrityFault the pool was smaller than the year's churn count;
 *                       {@code churnRate} is reported as zero
 */
public record YearChurn(
    int year,
    int churnedCount,
    BigDecimal churnedRevenue,
    int poolSize,
    BigDecimal churnRate,
    boolean integrityFault
) {}
