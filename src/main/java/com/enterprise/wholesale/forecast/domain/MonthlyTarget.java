package com.enterprise.wholesale.forecast.domain;

import java.math.BigDecimal;

/**
 * Revenue target for one channel and month, written by the forecast job.
 */
public record MonthlyTarget(
    Long forecastId,
    int fiscalYear,
    Channel channel,
    int quarter,
    int month,
    BigDecimal target
) {}
