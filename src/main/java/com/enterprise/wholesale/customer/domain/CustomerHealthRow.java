package com.enterprise.wholesale.customer.domain;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Flat view of a {@link ClassifiedCustomer} for the {@code customer_health}
 * table and report.
 */
public record CustomerHealthRow(
    LocalDate asOfDate,
    Long customerId,
    String companyName,
    CustomerSegment segment,
    HealthStatus healthStatus,
    Integer daysSinceLastOrder,
    Integer lifespanMonths,
    Integer churnYear,
    boolean door,
    boolean declining,
    boolean reactivated,
    BigDecimal lifetimeRevenue
) {

    public static CustomerHealthRow of(ClassifiedCustomer c, LocalDate asOf) {
        return new CustomerHealthRow(
            asOf,
            c.snapshot().customerId(),
            c.snapshot().companyName(),
            c.segment(),
            c.healthStatus(),
            c.daysSinceLastOrder(),
            c.lifespanMonths(),
            c.churnYear(),
            c.door(),
            c.hasFlag(CustomerFlag.DECLINING),
            c.hasFlag(CustomerFlag.REACTIVATED),
            c.snapshot().lifetimeRevenue());
    }
}
